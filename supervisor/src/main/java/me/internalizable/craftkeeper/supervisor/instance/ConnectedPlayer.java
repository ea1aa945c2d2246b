package me.internalizable.craftkeeper.supervisor.instance;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;

/**
 * A player currently connected to a server, as seen in its console.
 *
 * @param name player name
 * @param uuid UUID if the server announced it before the join
 * @param joinedAt when the join line was read
 */
public record ConnectedPlayer(@Nonnull String name, @Nullable String uuid, @Nonnull Instant joinedAt) {
}
