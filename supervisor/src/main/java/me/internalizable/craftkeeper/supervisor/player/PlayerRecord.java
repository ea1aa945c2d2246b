package me.internalizable.craftkeeper.supervisor.player;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;

/**
 * What is known about one player across all servers.
 *
 * @param key UUID if known, otherwise the player name
 * @param name last seen name
 * @param uuid UUID if any server announced it
 * @param firstSeen first join
 * @param lastSeen last join or leave
 * @param playTime accumulated time of finished sessions
 * @param serverId server of the current session, null when offline
 * @param sessionStart start of the current session, null when offline
 */
public record PlayerRecord(
        @Nonnull String key,
        @Nonnull String name,
        @Nullable String uuid,
        @Nonnull Instant firstSeen,
        @Nonnull Instant lastSeen,
        @Nonnull Duration playTime,
        @Nullable String serverId,
        @Nullable Instant sessionStart
) {

    public boolean isOnline() {
        return serverId != null;
    }

    PlayerRecord join(@Nonnull String server, @Nullable String announcedUuid, @Nonnull Instant at) {
        PlayerRecord closed = isOnline() ? leave(at) : this;
        return new PlayerRecord(key, name, announcedUuid != null ? announcedUuid : uuid,
                firstSeen, at, closed.playTime, server, at);
    }

    PlayerRecord leave(@Nonnull Instant at) {
        if (!isOnline()) {
            return new PlayerRecord(key, name, uuid, firstSeen, at, playTime, null, null);
        }
        Duration session = Duration.between(sessionStart, at);
        return new PlayerRecord(key, name, uuid, firstSeen, at,
                playTime.plus(session.isNegative() ? Duration.ZERO : session), null, null);
    }
}
