package me.internalizable.craftkeeper.api.supervisor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Point-in-time view of a supervised server.
 *
 * @param serverId server identifier
 * @param state lifecycle state
 * @param pid OS process id, or null when no process is alive
 * @param uptimeSeconds seconds since the current process was spawned, 0 when stopped
 * @param connectedPlayers number of players currently connected
 * @param players names of connected players
 * @param resources last sampled resource usage
 * @param crashRestartAttempts consecutive automatic restarts since the last stable run
 */
public record StatusSnapshot(
        @Nonnull String serverId,
        @Nonnull ServerState state,
        @Nullable Long pid,
        long uptimeSeconds,
        int connectedPlayers,
        @Nonnull List<String> players,
        @Nonnull ResourceSnapshot resources,
        int crashRestartAttempts
) {

    public StatusSnapshot {
        Objects.requireNonNull(serverId, "serverId");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(resources, "resources");
        players = List.copyOf(players);
    }
}
