package me.internalizable.craftkeeper.api.supervisor;

import javax.annotation.Nonnull;

/**
 * Thrown when the server process could not be launched. The server is left
 * in {@link ServerState#CRASHED}.
 */
public final class SpawnFailedException extends ServerOperationException {

    public SpawnFailedException(@Nonnull String serverId, @Nonnull String reason, Throwable cause) {
        super(serverId, "Failed to spawn server '" + serverId + "': " + reason, cause);
    }
}
