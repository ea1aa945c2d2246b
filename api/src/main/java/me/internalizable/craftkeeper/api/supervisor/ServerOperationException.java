package me.internalizable.craftkeeper.api.supervisor;

import javax.annotation.Nonnull;

/**
 * Thrown when an existing server rejects or fails an operation.
 */
public class ServerOperationException extends SupervisorException {

    private final String serverId;

    public ServerOperationException(@Nonnull String serverId, @Nonnull String message) {
        super(message);
        this.serverId = serverId;
    }

    public ServerOperationException(@Nonnull String serverId, @Nonnull String message, Throwable cause) {
        super(message, cause);
        this.serverId = serverId;
    }

    @Nonnull
    public String getServerId() {
        return serverId;
    }
}
