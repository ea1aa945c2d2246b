package me.internalizable.craftkeeper.api.supervisor;

import javax.annotation.Nonnull;

/**
 * Thrown when an operation names a server id that has no definition.
 */
public final class ServerNotFoundException extends SupervisorException {

    private final String serverId;

    public ServerNotFoundException(@Nonnull String serverId) {
        super("Server not found: " + serverId);
        this.serverId = serverId;
    }

    @Nonnull
    public String getServerId() {
        return serverId;
    }
}
