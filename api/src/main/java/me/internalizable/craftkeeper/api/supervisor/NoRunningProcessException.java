package me.internalizable.craftkeeper.api.supervisor;

import javax.annotation.Nonnull;

/**
 * Thrown when console input is sent to a server without a live process.
 */
public final class NoRunningProcessException extends ServerOperationException {

    public NoRunningProcessException(@Nonnull String serverId) {
        super(serverId, "Server '" + serverId + "' has no running process");
    }
}
