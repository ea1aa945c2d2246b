package me.internalizable.craftkeeper.api.supervisor;

import javax.annotation.Nonnull;

/**
 * Thrown when an operation is not valid for the server's current state,
 * for example starting a server that is already running.
 */
public final class InvalidTransitionException extends ServerOperationException {

    private final ServerState currentState;
    private final String operation;

    public InvalidTransitionException(
            @Nonnull String serverId,
            @Nonnull String operation,
            @Nonnull ServerState currentState) {
        super(serverId, String.format("Cannot %s server '%s' while it is %s",
                operation, serverId, currentState.getId()));
        this.operation = operation;
        this.currentState = currentState;
    }

    @Nonnull
    public ServerState getCurrentState() {
        return currentState;
    }

    @Nonnull
    public String getOperation() {
        return operation;
    }
}
