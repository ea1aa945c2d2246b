package me.internalizable.craftkeeper.api.supervisor;

/**
 * Base type of every failure reported by the supervisor control surface.
 */
public class SupervisorException extends RuntimeException {

    public SupervisorException(String message) {
        super(message);
    }

    public SupervisorException(String message, Throwable cause) {
        super(message, cause);
    }
}
