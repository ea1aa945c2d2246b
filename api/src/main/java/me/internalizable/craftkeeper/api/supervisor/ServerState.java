package me.internalizable.craftkeeper.api.supervisor;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Lifecycle state of a supervised server process.
 *
 * <h2>Transitions</h2>
 * <pre>
 * STOPPED → STARTING → RUNNING → STOPPING → STOPPED
 *              ↓          ↓
 *           CRASHED ← ────┘
 * </pre>
 *
 * <p>Any state other than {@link #STOPPED} may be forced back to
 * {@code STOPPED} by a kill.</p>
 */
public enum ServerState {
    /**
     * No process exists. Initial state and the result of a clean stop or kill.
     */
    STOPPED,

    /**
     * The process has been spawned but has not yet signalled readiness.
     */
    STARTING,

    /**
     * The process signalled readiness (or the readiness timeout elapsed).
     */
    RUNNING,

    /**
     * A graceful shutdown was requested and the supervisor is waiting for exit.
     */
    STOPPING,

    /**
     * The process exited without being asked to, or could not be spawned.
     */
    CRASHED;

    /**
     * Check if a live OS process is expected in this state.
     *
     * @return true if the process should be alive
     */
    public boolean isProcessExpected() {
        return this == STARTING || this == RUNNING || this == STOPPING;
    }

    /**
     * Check if a start is accepted from this state.
     *
     * @return true for {@link #STOPPED} and {@link #CRASHED}
     */
    public boolean canStart() {
        return this == STOPPED || this == CRASHED;
    }

    /**
     * Check if a graceful stop is accepted from this state.
     *
     * @return true for {@link #STARTING} and {@link #RUNNING}
     */
    public boolean canStop() {
        return this == STARTING || this == RUNNING;
    }

    /**
     * Get the lowercase identifier used in persisted definitions and console output.
     *
     * @return state identifier, e.g. {@code "running"}
     */
    @Nonnull
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
