package me.internalizable.craftkeeper.supervisor.instance;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Bounds automatic restarts after crashes.
 *
 * @param maxAttempts consecutive automatic restarts allowed before giving up
 * @param backoffStep delay added per attempt
 * @param backoffMax upper bound of the delay
 * @param stabilityWindow a server that ran at least this long before crashing starts counting from zero again
 */
public record RestartPolicy(
        int maxAttempts,
        @Nonnull Duration backoffStep,
        @Nonnull Duration backoffMax,
        @Nonnull Duration stabilityWindow
) {

    public RestartPolicy {
        Objects.requireNonNull(backoffStep, "backoffStep");
        Objects.requireNonNull(backoffMax, "backoffMax");
        Objects.requireNonNull(stabilityWindow, "stabilityWindow");
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative: " + maxAttempts);
        }
    }

    /**
     * Get the delay before the given restart attempt.
     *
     * @param attempt 1-based attempt number
     * @return {@code min(backoffStep * attempt, backoffMax)}
     */
    @Nonnull
    public Duration backoffFor(int attempt) {
        Duration delay = backoffStep.multipliedBy(Math.max(1, attempt));
        return delay.compareTo(backoffMax) > 0 ? backoffMax : delay;
    }
}
