package me.internalizable.craftkeeper.supervisor.metrics;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.Locale;

/**
 * A threshold violation or crash worth telling an operator about.
 *
 * @param serverId affected server
 * @param metric what was measured
 * @param level severity
 * @param value measured value
 * @param threshold threshold that was crossed
 * @param timestamp when the alert was raised
 */
public record PerformanceAlert(
        @Nonnull String serverId,
        @Nonnull Metric metric,
        @Nonnull Level level,
        double value,
        double threshold,
        @Nonnull Instant timestamp
) {

    public enum Metric {
        CPU, RAM, TPS, CRASH
    }

    public enum Level {
        WARNING, CRITICAL
    }

    /**
     * Get a one-line description of this alert.
     */
    @Nonnull
    public String message() {
        return switch (metric) {
            case CPU -> String.format(Locale.ROOT, "CPU usage at %.1f%% (threshold %.0f%%)", value, threshold);
            case RAM -> String.format(Locale.ROOT, "Memory usage at %.0f MB (threshold %.0f MB)", value, threshold);
            case TPS -> String.format(Locale.ROOT, "TPS dropped to %.1f (threshold %.0f)", value, threshold);
            case CRASH -> "Server crashed with exit code " + (long) value;
        };
    }
}
