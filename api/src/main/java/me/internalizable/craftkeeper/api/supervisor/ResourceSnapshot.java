package me.internalizable.craftkeeper.api.supervisor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Last sampled resource usage of a server process.
 *
 * @param cpuPercent CPU usage in percent of one core (may exceed 100 on multi-core hosts)
 * @param residentMemoryBytes resident set size in bytes, 0 when unknown
 * @param ticksPerSecond last reported ticks per second, or -1 when never reported
 * @param sampledAt when cpu and memory were sampled, or null if never sampled
 */
public record ResourceSnapshot(
        double cpuPercent,
        long residentMemoryBytes,
        double ticksPerSecond,
        @Nullable Instant sampledAt
) {

    private static final ResourceSnapshot EMPTY = new ResourceSnapshot(0, 0, -1, null);

    /**
     * Snapshot for a process that has not been sampled.
     *
     * @return the empty snapshot
     */
    @Nonnull
    public static ResourceSnapshot empty() {
        return EMPTY;
    }

    public long residentMemoryMegabytes() {
        return residentMemoryBytes / (1024 * 1024);
    }

    public boolean hasTicksPerSecond() {
        return ticksPerSecond >= 0;
    }
}
