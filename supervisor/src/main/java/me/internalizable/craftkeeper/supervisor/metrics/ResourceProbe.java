package me.internalizable.craftkeeper.supervisor.metrics;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Measures the resource usage of an OS process.
 */
public interface ResourceProbe {

    /**
     * Sample a process.
     *
     * @param pid process id
     * @return usage, or empty if the process is gone
     */
    @Nonnull
    Optional<ProcessUsage> sample(long pid);

    /**
     * Drop any state kept for a process.
     *
     * @param pid process id
     */
    default void forget(long pid) {
    }

    /**
     * @param cpuPercent CPU usage since the previous sample, in percent of one core
     * @param residentMemoryBytes resident set size, 0 if unknown
     */
    record ProcessUsage(double cpuPercent, long residentMemoryBytes) {
    }
}
