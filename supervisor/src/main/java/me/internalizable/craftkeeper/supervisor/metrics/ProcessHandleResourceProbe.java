package me.internalizable.craftkeeper.supervisor.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Samples processes through {@link ProcessHandle} and, where available, procfs.
 *
 * <p>CPU usage is the CPU time consumed between two samples divided by the
 * wall time between them; the first sample of a process reports 0. Resident
 * memory is read from {@code /proc/<pid>/status} and reported as 0 on
 * platforms without procfs.</p>
 */
public class ProcessHandleResourceProbe implements ResourceProbe {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessHandleResourceProbe.class);

    private final Path procRoot;
    private final Map<Long, CpuSample> previous = new ConcurrentHashMap<>();

    public ProcessHandleResourceProbe() {
        this(Path.of("/proc"));
    }

    public ProcessHandleResourceProbe(@Nonnull Path procRoot) {
        this.procRoot = Objects.requireNonNull(procRoot, "procRoot");
    }

    @Override
    @Nonnull
    public Optional<ProcessUsage> sample(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            previous.remove(pid);
            return Optional.empty();
        }

        long now = System.nanoTime();
        double cpuPercent = 0;
        Optional<Duration> cpuTime = handle.get().info().totalCpuDuration();
        if (cpuTime.isPresent()) {
            CpuSample current = new CpuSample(cpuTime.get().toNanos(), now);
            CpuSample last = previous.put(pid, current);
            if (last != null && current.wallNanos() > last.wallNanos()) {
                cpuPercent = 100.0 * (current.cpuNanos() - last.cpuNanos())
                        / (current.wallNanos() - last.wallNanos());
            }
        }

        return Optional.of(new ProcessUsage(Math.max(0, cpuPercent), readResidentMemory(pid)));
    }

    @Override
    public void forget(long pid) {
        previous.remove(pid);
    }

    /**
     * Read VmRSS of a process.
     *
     * @param pid process id
     * @return resident memory in bytes, 0 if unavailable
     */
    long readResidentMemory(long pid) {
        Path status = procRoot.resolve(Long.toString(pid)).resolve("status");
        if (!Files.isReadable(status)) {
            return 0;
        }
        try {
            List<String> lines = Files.readAllLines(status, StandardCharsets.UTF_8);
            for (String line : lines) {
                if (line.startsWith("VmRSS:")) {
                    String[] parts = line.substring("VmRSS:".length()).trim().split("\\s+");
                    return Long.parseLong(parts[0]) * 1024L;
                }
            }
        } catch (IOException | NumberFormatException e) {
            LOGGER.debug("Could not read resident memory of PID {}: {}", pid, e.getMessage());
        }
        return 0;
    }

    private record CpuSample(long cpuNanos, long wallNanos) {
    }
}
