package me.internalizable.craftkeeper.supervisor.metrics;

import me.internalizable.craftkeeper.api.supervisor.ServerState;
import me.internalizable.craftkeeper.supervisor.instance.ServerInstance;
import me.internalizable.craftkeeper.supervisor.registry.ServerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically samples CPU and memory of every live server process and
 * writes the results into its {@link ServerInstance}.
 */
public class ResourceSampler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceSampler.class);

    private final ServerRegistry registry;
    private final ResourceProbe probe;
    @Nullable
    private final PerformanceAlertMonitor alertMonitor;

    private ScheduledFuture<?> task;

    /**
     * Create a resource sampler.
     *
     * @param registry servers to sample
     * @param probe measures processes
     * @param alertMonitor receives every fresh sample, may be null
     */
    public ResourceSampler(@Nonnull ServerRegistry registry,
                           @Nonnull ResourceProbe probe,
                           @Nullable PerformanceAlertMonitor alertMonitor) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.alertMonitor = alertMonitor;
    }

    /**
     * Start sampling at a fixed interval.
     *
     * @param scheduler executor running the samples
     * @param interval time between samples
     */
    public synchronized void start(@Nonnull ScheduledExecutorService scheduler, @Nonnull Duration interval) {
        if (task != null) {
            throw new IllegalStateException("Resource sampler already started");
        }
        long millis = interval.toMillis();
        task = scheduler.scheduleAtFixedRate(this::sampleAll, millis, millis, TimeUnit.MILLISECONDS);
        LOGGER.debug("Sampling server resources every {}ms", millis);
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    /**
     * Sample every starting or running server once.
     */
    public void sampleAll() {
        for (ServerInstance instance : registry.getServersByState(ServerState.STARTING, ServerState.RUNNING)) {
            Long pid = instance.getPid();
            if (pid == null) {
                continue;
            }
            try {
                Optional<ResourceProbe.ProcessUsage> usage = probe.sample(pid);
                if (usage.isEmpty()) {
                    probe.forget(pid);
                    continue;
                }
                if (!instance.updateResources(pid, usage.get().cpuPercent(), usage.get().residentMemoryBytes())) {
                    LOGGER.debug("Dropped sample of '{}', PID {} is no longer current", instance.getServerId(), pid);
                    probe.forget(pid);
                    continue;
                }
                if (alertMonitor != null) {
                    alertMonitor.evaluate(instance.getServerId(), instance.getResources());
                }
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to sample resources of server '{}'", instance.getServerId(), e);
            }
        }
    }
}
