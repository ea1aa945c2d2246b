package me.internalizable.craftkeeper.supervisor.metrics;

import me.internalizable.craftkeeper.api.event.EventPayload;
import me.internalizable.craftkeeper.api.event.ServerEvent;
import me.internalizable.craftkeeper.api.event.ServerEventKind;
import me.internalizable.craftkeeper.api.event.ServerEventListener;
import me.internalizable.craftkeeper.api.supervisor.ResourceSnapshot;
import me.internalizable.craftkeeper.supervisor.config.SupervisorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raises alerts when a server's resource usage crosses configured thresholds.
 *
 * <p>Each server/metric/level combination is rate limited by a cooldown so a
 * server hovering around a threshold does not flood the sink. Subscribed to
 * the event stream, crashes are reported as critical alerts.</p>
 */
public class PerformanceAlertMonitor implements ServerEventListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(PerformanceAlertMonitor.class);

    private final SupervisorConfig.AlertConfig config;
    private final AlertSink sink;
    private final Clock clock;
    private final Map<String, Instant> lastRaised = new ConcurrentHashMap<>();

    public PerformanceAlertMonitor(@Nonnull SupervisorConfig.AlertConfig config, @Nonnull AlertSink sink) {
        this(config, sink, Clock.systemUTC());
    }

    public PerformanceAlertMonitor(@Nonnull SupervisorConfig.AlertConfig config,
                                   @Nonnull AlertSink sink,
                                   @Nonnull Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Check a fresh resource sample against the thresholds.
     *
     * @param serverId sampled server
     * @param snapshot sampled usage
     */
    public void evaluate(@Nonnull String serverId, @Nonnull ResourceSnapshot snapshot) {
        if (!config.isEnabled()) {
            return;
        }

        double cpu = snapshot.cpuPercent();
        if (cpu >= config.getCpuCritical()) {
            raise(serverId, PerformanceAlert.Metric.CPU, PerformanceAlert.Level.CRITICAL, cpu, config.getCpuCritical());
        } else if (cpu >= config.getCpuWarning()) {
            raise(serverId, PerformanceAlert.Metric.CPU, PerformanceAlert.Level.WARNING, cpu, config.getCpuWarning());
        }

        long ramMb = snapshot.residentMemoryMegabytes();
        if (config.getRamCriticalMb() > 0 && ramMb >= config.getRamCriticalMb()) {
            raise(serverId, PerformanceAlert.Metric.RAM, PerformanceAlert.Level.CRITICAL, ramMb, config.getRamCriticalMb());
        } else if (config.getRamWarningMb() > 0 && ramMb >= config.getRamWarningMb()) {
            raise(serverId, PerformanceAlert.Metric.RAM, PerformanceAlert.Level.WARNING, ramMb, config.getRamWarningMb());
        }

        if (snapshot.hasTicksPerSecond()) {
            double tps = snapshot.ticksPerSecond();
            if (tps < config.getTpsCritical()) {
                raise(serverId, PerformanceAlert.Metric.TPS, PerformanceAlert.Level.CRITICAL, tps, config.getTpsCritical());
            } else if (tps < config.getTpsWarning()) {
                raise(serverId, PerformanceAlert.Metric.TPS, PerformanceAlert.Level.WARNING, tps, config.getTpsWarning());
            }
        }
    }

    @Override
    public void onEvent(@Nonnull ServerEvent event) {
        if (event.kind() != ServerEventKind.CRASHED || !config.isEnabled()) {
            return;
        }
        EventPayload.ServerCrashed crash = event.payload(EventPayload.ServerCrashed.class);
        raise(event.serverId(), PerformanceAlert.Metric.CRASH, PerformanceAlert.Level.CRITICAL,
                crash.exitCode() != null ? crash.exitCode() : -1, 0);
    }

    /**
     * Forget cooldowns of a server, e.g. after it was deleted.
     *
     * @param serverId server identifier
     */
    public void reset(@Nonnull String serverId) {
        lastRaised.keySet().removeIf(key -> key.startsWith(serverId + ":"));
    }

    private void raise(String serverId, PerformanceAlert.Metric metric, PerformanceAlert.Level level,
                       double value, double threshold) {
        Instant now = clock.instant();
        Duration cooldown = Duration.ofMinutes(config.getCooldownMinutes());
        String key = serverId + ":" + metric + ":" + level;

        Instant last = lastRaised.get(key);
        if (last != null && now.isBefore(last.plus(cooldown))) {
            return;
        }
        lastRaised.put(key, now);

        PerformanceAlert alert = new PerformanceAlert(serverId, metric, level, value, threshold, now);
        try {
            sink.deliver(alert);
        } catch (RuntimeException e) {
            LOGGER.error("Failed to deliver {} alert for '{}'", metric, serverId, e);
        }
    }
}
