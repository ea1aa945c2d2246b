package me.internalizable.craftkeeper.supervisor.metrics;

import me.internalizable.craftkeeper.api.event.EventPayload;
import me.internalizable.craftkeeper.api.event.ServerEvent;
import me.internalizable.craftkeeper.api.supervisor.ResourceSnapshot;
import me.internalizable.craftkeeper.api.supervisor.ServerState;
import me.internalizable.craftkeeper.supervisor.MutableClock;
import me.internalizable.craftkeeper.supervisor.config.SupervisorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class PerformanceAlertMonitorTest {

    private static final long MB = 1024L * 1024L;

    private SupervisorConfig.AlertConfig config;
    private List<PerformanceAlert> delivered;
    private MutableClock clock;
    private PerformanceAlertMonitor monitor;

    @BeforeEach
    void setUp() {
        config = new SupervisorConfig.AlertConfig();
        config.setRamWarningMb(3072);
        config.setRamCriticalMb(3800);
        delivered = new ArrayList<>();
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        monitor = new PerformanceAlertMonitor(config, delivered::add, clock);
    }

    private static ResourceSnapshot sample(double cpu, long ramMb, double tps) {
        return new ResourceSnapshot(cpu, ramMb * MB, tps, Instant.now());
    }

    @Test
    void healthySampleRaisesNothing() {
        monitor.evaluate("srv", sample(35, 1024, 20));

        assertThat(delivered).isEmpty();
    }

    @Test
    void cpuRaisesHighestBreachedLevelOnly() {
        monitor.evaluate("srv", sample(85, 1024, -1));
        monitor.evaluate("other", sample(99, 1024, -1));

        assertThat(delivered).extracting(PerformanceAlert::serverId, PerformanceAlert::metric, PerformanceAlert::level)
                .containsExactly(
                        tuple("srv", PerformanceAlert.Metric.CPU, PerformanceAlert.Level.WARNING),
                        tuple("other", PerformanceAlert.Metric.CPU, PerformanceAlert.Level.CRITICAL));
    }

    @Test
    void memoryThresholdsApplyWhenConfigured() {
        monitor.evaluate("srv", sample(10, 3900, -1));

        assertThat(delivered).singleElement().satisfies(alert -> {
            assertThat(alert.metric()).isEqualTo(PerformanceAlert.Metric.RAM);
            assertThat(alert.level()).isEqualTo(PerformanceAlert.Level.CRITICAL);
            assertThat(alert.message()).isEqualTo("Memory usage at 3900 MB (threshold 3800 MB)");
        });
    }

    @Test
    void memoryAlertsAreOffByDefault() {
        monitor = new PerformanceAlertMonitor(new SupervisorConfig.AlertConfig(), delivered::add, clock);

        monitor.evaluate("srv", sample(10, 64_000, -1));

        assertThat(delivered).isEmpty();
    }

    @Test
    void lowTickRateIsReportedOnlyWhenKnown() {
        monitor.evaluate("srv", sample(10, 100, -1));
        monitor.evaluate("srv", sample(10, 100, 12.5));

        assertThat(delivered).singleElement().satisfies(alert -> {
            assertThat(alert.metric()).isEqualTo(PerformanceAlert.Metric.TPS);
            assertThat(alert.level()).isEqualTo(PerformanceAlert.Level.WARNING);
        });
    }

    @Test
    void repeatedAlertsRespectCooldown() {
        monitor.evaluate("srv", sample(90, 100, -1));
        clock.advance(Duration.ofMinutes(2));
        monitor.evaluate("srv", sample(90, 100, -1));
        clock.advance(Duration.ofMinutes(4));
        monitor.evaluate("srv", sample(90, 100, -1));

        assertThat(delivered).hasSize(2);
        assertThat(delivered.get(1).timestamp()).isEqualTo(Instant.parse("2024-05-01T12:06:00Z"));
    }

    @Test
    void resetClearsCooldown() {
        monitor.evaluate("srv", sample(90, 100, -1));
        monitor.reset("srv");
        monitor.evaluate("srv", sample(90, 100, -1));

        assertThat(delivered).hasSize(2);
    }

    @Test
    void crashEventRaisesCriticalAlert() {
        monitor.onEvent(ServerEvent.of("srv", new EventPayload.ServerCrashed("exited with code 1", 1, false, true),
                Instant.now()));
        monitor.onEvent(ServerEvent.of("srv",
                new EventPayload.StatusChanged(ServerState.RUNNING, ServerState.CRASHED, null, "exited"), Instant.now()));

        assertThat(delivered).singleElement().satisfies(alert -> {
            assertThat(alert.metric()).isEqualTo(PerformanceAlert.Metric.CRASH);
            assertThat(alert.level()).isEqualTo(PerformanceAlert.Level.CRITICAL);
            assertThat(alert.message()).isEqualTo("Server crashed with exit code 1");
        });
    }

    @Test
    void disabledMonitorIsSilent() {
        config.setEnabled(false);

        monitor.evaluate("srv", sample(100, 9999, 1));

        assertThat(delivered).isEmpty();
    }

    @Test
    void failingSinkDoesNotPropagate() {
        monitor = new PerformanceAlertMonitor(config, alert -> {
            throw new IllegalStateException("webhook down");
        }, clock);

        monitor.evaluate("srv", sample(99, 100, -1));
    }
}
