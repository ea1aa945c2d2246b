package me.internalizable.craftkeeper.supervisor.metrics;

import me.internalizable.craftkeeper.api.supervisor.ResourceSnapshot;
import me.internalizable.craftkeeper.api.supervisor.ServerState;
import me.internalizable.craftkeeper.supervisor.instance.ServerInstance;
import me.internalizable.craftkeeper.supervisor.registry.ServerRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResourceSamplerTest {

    @Mock
    private ServerRegistry registry;

    @Mock
    private ResourceProbe probe;

    @Mock
    private PerformanceAlertMonitor alertMonitor;

    @Mock
    private ServerInstance running;

    @Mock
    private ServerInstance other;

    @Test
    void samplesActiveServersAndFeedsAlerts() {
        ResourceSnapshot snapshot = new ResourceSnapshot(42.0, 512L * 1024 * 1024, 19.9, Instant.now());
        when(registry.getServersByState(ServerState.STARTING, ServerState.RUNNING)).thenReturn(List.of(running));
        when(running.getPid()).thenReturn(1234L);
        when(running.getServerId()).thenReturn("lobby");
        when(running.getResources()).thenReturn(snapshot);
        when(probe.sample(1234L)).thenReturn(Optional.of(new ResourceProbe.ProcessUsage(42.0, 512L * 1024 * 1024)));
        when(running.updateResources(1234L, 42.0, 512L * 1024 * 1024)).thenReturn(true);

        new ResourceSampler(registry, probe, alertMonitor).sampleAll();

        verify(alertMonitor).evaluate("lobby", snapshot);
    }

    @Test
    void sampleOfReplacedProcessIsDropped() {
        when(registry.getServersByState(ServerState.STARTING, ServerState.RUNNING)).thenReturn(List.of(running));
        when(running.getPid()).thenReturn(1234L);
        when(running.getServerId()).thenReturn("lobby");
        when(probe.sample(1234L)).thenReturn(Optional.of(new ResourceProbe.ProcessUsage(90.0, 1024)));
        when(running.updateResources(1234L, 90.0, 1024)).thenReturn(false);

        new ResourceSampler(registry, probe, alertMonitor).sampleAll();

        verify(probe).forget(1234L);
        verify(alertMonitor, never()).evaluate(any(), any());
    }

    @Test
    void serverWithoutPidIsSkipped() {
        when(registry.getServersByState(ServerState.STARTING, ServerState.RUNNING)).thenReturn(List.of(running));
        when(running.getPid()).thenReturn(null);

        new ResourceSampler(registry, probe, alertMonitor).sampleAll();

        verify(probe, never()).sample(anyLong());
        verify(running, never()).updateResources(anyLong(), anyDouble(), anyLong());
    }

    @Test
    void vanishedProcessIsForgotten() {
        when(registry.getServersByState(ServerState.STARTING, ServerState.RUNNING)).thenReturn(List.of(running));
        when(running.getPid()).thenReturn(77L);
        when(probe.sample(77L)).thenReturn(Optional.empty());

        new ResourceSampler(registry, probe, null).sampleAll();

        verify(probe).forget(77L);
        verify(running, never()).updateResources(anyLong(), anyDouble(), anyLong());
    }

    @Test
    void failureOnOneServerDoesNotSkipOthers() {
        when(registry.getServersByState(ServerState.STARTING, ServerState.RUNNING)).thenReturn(List.of(running, other));
        when(running.getPid()).thenReturn(1L);
        when(running.getServerId()).thenReturn("broken");
        when(other.getPid()).thenReturn(2L);
        when(probe.sample(1L)).thenThrow(new IllegalStateException("probe failed"));
        when(probe.sample(2L)).thenReturn(Optional.of(new ResourceProbe.ProcessUsage(5.0, 1024)));

        new ResourceSampler(registry, probe, null).sampleAll();

        verify(other).updateResources(2L, 5.0, 1024);
    }

    @Test
    void scheduledSamplingRunsUntilStopped() {
        when(registry.getServersByState(ServerState.STARTING, ServerState.RUNNING)).thenReturn(List.of());
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            ResourceSampler sampler = new ResourceSampler(registry, probe, alertMonitor);
            sampler.start(scheduler, Duration.ofMillis(20));

            verify(registry, timeout(2000).atLeast(2)).getServersByState(ServerState.STARTING, ServerState.RUNNING);
            assertThatThrownBy(() -> sampler.start(scheduler, Duration.ofMillis(20)))
                    .isInstanceOf(IllegalStateException.class);
            sampler.stop();
            verify(alertMonitor, never()).evaluate(any(), any());
        } finally {
            scheduler.shutdownNow();
        }
    }
}
