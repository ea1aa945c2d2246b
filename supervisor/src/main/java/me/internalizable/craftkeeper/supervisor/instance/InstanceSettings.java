package me.internalizable.craftkeeper.supervisor.instance;

import me.internalizable.craftkeeper.api.supervisor.ServerKind;
import me.internalizable.craftkeeper.supervisor.config.SupervisorConfig;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tunables shared by every {@link ServerInstance}.
 *
 * @param logBufferLines console lines retained per server
 * @param readinessTimeout time after which a starting server is assumed running
 * @param stopTimeout time a graceful stop may take before the process is killed
 * @param killGrace time to wait for a killed process to disappear
 * @param restartPolicy crash restart policy
 * @param readinessMarkers extra readiness regular expressions per kind
 */
public record InstanceSettings(
        int logBufferLines,
        @Nonnull Duration readinessTimeout,
        @Nonnull Duration stopTimeout,
        @Nonnull Duration killGrace,
        @Nonnull RestartPolicy restartPolicy,
        @Nonnull Map<ServerKind, List<String>> readinessMarkers
) {

    public InstanceSettings {
        Objects.requireNonNull(readinessTimeout, "readinessTimeout");
        Objects.requireNonNull(stopTimeout, "stopTimeout");
        Objects.requireNonNull(killGrace, "killGrace");
        Objects.requireNonNull(restartPolicy, "restartPolicy");
        readinessMarkers = Map.copyOf(readinessMarkers);
    }

    /**
     * Derive instance settings from the supervisor configuration.
     *
     * @param config supervisor configuration
     * @return instance settings
     */
    @Nonnull
    public static InstanceSettings fromConfig(@Nonnull SupervisorConfig config) {
        SupervisorConfig.TimeoutConfig timeouts = config.getTimeouts();
        SupervisorConfig.RestartPolicyConfig restart = config.getRestartPolicy();

        Map<ServerKind, List<String>> markers = new EnumMap<>(ServerKind.class);
        for (ServerKind kind : ServerKind.values()) {
            List<String> configured = config.getReadinessMarkersFor(kind.getId());
            if (!configured.isEmpty()) {
                markers.put(kind, List.copyOf(configured));
            }
        }

        return new InstanceSettings(
                config.getLogBufferLines(),
                Duration.ofSeconds(timeouts.getReadinessSeconds()),
                Duration.ofSeconds(timeouts.getStopSeconds()),
                Duration.ofSeconds(timeouts.getKillGraceSeconds()),
                new RestartPolicy(
                        restart.getMaxAttempts(),
                        Duration.ofSeconds(restart.getBackoffStepSeconds()),
                        Duration.ofSeconds(restart.getBackoffMaxSeconds()),
                        Duration.ofMinutes(restart.getStabilityResetMinutes())),
                markers);
    }

    @Nonnull
    public List<String> markersFor(@Nonnull ServerKind kind) {
        return readinessMarkers.getOrDefault(kind, List.of());
    }
}
