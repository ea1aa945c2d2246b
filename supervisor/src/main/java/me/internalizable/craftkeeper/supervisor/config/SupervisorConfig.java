package me.internalizable.craftkeeper.supervisor.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the server supervisor.
 *
 * <p>Loaded from {@code servers/config.yml} and defines where servers live,
 * the defaults applied to new servers, lifecycle timeouts and the crash
 * restart policy.</p>
 */
public class SupervisorConfig {

    private String serversDirectory = "servers";
    private String definitionsFile = "servers/definitions.yml";
    private String javaPath = "java";
    private DefaultsConfig defaults = new DefaultsConfig();
    private TimeoutConfig timeouts = new TimeoutConfig();
    private RestartPolicyConfig restartPolicy = new RestartPolicyConfig();
    private AlertConfig alerts = new AlertConfig();
    private RelayConfig relay = new RelayConfig();
    private Map<String, List<String>> readinessMarkers = new HashMap<>();
    private int logBufferLines = 2000;
    private int eventQueueCapacity = 1024;
    private int samplerIntervalSeconds = 15;
    private boolean acceptEula = true;

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     */
    @Nonnull
    public static SupervisorConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            SupervisorConfig config = new SupervisorConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(SupervisorConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            SupervisorConfig config = yaml.load(is);
            return config != null ? config : new SupervisorConfig();
        }
    }

    /**
     * Save configuration to file.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Yaml yaml = new Yaml();
        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write(yaml.dumpAsMap(this));
        }
    }

    /**
     * Get the extra readiness markers configured for a server kind.
     *
     * @param kindId kind identifier, e.g. {@code "forge"}
     * @return regular expressions, empty if none configured
     */
    @Nonnull
    public List<String> getReadinessMarkersFor(@Nonnull String kindId) {
        List<String> markers = readinessMarkers.get(kindId);
        return markers != null ? markers : List.of();
    }

    // Getters and Setters

    public String getServersDirectory() {
        return serversDirectory;
    }

    public void setServersDirectory(String serversDirectory) {
        this.serversDirectory = serversDirectory;
    }

    public String getDefinitionsFile() {
        return definitionsFile;
    }

    public void setDefinitionsFile(String definitionsFile) {
        this.definitionsFile = definitionsFile;
    }

    public String getJavaPath() {
        return javaPath;
    }

    public void setJavaPath(String javaPath) {
        this.javaPath = javaPath;
    }

    public DefaultsConfig getDefaults() {
        return defaults;
    }

    public void setDefaults(DefaultsConfig defaults) {
        this.defaults = defaults;
    }

    public TimeoutConfig getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(TimeoutConfig timeouts) {
        this.timeouts = timeouts;
    }

    public RestartPolicyConfig getRestartPolicy() {
        return restartPolicy;
    }

    public void setRestartPolicy(RestartPolicyConfig restartPolicy) {
        this.restartPolicy = restartPolicy;
    }

    public AlertConfig getAlerts() {
        return alerts;
    }

    public void setAlerts(AlertConfig alerts) {
        this.alerts = alerts;
    }

    public RelayConfig getRelay() {
        return relay;
    }

    public void setRelay(RelayConfig relay) {
        this.relay = relay;
    }

    public Map<String, List<String>> getReadinessMarkers() {
        return readinessMarkers;
    }

    public void setReadinessMarkers(Map<String, List<String>> readinessMarkers) {
        this.readinessMarkers = readinessMarkers;
    }

    public int getLogBufferLines() {
        return logBufferLines;
    }

    public void setLogBufferLines(int logBufferLines) {
        this.logBufferLines = logBufferLines;
    }

    public int getEventQueueCapacity() {
        return eventQueueCapacity;
    }

    public void setEventQueueCapacity(int eventQueueCapacity) {
        this.eventQueueCapacity = eventQueueCapacity;
    }

    public int getSamplerIntervalSeconds() {
        return samplerIntervalSeconds;
    }

    public void setSamplerIntervalSeconds(int samplerIntervalSeconds) {
        this.samplerIntervalSeconds = samplerIntervalSeconds;
    }

    public boolean isAcceptEula() {
        return acceptEula;
    }

    public void setAcceptEula(boolean acceptEula) {
        this.acceptEula = acceptEula;
    }

    /**
     * Values applied to new servers when the creation options leave them unset.
     */
    public static class DefaultsConfig {
        private int port = 25565;
        private int maxPlayers = 20;
        private int minRamMb = 1024;
        private int maxRamMb = 4096;
        private boolean useDefaultJvmFlags = true;
        private List<String> jvmFlags = new ArrayList<>();

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getMaxPlayers() {
            return maxPlayers;
        }

        public void setMaxPlayers(int maxPlayers) {
            this.maxPlayers = maxPlayers;
        }

        public int getMinRamMb() {
            return minRamMb;
        }

        public void setMinRamMb(int minRamMb) {
            this.minRamMb = minRamMb;
        }

        public int getMaxRamMb() {
            return maxRamMb;
        }

        public void setMaxRamMb(int maxRamMb) {
            this.maxRamMb = maxRamMb;
        }

        public boolean isUseDefaultJvmFlags() {
            return useDefaultJvmFlags;
        }

        public void setUseDefaultJvmFlags(boolean useDefaultJvmFlags) {
            this.useDefaultJvmFlags = useDefaultJvmFlags;
        }

        public List<String> getJvmFlags() {
            return jvmFlags;
        }

        public void setJvmFlags(List<String> jvmFlags) {
            this.jvmFlags = jvmFlags;
        }
    }

    /**
     * Lifecycle timeouts.
     */
    public static class TimeoutConfig {
        private int readinessSeconds = 180;
        private int stopSeconds = 30;
        private int killGraceSeconds = 5;

        public int getReadinessSeconds() {
            return readinessSeconds;
        }

        public void setReadinessSeconds(int readinessSeconds) {
            this.readinessSeconds = readinessSeconds;
        }

        public int getStopSeconds() {
            return stopSeconds;
        }

        public void setStopSeconds(int stopSeconds) {
            this.stopSeconds = stopSeconds;
        }

        public int getKillGraceSeconds() {
            return killGraceSeconds;
        }

        public void setKillGraceSeconds(int killGraceSeconds) {
            this.killGraceSeconds = killGraceSeconds;
        }
    }

    /**
     * Automatic restart after crashes.
     */
    public static class RestartPolicyConfig {
        private int maxAttempts = 5;
        private int backoffStepSeconds = 5;
        private int backoffMaxSeconds = 30;
        private int stabilityResetMinutes = 10;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getBackoffStepSeconds() {
            return backoffStepSeconds;
        }

        public void setBackoffStepSeconds(int backoffStepSeconds) {
            this.backoffStepSeconds = backoffStepSeconds;
        }

        public int getBackoffMaxSeconds() {
            return backoffMaxSeconds;
        }

        public void setBackoffMaxSeconds(int backoffMaxSeconds) {
            this.backoffMaxSeconds = backoffMaxSeconds;
        }

        public int getStabilityResetMinutes() {
            return stabilityResetMinutes;
        }

        public void setStabilityResetMinutes(int stabilityResetMinutes) {
            this.stabilityResetMinutes = stabilityResetMinutes;
        }
    }

    /**
     * Performance alert thresholds. RAM thresholds of 0 disable RAM alerts.
     */
    public static class AlertConfig {
        private boolean enabled = true;
        private double cpuWarning = 80;
        private double cpuCritical = 95;
        private long ramWarningMb = 0;
        private long ramCriticalMb = 0;
        private double tpsWarning = 15;
        private double tpsCritical = 10;
        private int cooldownMinutes = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getCpuWarning() {
            return cpuWarning;
        }

        public void setCpuWarning(double cpuWarning) {
            this.cpuWarning = cpuWarning;
        }

        public double getCpuCritical() {
            return cpuCritical;
        }

        public void setCpuCritical(double cpuCritical) {
            this.cpuCritical = cpuCritical;
        }

        public long getRamWarningMb() {
            return ramWarningMb;
        }

        public void setRamWarningMb(long ramWarningMb) {
            this.ramWarningMb = ramWarningMb;
        }

        public long getRamCriticalMb() {
            return ramCriticalMb;
        }

        public void setRamCriticalMb(long ramCriticalMb) {
            this.ramCriticalMb = ramCriticalMb;
        }

        public double getTpsWarning() {
            return tpsWarning;
        }

        public void setTpsWarning(double tpsWarning) {
            this.tpsWarning = tpsWarning;
        }

        public double getTpsCritical() {
            return tpsCritical;
        }

        public void setTpsCritical(double tpsCritical) {
            this.tpsCritical = tpsCritical;
        }

        public int getCooldownMinutes() {
            return cooldownMinutes;
        }

        public void setCooldownMinutes(int cooldownMinutes) {
            this.cooldownMinutes = cooldownMinutes;
        }
    }

    /**
     * Chat relay settings. Only the listed servers are relayed.
     */
    public static class RelayConfig {
        private boolean enabled = false;
        private boolean chat = true;
        private boolean playerEvents = true;
        private boolean status = true;
        private List<String> servers = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isChat() {
            return chat;
        }

        public void setChat(boolean chat) {
            this.chat = chat;
        }

        public boolean isPlayerEvents() {
            return playerEvents;
        }

        public void setPlayerEvents(boolean playerEvents) {
            this.playerEvents = playerEvents;
        }

        public boolean isStatus() {
            return status;
        }

        public void setStatus(boolean status) {
            this.status = status;
        }

        public List<String> getServers() {
            return servers;
        }

        public void setServers(List<String> servers) {
            this.servers = servers;
        }
    }
}
