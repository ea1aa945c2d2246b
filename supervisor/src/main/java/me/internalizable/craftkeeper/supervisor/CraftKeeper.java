package me.internalizable.craftkeeper.supervisor;

import me.internalizable.craftkeeper.api.event.EventSubscription;
import me.internalizable.craftkeeper.api.event.ServerEventKind;
import me.internalizable.craftkeeper.api.supervisor.SupervisorAPI;
import me.internalizable.craftkeeper.supervisor.api.SupervisorAPIImpl;
import me.internalizable.craftkeeper.supervisor.bridge.ChatRelay;
import me.internalizable.craftkeeper.supervisor.bridge.LoggingRelaySink;
import me.internalizable.craftkeeper.supervisor.bridge.RelaySettings;
import me.internalizable.craftkeeper.supervisor.command.SupervisorCommand;
import me.internalizable.craftkeeper.supervisor.command.SupervisorConsole;
import me.internalizable.craftkeeper.supervisor.config.SupervisorConfig;
import me.internalizable.craftkeeper.supervisor.metrics.LoggingAlertSink;
import me.internalizable.craftkeeper.supervisor.metrics.PerformanceAlertMonitor;
import me.internalizable.craftkeeper.supervisor.metrics.ProcessHandleResourceProbe;
import me.internalizable.craftkeeper.supervisor.metrics.ResourceSampler;
import me.internalizable.craftkeeper.supervisor.player.PlayerSessionTracker;
import me.internalizable.craftkeeper.supervisor.process.SystemProcessLauncher;
import me.internalizable.craftkeeper.supervisor.store.YamlDefinitionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Standalone supervisor application: loads the configuration, brings up the
 * supervisor with its samplers and relays, and serves the operator console.
 *
 * <p>The configuration path defaults to {@code servers/config.yml} and may be
 * given as the first argument.</p>
 */
public final class CraftKeeper {

    private static final Logger LOGGER = LoggerFactory.getLogger(CraftKeeper.class);
    private static final String DEFAULT_CONFIG = "servers/config.yml";

    private final SupervisorConfig config;
    private final ServerSupervisor supervisor;
    private final SupervisorAPI api;
    private final PlayerSessionTracker playerTracker = new PlayerSessionTracker();
    private final List<EventSubscription> subscriptions = new ArrayList<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private ResourceSampler sampler;

    public CraftKeeper(@Nonnull SupervisorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.supervisor = new ServerSupervisor(
                config,
                new YamlDefinitionStore(Path.of(config.getDefinitionsFile())),
                new SystemProcessLauncher());
        this.api = new SupervisorAPIImpl(supervisor);
    }

    public static void main(String[] args) {
        Path configPath = Path.of(args.length > 0 ? args[0] : DEFAULT_CONFIG);

        CraftKeeper app;
        try {
            app = new CraftKeeper(SupervisorConfig.load(configPath));
            app.start();
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Failed to start CraftKeeper", e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(app::stop, "Supervisor-Shutdown"));

        SupervisorConsole console = new SupervisorConsole(
                new SupervisorCommand(app.supervisor, System.out), System.in, System.out, () -> {
                    app.stop();
                    System.exit(0);
                });
        console.start();
    }

    /**
     * Initialize the supervisor and attach sampling, alerting, player tracking and relaying.
     *
     * @throws IOException if the servers directory or definitions cannot be read
     */
    public void start() throws IOException {
        LOGGER.info("Starting CraftKeeper...");

        subscriptions.add(supervisor.subscribe("player-sessions", PlayerSessionTracker.KINDS, playerTracker));

        PerformanceAlertMonitor alertMonitor = null;
        if (config.getAlerts().isEnabled()) {
            alertMonitor = new PerformanceAlertMonitor(config.getAlerts(), new LoggingAlertSink());
            subscriptions.add(supervisor.subscribe("performance-alerts",
                    EnumSet.of(ServerEventKind.CRASHED), alertMonitor));
        }

        SupervisorConfig.RelayConfig relayConfig = config.getRelay();
        if (relayConfig.isEnabled()) {
            ChatRelay relay = new ChatRelay(new LoggingRelaySink());
            RelaySettings settings = new RelaySettings(
                    relayConfig.isChat(), relayConfig.isPlayerEvents(), relayConfig.isStatus());
            for (String serverId : relayConfig.getServers()) {
                relay.configure(serverId, settings);
            }
            subscriptions.add(supervisor.subscribe("chat-relay", ChatRelay.KINDS, relay));
            LOGGER.info("Chat relay enabled for {} server(s)", relayConfig.getServers().size());
        }

        supervisor.initialize();

        sampler = new ResourceSampler(supervisor.getRegistry(), new ProcessHandleResourceProbe(), alertMonitor);
        sampler.start(supervisor.getScheduler(), Duration.ofSeconds(config.getSamplerIntervalSeconds()));

        LOGGER.info("CraftKeeper started with {} server(s)", supervisor.getRegistry().size());
    }

    /**
     * Stop sampling, bring every server down and release all threads. Safe to call twice.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        LOGGER.info("Stopping CraftKeeper...");
        if (sampler != null) {
            sampler.stop();
        }
        for (EventSubscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
        supervisor.shutdown();
        LOGGER.info("CraftKeeper stopped");
    }

    @Nonnull
    public SupervisorAPI getApi() {
        return api;
    }

    @Nonnull
    public ServerSupervisor getSupervisor() {
        return supervisor;
    }

    @Nonnull
    public PlayerSessionTracker getPlayerTracker() {
        return playerTracker;
    }
}
