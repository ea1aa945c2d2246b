package me.internalizable.craftkeeper.supervisor;

import me.internalizable.craftkeeper.api.event.EventPayload;
import me.internalizable.craftkeeper.api.event.EventSubscription;
import me.internalizable.craftkeeper.api.event.ServerEvent;
import me.internalizable.craftkeeper.api.event.ServerEventKind;
import me.internalizable.craftkeeper.api.event.ServerEventListener;
import me.internalizable.craftkeeper.api.supervisor.InvalidTransitionException;
import me.internalizable.craftkeeper.api.supervisor.ServerNotFoundException;
import me.internalizable.craftkeeper.api.supervisor.ServerOperationException;
import me.internalizable.craftkeeper.api.supervisor.ServerState;
import me.internalizable.craftkeeper.api.supervisor.StatusSnapshot;
import me.internalizable.craftkeeper.api.supervisor.SupervisorAPI;
import me.internalizable.craftkeeper.supervisor.config.SupervisorConfig;
import me.internalizable.craftkeeper.supervisor.event.EventBroadcaster;
import me.internalizable.craftkeeper.supervisor.instance.InstanceSettings;
import me.internalizable.craftkeeper.supervisor.instance.ServerInstance;
import me.internalizable.craftkeeper.supervisor.process.LaunchCommandFactory;
import me.internalizable.craftkeeper.supervisor.process.ProcessLauncher;
import me.internalizable.craftkeeper.supervisor.registry.ServerRegistry;
import me.internalizable.craftkeeper.supervisor.store.DefinitionStore;
import me.internalizable.craftkeeper.supervisor.store.ServerDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Central coordinator of all supervised servers.
 *
 * <p>Owns one {@link ServerInstance} per stored {@link ServerDefinition},
 * routes control operations to them by id, relays their events through an
 * {@link EventBroadcaster} and keeps the stored status of every server in
 * line with its runtime state.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * SupervisorConfig config = SupervisorConfig.load(Path.of("servers/config.yml"));
 * ServerSupervisor supervisor = new ServerSupervisor(
 *         config,
 *         new YamlDefinitionStore(Path.of(config.getDefinitionsFile())),
 *         new SystemProcessLauncher());
 * supervisor.initialize();
 *
 * supervisor.startServer("7f1c...").thenAccept(state -> ...);
 *
 * // On application shutdown
 * supervisor.shutdown();
 * }</pre>
 */
public class ServerSupervisor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerSupervisor.class);

    private static final Duration SHUTDOWN_MARGIN = Duration.ofSeconds(10);

    private final SupervisorConfig config;
    private final InstanceSettings settings;
    private final DefinitionStore store;
    private final ProcessLauncher launcher;
    private final LaunchCommandFactory commandFactory;
    private final EventBroadcaster broadcaster;
    private final ServerRegistry registry = new ServerRegistry();
    private final ScheduledExecutorService scheduler;
    private final ExecutorService asyncExecutor;
    private final Path serversDirectory;

    private EventSubscription statusSubscription;

    private volatile boolean initialized = false;
    private volatile boolean shutdown = false;

    /**
     * Create a supervisor with instance settings derived from the configuration.
     *
     * @param config supervisor configuration
     * @param store definition store
     * @param launcher process launcher
     */
    public ServerSupervisor(@Nonnull SupervisorConfig config,
                            @Nonnull DefinitionStore store,
                            @Nonnull ProcessLauncher launcher) {
        this(config, InstanceSettings.fromConfig(config), store, launcher);
    }

    /**
     * Create a supervisor.
     *
     * @param config supervisor configuration
     * @param settings instance tunables
     * @param store definition store
     * @param launcher process launcher
     */
    public ServerSupervisor(@Nonnull SupervisorConfig config,
                            @Nonnull InstanceSettings settings,
                            @Nonnull DefinitionStore store,
                            @Nonnull ProcessLauncher launcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.store = Objects.requireNonNull(store, "store");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.serversDirectory = Path.of(config.getServersDirectory());
        this.commandFactory = new LaunchCommandFactory(
                config.getJavaPath(),
                config.getDefaults().isUseDefaultJvmFlags(),
                config.isAcceptEula());
        this.broadcaster = new EventBroadcaster(config.getEventQueueCapacity());
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "Supervisor-Scheduler");
            t.setDaemon(true);
            return t;
        });
        this.asyncExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "Supervisor-Async");
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== Initialization ====================

    /**
     * Load every stored definition and bring servers up.
     *
     * <p>Statuses persisted by a previous run are reset to
     * {@link ServerState#STOPPED}, since no process survives a supervisor
     * restart. Servers flagged auto-start are then started; failures are
     * logged and do not abort initialization.</p>
     *
     * @throws IOException if the servers directory or definitions cannot be read
     */
    public void initialize() throws IOException {
        if (initialized) {
            throw new IllegalStateException("Supervisor already initialized");
        }

        LOGGER.info("Initializing server supervisor...");
        Files.createDirectories(serversDirectory);

        statusSubscription = broadcaster.subscribe("definition-status",
                EnumSet.of(ServerEventKind.STATUS_CHANGED), this::persistStatus);

        List<ServerDefinition> definitions = store.loadAll();
        for (ServerDefinition definition : definitions) {
            if (definition.getStatus() != ServerState.STOPPED || definition.getPid() != null) {
                LOGGER.info("Resetting stale status '{}' of server '{}'",
                        definition.getStatus() != null ? definition.getStatus().getId() : null, definition.getId());
                definition.setStatus(ServerState.STOPPED);
                definition.setPid(null);
                store.updateStatus(definition.getId(), ServerState.STOPPED, null);
            }
            registry.register(newInstance(definition));
        }

        initialized = true;
        LOGGER.info("Server supervisor initialized with {} server(s)", registry.size());

        for (ServerDefinition definition : definitions) {
            if (definition.isAutoStart()) {
                String serverId = definition.getId();
                LOGGER.info("Auto-starting server '{}' ({})", definition.getName(), serverId);
                startServer(serverId).exceptionally(e -> {
                    LOGGER.error("Failed to auto-start server '{}': {}", serverId, unwrap(e).getMessage());
                    return null;
                });
            }
        }
    }

    private ServerInstance newInstance(ServerDefinition definition) {
        return new ServerInstance(definition, settings, launcher, commandFactory, broadcaster, scheduler);
    }

    private void persistStatus(ServerEvent event) {
        EventPayload.StatusChanged change = event.payload(EventPayload.StatusChanged.class);
        try {
            store.updateStatus(event.serverId(), change.current(), change.pid());
        } catch (IOException e) {
            LOGGER.error("Failed to persist status '{}' of server '{}'",
                    change.current().getId(), event.serverId(), e);
        }
    }

    // ==================== Definitions ====================

    /**
     * Provision a new server: assigns an id, creates its working directory and
     * stores its definition with configured defaults for unset options.
     *
     * @param options creation options
     * @return the stored definition
     * @throws IOException if the directory or definition cannot be written
     */
    @Nonnull
    public ServerDefinition createServer(@Nonnull SupervisorAPI.CreateOptions options) throws IOException {
        checkInitialized();
        Objects.requireNonNull(options, "options");

        String serverId = UUID.randomUUID().toString();
        Path directory = serversDirectory.resolve(serverId);
        Files.createDirectories(directory);

        SupervisorConfig.DefaultsConfig defaults = config.getDefaults();
        ServerDefinition definition = new ServerDefinition();
        definition.setId(serverId);
        definition.setName(options.getName());
        definition.setKind(options.getKind());
        definition.setVersion(options.getVersion());
        definition.setDirectory(directory.toString());
        definition.setJarFile(options.getJarFile());
        definition.setJavaPath(options.getJavaPath());
        definition.setMinRamMb(options.getMinRamMb() > 0 ? options.getMinRamMb() : defaults.getMinRamMb());
        definition.setMaxRamMb(options.getMaxRamMb() > 0 ? options.getMaxRamMb() : defaults.getMaxRamMb());
        List<String> flags = new ArrayList<>(defaults.getJvmFlags());
        flags.addAll(options.getJvmFlags());
        definition.setJvmFlags(flags);
        definition.setEnvironment(new LinkedHashMap<>(options.getEnvironment()));
        definition.setPort(options.getPort() > 0 ? options.getPort() : defaults.getPort());
        definition.setMaxPlayers(options.getMaxPlayers() > 0 ? options.getMaxPlayers() : defaults.getMaxPlayers());
        definition.setAutoStart(options.isAutoStart());
        definition.setAutoRestart(options.isAutoRestart());
        definition.setStatus(ServerState.STOPPED);
        long now = System.currentTimeMillis();
        definition.setCreatedAt(now);
        definition.setUpdatedAt(now);

        store.save(definition);
        registry.register(newInstance(definition));

        LOGGER.info("Created server '{}' ({}, {}) in {}",
                definition.getName(), serverId, definition.getKind().getId(), directory);
        return definition.copy();
    }

    /**
     * Edit a server definition. Changes apply from the next start.
     *
     * @param serverId server identifier
     * @param mutator edits a copy of the definition; id, status and pid changes are ignored
     * @return the stored definition
     * @throws ServerNotFoundException if the server is unknown
     * @throws IOException if the definition cannot be written
     */
    @Nonnull
    public ServerDefinition updateServer(@Nonnull String serverId,
                                         @Nonnull Consumer<ServerDefinition> mutator) throws IOException {
        Objects.requireNonNull(mutator, "mutator");
        ServerInstance instance = requireInstance(serverId);

        ServerDefinition definition = instance.getDefinition();
        mutator.accept(definition);
        definition.setId(serverId);
        definition.setStatus(instance.getState());
        definition.setPid(instance.getPid());
        definition.setUpdatedAt(System.currentTimeMillis());

        store.save(definition);
        instance.updateDefinition(definition);
        LOGGER.info("Updated server '{}'", serverId);
        return definition.copy();
    }

    /**
     * Stop a server if needed and remove it.
     *
     * @param serverId server identifier
     * @param purgeFiles also delete the working directory
     * @return future completing when the server is removed
     */
    @Nonnull
    public CompletableFuture<Void> deleteServer(@Nonnull String serverId, boolean purgeFiles) {
        return async(serverId, instance -> {
            instance.retire();
            registry.unregister(serverId);

            Path directory = instance.getDefinition().getDirectoryPath();
            try {
                store.delete(serverId);
                if (purgeFiles && Files.exists(directory)) {
                    deleteDirectory(directory);
                }
            } catch (IOException e) {
                throw new CompletionException(new ServerOperationException(serverId,
                        "Failed to delete server '" + serverId + "': " + e.getMessage(), e));
            }

            LOGGER.info("Deleted server '{}'{}", serverId, purgeFiles ? " and its files" : "");
            return null;
        });
    }

    @Nonnull
    public ServerDefinition getDefinition(@Nonnull String serverId) {
        return requireInstance(serverId).getDefinition();
    }

    /**
     * Get every definition, ordered by creation time.
     *
     * @return definition copies
     */
    @Nonnull
    public List<ServerDefinition> listDefinitions() {
        List<ServerDefinition> definitions = new ArrayList<>();
        for (ServerInstance instance : registry.getAllServers()) {
            definitions.add(instance.getDefinition());
        }
        definitions.sort(Comparator.comparingLong(ServerDefinition::getCreatedAt)
                .thenComparing(ServerDefinition::getId));
        return definitions;
    }

    // ==================== Lifecycle ====================

    /**
     * Start a server.
     *
     * @param serverId server identifier
     * @return future completing with the state the start settled in
     */
    @Nonnull
    public CompletableFuture<ServerState> startServer(@Nonnull String serverId) {
        return async(serverId, ServerInstance::start).thenCompose(Function.identity());
    }

    /**
     * Gracefully stop a server.
     *
     * @param serverId server identifier
     * @return future completing when the server is stopped
     */
    @Nonnull
    public CompletableFuture<Void> stopServer(@Nonnull String serverId) {
        return async(serverId, instance -> {
            instance.stop();
            return null;
        });
    }

    /**
     * Restart a server.
     *
     * @param serverId server identifier
     * @return future completing with the state the new start settled in
     */
    @Nonnull
    public CompletableFuture<ServerState> restartServer(@Nonnull String serverId) {
        return async(serverId, ServerInstance::restart).thenCompose(Function.identity());
    }

    /**
     * Forcibly terminate a server.
     *
     * @param serverId server identifier
     * @return future completing when the server is stopped
     */
    @Nonnull
    public CompletableFuture<Void> killServer(@Nonnull String serverId) {
        return async(serverId, instance -> {
            instance.kill();
            return null;
        });
    }

    /**
     * Write one line of console input to a server.
     *
     * @param serverId server identifier
     * @param command console command
     */
    public void sendCommand(@Nonnull String serverId, @Nonnull String command) {
        requireInstance(serverId).sendCommand(command);
    }

    // ==================== Observation ====================

    @Nonnull
    public List<String> tailLogs(@Nonnull String serverId, int lines) {
        return requireInstance(serverId).tailLogs(lines);
    }

    @Nonnull
    public StatusSnapshot getStatus(@Nonnull String serverId) {
        return requireInstance(serverId).getStatusSnapshot();
    }

    /**
     * Collect the status of every server concurrently.
     *
     * @return snapshots keyed by server id, sorted by id
     */
    @Nonnull
    public Map<String, StatusSnapshot> getAllStatuses() {
        Map<String, CompletableFuture<StatusSnapshot>> pending = new LinkedHashMap<>();
        for (ServerInstance instance : registry.getAllServers()) {
            pending.put(instance.getServerId(),
                    CompletableFuture.supplyAsync(instance::getStatusSnapshot, asyncExecutor));
        }

        Map<String, StatusSnapshot> result = new TreeMap<>();
        pending.forEach((serverId, future) -> result.put(serverId, future.join()));
        return result;
    }

    @Nonnull
    public EventSubscription subscribe(@Nonnull String name, @Nonnull Set<ServerEventKind> kinds,
                                       @Nonnull ServerEventListener listener) {
        return broadcaster.subscribe(name, kinds, listener);
    }

    /**
     * Get an instance by id.
     *
     * @param serverId server identifier
     * @return the instance
     * @throws ServerNotFoundException if the server is unknown
     */
    @Nonnull
    public ServerInstance getInstance(@Nonnull String serverId) {
        return requireInstance(serverId);
    }

    @Nullable
    public ServerInstance findInstance(@Nonnull String serverId) {
        return registry.getServer(serverId);
    }

    @Nonnull
    public ServerRegistry getRegistry() {
        return registry;
    }

    @Nonnull
    public SupervisorConfig getConfig() {
        return config;
    }

    @Nonnull
    public ScheduledExecutorService getScheduler() {
        return scheduler;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    // ==================== Shutdown ====================

    /**
     * Stop every starting or running server concurrently, kill those that do
     * not stop in time, and release all threads.
     *
     * <p>Every instance is destroyed before anything is stopped, so pending
     * automatic restarts cannot spawn new processes while shutdown waits.</p>
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        LOGGER.info("Shutting down server supervisor...");

        List<ServerInstance> instances = new ArrayList<>(registry.getAllServers());
        for (ServerInstance instance : instances) {
            instance.destroy();
        }

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (ServerInstance instance : instances) {
            futures.add(CompletableFuture.runAsync(instance::retire, asyncExecutor));
        }

        Duration budget = settings.stopTimeout().plus(settings.killGrace()).plus(SHUTDOWN_MARGIN);
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | ExecutionException e) {
            LOGGER.warn("Timeout waiting for server shutdowns, forcing...");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted waiting for server shutdowns, forcing...");
        }
        killRemaining(instances);

        if (statusSubscription != null) {
            statusSubscription.close();
        }
        for (ServerInstance instance : instances) {
            try {
                store.updateStatus(instance.getServerId(), instance.getState(), instance.getPid());
            } catch (IOException e) {
                LOGGER.error("Failed to persist final status of server '{}'", instance.getServerId(), e);
            }
        }

        broadcaster.shutdown();
        scheduler.shutdown();
        asyncExecutor.shutdown();

        try {
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
            asyncExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        registry.clear();
        LOGGER.info("Server supervisor shut down");
    }

    private void killRemaining(List<ServerInstance> instances) {
        for (ServerInstance instance : instances) {
            if (instance.getState().isProcessExpected()) {
                try {
                    instance.kill();
                } catch (InvalidTransitionException e) {
                    LOGGER.debug("Server '{}' already stopped", instance.getServerId());
                }
            }
        }
    }

    // ==================== Internals ====================

    private ServerInstance requireInstance(String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        ServerInstance instance = registry.getServer(serverId);
        if (instance == null) {
            throw new ServerNotFoundException(serverId);
        }
        return instance;
    }

    private <T> CompletableFuture<T> async(String serverId, Function<ServerInstance, T> operation) {
        Objects.requireNonNull(serverId, "serverId");
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Supervisor has been shut down"));
        }
        ServerInstance instance = registry.getServer(serverId);
        if (instance == null) {
            return CompletableFuture.failedFuture(new ServerNotFoundException(serverId));
        }
        return CompletableFuture.supplyAsync(() -> operation.apply(instance), asyncExecutor);
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Supervisor not initialized");
        }
        if (shutdown) {
            throw new IllegalStateException("Supervisor has been shut down");
        }
    }

    /**
     * Strip {@link CompletionException} wrappers from a future's failure.
     */
    @Nonnull
    public static Throwable unwrap(@Nonnull Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static void deleteDirectory(Path directory) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
