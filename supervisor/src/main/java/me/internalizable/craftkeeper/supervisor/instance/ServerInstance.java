package me.internalizable.craftkeeper.supervisor.instance;

import me.internalizable.craftkeeper.api.event.EventPayload;
import me.internalizable.craftkeeper.api.event.ServerEvent;
import me.internalizable.craftkeeper.api.supervisor.InvalidTransitionException;
import me.internalizable.craftkeeper.api.supervisor.NoRunningProcessException;
import me.internalizable.craftkeeper.api.supervisor.ResourceSnapshot;
import me.internalizable.craftkeeper.api.supervisor.ServerOperationException;
import me.internalizable.craftkeeper.api.supervisor.ServerState;
import me.internalizable.craftkeeper.api.supervisor.SpawnFailedException;
import me.internalizable.craftkeeper.api.supervisor.StatusSnapshot;
import me.internalizable.craftkeeper.supervisor.console.ConsoleLineClassifier;
import me.internalizable.craftkeeper.supervisor.console.ConsoleMatch;
import me.internalizable.craftkeeper.supervisor.event.EventSink;
import me.internalizable.craftkeeper.supervisor.process.ConsoleReader;
import me.internalizable.craftkeeper.supervisor.process.LaunchCommand;
import me.internalizable.craftkeeper.supervisor.process.LaunchCommandFactory;
import me.internalizable.craftkeeper.supervisor.process.LogRingBuffer;
import me.internalizable.craftkeeper.supervisor.process.ManagedProcess;
import me.internalizable.craftkeeper.supervisor.process.ProcessLauncher;
import me.internalizable.craftkeeper.supervisor.store.ServerDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Supervises the OS process of one server.
 *
 * <p>Owns the lifecycle state machine, the console log buffer, the set of
 * connected players and the automatic restart policy.</p>
 *
 * <h2>Lifecycle States</h2>
 * <pre>
 * STOPPED → STARTING → RUNNING → STOPPING → STOPPED
 *              ↓          ↓
 *           CRASHED ← ────┘     (any state) → kill → STOPPED
 * </pre>
 *
 * <h2>Threading</h2>
 * <p>{@link #start()}, {@link #stop()}, {@link #restart()} and {@link #kill()}
 * are serialized by a per-instance lock, so at most one process is ever alive.
 * State and process fields are guarded by a separate monitor that is only
 * held briefly, which lets exit handling and readiness detection proceed
 * while a control operation waits for the process. Each process gets one
 * console reader thread; it is the only writer of the log buffer and player
 * map and it reports the exit once all output has been read.</p>
 */
public class ServerInstance implements ConsoleReader.Callback {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerInstance.class);

    private final String serverId;
    private final InstanceSettings settings;
    private final ProcessLauncher launcher;
    private final LaunchCommandFactory commandFactory;
    private final EventSink eventSink;
    private final ScheduledExecutorService scheduler;
    private final LogRingBuffer logBuffer;

    private final ReentrantLock operationLock = new ReentrantLock();
    private final Object stateLock = new Object();
    private final Object emitLock = new Object();

    private final Map<String, ConnectedPlayer> players = new ConcurrentHashMap<>();
    private final Map<String, String> announcedUuids = new ConcurrentHashMap<>();

    private volatile ServerDefinition definition;
    private volatile ConsoleLineClassifier classifier;

    // guarded by stateLock
    private volatile ServerState state = ServerState.STOPPED;
    private volatile ManagedProcess process;
    private volatile Thread consoleReader;
    private boolean stopRequested;
    private boolean crashReportSeen;
    private int crashRestartAttempts;
    private Instant runningSince;
    private CompletableFuture<ServerState> startResult;
    private ScheduledFuture<?> readinessTimeout;
    private ScheduledFuture<?> pendingRestart;
    private boolean destroyed;

    // guarded by emitLock
    private Instant lastEventTime = Instant.EPOCH;

    private volatile double cpuPercent;
    private volatile long residentMemoryBytes;
    private volatile double ticksPerSecond = -1;
    private volatile Instant sampledAt;

    /**
     * Create a server instance in the {@link ServerState#STOPPED} state.
     *
     * @param definition server definition; copied
     * @param settings shared instance tunables
     * @param launcher spawns the OS process
     * @param commandFactory builds the launch command from the definition
     * @param eventSink receives every emitted event
     * @param scheduler runs readiness timeouts and delayed restarts
     */
    public ServerInstance(
            @Nonnull ServerDefinition definition,
            @Nonnull InstanceSettings settings,
            @Nonnull ProcessLauncher launcher,
            @Nonnull LaunchCommandFactory commandFactory,
            @Nonnull EventSink eventSink,
            @Nonnull ScheduledExecutorService scheduler) {
        Objects.requireNonNull(definition, "definition");
        this.serverId = Objects.requireNonNull(definition.getId(), "definition.id");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.commandFactory = Objects.requireNonNull(commandFactory, "commandFactory");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.logBuffer = new LogRingBuffer(settings.logBufferLines());
        updateDefinition(definition);
    }

    // ==================== Lifecycle ====================

    /**
     * Spawn the server process.
     *
     * <p>Returns once the process is spawned. The returned future completes
     * with {@link ServerState#RUNNING} when the server reports readiness (or
     * the readiness timeout elapses), with {@link ServerState#CRASHED} if the
     * process dies first, or with {@link ServerState#STOPPED} if it is
     * stopped or killed before becoming ready. A manual start resets the
     * crash restart counter and cancels a pending automatic restart.</p>
     *
     * @return future completing with the state the start settled in
     * @throws InvalidTransitionException if the server is not stopped or crashed
     * @throws SpawnFailedException if the process could not be launched
     */
    @Nonnull
    public CompletableFuture<ServerState> start() {
        return start(true);
    }

    private CompletableFuture<ServerState> start(boolean manual) {
        operationLock.lock();
        try {
            ServerDefinition current = definition;
            synchronized (stateLock) {
                if (destroyed) {
                    throw new ServerOperationException(serverId, "Server '" + serverId + "' has been deleted");
                }
                if (!state.canStart() || (!manual && state != ServerState.CRASHED)) {
                    throw new InvalidTransitionException(serverId, "start", state);
                }
                if (manual) {
                    cancelPendingRestart();
                    crashRestartAttempts = 0;
                }
            }

            ManagedProcess managed;
            try {
                LaunchCommand command = commandFactory.create(current);
                LOGGER.info("Spawning server '{}' ({}) in {}", serverId, current.getKind().getId(),
                        command.workingDirectory());
                managed = new ManagedProcess(serverId, launcher.launch(command));
            } catch (IOException e) {
                failSpawn(e);
                throw new SpawnFailedException(serverId, e.getMessage(), e);
            }

            boolean deleted;
            synchronized (stateLock) {
                deleted = destroyed;
            }
            if (deleted) {
                LOGGER.info("Server '{}' was deleted while spawning, killing PID {}", serverId, managed.getPid());
                terminate(managed);
                throw new ServerOperationException(serverId, "Server '" + serverId + "' has been deleted");
            }

            CompletableFuture<ServerState> result = new CompletableFuture<>();
            synchronized (stateLock) {
                process = managed;
                stopRequested = false;
                crashReportSeen = false;
                runningSince = null;
                startResult = result;
                transition(ServerState.STARTING, manual ? "start requested" : "automatic restart");
                readinessTimeout = scheduler.schedule(() -> onReadinessTimeout(managed),
                        settings.readinessTimeout().toMillis(), TimeUnit.MILLISECONDS);
            }

            consoleReader = ConsoleReader.start(managed, this);
            LOGGER.info("Server '{}' started with PID {}", serverId, managed.getPid());
            return result;
        } finally {
            operationLock.unlock();
        }
    }

    /**
     * Gracefully stop the server.
     *
     * <p>Sends the kind's shutdown command and waits up to the stop timeout
     * for the process to exit, then forcibly terminates it. Blocks until the
     * server is {@link ServerState#STOPPED}.</p>
     *
     * @throws InvalidTransitionException if the server is not starting or running
     */
    public void stop() {
        operationLock.lock();
        try {
            stopLocked();
        } finally {
            operationLock.unlock();
        }
    }

    private void stopLocked() {
        ManagedProcess managed;
        synchronized (stateLock) {
            if (!state.canStop()) {
                throw new InvalidTransitionException(serverId, "stop", state);
            }
            managed = process;
            stopRequested = true;
            cancel(readinessTimeout);
            transition(ServerState.STOPPING, "stop requested");
        }

        String command = definition.getKind().getShutdownCommand();
        boolean exited = false;
        try {
            LOGGER.info("Requesting graceful shutdown for '{}'", serverId);
            managed.sendLine(command);
            exited = managed.waitFor(settings.stopTimeout());
            if (!exited) {
                LOGGER.warn("Server '{}' did not stop within {}s, forcing...",
                        serverId, settings.stopTimeout().toSeconds());
            }
        } catch (IOException e) {
            LOGGER.warn("Could not send '{}' to server '{}' ({}), forcing...", command, serverId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while stopping server '{}', forcing...", serverId);
        }

        if (!exited) {
            terminate(managed);
        }
        drainOutput(managed);
        settleStopped(managed, exited ? "stopped" : "stopped after forced termination");
    }

    /**
     * Stop the server if it is running, then start it again.
     *
     * @return future completing with the state the new start settled in
     * @throws InvalidTransitionException if the server is stopping
     * @throws SpawnFailedException if the new process could not be launched
     */
    @Nonnull
    public CompletableFuture<ServerState> restart() {
        operationLock.lock();
        try {
            ServerState current = state;
            if (current.canStop()) {
                stopLocked();
            } else if (!current.canStart()) {
                throw new InvalidTransitionException(serverId, "restart", current);
            }
            return start(true);
        } finally {
            operationLock.unlock();
        }
    }

    /**
     * Forcibly terminate the server and cancel any pending automatic restart.
     *
     * <p>If another operation is in flight (typically a stop waiting on a hung
     * process) its process is killed first so the operation finishes quickly.
     * The server ends up {@link ServerState#STOPPED} even if the process
     * outlives the kill grace period.</p>
     *
     * @throws InvalidTransitionException if the server was already stopped when called
     */
    public void kill() {
        boolean preempted = false;
        if (!operationLock.tryLock()) {
            ManagedProcess inFlight = process;
            if (inFlight != null) {
                LOGGER.info("Killing server '{}' during an in-flight operation", serverId);
                inFlight.destroyForcibly();
                preempted = true;
            }
            operationLock.lock();
        }
        try {
            killLocked(preempted);
        } finally {
            operationLock.unlock();
        }
    }

    private void killLocked(boolean preempted) {
        ManagedProcess managed;
        synchronized (stateLock) {
            if (state == ServerState.STOPPED) {
                if (preempted) {
                    LOGGER.debug("Server '{}' stopped after its in-flight process was killed", serverId);
                    return;
                }
                throw new InvalidTransitionException(serverId, "kill", state);
            }
            cancelPendingRestart();
            cancel(readinessTimeout);
            stopRequested = true;
            managed = process;
        }

        if (managed != null) {
            LOGGER.info("Killing server '{}' (PID {})", serverId, managed.getPid());
            terminate(managed);
        }
        settleStopped(managed, "killed");
    }

    /**
     * Write one line of console input to the server.
     *
     * @param command console command without trailing newline
     * @throws NoRunningProcessException if no process is alive
     * @throws ServerOperationException if writing to the process fails
     */
    public void sendCommand(@Nonnull String command) {
        Objects.requireNonNull(command, "command");
        ManagedProcess managed = process;
        if (managed == null || !state.isProcessExpected()) {
            throw new NoRunningProcessException(serverId);
        }
        try {
            managed.sendLine(command);
            LOGGER.debug("Sent command to '{}': {}", serverId, command);
        } catch (IOException e) {
            throw new ServerOperationException(serverId, "Failed to write command to server '" + serverId + "'", e);
        }
    }

    /**
     * Mark the instance as deleted: cancels scheduled work and rejects further starts.
     *
     * <p>A start already spawning when this is called kills its own process
     * once the spawn returns. Use {@link #retire()} to also bring down a live process.</p>
     */
    public void destroy() {
        synchronized (stateLock) {
            destroyed = true;
            cancelPendingRestart();
            cancel(readinessTimeout);
        }
    }

    /**
     * Destroy the instance and drive any live process down: gracefully when
     * it is starting or running, by kill when it is stopping.
     *
     * <p>Waits for an in-flight operation to finish first, so no process
     * spawned by it outlives this call. A crashed or stopped server is left
     * as it is.</p>
     */
    public void retire() {
        destroy();
        operationLock.lock();
        try {
            ServerState current = state;
            if (!current.isProcessExpected()) {
                return;
            }
            LOGGER.info("Bringing down server '{}' ({})", serverId, current.getId());
            if (current.canStop()) {
                try {
                    stopLocked();
                    return;
                } catch (InvalidTransitionException e) {
                    LOGGER.debug("Server '{}' changed state while stopping: {}", serverId, e.getMessage());
                }
            }
            if (state != ServerState.STOPPED) {
                killLocked(false);
            }
        } finally {
            operationLock.unlock();
        }
    }

    // ==================== Console ====================

    @Override
    public void onLine(@Nonnull ManagedProcess source, @Nonnull String line) {
        if (source != process) {
            return;
        }

        logBuffer.append(line);
        emit(new EventPayload.LogLine(line));
        classifier.classify(line).ifPresent(match -> handleMatch(source, match));
    }

    private void handleMatch(ManagedProcess source, ConsoleMatch match) {
        if (match instanceof ConsoleMatch.Ready) {
            markRunning(source, "readiness marker");
        } else if (match instanceof ConsoleMatch.PlayerUuid announced) {
            announcedUuids.put(announced.name(), announced.uuid());
        } else if (match instanceof ConsoleMatch.PlayerJoin join) {
            String uuid = announcedUuids.remove(join.name());
            players.put(join.name(), new ConnectedPlayer(join.name(), uuid, Instant.now()));
            emit(new EventPayload.PlayerJoined(join.name(), uuid, players.size()));
        } else if (match instanceof ConsoleMatch.PlayerLeave leave) {
            players.remove(leave.name());
            emit(new EventPayload.PlayerLeft(leave.name(), players.size()));
        } else if (match instanceof ConsoleMatch.Chat chat) {
            emit(new EventPayload.ChatMessage(chat.sender(), chat.message()));
        } else if (match instanceof ConsoleMatch.Advancement advancement) {
            emit(new EventPayload.AdvancementEarned(advancement.player(), advancement.advancement()));
        } else if (match instanceof ConsoleMatch.Death death) {
            emit(new EventPayload.PlayerDied(death.player(), death.message()));
        } else if (match instanceof ConsoleMatch.TickRate tickRate) {
            ticksPerSecond = tickRate.ticksPerSecond();
        } else if (match instanceof ConsoleMatch.CrashReport) {
            LOGGER.warn("Server '{}' is writing a crash report", serverId);
            synchronized (stateLock) {
                crashReportSeen = true;
            }
        }
    }

    @Override
    public void onExit(@Nonnull ManagedProcess source, int exitCode) {
        CompletableFuture<ServerState> result;
        ServerState settled;
        synchronized (stateLock) {
            if (source != process) {
                LOGGER.debug("Ignoring exit of stale process of '{}' (code {})", serverId, exitCode);
                return;
            }

            ServerState previous = state;
            process = null;
            cancel(readinessTimeout);
            clearRuntimeState();

            if (stopRequested) {
                transition(ServerState.STOPPED, "process exited");
            } else if (exitCode == 0 && previous == ServerState.RUNNING) {
                LOGGER.info("Server '{}' exited cleanly without a stop request", serverId);
                transition(ServerState.STOPPED, "process exited with code 0");
            } else {
                String reason = previous == ServerState.STARTING
                        ? "exited during startup with code " + exitCode
                        : "exited with code " + exitCode;
                LOGGER.warn("Server '{}' {}", serverId, reason);

                Duration delay = planRestart();
                transition(ServerState.CRASHED, reason);
                emit(new EventPayload.ServerCrashed(reason, exitCode, crashReportSeen, delay != null));
                if (delay != null) {
                    pendingRestart = scheduler.schedule(this::autoRestart, delay.toMillis(), TimeUnit.MILLISECONDS);
                }
            }
            runningSince = null;
            settled = state;
            result = takeStartResult();
        }
        complete(result, settled);
    }

    // ==================== Internals ====================

    private void markRunning(ManagedProcess source, String reason) {
        CompletableFuture<ServerState> result;
        synchronized (stateLock) {
            if (source != process || state != ServerState.STARTING) {
                return;
            }
            cancel(readinessTimeout);
            runningSince = Instant.now();
            transition(ServerState.RUNNING, reason);
            result = takeStartResult();
        }
        complete(result, ServerState.RUNNING);
    }

    private void onReadinessTimeout(ManagedProcess source) {
        if (!source.isAlive()) {
            return;
        }
        if (source == process && state == ServerState.STARTING) {
            LOGGER.warn("Server '{}' did not report readiness within {}s, assuming it is running",
                    serverId, settings.readinessTimeout().toSeconds());
        }
        markRunning(source, "readiness timeout");
    }

    /**
     * Decide whether a crash is followed by an automatic restart.
     *
     * @return the restart delay, or null if no restart is scheduled
     */
    @Nullable
    private Duration planRestart() {
        if (!definition.isAutoRestart() || destroyed) {
            return null;
        }

        RestartPolicy policy = settings.restartPolicy();
        if (runningSince != null
                && Duration.between(runningSince, Instant.now()).compareTo(policy.stabilityWindow()) >= 0) {
            crashRestartAttempts = 0;
        }
        if (crashRestartAttempts >= policy.maxAttempts()) {
            LOGGER.error("Server '{}' crashed {} time(s) in a row, giving up on automatic restarts",
                    serverId, crashRestartAttempts + 1);
            return null;
        }

        crashRestartAttempts++;
        Duration delay = policy.backoffFor(crashRestartAttempts);
        LOGGER.info("Restarting server '{}' in {}ms (attempt {}/{})",
                serverId, delay.toMillis(), crashRestartAttempts, policy.maxAttempts());
        return delay;
    }

    private void autoRestart() {
        synchronized (stateLock) {
            pendingRestart = null;
            if (destroyed || state != ServerState.CRASHED) {
                return;
            }
        }
        try {
            start(false);
        } catch (InvalidTransitionException e) {
            LOGGER.debug("Skipping automatic restart of '{}': {}", serverId, e.getMessage());
        } catch (ServerOperationException e) {
            LOGGER.error("Automatic restart of '{}' failed", serverId, e);
        }
    }

    private void failSpawn(IOException cause) {
        LOGGER.error("Failed to spawn server '{}': {}", serverId, cause.getMessage());
        synchronized (stateLock) {
            process = null;
            String reason = "spawn failed: " + cause.getMessage();
            transition(ServerState.CRASHED, reason);
            emit(new EventPayload.ServerCrashed(reason, null, false, false));
        }
    }

    private void terminate(ManagedProcess managed) {
        managed.destroyForcibly();
        try {
            if (!managed.waitFor(settings.killGrace())) {
                LOGGER.warn("Server '{}' (PID {}) still alive {}ms after kill, treating it as terminated",
                        serverId, managed.getPid(), settings.killGrace().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for server '{}' to die", serverId);
        }
    }

    /**
     * Give the console reader of an exited process a moment to deliver its
     * last lines and report the exit itself.
     */
    private void drainOutput(ManagedProcess managed) {
        Thread reader = consoleReader;
        if (reader == null || managed.isAlive() || Thread.currentThread() == reader) {
            return;
        }
        try {
            reader.join(settings.killGrace().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while draining output of server '{}'", serverId);
        }
    }

    /**
     * Settle in STOPPED after a stop or kill, unless the console reader
     * already did so on exit.
     */
    private void settleStopped(@Nullable ManagedProcess managed, String reason) {
        CompletableFuture<ServerState> result;
        synchronized (stateLock) {
            if (process != managed || state == ServerState.STOPPED) {
                return;
            }
            process = null;
            runningSince = null;
            clearRuntimeState();
            transition(ServerState.STOPPED, reason);
            result = takeStartResult();
        }
        complete(result, ServerState.STOPPED);
    }

    private void clearRuntimeState() {
        players.clear();
        announcedUuids.clear();
        cpuPercent = 0;
        residentMemoryBytes = 0;
        ticksPerSecond = -1;
        sampledAt = null;
    }

    private void transition(ServerState next, @Nullable String reason) {
        ServerState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        LOGGER.info("Server '{}' {} -> {} ({})", serverId, previous.getId(), next.getId(), reason);
        emit(new EventPayload.StatusChanged(previous, next, pidOf(process), reason));
    }

    @Nullable
    private CompletableFuture<ServerState> takeStartResult() {
        CompletableFuture<ServerState> result = startResult;
        startResult = null;
        return result;
    }

    /**
     * Complete a start future. Called outside the state monitor so dependent
     * callbacks may invoke control operations.
     */
    private static void complete(@Nullable CompletableFuture<ServerState> result, ServerState settled) {
        if (result != null) {
            result.complete(settled);
        }
    }

    private void cancelPendingRestart() {
        if (pendingRestart != null) {
            pendingRestart.cancel(false);
            pendingRestart = null;
        }
    }

    private static void cancel(@Nullable ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private void emit(EventPayload payload) {
        synchronized (emitLock) {
            Instant now = Instant.now();
            if (now.isBefore(lastEventTime)) {
                now = lastEventTime;
            }
            lastEventTime = now;
            eventSink.publish(ServerEvent.of(serverId, payload, now));
        }
    }

    @Nullable
    private static Long pidOf(@Nullable ManagedProcess managed) {
        if (managed == null) {
            return null;
        }
        long pid = managed.getPid();
        return pid >= 0 ? pid : null;
    }

    // ==================== Observation ====================

    /**
     * Get a point-in-time view of this server.
     *
     * @return status snapshot
     */
    @Nonnull
    public StatusSnapshot getStatusSnapshot() {
        ServerState currentState;
        ManagedProcess managed;
        int attempts;
        synchronized (stateLock) {
            currentState = state;
            managed = process;
            attempts = crashRestartAttempts;
        }

        List<String> names = new ArrayList<>(players.keySet());
        Collections.sort(names);
        return new StatusSnapshot(
                serverId,
                currentState,
                pidOf(managed),
                managed != null ? managed.getUptime().toSeconds() : 0,
                names.size(),
                names,
                getResources(),
                attempts);
    }

    /**
     * Record sampled resource usage of the current process.
     *
     * @param pid PID the sample was taken from
     * @param cpuPercent CPU usage in percent of one core
     * @param residentMemoryBytes resident set size in bytes
     * @return false if that process is no longer the current one and the sample was dropped
     */
    public boolean updateResources(long pid, double cpuPercent, long residentMemoryBytes) {
        synchronized (stateLock) {
            ManagedProcess managed = process;
            if (managed == null || managed.getPid() != pid) {
                return false;
            }
            this.cpuPercent = cpuPercent;
            this.residentMemoryBytes = residentMemoryBytes;
            this.sampledAt = Instant.now();
            return true;
        }
    }

    @Nonnull
    public ResourceSnapshot getResources() {
        return new ResourceSnapshot(cpuPercent, residentMemoryBytes, ticksPerSecond, sampledAt);
    }

    /**
     * Get the most recent console lines, oldest first.
     *
     * @param lines maximum number of lines
     * @return console lines
     */
    @Nonnull
    public List<String> tailLogs(int lines) {
        return logBuffer.tail(lines);
    }

    /**
     * Replace the definition used by future starts.
     *
     * @param updated new definition; copied
     */
    public void updateDefinition(@Nonnull ServerDefinition updated) {
        if (!serverId.equals(updated.getId())) {
            throw new IllegalArgumentException("Definition " + updated.getId() + " does not belong to " + serverId);
        }
        ServerDefinition copy = updated.copy();
        this.classifier = ConsoleLineClassifier.forKind(copy.getKind(), settings.markersFor(copy.getKind()));
        this.definition = copy;
    }

    // ==================== Getters ====================

    @Nonnull
    public String getServerId() {
        return serverId;
    }

    @Nonnull
    public ServerState getState() {
        return state;
    }

    /**
     * Get a copy of the current definition.
     */
    @Nonnull
    public ServerDefinition getDefinition() {
        return definition.copy();
    }

    /**
     * Get the PID of the live process.
     *
     * @return PID, or null when no process is alive
     */
    @Nullable
    public Long getPid() {
        return pidOf(process);
    }

    @Nonnull
    public Collection<ConnectedPlayer> getConnectedPlayers() {
        return Collections.unmodifiableCollection(players.values());
    }

    public int getCrashRestartAttempts() {
        synchronized (stateLock) {
            return crashRestartAttempts;
        }
    }

    public boolean isDestroyed() {
        synchronized (stateLock) {
            return destroyed;
        }
    }

    public boolean isRestartPending() {
        synchronized (stateLock) {
            return pendingRestart != null;
        }
    }

    @Override
    public String toString() {
        return "ServerInstance{" +
                "serverId='" + serverId + '\'' +
                ", kind=" + definition.getKind() +
                ", state=" + state +
                ", players=" + players.size() +
                '}';
    }
}
