package me.internalizable.craftkeeper.api.supervisor;

import me.internalizable.craftkeeper.api.event.EventSubscription;
import me.internalizable.craftkeeper.api.event.ServerEventKind;
import me.internalizable.craftkeeper.api.event.ServerEventListener;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Control and observation surface of the server supervisor.
 *
 * <p>Futures returned by this interface complete exceptionally with
 * {@link ServerNotFoundException} for unknown ids and with a
 * {@link ServerOperationException} subtype when the server rejects or fails
 * the operation.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * SupervisorAPI api = ...;
 *
 * api.createServer(CreateOptions.builder()
 *         .name("survival")
 *         .kind(ServerKind.PAPER)
 *         .jarFile("paper.jar")
 *         .maxRamMb(6144)
 *         .build())
 *     .thenCompose(api::startServer)
 *     .thenAccept(state -> System.out.println("Server settled in " + state));
 *
 * try (EventSubscription sub = api.subscribe("chat-log", EnumSet.of(ServerEventKind.CHAT),
 *         event -> System.out.println(event))) {
 *     ...
 * }
 * }</pre>
 */
public interface SupervisorAPI {

    // ==================== Definitions ====================

    /**
     * Provision a new server definition and its working directory.
     *
     * @param options creation options
     * @return future completing with the generated server id
     */
    @Nonnull
    CompletableFuture<String> createServer(@Nonnull CreateOptions options);

    /**
     * Stop (if needed) and remove a server.
     *
     * @param serverId server identifier
     * @param purgeFiles also delete the working directory
     * @return future completing when the server is gone
     */
    @Nonnull
    CompletableFuture<Void> deleteServer(@Nonnull String serverId, boolean purgeFiles);

    /**
     * Get the ids of all known servers.
     *
     * @return server ids
     */
    @Nonnull
    Set<String> getServerIds();

    // ==================== Lifecycle ====================

    /**
     * Start a stopped or crashed server.
     *
     * @param serverId server identifier
     * @return future completing with the state the start settled in
     */
    @Nonnull
    CompletableFuture<ServerState> startServer(@Nonnull String serverId);

    /**
     * Gracefully stop a starting or running server, escalating to a kill on timeout.
     *
     * @param serverId server identifier
     * @return future completing once the server is stopped
     */
    @Nonnull
    CompletableFuture<Void> stopServer(@Nonnull String serverId);

    /**
     * Stop (when running) and start a server again.
     *
     * @param serverId server identifier
     * @return future completing with the state the new start settled in
     */
    @Nonnull
    CompletableFuture<ServerState> restartServer(@Nonnull String serverId);

    /**
     * Forcibly terminate a server and cancel any pending automatic restart.
     *
     * @param serverId server identifier
     * @return future completing once the server is stopped
     */
    @Nonnull
    CompletableFuture<Void> killServer(@Nonnull String serverId);

    /**
     * Write one line of console input to a server.
     *
     * @param serverId server identifier
     * @param command console command without trailing newline
     * @throws ServerNotFoundException if the server is unknown
     * @throws NoRunningProcessException if the server has no live process
     */
    void sendCommand(@Nonnull String serverId, @Nonnull String command);

    // ==================== Observation ====================

    /**
     * Get the most recent console lines of a server, oldest first.
     *
     * @param serverId server identifier
     * @param lines maximum number of lines
     * @return console lines
     */
    @Nonnull
    List<String> tailLogs(@Nonnull String serverId, int lines);

    /**
     * Get the current status of a server.
     *
     * @param serverId server identifier
     * @return status snapshot
     * @throws ServerNotFoundException if the server is unknown
     */
    @Nonnull
    StatusSnapshot getStatus(@Nonnull String serverId);

    /**
     * Get the current status of every server.
     *
     * @return snapshots keyed by server id
     */
    @Nonnull
    Map<String, StatusSnapshot> getAllStatuses();

    /**
     * Subscribe to events of the given kinds from all servers.
     *
     * @param name subscriber name, used for its dispatcher thread and logs
     * @param kinds event kinds to receive
     * @param listener event callback
     * @return subscription handle; close it to unsubscribe
     */
    @Nonnull
    EventSubscription subscribe(@Nonnull String name, @Nonnull Set<ServerEventKind> kinds,
                                @Nonnull ServerEventListener listener);

    /**
     * Subscribe to every event from all servers.
     *
     * @param name subscriber name
     * @param listener event callback
     * @return subscription handle
     */
    @Nonnull
    default EventSubscription subscribe(@Nonnull String name, @Nonnull ServerEventListener listener) {
        return subscribe(name, EnumSet.allOf(ServerEventKind.class), listener);
    }

    /**
     * Options for provisioning a server.
     *
     * <p>Numeric values of {@code -1} and null strings fall back to the
     * supervisor's configured defaults.</p>
     */
    interface CreateOptions {
        @Nonnull
        String getName();

        @Nonnull
        ServerKind getKind();

        @Nullable
        String getVersion();

        /**
         * Get the server jar, relative to the working directory.
         */
        @Nonnull
        String getJarFile();

        @Nullable
        String getJavaPath();

        int getMinRamMb();

        int getMaxRamMb();

        @Nonnull
        List<String> getJvmFlags();

        int getPort();

        int getMaxPlayers();

        boolean isAutoStart();

        boolean isAutoRestart();

        @Nonnull
        Map<String, String> getEnvironment();

        /**
         * Create a builder for creation options.
         */
        @Nonnull
        static Builder builder() {
            return new CreateOptionsBuilder();
        }

        /**
         * Builder for creation options.
         */
        interface Builder {
            Builder name(@Nonnull String name);
            Builder kind(@Nonnull ServerKind kind);
            Builder version(@Nullable String version);
            Builder jarFile(@Nonnull String jarFile);
            Builder javaPath(@Nullable String javaPath);
            Builder minRamMb(int minRamMb);
            Builder maxRamMb(int maxRamMb);
            Builder jvmFlag(@Nonnull String flag);
            Builder port(int port);
            Builder maxPlayers(int maxPlayers);
            Builder autoStart(boolean autoStart);
            Builder autoRestart(boolean autoRestart);
            Builder environment(@Nonnull String key, @Nonnull String value);
            CreateOptions build();
        }
    }
}
