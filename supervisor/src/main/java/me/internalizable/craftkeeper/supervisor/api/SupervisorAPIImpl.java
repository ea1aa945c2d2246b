package me.internalizable.craftkeeper.supervisor.api;

import me.internalizable.craftkeeper.api.event.EventSubscription;
import me.internalizable.craftkeeper.api.event.ServerEventKind;
import me.internalizable.craftkeeper.api.event.ServerEventListener;
import me.internalizable.craftkeeper.api.supervisor.ServerOperationException;
import me.internalizable.craftkeeper.api.supervisor.ServerState;
import me.internalizable.craftkeeper.api.supervisor.StatusSnapshot;
import me.internalizable.craftkeeper.api.supervisor.SupervisorAPI;
import me.internalizable.craftkeeper.supervisor.ServerSupervisor;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;

/**
 * Implementation of {@link SupervisorAPI} that wraps the internal {@link ServerSupervisor}.
 */
public class SupervisorAPIImpl implements SupervisorAPI {

    private final ServerSupervisor supervisor;

    public SupervisorAPIImpl(@Nonnull ServerSupervisor supervisor) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    }

    @Override
    @Nonnull
    public CompletableFuture<String> createServer(@Nonnull CreateOptions options) {
        Objects.requireNonNull(options, "options");
        try {
            return CompletableFuture.completedFuture(supervisor.createServer(options).getId());
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new ServerOperationException(options.getName(),
                    "Failed to create server '" + options.getName() + "': " + e.getMessage(), e));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    @Nonnull
    public CompletableFuture<Void> deleteServer(@Nonnull String serverId, boolean purgeFiles) {
        return supervisor.deleteServer(serverId, purgeFiles);
    }

    @Override
    @Nonnull
    public Set<String> getServerIds() {
        return new TreeSet<>(supervisor.getRegistry().getServerIds());
    }

    @Override
    @Nonnull
    public CompletableFuture<ServerState> startServer(@Nonnull String serverId) {
        return supervisor.startServer(serverId);
    }

    @Override
    @Nonnull
    public CompletableFuture<Void> stopServer(@Nonnull String serverId) {
        return supervisor.stopServer(serverId);
    }

    @Override
    @Nonnull
    public CompletableFuture<ServerState> restartServer(@Nonnull String serverId) {
        return supervisor.restartServer(serverId);
    }

    @Override
    @Nonnull
    public CompletableFuture<Void> killServer(@Nonnull String serverId) {
        return supervisor.killServer(serverId);
    }

    @Override
    public void sendCommand(@Nonnull String serverId, @Nonnull String command) {
        supervisor.sendCommand(serverId, command);
    }

    @Override
    @Nonnull
    public List<String> tailLogs(@Nonnull String serverId, int lines) {
        return supervisor.tailLogs(serverId, lines);
    }

    @Override
    @Nonnull
    public StatusSnapshot getStatus(@Nonnull String serverId) {
        return supervisor.getStatus(serverId);
    }

    @Override
    @Nonnull
    public Map<String, StatusSnapshot> getAllStatuses() {
        return supervisor.getAllStatuses();
    }

    @Override
    @Nonnull
    public EventSubscription subscribe(@Nonnull String name, @Nonnull Set<ServerEventKind> kinds,
                                       @Nonnull ServerEventListener listener) {
        return supervisor.subscribe(name, kinds, listener);
    }
}
