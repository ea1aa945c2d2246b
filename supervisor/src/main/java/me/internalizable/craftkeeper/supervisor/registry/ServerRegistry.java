package me.internalizable.craftkeeper.supervisor.registry;

import me.internalizable.craftkeeper.api.supervisor.ServerKind;
import me.internalizable.craftkeeper.api.supervisor.ServerState;
import me.internalizable.craftkeeper.supervisor.instance.ServerInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory index of all supervised server instances.
 */
public class ServerRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServerRegistry.class);

    private final Map<String, ServerInstance> servers = new ConcurrentHashMap<>();

    /**
     * Register a server instance.
     *
     * @param instance the server instance
     * @throws IllegalStateException if the server id is already registered
     */
    public void register(@Nonnull ServerInstance instance) {
        Objects.requireNonNull(instance, "instance");

        ServerInstance existing = servers.putIfAbsent(instance.getServerId(), instance);
        if (existing != null) {
            throw new IllegalStateException("Server already registered: " + instance.getServerId());
        }
        LOGGER.debug("Registered server: {}", instance.getServerId());
    }

    /**
     * Unregister a server instance.
     *
     * @param serverId server identifier
     * @return the removed instance, or null if not found
     */
    @Nullable
    public ServerInstance unregister(@Nonnull String serverId) {
        Objects.requireNonNull(serverId, "serverId");

        ServerInstance instance = servers.remove(serverId);
        if (instance != null) {
            LOGGER.debug("Unregistered server: {}", serverId);
        }
        return instance;
    }

    @Nullable
    public ServerInstance getServer(@Nonnull String serverId) {
        Objects.requireNonNull(serverId, "serverId");
        return servers.get(serverId);
    }

    public boolean hasServer(@Nonnull String serverId) {
        return servers.containsKey(serverId);
    }

    @Nonnull
    public Collection<ServerInstance> getAllServers() {
        return Collections.unmodifiableCollection(servers.values());
    }

    @Nonnull
    public Set<String> getServerIds() {
        return Collections.unmodifiableSet(servers.keySet());
    }

    /**
     * Get servers in any of the given states.
     *
     * @param states state filter
     * @return list of matching servers
     */
    @Nonnull
    public List<ServerInstance> getServersByState(@Nonnull ServerState... states) {
        Set<ServerState> wanted = Set.of(states);
        return getServers(s -> wanted.contains(s.getState()));
    }

    @Nonnull
    public List<ServerInstance> getServersByKind(@Nonnull ServerKind kind) {
        Objects.requireNonNull(kind, "kind");
        return getServers(s -> s.getDefinition().getKind() == kind);
    }

    /**
     * Get servers matching a predicate.
     *
     * @param predicate filter predicate
     * @return list of matching servers
     */
    @Nonnull
    public List<ServerInstance> getServers(@Nonnull Predicate<ServerInstance> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return servers.values().stream()
                .filter(predicate)
                .collect(Collectors.toList());
    }

    public int size() {
        return servers.size();
    }

    public void clear() {
        servers.clear();
    }

    /**
     * Get registry statistics.
     *
     * @return current counts
     */
    @Nonnull
    public RegistryStats getStats() {
        int running = 0;
        int crashed = 0;
        int players = 0;
        for (ServerInstance instance : servers.values()) {
            ServerState state = instance.getState();
            if (state == ServerState.RUNNING || state == ServerState.STARTING) {
                running++;
            } else if (state == ServerState.CRASHED) {
                crashed++;
            }
            players += instance.getConnectedPlayers().size();
        }
        return new RegistryStats(servers.size(), running, crashed, players);
    }

    /**
     * Registry statistics.
     *
     * @param totalServers registered servers
     * @param activeServers starting or running servers
     * @param crashedServers crashed servers
     * @param totalPlayers connected players across all servers
     */
    public record RegistryStats(
            int totalServers,
            int activeServers,
            int crashedServers,
            int totalPlayers
    ) {}
}
