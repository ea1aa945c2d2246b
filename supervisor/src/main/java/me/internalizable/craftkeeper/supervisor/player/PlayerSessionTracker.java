package me.internalizable.craftkeeper.supervisor.player;

import me.internalizable.craftkeeper.api.event.EventPayload;
import me.internalizable.craftkeeper.api.event.ServerEvent;
import me.internalizable.craftkeeper.api.event.ServerEventKind;
import me.internalizable.craftkeeper.api.event.ServerEventListener;
import me.internalizable.craftkeeper.api.supervisor.ServerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records who played where and for how long, from join and leave events.
 *
 * <p>Players are keyed by UUID when the server announced one and by name
 * otherwise. When a server stops or crashes every open session on it is
 * closed.</p>
 */
public class PlayerSessionTracker implements ServerEventListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlayerSessionTracker.class);

    /**
     * Event kinds this tracker needs.
     */
    public static final Set<ServerEventKind> KINDS = EnumSet.of(
            ServerEventKind.PLAYER_JOIN, ServerEventKind.PLAYER_LEAVE, ServerEventKind.STATUS_CHANGED);

    private final Clock clock;
    private final Map<String, PlayerRecord> records = new ConcurrentHashMap<>();
    private final Map<String, String> openSessions = new ConcurrentHashMap<>();

    public PlayerSessionTracker() {
        this(Clock.systemUTC());
    }

    public PlayerSessionTracker(@Nonnull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void onEvent(@Nonnull ServerEvent event) {
        switch (event.kind()) {
            case PLAYER_JOIN -> onJoin(event.serverId(), event.payload(EventPayload.PlayerJoined.class));
            case PLAYER_LEAVE -> onLeave(event.serverId(), event.payload(EventPayload.PlayerLeft.class).name());
            case STATUS_CHANGED -> {
                ServerState current = event.payload(EventPayload.StatusChanged.class).current();
                if (current == ServerState.STOPPED || current == ServerState.CRASHED) {
                    closeSessions(event.serverId());
                }
            }
            default -> {
            }
        }
    }

    private void onJoin(String serverId, EventPayload.PlayerJoined join) {
        Instant now = clock.instant();
        String key = join.uuid() != null ? join.uuid() : join.name();
        records.compute(key, (k, existing) -> existing == null
                ? new PlayerRecord(k, join.name(), join.uuid(), now, now, Duration.ZERO, serverId, now)
                : existing.join(serverId, join.uuid(), now));
        openSessions.put(sessionKey(serverId, join.name()), key);
        LOGGER.debug("Player {} joined '{}'", join.name(), serverId);
    }

    private void onLeave(String serverId, String name) {
        String key = openSessions.remove(sessionKey(serverId, name));
        if (key == null) {
            LOGGER.debug("Leave of {} from '{}' without a tracked session", name, serverId);
            return;
        }
        Instant now = clock.instant();
        records.computeIfPresent(key, (k, existing) -> existing.leave(now));
    }

    private void closeSessions(String serverId) {
        String prefix = serverId + ":";
        List<String> sessions = new ArrayList<>();
        for (String session : openSessions.keySet()) {
            if (session.startsWith(prefix)) {
                sessions.add(session);
            }
        }
        Instant now = clock.instant();
        for (String session : sessions) {
            String key = openSessions.remove(session);
            if (key != null) {
                records.computeIfPresent(key, (k, existing) -> existing.leave(now));
            }
        }
        if (!sessions.isEmpty()) {
            LOGGER.debug("Closed {} session(s) on '{}'", sessions.size(), serverId);
        }
    }

    /**
     * Find a player by UUID or name.
     *
     * @param nameOrUuid UUID or player name
     * @return the record, if the player was ever seen
     */
    @Nonnull
    public Optional<PlayerRecord> find(@Nonnull String nameOrUuid) {
        PlayerRecord direct = records.get(nameOrUuid);
        if (direct != null) {
            return Optional.of(direct);
        }
        return records.values().stream()
                .filter(r -> r.name().equalsIgnoreCase(nameOrUuid))
                .findFirst();
    }

    /**
     * Get players currently online on a server.
     *
     * @param serverId server identifier
     * @return online players sorted by name
     */
    @Nonnull
    public List<PlayerRecord> getOnlinePlayers(@Nonnull String serverId) {
        List<PlayerRecord> online = new ArrayList<>();
        for (PlayerRecord record : records.values()) {
            if (serverId.equals(record.serverId())) {
                online.add(record);
            }
        }
        online.sort(Comparator.comparing(PlayerRecord::name));
        return online;
    }

    @Nonnull
    public Collection<PlayerRecord> getAllPlayers() {
        return List.copyOf(records.values());
    }

    private static String sessionKey(String serverId, String name) {
        return serverId + ":" + name;
    }
}
