package me.internalizable.craftkeeper.supervisor.bridge;

import me.internalizable.craftkeeper.api.event.EventPayload;
import me.internalizable.craftkeeper.api.event.ServerEvent;
import me.internalizable.craftkeeper.api.event.ServerEventKind;
import me.internalizable.craftkeeper.api.event.ServerEventListener;
import me.internalizable.craftkeeper.api.supervisor.ServerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Forwards in-game chat and notable events of selected servers to an external chat.
 *
 * <p>Servers relay nothing until configured with {@link #configure(String, RelaySettings)}.</p>
 */
public class ChatRelay implements ServerEventListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatRelay.class);

    public static final Set<ServerEventKind> KINDS = EnumSet.of(
            ServerEventKind.CHAT,
            ServerEventKind.PLAYER_JOIN,
            ServerEventKind.PLAYER_LEAVE,
            ServerEventKind.ADVANCEMENT,
            ServerEventKind.DEATH,
            ServerEventKind.STATUS_CHANGED,
            ServerEventKind.CRASHED);

    private final RelaySink sink;
    private final Map<String, RelaySettings> settings = new ConcurrentHashMap<>();

    public ChatRelay(@Nonnull RelaySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Set what a server relays.
     *
     * @param serverId server identifier
     * @param relaySettings relay settings, {@link RelaySettings#none()} disables the server
     */
    public void configure(@Nonnull String serverId, @Nonnull RelaySettings relaySettings) {
        settings.put(Objects.requireNonNull(serverId, "serverId"), Objects.requireNonNull(relaySettings, "relaySettings"));
    }

    public void remove(@Nonnull String serverId) {
        settings.remove(serverId);
    }

    @Override
    public void onEvent(@Nonnull ServerEvent event) {
        RelaySettings relay = settings.getOrDefault(event.serverId(), RelaySettings.none());
        RelayMessage message = format(event, relay);
        if (message == null) {
            return;
        }
        try {
            sink.send(message);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to relay {} from '{}': {}", message.type(), event.serverId(), e.getMessage());
        }
    }

    @Nullable
    RelayMessage format(@Nonnull ServerEvent event, @Nonnull RelaySettings relay) {
        String serverId = event.serverId();
        EventPayload payload = event.payload();

        if (payload instanceof EventPayload.ChatMessage chat && relay.chat()) {
            return new RelayMessage(serverId, RelayMessage.Type.CHAT, chat.sender(), chat.message(), event.timestamp());
        }
        if (relay.playerEvents()) {
            if (payload instanceof EventPayload.PlayerJoined join) {
                return notice(event, RelayMessage.Type.JOIN, "**" + join.name() + "** joined the server");
            }
            if (payload instanceof EventPayload.PlayerLeft leave) {
                return notice(event, RelayMessage.Type.LEAVE, "**" + leave.name() + "** left the server");
            }
            if (payload instanceof EventPayload.AdvancementEarned advancement) {
                return notice(event, RelayMessage.Type.ADVANCEMENT,
                        "**" + advancement.player() + "** has made the advancement **" + advancement.advancement() + "**");
            }
            if (payload instanceof EventPayload.PlayerDied death) {
                return notice(event, RelayMessage.Type.DEATH, death.message());
            }
        }
        if (relay.status()) {
            if (payload instanceof EventPayload.StatusChanged change) {
                if (change.current() == ServerState.RUNNING) {
                    return notice(event, RelayMessage.Type.STATUS, "Server is online");
                }
                if (change.current() == ServerState.STOPPED) {
                    return notice(event, RelayMessage.Type.STATUS, "Server is offline");
                }
            }
            if (payload instanceof EventPayload.ServerCrashed crash) {
                return notice(event, RelayMessage.Type.STATUS, "Server crashed: " + crash.reason()
                        + (crash.restartScheduled() ? " (restarting)" : ""));
            }
        }
        return null;
    }

    private static RelayMessage notice(ServerEvent event, RelayMessage.Type type, String content) {
        return new RelayMessage(event.serverId(), type, null, content, event.timestamp());
    }
}
