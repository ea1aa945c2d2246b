package me.internalizable.craftkeeper.api.event;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Closed set of event tags emitted by supervised servers. Each kind has
 * exactly one payload type, see {@link #getPayloadType()}.
 */
public enum ServerEventKind {
    STATUS_CHANGED(EventPayload.StatusChanged.class),
    PLAYER_JOIN(EventPayload.PlayerJoined.class),
    PLAYER_LEAVE(EventPayload.PlayerLeft.class),
    CHAT(EventPayload.ChatMessage.class),
    ADVANCEMENT(EventPayload.AdvancementEarned.class),
    DEATH(EventPayload.PlayerDied.class),
    CRASHED(EventPayload.ServerCrashed.class),
    LOG_LINE(EventPayload.LogLine.class);

    private final Class<? extends EventPayload> payloadType;

    ServerEventKind(Class<? extends EventPayload> payloadType) {
        this.payloadType = payloadType;
    }

    @Nonnull
    public Class<? extends EventPayload> getPayloadType() {
        return payloadType;
    }

    /**
     * Get the wire identifier, e.g. {@code "player_join"}.
     *
     * @return lowercase identifier
     */
    @Nonnull
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
