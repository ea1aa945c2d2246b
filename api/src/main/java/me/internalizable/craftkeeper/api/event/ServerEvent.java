package me.internalizable.craftkeeper.api.event;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.Objects;

/**
 * An observation about one supervised server.
 *
 * @param serverId id of the server that produced the event
 * @param kind event tag, always equal to {@code payload.kind()}
 * @param payload kind specific data
 * @param timestamp when the event was produced; non-decreasing per server
 */
public record ServerEvent(
        @Nonnull String serverId,
        @Nonnull ServerEventKind kind,
        @Nonnull EventPayload payload,
        @Nonnull Instant timestamp
) {

    public ServerEvent {
        Objects.requireNonNull(serverId, "serverId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(timestamp, "timestamp");
        if (payload.kind() != kind) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getSimpleName()
                    + " does not belong to event kind " + kind);
        }
    }

    /**
     * Create an event whose kind is taken from the payload.
     */
    @Nonnull
    public static ServerEvent of(@Nonnull String serverId, @Nonnull EventPayload payload, @Nonnull Instant timestamp) {
        return new ServerEvent(serverId, payload.kind(), payload, timestamp);
    }

    /**
     * Get the payload as its concrete type.
     *
     * @param type expected payload type
     * @param <T> payload type
     * @return the payload
     * @throws ClassCastException if the payload has a different type
     */
    @Nonnull
    public <T extends EventPayload> T payload(@Nonnull Class<T> type) {
        return type.cast(payload);
    }
}
