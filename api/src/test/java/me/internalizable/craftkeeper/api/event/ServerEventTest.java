package me.internalizable.craftkeeper.api.event;

import me.internalizable.craftkeeper.api.supervisor.ServerState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerEventTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void kindIsTakenFromPayload() {
        ServerEvent event = ServerEvent.of("lobby", new EventPayload.ChatMessage("Steve", "hi"), NOW);

        assertThat(event.kind()).isEqualTo(ServerEventKind.CHAT);
        assertThat(event.payload(EventPayload.ChatMessage.class).sender()).isEqualTo("Steve");
    }

    @Test
    void mismatchedKindIsRejected() {
        assertThatThrownBy(() -> new ServerEvent("lobby", ServerEventKind.CRASHED,
                new EventPayload.LogLine("hello"), NOW))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("LogLine");
    }

    @Test
    void wrongPayloadTypeFailsCast() {
        ServerEvent event = ServerEvent.of("lobby", new EventPayload.PlayerLeft("Steve", 0), NOW);

        assertThatThrownBy(() -> event.payload(EventPayload.PlayerJoined.class))
                .isInstanceOf(ClassCastException.class);
    }

    @Test
    void everyKindDeclaresItsPayload() {
        assertThat(ServerEventKind.STATUS_CHANGED.getPayloadType()).isEqualTo(EventPayload.StatusChanged.class);
        assertThat(ServerEventKind.PLAYER_JOIN.getId()).isEqualTo("player_join");
        assertThat(new EventPayload.StatusChanged(ServerState.STOPPED, ServerState.STARTING, 7L, null).kind())
                .isEqualTo(ServerEventKind.STATUS_CHANGED);
    }
}
