package me.internalizable.craftkeeper.supervisor.bridge;

import me.internalizable.craftkeeper.api.event.EventPayload;
import me.internalizable.craftkeeper.api.event.ServerEvent;
import me.internalizable.craftkeeper.api.supervisor.ServerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ChatRelayTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final List<RelayMessage> sent = new ArrayList<>();
    private ChatRelay relay;

    @BeforeEach
    void setUp() {
        relay = new ChatRelay(sent::add);
    }

    private static ServerEvent event(EventPayload payload) {
        return ServerEvent.of("survival", payload, NOW);
    }

    @Test
    void unconfiguredServerRelaysNothing() {
        relay.onEvent(event(new EventPayload.ChatMessage("Steve", "hello")));

        assertThat(sent).isEmpty();
    }

    @Test
    void relaysChatWithAuthor() {
        relay.configure("survival", RelaySettings.all());

        relay.onEvent(event(new EventPayload.ChatMessage("Steve", "hello there")));

        assertThat(sent).containsExactly(
                new RelayMessage("survival", RelayMessage.Type.CHAT, "Steve", "hello there", NOW));
    }

    @Test
    void formatsPlayerEvents() {
        RelaySettings settings = RelaySettings.all();

        assertThat(relay.format(event(new EventPayload.PlayerJoined("Alex", null, 1)), settings).content())
                .isEqualTo("**Alex** joined the server");
        assertThat(relay.format(event(new EventPayload.PlayerLeft("Alex", 0)), settings).content())
                .isEqualTo("**Alex** left the server");
        assertThat(relay.format(event(new EventPayload.AdvancementEarned("Alex", "Stone Age")), settings).content())
                .isEqualTo("**Alex** has made the advancement **Stone Age**");

        RelayMessage death = relay.format(event(new EventPayload.PlayerDied("Alex", "Alex fell from a high place")), settings);
        assertThat(death.type()).isEqualTo(RelayMessage.Type.DEATH);
        assertThat(death.author()).isNull();
        assertThat(death.content()).isEqualTo("Alex fell from a high place");
    }

    @Test
    void formatsStatusChanges() {
        RelaySettings settings = new RelaySettings(false, false, true);

        assertThat(relay.format(event(new EventPayload.StatusChanged(
                ServerState.STARTING, ServerState.RUNNING, 42L, null)), settings).content())
                .isEqualTo("Server is online");
        assertThat(relay.format(event(new EventPayload.StatusChanged(
                ServerState.STOPPING, ServerState.STOPPED, null, null)), settings).content())
                .isEqualTo("Server is offline");
        assertThat(relay.format(event(new EventPayload.StatusChanged(
                ServerState.STOPPED, ServerState.STARTING, 42L, null)), settings))
                .isNull();
        assertThat(relay.format(event(new EventPayload.ServerCrashed("exit code 1", 1, true, true)), settings).content())
                .isEqualTo("Server crashed: exit code 1 (restarting)");
    }

    @Test
    void respectsDisabledCategories() {
        RelaySettings chatOnly = new RelaySettings(true, false, false);

        assertThat(relay.format(event(new EventPayload.PlayerJoined("Alex", null, 1)), chatOnly)).isNull();
        assertThat(relay.format(event(new EventPayload.ServerCrashed("boom", 1, false, false)), chatOnly)).isNull();
        assertThat(relay.format(event(new EventPayload.ChatMessage("Alex", "hi")), chatOnly)).isNotNull();
    }

    @Test
    void removedServerStopsRelaying() {
        relay.configure("survival", RelaySettings.all());
        relay.remove("survival");

        relay.onEvent(event(new EventPayload.ChatMessage("Steve", "hello")));

        assertThat(sent).isEmpty();
    }

    @Test
    void failingSinkIsLoggedNotThrown() {
        ChatRelay failing = new ChatRelay(message -> {
            throw new IllegalStateException("webhook down");
        });
        failing.configure("survival", RelaySettings.all());

        assertThatCode(() -> failing.onEvent(event(new EventPayload.ChatMessage("Steve", "hi"))))
                .doesNotThrowAnyException();
    }
}
