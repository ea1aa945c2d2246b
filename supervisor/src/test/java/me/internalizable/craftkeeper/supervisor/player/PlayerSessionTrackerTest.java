package me.internalizable.craftkeeper.supervisor.player;

import me.internalizable.craftkeeper.api.event.EventPayload;
import me.internalizable.craftkeeper.api.event.ServerEvent;
import me.internalizable.craftkeeper.api.supervisor.ServerState;
import me.internalizable.craftkeeper.supervisor.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class PlayerSessionTrackerTest {

    private static final String UUID = "069a79f4-44e9-4726-a5be-fca90e38aaf5";

    private MutableClock clock;
    private PlayerSessionTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        tracker = new PlayerSessionTracker(clock);
    }

    private void deliver(String serverId, EventPayload payload) {
        tracker.onEvent(ServerEvent.of(serverId, payload, clock.instant()));
    }

    @Test
    void accumulatesPlayTimeAcrossSessions() {
        deliver("lobby", new EventPayload.PlayerJoined("Notch", UUID, 1));
        clock.advance(Duration.ofMinutes(30));
        deliver("lobby", new EventPayload.PlayerLeft("Notch", 0));

        clock.advance(Duration.ofHours(2));
        deliver("survival", new EventPayload.PlayerJoined("Notch", UUID, 1));
        clock.advance(Duration.ofMinutes(15));
        deliver("survival", new EventPayload.PlayerLeft("Notch", 0));

        PlayerRecord record = tracker.find(UUID).orElseThrow();
        assertThat(record.playTime()).isEqualTo(Duration.ofMinutes(45));
        assertThat(record.isOnline()).isFalse();
        assertThat(record.firstSeen()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(record.lastSeen()).isEqualTo(Instant.parse("2024-05-01T12:45:00Z"));
    }

    @Test
    void findsPlayersByNameIgnoringCase() {
        deliver("lobby", new EventPayload.PlayerJoined("Notch", UUID, 1));
        deliver("lobby", new EventPayload.PlayerJoined("jeb_", null, 2));

        assertThat(tracker.find("notch")).get().extracting(PlayerRecord::uuid).isEqualTo(UUID);
        assertThat(tracker.find("jeb_")).get().extracting(PlayerRecord::key).isEqualTo("jeb_");
        assertThat(tracker.find("Dinnerbone")).isEmpty();
    }

    @Test
    void listsOnlinePlayersPerServerSortedByName() {
        deliver("lobby", new EventPayload.PlayerJoined("Steve", null, 1));
        deliver("lobby", new EventPayload.PlayerJoined("Alex", null, 2));
        deliver("survival", new EventPayload.PlayerJoined("Herobrine", null, 1));

        assertThat(tracker.getOnlinePlayers("lobby"))
                .extracting(PlayerRecord::name)
                .containsExactly("Alex", "Steve");
        assertThat(tracker.getOnlinePlayers("survival"))
                .extracting(PlayerRecord::name)
                .containsExactly("Herobrine");
        assertThat(tracker.getAllPlayers()).hasSize(3);
    }

    @Test
    void stoppingServerClosesItsSessions() {
        deliver("lobby", new EventPayload.PlayerJoined("Steve", null, 1));
        deliver("survival", new EventPayload.PlayerJoined("Alex", null, 1));
        clock.advance(Duration.ofMinutes(10));

        deliver("lobby", new EventPayload.StatusChanged(ServerState.STOPPING, ServerState.STOPPED, null, null));

        PlayerRecord steve = tracker.find("Steve").orElseThrow();
        assertThat(steve.isOnline()).isFalse();
        assertThat(steve.playTime()).isEqualTo(Duration.ofMinutes(10));
        assertThat(tracker.find("Alex").orElseThrow().isOnline()).isTrue();
    }

    @Test
    void crashClosesSessionsToo() {
        deliver("lobby", new EventPayload.PlayerJoined("Steve", null, 1));
        clock.advance(Duration.ofMinutes(3));

        deliver("lobby", new EventPayload.StatusChanged(ServerState.RUNNING, ServerState.CRASHED, null, "exit code 1"));

        assertThat(tracker.getOnlinePlayers("lobby")).isEmpty();
        assertThat(tracker.find("Steve").orElseThrow().playTime()).isEqualTo(Duration.ofMinutes(3));
    }

    @Test
    void switchingServersClosesPreviousSession() {
        deliver("lobby", new EventPayload.PlayerJoined("Notch", UUID, 1));
        clock.advance(Duration.ofMinutes(5));
        deliver("survival", new EventPayload.PlayerJoined("Notch", UUID, 1));

        PlayerRecord record = tracker.find(UUID).orElseThrow();
        assertThat(record.serverId()).isEqualTo("survival");
        assertThat(record.playTime()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void leaveWithoutJoinIsIgnored() {
        deliver("lobby", new EventPayload.PlayerLeft("Ghost", 0));

        assertThat(tracker.getAllPlayers()).isEmpty();
    }
}
