package me.internalizable.craftkeeper.api.event;

import me.internalizable.craftkeeper.api.supervisor.ServerState;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Payload carried by a {@link ServerEvent}. One record per {@link ServerEventKind}.
 */
public interface EventPayload {

    /**
     * Get the event kind this payload belongs to.
     *
     * @return event kind
     */
    @Nonnull
    ServerEventKind kind();

    /**
     * A lifecycle transition.
     *
     * @param previous state before the transition
     * @param current state after the transition
     * @param pid process id in the new state, or null when no process is alive
     * @param reason short human readable cause, or null
     */
    record StatusChanged(
            @Nonnull ServerState previous,
            @Nonnull ServerState current,
            @Nullable Long pid,
            @Nullable String reason
    ) implements EventPayload {

        public StatusChanged {
            Objects.requireNonNull(previous, "previous");
            Objects.requireNonNull(current, "current");
        }

        @Override
        @Nonnull
        public ServerEventKind kind() {
            return ServerEventKind.STATUS_CHANGED;
        }
    }

    /**
     * @param name player name
     * @param uuid player UUID if the server announced it, otherwise null
     * @param playerCount connected players after the join
     */
    record PlayerJoined(@Nonnull String name, @Nullable String uuid, int playerCount) implements EventPayload {

        @Override
        @Nonnull
        public ServerEventKind kind() {
            return ServerEventKind.PLAYER_JOIN;
        }
    }

    record PlayerLeft(@Nonnull String name, int playerCount) implements EventPayload {

        @Override
        @Nonnull
        public ServerEventKind kind() {
            return ServerEventKind.PLAYER_LEAVE;
        }
    }

    record ChatMessage(@Nonnull String sender, @Nonnull String message) implements EventPayload {

        @Override
        @Nonnull
        public ServerEventKind kind() {
            return ServerEventKind.CHAT;
        }
    }

    record AdvancementEarned(@Nonnull String player, @Nonnull String advancement) implements EventPayload {

        @Override
        @Nonnull
        public ServerEventKind kind() {
            return ServerEventKind.ADVANCEMENT;
        }
    }

    /**
     * @param player player who died
     * @param message full death message as printed by the server
     */
    record PlayerDied(@Nonnull String player, @Nonnull String message) implements EventPayload {

        @Override
        @Nonnull
        public ServerEventKind kind() {
            return ServerEventKind.DEATH;
        }
    }

    /**
     * An unexpected exit or a failed spawn.
     *
     * @param reason short description of the failure
     * @param exitCode process exit code, or null if the process never started
     * @param crashReportDetected whether a crash report banner appeared in the console
     * @param restartScheduled whether an automatic restart has been scheduled
     */
    record ServerCrashed(
            @Nonnull String reason,
            @Nullable Integer exitCode,
            boolean crashReportDetected,
            boolean restartScheduled
    ) implements EventPayload {

        @Override
        @Nonnull
        public ServerEventKind kind() {
            return ServerEventKind.CRASHED;
        }
    }

    record LogLine(@Nonnull String line) implements EventPayload {

        @Override
        @Nonnull
        public ServerEventKind kind() {
            return ServerEventKind.LOG_LINE;
        }
    }
}
