package me.internalizable.craftkeeper.supervisor.console;

import javax.annotation.Nonnull;

/**
 * Semantic meaning recognised in a console line.
 */
public interface ConsoleMatch {

    /**
     * The server finished starting up.
     */
    record Ready() implements ConsoleMatch {
    }

    /**
     * Announcement of a player's UUID, printed shortly before the join.
     */
    record PlayerUuid(@Nonnull String name, @Nonnull String uuid) implements ConsoleMatch {
    }

    record PlayerJoin(@Nonnull String name) implements ConsoleMatch {
    }

    record PlayerLeave(@Nonnull String name) implements ConsoleMatch {
    }

    record Chat(@Nonnull String sender, @Nonnull String message) implements ConsoleMatch {
    }

    record Advancement(@Nonnull String player, @Nonnull String advancement) implements ConsoleMatch {
    }

    /**
     * @param player player who died
     * @param message full death message
     */
    record Death(@Nonnull String player, @Nonnull String message) implements ConsoleMatch {
    }

    /**
     * A ticks-per-second report, e.g. the output of Paper's {@code tps} command.
     *
     * @param ticksPerSecond most recent (1 minute) average
     */
    record TickRate(double ticksPerSecond) implements ConsoleMatch {
    }

    /**
     * The banner that opens a crash report.
     */
    record CrashReport() implements ConsoleMatch {
    }
}
