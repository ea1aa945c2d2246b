package me.internalizable.craftkeeper.supervisor.console;

import me.internalizable.craftkeeper.api.supervisor.ServerKind;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises server events in raw console lines.
 *
 * <p>Vendor prefixes (timestamps, thread and level tags, logger names) are
 * stripped first; the remaining message is tested against an ordered rule
 * table and the first matching rule wins. Instances are immutable and safe to
 * share between threads.</p>
 */
public final class ConsoleLineClassifier {

    /**
     * Leading bracket groups such as {@code [12:00:00] [Server thread/INFO]:}
     * or {@code [STDERR] }, optionally after a bare BungeeCord timestamp.
     */
    private static final Pattern PREFIX = Pattern.compile("^(?:\\d{2}:\\d{2}:\\d{2}\\s+)?(?:\\[[^\\]]*]\\s*)+:?\\s*");

    private static final Pattern GAME_READY = Pattern.compile("^Done \\([\\d.,]+s\\)!");
    private static final Pattern BUNGEE_READY = Pattern.compile("^Listening on /");

    private static final Pattern PLAYER_UUID = Pattern.compile("^UUID of player (\\w+) is ([0-9a-fA-F-]{32,36})");
    private static final Pattern PLAYER_JOIN = Pattern.compile("^(\\w+) joined the game");
    private static final Pattern PLAYER_LEAVE = Pattern.compile("^(\\w+) left the game");
    private static final Pattern CHAT = Pattern.compile("^(?:\\[Not Secure] )?<(\\w+)> (.*)$");
    private static final Pattern ADVANCEMENT = Pattern.compile(
            "^(\\w+) has (?:made the advancement|completed the challenge|reached the goal) \\[(.+)]");
    private static final Pattern PAPER_TPS = Pattern.compile("TPS from last 1m, 5m, 15m: \\D*([\\d.]+)");
    private static final Pattern GENERIC_TPS = Pattern.compile("TPS from last \\d+\\w?: \\D*([\\d.]+)");
    private static final Pattern CRASH_REPORT = Pattern.compile("---- Minecraft Crash Report ----|crash report has been saved to");
    private static final Pattern DEATH = Pattern.compile(
            "^(\\w+) (?:was |fell |drowned|burned|starved|suffocated|hit the ground|went up in flames"
                    + "|blew up|tried to swim|experienced kinetic energy|walked into|froze to death"
                    + "|withered away|discovered the floor was lava|died).*$");

    private final List<Rule> rules;

    private ConsoleLineClassifier(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Create a classifier for a server kind.
     *
     * @param kind server kind, selects the built-in readiness marker
     * @param extraReadinessMarkers additional readiness regular expressions, matched anywhere in the message
     * @return classifier
     */
    @Nonnull
    public static ConsoleLineClassifier forKind(@Nonnull ServerKind kind,
                                                @Nonnull Collection<String> extraReadinessMarkers) {
        Objects.requireNonNull(kind, "kind");

        List<Rule> rules = new ArrayList<>();
        Pattern builtinReady = kind == ServerKind.BUNGEECORD || kind == ServerKind.WATERFALL
                ? BUNGEE_READY : GAME_READY;
        rules.add(new Rule(builtinReady, m -> new ConsoleMatch.Ready()));
        for (String marker : extraReadinessMarkers) {
            rules.add(new Rule(Pattern.compile(marker), m -> new ConsoleMatch.Ready()));
        }

        rules.add(new Rule(PLAYER_UUID, m -> new ConsoleMatch.PlayerUuid(m.group(1), m.group(2))));
        rules.add(new Rule(PLAYER_JOIN, m -> new ConsoleMatch.PlayerJoin(m.group(1))));
        rules.add(new Rule(PLAYER_LEAVE, m -> new ConsoleMatch.PlayerLeave(m.group(1))));
        rules.add(new Rule(CHAT, m -> new ConsoleMatch.Chat(m.group(1), m.group(2))));
        rules.add(new Rule(ADVANCEMENT, m -> new ConsoleMatch.Advancement(m.group(1), m.group(2))));
        rules.add(new Rule(PAPER_TPS, ConsoleLineClassifier::tickRate));
        rules.add(new Rule(GENERIC_TPS, ConsoleLineClassifier::tickRate));
        rules.add(new Rule(CRASH_REPORT, m -> new ConsoleMatch.CrashReport()));
        rules.add(new Rule(DEATH, m -> new ConsoleMatch.Death(m.group(1), m.group(0))));
        return new ConsoleLineClassifier(rules);
    }

    /**
     * Classify one raw console line.
     *
     * @param rawLine line as printed by the process
     * @return the first matching event, or empty if the line carries no known event
     */
    @Nonnull
    public Optional<ConsoleMatch> classify(@Nonnull String rawLine) {
        String message = stripPrefix(rawLine);
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern().matcher(message);
            if (matcher.find()) {
                ConsoleMatch match = rule.extractor().apply(matcher);
                if (match != null) {
                    return Optional.of(match);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Remove vendor prefixes from a console line.
     *
     * @param rawLine raw line
     * @return the message part
     */
    @Nonnull
    static String stripPrefix(@Nonnull String rawLine) {
        return PREFIX.matcher(rawLine).replaceFirst("").stripTrailing();
    }

    private static ConsoleMatch tickRate(Matcher matcher) {
        try {
            return new ConsoleMatch.TickRate(Double.parseDouble(matcher.group(1)));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private record Rule(Pattern pattern, Function<Matcher, ConsoleMatch> extractor) {
    }
}
