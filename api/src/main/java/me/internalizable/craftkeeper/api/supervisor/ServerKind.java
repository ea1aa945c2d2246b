package me.internalizable.craftkeeper.api.supervisor;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Flavour of server software running inside a supervised process.
 *
 * <p>The kind decides which console command asks the process to shut down
 * and whether it is a game server or a proxy in front of game servers.</p>
 */
public enum ServerKind {
    VANILLA("stop", false),
    PAPER("stop", false),
    SPIGOT("stop", false),
    PURPUR("stop", false),
    FORGE("stop", false),
    FABRIC("stop", false),
    SPONGE("stop", false),
    BUNGEECORD("end", true),
    WATERFALL("end", true),
    VELOCITY("shutdown", true);

    private final String shutdownCommand;
    private final boolean proxy;

    ServerKind(String shutdownCommand, boolean proxy) {
        this.shutdownCommand = shutdownCommand;
        this.proxy = proxy;
    }

    /**
     * Get the console command that requests a graceful shutdown.
     *
     * @return shutdown command without trailing newline
     */
    @Nonnull
    public String getShutdownCommand() {
        return shutdownCommand;
    }

    /**
     * Check if this kind is a proxy rather than a game server.
     *
     * <p>Proxies have no world, no EULA file and no {@code nogui} argument.</p>
     *
     * @return true for proxy kinds
     */
    public boolean isProxy() {
        return proxy;
    }

    @Nonnull
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a kind from its identifier, ignoring case.
     *
     * @param id kind identifier such as {@code "paper"}
     * @return the matching kind
     * @throws IllegalArgumentException if no kind matches
     */
    @Nonnull
    public static ServerKind fromId(@Nonnull String id) {
        for (ServerKind kind : values()) {
            if (kind.name().equalsIgnoreCase(id.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown server kind: " + id);
    }
}
