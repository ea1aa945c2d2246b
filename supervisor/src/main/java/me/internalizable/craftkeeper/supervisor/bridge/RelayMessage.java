package me.internalizable.craftkeeper.supervisor.bridge;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;

/**
 * A formatted message ready to be posted to an external chat.
 *
 * @param serverId originating server
 * @param type message category
 * @param author player who wrote it, null for server notices
 * @param content message text
 * @param timestamp when the originating event happened
 */
public record RelayMessage(
        @Nonnull String serverId,
        @Nonnull Type type,
        @Nullable String author,
        @Nonnull String content,
        @Nonnull Instant timestamp
) {

    public enum Type {
        CHAT, JOIN, LEAVE, ADVANCEMENT, DEATH, STATUS
    }
}
