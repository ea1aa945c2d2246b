package me.internalizable.craftkeeper.supervisor.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Writes relay messages to the {@code craftkeeper.relay} logger, for use until a chat transport is configured.
 */
public class LoggingRelaySink implements RelaySink {

    private static final Logger LOGGER = LoggerFactory.getLogger("craftkeeper.relay");

    @Override
    public void send(@Nonnull RelayMessage message) {
        if (message.author() != null) {
            LOGGER.info("[{}] <{}> {}", message.serverId(), message.author(), message.content());
        } else {
            LOGGER.info("[{}] {}", message.serverId(), message.content());
        }
    }
}
