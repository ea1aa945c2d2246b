package me.internalizable.craftkeeper.supervisor.bridge;

import javax.annotation.Nonnull;

/**
 * Transport that posts relay messages to an external chat service.
 */
@FunctionalInterface
public interface RelaySink {

    void send(@Nonnull RelayMessage message);
}
