package me.internalizable.craftkeeper.supervisor.event;

import me.internalizable.craftkeeper.api.event.ServerEvent;

import javax.annotation.Nonnull;

/**
 * Receives events emitted by server instances. Implementations must not block.
 */
@FunctionalInterface
public interface EventSink {

    void publish(@Nonnull ServerEvent event);
}
