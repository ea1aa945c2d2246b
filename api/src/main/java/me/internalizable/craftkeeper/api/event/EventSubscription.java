package me.internalizable.craftkeeper.api.event;

import javax.annotation.Nonnull;

/**
 * Handle of an event subscription. Closing it stops delivery and releases
 * the dispatcher thread; pending events are discarded.
 */
public interface EventSubscription extends AutoCloseable {

    @Nonnull
    String getName();

    /**
     * Check if events are still being delivered.
     *
     * @return false once closed
     */
    boolean isActive();

    /**
     * Get the number of events discarded because this subscriber fell behind.
     *
     * @return dropped event count
     */
    long getDroppedCount();

    @Override
    void close();
}
