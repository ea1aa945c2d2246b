package me.internalizable.craftkeeper.supervisor.metrics;

import javax.annotation.Nonnull;

/**
 * Delivers performance alerts, e.g. to a chat bridge or notification service.
 */
@FunctionalInterface
public interface AlertSink {

    void deliver(@Nonnull PerformanceAlert alert);
}
