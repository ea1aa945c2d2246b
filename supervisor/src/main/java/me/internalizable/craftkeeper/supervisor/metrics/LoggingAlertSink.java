package me.internalizable.craftkeeper.supervisor.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Writes alerts to the log: warnings at WARN, critical alerts at ERROR.
 */
public class LoggingAlertSink implements AlertSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingAlertSink.class);

    @Override
    public void deliver(@Nonnull PerformanceAlert alert) {
        if (alert.level() == PerformanceAlert.Level.CRITICAL) {
            LOGGER.error("[{}] {}", alert.serverId(), alert.message());
        } else {
            LOGGER.warn("[{}] {}", alert.serverId(), alert.message());
        }
    }
}
