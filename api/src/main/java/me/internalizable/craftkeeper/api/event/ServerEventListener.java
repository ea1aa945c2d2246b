package me.internalizable.craftkeeper.api.event;

import javax.annotation.Nonnull;

/**
 * Receives server events on the subscription's own dispatcher thread.
 *
 * <p>Exceptions thrown by a listener are logged by the supervisor; the
 * subscription stays active.</p>
 */
@FunctionalInterface
public interface ServerEventListener {

    void onEvent(@Nonnull ServerEvent event) throws Exception;
}
