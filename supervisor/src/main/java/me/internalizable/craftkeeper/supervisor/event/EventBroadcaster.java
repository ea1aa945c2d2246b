package me.internalizable.craftkeeper.supervisor.event;

import me.internalizable.craftkeeper.api.event.EventPayload;
import me.internalizable.craftkeeper.api.event.EventSubscription;
import me.internalizable.craftkeeper.api.event.ServerEvent;
import me.internalizable.craftkeeper.api.event.ServerEventKind;
import me.internalizable.craftkeeper.api.event.ServerEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans server events out to independent subscribers.
 *
 * <p>Every subscription owns a bounded queue and a dispatcher thread.
 * {@link #publish(ServerEvent)} never blocks: when a subscriber's queue is
 * full its oldest pending event is dropped. A listener that throws is logged
 * and keeps receiving events, so one slow or failing subscriber cannot delay
 * the others or the console readers that publish.</p>
 */
public class EventBroadcaster implements EventSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventBroadcaster.class);

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);
    private static final ServerEvent STOP = ServerEvent.of("", new EventPayload.LogLine(""), Instant.EPOCH);

    private final int queueCapacity;
    private final List<QueueSubscription> subscriptions = new CopyOnWriteArrayList<>();

    private volatile boolean shutdown;

    /**
     * Create an event broadcaster.
     *
     * @param queueCapacity pending events retained per subscriber
     */
    public EventBroadcaster(int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
    }

    /**
     * Register a subscriber.
     *
     * @param name subscriber name, used for the dispatcher thread
     * @param kinds event kinds to deliver
     * @param listener event callback
     * @return subscription handle
     */
    @Nonnull
    public EventSubscription subscribe(@Nonnull String name, @Nonnull Set<ServerEventKind> kinds,
                                       @Nonnull ServerEventListener listener) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kinds, "kinds");
        Objects.requireNonNull(listener, "listener");
        if (shutdown) {
            throw new IllegalStateException("Event broadcaster has been shut down");
        }

        Set<ServerEventKind> filter = kinds.isEmpty()
                ? EnumSet.noneOf(ServerEventKind.class) : EnumSet.copyOf(kinds);
        QueueSubscription subscription = new QueueSubscription(name, filter, listener, queueCapacity);
        subscriptions.add(subscription);
        subscription.start();
        LOGGER.debug("Registered event subscriber '{}' for {}", name, filter);
        return subscription;
    }

    @Override
    public void publish(@Nonnull ServerEvent event) {
        Objects.requireNonNull(event, "event");
        for (QueueSubscription subscription : subscriptions) {
            subscription.offer(event);
        }
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    /**
     * Close every subscription and reject new ones. Events being delivered
     * when this is called are allowed to finish.
     */
    public void shutdown() {
        shutdown = true;
        for (QueueSubscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
    }

    private final class QueueSubscription implements EventSubscription {

        private final String name;
        private final Set<ServerEventKind> kinds;
        private final ServerEventListener listener;
        private final BlockingQueue<ServerEvent> queue;
        private final AtomicLong dropped = new AtomicLong();
        private final Thread dispatcher;

        private volatile boolean active = true;

        private QueueSubscription(String name, Set<ServerEventKind> kinds,
                                  ServerEventListener listener, int capacity) {
            this.name = name;
            this.kinds = kinds;
            this.listener = listener;
            this.queue = new ArrayBlockingQueue<>(capacity);
            this.dispatcher = new Thread(this::dispatchLoop, "EventDispatch-" + name);
            this.dispatcher.setDaemon(true);
        }

        private void start() {
            dispatcher.start();
        }

        private void offer(ServerEvent event) {
            if (!active || !kinds.contains(event.kind())) {
                return;
            }
            while (!queue.offer(event)) {
                if (queue.poll() != null && dropped.incrementAndGet() % queueCapacity == 1) {
                    LOGGER.warn("Event subscriber '{}' is falling behind, {} event(s) dropped so far",
                            name, dropped.get());
                }
            }
        }

        private void dispatchLoop() {
            while (active) {
                ServerEvent event;
                try {
                    event = queue.take();
                } catch (InterruptedException e) {
                    if (active) {
                        LOGGER.warn("Event dispatcher '{}' interrupted", name);
                    }
                    return;
                }
                if (event == STOP || !active) {
                    return;
                }
                try {
                    listener.onEvent(event);
                } catch (Exception e) {
                    LOGGER.error("Event subscriber '{}' failed to handle {} from '{}'",
                            name, event.kind().getId(), event.serverId(), e);
                }
            }
        }

        @Override
        @Nonnull
        public String getName() {
            return name;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public long getDroppedCount() {
            return dropped.get();
        }

        /**
         * Stop delivery. Pending events are discarded; an event already being
         * handled finishes before this returns, unless called from the
         * listener itself.
         */
        @Override
        public void close() {
            if (!active) {
                return;
            }
            active = false;
            subscriptions.remove(this);
            queue.clear();
            while (!queue.offer(STOP)) {
                queue.poll();
            }
            if (Thread.currentThread() == dispatcher) {
                return;
            }
            try {
                dispatcher.join(CLOSE_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (dispatcher.isAlive()) {
                LOGGER.warn("Event subscriber '{}' still busy {}s after close, interrupting",
                        name, CLOSE_TIMEOUT.toSeconds());
                dispatcher.interrupt();
            }
            LOGGER.debug("Closed event subscriber '{}'", name);
        }
    }
}
