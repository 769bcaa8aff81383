package com.ryuqq.sortedfeed.adapter.inmemory.bus;

import com.ryuqq.sortedfeed.core.event.FeedEvent;
import com.ryuqq.sortedfeed.core.model.FeedName;
import com.ryuqq.sortedfeed.core.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link NotificationSink} SPI.
 *
 * <p>Delivers each emitted event synchronously to the listeners registered at the time
 * of the emit. There is no buffering: a listener that subscribes after an emit never
 * sees it.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Per-feed subscriptions ({@link #subscribe(FeedName, FeedListener)})</li>
 *   <li>Catch-all subscriptions ({@link #subscribeAll(FeedListener)})</li>
 *   <li>Listener isolation: a throwing listener is logged and does not block the others</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryNotificationBus bus = new InMemoryNotificationBus();
 * try (Subscription s = bus.subscribe(FeedName.of("news"), event -&gt; render(event))) {
 *     feed.publish(Content.of("hello"));
 * }
 * </pre>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public class InMemoryNotificationBus implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryNotificationBus.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final AtomicLong emitted = new AtomicLong();

    @Override
    public void emit(FeedEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        emitted.incrementAndGet();

        for (Registration registration : registrations) {
            if (registration.feed != null && !registration.feed.equals(event.feed())) {
                continue;
            }
            try {
                registration.listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed for {} on {}", event.id(), event.feed(), e);
            }
        }
    }

    /**
     * Registers a listener for one feed.
     *
     * @param feed the feed to listen to
     * @param listener the listener
     * @return a subscription that unregisters the listener when closed
     * @throws IllegalArgumentException if feed or listener is null
     */
    public Subscription subscribe(FeedName feed, FeedListener listener) {
        if (feed == null) {
            throw new IllegalArgumentException("feed cannot be null");
        }
        return register(feed, listener);
    }

    /**
     * Registers a listener for every feed.
     *
     * @param listener the listener
     * @return a subscription that unregisters the listener when closed
     * @throws IllegalArgumentException if listener is null
     */
    public Subscription subscribeAll(FeedListener listener) {
        return register(null, listener);
    }

    /**
     * Returns the number of currently registered listeners.
     *
     * @return listener count
     */
    public int subscriberCount() {
        return registrations.size();
    }

    /**
     * Returns the number of events emitted since creation or the last {@link #clear()}.
     *
     * @return emitted event count
     */
    public long emittedCount() {
        return emitted.get();
    }

    /**
     * Removes all listeners and resets counters (for test cleanup).
     */
    public void clear() {
        registrations.clear();
        emitted.set(0);
    }

    private Subscription register(FeedName feed, FeedListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        Registration registration = new Registration(feed, listener);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    /**
     * Handle returned by subscribe; closing it stops delivery.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        @Override
        void close();
    }

    private static final class Registration {

        private final FeedName feed;
        private final FeedListener listener;

        private Registration(FeedName feed, FeedListener listener) {
            this.feed = feed;
            this.listener = listener;
        }
    }
}
