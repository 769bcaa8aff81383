package com.ryuqq.sortedfeed.testkit.contract;

import com.ryuqq.sortedfeed.core.event.FeedEvent;
import com.ryuqq.sortedfeed.core.event.PublishEvent;
import com.ryuqq.sortedfeed.core.event.RetractEvent;
import com.ryuqq.sortedfeed.core.spi.NotificationSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * NotificationSink that records every emitted event for assertions.
 *
 * <p>Thread-safe: events may be emitted from concurrent mutations.</p>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public class RecordingNotificationSink implements NotificationSink {

    private final List<FeedEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void emit(FeedEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
    }

    /**
     * Returns all recorded events in emission order.
     *
     * @return immutable snapshot
     */
    public List<FeedEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns recorded publish events (publish, insert, edit).
     *
     * @return immutable snapshot
     */
    public List<PublishEvent> publishEvents() {
        return events.stream()
            .filter(PublishEvent.class::isInstance)
            .map(PublishEvent.class::cast)
            .toList();
    }

    /**
     * Returns recorded retract events.
     *
     * @return immutable snapshot
     */
    public List<RetractEvent> retractEvents() {
        return events.stream()
            .filter(RetractEvent.class::isInstance)
            .map(RetractEvent.class::cast)
            .toList();
    }

    /**
     * Returns the number of recorded events.
     *
     * @return event count
     */
    public int size() {
        return events.size();
    }
}
