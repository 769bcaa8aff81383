package com.ryuqq.sortedfeed.adapter.inmemory.bus;

import com.ryuqq.sortedfeed.core.event.FeedEvent;

/**
 * Receives events delivered by {@link InMemoryNotificationBus}.
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface FeedListener {

    /**
     * Called on the emitting thread for each event after the mutation committed.
     *
     * @param event the event
     */
    void onEvent(FeedEvent event);
}
