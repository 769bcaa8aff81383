package com.ryuqq.sortedfeed.core.spi;

import com.ryuqq.sortedfeed.core.event.FeedEvent;

/**
 * Fan-out channel for feed change notifications.
 *
 * <p>Events are queued on a {@link FeedTransaction} and handed to
 * {@link #emit(FeedEvent)} by {@link FeedTransaction#commit(NotificationSink)}: exactly once
 * per committed mutation, and never for aborted attempts or no-ops.</p>
 *
 * <p><strong>Delivery Semantics:</strong></p>
 * <ul>
 *   <li>Live only: observers that subscribe after an emit never receive it</li>
 *   <li>No durable replay of missed notifications</li>
 *   <li>Events of one feed reach the sink in commit order for writers sharing one store instance</li>
 *   <li>Called while the store serializes commits on the feed: implementations should not
 *       block on other writers of the same feed</li>
 * </ul>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface NotificationSink {

    /**
     * Broadcasts an event to current subscribers.
     *
     * @param event the event to broadcast
     * @throws IllegalArgumentException if event is null
     * @throws FeedStoreException if the transport is unavailable
     */
    void emit(FeedEvent event);
}
