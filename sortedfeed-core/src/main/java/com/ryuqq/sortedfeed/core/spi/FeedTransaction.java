package com.ryuqq.sortedfeed.core.spi;

import com.ryuqq.sortedfeed.core.event.FeedEvent;
import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.Position;

/**
 * One all-or-nothing unit of writes against a single feed.
 *
 * <p>Write methods only queue; nothing is visible to other readers until
 * {@link #commit(NotificationSink)} succeeds. A transaction is single-use and not
 * thread-safe.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * open (begin / watch) → [contains]* → [queue writes, publish events]* → commit(sink) → close
 *                                                                      ↘ close (discard, release watch)
 * </pre>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public interface FeedTransaction extends AutoCloseable {

    /**
     * Reads whether an item exists, under the transaction's watch.
     *
     * @param id the item id
     * @return true if the items key holds an entry for id
     * @throws IllegalArgumentException if id is null
     * @throws IllegalStateException if the transaction is already committed or closed
     * @throws FeedStoreException if the store is unavailable
     */
    boolean contains(FeedId id);

    /**
     * Queues a push of id to the end of the order.
     *
     * @param id the item id
     * @return this transaction
     */
    FeedTransaction appendTail(FeedId id);

    /**
     * Queues a push of id to the start of the order.
     *
     * @param id the item id
     * @return this transaction
     */
    FeedTransaction appendHead(FeedId id);

    /**
     * Queues an insert of id next to the first occurrence of anchor in the order.
     *
     * @param id the item id
     * @param anchor the existing id to insert relative to
     * @param position BEFORE or AFTER the anchor
     * @return this transaction
     */
    FeedTransaction insertRelative(FeedId id, FeedId anchor, Position position);

    /**
     * Queues removal of the first occurrence of id from the order.
     *
     * @param id the item id
     * @return this transaction
     */
    FeedTransaction remove(FeedId id);

    /**
     * Queues a write of content under id in the items map.
     *
     * @param id the item id
     * @param content the content
     * @return this transaction
     */
    FeedTransaction put(FeedId id, Content content);

    /**
     * Queues deletion of id from the items map.
     *
     * @param id the item id
     * @return this transaction
     */
    FeedTransaction delete(FeedId id);

    /**
     * Queues an increment of the publish counter.
     *
     * @return this transaction
     */
    FeedTransaction incrementPublishCount();

    /**
     * Queues a notification to hand to the sink if, and only if, the commit applies.
     *
     * @param event the event describing the queued writes
     * @return this transaction
     */
    FeedTransaction publish(FeedEvent event);

    /**
     * Applies every queued write atomically, then hands the queued events to the sink.
     *
     * <p>Events of one commit reach the sink before any later commit on the same feed
     * through the same store instance can deliver its own, so a single engine emits in
     * commit order. A sink exception propagates after the writes are applied.</p>
     *
     * @param sink receiver of the queued events
     * @return true if applied, false if a watched key changed since the watch began
     *         (nothing applied, nothing emitted)
     * @throws IllegalArgumentException if sink is null
     * @throws IllegalStateException if the transaction is already committed or closed
     * @throws FeedStoreException if the store is unavailable
     */
    boolean commit(NotificationSink sink);

    /**
     * Applies every queued write atomically, for transactions without queued events.
     *
     * @return true if applied, false if a watched key changed since the watch began
     * @throws IllegalStateException if the transaction is already committed or closed, or
     *         if an event was queued (raised once the writes have applied)
     * @throws FeedStoreException if the store is unavailable
     */
    default boolean commit() {
        return commit(event -> {
            throw new IllegalStateException("No sink for queued event on " + event.feed());
        });
    }

    /**
     * Discards queued writes if not committed and releases any watch.
     *
     * <p>Idempotent. Never throws a checked exception.</p>
     */
    @Override
    void close();
}
