package com.ryuqq.sortedfeed.core.spi;

import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedKeys;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Transactional key-value store SPI backing sorted feeds.
 *
 * <p>This interface provides the primitives the mutation engine needs to keep three
 * co-located structures mutually consistent:</p>
 *
 * <ul>
 *   <li><strong>order:</strong> ordered sequence of ids (the feed's visible ordering)</li>
 *   <li><strong>items:</strong> id → content map (key set is the "item exists" predicate)</li>
 *   <li><strong>idCounter / publishCounter:</strong> monotonic counters</li>
 * </ul>
 *
 * <p><strong>Write Path:</strong></p>
 * <p>Writes are never applied directly. They are queued on a {@link FeedTransaction}
 * obtained from {@link #begin(FeedKeys)} (unconditional) or {@link #watch(FeedKeys)}
 * (compare-and-swap on the items key) and applied all-or-nothing on commit.</p>
 *
 * <p><strong>Compare-and-Swap Contract:</strong></p>
 * <pre>
 * try (FeedTransaction tx = store.watch(keys)) {   // WATCH items
 *     if (!tx.contains(anchor)) return missing;    // read under watch
 *     tx.insertRelative(id, anchor, BEFORE);       // queue
 *     tx.put(id, content);
 *     committed = tx.commit();                     // false if items changed since WATCH
 * }
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Cross-process: Correctness must not rely on in-process locks of the caller</li>
 *   <li>Failures: Connectivity or server errors surface as {@link FeedStoreException}</li>
 * </ul>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public interface FeedStore {

    /**
     * Atomically increments the feed's id counter and returns the new value.
     *
     * <p>There is no release: an id obtained here and never written leaves a
     * permanent gap in the sequence.</p>
     *
     * @param keys the feed keys
     * @return a new id, strictly greater than every id previously returned for this feed
     * @throws IllegalArgumentException if keys is null
     * @throws FeedStoreException if the store is unavailable
     */
    FeedId nextId(FeedKeys keys);

    /**
     * Opens an unconditional transaction.
     *
     * <p>{@link FeedTransaction#commit(NotificationSink)} on the returned transaction always applies
     * the queued writes (it never reports a conflict).</p>
     *
     * @param keys the feed keys
     * @return a new transaction
     * @throws IllegalArgumentException if keys is null
     * @throws FeedStoreException if the store is unavailable
     */
    FeedTransaction begin(FeedKeys keys);

    /**
     * Opens a transaction that watches the feed's items key.
     *
     * <p>{@link FeedTransaction#commit(NotificationSink)} on the returned transaction applies the queued
     * writes only if no other committer modified the items key since this call.</p>
     *
     * @param keys the feed keys
     * @return a new watching transaction
     * @throws IllegalArgumentException if keys is null
     * @throws FeedStoreException if the store is unavailable
     */
    FeedTransaction watch(FeedKeys keys);

    /**
     * Returns a point-in-time snapshot of the feed's ordering.
     *
     * @param keys the feed keys
     * @return ids in feed order (may be empty)
     * @throws IllegalArgumentException if keys is null
     * @throws FeedStoreException if the store is unavailable
     */
    List<FeedId> getIds(FeedKeys keys);

    /**
     * Looks up one item.
     *
     * @param keys the feed keys
     * @param id the item id
     * @return the content, or empty if the item does not exist
     * @throws IllegalArgumentException if keys or id is null
     * @throws FeedStoreException if the store is unavailable
     */
    Optional<Content> getItem(FeedKeys keys, FeedId id);

    /**
     * Returns a snapshot of every item.
     *
     * <p>Iteration order is ascending by id. It is not jointly consistent with a
     * separate {@link #getIds(FeedKeys)} call.</p>
     *
     * @param keys the feed keys
     * @return id → content mapping (may be empty)
     * @throws IllegalArgumentException if keys is null
     * @throws FeedStoreException if the store is unavailable
     */
    Map<FeedId, Content> getItems(FeedKeys keys);

    /**
     * Returns the number of items in the feed.
     *
     * @param keys the feed keys
     * @return item count
     * @throws IllegalArgumentException if keys is null
     * @throws FeedStoreException if the store is unavailable
     */
    long size(FeedKeys keys);

    /**
     * Returns the advisory publish counter.
     *
     * @param keys the feed keys
     * @return publish count (0 if never incremented)
     * @throws IllegalArgumentException if keys is null
     * @throws FeedStoreException if the store is unavailable
     */
    long publishCount(FeedKeys keys);
}
