package com.ryuqq.sortedfeed.adapter.inmemory.store;

import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedKeys;
import com.ryuqq.sortedfeed.core.spi.FeedStore;
import com.ryuqq.sortedfeed.core.spi.FeedTransaction;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link FeedStore} SPI for testing and reference purposes.
 *
 * <p>This implementation reproduces the compare-and-swap contract of a transactional
 * key-value store (WATCH / MULTI / EXEC) inside one JVM, so the mutation engine can be
 * exercised without a server.</p>
 *
 * <p><strong>Data Structures (per feed):</strong></p>
 * <ul>
 *   <li><strong>order:</strong> ArrayList&lt;FeedId&gt; - Feed ordering, duplicates allowed</li>
 *   <li><strong>items:</strong> HashMap&lt;FeedId, Content&gt; - Item contents</li>
 *   <li><strong>idCounter / publishCounter:</strong> long counters</li>
 *   <li><strong>itemsVersion:</strong> long - Bumped on every items modification, compared by watching transactions</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong></p>
 * <ul>
 *   <li>Each feed's state is guarded by its own monitor, standing in for the server's single-threaded execution</li>
 *   <li>A commit applies every queued write while holding the monitor</li>
 *   <li>A watching commit aborts (returns false) if the items map changed after the watch began</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryFeedStore store = new InMemoryFeedStore();
 * SortedFeed feed = new OptimisticSortedFeed(store, new InMemoryNotificationBus(), FeedName.of("news"));
 * </pre>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public class InMemoryFeedStore implements FeedStore {

    /**
     * Per-feed state.
     * Key: FeedKeys, Value: FeedState (guarded by its own monitor)
     */
    private final ConcurrentHashMap<FeedKeys, FeedState> feeds = new ConcurrentHashMap<>();

    /**
     * Number of watching commits aborted because of a concurrent items modification.
     */
    private final AtomicLong abortedCommits = new AtomicLong();

    @Override
    public FeedId nextId(FeedKeys keys) {
        FeedState state = state(keys);
        synchronized (state) {
            return FeedId.of(++state.idCounter);
        }
    }

    @Override
    public FeedTransaction begin(FeedKeys keys) {
        return new InMemoryFeedTransaction(this, state(keys), false);
    }

    @Override
    public FeedTransaction watch(FeedKeys keys) {
        return new InMemoryFeedTransaction(this, state(keys), true);
    }

    @Override
    public List<FeedId> getIds(FeedKeys keys) {
        FeedState state = state(keys);
        synchronized (state) {
            return List.copyOf(state.order);
        }
    }

    @Override
    public Optional<Content> getItem(FeedKeys keys, FeedId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        FeedState state = state(keys);
        synchronized (state) {
            return Optional.ofNullable(state.items.get(id));
        }
    }

    @Override
    public Map<FeedId, Content> getItems(FeedKeys keys) {
        FeedState state = state(keys);
        synchronized (state) {
            return Collections.unmodifiableMap(new TreeMap<>(state.items));
        }
    }

    @Override
    public long size(FeedKeys keys) {
        FeedState state = state(keys);
        synchronized (state) {
            return state.items.size();
        }
    }

    @Override
    public long publishCount(FeedKeys keys) {
        FeedState state = state(keys);
        synchronized (state) {
            return state.publishCounter;
        }
    }

    /**
     * Returns the number of watching commits that were aborted by a conflict.
     *
     * @return aborted commit count
     */
    public long abortedCommits() {
        return abortedCommits.get();
    }

    /**
     * Clears all feeds (for test cleanup).
     */
    public void clear() {
        feeds.clear();
        abortedCommits.set(0);
    }

    void recordAbort() {
        abortedCommits.incrementAndGet();
    }

    private FeedState state(FeedKeys keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        return feeds.computeIfAbsent(keys, k -> new FeedState());
    }
}
