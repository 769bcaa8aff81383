package com.ryuqq.sortedfeed.testkit.contract;

import com.ryuqq.sortedfeed.core.event.FeedEvent;
import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedKeys;
import com.ryuqq.sortedfeed.core.model.Position;
import com.ryuqq.sortedfeed.core.spi.FeedStore;
import com.ryuqq.sortedfeed.core.spi.FeedTransaction;
import com.ryuqq.sortedfeed.core.spi.NotificationSink;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * FeedStore decorator that injects write conflicts into watched transactions.
 *
 * <p>For the first {@code conflicts} watched transactions whose {@code contains()} check
 * succeeds, a competing writer rewrites the checked item through a separate
 * {@link FeedStore#begin(FeedKeys)} transaction. The rewrite keeps the current content, so
 * the feed's visible state is unchanged but the watch is invalidated and the pending
 * commit must abort.</p>
 *
 * <pre>
 * ContendedFeedStore contended = new ContendedFeedStore(store, 2);
 * // first two commits conflict, third one goes through
 * FeedOutcome outcome = new OptimisticSortedFeed(contended, sink, keys, policy).edit(id, content);
 * </pre>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public class ContendedFeedStore implements FeedStore {

    private final FeedStore delegate;
    private final AtomicInteger remaining;
    private final AtomicInteger injected = new AtomicInteger();

    /**
     * @param delegate the real store
     * @param conflicts number of watched transactions to sabotage (Integer.MAX_VALUE: all)
     * @throws IllegalArgumentException if delegate is null or conflicts is negative
     */
    public ContendedFeedStore(FeedStore delegate, int conflicts) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (conflicts < 0) {
            throw new IllegalArgumentException("conflicts must not be negative (current: " + conflicts + ")");
        }
        this.delegate = delegate;
        this.remaining = new AtomicInteger(conflicts);
    }

    /**
     * @return number of conflicting writes injected so far
     */
    public int injectedConflicts() {
        return injected.get();
    }

    @Override
    public FeedId nextId(FeedKeys keys) {
        return delegate.nextId(keys);
    }

    @Override
    public FeedTransaction begin(FeedKeys keys) {
        return delegate.begin(keys);
    }

    @Override
    public FeedTransaction watch(FeedKeys keys) {
        return new SabotagedTransaction(keys, delegate.watch(keys));
    }

    @Override
    public List<FeedId> getIds(FeedKeys keys) {
        return delegate.getIds(keys);
    }

    @Override
    public Optional<Content> getItem(FeedKeys keys, FeedId id) {
        return delegate.getItem(keys, id);
    }

    @Override
    public Map<FeedId, Content> getItems(FeedKeys keys) {
        return delegate.getItems(keys);
    }

    @Override
    public long size(FeedKeys keys) {
        return delegate.size(keys);
    }

    @Override
    public long publishCount(FeedKeys keys) {
        return delegate.publishCount(keys);
    }

    private boolean takeConflict() {
        return remaining.getAndUpdate(n -> n > 0 && n != Integer.MAX_VALUE ? n - 1 : n) > 0;
    }

    private final class SabotagedTransaction implements FeedTransaction {

        private final FeedKeys keys;
        private final FeedTransaction tx;

        private SabotagedTransaction(FeedKeys keys, FeedTransaction tx) {
            this.keys = keys;
            this.tx = tx;
        }

        @Override
        public boolean contains(FeedId id) {
            boolean present = tx.contains(id);
            if (present && takeConflict()) {
                Optional<Content> current = delegate.getItem(keys, id);
                if (current.isPresent()) {
                    try (FeedTransaction competing = delegate.begin(keys)) {
                        competing.put(id, current.get()).commit();
                    }
                    injected.incrementAndGet();
                }
            }
            return present;
        }

        @Override
        public FeedTransaction appendTail(FeedId id) {
            tx.appendTail(id);
            return this;
        }

        @Override
        public FeedTransaction appendHead(FeedId id) {
            tx.appendHead(id);
            return this;
        }

        @Override
        public FeedTransaction insertRelative(FeedId id, FeedId anchor, Position position) {
            tx.insertRelative(id, anchor, position);
            return this;
        }

        @Override
        public FeedTransaction remove(FeedId id) {
            tx.remove(id);
            return this;
        }

        @Override
        public FeedTransaction put(FeedId id, Content content) {
            tx.put(id, content);
            return this;
        }

        @Override
        public FeedTransaction delete(FeedId id) {
            tx.delete(id);
            return this;
        }

        @Override
        public FeedTransaction incrementPublishCount() {
            tx.incrementPublishCount();
            return this;
        }

        @Override
        public FeedTransaction publish(FeedEvent event) {
            tx.publish(event);
            return this;
        }

        @Override
        public boolean commit(NotificationSink sink) {
            return tx.commit(sink);
        }

        @Override
        public void close() {
            tx.close();
        }
    }
}
