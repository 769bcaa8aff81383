package com.ryuqq.sortedfeed.adapter.inmemory.store;

import com.ryuqq.sortedfeed.core.event.FeedEvent;
import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.Position;
import com.ryuqq.sortedfeed.core.spi.FeedTransaction;
import com.ryuqq.sortedfeed.core.spi.NotificationSink;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * {@link FeedTransaction} over a {@link FeedState}.
 *
 * <p>Writes are buffered as closures and applied under the state's monitor on commit.
 * A watching transaction records the items version when it is opened and aborts the
 * commit if that version has moved. Queued events are emitted while the monitor is
 * still held, so they leave in the order the commits applied.</p>
 */
final class InMemoryFeedTransaction implements FeedTransaction {

    private final InMemoryFeedStore owner;
    private final FeedState state;
    private final boolean watching;
    private final long watchedVersion;
    private final List<Consumer<FeedState>> writes = new ArrayList<>();
    private final List<FeedEvent> events = new ArrayList<>();
    private boolean finished;

    InMemoryFeedTransaction(InMemoryFeedStore owner, FeedState state, boolean watching) {
        this.owner = owner;
        this.state = state;
        this.watching = watching;
        synchronized (state) {
            this.watchedVersion = state.itemsVersion;
        }
    }

    @Override
    public boolean contains(FeedId id) {
        requireOpen();
        requireNonNull(id, "id");
        synchronized (state) {
            return state.items.containsKey(id);
        }
    }

    @Override
    public FeedTransaction appendTail(FeedId id) {
        requireNonNull(id, "id");
        return queue(s -> s.order.add(id));
    }

    @Override
    public FeedTransaction appendHead(FeedId id) {
        requireNonNull(id, "id");
        return queue(s -> s.order.add(0, id));
    }

    @Override
    public FeedTransaction insertRelative(FeedId id, FeedId anchor, Position position) {
        requireNonNull(id, "id");
        requireNonNull(anchor, "anchor");
        requireNonNull(position, "position");
        return queue(s -> s.insertRelative(id, anchor, position == Position.BEFORE));
    }

    @Override
    public FeedTransaction remove(FeedId id) {
        requireNonNull(id, "id");
        return queue(s -> s.order.remove(id));
    }

    @Override
    public FeedTransaction put(FeedId id, Content content) {
        requireNonNull(id, "id");
        requireNonNull(content, "content");
        return queue(s -> s.putItem(id, content));
    }

    @Override
    public FeedTransaction delete(FeedId id) {
        requireNonNull(id, "id");
        return queue(s -> s.deleteItem(id));
    }

    @Override
    public FeedTransaction incrementPublishCount() {
        return queue(s -> s.publishCounter++);
    }

    @Override
    public FeedTransaction publish(FeedEvent event) {
        requireOpen();
        requireNonNull(event, "event");
        events.add(event);
        return this;
    }

    @Override
    public boolean commit(NotificationSink sink) {
        requireOpen();
        requireNonNull(sink, "sink");
        finished = true;
        synchronized (state) {
            if (watching && state.itemsVersion != watchedVersion) {
                owner.recordAbort();
                return false;
            }
            for (Consumer<FeedState> write : writes) {
                write.accept(state);
            }
            for (FeedEvent event : events) {
                sink.emit(event);
            }
        }
        return true;
    }

    @Override
    public void close() {
        finished = true;
        writes.clear();
        events.clear();
    }

    private FeedTransaction queue(Consumer<FeedState> write) {
        requireOpen();
        writes.add(write);
        return this;
    }

    private void requireOpen() {
        if (finished) {
            throw new IllegalStateException("transaction already committed or closed");
        }
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
