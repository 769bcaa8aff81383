package com.ryuqq.sortedfeed.adapter.redis;

import com.ryuqq.sortedfeed.core.event.FeedEvent;
import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedKeys;
import com.ryuqq.sortedfeed.core.model.Position;
import com.ryuqq.sortedfeed.core.spi.FeedStoreException;
import com.ryuqq.sortedfeed.core.spi.FeedTransaction;
import com.ryuqq.sortedfeed.core.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.args.ListPosition;
import redis.clients.jedis.exceptions.JedisException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * {@link FeedTransaction} mapped onto Redis WATCH / MULTI / EXEC.
 *
 * <p>Owns one pooled connection for its whole life, since WATCH is connection-scoped.
 * Writes are buffered and replayed inside MULTI on commit; reads made through
 * {@link #contains(FeedId)} happen after WATCH and before MULTI.</p>
 *
 * <p>MULTI / EXEC and the emit of queued events run under a per-feed commit lock shared by
 * every transaction of one {@link RedisFeedStore}, so its writers emit in EXEC order.</p>
 *
 * <pre>
 * contains       HEXISTS  items id
 * appendTail     RPUSH    order id
 * appendHead     LPUSH    order id
 * insertRelative LINSERT  order BEFORE|AFTER anchor id
 * remove         LREM     order 1 id
 * put            HSET     items id content
 * delete         HDEL     items id
 * incrementPublishCount  INCR publishCounter
 * </pre>
 */
final class RedisFeedTransaction implements FeedTransaction {

    private static final Logger log = LoggerFactory.getLogger(RedisFeedTransaction.class);

    private final Jedis jedis;
    private final FeedKeys keys;
    private final boolean watching;
    private final Object commitLock;
    private final List<Consumer<Transaction>> writes = new ArrayList<>();
    private final List<FeedEvent> events = new ArrayList<>();
    private boolean finished;
    private boolean executed;
    private boolean closed;

    RedisFeedTransaction(Jedis jedis, FeedKeys keys, boolean watching, Object commitLock) {
        this.jedis = jedis;
        this.keys = keys;
        this.watching = watching;
        this.commitLock = commitLock;
        if (watching) {
            try {
                jedis.watch(keys.items());
            } catch (JedisException e) {
                jedis.close();
                throw new FeedStoreException("WATCH failed on " + keys.items(), e);
            }
        }
    }

    @Override
    public boolean contains(FeedId id) {
        requireOpen();
        requireNonNull(id, "id");
        try {
            return jedis.hexists(keys.items(), id.asString());
        } catch (JedisException e) {
            throw new FeedStoreException("HEXISTS failed on " + keys.items(), e);
        }
    }

    @Override
    public FeedTransaction appendTail(FeedId id) {
        requireNonNull(id, "id");
        return queue(t -> t.rpush(keys.order(), id.asString()));
    }

    @Override
    public FeedTransaction appendHead(FeedId id) {
        requireNonNull(id, "id");
        return queue(t -> t.lpush(keys.order(), id.asString()));
    }

    @Override
    public FeedTransaction insertRelative(FeedId id, FeedId anchor, Position position) {
        requireNonNull(id, "id");
        requireNonNull(anchor, "anchor");
        requireNonNull(position, "position");
        ListPosition where = position == Position.BEFORE ? ListPosition.BEFORE : ListPosition.AFTER;
        return queue(t -> t.linsert(keys.order(), where, anchor.asString(), id.asString()));
    }

    @Override
    public FeedTransaction remove(FeedId id) {
        requireNonNull(id, "id");
        return queue(t -> t.lrem(keys.order(), 1, id.asString()));
    }

    @Override
    public FeedTransaction put(FeedId id, Content content) {
        requireNonNull(id, "id");
        requireNonNull(content, "content");
        return queue(t -> t.hset(keys.items(), id.asString(), content.getValue()));
    }

    @Override
    public FeedTransaction delete(FeedId id) {
        requireNonNull(id, "id");
        return queue(t -> t.hdel(keys.items(), id.asString()));
    }

    @Override
    public FeedTransaction incrementPublishCount() {
        return queue(t -> t.incr(keys.publishCounter()));
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
        synchronized (commitLock) {
            if (!exec()) {
                return false;
            }
            for (FeedEvent event : events) {
                sink.emit(event);
            }
            return true;
        }
    }

    private boolean exec() {
        try {
            Transaction multi = jedis.multi();
            for (Consumer<Transaction> write : writes) {
                write.accept(multi);
            }
            List<Object> replies = multi.exec();
            executed = true;
            // null reply: a watched key changed, nothing was applied
            return replies != null;
        } catch (JedisException e) {
            throw new FeedStoreException("MULTI/EXEC failed on " + keys.feed(), e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        finished = true;
        writes.clear();
        events.clear();
        try {
            if (watching && !executed) {
                jedis.unwatch();
            }
        } catch (JedisException e) {
            log.warn("UNWATCH failed on {}, connection will be reset by the pool", keys.items(), e);
        } finally {
            jedis.close();
        }
    }

    private FeedTransaction queue(Consumer<Transaction> write) {
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
