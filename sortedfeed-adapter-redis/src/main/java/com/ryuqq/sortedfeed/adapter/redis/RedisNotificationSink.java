package com.ryuqq.sortedfeed.adapter.redis;

import com.ryuqq.sortedfeed.core.event.FeedEvent;
import com.ryuqq.sortedfeed.core.event.FeedEventCodec;
import com.ryuqq.sortedfeed.core.model.FeedKeys;
import com.ryuqq.sortedfeed.core.model.FeedName;
import com.ryuqq.sortedfeed.core.spi.FeedStoreException;
import com.ryuqq.sortedfeed.core.spi.NotificationSink;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisException;

import java.util.function.Function;

/**
 * Redis pub/sub implementation of {@link NotificationSink} SPI.
 *
 * <p>Each event is PUBLISHed on the feed's publish or retract channel using
 * {@link FeedEventCodec}. Redis pub/sub is live-only, so subscribers that are not
 * connected at publish time miss the message.</p>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public class RedisNotificationSink implements NotificationSink {

    private final JedisPool pool;
    private final Function<FeedName, FeedKeys> keyResolver;

    /**
     * Creates a sink using the default key layout ({@link FeedKeys#of(FeedName)}).
     *
     * @param pool the connection pool
     * @throws IllegalArgumentException if pool is null
     */
    public RedisNotificationSink(JedisPool pool) {
        this(pool, FeedKeys::of);
    }

    /**
     * Creates a sink with a custom key layout.
     *
     * @param pool the connection pool
     * @param keyResolver maps a feed name to its keys and channels
     * @throws IllegalArgumentException if pool or keyResolver is null
     */
    public RedisNotificationSink(JedisPool pool, Function<FeedName, FeedKeys> keyResolver) {
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        if (keyResolver == null) {
            throw new IllegalArgumentException("keyResolver cannot be null");
        }
        this.pool = pool;
        this.keyResolver = keyResolver;
    }

    @Override
    public void emit(FeedEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        String channel = FeedEventCodec.channel(keyResolver.apply(event.feed()), event);
        String message = FeedEventCodec.encode(event);

        try (Jedis jedis = pool.getResource()) {
            jedis.publish(channel, message);
        } catch (JedisException e) {
            throw new FeedStoreException("PUBLISH failed on " + channel, e);
        }
    }
}
