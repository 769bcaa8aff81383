package com.ryuqq.sortedfeed.adapter.redis;

import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedKeys;
import com.ryuqq.sortedfeed.core.spi.FeedStore;
import com.ryuqq.sortedfeed.core.spi.FeedStoreException;
import com.ryuqq.sortedfeed.core.spi.FeedTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Redis implementation of {@link FeedStore} SPI.
 *
 * <p>Maps the feed structures onto plain Redis types and the compare-and-swap contract
 * onto WATCH / MULTI / EXEC:</p>
 *
 * <ul>
 *   <li><strong>order:</strong> LIST of ids</li>
 *   <li><strong>items:</strong> HASH id → content</li>
 *   <li><strong>idCounter / publishCounter:</strong> string counters driven by INCR</li>
 * </ul>
 *
 * <p><strong>Connection Handling:</strong></p>
 * <ul>
 *   <li>Each read borrows a connection from the pool for one command</li>
 *   <li>Each transaction keeps its connection until closed (WATCH is connection-scoped)</li>
 *   <li>A pool passed to the constructor is not closed by {@link #close()}</li>
 * </ul>
 *
 * <p><strong>Notification Order:</strong> commits on one feed through this store are
 * serialized from EXEC to the last emit, so a shared engine notifies in commit order.
 * Separate store instances (or processes) do not coordinate.</p>
 *
 * <p><strong>Errors:</strong> every {@link JedisException} is rethrown as
 * {@link FeedStoreException}.</p>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public class RedisFeedStore implements FeedStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisFeedStore.class);

    private final JedisPool pool;
    private final boolean ownsPool;
    private final ConcurrentMap<FeedKeys, Object> commitLocks = new ConcurrentHashMap<>();

    /**
     * Creates a store over an externally managed pool.
     *
     * @param pool the connection pool
     * @throws IllegalArgumentException if pool is null
     */
    public RedisFeedStore(JedisPool pool) {
        this(pool, false);
    }

    /**
     * Creates a store with its own pool built from the given settings.
     *
     * @param config connection settings
     * @throws IllegalArgumentException if config is null
     */
    public RedisFeedStore(RedisConnectionConfig config) {
        this(createPool(config), true);
        log.info("RedisFeedStore connected with {}", config);
    }

    private RedisFeedStore(JedisPool pool, boolean ownsPool) {
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        this.pool = pool;
        this.ownsPool = ownsPool;
    }

    /**
     * Builds a connection pool from settings.
     *
     * @param config connection settings
     * @return a new pool
     * @throws IllegalArgumentException if config is null
     */
    public static JedisPool createPool(RedisConnectionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return new JedisPool(new JedisPoolConfig(), config.host(), config.port(),
            config.timeoutMs(), config.password(), config.database());
    }

    @Override
    public FeedId nextId(FeedKeys keys) {
        requireKeys(keys);
        return read("INCR " + keys.idCounter(), jedis -> FeedId.of(jedis.incr(keys.idCounter())));
    }

    @Override
    public FeedTransaction begin(FeedKeys keys) {
        requireKeys(keys);
        return new RedisFeedTransaction(borrow(), keys, false, commitLock(keys));
    }

    @Override
    public FeedTransaction watch(FeedKeys keys) {
        requireKeys(keys);
        return new RedisFeedTransaction(borrow(), keys, true, commitLock(keys));
    }

    @Override
    public List<FeedId> getIds(FeedKeys keys) {
        requireKeys(keys);
        return read("LRANGE " + keys.order(), jedis -> {
            List<String> raw = jedis.lrange(keys.order(), 0, -1);
            List<FeedId> ids = new ArrayList<>(raw.size());
            for (String value : raw) {
                ids.add(FeedId.parse(value));
            }
            return Collections.unmodifiableList(ids);
        });
    }

    @Override
    public Optional<Content> getItem(FeedKeys keys, FeedId id) {
        requireKeys(keys);
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return read("HGET " + keys.items(), jedis ->
            Optional.ofNullable(jedis.hget(keys.items(), id.asString())).map(Content::of));
    }

    @Override
    public Map<FeedId, Content> getItems(FeedKeys keys) {
        requireKeys(keys);
        return read("HGETALL " + keys.items(), jedis -> {
            Map<FeedId, Content> items = new TreeMap<>();
            jedis.hgetAll(keys.items()).forEach((id, content) -> items.put(FeedId.parse(id), Content.of(content)));
            return Collections.unmodifiableMap(items);
        });
    }

    @Override
    public long size(FeedKeys keys) {
        requireKeys(keys);
        return read("HLEN " + keys.items(), jedis -> jedis.hlen(keys.items()));
    }

    @Override
    public long publishCount(FeedKeys keys) {
        requireKeys(keys);
        return read("GET " + keys.publishCounter(), jedis -> {
            String value = jedis.get(keys.publishCounter());
            return value == null ? 0L : Long.parseLong(value);
        });
    }

    /**
     * Closes the pool if this store created it.
     */
    @Override
    public void close() {
        if (ownsPool) {
            pool.close();
        }
    }

    private <T> T read(String command, Function<Jedis, T> call) {
        try (Jedis jedis = pool.getResource()) {
            return call.apply(jedis);
        } catch (JedisException e) {
            throw new FeedStoreException(command + " failed", e);
        }
    }

    private Object commitLock(FeedKeys keys) {
        return commitLocks.computeIfAbsent(keys, k -> new Object());
    }

    private Jedis borrow() {
        try {
            return pool.getResource();
        } catch (JedisException e) {
            throw new FeedStoreException("Could not borrow a Redis connection", e);
        }
    }

    private static void requireKeys(FeedKeys keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
    }
}
