package com.ryuqq.sortedfeed.adapter.redis;

import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedKeys;
import com.ryuqq.sortedfeed.core.model.FeedName;
import com.ryuqq.sortedfeed.core.spi.FeedStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * RedisFeedStore 유닛 테스트 (Redis 명령 매핑).
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RedisFeedStoreTest {

    private static final FeedKeys KEYS = FeedKeys.of(FeedName.of("news"));

    @Mock
    private JedisPool pool;

    @Mock
    private Jedis jedis;

    private RedisFeedStore store;

    @BeforeEach
    void setUp() {
        store = new RedisFeedStore(pool);
    }

    @Test
    void nextId_UsesIncrOnIdCounter() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.incr("feed.idincr:news")).thenReturn(4L);

        assertThat(store.nextId(KEYS)).isEqualTo(FeedId.of(4));
        verify(jedis).close();
    }

    @Test
    void getIds_ParsesListInOrder() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.lrange("feed.ids:news", 0, -1)).thenReturn(List.of("3", "1", "2"));

        assertThat(store.getIds(KEYS)).containsExactly(FeedId.of(3), FeedId.of(1), FeedId.of(2));
    }

    @Test
    void getItems_SortsNumericallyById() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.hgetAll("feed.items:news")).thenReturn(Map.of("10", "ten", "9", "nine"));

        assertThat(store.getItems(KEYS).keySet()).containsExactly(FeedId.of(9), FeedId.of(10));
    }

    @Test
    void getItem_AbsentField_ReturnsEmpty() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.hget("feed.items:news", "1")).thenReturn(null);

        assertThat(store.getItem(KEYS, FeedId.of(1))).isEmpty();
    }

    @Test
    void getItem_PresentField_ReturnsContent() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.hget("feed.items:news", "1")).thenReturn("one");

        assertThat(store.getItem(KEYS, FeedId.of(1))).contains(Content.of("one"));
    }

    @Test
    void publishCount_MissingKey_IsZero() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.get("feed.publishes:news")).thenReturn(null);

        assertThat(store.publishCount(KEYS)).isZero();
    }

    @Test
    void size_UsesHlen() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.hlen("feed.items:news")).thenReturn(3L);

        assertThat(store.size(KEYS)).isEqualTo(3);
    }

    @Test
    void transportFailure_WrappedInFeedStoreException() {
        when(pool.getResource()).thenReturn(jedis);
        when(jedis.incr("feed.idincr:news")).thenThrow(new JedisConnectionException("refused"));

        assertThatThrownBy(() -> store.nextId(KEYS))
            .isInstanceOf(FeedStoreException.class)
            .hasMessageContaining("INCR")
            .hasCauseInstanceOf(JedisConnectionException.class);
        verify(jedis).close();
    }

    @Test
    void poolExhausted_WrappedInFeedStoreException() {
        when(pool.getResource()).thenThrow(new JedisConnectionException("pool exhausted"));

        assertThatThrownBy(() -> store.watch(KEYS))
            .isInstanceOf(FeedStoreException.class);
    }

    @Test
    void watch_BorrowsDedicatedConnection() {
        when(pool.getResource()).thenReturn(jedis);

        store.watch(KEYS).close();

        verify(jedis).watch("feed.items:news");
        verify(jedis).unwatch();
        verify(jedis).close();
    }

    @Test
    void close_ExternalPool_IsLeftOpen() {
        store.close();

        verify(pool, never()).close();
    }

    @Test
    void nullArguments_Throw() {
        assertThatThrownBy(() -> new RedisFeedStore((JedisPool) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pool cannot be null");
        assertThatThrownBy(() -> new RedisFeedStore((RedisConnectionConfig) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
        assertThatThrownBy(() -> store.getIds(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
