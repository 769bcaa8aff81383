/**
 * Redis adapter (Jedis).
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sortedfeed.adapter.redis.RedisFeedStore} - FeedStore over LIST / HASH / INCR with WATCH-MULTI-EXEC transactions</li>
 *   <li>{@link com.ryuqq.sortedfeed.adapter.redis.RedisNotificationSink} - NotificationSink over PUBLISH</li>
 *   <li>{@link com.ryuqq.sortedfeed.adapter.redis.RedisConnectionConfig} - Standalone connection settings</li>
 * </ul>
 *
 * <h2>Wiring</h2>
 * <pre>
 * JedisPool pool = RedisFeedStore.createPool(new RedisConnectionConfig());
 * SortedFeed feed = new OptimisticSortedFeed(
 *     new RedisFeedStore(pool), new RedisNotificationSink(pool), FeedName.of("news"));
 * </pre>
 *
 * @since 1.0.0
 * @author SortedFeed Team
 */
package com.ryuqq.sortedfeed.adapter.redis;
