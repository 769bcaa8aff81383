/**
 * Application Layer - 정렬 피드 변경 엔진.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sortedfeed.application.feed.SortedFeed} - 피드 연산 인터페이스</li>
 *   <li>{@link com.ryuqq.sortedfeed.application.feed.OptimisticSortedFeed} - watch/commit 재시도 루프 구현체</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * application (SortedFeed, OptimisticSortedFeed)
 *   ↓ depends on
 * core (FeedId, Content, FeedEvent, FeedOutcome)
 *   ↓ depends on
 * core/spi (FeedStore, FeedTransaction, NotificationSink)
 *   ↑ implemented by
 * adapter-inmemory, adapter-redis
 * </pre>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
package com.ryuqq.sortedfeed.application.feed;
