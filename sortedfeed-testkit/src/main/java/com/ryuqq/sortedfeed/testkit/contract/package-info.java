/**
 * Reusable contract tests for store adapters.
 *
 * <p>An adapter module adds this module in test scope and extends the abstract classes:</p>
 * <pre>
 * class RedisFeedStoreContractTest extends AbstractFeedStoreContractTest {
 *     {@literal @}Override
 *     protected FeedStore createStore() {
 *         return new RedisFeedStore(pool);
 *     }
 * }
 * </pre>
 *
 * <ul>
 *   <li>{@link com.ryuqq.sortedfeed.testkit.contract.AbstractFeedStoreContractTest} - FeedStore / FeedTransaction SPI</li>
 *   <li>{@link com.ryuqq.sortedfeed.testkit.contract.AbstractSortedFeedContractTest} - mutation protocols on a real store</li>
 *   <li>{@link com.ryuqq.sortedfeed.testkit.contract.ContendedFeedStore} - injects write conflicts</li>
 *   <li>{@link com.ryuqq.sortedfeed.testkit.contract.RecordingNotificationSink} - captures emitted events</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.sortedfeed.testkit.contract;
