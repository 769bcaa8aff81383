/**
 * In-memory {@link com.ryuqq.sortedfeed.core.spi.FeedStore} implementation.
 *
 * <p>Reference implementation of the watch / compare-and-swap contract, used by tests and
 * by single-process deployments.</p>
 *
 * @since 1.0.0
 * @author SortedFeed Team
 */
package com.ryuqq.sortedfeed.adapter.inmemory.store;
