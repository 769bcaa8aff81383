/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to back sorted feeds with a transactional key-value store and a notification transport.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sortedfeed.core.spi.FeedStore} - Id allocation, reads, transaction factory</li>
 *   <li>{@link com.ryuqq.sortedfeed.core.spi.FeedTransaction} - Queued all-or-nothing writes with optional watch</li>
 *   <li>{@link com.ryuqq.sortedfeed.core.spi.NotificationSink} - Post-commit event fan-out</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (sortedfeed-adapter-inmemory, sortedfeed-adapter-redis) provide
 * concrete implementations. Every store adapter is expected to pass the contract tests
 * in sortedfeed-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Store-side Serialization:</strong> All write ordering goes through the store's compare-and-swap primitive</li>
 *   <li><strong>Pluggability:</strong> InMemory for tests, Redis for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SortedFeed Team
 */
package com.ryuqq.sortedfeed.core.spi;
