/**
 * In-memory {@link com.ryuqq.sortedfeed.core.spi.NotificationSink} implementation.
 *
 * <p>Synchronous, live-only fan-out to registered listeners.</p>
 *
 * @since 1.0.0
 * @author SortedFeed Team
 */
package com.ryuqq.sortedfeed.adapter.inmemory.bus;
