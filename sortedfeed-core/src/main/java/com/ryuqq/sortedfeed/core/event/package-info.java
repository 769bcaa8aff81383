/**
 * Change notifications emitted after committed feed mutations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.sortedfeed.core.event.FeedEvent} - Sealed interface (permits PublishEvent, RetractEvent)</li>
 *   <li>{@link com.ryuqq.sortedfeed.core.event.FeedEventCodec} - NUL-separated channel message format</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SortedFeed Team
 */
package com.ryuqq.sortedfeed.core.event;
