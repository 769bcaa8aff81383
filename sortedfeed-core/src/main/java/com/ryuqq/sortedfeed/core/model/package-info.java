/**
 * Core value objects for sorted feeds.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sortedfeed.core.model.FeedName} - Feed name used for key namespacing</li>
 *   <li>{@link com.ryuqq.sortedfeed.core.model.FeedKeys} - Store keys and channels of one feed</li>
 *   <li>{@link com.ryuqq.sortedfeed.core.model.FeedId} - Monotonic item identifier</li>
 *   <li>{@link com.ryuqq.sortedfeed.core.model.Content} - Opaque item payload</li>
 *   <li>{@link com.ryuqq.sortedfeed.core.model.Position} - BEFORE / AFTER relative to an anchor</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SortedFeed Team
 */
package com.ryuqq.sortedfeed.core.model;
