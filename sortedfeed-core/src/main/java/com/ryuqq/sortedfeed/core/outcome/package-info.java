/**
 * Outcome of check-then-act feed mutations.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sortedfeed.core.outcome.FeedOutcome} - Sealed interface (permits Committed, Missing, Contended)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sortedfeed.core.outcome.Committed} - Transaction committed, notification emitted</li>
 *   <li>{@link com.ryuqq.sortedfeed.core.outcome.Missing} - Anchor or target absent, nothing changed</li>
 *   <li>{@link com.ryuqq.sortedfeed.core.outcome.Contended} - Bounded retry policy exhausted by write conflicts</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SortedFeed Team
 */
package com.ryuqq.sortedfeed.core.outcome;
