/**
 * 충돌 재시도 정책.
 *
 * <ul>
 *   <li>{@link com.ryuqq.sortedfeed.application.retry.RetryPolicy} - 시도 한도 및 백오프 설정</li>
 *   <li>{@link com.ryuqq.sortedfeed.application.retry.BackoffCalculator} - 지수 백오프 + Jitter 계산</li>
 * </ul>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
package com.ryuqq.sortedfeed.application.retry;
