package com.ryuqq.sortedfeed.application.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>충돌 재시도 간격을 지수적으로 증가시키되, Jitter를 추가하여
 * 같은 키를 두고 경쟁하는 writer들이 동시에 다시 충돌하지 않도록 분산합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attemptCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1ms, maxDelay=100ms, jitterFactor=0.5):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 1ms + jitter(0-0.5ms)</li>
 *   <li>attemptCount=4: 8ms + jitter(0-4ms) = 8-12ms</li>
 *   <li>attemptCount=8: 128ms (capped at maxDelay=100ms)</li>
 * </ul>
 *
 * <p>baseDelay가 0이면 항상 0을 반환합니다 (즉시 재시도).</p>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    /**
     * 2^30 이상으로는 증가시키지 않습니다.
     */
    private static final int MAX_SHIFT = 30;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 재시도 정책으로부터 생성.
     *
     * @param policy 재시도 정책
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public BackoffCalculator(RetryPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.baseDelayMs = policy.baseDelayMs();
        this.maxDelayMs = policy.maxDelayMs();
        this.jitterFactor = policy.jitterFactor();
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 실패한 시도 횟수 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }
        if (baseDelayMs == 0) {
            return 0;
        }

        // 1. 지수적 백오프 (곱셈 전에 maxDelayMs와 비교하여 overflow 방지)
        int shift = Math.min(attemptCount - 1, MAX_SHIFT);
        long exponential = baseDelayMs > (maxDelayMs >> shift)
            ? maxDelayMs
            : Math.min(baseDelayMs << shift, maxDelayMs);

        // 2. Jitter 추가 (0 ~ exponential * jitterFactor)
        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());

        // 3. 최대값 제한 (exponential <= maxDelayMs 이므로 뺄셈은 안전)
        return jitter > maxDelayMs - exponential ? maxDelayMs : exponential + jitter;
    }

    /**
     * 기본 지연 시간 조회.
     *
     * @return 기본 지연 시간 (밀리초)
     */
    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    /**
     * 최대 지연 시간 조회.
     *
     * @return 최대 지연 시간 (밀리초)
     */
    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Jitter 비율 조회.
     *
     * @return Jitter 비율 (0.0 ~ 1.0)
     */
    public double getJitterFactor() {
        return jitterFactor;
    }
}
