package com.ryuqq.sortedfeed.application.retry;

/**
 * 조건부 변경의 충돌 재시도 정책 (불변 record).
 *
 * <p>동시 쓰기 충돌(watch 위반)로 커밋이 중단되었을 때 재시도 횟수와 대기 간격을 제어합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최대 시도 횟수, 0이면 무제한 (기본 0)</li>
 *   <li>baseDelayMs: 첫 재시도 전 대기 시간, 0이면 즉시 재시도 (기본 1ms)</li>
 *   <li>maxDelayMs: 대기 시간 상한 (기본 100ms)</li>
 *   <li>jitterFactor: Jitter 비율 0.0 ~ 1.0 (기본 0.5)</li>
 * </ul>
 *
 * <p>기본값은 무제한 재시도이므로 "성공하거나 전제 조건 실패를 보고한다"는 계약이 유지됩니다.
 * maxAttempts를 지정하면 한도 소진 시 {@code Contended} 결과가 반환됩니다.</p>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (0 = 무제한, 음수 불가)
 * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
 * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record RetryPolicy(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * 무제한 재시도를 나타내는 maxAttempts 값.
     */
    public static final int UNBOUNDED = 0;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=0 (무제한), baseDelayMs=1, maxDelayMs=100, jitterFactor=0.5</p>
     */
    public RetryPolicy() {
        this(UNBOUNDED, 1, 100, 0.5);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be non-negative (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be non-negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * 기본 백오프를 사용하는 무제한 재시도 정책.
     *
     * @return RetryPolicy 인스턴스
     */
    public static RetryPolicy unbounded() {
        return new RetryPolicy();
    }

    /**
     * 기본 백오프를 사용하는 유한 재시도 정책.
     *
     * @param maxAttempts 최대 시도 횟수 (1 이상)
     * @return RetryPolicy 인스턴스
     * @throws IllegalArgumentException maxAttempts가 양수가 아닌 경우
     */
    public static RetryPolicy bounded(int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        return new RetryPolicy().withMaxAttempts(maxAttempts);
    }

    /**
     * 대기 없이 즉시 재시도하는 무제한 정책.
     *
     * @return RetryPolicy 인스턴스
     */
    public static RetryPolicy immediate() {
        return new RetryPolicy(UNBOUNDED, 0, 0, 0.0);
    }

    /**
     * 무제한 재시도인지 확인.
     *
     * @return maxAttempts가 0이면 true
     */
    public boolean isUnbounded() {
        return maxAttempts == UNBOUNDED;
    }

    /**
     * 주어진 시도 횟수 이후 더 이상 재시도할 수 없는지 확인.
     *
     * @param attempts 지금까지 수행한 시도 횟수
     * @return 한도에 도달했으면 true
     */
    public boolean isExhausted(int attempts) {
        return !isUnbounded() && attempts >= maxAttempts;
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * baseDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withBaseDelayMs(long baseDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxDelayMs(long maxDelayMs) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }
}
