package com.ryuqq.sortedfeed.core.outcome;

import com.ryuqq.sortedfeed.core.model.FeedId;

/**
 * 재시도 한도 소진.
 *
 * <p>유한한 재시도 정책에서만 발생합니다. 모든 시도가 동시 쓰기 충돌로 중단되었으며,
 * 어떤 변경도 커밋되지 않았습니다.</p>
 *
 * @param reference 변경 대상이던 기준 또는 대상 id
 * @param attempts 수행한 시도 횟수 (1 이상)
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public record Contended(
    FeedId reference,
    int attempts
) implements FeedOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reference가 null이거나 attempts가 양수가 아닌 경우
     */
    public Contended {
        if (reference == null) {
            throw new IllegalArgumentException("reference cannot be null");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }
}
