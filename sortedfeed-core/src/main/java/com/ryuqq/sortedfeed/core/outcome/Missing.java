package com.ryuqq.sortedfeed.core.outcome;

import com.ryuqq.sortedfeed.core.model.FeedId;

/**
 * 전제 조건 실패 (기준 또는 대상 아이템 없음).
 *
 * <p>트랜잭션을 시도하지 않았고 알림도 발송되지 않았습니다.
 * 삽입의 경우 미리 발급된 id는 버려지며, id 시퀀스에 영구적인 공백이 남습니다.</p>
 *
 * @param reference 존재하지 않았던 기준(anchor) 또는 대상 id
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public record Missing(
    FeedId reference
) implements FeedOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reference가 null인 경우
     */
    public Missing {
        if (reference == null) {
            throw new IllegalArgumentException("reference cannot be null");
        }
    }
}
