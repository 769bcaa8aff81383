package com.ryuqq.sortedfeed.core.outcome;

import com.ryuqq.sortedfeed.core.model.FeedId;

/**
 * 커밋 성공.
 *
 * <p>삽입(publishBefore/publishAfter)은 새로 발급된 id를,
 * 수정/삭제(edit/retract)는 대상 id를 담습니다.</p>
 *
 * @param id 커밋된 아이템 id
 * @param attempts 커밋까지 걸린 시도 횟수 (1 이상)
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public record Committed(
    FeedId id,
    int attempts
) implements FeedOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null이거나 attempts가 양수가 아닌 경우
     */
    public Committed {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }

    /**
     * 첫 시도에 커밋된 결과 생성.
     *
     * @param id 커밋된 아이템 id
     * @return Committed 인스턴스
     */
    public static Committed of(FeedId id) {
        return new Committed(id, 1);
    }
}
