package com.ryuqq.sortedfeed.core.outcome;

import com.ryuqq.sortedfeed.core.model.FeedId;

import java.util.Optional;

/**
 * 조건부 변경(check-then-act)의 결과.
 *
 * <p>FeedOutcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Committed}: 트랜잭션이 커밋되고 알림이 발송됨</li>
 *   <li>{@link Missing}: 기준/대상 아이템이 없어 아무것도 하지 않음</li>
 *   <li>{@link Contended}: 재시도 한도 내에 충돌 없이 커밋하지 못함</li>
 * </ul>
 *
 * <p>{@link Missing}은 오류가 아니라 정상 결과입니다. 예외를 던지지 않으며,
 * 상태 변경이나 알림도 발생하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * FeedOutcome outcome = feed.publishAfter(anchor, Content.of("body"));
 * if (outcome instanceof Committed committed) {
 *     render(committed.id());
 * } else if (outcome instanceof Missing missing) {
 *     log.debug("anchor {} is gone", missing.reference());
 * }
 * </pre>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public sealed interface FeedOutcome permits Committed, Missing, Contended {

    /**
     * 커밋되었는지 확인.
     *
     * @return 커밋 여부
     */
    default boolean isCommitted() {
        return this instanceof Committed;
    }

    /**
     * 전제 조건(기준/대상 존재)이 실패했는지 확인.
     *
     * @return 전제 조건 실패 여부
     */
    default boolean isMissing() {
        return this instanceof Missing;
    }

    /**
     * 재시도 한도가 소진되었는지 확인.
     *
     * @return 재시도 한도 소진 여부
     */
    default boolean isContended() {
        return this instanceof Contended;
    }

    /**
     * 커밋된 아이템 id.
     *
     * @return 커밋된 경우 id, 그 외에는 빈 Optional
     */
    default Optional<FeedId> committedId() {
        if (this instanceof Committed committed) {
            return Optional.of(committed.id());
        }
        return Optional.empty();
    }
}
