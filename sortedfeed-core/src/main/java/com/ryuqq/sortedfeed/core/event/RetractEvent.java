package com.ryuqq.sortedfeed.core.event;

import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedName;

/**
 * 삭제 알림. 본문은 포함하지 않습니다.
 *
 * @param feed 피드 이름
 * @param id 삭제된 아이템 id
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public record RetractEvent(
    FeedName feed,
    FeedId id
) implements FeedEvent {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 인자 중 null이 있는 경우
     */
    public RetractEvent {
        if (feed == null) {
            throw new IllegalArgumentException("feed cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }
}
