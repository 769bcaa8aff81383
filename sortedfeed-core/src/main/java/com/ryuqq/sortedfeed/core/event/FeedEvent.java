package com.ryuqq.sortedfeed.core.event;

import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedName;

/**
 * 커밋된 변경에 대한 알림 이벤트.
 *
 * <ul>
 *   <li>{@link PublishEvent}: 새 아이템 게시, 상대 위치 삽입, 본문 수정</li>
 *   <li>{@link RetractEvent}: 아이템 삭제</li>
 * </ul>
 *
 * <p>수정(edit)은 새 게시와 동일한 {@link PublishEvent}로 전달됩니다.
 * 구독자는 이미 알고 있는 id인지 여부로만 둘을 구분할 수 있습니다.</p>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public sealed interface FeedEvent permits PublishEvent, RetractEvent {

    /**
     * 이벤트가 발생한 피드.
     *
     * @return 피드 이름
     */
    FeedName feed();

    /**
     * 대상 아이템 id.
     *
     * @return 아이템 id
     */
    FeedId id();

    /**
     * publish 계열 이벤트인지 확인.
     *
     * @return PublishEvent이면 true
     */
    default boolean isPublish() {
        return this instanceof PublishEvent;
    }

    /**
     * retract 이벤트인지 확인.
     *
     * @return RetractEvent이면 true
     */
    default boolean isRetract() {
        return this instanceof RetractEvent;
    }
}
