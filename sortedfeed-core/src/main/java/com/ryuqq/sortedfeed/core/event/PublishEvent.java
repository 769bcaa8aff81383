package com.ryuqq.sortedfeed.core.event;

import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedName;

/**
 * 게시(또는 수정) 알림.
 *
 * @param feed 피드 이름
 * @param id 아이템 id
 * @param content 게시된 본문
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public record PublishEvent(
    FeedName feed,
    FeedId id,
    Content content
) implements FeedEvent {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 인자 중 null이 있는 경우
     */
    public PublishEvent {
        if (feed == null) {
            throw new IllegalArgumentException("feed cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
    }
}
