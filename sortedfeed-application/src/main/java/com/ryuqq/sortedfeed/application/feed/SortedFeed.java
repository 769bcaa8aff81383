package com.ryuqq.sortedfeed.application.feed;

import com.ryuqq.sortedfeed.core.model.Content;
import com.ryuqq.sortedfeed.core.model.FeedId;
import com.ryuqq.sortedfeed.core.model.FeedKeys;
import com.ryuqq.sortedfeed.core.model.FeedName;
import com.ryuqq.sortedfeed.core.outcome.FeedOutcome;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 수동 정렬 피드.
 *
 * <p>아이템의 순서는 시간이나 정렬 키가 아니라 호출자가 명시적으로 지정합니다
 * (append, prepend, 특정 아이템 앞/뒤 삽입). 커밋된 모든 변경은 알림으로 전파됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * FeedId a = feed.publish(Content.of("a"));                 // [a]
 * FeedId b = feed.publish(Content.of("b"));                 // [a, b]
 * FeedOutcome c = feed.publishBefore(b, Content.of("c"));   // [a, c, b]
 *
 * feed.retract(c.committedId().orElseThrow());              // [a, b]
 * feed.edit(FeedId.of(999), Content.of("z")).isMissing();   // true, 변경 없음
 * </pre>
 *
 * <p><strong>원자성:</strong> 각 변경은 순서 리스트, 아이템 맵, 카운터를 하나의 트랜잭션으로
 * 커밋합니다. 조회 메서드 두 개를 연달아 호출한 결과는 서로 일관되지 않을 수 있습니다.</p>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public interface SortedFeed {

    /**
     * 피드 끝에 아이템 추가.
     *
     * @param content 본문
     * @return 새로 발급된 id
     * @throws IllegalArgumentException content가 null인 경우
     * @throws com.ryuqq.sortedfeed.core.spi.FeedStoreException 저장소 장애 시
     */
    FeedId publish(Content content);

    /**
     * 피드 끝에 아이템 추가 ({@link #publish(Content)}와 동일).
     *
     * @param content 본문
     * @return 새로 발급된 id
     */
    default FeedId append(Content content) {
        return publish(content);
    }

    /**
     * 피드 맨 앞에 아이템 추가.
     *
     * @param content 본문
     * @return 새로 발급된 id
     * @throws IllegalArgumentException content가 null인 경우
     * @throws com.ryuqq.sortedfeed.core.spi.FeedStoreException 저장소 장애 시
     */
    FeedId prepend(Content content);

    /**
     * 기존 아이템 바로 앞에 삽입.
     *
     * <p>id는 기준 아이템 존재 확인 전에 발급됩니다. 기준 아이템이 없으면
     * 발급된 id는 버려지고 {@code Missing}이 반환됩니다.</p>
     *
     * @param anchor 기준 아이템 id
     * @param content 본문
     * @return Committed(새 id), Missing(anchor), 또는 Contended
     * @throws IllegalArgumentException 인자 중 null이 있는 경우
     * @throws com.ryuqq.sortedfeed.core.spi.FeedStoreException 저장소 장애 시
     */
    FeedOutcome publishBefore(FeedId anchor, Content content);

    /**
     * 기존 아이템 바로 뒤에 삽입.
     *
     * @param anchor 기준 아이템 id
     * @param content 본문
     * @return Committed(새 id), Missing(anchor), 또는 Contended
     * @throws IllegalArgumentException 인자 중 null이 있는 경우
     * @throws com.ryuqq.sortedfeed.core.spi.FeedStoreException 저장소 장애 시
     * @see #publishBefore(FeedId, Content)
     */
    FeedOutcome publishAfter(FeedId anchor, Content content);

    /**
     * 아이템 본문을 제자리에서 수정.
     *
     * <p>알림은 새 게시와 동일한 형태의 publish 이벤트로 발송됩니다.</p>
     *
     * @param id 대상 아이템 id
     * @param content 새 본문
     * @return Committed(id), Missing(id), 또는 Contended
     * @throws IllegalArgumentException 인자 중 null이 있는 경우
     * @throws com.ryuqq.sortedfeed.core.spi.FeedStoreException 저장소 장애 시
     */
    FeedOutcome edit(FeedId id, Content content);

    /**
     * 아이템 삭제.
     *
     * @param id 대상 아이템 id
     * @return Committed(id), Missing(id), 또는 Contended
     * @throws IllegalArgumentException id가 null인 경우
     * @throws com.ryuqq.sortedfeed.core.spi.FeedStoreException 저장소 장애 시
     */
    FeedOutcome retract(FeedId id);

    /**
     * 현재 순서대로 id 목록 조회 (스냅샷).
     *
     * @return id 목록
     */
    List<FeedId> getIds();

    /**
     * 아이템 하나 조회.
     *
     * @param id 아이템 id
     * @return 본문, 없으면 빈 Optional
     */
    Optional<Content> getItem(FeedId id);

    /**
     * 모든 아이템 조회 (스냅샷, id 오름차순).
     *
     * @return id → 본문
     */
    Map<FeedId, Content> getItems();

    /**
     * 아이템 개수.
     *
     * @return 아이템 개수
     */
    long size();

    /**
     * 피드 이름.
     *
     * @return 피드 이름
     */
    default FeedName name() {
        return keys().feed();
    }

    /**
     * 이 피드가 사용하는 저장소 키.
     *
     * @return 키 묶음
     */
    FeedKeys keys();

    /**
     * 이 피드가 영속 저장소에 사용하는 키 집합.
     *
     * @return 키 집합
     */
    default Set<String> schemas() {
        return keys().schemas();
    }
}
