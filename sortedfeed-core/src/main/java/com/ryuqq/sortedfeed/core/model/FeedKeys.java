package com.ryuqq.sortedfeed.core.model;

import java.util.Set;

/**
 * 피드 하나가 사용하는 저장소 키 묶음.
 *
 * <p>기본 명명 규칙({@link #of(FeedName)}):</p>
 * <pre>
 * order           feed.ids:[feed]        순서 리스트
 * items           feed.items:[feed]      id → 본문 해시
 * idCounter       feed.idincr:[feed]     id 발급 카운터
 * publishCounter  feed.publishes:[feed]  publish 카운터
 * publishChannel  feed.publish:[feed]    publish 알림 채널
 * retractChannel  feed.retract:[feed]    retract 알림 채널
 * </pre>
 *
 * <p>다른 명명 규칙이 필요하면 생성자로 직접 지정합니다.</p>
 *
 * @param feed 피드 이름
 * @param order 순서 리스트 키
 * @param items 아이템 해시 키
 * @param idCounter id 카운터 키
 * @param publishCounter publish 카운터 키
 * @param publishChannel publish 채널 이름
 * @param retractChannel retract 채널 이름
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public record FeedKeys(
    FeedName feed,
    String order,
    String items,
    String idCounter,
    String publishCounter,
    String publishChannel,
    String retractChannel
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public FeedKeys {
        if (feed == null) {
            throw new IllegalArgumentException("feed cannot be null");
        }
        requireKey("order", order);
        requireKey("items", items);
        requireKey("idCounter", idCounter);
        requireKey("publishCounter", publishCounter);
        requireKey("publishChannel", publishChannel);
        requireKey("retractChannel", retractChannel);
    }

    /**
     * 기본 명명 규칙으로 키 묶음 생성.
     *
     * @param feed 피드 이름
     * @return FeedKeys 인스턴스
     * @throws IllegalArgumentException feed가 null인 경우
     */
    public static FeedKeys of(FeedName feed) {
        if (feed == null) {
            throw new IllegalArgumentException("feed cannot be null");
        }
        String name = feed.getValue();
        return new FeedKeys(
            feed,
            "feed.ids:" + name,
            "feed.items:" + name,
            "feed.idincr:" + name,
            "feed.publishes:" + name,
            "feed.publish:" + name,
            "feed.retract:" + name
        );
    }

    /**
     * 이 피드가 영속 저장소에 사용하는 키 집합 (채널 제외).
     *
     * @return 키 집합
     */
    public Set<String> schemas() {
        return Set.of(order, items, idCounter, publishCounter);
    }

    private static void requireKey(String role, String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException(role + " key cannot be null or blank");
        }
    }
}
