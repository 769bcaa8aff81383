package com.ryuqq.sortedfeed.core.model;

/**
 * 피드 이름.
 *
 * <p>FeedName은 저장소 키 네임스페이스를 구분하는 데 사용되며,
 * 피드 수명주기(생성/삭제/설정)는 이 모듈의 책임이 아닙니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>공백 문자 불가 (키 구분자 충돌 방지)</li>
 * </ul>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public final class FeedName {

    private final String value;

    private FeedName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("FeedName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("FeedName length cannot exceed 255 characters");
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("FeedName cannot contain whitespace");
        }
        this.value = value;
    }

    /**
     * FeedName 생성.
     *
     * @param value 피드 이름 (예: "news", "queue:orders")
     * @return FeedName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static FeedName of(String value) {
        return new FeedName(value);
    }

    /**
     * 피드 이름 조회.
     *
     * @return 피드 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FeedName feedName = (FeedName) o;
        return value.equals(feedName.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "FeedName{" + value + '}';
    }
}
