package com.ryuqq.sortedfeed.core.model;

/**
 * 피드 아이템 식별자.
 *
 * <p>FeedId는 피드별 카운터에서 발급되는 양의 정수 값이며,
 * 발급 순서대로 엄격하게 증가합니다. 한 번 발급된 값은 재사용되지 않습니다.</p>
 *
 * <p><strong>전순서:</strong> {@link Comparable} 구현으로 발급 순서 비교 가능</p>
 * <p><strong>문자열 표현:</strong> 저장소에는 10진수 문자열로 저장됩니다 ({@link #asString()}).</p>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public final class FeedId implements Comparable<FeedId> {

    private final long value;

    private FeedId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("FeedId must be positive (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * FeedId 생성.
     *
     * @param value 식별자 값 (양수)
     * @return FeedId 인스턴스
     * @throws IllegalArgumentException 값이 양수가 아닌 경우
     */
    public static FeedId of(long value) {
        return new FeedId(value);
    }

    /**
     * 저장소 문자열 표현으로부터 FeedId 복원.
     *
     * @param text 10진수 문자열
     * @return FeedId 인스턴스
     * @throws IllegalArgumentException null이거나 숫자 형식이 아닌 경우
     */
    public static FeedId parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("FeedId text cannot be null or blank");
        }
        try {
            return new FeedId(Long.parseLong(text.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("FeedId text is not a number: " + text, e);
        }
    }

    /**
     * 식별자 값 조회.
     *
     * @return 식별자 값
     */
    public long getValue() {
        return value;
    }

    /**
     * 저장소/와이어 포맷용 10진수 문자열.
     *
     * @return 10진수 문자열
     */
    public String asString() {
        return Long.toString(value);
    }

    @Override
    public int compareTo(FeedId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FeedId feedId = (FeedId) o;
        return value == feedId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "FeedId{" + value + '}';
    }
}
