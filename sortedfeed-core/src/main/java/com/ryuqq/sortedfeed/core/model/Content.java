package com.ryuqq.sortedfeed.core.model;

/**
 * 피드 아이템 본문.
 *
 * <p>본문은 불투명한 문자열이며, 직렬화 형식(JSON, XML 등)은 사용자가 선택합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 불가 (빈 문자열은 허용)</li>
 * </ul>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public final class Content {

    private final String value;

    private Content(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Content cannot be null");
        }
        this.value = value;
    }

    /**
     * Content 생성.
     *
     * @param value 본문 (빈 문자열 허용)
     * @return Content 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Content of(String value) {
        return new Content(value);
    }

    /**
     * 빈 Content 생성.
     *
     * @return 빈 Content 인스턴스
     */
    public static Content empty() {
        return new Content("");
    }

    /**
     * 본문 조회.
     *
     * @return 본문
     */
    public String getValue() {
        return value;
    }

    /**
     * 본문이 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Content content = (Content) o;
        return value.equals(content.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Content{" + value.length() + " chars}";
    }
}
