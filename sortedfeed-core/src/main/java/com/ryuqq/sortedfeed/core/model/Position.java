package com.ryuqq.sortedfeed.core.model;

/**
 * 기준 아이템(anchor)에 대한 삽입 위치.
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public enum Position {

    /**
     * 기준 아이템 바로 앞.
     */
    BEFORE,

    /**
     * 기준 아이템 바로 뒤.
     */
    AFTER
}
