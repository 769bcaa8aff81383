package com.ryuqq.sortedfeed.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FeedName Value Object 테스트.
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
class FeedNameTest {

    @Test
    void of_ValidValue_CreatesFeedName() {
        // Given
        String value = "news.front-page_v2";

        // When
        FeedName name = FeedName.of(value);

        // Then
        assertEquals(value, name.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> FeedName.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> FeedName.of(""));
        assertThrows(IllegalArgumentException.class, () -> FeedName.of("   "));
    }

    @Test
    void of_Whitespace_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> FeedName.of("front page")
        );
        assertTrue(exception.getMessage().contains("whitespace"));
    }

    @Test
    void of_MaxLength_Accepted() {
        assertEquals(255, FeedName.of("a".repeat(255)).getValue().length());
        assertThrows(IllegalArgumentException.class, () -> FeedName.of("a".repeat(256)));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        assertEquals(FeedName.of("news"), FeedName.of("news"));
        assertNotEquals(FeedName.of("news"), FeedName.of("sports"));
    }
}
