package com.ryuqq.publisher.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ContentPiece 테스트.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class ContentPieceTest {

    @Test
    void of_MinimalFields_ReadyWithEmptyLists() {
        // When
        ContentPiece piece = ContentPiece.of("c1", Platform.TWITTER, "hello");

        // Then
        assertEquals(ContentStatus.READY, piece.status());
        assertTrue(piece.keywords().isEmpty());
        assertNull(piece.platformId());
    }

    @Test
    void constructor_MissingId_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> ContentPiece.of(" ", Platform.TWITTER, "hello"));
    }

    @Test
    void constructor_ListsAreCopied() {
        // Given
        List<String> keywords = new ArrayList<>(List.of("java"));

        // When
        ContentPiece piece = new ContentPiece("c1", "topic", "post", Platform.TWITTER, null, null, keywords,
            null, null, ContentStatus.DRAFT, "body", null, null, null);
        keywords.add("mutated");

        // Then
        assertEquals(List.of("java"), piece.keywords());
        assertThrows(UnsupportedOperationException.class, () -> piece.keywords().add("x"));
    }

    @Test
    void markPublished_SetsStatusAndPlatformFields() {
        // Given
        ContentPiece piece = ContentPiece.of("c1", Platform.TWITTER, "hello").withFormattedContent("hello!");

        // When
        ContentPiece published = piece.markPublished("tw-1", "https://x/1");

        // Then
        assertEquals(ContentStatus.PUBLISHED, published.status());
        assertEquals("tw-1", published.platformId());
        assertEquals("https://x/1", published.publishedUrl());
        assertEquals("hello!", published.formattedContent());
        assertEquals(ContentStatus.READY, piece.status(), "Original should be unchanged");
    }

    @Test
    void withPlatform_KeepsOtherFields() {
        // Given
        ContentPiece piece = ContentPiece.of("c1", Platform.TWITTER, "hello");

        // When
        ContentPiece moved = piece.withPlatform(Platform.DISCORD);

        // Then
        assertEquals(Platform.DISCORD, moved.platform());
        assertEquals("c1", moved.id());
        assertEquals("hello", moved.generatedContent());
    }

    @Test
    void forPlatform_DerivesPlatformScopedId() {
        // Given
        ContentPiece piece = ContentPiece.of("c1", Platform.TWITTER, "hello");

        // When
        ContentPiece copy = piece.forPlatform(Platform.DISCORD);

        // Then
        assertEquals("c1-discord", copy.id());
        assertEquals(Platform.DISCORD, copy.platform());
        assertEquals("hello", copy.generatedContent());
        assertThrows(IllegalArgumentException.class, () -> piece.forPlatform(null));
    }
}
