package com.ryuqq.publisher.core.spi;

import com.ryuqq.publisher.core.model.ContentPiece;

import java.util.Optional;

/**
 * Structured entity store SPI holding the authoritative copy of content pieces.
 *
 * <p>The orchestrator consults it before every publish attempt so that a piece
 * transitions to PUBLISHED at most once.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public interface EntityStore {

    /**
     * @param contentId content piece id
     * @return the stored piece, or empty if unknown
     */
    Optional<ContentPiece> findContentPiece(String contentId);

    /**
     * Inserts or replaces a content piece.
     *
     * @param piece piece to store
     */
    void saveContentPiece(ContentPiece piece);
}
