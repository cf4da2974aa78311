package com.ryuqq.publisher.adapter.inmemory.store;

import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.spi.EntityStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link EntityStore} SPI.
 *
 * <p>Keeps the latest copy of each content piece keyed by id and counts writes,
 * which tests use to assert that a piece was persisted exactly once.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public class InMemoryEntityStore implements EntityStore {

    private final ConcurrentHashMap<String, ContentPiece> pieces = new ConcurrentHashMap<>();
    private final AtomicInteger saveCount = new AtomicInteger();

    @Override
    public Optional<ContentPiece> findContentPiece(String contentId) {
        if (contentId == null) {
            throw new IllegalArgumentException("contentId cannot be null");
        }
        return Optional.ofNullable(pieces.get(contentId));
    }

    @Override
    public void saveContentPiece(ContentPiece piece) {
        if (piece == null) {
            throw new IllegalArgumentException("piece cannot be null");
        }
        pieces.put(piece.id(), piece);
        saveCount.incrementAndGet();
    }

    public int getSaveCount() {
        return saveCount.get();
    }

    public int size() {
        return pieces.size();
    }
}
