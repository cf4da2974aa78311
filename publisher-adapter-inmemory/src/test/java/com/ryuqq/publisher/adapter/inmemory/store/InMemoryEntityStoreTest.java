package com.ryuqq.publisher.adapter.inmemory.store;

import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.model.Platform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryEntityStore 테스트.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class InMemoryEntityStoreTest {

    private InMemoryEntityStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
    }

    @Test
    void save_ThenFind_ReturnsLatestVersion() {
        // given
        ContentPiece draft = ContentPiece.of("c1", Platform.TWITTER, "hello");
        store.saveContentPiece(draft);

        // when
        ContentPiece updated = ContentPiece.of("c1", Platform.TWITTER, "hello again");
        store.saveContentPiece(updated);

        // then
        assertThat(store.findContentPiece("c1")).contains(updated);
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.getSaveCount()).isEqualTo(2);
    }

    @Test
    void find_Unknown_ReturnsEmpty() {
        assertThat(store.findContentPiece("missing")).isEmpty();
    }

    @Test
    void find_NullId_ThrowsException() {
        assertThatThrownBy(() -> store.findContentPiece(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("contentId cannot be null");
    }
}
