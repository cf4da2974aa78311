package com.ryuqq.publisher.adapter.inmemory.registry;

import com.ryuqq.publisher.core.error.AdapterUnavailableException;
import com.ryuqq.publisher.core.error.ErrorCode;
import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.model.Platform;
import com.ryuqq.publisher.core.model.PublishResult;
import com.ryuqq.publisher.core.model.ValidationResult;
import com.ryuqq.publisher.core.spi.PlatformAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryAdapterRegistry 테스트.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class InMemoryAdapterRegistryTest {

    private InMemoryAdapterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryAdapterRegistry();
    }

    @Test
    void find_RegisteredAdapter_Returned() {
        // given
        StubAdapter twitter = new StubAdapter(Platform.TWITTER);
        registry.register(twitter);

        // when & then
        assertThat(registry.find(Platform.of("TWITTER"))).containsSame(twitter);
        assertThat(registry.find(Platform.DISCORD)).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void disable_HidesAdapterUntilEnabled() {
        // given
        registry.register(new StubAdapter(Platform.TWITTER));

        // when
        boolean disabled = registry.disable(Platform.TWITTER);

        // then
        assertThat(disabled).isTrue();
        assertThat(registry.find(Platform.TWITTER)).isEmpty();
        assertThat(registry.enabledAdapters()).isEmpty();
        assertThat(registry.registeredPlatforms()).containsExactly(Platform.TWITTER);

        registry.enable(Platform.TWITTER);
        assertThat(registry.find(Platform.TWITTER)).isPresent();
    }

    @Test
    void enabledAdapters_SortedByPlatform() {
        // given
        registry.register(new StubAdapter(Platform.TWITTER));
        registry.register(new StubAdapter(Platform.DISCORD));
        registry.register(new StubAdapter(Platform.MEDIUM));

        // when & then
        assertThat(registry.enabledAdapters())
            .extracting(PlatformAdapter::platform)
            .containsExactly(Platform.DISCORD, Platform.MEDIUM, Platform.TWITTER);
    }

    @Test
    void register_SamePlatform_Replaces() {
        // given
        StubAdapter first = new StubAdapter(Platform.TWITTER);
        StubAdapter second = new StubAdapter(Platform.TWITTER);
        registry.register(first);

        // when
        registry.register(second);

        // then
        assertThat(registry.find(Platform.TWITTER)).containsSame(second);
    }

    @Test
    void disable_UnknownPlatform_ReturnsFalse() {
        assertThat(registry.disable(Platform.MEDIUM)).isFalse();
        assertThat(registry.unregister(Platform.MEDIUM)).isFalse();
    }

    @Test
    void require_DisabledPlatform_ThrowsAdapterUnavailable() {
        // given
        registry.register(new StubAdapter(Platform.TWITTER));
        registry.disable(Platform.TWITTER);

        // when & then
        assertThatThrownBy(() -> registry.require(Platform.TWITTER))
            .isInstanceOf(AdapterUnavailableException.class)
            .hasMessage("No adapter found for platform: twitter")
            .extracting(e -> ((AdapterUnavailableException) e).getErrorCode())
            .isEqualTo(ErrorCode.ADAPTER_UNAVAILABLE);
    }

    @Test
    void register_Null_ThrowsException() {
        assertThatThrownBy(() -> registry.register(null)).isInstanceOf(IllegalArgumentException.class);
    }

    private static final class StubAdapter implements PlatformAdapter {

        private final Platform platform;

        StubAdapter(Platform platform) {
            this.platform = platform;
        }

        @Override
        public Platform platform() {
            return platform;
        }

        @Override
        public ValidationResult validateContent(ContentPiece piece) {
            return ValidationResult.ok();
        }

        @Override
        public ContentPiece formatContent(ContentPiece piece) {
            return piece;
        }

        @Override
        public PublishResult publishContent(ContentPiece piece) {
            return PublishResult.success("id", "url", Instant.EPOCH);
        }

        @Override
        public boolean checkConnection() {
            return true;
        }
    }
}
