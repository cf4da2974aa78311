package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.core.error.ErrorCode;
import com.ryuqq.publisher.core.error.PublishException;
import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.model.Platform;
import com.ryuqq.publisher.core.model.PublishResult;
import com.ryuqq.publisher.core.outcome.Fail;
import com.ryuqq.publisher.core.outcome.Ok;
import com.ryuqq.publisher.core.outcome.Outcome;
import com.ryuqq.publisher.core.spi.PlatformAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PublishRetrier 유닛 테스트.
 *
 * <p>재시도 횟수 상한과 영구 오류 즉시 중단을 검증합니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class PublishRetrierTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    private PlatformAdapter adapter;

    private PublishRetrier retrier;
    private ContentPiece piece;

    @BeforeEach
    void setUp() {
        retrier = new PublishRetrier(new BackoffCalculator(1, 1, 0.0));
        piece = ContentPiece.of("c1", Platform.TWITTER, "hello");
    }

    @Test
    void publish_첫_시도에_성공하면_Ok_반환() {
        // given
        PublishResult success = PublishResult.success("tw-1", "https://x/tw-1", NOW);
        when(adapter.publishContent(piece)).thenReturn(success);

        // when
        Outcome outcome = retrier.publish(adapter, piece, 3);

        // then
        assertThat(outcome).isInstanceOf(Ok.class);
        Ok ok = (Ok) outcome;
        assertThat(ok.result()).isEqualTo(success);
        assertThat(ok.attemptCount()).isEqualTo(1);
    }

    @Test
    void publish_일시적_실패_후_성공하면_재시도_횟수만큼_호출됨() {
        // given
        when(adapter.publishContent(piece))
            .thenReturn(PublishResult.failure("timeout", NOW))
            .thenThrow(new RuntimeException("connection reset"))
            .thenReturn(PublishResult.success("tw-1", "https://x/tw-1", NOW));

        // when
        Outcome outcome = retrier.publish(adapter, piece, 3);

        // then
        assertThat(outcome).isInstanceOf(Ok.class);
        assertThat(((Ok) outcome).attemptCount()).isEqualTo(3);
        verify(adapter, times(3)).publishContent(piece);
    }

    @Test
    void publish_모든_시도가_실패하면_마지막_오류로_Fail_반환() {
        // given
        when(adapter.publishContent(piece))
            .thenReturn(PublishResult.failure("timeout 1", NOW))
            .thenReturn(PublishResult.failure("timeout 2", NOW));

        // when
        Outcome outcome = retrier.publish(adapter, piece, 2);

        // then
        assertThat(outcome).isInstanceOf(Fail.class);
        Fail fail = (Fail) outcome;
        assertThat(fail.errorCode()).isEqualTo(ErrorCode.TRANSIENT_PUBLISH);
        assertThat(fail.message()).isEqualTo("timeout 2");
        assertThat(fail.attemptCount()).isEqualTo(2);
        verify(adapter, times(2)).publishContent(piece);
    }

    @Test
    void publish_영구_오류_메시지면_즉시_중단함() {
        // given
        when(adapter.publishContent(piece)).thenReturn(PublishResult.failure("Authentication failed", NOW));

        // when
        Outcome outcome = retrier.publish(adapter, piece, 5);

        // then
        assertThat(outcome).isInstanceOf(Fail.class);
        assertThat(((Fail) outcome).errorCode()).isEqualTo(ErrorCode.FATAL_PUBLISH);
        verify(adapter, times(1)).publishContent(piece);
    }

    @Test
    void publish_영구_PublishException이면_즉시_중단함() {
        // given
        when(adapter.publishContent(piece)).thenThrow(PublishException.fatal("content rejected"));

        // when
        Outcome outcome = retrier.publish(adapter, piece, 5);

        // then
        assertThat(outcome).isInstanceOf(Fail.class);
        assertThat(((Fail) outcome).message()).isEqualTo("content rejected");
        verify(adapter, times(1)).publishContent(piece);
    }

    @Test
    void publish_결과가_null이면_Unknown_error로_재시도함() {
        // given
        when(adapter.publishContent(piece)).thenReturn(null);

        // when
        Outcome outcome = retrier.publish(adapter, piece, 2);

        // then
        assertThat(((Fail) outcome).message()).isEqualTo("Unknown error");
        verify(adapter, times(2)).publishContent(piece);
    }

    @Test
    void publish_maxAttempts가_0이면_예외() {
        assertThatThrownBy(() -> retrier.publish(adapter, piece, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxAttempts must be positive");
    }
}
