package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.core.error.ErrorCode;
import com.ryuqq.publisher.core.error.PublishException;
import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.model.PublishResult;
import com.ryuqq.publisher.core.outcome.Fail;
import com.ryuqq.publisher.core.outcome.Ok;
import com.ryuqq.publisher.core.outcome.Outcome;
import com.ryuqq.publisher.core.outcome.Retry;
import com.ryuqq.publisher.core.spi.PlatformAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 게시 호출 재시도 정책.
 *
 * <p>각 시도를 {@link Outcome}으로 분류합니다:</p>
 * <ul>
 *   <li>성공 → {@link Ok} (즉시 반환)</li>
 *   <li>치명 오류 패턴 또는 {@link PublishException} FATAL → {@link Fail} (즉시 반환, 1회 시도)</li>
 *   <li>그 외 오류 → {@link Retry} (백오프 후 재시도)</li>
 *   <li>시도 횟수 소진 → {@link Fail} (TRANSIENT_PUBLISH, 마지막 오류)</li>
 * </ul>
 *
 * <p>반환값은 항상 {@link Ok} 또는 {@link Fail}입니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class PublishRetrier {

    private static final Logger log = LoggerFactory.getLogger(PublishRetrier.class);

    private final BackoffCalculator backoffCalculator;

    public PublishRetrier() {
        this(new BackoffCalculator());
    }

    public PublishRetrier(BackoffCalculator backoffCalculator) {
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * 재시도 정책 하에 게시.
     *
     * @param adapter 플랫폼 어댑터
     * @param piece 게시할 콘텐츠
     * @param maxAttempts 최대 시도 횟수 (1 이상)
     * @return {@link Ok} 또는 {@link Fail}
     */
    public Outcome publish(PlatformAdapter adapter, ContentPiece piece, int maxAttempts) {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter cannot be null");
        }
        if (piece == null) {
            throw new IllegalArgumentException("piece cannot be null");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }

        String lastError = "Operation failed";
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            log.debug("Publishing {} to {} attempt {}/{}", piece.id(), piece.platform(), attempt, maxAttempts);

            Outcome outcome = attemptOnce(adapter, piece, attempt, maxAttempts);
            if (outcome instanceof Ok || outcome instanceof Fail) {
                return outcome;
            }

            Retry retry = (Retry) outcome;
            lastError = retry.reason();
            log.warn("Publish attempt {}/{} failed for {}: {}", attempt, maxAttempts, piece.id(), lastError);
            if (attempt < maxAttempts) {
                sleep(retry.nextRetryAfterMillis());
            }
        }

        log.error("Publish failed for {} after {} attempts: {}", piece.id(), maxAttempts, lastError);
        return new Fail(ErrorCode.TRANSIENT_PUBLISH, lastError, maxAttempts);
    }

    private Outcome attemptOnce(PlatformAdapter adapter, ContentPiece piece, int attempt, int maxAttempts) {
        String error;
        try {
            PublishResult result = adapter.publishContent(piece);
            if (result != null && result.success()) {
                return new Ok(result, attempt);
            }
            error = result == null || result.error() == null ? "Unknown error" : result.error();
        } catch (PublishException e) {
            if (!e.isTransient()) {
                log.error("Non-retryable publish error for {}: {}", piece.id(), e.getMessage());
                return new Fail(ErrorCode.FATAL_PUBLISH, messageOf(e), attempt);
            }
            error = messageOf(e);
        } catch (RuntimeException e) {
            error = messageOf(e);
        }

        if (NonRetryableErrors.matches(error)) {
            log.error("Non-retryable publish error for {}: {}", piece.id(), error);
            return new Fail(ErrorCode.FATAL_PUBLISH, error, attempt);
        }
        long delay = attempt < maxAttempts ? backoffCalculator.calculate(attempt) : 0L;
        return new Retry(error, attempt, delay);
    }

    private static String messageOf(Exception e) {
        return e.getMessage() == null || e.getMessage().isBlank() ? e.getClass().getSimpleName() : e.getMessage();
    }

    /**
     * Sleep 유틸리티.
     *
     * @param millis 대기 시간 (밀리초)
     */
    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted during publish backoff", e);
        }
    }
}
