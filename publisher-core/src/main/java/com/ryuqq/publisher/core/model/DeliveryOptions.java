package com.ryuqq.publisher.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 콘텐츠 전달 옵션.
 *
 * <p>모든 필드는 null 허용이며, null은 "기본값 사용"을 의미합니다.
 * {@link #mergedOver(DeliveryOptions)}로 기본값 위에 호출자 옵션을 겹쳐
 * 실효 옵션을 만듭니다.</p>
 *
 * <p><strong>기본값 ({@link #defaults()}):</strong></p>
 * <ul>
 *   <li>retry = true</li>
 *   <li>maxRetries = 3</li>
 *   <li>validateBeforePublish = true</li>
 *   <li>skipApproval = false</li>
 *   <li>approvalOffsetMs = 3시간</li>
 * </ul>
 *
 * @param retry 게시 재시도 여부
 * @param maxRetries 최대 시도 횟수 (1 이상)
 * @param validateBeforePublish 게시 전 검증 여부
 * @param skipApproval 승인 단계 생략 여부
 * @param approvalOffsetMs 예약 게시 전 승인 선행 시간 (밀리초, 0 이상)
 * @param scheduledTime 예약 게시 시각 (null이면 즉시)
 * @param formatOptions 플랫폼 포맷 옵션
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public record DeliveryOptions(
    Boolean retry,
    Integer maxRetries,
    Boolean validateBeforePublish,
    Boolean skipApproval,
    Long approvalOffsetMs,
    Instant scheduledTime,
    Map<String, Object> formatOptions
) {

    public static final long DEFAULT_APPROVAL_OFFSET_MS = Duration.ofHours(3).toMillis();

    public DeliveryOptions {
        if (maxRetries != null && maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be positive (current: " + maxRetries + ")");
        }
        if (approvalOffsetMs != null && approvalOffsetMs < 0) {
            throw new IllegalArgumentException(
                "approvalOffsetMs must be non-negative (current: " + approvalOffsetMs + ")"
            );
        }
        formatOptions = formatOptions == null ? null : Map.copyOf(formatOptions);
    }

    /**
     * 모든 필드가 비어 있는 옵션.
     *
     * @return 빈 옵션
     */
    public static DeliveryOptions empty() {
        return new DeliveryOptions(null, null, null, null, null, null, null);
    }

    /**
     * 기본 옵션.
     *
     * @return 기본값이 채워진 옵션
     */
    public static DeliveryOptions defaults() {
        return new DeliveryOptions(true, 3, true, false, DEFAULT_APPROVAL_OFFSET_MS, null, Map.of());
    }

    /**
     * 기본값 위에 이 옵션을 병합.
     *
     * <p>이 옵션의 null이 아닌 필드가 우선합니다.</p>
     *
     * @param base 기본 옵션
     * @return 병합된 옵션
     */
    public DeliveryOptions mergedOver(DeliveryOptions base) {
        if (base == null) {
            throw new IllegalArgumentException("base cannot be null");
        }
        return new DeliveryOptions(
            retry != null ? retry : base.retry,
            maxRetries != null ? maxRetries : base.maxRetries,
            validateBeforePublish != null ? validateBeforePublish : base.validateBeforePublish,
            skipApproval != null ? skipApproval : base.skipApproval,
            approvalOffsetMs != null ? approvalOffsetMs : base.approvalOffsetMs,
            scheduledTime != null ? scheduledTime : base.scheduledTime,
            formatOptions != null ? formatOptions : base.formatOptions
        );
    }

    /**
     * 실제 게시 시도 횟수 상한.
     *
     * <p>retry=false이면 1, 그 외에는 maxRetries (미설정 시 3).</p>
     *
     * @return 시도 횟수 상한
     */
    public int attemptLimit() {
        if (Boolean.FALSE.equals(retry)) {
            return 1;
        }
        return maxRetries != null ? maxRetries : 3;
    }

    public boolean shouldValidate() {
        return !Boolean.FALSE.equals(validateBeforePublish);
    }

    public boolean shouldSkipApproval() {
        return Boolean.TRUE.equals(skipApproval);
    }

    public long approvalOffsetOrZero() {
        return approvalOffsetMs != null ? approvalOffsetMs : 0L;
    }

    public DeliveryOptions withRetry(Boolean retry) {
        return new DeliveryOptions(retry, maxRetries, validateBeforePublish, skipApproval, approvalOffsetMs,
            scheduledTime, formatOptions);
    }

    public DeliveryOptions withMaxRetries(Integer maxRetries) {
        return new DeliveryOptions(retry, maxRetries, validateBeforePublish, skipApproval, approvalOffsetMs,
            scheduledTime, formatOptions);
    }

    public DeliveryOptions withValidateBeforePublish(Boolean validateBeforePublish) {
        return new DeliveryOptions(retry, maxRetries, validateBeforePublish, skipApproval, approvalOffsetMs,
            scheduledTime, formatOptions);
    }

    public DeliveryOptions withSkipApproval(Boolean skipApproval) {
        return new DeliveryOptions(retry, maxRetries, validateBeforePublish, skipApproval, approvalOffsetMs,
            scheduledTime, formatOptions);
    }

    public DeliveryOptions withApprovalOffsetMs(Long approvalOffsetMs) {
        return new DeliveryOptions(retry, maxRetries, validateBeforePublish, skipApproval, approvalOffsetMs,
            scheduledTime, formatOptions);
    }

    public DeliveryOptions withScheduledTime(Instant scheduledTime) {
        return new DeliveryOptions(retry, maxRetries, validateBeforePublish, skipApproval, approvalOffsetMs,
            scheduledTime, formatOptions);
    }
}
