package com.ryuqq.publisher.core.model;

import com.ryuqq.publisher.core.error.ErrorCode;

import java.time.Instant;
import java.util.List;

/**
 * 콘텐츠 전달 결과.
 *
 * <p>어댑터/제공자 오류는 예외로 전파되지 않고 {@code error} 문자열로 변환되어
 * 이 결과에 담깁니다. 예약만 된 경우에도 {@code success=true}이지만
 * {@code stage=SCHEDULED}이며 게시 확인이 아닙니다.</p>
 *
 * @param contentId 콘텐츠 ID
 * @param platform 대상 플랫폼
 * @param success 성공 여부
 * @param timestamp 결과 생성 시각
 * @param attempts 게시 시도 횟수 (게시를 시도하지 않았으면 0)
 * @param error 사람이 읽을 수 있는 오류 (null 가능)
 * @param errorCode 오류 분류 (null 가능)
 * @param message 정보성 메시지 (null 가능)
 * @param validationErrors 검증 오류 목록
 * @param platformId 플랫폼 게시물 ID (null 가능)
 * @param publishedUrl 게시 URL (null 가능)
 * @param stage 도달 단계
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public record DeliveryResult(
    String contentId,
    Platform platform,
    boolean success,
    Instant timestamp,
    int attempts,
    String error,
    ErrorCode errorCode,
    String message,
    List<String> validationErrors,
    String platformId,
    String publishedUrl,
    DeliveryStage stage
) {

    public DeliveryResult {
        if (contentId == null || contentId.isBlank()) {
            throw new IllegalArgumentException("contentId cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
    }

    public static DeliveryResult published(ContentPiece piece, int attempts, Instant now) {
        return new DeliveryResult(piece.id(), piece.platform(), true, now, attempts, null, null,
            "Content published", List.of(), piece.platformId(), piece.publishedUrl(), DeliveryStage.PUBLISHED);
    }

    public static DeliveryResult publishFailed(ContentPiece piece, int attempts, ErrorCode errorCode,
                                               String error, Instant now) {
        return new DeliveryResult(piece.id(), piece.platform(), false, now, attempts, error, errorCode,
            null, List.of(), null, null, DeliveryStage.PUBLISH_FAILED);
    }

    public static DeliveryResult validationFailed(ContentPiece piece, List<String> errors, Instant now) {
        return new DeliveryResult(piece.id(), piece.platform(), false, now, 0,
            "Content validation failed: " + String.join(", ", errors), ErrorCode.VALIDATION_FAILED,
            null, errors, null, null, DeliveryStage.VALIDATION_FAILED);
    }

    public static DeliveryResult scheduled(ContentPiece piece, Instant scheduledTime, Instant now) {
        return new DeliveryResult(piece.id(), piece.platform(), true, now, 0, null, null,
            "Content scheduled for delivery at " + scheduledTime, List.of(), null, null, DeliveryStage.SCHEDULED);
    }

    public static DeliveryResult pendingApproval(ContentPiece piece, ApprovalStatus status, Instant now) {
        return new DeliveryResult(piece.id(), piece.platform(), true, now, 0, null, null,
            "Content submitted for approval (status: " + status + ")", List.of(), null, null,
            DeliveryStage.APPROVAL_PENDING);
    }

    public static DeliveryResult dropped(ContentPiece piece, String reason, Instant now) {
        return new DeliveryResult(piece.id(), piece.platform(), false, now, 0, reason, ErrorCode.NOT_APPROVED,
            null, List.of(), null, null, DeliveryStage.DROPPED);
    }

    public static DeliveryResult rejected(ContentPiece piece, ErrorCode errorCode, String error, Instant now) {
        return new DeliveryResult(piece.id(), piece.platform(), false, now, 0, error, errorCode,
            null, List.of(), null, null, DeliveryStage.REJECTED);
    }
}
