package com.ryuqq.publisher.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * 예약 게시 영속 레코드.
 *
 * <p>{@code contentDelivery/scheduled/<contentId>-<scheduledEpochMs>} 키에 저장되며,
 * 프로세스 재시작 후 캐시만으로 예약을 복구하는 데 필요한 모든 상태를 담습니다.
 * 모든 쓰기는 델타가 아닌 전체 상태를 기록합니다.</p>
 *
 * <p><strong>상태 필드:</strong></p>
 * <ul>
 *   <li>approvalStatus/approvalId/formattedContent: 승인 선행 조회가 끝나면 채워짐</li>
 *   <li>processing/lastProcessed: 승인 왕복 진행 중 표시 (JSON 필드명 {@code isProcessing})</li>
 * </ul>
 *
 * @param contentPiece 예약된 콘텐츠
 * @param options 예약 시 사용된 옵션 (scheduledTime 필수)
 * @param createdAt 생성 시각
 * @param approvalStatus 선행 승인 상태 (null 가능)
 * @param approvalId 선행 승인 요청 ID (null 가능)
 * @param formattedContent 승인된 포맷 콘텐츠 (null 가능)
 * @param processing 승인 왕복 진행 중 여부
 * @param lastProcessed 마지막 처리 시각 (null 가능)
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public record ScheduledDeliveryEntry(
    ContentPiece contentPiece,
    DeliveryOptions options,
    Instant createdAt,
    ApprovalStatus approvalStatus,
    String approvalId,
    ContentPiece formattedContent,
    @JsonProperty("isProcessing") boolean processing,
    Instant lastProcessed
) {

    public ScheduledDeliveryEntry {
        if (contentPiece == null) {
            throw new IllegalArgumentException("contentPiece cannot be null");
        }
        if (options == null || options.scheduledTime() == null) {
            throw new IllegalArgumentException("options.scheduledTime cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    /**
     * 신규 예약 항목 생성.
     *
     * @param contentPiece 콘텐츠
     * @param options 옵션 (scheduledTime 필수)
     * @param createdAt 생성 시각
     * @return 승인 정보가 비어 있는 항목
     */
    public static ScheduledDeliveryEntry create(ContentPiece contentPiece, DeliveryOptions options, Instant createdAt) {
        return new ScheduledDeliveryEntry(contentPiece, options, createdAt, null, null, null, false, null);
    }

    public Instant scheduledTime() {
        return options.scheduledTime();
    }

    /**
     * 캐시 만료 시각 ({@code scheduledTime + grace}).
     *
     * @param graceMs 유예 기간 (밀리초)
     * @return epoch millis
     */
    public long expiresAtEpochMs(long graceMs) {
        return options.scheduledTime().toEpochMilli() + graceMs;
    }

    /**
     * 진행 중 표시 설정.
     *
     * @param now 현재 시각
     * @return processing=true, lastProcessed=now인 새 항목
     */
    public ScheduledDeliveryEntry markProcessing(Instant now) {
        return new ScheduledDeliveryEntry(contentPiece, options, createdAt, approvalStatus, approvalId,
            formattedContent, true, now);
    }

    /**
     * 진행 중 표시 해제.
     *
     * @param now 현재 시각 (null이면 lastProcessed 유지)
     * @return processing=false인 새 항목
     */
    public ScheduledDeliveryEntry clearProcessing(Instant now) {
        return new ScheduledDeliveryEntry(contentPiece, options, createdAt, approvalStatus, approvalId,
            formattedContent, false, now != null ? now : lastProcessed);
    }

    /**
     * 승인 결과 기록.
     *
     * @param status 승인 상태
     * @param approvalId 승인 요청 ID
     * @param approvedContent 승인된 콘텐츠
     * @return 승인 정보가 채워지고 processing=false인 새 항목
     */
    public ScheduledDeliveryEntry withApproval(ApprovalStatus status, String approvalId, ContentPiece approvedContent) {
        return new ScheduledDeliveryEntry(contentPiece, options, createdAt, status, approvalId,
            approvedContent, false, lastProcessed);
    }
}
