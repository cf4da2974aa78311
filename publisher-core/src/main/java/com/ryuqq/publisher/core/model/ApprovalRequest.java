package com.ryuqq.publisher.core.model;

import java.time.Instant;

/**
 * 승인 가능한 페이로드를 감싸는 승인 요청 봉투.
 *
 * <p>요청 ID는 콘텐츠 ID로부터 결정적으로 파생되므로({@link #idFor(String)}),
 * 같은 콘텐츠를 다시 제출하면 캐시에 저장된 진행 중 요청이 반환됩니다.</p>
 *
 * <p>Approval Coordinator만 생성하고 변경합니다. 종료 상태가 되면 활성 집합에서
 * 제거되지만, 콘텐츠 범위 캐시 키로는 계속 조회할 수 있습니다.</p>
 *
 * @param id 요청 ID ({@code <contentId>-approval})
 * @param content 승인 대상 페이로드
 * @param providerName 해석된 승인 제공자 이름
 * @param contentType 페이로드 종류 (contentPiece, plan)
 * @param requesterId 요청자 ID
 * @param timestamp 생성 시각
 * @param status 승인 상태
 * @param comments 검토 의견 (null 가능)
 * @param approverId 승인자 ID (null 가능)
 * @param platformId 제공자 측 상관 ID (예: 채팅 메시지 ID, null 가능)
 * @param continuation 상태 변경 시 실행할 후속 작업 (null 가능)
 * @param <T> 페이로드 타입
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public record ApprovalRequest<T extends Approvable>(
    String id,
    T content,
    String providerName,
    String contentType,
    String requesterId,
    Instant timestamp,
    ApprovalStatus status,
    String comments,
    String approverId,
    String platformId,
    Continuation continuation
) {

    public static final String ID_SUFFIX = "-approval";

    public static final String CONTENT_TYPE_CONTENT_PIECE = "contentPiece";
    public static final String CONTENT_TYPE_PLAN = "plan";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 누락된 경우
     */
    public ApprovalRequest {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }

    /**
     * 콘텐츠 ID로부터 승인 요청 ID 파생.
     *
     * @param contentId 콘텐츠 ID
     * @return {@code <contentId>-approval}
     */
    public static String idFor(String contentId) {
        if (contentId == null || contentId.isBlank()) {
            throw new IllegalArgumentException("contentId cannot be null or blank");
        }
        return contentId + ID_SUFFIX;
    }

    /**
     * 페이로드 종류 판별.
     *
     * @param content 페이로드
     * @return contentPiece 또는 plan
     */
    public static String contentTypeOf(Approvable content) {
        return content instanceof ContentPiece ? CONTENT_TYPE_CONTENT_PIECE : CONTENT_TYPE_PLAN;
    }

    /**
     * 새 승인 요청 생성.
     *
     * @param content 페이로드
     * @param providerName 제공자 이름
     * @param requesterId 요청자 ID
     * @param timestamp 생성 시각
     * @param status 초기 상태
     * @param continuation 후속 작업
     * @param <T> 페이로드 타입
     * @return ApprovalRequest 인스턴스
     */
    public static <T extends Approvable> ApprovalRequest<T> create(
        T content,
        String providerName,
        String requesterId,
        Instant timestamp,
        ApprovalStatus status,
        Continuation continuation
    ) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        return new ApprovalRequest<>(
            idFor(content.id()), content, providerName, contentTypeOf(content), requesterId,
            timestamp, status, null, null, null, continuation
        );
    }

    public ApprovalRequest<T> withStatus(ApprovalStatus status) {
        return new ApprovalRequest<>(id, content, providerName, contentType, requesterId, timestamp,
            status, comments, approverId, platformId, continuation);
    }

    public ApprovalRequest<T> withComments(String comments) {
        return new ApprovalRequest<>(id, content, providerName, contentType, requesterId, timestamp,
            status, comments, approverId, platformId, continuation);
    }

    public ApprovalRequest<T> withApproverId(String approverId) {
        return new ApprovalRequest<>(id, content, providerName, contentType, requesterId, timestamp,
            status, comments, approverId, platformId, continuation);
    }

    public ApprovalRequest<T> withPlatformId(String platformId) {
        return new ApprovalRequest<>(id, content, providerName, contentType, requesterId, timestamp,
            status, comments, approverId, platformId, continuation);
    }

    public ApprovalRequest<T> withContinuation(Continuation continuation) {
        return new ApprovalRequest<>(id, content, providerName, contentType, requesterId, timestamp,
            status, comments, approverId, platformId, continuation);
    }

    public ApprovalRequest<T> withContent(T content) {
        return new ApprovalRequest<>(id, content, providerName, contentType, requesterId, timestamp,
            status, comments, approverId, platformId, continuation);
    }
}
