package com.ryuqq.publisher.core.model;

/**
 * 승인 요청 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * DRAFT ──► PENDING ──► APPROVED
 *   │          ├──────► REJECTED
 *   │          └──────► FAILED
 *   ├──► APPROVED (자동 승인)
 *   └──► FAILED   (승인 제공자 없음)
 * </pre>
 *
 * <p>종료 상태(APPROVED, REJECTED, FAILED)에서는 어떤 상태로도 전이할 수 없습니다.
 * 새로운 승인 주기가 필요하면 새 콘텐츠 ID로 제출해야 합니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 * @see com.ryuqq.publisher.core.statemachine.ApprovalTransition
 */
public enum ApprovalStatus {

    /**
     * 작성 중 (아직 제출 안 됨).
     */
    DRAFT,

    /**
     * 승인 대기 중.
     */
    PENDING,

    /**
     * 승인됨.
     */
    APPROVED,

    /**
     * 거절됨 (만료에 의한 자동 거절 포함).
     */
    REJECTED,

    /**
     * 실패 (승인 제공자 없음, 제출 오류).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return APPROVED, REJECTED, FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == APPROVED || this == REJECTED || this == FAILED;
    }
}
