package com.ryuqq.publisher.core.statemachine;

import com.ryuqq.publisher.core.model.ApprovalStatus;

/**
 * 승인 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>DRAFT → PENDING (제공자에 제출)</li>
 *   <li>DRAFT → APPROVED (자동 승인)</li>
 *   <li>DRAFT → FAILED (제공자 없음, 제출 오류)</li>
 *   <li>PENDING → APPROVED / REJECTED / FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(APPROVED, REJECTED, FAILED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>같은 상태로의 전이는 변경 없음으로 간주 (PENDING → PENDING 허용)</li>
 * </ul>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class ApprovalTransition {

    private ApprovalTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ApprovalStatus from, ApprovalStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case DRAFT -> to == ApprovalStatus.PENDING || to == ApprovalStatus.APPROVED
                || to == ApprovalStatus.FAILED;
            case PENDING -> to != ApprovalStatus.DRAFT;
            case APPROVED, REJECTED, FAILED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 예외 없이 전이 가능 여부 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     */
    public static boolean isAllowed(ApprovalStatus from, ApprovalStatus to) {
        try {
            validate(from, to);
            return true;
        } catch (IllegalStateException | IllegalArgumentException e) {
            return false;
        }
    }
}
