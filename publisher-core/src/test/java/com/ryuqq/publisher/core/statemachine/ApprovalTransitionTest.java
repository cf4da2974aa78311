package com.ryuqq.publisher.core.statemachine;

import com.ryuqq.publisher.core.model.ApprovalStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ApprovalTransition 상태 전이 규칙 테스트.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class ApprovalTransitionTest {

    @Test
    void validate_DraftToPending_Allowed() {
        assertDoesNotThrow(() -> ApprovalTransition.validate(ApprovalStatus.DRAFT, ApprovalStatus.PENDING));
    }

    @Test
    void validate_PendingToTerminal_Allowed() {
        assertTrue(ApprovalTransition.isAllowed(ApprovalStatus.PENDING, ApprovalStatus.APPROVED));
        assertTrue(ApprovalTransition.isAllowed(ApprovalStatus.PENDING, ApprovalStatus.REJECTED));
        assertTrue(ApprovalTransition.isAllowed(ApprovalStatus.PENDING, ApprovalStatus.FAILED));
    }

    @Test
    void validate_PendingToDraft_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> ApprovalTransition.validate(ApprovalStatus.PENDING, ApprovalStatus.DRAFT));
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_DraftToRejected_NotAllowed() {
        assertFalse(ApprovalTransition.isAllowed(ApprovalStatus.DRAFT, ApprovalStatus.REJECTED));
    }

    @ParameterizedTest
    @EnumSource(value = ApprovalStatus.class, names = {"APPROVED", "REJECTED", "FAILED"})
    void validate_FromTerminal_ThrowsException(ApprovalStatus terminal) {
        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> ApprovalTransition.validate(terminal, ApprovalStatus.PENDING));
        assertTrue(exception.getMessage().contains("terminal"));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> ApprovalTransition.validate(null, ApprovalStatus.PENDING));
        assertFalse(ApprovalTransition.isAllowed(ApprovalStatus.PENDING, null));
    }
}
