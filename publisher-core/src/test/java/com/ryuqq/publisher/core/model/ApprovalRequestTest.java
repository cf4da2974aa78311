package com.ryuqq.publisher.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ApprovalRequest 테스트.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class ApprovalRequestTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    void create_ContentPiece_IdDerivedFromContentId() {
        // When
        ApprovalRequest<ContentPiece> request = ApprovalRequest.create(
            ContentPiece.of("c1", Platform.TWITTER, "hello"), "default", "agent", NOW,
            ApprovalStatus.PENDING, Continuation.publish("c1"));

        // Then
        assertEquals("c1-approval", request.id());
        assertEquals(ApprovalRequest.CONTENT_TYPE_CONTENT_PIECE, request.contentType());
        assertEquals(Continuation.PUBLISH, request.continuation().kind());
    }

    @Test
    void create_Plan_ContentTypeIsPlan() {
        // Given
        PlanSummary plan = new PlanSummary("p1", PlanSummary.Kind.MASTER, "Q1 plan", null, null, NOW);

        // When
        ApprovalRequest<PlanSummary> request = ApprovalRequest.create(plan, "default", "agent", NOW,
            ApprovalStatus.PENDING, null);

        // Then
        assertEquals(ApprovalRequest.CONTENT_TYPE_PLAN, request.contentType());
        assertEquals("p1-approval", request.id());
    }

    @Test
    void withStatus_KeepsIdentityAndContinuation() {
        // Given
        ApprovalRequest<ContentPiece> request = ApprovalRequest.create(
            ContentPiece.of("c1", Platform.TWITTER, "hello"), "default", "agent", NOW,
            ApprovalStatus.PENDING, Continuation.recordApprovalOnly("contentDelivery/scheduled/c1-1"));

        // When
        ApprovalRequest<ContentPiece> approved = request.withStatus(ApprovalStatus.APPROVED).withApproverId("u1");

        // Then
        assertEquals(request.id(), approved.id());
        assertEquals(ApprovalStatus.APPROVED, approved.status());
        assertEquals("u1", approved.approverId());
        assertEquals(request.continuation(), approved.continuation());
    }

    @Test
    void constructor_MissingStatus_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> ApprovalRequest.create(
            ContentPiece.of("c1", Platform.TWITTER, "hello"), "default", "agent", NOW, null, null));
    }
}
