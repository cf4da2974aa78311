package com.ryuqq.publisher.testkit.contract;

import com.ryuqq.publisher.core.model.ApprovalRequest;
import com.ryuqq.publisher.core.model.ApprovalStatus;
import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.model.Continuation;
import com.ryuqq.publisher.core.model.DeliveryOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Pending requests older than the auto-reject age are rejected by the sweep.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class StaleApprovalContractTest extends AbstractContractTest {

    @Test
    void testStaleApproval_OlderThanThreshold_RejectedOnceAndRemoved() {
        // Given
        startPipeline();
        List<ApprovalRequest<?>> notified = new CopyOnWriteArrayList<>();
        pipeline.approvals().registerContinuationHandler(Continuation.NOTIFY, (request, continuation) -> notified.add(request));
        ApprovalRequest<ContentPiece> pending = pipeline.approvals()
            .sendForApproval(piece("c1"), Continuation.notifyListener("planner"));
        notified.clear();

        // When
        clock.advance(Duration.ofDays(approvalConfig.autoRejectDays()).plusMinutes(1));
        pipeline.approvals().sweep();
        pipeline.approvals().sweep();

        // Then
        assertEquals(0, pipeline.approvals().getPendingApprovalsCount());
        assertEquals(1, notified.size(), "Continuation should run exactly once");
        ApprovalRequest<?> rejected = notified.get(0);
        assertEquals(pending.id(), rejected.id());
        assertEquals(ApprovalStatus.REJECTED, rejected.status());
        assertEquals("Auto-rejected: Request exceeded maximum age of 7 days", rejected.comments());
    }

    @Test
    void testStaleApproval_YoungerThanThreshold_StaysPending() {
        // Given
        startPipeline();
        pipeline.approvals().sendForApproval(piece("c2"), Continuation.notifyListener("planner"));

        // When
        clock.advance(Duration.ofDays(6));
        pipeline.approvals().sweep();

        // Then
        assertEquals(1, pipeline.approvals().getPendingApprovalsCount());
    }

    @Test
    void testStaleApproval_PublishContinuation_NeverPublishes() {
        // Given
        startPipeline();
        orchestrator().submitContent(piece("c3"), DeliveryOptions.empty());

        // When
        advance(Duration.ofDays(8));

        // Then
        assertEquals(0, pipeline.approvals().getPendingApprovalsCount());
        assertNeverPublished("c3");
    }
}
