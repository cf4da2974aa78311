package com.ryuqq.publisher.testkit.contract;

import com.ryuqq.publisher.adapter.runner.ScheduledDeliveryStore;
import com.ryuqq.publisher.core.model.DeliveryOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Cancelling a scheduled delivery.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractContractTest {

    @Test
    void testCancellation_BeforeDelivery_NothingPublishedAndIdempotent() {
        // Given
        startPipeline();
        Instant deliveryTime = START.plus(Duration.ofHours(4));
        orchestrator().submitContent(piece("c1"), DeliveryOptions.empty().withScheduledTime(deliveryTime));
        String scheduledId = ScheduledDeliveryStore.scheduledId("c1", deliveryTime);

        // When
        boolean first = orchestrator().cancelScheduledDelivery(scheduledId);
        boolean second = orchestrator().cancelScheduledDelivery(scheduledId);
        advance(Duration.ofHours(5));

        // Then
        assertTrue(first);
        assertFalse(second, "Second cancel should find nothing");
        assertEquals(0, twitter.publishCount());
        assertEquals(0, approvalProvider.submitCount(), "Approval prefetch should be cancelled too");
        assertTrue(pipeline.scheduledStore().keys().isEmpty());
    }

    @Test
    void testCancellation_AfterRestart_StaysCancelled() {
        // Given
        startPipeline();
        Instant deliveryTime = START.plus(Duration.ofHours(4));
        orchestrator().submitContent(piece("c2"), DeliveryOptions.empty().withScheduledTime(deliveryTime));
        orchestrator().cancelScheduledDelivery(ScheduledDeliveryStore.scheduledId("c2", deliveryTime));

        // When
        restart();
        advance(Duration.ofHours(5));

        // Then
        assertEquals(0, twitter.publishCount());
    }

    @Test
    void testCancellation_UnknownId_ReturnsFalse() {
        // Given
        startPipeline();

        // When
        boolean cancelled = orchestrator().cancelScheduledDelivery("missing-123");

        // Then
        assertFalse(cancelled);
    }
}
