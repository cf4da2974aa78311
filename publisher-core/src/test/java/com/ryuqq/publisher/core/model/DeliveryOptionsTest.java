package com.ryuqq.publisher.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DeliveryOptions 병합/기본값 테스트.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class DeliveryOptionsTest {

    @Test
    void mergedOver_EmptyOptions_TakesAllDefaults() {
        // When
        DeliveryOptions merged = DeliveryOptions.empty().mergedOver(DeliveryOptions.defaults());

        // Then
        assertEquals(DeliveryOptions.defaults(), merged);
        assertEquals(3, merged.attemptLimit());
        assertTrue(merged.shouldValidate());
        assertFalse(merged.shouldSkipApproval());
        assertEquals(DeliveryOptions.DEFAULT_APPROVAL_OFFSET_MS, merged.approvalOffsetOrZero());
    }

    @Test
    void mergedOver_CallerValuesWin() {
        // Given
        Instant time = Instant.parse("2025-01-01T10:00:00Z");
        DeliveryOptions caller = DeliveryOptions.empty()
            .withMaxRetries(5)
            .withSkipApproval(true)
            .withScheduledTime(time);

        // When
        DeliveryOptions merged = caller.mergedOver(DeliveryOptions.defaults());

        // Then
        assertEquals(5, merged.attemptLimit());
        assertTrue(merged.shouldSkipApproval());
        assertEquals(time, merged.scheduledTime());
        assertTrue(merged.retry());
    }

    @Test
    void attemptLimit_RetryDisabled_One() {
        // Given
        DeliveryOptions options = DeliveryOptions.defaults().withRetry(false).withMaxRetries(10);

        // Then
        assertEquals(1, options.attemptLimit());
    }

    @Test
    void attemptLimit_Unset_DefaultsToThree() {
        // Then
        assertEquals(3, DeliveryOptions.empty().attemptLimit());
        assertEquals(0L, DeliveryOptions.empty().approvalOffsetOrZero());
    }

    @Test
    void mergedOver_NullBase_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> DeliveryOptions.empty().mergedOver(null));
    }
}
