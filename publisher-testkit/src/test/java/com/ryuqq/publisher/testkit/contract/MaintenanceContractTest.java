package com.ryuqq.publisher.testkit.contract;

import com.ryuqq.publisher.adapter.runner.CacheLock;
import com.ryuqq.publisher.adapter.runner.ScheduledDeliveryStore;
import com.ryuqq.publisher.core.model.DeliveryOptions;
import com.ryuqq.publisher.core.model.ScheduledDeliveryEntry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Maintenance sweep over scheduled deliveries.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Index key without an entry → removed from the index</li>
 *   <li>Entry stuck in processing past the threshold → processing cleared</li>
 *   <li>Lock held past its timeout → removed</li>
 * </ul>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class MaintenanceContractTest extends AbstractContractTest {

    @Test
    void testMaintenance_OrphanedKey_RemovedFromIndex() {
        // Given
        startPipeline();
        ScheduledDeliveryStore store = pipeline.scheduledStore();
        String orphan = ScheduledDeliveryStore.keyFor("ghost-1");
        store.addKey(orphan);

        // When
        pipeline.maintenanceReaper().scan();

        // Then
        assertFalse(store.keys().contains(orphan));
    }

    @Test
    void testMaintenance_StuckProcessing_Cleared() {
        // Given
        startPipeline();
        ScheduledDeliveryStore store = pipeline.scheduledStore();
        Instant deliveryTime = START.plus(Duration.ofDays(1));
        String key = ScheduledDeliveryStore.keyFor(ScheduledDeliveryStore.scheduledId("c1", deliveryTime));
        ScheduledDeliveryEntry stuck = ScheduledDeliveryEntry
            .create(piece("c1"), DeliveryOptions.empty().withScheduledTime(deliveryTime), START)
            .markProcessing(START);
        store.save(key, stuck);
        store.addKey(key);

        // When
        clock.advance(Duration.ofMinutes(31));
        pipeline.maintenanceReaper().scan();

        // Then
        ScheduledDeliveryEntry after = store.find(key).orElseThrow();
        assertFalse(after.processing());
        assertEquals(START, after.lastProcessed());
        assertEquals(List.of(key), store.keys());
    }

    @Test
    void testMaintenance_EntryPastGrace_Dropped() {
        // Given
        startPipeline();
        Instant deliveryTime = START.plus(Duration.ofHours(1));
        orchestrator().submitContent(piece("c2"), DeliveryOptions.empty().withScheduledTime(deliveryTime));
        orchestrator().shutdown();

        // When
        clock.advance(Duration.ofHours(26));
        pipeline.maintenanceReaper().scan();

        // Then
        assertTrue(pipeline.scheduledStore().keys().isEmpty());
        assertEquals(0, twitter.publishCount());
    }

    @Test
    void testMaintenance_StaleDeliveryLock_Removed() {
        // Given
        startPipeline();
        Instant deliveryTime = START.plus(Duration.ofDays(1));
        String scheduledId = ScheduledDeliveryStore.scheduledId("c3", deliveryTime);
        orchestrator().submitContent(piece("c3"), DeliveryOptions.empty().withScheduledTime(deliveryTime));
        CacheLock otherInstance = new CacheLock(cache, clock, lockConfig);
        assertTrue(otherInstance.tryAcquire("delivery/" + scheduledId));

        // When
        clock.advance(Duration.ofMinutes(6));
        pipeline.maintenanceReaper().scan();

        // Then
        assertTrue(pipeline.cacheLock().tryAcquire("delivery/" + scheduledId),
            "Lock should be free after maintenance");
    }
}
