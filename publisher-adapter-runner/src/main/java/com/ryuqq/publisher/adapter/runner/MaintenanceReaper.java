package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.core.model.ScheduledDeliveryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 예약 전달 유지보수 Reaper.
 *
 * <p>주기적으로 예약 인덱스를 스캔하여 아래 항목을 정리합니다.</p>
 * <ul>
 *   <li>고아 키: 인덱스에는 있지만 항목이 없는 키 → 인덱스에서 제거</li>
 *   <li>만료 항목: 예약 시각 + grace 경과 → 타이머 해제, 항목 삭제</li>
 *   <li>정체 항목: processing 상태로 stuckThreshold 초과 → processing 해제</li>
 *   <li>오래된 락 마커</li>
 * </ul>
 *
 * <p>개별 키 실패는 로그만 남기고 다음 키로 진행합니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class MaintenanceReaper {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceReaper.class);

    private final ScheduledDeliveryStore store;
    private final DeliveryScheduler scheduler;
    private final CacheLock cacheLock;
    private final DeliveryConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MaintenanceReaper(
        ScheduledDeliveryStore store,
        DeliveryScheduler scheduler,
        CacheLock cacheLock,
        DeliveryConfig config,
        Clock clock
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (cacheLock == null) {
            throw new IllegalArgumentException("cacheLock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.scheduler = scheduler;
        this.cacheLock = cacheLock;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 예약 항목 유지보수 스캔.
     *
     * <pre>
     * 1. 인덱스 키 목록 조회
     * 2. 키별 분류: 고아 / 만료 / 정체 / 정상
     * 3. 고아/만료 키를 인덱스에서 제거
     * 4. 오래된 락 정리
     * </pre>
     */
    public void scan() {
        log.info("Maintenance scan started");

        List<String> keys = store.keys();
        List<String> dropped = new ArrayList<>();
        Instant now = clock.instant();
        int orphaned = 0;
        int expired = 0;
        int unstuck = 0;

        for (String key : keys) {
            try {
                switch (inspect(key, now)) {
                    case ORPHANED -> {
                        orphaned++;
                        dropped.add(key);
                    }
                    case EXPIRED -> {
                        expired++;
                        dropped.add(key);
                    }
                    case UNSTUCK -> unstuck++;
                    case KEPT -> { }
                }
            } catch (Exception e) {
                log.error("Failed to maintain scheduled key {}", key, e);
            }
        }

        store.removeKeys(dropped);
        List<String> lockNames = new ArrayList<>(keys.size());
        for (String key : keys) {
            lockNames.add(ContentDeliveryRunner.DELIVERY_LOCK_PREFIX + ScheduledDeliveryStore.scheduledIdOf(key));
        }
        int locks = cacheLock.cleanupStale(lockNames);

        log.info("Maintenance scan completed: {} orphaned, {} expired, {} unstuck, {} stale locks out of {} keys",
            orphaned, expired, unstuck, locks, keys.size());
    }

    private Verdict inspect(String key, Instant now) {
        Optional<ScheduledDeliveryEntry> found = store.find(key);
        if (found.isEmpty()) {
            log.debug("Removing orphaned scheduled key {}", key);
            return Verdict.ORPHANED;
        }
        ScheduledDeliveryEntry entry = found.get();

        if (entry.scheduledTime().isBefore(now.minusMillis(config.graceMs()))) {
            String scheduledId = ScheduledDeliveryStore.scheduledIdOf(key);
            scheduler.cancel(scheduledId);
            scheduler.cancel(ContentDeliveryRunner.approvalTaskId(scheduledId));
            store.delete(key);
            log.debug("Removed expired scheduled delivery {} (scheduled {})", scheduledId, entry.scheduledTime());
            return Verdict.EXPIRED;
        }

        if (entry.processing() && entry.lastProcessed() != null
            && entry.lastProcessed().isBefore(now.minusMillis(config.stuckThresholdMs()))) {
            log.warn("Clearing stuck processing flag for {} (since {})", key, entry.lastProcessed());
            store.update(key, current -> current.clearProcessing(null));
            return Verdict.UNSTUCK;
        }
        return Verdict.KEPT;
    }

    private enum Verdict {
        ORPHANED, EXPIRED, UNSTUCK, KEPT
    }
}
