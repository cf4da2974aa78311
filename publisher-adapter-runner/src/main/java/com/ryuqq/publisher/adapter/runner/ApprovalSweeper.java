package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.core.model.ApprovalRequest;
import com.ryuqq.publisher.core.model.ApprovalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 승인 스윕 컴포넌트.
 *
 * <p>활성 승인 요청의 상태를 제공자에게 확인하고, 최대 보관 기간을 넘긴 요청을 자동 거절합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 활성 요청 스냅샷 → 고정 크기 풀에서 병렬 상태 확인
 * 2. 모든 확인이 끝날 때까지 대기
 * 3. autoRejectDays 초과 요청 → REJECTED
 * 4. 변경/만료 카운트 로깅
 * </pre>
 *
 * <p>개별 요청 실패는 로그만 남기고 다음 요청으로 진행합니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class ApprovalSweeper {

    private static final Logger log = LoggerFactory.getLogger(ApprovalSweeper.class);

    private final PollingApprovalCoordinator coordinator;
    private final ApprovalConfig config;
    private final Clock clock;
    private final ExecutorService pool;

    /**
     * 생성자.
     *
     * @param coordinator 승인 코디네이터
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ApprovalSweeper(PollingApprovalCoordinator coordinator, ApprovalConfig config, Clock clock) {
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.coordinator = coordinator;
        this.config = config;
        this.clock = clock;
        AtomicInteger threadIndex = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(config.sweepConcurrency(), runnable -> {
            Thread thread = new Thread(runnable, "approval-sweep-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 활성 요청 상태 확인 및 만료 처리.
     */
    public void scan() {
        List<ApprovalRequest<?>> snapshot = coordinator.activeRequests();
        log.info("Approval sweep started for {} active requests", snapshot.size());

        // 1. 병렬 상태 확인
        List<Future<Boolean>> futures = new ArrayList<>(snapshot.size());
        for (ApprovalRequest<?> request : snapshot) {
            futures.add(pool.submit(() -> tryCheck(request)));
        }

        // 2. 전체 완료 대기
        int changed = 0;
        for (Future<Boolean> future : futures) {
            try {
                if (future.get()) {
                    changed++;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Approval sweep interrupted");
                return;
            } catch (ExecutionException e) {
                log.error("Approval status check failed", e.getCause());
            }
        }

        // 3. 만료 요청 자동 거절
        int expired = expireStale();

        log.info("Approval sweep completed: {} changed, {} expired out of {} active",
            changed, expired, snapshot.size());
    }

    /**
     * 풀 종료.
     */
    public void shutdown() {
        pool.shutdownNow();
    }

    private boolean tryCheck(ApprovalRequest<?> request) {
        try {
            ApprovalRequest<?> latest = coordinator.checkApprovalStatus(request);
            return latest.status() != request.status();
        } catch (Exception e) {
            log.error("Failed to check approval status for {}", request.id(), e);
            return false;
        }
    }

    private int expireStale() {
        Instant threshold = clock.instant().minus(config.autoRejectAge());
        String comment = "Auto-rejected: Request exceeded maximum age of " + config.autoRejectDays() + " days";

        int expired = 0;
        for (ApprovalRequest<?> request : coordinator.activeRequests()) {
            if (!request.timestamp().isBefore(threshold)) {
                continue;
            }
            try {
                coordinator.updateApprovalRequest(request.withStatus(ApprovalStatus.REJECTED).withComments(comment));
                log.info("Auto-rejected stale approval request {} (submitted {})", request.id(), request.timestamp());
                expired++;
            } catch (Exception e) {
                log.error("Failed to auto-reject approval request {}", request.id(), e);
            }
        }
        return expired;
    }
}
