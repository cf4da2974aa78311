package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.application.runtime.Runtime;
import com.ryuqq.publisher.core.spi.AdapterRegistry;
import com.ryuqq.publisher.core.spi.ApprovalProviderRegistry;
import com.ryuqq.publisher.core.spi.Cache;
import com.ryuqq.publisher.core.spi.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 전달 파이프라인 조립.
 *
 * <p>캐시/엔티티 저장소/레지스트리와 설정만 받아 스케줄러, 승인 코디네이터, 전달 Runner,
 * 유지보수 Reaper를 하나의 단위로 연결합니다.</p>
 *
 * <p><strong>주기 작업:</strong></p>
 * <ul>
 *   <li>{@value #MAINTENANCE_TASK_ID}: {@link MaintenanceReaper#scan()}</li>
 *   <li>{@value #MONITOR_TASK_ID}: 예약 항목 재적재 (다른 인스턴스가 만든 예약 포함)</li>
 *   <li>{@value PollingApprovalCoordinator#SWEEP_TASK_ID}: 승인 상태 스윕</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * DeliveryPipeline pipeline = DeliveryPipeline.withWorkerPool(cache, entities, adapters, providers,
 *     ApprovalConfig.fromProperties(props), DeliveryConfig.fromProperties(props), new LockConfig(),
 *     Clock.systemUTC());
 * pipeline.start();
 * pipeline.orchestrator().submitContent(piece, DeliveryOptions.empty());
 * }</pre>
 *
 * <p>테스트에서는 {@link #initialize()} 후 {@link #pump()}를 직접 호출해 시간을 진행합니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class DeliveryPipeline implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(DeliveryPipeline.class);

    public static final String MAINTENANCE_TASK_ID = "maintenance";
    public static final String MONITOR_TASK_ID = "delivery-monitor";

    private final DeliveryConfig deliveryConfig;
    private final DeliveryScheduler scheduler;
    private final ScheduledDeliveryStore scheduledStore;
    private final CacheLock cacheLock;
    private final PollingApprovalCoordinator coordinator;
    private final ContentDeliveryRunner runner;
    private final MaintenanceReaper reaper;
    private final ExecutorService ownedWorkers;

    /**
     * 호출 스레드에서 타이머를 실행하는 파이프라인 생성.
     */
    public DeliveryPipeline(
        Cache cache,
        EntityStore entities,
        AdapterRegistry adapters,
        ApprovalProviderRegistry providers,
        ApprovalConfig approvalConfig,
        DeliveryConfig deliveryConfig,
        LockConfig lockConfig,
        Clock clock
    ) {
        this(cache, entities, adapters, providers, approvalConfig, deliveryConfig, lockConfig, clock, Runnable::run);
    }

    /**
     * 생성자.
     *
     * @param taskExecutor 타이머 본문 실행자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DeliveryPipeline(
        Cache cache,
        EntityStore entities,
        AdapterRegistry adapters,
        ApprovalProviderRegistry providers,
        ApprovalConfig approvalConfig,
        DeliveryConfig deliveryConfig,
        LockConfig lockConfig,
        Clock clock,
        Executor taskExecutor
    ) {
        this(cache, entities, adapters, providers, approvalConfig, deliveryConfig, lockConfig, clock, taskExecutor, null);
    }

    private DeliveryPipeline(
        Cache cache,
        EntityStore entities,
        AdapterRegistry adapters,
        ApprovalProviderRegistry providers,
        ApprovalConfig approvalConfig,
        DeliveryConfig deliveryConfig,
        LockConfig lockConfig,
        Clock clock,
        Executor taskExecutor,
        ExecutorService ownedWorkers
    ) {
        if (deliveryConfig == null) {
            throw new IllegalArgumentException("deliveryConfig cannot be null");
        }
        if (lockConfig == null) {
            throw new IllegalArgumentException("lockConfig cannot be null");
        }
        this.deliveryConfig = deliveryConfig;
        this.scheduler = new DeliveryScheduler(clock, taskExecutor);
        this.scheduledStore = new ScheduledDeliveryStore(cache, clock, deliveryConfig.graceMs());
        this.cacheLock = new CacheLock(cache, clock, lockConfig);
        this.coordinator = new PollingApprovalCoordinator(
            cache, providers, approvalConfig, clock, scheduler, deliveryConfig.requesterId()
        );
        PublishRetrier retrier = new PublishRetrier(
            new BackoffCalculator(deliveryConfig.retryBaseDelayMs(), deliveryConfig.retryMaxDelayMs(), 0.0)
        );
        this.runner = new ContentDeliveryRunner(
            adapters, entities, coordinator, scheduledStore, scheduler, cacheLock, retrier, deliveryConfig, clock
        );
        this.reaper = new MaintenanceReaper(scheduledStore, scheduler, cacheLock, deliveryConfig, clock);
        this.ownedWorkers = ownedWorkers;
    }

    /**
     * {@link DeliveryConfig#workerThreads()} 크기의 전용 워커 풀로 타이머를 실행하는 파이프라인 생성.
     *
     * <p>워커 풀은 {@link #stop()}에서 함께 종료됩니다.</p>
     */
    public static DeliveryPipeline withWorkerPool(
        Cache cache,
        EntityStore entities,
        AdapterRegistry adapters,
        ApprovalProviderRegistry providers,
        ApprovalConfig approvalConfig,
        DeliveryConfig deliveryConfig,
        LockConfig lockConfig,
        Clock clock
    ) {
        if (deliveryConfig == null) {
            throw new IllegalArgumentException("deliveryConfig cannot be null");
        }
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(deliveryConfig.workerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "delivery-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        return new DeliveryPipeline(cache, entities, adapters, providers, approvalConfig, deliveryConfig, lockConfig,
            clock, workers, workers);
    }

    /**
     * 승인 복원, 예약 복원, 주기 작업 등록.
     */
    public void initialize() {
        coordinator.initialize();
        runner.initialize();
        scheduler.scheduleWithFixedDelay(
            MAINTENANCE_TASK_ID, Duration.ofMillis(deliveryConfig.maintenanceIntervalMs()), reaper::scan
        );
        scheduler.scheduleWithFixedDelay(
            MONITOR_TASK_ID, Duration.ofMillis(deliveryConfig.monitorIntervalMs()), runner::loadScheduledDeliveries
        );
        log.info("Delivery pipeline initialized");
    }

    /**
     * 초기화 후 스케줄링 스레드 시작.
     */
    public void start() {
        initialize();
        scheduler.start(Duration.ofMillis(deliveryConfig.schedulerTickMs()));
    }

    /**
     * 스케줄링 중지 및 컴포넌트 종료. 예약 항목은 캐시에 남습니다.
     */
    public void stop() {
        scheduler.stop();
        scheduler.cancel(MAINTENANCE_TASK_ID);
        scheduler.cancel(MONITOR_TASK_ID);
        runner.shutdown();
        coordinator.shutdown();
        if (ownedWorkers != null) {
            ownedWorkers.shutdown();
        }
        log.info("Delivery pipeline stopped");
    }

    @Override
    public int pump() {
        return scheduler.pump();
    }

    public ContentDeliveryRunner orchestrator() {
        return runner;
    }

    public PollingApprovalCoordinator approvals() {
        return coordinator;
    }

    public DeliveryScheduler scheduler() {
        return scheduler;
    }

    public ScheduledDeliveryStore scheduledStore() {
        return scheduledStore;
    }

    public CacheLock cacheLock() {
        return cacheLock;
    }

    public MaintenanceReaper maintenanceReaper() {
        return reaper;
    }
}
