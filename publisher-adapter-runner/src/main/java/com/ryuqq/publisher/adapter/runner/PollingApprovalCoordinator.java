package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.application.approval.ApprovalCoordinator;
import com.ryuqq.publisher.core.error.ProviderUnavailableException;
import com.ryuqq.publisher.core.model.Approvable;
import com.ryuqq.publisher.core.model.ApprovalRequest;
import com.ryuqq.publisher.core.model.ApprovalStatus;
import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.model.Continuation;
import com.ryuqq.publisher.core.spi.ApprovalProvider;
import com.ryuqq.publisher.core.spi.ApprovalProviderRegistry;
import com.ryuqq.publisher.core.spi.Cache;
import com.ryuqq.publisher.core.spi.ContinuationHandler;
import com.ryuqq.publisher.core.statemachine.ApprovalTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 폴링 기반 Approval Coordinator.
 *
 * <p>활성 요청(PENDING)을 메모리와 캐시({@value #ACTIVE_SET_KEY})에 함께 보관하고,
 * 주기적인 {@link ApprovalSweeper} 스윕으로 제공자 상태를 확인하며 오래된 요청을 자동 거절합니다.</p>
 *
 * <p><strong>제공자 결정 순서:</strong></p>
 * <ol>
 *   <li>ContentPiece: 플랫폼 → 제공자 매핑 설정</li>
 *   <li>ContentPiece: 플랫폼과 같은 이름의 제공자</li>
 *   <li>기본 제공자 ({@code default})</li>
 *   <li>이름 사전순 첫 번째 제공자</li>
 * </ol>
 *
 * <p><strong>캐시 키:</strong></p>
 * <ul>
 *   <li>{@code approval/<provider>/<contentId>-approval}: 요청별 최신 상태 (종료 후에도 유지)</li>
 *   <li>{@code pendingApprovals}: 활성 요청 스냅샷</li>
 * </ul>
 *
 * <p><strong>후속 작업:</strong> 상태가 반영될 때마다 {@link Continuation#kind()}에 등록된
 * {@link ContinuationHandler}를 지수 백오프로 재시도하며 호출하고, 끝내 실패하면 로그만 남깁니다.
 * 같은 요청의 종료 전이는 한 번만 반영되므로 종료 시 후속 작업도 한 번만 실행됩니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class PollingApprovalCoordinator implements ApprovalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PollingApprovalCoordinator.class);

    public static final String ACTIVE_SET_KEY = "pendingApprovals";
    public static final String REQUEST_KEY_PREFIX = "approval/";
    public static final String SWEEP_TASK_ID = "approval-sweep";

    private final Cache cache;
    private final ApprovalProviderRegistry providers;
    private final ApprovalConfig config;
    private final Clock clock;
    private final DeliveryScheduler scheduler;
    private final String requesterId;
    private final BackoffCalculator callbackBackoff;
    private final ApprovalSweeper sweeper;

    private final ConcurrentHashMap<String, ApprovalRequest<?>> active = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ContinuationHandler> handlers = new ConcurrentHashMap<>();
    private final Set<String> initializedProviders = ConcurrentHashMap.newKeySet();
    private volatile boolean initialized;

    /**
     * 생성자.
     *
     * @param cache 캐시
     * @param providers 승인 제공자 레지스트리
     * @param config 설정
     * @param clock 시계
     * @param scheduler 주기 스윕용 스케줄러
     * @param requesterId 요청자 ID
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PollingApprovalCoordinator(
        Cache cache,
        ApprovalProviderRegistry providers,
        ApprovalConfig config,
        Clock clock,
        DeliveryScheduler scheduler,
        String requesterId
    ) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (providers == null) {
            throw new IllegalArgumentException("providers cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (requesterId == null || requesterId.isBlank()) {
            throw new IllegalArgumentException("requesterId cannot be null or blank");
        }
        this.cache = cache;
        this.providers = providers;
        this.config = config;
        this.clock = clock;
        this.scheduler = scheduler;
        this.requesterId = requesterId;
        this.callbackBackoff = new BackoffCalculator(config.callbackBaseDelayMs(), config.callbackMaxDelayMs(), 0.0);
        this.sweeper = new ApprovalSweeper(this, config, clock);
        this.handlers.put(Continuation.NOTIFY, PollingApprovalCoordinator::logNotification);
    }

    private static void logNotification(ApprovalRequest<?> request, Continuation continuation) {
        log.info("Approval {} is {} (listener: {})",
            request.id(), request.status(), ((Continuation.Notify) continuation).listener());
    }

    @Override
    public <T extends Approvable> ApprovalRequest<T> sendForApproval(T content, Continuation continuation) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        Instant now = clock.instant();

        // 1. 자동 승인: 제공자 왕복 없음
        if (config.autoApprove()) {
            log.warn("Auto-approve is enabled, skipping approval for {}", content.id());
            ApprovalRequest<T> approved = ApprovalRequest.create(
                content, ApprovalConfig.AUTO_PROVIDER_NAME, requesterId, now, ApprovalStatus.APPROVED, continuation
            ).withComments("Automatically approved");
            invokeContinuation(approved);
            return approved;
        }

        // 2. 제공자 결정 (실패 시 후속 작업 없이 FAILED)
        ApprovalProvider provider;
        try {
            provider = requireProvider(content);
        } catch (ProviderUnavailableException e) {
            log.error("{} for {}", e.getMessage(), content.id());
            return ApprovalRequest.create(content, null, requesterId, now, ApprovalStatus.FAILED, continuation)
                .withComments(e.getMessage());
        }
        String providerName = provider.providerName();

        // 3. 동일 요청이 캐시에 있으면 재제출하지 않음
        Optional<ApprovalRequest<T>> cached = findCached(providerName, content);
        if (cached.isPresent()) {
            ApprovalRequest<T> existing = cached.get();
            log.info("Approval request {} already exists with status {}", existing.id(), existing.status());
            if (existing.status().isTerminal()) {
                return existing;
            }
            ApprovalRequest<T> rebound = existing.withContinuation(continuation);
            active.put(rebound.id(), rebound);
            persist(rebound);
            persistActiveSet();
            return rebound;
        }

        // 4. PENDING 요청 제출
        ApprovalTransition.validate(ApprovalStatus.DRAFT, ApprovalStatus.PENDING);
        ApprovalRequest<T> pending = ApprovalRequest.create(
            content, providerName, requesterId, now, ApprovalStatus.PENDING, continuation
        );
        ApprovalRequest<T> submitted;
        try {
            ApprovalRequest<T> returned = provider.submitForApproval(pending);
            submitted = returned == null
                ? pending
                : returned.withStatus(ApprovalStatus.PENDING).withContinuation(continuation);
        } catch (RuntimeException e) {
            log.error("Failed to submit {} to approval provider {}", content.id(), providerName, e);
            return pending.withStatus(ApprovalStatus.FAILED)
                .withComments("Failed to submit for approval: " + e.getMessage());
        }

        active.put(submitted.id(), submitted);
        persist(submitted);
        persistActiveSet();
        log.info("Submitted {} for approval via {} (request: {})", content.id(), providerName, submitted.id());
        return submitted;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends Approvable> ApprovalRequest<T> checkApprovalStatus(ApprovalRequest<T> request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        ApprovalRequest<?> tracked = active.get(request.id());
        if (tracked == null) {
            return request;
        }
        ApprovalRequest<T> current = (ApprovalRequest<T>) tracked;

        Optional<ApprovalProvider> provider = providerFor(current);
        if (provider.isEmpty()) {
            log.warn("No approval provider for active request {}", current.id());
            return current;
        }

        ApprovalRequest<T> latest;
        try {
            latest = provider.get().checkApprovalStatus(current);
        } catch (RuntimeException e) {
            // 일시 장애는 변경 없음으로 간주
            log.warn("Status check failed for {}, treating as unchanged: {}", current.id(), e.getMessage());
            return current;
        }
        if (latest == null || latest.status() == current.status()) {
            return current;
        }
        if (!ApprovalTransition.isAllowed(current.status(), latest.status())) {
            log.warn("Ignoring invalid approval transition for {}: {} → {}", current.id(), current.status(), latest.status());
            return current;
        }

        ApprovalRequest<T> updated = latest.withContinuation(current.continuation());
        updateApprovalRequest(updated);
        return updated;
    }

    @Override
    public void updateApprovalRequest(ApprovalRequest<?> request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        String id = request.id();

        // 종료 전이는 먼저 제거한 쪽만 반영 (후속 작업 1회 보장)
        if (request.status().isTerminal()) {
            if (active.remove(id) == null) {
                log.debug("Ignoring update for inactive approval request {}", id);
                return;
            }
        } else if (active.replace(id, request) == null) {
            log.debug("Ignoring update for inactive approval request {}", id);
            return;
        }

        persistActiveSet();
        persist(request);
        log.info("Approval request {} is now {}", id, request.status());

        if (request.status().isTerminal()) {
            cleanupProviderArtifact(request);
        }
        invokeContinuation(request);
    }

    @Override
    public boolean cancelApprovalRequest(String requestId) {
        ApprovalRequest<?> tracked = active.get(requestId);
        if (tracked == null) {
            return false;
        }
        updateApprovalRequest(tracked.withStatus(ApprovalStatus.REJECTED).withComments("Approval request cancelled"));
        return true;
    }

    @Override
    public int getPendingApprovalsCount() {
        return active.size();
    }

    @Override
    public void registerProvider(ApprovalProvider provider) {
        providers.register(provider);
        log.info("Registered approval provider {}", provider.providerName());
        if (initialized) {
            initializeProvider(provider);
        }
    }

    @Override
    public void registerContinuationHandler(String kind, ContinuationHandler handler) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        handlers.put(kind, handler);
    }

    @Override
    public boolean isEnabled() {
        return config.enabled();
    }

    /**
     * 활성 요청 복원, 제공자 초기화, 초기 스윕, 주기 스윕 등록.
     */
    @Override
    public void initialize() {
        if (!config.enabled()) {
            log.info("Approval is disabled, coordinator not started");
            return;
        }
        loadActiveSet();
        for (String name : providers.providerNames()) {
            providers.find(name).ifPresent(this::initializeProvider);
        }
        initialized = true;

        sweeper.scan();
        if (config.sweepEnabled()) {
            scheduler.scheduleWithFixedDelay(SWEEP_TASK_ID, Duration.ofMillis(config.checkIntervalMs()), sweeper::scan);
        }
        log.info("Approval coordinator initialized with {} active requests", active.size());
    }

    @Override
    public void shutdown() {
        scheduler.cancel(SWEEP_TASK_ID);
        persistActiveSet();
        sweeper.shutdown();
        initialized = false;
        log.info("Approval coordinator stopped");
    }

    /**
     * 주기 스윕 1회 실행.
     */
    public void sweep() {
        sweeper.scan();
    }

    /**
     * @return 활성 요청 스냅샷
     */
    public List<ApprovalRequest<?>> activeRequests() {
        return List.copyOf(active.values());
    }

    /**
     * 요청별 캐시 키.
     *
     * @param providerName 제공자 이름
     * @param requestId 요청 ID
     * @return {@code approval/<provider>/<requestId>}
     */
    public static String requestKey(String providerName, String requestId) {
        return REQUEST_KEY_PREFIX + providerName + "/" + requestId;
    }

    /**
     * 페이로드의 승인 제공자 결정.
     *
     * @param content 페이로드
     * @return 제공자 (없으면 empty)
     */
    Optional<ApprovalProvider> resolveProvider(Approvable content) {
        if (content instanceof ContentPiece) {
            String platform = ((ContentPiece) content).platform().getValue();
            String mapped = config.platformProviderMapping().get(platform);
            if (mapped != null) {
                Optional<ApprovalProvider> byMapping = providers.find(mapped);
                if (byMapping.isPresent()) {
                    return byMapping;
                }
                log.warn("Mapped approval provider {} for platform {} is not registered", mapped, platform);
            }
            Optional<ApprovalProvider> byPlatform = providers.find(platform);
            if (byPlatform.isPresent()) {
                return byPlatform;
            }
        }
        Optional<ApprovalProvider> byDefault = providers.find(config.defaultProviderName());
        if (byDefault.isPresent()) {
            return byDefault;
        }
        List<String> names = providers.providerNames();
        return names.isEmpty() ? Optional.empty() : providers.find(names.get(0));
    }

    private ApprovalProvider requireProvider(Approvable content) {
        return resolveProvider(content)
            .orElseThrow(() -> new ProviderUnavailableException("No approval provider available"));
    }

    private Optional<ApprovalProvider> providerFor(ApprovalRequest<?> request) {
        if (request.providerName() != null) {
            Optional<ApprovalProvider> named = providers.find(request.providerName());
            if (named.isPresent()) {
                return named;
            }
        }
        return resolveProvider(request.content());
    }

    @SuppressWarnings("unchecked")
    private <T extends Approvable> Optional<ApprovalRequest<T>> findCached(String providerName, T content) {
        String key = requestKey(providerName, ApprovalRequest.idFor(content.id()));
        try {
            return cache.get(key, ApprovalRequest.class).map(request -> (ApprovalRequest<T>) request);
        } catch (RuntimeException e) {
            log.error("Failed to read cached approval request {}", key, e);
            return Optional.empty();
        }
    }

    private void invokeContinuation(ApprovalRequest<?> request) {
        Continuation continuation = request.continuation();
        if (continuation == null) {
            return;
        }
        ContinuationHandler handler = handlers.get(continuation.kind());
        if (handler == null) {
            log.warn("No handler registered for continuation kind {} (request: {})", continuation.kind(), request.id());
            return;
        }

        int maxAttempts = config.callbackMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                handler.handle(request, continuation);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Continuation {} for {} interrupted", continuation.kind(), request.id(), e);
                return;
            } catch (Exception e) {
                if (attempt == maxAttempts) {
                    log.error("Continuation {} for {} failed after {} attempts",
                        continuation.kind(), request.id(), maxAttempts, e);
                    return;
                }
                long delay = callbackBackoff.calculate(attempt);
                log.warn("Continuation {} for {} failed (attempt {}/{}), retrying in {}ms: {}",
                    continuation.kind(), request.id(), attempt, maxAttempts, delay, e.getMessage());
                sleep(delay);
            }
        }
    }

    private void cleanupProviderArtifact(ApprovalRequest<?> request) {
        if (request.platformId() == null) {
            return;
        }
        providerFor(request).ifPresent(provider -> {
            try {
                provider.cleanupRequest(request.platformId());
            } catch (RuntimeException e) {
                log.warn("Failed to clean up provider artifact {} for {}: {}",
                    request.platformId(), request.id(), e.getMessage());
            }
        });
    }

    private void initializeProvider(ApprovalProvider provider) {
        if (!initializedProviders.add(provider.providerName())) {
            return;
        }
        try {
            provider.initialize();
        } catch (RuntimeException e) {
            log.error("Failed to initialize approval provider {}", provider.providerName(), e);
        }
    }

    private void loadActiveSet() {
        try {
            ApprovalRequest<?>[] stored = cache.get(ACTIVE_SET_KEY, ApprovalRequest[].class)
                .orElse(new ApprovalRequest<?>[0]);
            for (ApprovalRequest<?> request : stored) {
                if (!request.status().isTerminal()) {
                    active.putIfAbsent(request.id(), request);
                }
            }
        } catch (RuntimeException e) {
            log.error("Failed to load active approval requests", e);
        }
    }

    private void persist(ApprovalRequest<?> request) {
        if (request.providerName() == null) {
            return;
        }
        try {
            cache.set(requestKey(request.providerName(), request.id()), request, expiry());
        } catch (RuntimeException e) {
            log.error("Failed to persist approval request {}", request.id(), e);
        }
    }

    private void persistActiveSet() {
        try {
            cache.set(ACTIVE_SET_KEY, active.values().toArray(new ApprovalRequest<?>[0]), expiry());
        } catch (RuntimeException e) {
            log.error("Failed to persist active approval requests", e);
        }
    }

    private long expiry() {
        return clock.millis() + config.requestTtlMs();
    }

    /**
     * Sleep 유틸리티.
     *
     * @param millis 대기 시간 (밀리초)
     */
    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted during continuation backoff", e);
        }
    }
}
