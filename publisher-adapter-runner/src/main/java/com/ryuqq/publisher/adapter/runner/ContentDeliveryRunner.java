package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.application.approval.ApprovalCoordinator;
import com.ryuqq.publisher.application.orchestrator.DeliveryOrchestrator;
import com.ryuqq.publisher.core.error.DeliveryException;
import com.ryuqq.publisher.core.error.ErrorCode;
import com.ryuqq.publisher.core.model.ApprovalRequest;
import com.ryuqq.publisher.core.model.ApprovalStatus;
import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.model.ContentStatus;
import com.ryuqq.publisher.core.model.Continuation;
import com.ryuqq.publisher.core.model.DeliveryOptions;
import com.ryuqq.publisher.core.model.DeliveryResult;
import com.ryuqq.publisher.core.model.Platform;
import com.ryuqq.publisher.core.model.PublishResult;
import com.ryuqq.publisher.core.model.ScheduledDeliveryEntry;
import com.ryuqq.publisher.core.model.ValidationResult;
import com.ryuqq.publisher.core.outcome.Fail;
import com.ryuqq.publisher.core.outcome.Ok;
import com.ryuqq.publisher.core.outcome.Outcome;
import com.ryuqq.publisher.core.spi.AdapterRegistry;
import com.ryuqq.publisher.core.spi.EntityStore;
import com.ryuqq.publisher.core.spi.PlatformAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 콘텐츠 전달 Runner.
 *
 * <p>{@link DeliveryOrchestrator}의 기본 구현입니다.
 * 포맷/검증 → (예약) → 승인 → 재시도 게시 → 엔티티 저장까지의 흐름을 담당합니다.</p>
 *
 * <p><strong>즉시 전달 흐름:</strong></p>
 * <pre>
 * 1. 이미 PUBLISHED → ALREADY_PUBLISHED (어댑터 호출 없음)
 * 2. 어댑터 조회 → 없으면 ADAPTER_UNAVAILABLE
 * 3. formatContent → validateContent (옵션)
 * 4. 미래 scheduledTime → 예약 저장 후 SCHEDULED
 * 5. 승인 생략 또는 비활성 → 바로 게시
 * 6. 승인 요청 → APPROVED면 게시, PENDING이면 대기, REJECTED면 DROPPED
 * </pre>
 *
 * <p><strong>예약 전달:</strong></p>
 * <ul>
 *   <li>항목은 {@link ScheduledDeliveryStore}에 저장되어 재시작 후에도 복원됩니다.</li>
 *   <li>{@code approvalOffsetMs > 0}이면 예약 시각 이전에 승인을 미리 받아 둡니다 ({@code <scheduledId>-approval} 타이머).</li>
 *   <li>전달 타이머는 {@code delivery/<scheduledId>} 락 아래에서 실행되며, 성공/실패와 관계없이 항목을 정리합니다.</li>
 * </ul>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class ContentDeliveryRunner implements DeliveryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ContentDeliveryRunner.class);

    static final String APPROVAL_TASK_SUFFIX = "-approval";
    static final String DELIVERY_LOCK_PREFIX = "delivery/";

    private final AdapterRegistry adapters;
    private final EntityStore entities;
    private final ApprovalCoordinator approvals;
    private final ScheduledDeliveryStore store;
    private final DeliveryScheduler scheduler;
    private final CacheLock cacheLock;
    private final PublishRetrier retrier;
    private final DeliveryConfig config;
    private final Clock clock;

    private final Map<String, DeliveryOptions> awaitingInline = new ConcurrentHashMap<>();
    private final Map<String, DeliveryResult> inlineResults = new ConcurrentHashMap<>();
    private final Set<String> publishing = ConcurrentHashMap.newKeySet();

    /**
     * 생성자.
     *
     * <p>승인 코디네이터에 {@code publish}, {@code recordApprovalOnly} 후속 작업 핸들러를 등록합니다.</p>
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ContentDeliveryRunner(
        AdapterRegistry adapters,
        EntityStore entities,
        ApprovalCoordinator approvals,
        ScheduledDeliveryStore store,
        DeliveryScheduler scheduler,
        CacheLock cacheLock,
        PublishRetrier retrier,
        DeliveryConfig config,
        Clock clock
    ) {
        if (adapters == null) {
            throw new IllegalArgumentException("adapters cannot be null");
        }
        if (entities == null) {
            throw new IllegalArgumentException("entities cannot be null");
        }
        if (approvals == null) {
            throw new IllegalArgumentException("approvals cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (cacheLock == null) {
            throw new IllegalArgumentException("cacheLock cannot be null");
        }
        if (retrier == null) {
            throw new IllegalArgumentException("retrier cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.adapters = adapters;
        this.entities = entities;
        this.approvals = approvals;
        this.store = store;
        this.scheduler = scheduler;
        this.cacheLock = cacheLock;
        this.retrier = retrier;
        this.config = config;
        this.clock = clock;

        approvals.registerContinuationHandler(Continuation.PUBLISH, this::onPublishContinuation);
        approvals.registerContinuationHandler(Continuation.RECORD_APPROVAL_ONLY, this::onRecordApprovalOnly);
    }

    @Override
    public DeliveryResult submitContent(ContentPiece piece, DeliveryOptions options) {
        if (piece == null) {
            throw new IllegalArgumentException("piece cannot be null");
        }
        Instant now = clock.instant();
        log.debug("Submitting content {} for {}", piece.id(), piece.platform());

        try {
            // 1. 중복 게시 방지
            if (isPublished(piece)) {
                log.info("Content {} is already published, skipping", piece.id());
                return DeliveryResult.rejected(piece, ErrorCode.ALREADY_PUBLISHED, "Content already published", now);
            }

            DeliveryOptions merged = (options == null ? DeliveryOptions.empty() : options)
                .mergedOver(config.defaultOptions());

            // 2. 어댑터 조회
            PlatformAdapter adapter = adapters.require(piece.platform());

            // 3. 포맷 → 검증
            ContentPiece formatted = adapter.formatContent(piece);
            if (merged.shouldValidate()) {
                ValidationResult validation = adapter.validateContent(formatted);
                if (!validation.valid()) {
                    log.warn("Content {} failed validation: {}", piece.id(), validation.errors());
                    return DeliveryResult.validationFailed(formatted, validation.errors(), now);
                }
            }

            // 4. 예약
            if (merged.scheduledTime() != null && merged.scheduledTime().isAfter(now)) {
                return scheduleContentDelivery(formatted, merged, now);
            }

            // 5. 승인 생략
            if (merged.shouldSkipApproval() || !approvals.isEnabled()) {
                ApprovalRequest<ContentPiece> approved = ApprovalRequest.create(
                    formatted, ApprovalConfig.AUTO_PROVIDER_NAME, config.requesterId(), now,
                    ApprovalStatus.APPROVED, null
                ).withComments("Approval skipped");
                return publishContent(approved, merged);
            }

            // 6. 승인 요청
            return requestApproval(formatted, merged, now);

        } catch (DeliveryException e) {
            log.error("Content {} rejected: {}", piece.id(), e.getMessage());
            return DeliveryResult.rejected(piece, e.getErrorCode(), e.getMessage(), now);
        } catch (RuntimeException e) {
            log.error("Error delivering content {}", piece.id(), e);
            return DeliveryResult.publishFailed(piece, 0, ErrorCode.FATAL_PUBLISH, "Error: " + e.getMessage(), now);
        }
    }

    @Override
    public DeliveryResult publishContent(ApprovalRequest<ContentPiece> request) {
        return publishContent(request, config.defaultOptions());
    }

    /**
     * 승인된 콘텐츠 게시.
     *
     * @param request 승인 요청
     * @param options 병합된 옵션 (재시도 한도)
     * @return 게시 결과
     */
    public DeliveryResult publishContent(ApprovalRequest<ContentPiece> request, DeliveryOptions options) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        ContentPiece piece = request.content();
        Instant now = clock.instant();

        if (request.status() != ApprovalStatus.APPROVED) {
            log.error("Content not approved for publishing: {} ({})", request.id(), request.status());
            return DeliveryResult.rejected(piece, ErrorCode.NOT_APPROVED, "Content not approved for publishing", now);
        }
        if (!publishing.add(piece.id())) {
            log.warn("Content {} is already being published", piece.id());
            return DeliveryResult.rejected(piece, ErrorCode.ALREADY_PUBLISHED, "Content is already being published", now);
        }

        try {
            if (isPublished(piece)) {
                log.info("Content {} is already published, skipping", piece.id());
                return DeliveryResult.rejected(piece, ErrorCode.ALREADY_PUBLISHED, "Content already published", now);
            }
            PlatformAdapter adapter = adapters.require(piece.platform());

            DeliveryOptions effective = options == null ? config.defaultOptions() : options;
            Outcome outcome = retrier.publish(adapter, piece, effective.attemptLimit());
            if (outcome instanceof Ok) {
                Ok ok = (Ok) outcome;
                PublishResult result = ok.result();
                ContentPiece published = piece.markPublished(result.platformId(), result.publishedUrl());
                entities.saveContentPiece(published);
                log.info("Published {} to {} in {} attempt(s): {}",
                    piece.id(), piece.platform(), ok.attemptCount(), result.publishedUrl());
                return DeliveryResult.published(published, ok.attemptCount(), clock.instant());
            }

            Fail fail = (Fail) outcome;
            return DeliveryResult.publishFailed(piece, fail.attemptCount(), fail.errorCode(),
                "Error: " + fail.message(), clock.instant());

        } catch (DeliveryException e) {
            log.error("Content {} rejected: {}", piece.id(), e.getMessage());
            return DeliveryResult.rejected(piece, e.getErrorCode(), e.getMessage(), now);
        } catch (RuntimeException e) {
            log.error("Error in publish workflow for {}", piece.id(), e);
            return DeliveryResult.publishFailed(piece, 0, ErrorCode.FATAL_PUBLISH, "Error: " + e.getMessage(),
                clock.instant());
        } finally {
            publishing.remove(piece.id());
        }
    }

    @Override
    public List<DeliveryResult> submitToPlatforms(ContentPiece piece, List<Platform> platforms, DeliveryOptions options) {
        if (piece == null) {
            throw new IllegalArgumentException("piece cannot be null");
        }
        if (platforms == null) {
            throw new IllegalArgumentException("platforms cannot be null");
        }
        List<DeliveryResult> results = new ArrayList<>(platforms.size());
        for (Platform platform : platforms) {
            results.add(submitContent(piece.forPlatform(platform), options));
        }
        return results;
    }

    @Override
    public boolean cancelScheduledDelivery(String scheduledId) {
        if (scheduledId == null || scheduledId.isBlank()) {
            throw new IllegalArgumentException("scheduledId cannot be null or blank");
        }
        boolean existed = cleanupScheduledDelivery(ScheduledDeliveryStore.keyFor(scheduledId), scheduledId);
        log.info("Cancel scheduled delivery {}: {}", scheduledId, existed ? "removed" : "not found");
        return existed;
    }

    @Override
    public int loadScheduledDeliveries() {
        List<String> keys = store.keys();
        List<String> orphaned = new ArrayList<>();
        int restored = 0;

        for (String key : keys) {
            try {
                Optional<ScheduledDeliveryEntry> entry = store.find(key);
                if (entry.isEmpty()) {
                    log.debug("Dropping orphaned scheduled key {}", key);
                    orphaned.add(key);
                    continue;
                }
                arm(key, entry.get());
                restored++;
            } catch (RuntimeException e) {
                log.error("Failed to restore scheduled delivery {}", key, e);
            }
        }

        store.removeKeys(orphaned);
        log.info("Restored {} scheduled deliveries out of {} keys", restored, keys.size());
        return restored;
    }

    @Override
    public Map<Platform, Boolean> checkPlatformConnections() {
        Map<Platform, Boolean> health = new LinkedHashMap<>();
        for (PlatformAdapter adapter : adapters.enabledAdapters()) {
            boolean connected;
            try {
                connected = adapter.checkConnection();
            } catch (RuntimeException e) {
                log.warn("Connection check failed for {}: {}", adapter.platform(), e.getMessage());
                connected = false;
            }
            health.put(adapter.platform(), connected);
        }
        return health;
    }

    @Override
    public void initialize() {
        checkPlatformConnections().forEach((platform, connected) ->
            log.info("Platform {} connection: {}", platform, connected ? "OK" : "FAILED"));
        loadScheduledDeliveries();
    }

    /**
     * 예약 타이머 해제. 캐시 항목은 다음 기동 시 복원을 위해 유지합니다.
     */
    @Override
    public void shutdown() {
        for (String key : store.keys()) {
            String scheduledId = ScheduledDeliveryStore.scheduledIdOf(key);
            scheduler.cancel(scheduledId);
            scheduler.cancel(approvalTaskId(scheduledId));
        }
        log.info("Content delivery runner stopped");
    }

    static String approvalTaskId(String scheduledId) {
        return scheduledId + APPROVAL_TASK_SUFFIX;
    }

    private DeliveryResult requestApproval(ContentPiece formatted, DeliveryOptions merged, Instant now) {
        String contentId = formatted.id();
        awaitingInline.put(contentId, merged);
        try {
            ApprovalRequest<ContentPiece> request = approvals.sendForApproval(formatted, Continuation.publish(contentId));
            DeliveryResult inline = inlineResults.remove(contentId);

            switch (request.status()) {
                case APPROVED:
                    return inline != null ? inline : publishContent(request, merged);
                case REJECTED:
                    log.info("Content {} was rejected: {}", contentId, request.comments());
                    return DeliveryResult.dropped(formatted, "Content was rejected: " + request.comments(), now);
                case FAILED:
                    return DeliveryResult.rejected(formatted, ErrorCode.PROVIDER_UNAVAILABLE,
                        request.comments() != null ? request.comments() : "Approval request failed", now);
                default:
                    log.info("Content {} awaiting approval ({})", contentId, request.id());
                    return DeliveryResult.pendingApproval(formatted, request.status(), now);
            }
        } finally {
            awaitingInline.remove(contentId);
            inlineResults.remove(contentId);
        }
    }

    private DeliveryResult scheduleContentDelivery(ContentPiece formatted, DeliveryOptions merged, Instant now) {
        Instant scheduledTime = merged.scheduledTime();
        String scheduledId = ScheduledDeliveryStore.scheduledId(formatted.id(), scheduledTime);
        String key = ScheduledDeliveryStore.keyFor(scheduledId);

        ScheduledDeliveryEntry entry = ScheduledDeliveryEntry.create(formatted, merged, now);
        store.save(key, entry);
        store.addKey(key);
        arm(key, entry);

        log.info("Scheduled {} for delivery at {} ({})", formatted.id(), scheduledTime, scheduledId);
        return DeliveryResult.scheduled(formatted, scheduledTime, now);
    }

    /**
     * 예약 항목의 타이머 설정 (신규 예약과 재시작 복원 공용).
     */
    private void arm(String key, ScheduledDeliveryEntry entry) {
        String scheduledId = ScheduledDeliveryStore.scheduledIdOf(key);
        Instant now = clock.instant();
        Instant scheduledTime = entry.scheduledTime();

        if (shouldPrefetch(entry, now)) {
            Instant approvalTime = scheduledTime.minusMillis(entry.options().approvalOffsetOrZero());
            scheduler.schedule(approvalTaskId(scheduledId), latest(approvalTime, now), () -> prefetchApproval(key));
            log.debug("Armed approval prefetch for {} at {}", scheduledId, latest(approvalTime, now));
        }
        scheduler.schedule(scheduledId, latest(scheduledTime, now), () -> fireDelivery(key));
    }

    private boolean shouldPrefetch(ScheduledDeliveryEntry entry, Instant now) {
        DeliveryOptions options = entry.options();
        return options.approvalOffsetOrZero() > 0
            && !options.shouldSkipApproval()
            && approvals.isEnabled()
            && entry.approvalStatus() == null
            && !entry.processing()
            && entry.scheduledTime().isAfter(now);
    }

    private void prefetchApproval(String key) {
        Optional<ScheduledDeliveryEntry> marked = store.update(key, entry -> entry.markProcessing(clock.instant()));
        if (marked.isEmpty()) {
            log.debug("Scheduled entry {} disappeared before approval prefetch", key);
            return;
        }
        ScheduledDeliveryEntry entry = marked.get();
        log.info("Requesting pre-approval for scheduled content {}", entry.contentPiece().id());

        try {
            ApprovalRequest<ContentPiece> request = approvals.sendForApproval(
                entry.contentPiece(), Continuation.recordApprovalOnly(key)
            );
            // 후속 작업이 이미 종료 상태를 기록했으면 유지
            store.update(key, current -> current.approvalStatus() != null && current.approvalStatus().isTerminal()
                ? current.clearProcessing(clock.instant())
                : current.withApproval(request.status(), request.id(), request.content()));
        } catch (RuntimeException e) {
            log.error("Approval prefetch failed for {}", key, e);
            store.update(key, current -> current.clearProcessing(clock.instant()));
        }
    }

    private void fireDelivery(String key) {
        String scheduledId = ScheduledDeliveryStore.scheduledIdOf(key);
        Optional<Boolean> ran = cacheLock.withLock(DELIVERY_LOCK_PREFIX + scheduledId, () -> {
            deliverScheduled(key, scheduledId);
            return Boolean.TRUE;
        });
        if (ran.isEmpty()) {
            log.info("Scheduled delivery {} is held by another worker, skipping", scheduledId);
        }
    }

    private void deliverScheduled(String key, String scheduledId) {
        try {
            Optional<ScheduledDeliveryEntry> found = store.find(key);
            if (found.isEmpty()) {
                log.warn("Scheduled content not found in cache: {}", scheduledId);
                return;
            }
            ScheduledDeliveryEntry entry = awaitProcessing(key, found.get());
            ContentPiece piece = entry.contentPiece();
            DeliveryOptions options = entry.options().withScheduledTime(null);
            log.info("Executing scheduled delivery: {}", piece.id());

            DeliveryResult result;
            if (entry.approvalStatus() == ApprovalStatus.APPROVED && entry.formattedContent() != null) {
                ApprovalRequest<ContentPiece> preApproved = ApprovalRequest.create(
                    entry.formattedContent(), ApprovalConfig.AUTO_PROVIDER_NAME, config.requesterId(),
                    clock.instant(), ApprovalStatus.APPROVED, null
                ).withComments("Pre-approved for scheduled delivery");
                result = publishContent(preApproved, options);
            } else if (entry.approvalStatus() == ApprovalStatus.REJECTED) {
                log.warn("Scheduled content was rejected during pre-approval: {}", piece.id());
                return;
            } else {
                result = submitContent(piece, options);
            }
            log.info("Scheduled delivery {} finished at stage {}", scheduledId, result.stage());

        } catch (RuntimeException e) {
            log.error("Error executing scheduled delivery {}", scheduledId, e);
        } finally {
            cleanupScheduledDelivery(key, scheduledId);
        }
    }

    private ScheduledDeliveryEntry awaitProcessing(String key, ScheduledDeliveryEntry entry) {
        ScheduledDeliveryEntry current = entry;
        for (int i = 0; i < config.processingWaitAttempts() && current.processing(); i++) {
            if (i == 0) {
                log.info("Waiting for approval processing to complete: {}", key);
            }
            sleep(config.processingWaitIntervalMs());
            Optional<ScheduledDeliveryEntry> latest = store.find(key);
            if (latest.isEmpty()) {
                return current;
            }
            current = latest.get();
        }
        if (current.processing()) {
            log.warn("Approval still processing after wait, proceeding: {}", key);
        }
        return current;
    }

    private boolean cleanupScheduledDelivery(String key, String scheduledId) {
        boolean existed = scheduler.cancel(scheduledId);
        existed |= scheduler.cancel(approvalTaskId(scheduledId));
        try {
            existed |= store.find(key).isPresent();
            store.delete(key);
            store.removeKey(key);
        } catch (RuntimeException e) {
            log.error("Failed to clean up scheduled delivery {}", scheduledId, e);
        }
        return existed;
    }

    @SuppressWarnings("unchecked")
    private void onPublishContinuation(ApprovalRequest<?> request, Continuation continuation) {
        if (request.status() != ApprovalStatus.APPROVED) {
            if (request.status().isTerminal()) {
                log.info("Approval {} ended as {}, content will not be published", request.id(), request.status());
            }
            return;
        }
        if (!(request.content() instanceof ContentPiece)) {
            log.warn("Publish continuation received non-content payload: {}", request.id());
            return;
        }
        ApprovalRequest<ContentPiece> approved = (ApprovalRequest<ContentPiece>) request;
        String contentId = approved.content().id();
        DeliveryOptions inlineOptions = awaitingInline.get(contentId);

        DeliveryResult result = publishContent(approved, inlineOptions != null ? inlineOptions : config.defaultOptions());
        if (inlineOptions != null) {
            inlineResults.put(contentId, result);
        }
        log.info("Approved content {} delivered with stage {}", contentId, result.stage());
    }

    private void onRecordApprovalOnly(ApprovalRequest<?> request, Continuation continuation) {
        String key = ((Continuation.RecordApprovalOnly) continuation).cacheKey();
        if (!(request.content() instanceof ContentPiece)) {
            log.warn("Approval record received non-content payload: {}", request.id());
            return;
        }
        ContentPiece approvedContent = (ContentPiece) request.content();
        Optional<ScheduledDeliveryEntry> updated = store.update(key,
            entry -> entry.withApproval(request.status(), request.id(), approvedContent));
        if (updated.isEmpty()) {
            log.debug("Scheduled entry {} no longer exists, approval {} not recorded", key, request.id());
        } else {
            log.info("Recorded pre-approval {} for {}", request.status(), key);
        }
    }

    private boolean isPublished(ContentPiece piece) {
        if (piece.status() == ContentStatus.PUBLISHED) {
            return true;
        }
        return entities.findContentPiece(piece.id())
            .map(stored -> stored.status() == ContentStatus.PUBLISHED)
            .orElse(false);
    }

    private static Instant latest(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
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
            throw new RuntimeException("Interrupted while waiting for approval processing", e);
        }
    }
}
