package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.core.model.DeliveryOptions;

import java.time.Duration;
import java.util.Properties;

/**
 * Delivery Orchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultOptions: 호출자 옵션 아래에 깔리는 기본 옵션 (retry=true, maxRetries=3,
 *       validateBeforePublish=true, skipApproval=false, approvalOffset=3h)</li>
 *   <li>retryBaseDelayMs / retryMaxDelayMs: 게시 재시도 백오프 (기본 1000ms / 30000ms)</li>
 *   <li>graceMs: 예약 시각 이후 항목 보존 기간 (기본 24h)</li>
 *   <li>stuckThresholdMs: isProcessing 고착 판정 기준 (기본 30분)</li>
 *   <li>processingWaitAttempts / processingWaitIntervalMs: 게시 타이머의 승인 대기 폴링 (기본 12 × 10s)</li>
 *   <li>maintenanceIntervalMs: 유지보수 스윕 주기 (기본 2h)</li>
 *   <li>monitorIntervalMs: 예약 재무장 안전망 주기 (기본 15분)</li>
 *   <li>schedulerTickMs: 스케줄러 pump 간격 (기본 1000ms)</li>
 *   <li>workerThreads: 타이머 본문 실행 스레드 수 (기본 4)</li>
 *   <li>requesterId: 승인 요청 요청자 ID (기본 "publisher")</li>
 * </ul>
 *
 * @author Publisher Team
 * @since 1.0.0
 * @param defaultOptions 기본 옵션 (모든 필드 non-null)
 * @param retryBaseDelayMs 재시도 기본 지연 (밀리초, 양수)
 * @param retryMaxDelayMs 재시도 최대 지연 (밀리초)
 * @param graceMs 유예 기간 (밀리초, 양수)
 * @param stuckThresholdMs 고착 기준 (밀리초, 양수)
 * @param processingWaitAttempts 승인 대기 폴링 횟수 (0 이상)
 * @param processingWaitIntervalMs 승인 대기 폴링 간격 (밀리초, 양수)
 * @param maintenanceIntervalMs 유지보수 주기 (밀리초, 양수)
 * @param monitorIntervalMs 재무장 주기 (밀리초, 양수)
 * @param schedulerTickMs pump 간격 (밀리초, 양수)
 * @param workerThreads 작업 스레드 수 (양수)
 * @param requesterId 요청자 ID
 */
public record DeliveryConfig(
    DeliveryOptions defaultOptions,
    long retryBaseDelayMs,
    long retryMaxDelayMs,
    long graceMs,
    long stuckThresholdMs,
    int processingWaitAttempts,
    long processingWaitIntervalMs,
    long maintenanceIntervalMs,
    long monitorIntervalMs,
    long schedulerTickMs,
    int workerThreads,
    String requesterId
) {

    /**
     * 기본 설정 생성자.
     */
    public DeliveryConfig() {
        this(DeliveryOptions.defaults(), 1000, 30000, Duration.ofHours(24).toMillis(),
            Duration.ofMinutes(30).toMillis(), 12, 10000, Duration.ofHours(2).toMillis(),
            Duration.ofMinutes(15).toMillis(), 1000, 4, "publisher");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DeliveryConfig {
        if (defaultOptions == null) {
            throw new IllegalArgumentException("defaultOptions cannot be null");
        }
        defaultOptions = defaultOptions.mergedOver(DeliveryOptions.defaults());
        if (retryBaseDelayMs <= 0) {
            throw new IllegalArgumentException("retryBaseDelayMs must be positive (current: " + retryBaseDelayMs + ")");
        }
        if (retryMaxDelayMs < retryBaseDelayMs) {
            throw new IllegalArgumentException(
                "retryMaxDelayMs must be >= retryBaseDelayMs (base: " + retryBaseDelayMs + ", max: " + retryMaxDelayMs + ")"
            );
        }
        if (graceMs <= 0) {
            throw new IllegalArgumentException("graceMs must be positive (current: " + graceMs + ")");
        }
        if (stuckThresholdMs <= 0) {
            throw new IllegalArgumentException("stuckThresholdMs must be positive (current: " + stuckThresholdMs + ")");
        }
        if (processingWaitAttempts < 0) {
            throw new IllegalArgumentException(
                "processingWaitAttempts must be non-negative (current: " + processingWaitAttempts + ")"
            );
        }
        if (processingWaitIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "processingWaitIntervalMs must be positive (current: " + processingWaitIntervalMs + ")"
            );
        }
        if (maintenanceIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "maintenanceIntervalMs must be positive (current: " + maintenanceIntervalMs + ")"
            );
        }
        if (monitorIntervalMs <= 0) {
            throw new IllegalArgumentException("monitorIntervalMs must be positive (current: " + monitorIntervalMs + ")");
        }
        if (schedulerTickMs <= 0) {
            throw new IllegalArgumentException("schedulerTickMs must be positive (current: " + schedulerTickMs + ")");
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive (current: " + workerThreads + ")");
        }
        if (requesterId == null || requesterId.isBlank()) {
            throw new IllegalArgumentException("requesterId cannot be null or blank");
        }
    }

    /**
     * Properties에서 설정 읽기.
     *
     * <p>키: {@code DELIVERY_RETRY}, {@code DELIVERY_MAX_RETRIES}, {@code DELIVERY_VALIDATE},
     * {@code DELIVERY_SKIP_APPROVAL}, {@code DELIVERY_APPROVAL_OFFSET_MINUTES},
     * {@code DELIVERY_MAINTENANCE_INTERVAL_MINUTES}, {@code DELIVERY_MONITOR_INTERVAL_MINUTES},
     * {@code DELIVERY_WORKER_THREADS}</p>
     *
     * @param properties 설정 값
     * @return DeliveryConfig
     */
    public static DeliveryConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        DeliveryConfig defaults = new DeliveryConfig();
        DeliveryOptions base = defaults.defaultOptions();
        DeliveryOptions options = base
            .withRetry(ConfigProperties.booleanValue(properties, "DELIVERY_RETRY", base.retry()))
            .withMaxRetries(ConfigProperties.positiveInt(properties, "DELIVERY_MAX_RETRIES", base.maxRetries()))
            .withValidateBeforePublish(
                ConfigProperties.booleanValue(properties, "DELIVERY_VALIDATE", base.validateBeforePublish()))
            .withSkipApproval(ConfigProperties.booleanValue(properties, "DELIVERY_SKIP_APPROVAL", base.skipApproval()))
            .withApprovalOffsetMs(Duration.ofMinutes(ConfigProperties.positiveLong(
                properties, "DELIVERY_APPROVAL_OFFSET_MINUTES", Duration.ofMillis(base.approvalOffsetMs()).toMinutes()
            )).toMillis());

        return defaults
            .withDefaultOptions(options)
            .withMaintenanceIntervalMs(Duration.ofMinutes(ConfigProperties.positiveLong(
                properties, "DELIVERY_MAINTENANCE_INTERVAL_MINUTES", 120)).toMillis())
            .withMonitorIntervalMs(Duration.ofMinutes(ConfigProperties.positiveLong(
                properties, "DELIVERY_MONITOR_INTERVAL_MINUTES", 15)).toMillis())
            .withWorkerThreads(ConfigProperties.positiveInt(properties, "DELIVERY_WORKER_THREADS", defaults.workerThreads()));
    }

    public DeliveryConfig withDefaultOptions(DeliveryOptions defaultOptions) {
        return new DeliveryConfig(defaultOptions, retryBaseDelayMs, retryMaxDelayMs, graceMs, stuckThresholdMs,
            processingWaitAttempts, processingWaitIntervalMs, maintenanceIntervalMs, monitorIntervalMs,
            schedulerTickMs, workerThreads, requesterId);
    }

    /**
     * 재시도 백오프만 변경한 새 인스턴스 생성.
     */
    public DeliveryConfig withRetryBackoff(long retryBaseDelayMs, long retryMaxDelayMs) {
        return new DeliveryConfig(defaultOptions, retryBaseDelayMs, retryMaxDelayMs, graceMs, stuckThresholdMs,
            processingWaitAttempts, processingWaitIntervalMs, maintenanceIntervalMs, monitorIntervalMs,
            schedulerTickMs, workerThreads, requesterId);
    }

    public DeliveryConfig withGraceMs(long graceMs) {
        return new DeliveryConfig(defaultOptions, retryBaseDelayMs, retryMaxDelayMs, graceMs, stuckThresholdMs,
            processingWaitAttempts, processingWaitIntervalMs, maintenanceIntervalMs, monitorIntervalMs,
            schedulerTickMs, workerThreads, requesterId);
    }

    public DeliveryConfig withStuckThresholdMs(long stuckThresholdMs) {
        return new DeliveryConfig(defaultOptions, retryBaseDelayMs, retryMaxDelayMs, graceMs, stuckThresholdMs,
            processingWaitAttempts, processingWaitIntervalMs, maintenanceIntervalMs, monitorIntervalMs,
            schedulerTickMs, workerThreads, requesterId);
    }

    /**
     * 승인 대기 폴링만 변경한 새 인스턴스 생성.
     */
    public DeliveryConfig withProcessingWait(int processingWaitAttempts, long processingWaitIntervalMs) {
        return new DeliveryConfig(defaultOptions, retryBaseDelayMs, retryMaxDelayMs, graceMs, stuckThresholdMs,
            processingWaitAttempts, processingWaitIntervalMs, maintenanceIntervalMs, monitorIntervalMs,
            schedulerTickMs, workerThreads, requesterId);
    }

    public DeliveryConfig withMaintenanceIntervalMs(long maintenanceIntervalMs) {
        return new DeliveryConfig(defaultOptions, retryBaseDelayMs, retryMaxDelayMs, graceMs, stuckThresholdMs,
            processingWaitAttempts, processingWaitIntervalMs, maintenanceIntervalMs, monitorIntervalMs,
            schedulerTickMs, workerThreads, requesterId);
    }

    public DeliveryConfig withMonitorIntervalMs(long monitorIntervalMs) {
        return new DeliveryConfig(defaultOptions, retryBaseDelayMs, retryMaxDelayMs, graceMs, stuckThresholdMs,
            processingWaitAttempts, processingWaitIntervalMs, maintenanceIntervalMs, monitorIntervalMs,
            schedulerTickMs, workerThreads, requesterId);
    }

    public DeliveryConfig withWorkerThreads(int workerThreads) {
        return new DeliveryConfig(defaultOptions, retryBaseDelayMs, retryMaxDelayMs, graceMs, stuckThresholdMs,
            processingWaitAttempts, processingWaitIntervalMs, maintenanceIntervalMs, monitorIntervalMs,
            schedulerTickMs, workerThreads, requesterId);
    }

    public DeliveryConfig withRequesterId(String requesterId) {
        return new DeliveryConfig(defaultOptions, retryBaseDelayMs, retryMaxDelayMs, graceMs, stuckThresholdMs,
            processingWaitAttempts, processingWaitIntervalMs, maintenanceIntervalMs, monitorIntervalMs,
            schedulerTickMs, workerThreads, requesterId);
    }
}
