package com.ryuqq.publisher.adapter.runner;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Approval Coordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>enabled: 승인 단계 사용 여부 (기본 true, false면 전달 시 인라인 자동 승인)</li>
 *   <li>autoApprove: 제공자 없이 즉시 승인 (기본 false)</li>
 *   <li>autoRejectDays: 이 일수를 넘긴 대기 요청은 자동 거절 (기본 7)</li>
 *   <li>checkIntervalMs: 상태 확인 스윕 주기 (기본 60000ms = 1분)</li>
 *   <li>platformProviderMapping: 플랫폼 → 제공자 이름 매핑</li>
 *   <li>defaultProviderName: 기획 등 플랫폼 없는 페이로드의 제공자 (기본 "default")</li>
 *   <li>callbackMaxAttempts / callbackBaseDelayMs / callbackMaxDelayMs: 후속 작업 재시도 (기본 3회, 2000ms, 30000ms)</li>
 *   <li>sweepConcurrency: 스윕 동시 확인 수 (기본 5)</li>
 *   <li>requestTtlMs: 승인 요청 캐시 보존 기간 (기본 7일)</li>
 *   <li>sweepEnabled: 주기적 스윕 사용 여부 (기본 true)</li>
 * </ul>
 *
 * <p><strong>Properties 키:</strong> {@code APPROVAL_ENABLED}, {@code APPROVAL_AUTOAPPROVE},
 * {@code AUTO_REJECT_DAYS}, {@code APPROVAL_CHECK_INTERVAL} (분),
 * {@code PLATFORM_PROVIDER_MAPPING} ({@code twitter=discord,medium=discord})</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 * @param enabled 승인 사용 여부
 * @param autoApprove 자동 승인 여부
 * @param autoRejectDays 자동 거절 기준 일수 (양수)
 * @param checkIntervalMs 스윕 주기 (밀리초, 양수)
 * @param platformProviderMapping 플랫폼 → 제공자 매핑 (null이면 빈 매핑)
 * @param defaultProviderName 기본 제공자 이름
 * @param callbackMaxAttempts 후속 작업 최대 시도 횟수 (양수)
 * @param callbackBaseDelayMs 후속 작업 재시도 기본 지연 (밀리초, 양수)
 * @param callbackMaxDelayMs 후속 작업 재시도 최대 지연 (밀리초)
 * @param sweepConcurrency 스윕 동시성 (양수)
 * @param requestTtlMs 승인 요청 캐시 TTL (밀리초, 양수)
 * @param sweepEnabled 주기적 스윕 여부
 */
public record ApprovalConfig(
    boolean enabled,
    boolean autoApprove,
    int autoRejectDays,
    long checkIntervalMs,
    Map<String, String> platformProviderMapping,
    String defaultProviderName,
    int callbackMaxAttempts,
    long callbackBaseDelayMs,
    long callbackMaxDelayMs,
    int sweepConcurrency,
    long requestTtlMs,
    boolean sweepEnabled
) {

    public static final String DEFAULT_PROVIDER_NAME = "default";
    public static final String AUTO_PROVIDER_NAME = "auto";

    /**
     * 기본 설정 생성자.
     */
    public ApprovalConfig() {
        this(true, false, 7, Duration.ofMinutes(1).toMillis(), Map.of(), DEFAULT_PROVIDER_NAME,
            3, 2000, 30000, 5, Duration.ofDays(7).toMillis(), true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ApprovalConfig {
        if (autoRejectDays <= 0) {
            throw new IllegalArgumentException("autoRejectDays must be positive (current: " + autoRejectDays + ")");
        }
        if (checkIntervalMs <= 0) {
            throw new IllegalArgumentException("checkIntervalMs must be positive (current: " + checkIntervalMs + ")");
        }
        if (defaultProviderName == null || defaultProviderName.isBlank()) {
            throw new IllegalArgumentException("defaultProviderName cannot be null or blank");
        }
        if (callbackMaxAttempts <= 0) {
            throw new IllegalArgumentException(
                "callbackMaxAttempts must be positive (current: " + callbackMaxAttempts + ")"
            );
        }
        if (callbackBaseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "callbackBaseDelayMs must be positive (current: " + callbackBaseDelayMs + ")"
            );
        }
        if (callbackMaxDelayMs < callbackBaseDelayMs) {
            throw new IllegalArgumentException(
                "callbackMaxDelayMs must be >= callbackBaseDelayMs (base: " + callbackBaseDelayMs
                    + ", max: " + callbackMaxDelayMs + ")"
            );
        }
        if (sweepConcurrency <= 0) {
            throw new IllegalArgumentException("sweepConcurrency must be positive (current: " + sweepConcurrency + ")");
        }
        if (requestTtlMs <= 0) {
            throw new IllegalArgumentException("requestTtlMs must be positive (current: " + requestTtlMs + ")");
        }
        platformProviderMapping = platformProviderMapping == null ? Map.of() : Map.copyOf(platformProviderMapping);
    }

    /**
     * Properties에서 설정 읽기. 없는 키는 기본값을 사용합니다.
     *
     * @param properties 설정 값
     * @return ApprovalConfig
     */
    public static ApprovalConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        ApprovalConfig defaults = new ApprovalConfig();
        return defaults
            .withEnabled(ConfigProperties.booleanValue(properties, "APPROVAL_ENABLED", defaults.enabled()))
            .withAutoApprove(ConfigProperties.booleanValue(properties, "APPROVAL_AUTOAPPROVE", defaults.autoApprove()))
            .withAutoRejectDays(ConfigProperties.positiveInt(properties, "AUTO_REJECT_DAYS", defaults.autoRejectDays()))
            .withCheckIntervalMs(Duration.ofMinutes(
                ConfigProperties.positiveLong(properties, "APPROVAL_CHECK_INTERVAL", 1)).toMillis())
            .withPlatformProviderMapping(ConfigProperties.mapping(properties, "PLATFORM_PROVIDER_MAPPING"));
    }

    public ApprovalConfig withEnabled(boolean enabled) {
        return new ApprovalConfig(enabled, autoApprove, autoRejectDays, checkIntervalMs, platformProviderMapping,
            defaultProviderName, callbackMaxAttempts, callbackBaseDelayMs, callbackMaxDelayMs, sweepConcurrency,
            requestTtlMs, sweepEnabled);
    }

    public ApprovalConfig withAutoApprove(boolean autoApprove) {
        return new ApprovalConfig(enabled, autoApprove, autoRejectDays, checkIntervalMs, platformProviderMapping,
            defaultProviderName, callbackMaxAttempts, callbackBaseDelayMs, callbackMaxDelayMs, sweepConcurrency,
            requestTtlMs, sweepEnabled);
    }

    public ApprovalConfig withAutoRejectDays(int autoRejectDays) {
        return new ApprovalConfig(enabled, autoApprove, autoRejectDays, checkIntervalMs, platformProviderMapping,
            defaultProviderName, callbackMaxAttempts, callbackBaseDelayMs, callbackMaxDelayMs, sweepConcurrency,
            requestTtlMs, sweepEnabled);
    }

    public ApprovalConfig withCheckIntervalMs(long checkIntervalMs) {
        return new ApprovalConfig(enabled, autoApprove, autoRejectDays, checkIntervalMs, platformProviderMapping,
            defaultProviderName, callbackMaxAttempts, callbackBaseDelayMs, callbackMaxDelayMs, sweepConcurrency,
            requestTtlMs, sweepEnabled);
    }

    public ApprovalConfig withPlatformProviderMapping(Map<String, String> platformProviderMapping) {
        return new ApprovalConfig(enabled, autoApprove, autoRejectDays, checkIntervalMs, platformProviderMapping,
            defaultProviderName, callbackMaxAttempts, callbackBaseDelayMs, callbackMaxDelayMs, sweepConcurrency,
            requestTtlMs, sweepEnabled);
    }

    public ApprovalConfig withDefaultProviderName(String defaultProviderName) {
        return new ApprovalConfig(enabled, autoApprove, autoRejectDays, checkIntervalMs, platformProviderMapping,
            defaultProviderName, callbackMaxAttempts, callbackBaseDelayMs, callbackMaxDelayMs, sweepConcurrency,
            requestTtlMs, sweepEnabled);
    }

    /**
     * 후속 작업 재시도 설정만 변경한 새 인스턴스 생성.
     */
    public ApprovalConfig withCallbackRetry(int callbackMaxAttempts, long callbackBaseDelayMs, long callbackMaxDelayMs) {
        return new ApprovalConfig(enabled, autoApprove, autoRejectDays, checkIntervalMs, platformProviderMapping,
            defaultProviderName, callbackMaxAttempts, callbackBaseDelayMs, callbackMaxDelayMs, sweepConcurrency,
            requestTtlMs, sweepEnabled);
    }

    public ApprovalConfig withSweepConcurrency(int sweepConcurrency) {
        return new ApprovalConfig(enabled, autoApprove, autoRejectDays, checkIntervalMs, platformProviderMapping,
            defaultProviderName, callbackMaxAttempts, callbackBaseDelayMs, callbackMaxDelayMs, sweepConcurrency,
            requestTtlMs, sweepEnabled);
    }

    public ApprovalConfig withSweepEnabled(boolean sweepEnabled) {
        return new ApprovalConfig(enabled, autoApprove, autoRejectDays, checkIntervalMs, platformProviderMapping,
            defaultProviderName, callbackMaxAttempts, callbackBaseDelayMs, callbackMaxDelayMs, sweepConcurrency,
            requestTtlMs, sweepEnabled);
    }

    public Duration autoRejectAge() {
        return Duration.ofDays(autoRejectDays);
    }
}
