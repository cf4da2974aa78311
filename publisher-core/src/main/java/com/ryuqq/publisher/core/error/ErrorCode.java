package com.ryuqq.publisher.core.error;

/**
 * 전달 파이프라인 오류 분류.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /**
     * 플랫폼 규칙 위반. 재시도하지 않음.
     */
    VALIDATION_FAILED(false),

    /**
     * 승인 제공자를 찾을 수 없음. 요청은 FAILED 처리.
     */
    PROVIDER_UNAVAILABLE(false),

    /**
     * 네트워크/플랫폼 일시 오류. 백오프 후 재시도.
     */
    TRANSIENT_PUBLISH(true),

    /**
     * 인증, 권한, 정지, 요청 한도 초과 등. 즉시 중단.
     */
    FATAL_PUBLISH(false),

    ALREADY_PUBLISHED(false),

    NOT_APPROVED(false),

    ADAPTER_UNAVAILABLE(false);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
