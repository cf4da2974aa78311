package com.ryuqq.publisher.core.error;

/**
 * 전달 파이프라인 예외의 기반 클래스.
 *
 * <p>모든 하위 예외는 {@link ErrorCode}를 가지며, Orchestrator 경계에서
 * {@code DeliveryResult.error}로 변환됩니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public class DeliveryException extends RuntimeException {

    private final ErrorCode errorCode;

    public DeliveryException(ErrorCode errorCode, String message) {
        super(message);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    public DeliveryException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
