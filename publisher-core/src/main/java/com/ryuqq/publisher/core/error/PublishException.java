package com.ryuqq.publisher.core.error;

/**
 * 플랫폼 게시 오류.
 *
 * <p>어댑터는 일시 오류와 치명 오류를 구분해서 던질 수 있습니다.
 * 구분 없이 던진 일반 예외는 메시지 패턴으로 분류됩니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public class PublishException extends DeliveryException {

    public PublishException(ErrorCode errorCode, String message) {
        super(requirePublishCode(errorCode), message);
    }

    public PublishException(ErrorCode errorCode, String message, Throwable cause) {
        super(requirePublishCode(errorCode), message, cause);
    }

    public static PublishException transientError(String message) {
        return new PublishException(ErrorCode.TRANSIENT_PUBLISH, message);
    }

    public static PublishException fatal(String message) {
        return new PublishException(ErrorCode.FATAL_PUBLISH, message);
    }

    public boolean isTransient() {
        return getErrorCode() == ErrorCode.TRANSIENT_PUBLISH;
    }

    private static ErrorCode requirePublishCode(ErrorCode errorCode) {
        if (errorCode != ErrorCode.TRANSIENT_PUBLISH && errorCode != ErrorCode.FATAL_PUBLISH) {
            throw new IllegalArgumentException(
                "errorCode must be TRANSIENT_PUBLISH or FATAL_PUBLISH (current: " + errorCode + ")"
            );
        }
        return errorCode;
    }
}
