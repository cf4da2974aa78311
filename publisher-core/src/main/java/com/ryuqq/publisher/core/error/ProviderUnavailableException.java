package com.ryuqq.publisher.core.error;

/**
 * 승인 제공자를 찾을 수 없거나 등록이 충돌하는 경우.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public class ProviderUnavailableException extends DeliveryException {

    public ProviderUnavailableException(String message) {
        super(ErrorCode.PROVIDER_UNAVAILABLE, message);
    }
}
