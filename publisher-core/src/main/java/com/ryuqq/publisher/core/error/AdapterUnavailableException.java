package com.ryuqq.publisher.core.error;

import com.ryuqq.publisher.core.model.Platform;

/**
 * 플랫폼 어댑터가 등록되지 않았거나 비활성화된 경우.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public class AdapterUnavailableException extends DeliveryException {

    private final Platform platform;

    public AdapterUnavailableException(Platform platform) {
        super(ErrorCode.ADAPTER_UNAVAILABLE, "No adapter found for platform: " + platform);
        this.platform = platform;
    }

    public Platform getPlatform() {
        return platform;
    }
}
