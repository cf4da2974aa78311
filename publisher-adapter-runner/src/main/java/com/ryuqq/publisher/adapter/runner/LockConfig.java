package com.ryuqq.publisher.adapter.runner;

import java.time.Duration;

/**
 * 캐시 락 설정 (불변 record).
 *
 * @author Publisher Team
 * @since 1.0.0
 * @param timeoutMs 락 TTL이자 오래된 락 판정 기준 (밀리초, 기본 300000ms = 5분)
 */
public record LockConfig(long timeoutMs) {

    public LockConfig() {
        this(Duration.ofMinutes(5).toMillis());
    }

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
    }
}
