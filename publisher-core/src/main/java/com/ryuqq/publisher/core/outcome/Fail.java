package com.ryuqq.publisher.core.outcome;

import com.ryuqq.publisher.core.error.ErrorCode;

/**
 * 영구적 실패 (더 이상 재시도하지 않음).
 *
 * <p>치명 오류 패턴(인증 실패, 권한 부족, 계정 정지, 요청 한도 초과 등)에 해당하거나
 * 일시 오류가 최대 시도 횟수까지 반복된 경우입니다.</p>
 *
 * @param errorCode FATAL_PUBLISH 또는 TRANSIENT_PUBLISH (소진)
 * @param message 마지막 오류 메시지
 * @param attemptCount 시도 횟수
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public record Fail(
    ErrorCode errorCode,
    String message,
    int attemptCount
) implements Outcome {

    public Fail {
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must be non-negative (current: " + attemptCount + ")");
        }
    }

    /**
     * 재시도를 모두 소진한 실패인지 확인.
     *
     * @return errorCode가 TRANSIENT_PUBLISH인 경우 true
     */
    public boolean exhausted() {
        return errorCode == ErrorCode.TRANSIENT_PUBLISH;
    }
}
