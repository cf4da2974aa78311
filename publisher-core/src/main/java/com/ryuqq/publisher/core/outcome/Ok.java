package com.ryuqq.publisher.core.outcome;

import com.ryuqq.publisher.core.model.PublishResult;

/**
 * 게시 성공.
 *
 * @param result 어댑터 게시 결과 (success=true)
 * @param attemptCount 성공까지의 시도 횟수
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public record Ok(
    PublishResult result,
    int attemptCount
) implements Outcome {

    public Ok {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (!result.success()) {
            throw new IllegalArgumentException("result must be successful");
        }
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
    }
}
