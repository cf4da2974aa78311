package com.ryuqq.publisher.core.outcome;

/**
 * 게시 시도 1회의 분류 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 게시 성공</li>
 *   <li>{@link Retry}: 일시적 실패, 백오프 후 재시도</li>
 *   <li>{@link Fail}: 치명적 실패 또는 시도 횟수 소진</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Retry, Fail {

    /**
     * @return 지금까지의 시도 횟수 (1 이상)
     */
    int attemptCount();

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isRetry() {
        return this instanceof Retry;
    }

    default boolean isFail() {
        return this instanceof Fail;
    }
}
