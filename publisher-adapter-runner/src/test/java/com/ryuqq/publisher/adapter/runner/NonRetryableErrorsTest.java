package com.ryuqq.publisher.adapter.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * NonRetryableErrors 유닛 테스트.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class NonRetryableErrorsTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "Authentication failed for token",
        "insufficient permissions to post",
        "Invalid content format: too long",
        "ACCOUNT SUSPENDED",
        "429: Rate limit exceeded"
    })
    void matches_영구_오류_메시지는_대소문자_무관하게_일치함(String message) {
        assertThat(NonRetryableErrors.matches(message)).isTrue();
    }

    @Test
    void matches_일시적_오류는_일치하지_않음() {
        assertThat(NonRetryableErrors.matches("connection reset")).isFalse();
        assertThat(NonRetryableErrors.matches("Service unavailable")).isFalse();
    }

    @Test
    void matches_null이나_빈_문자열은_false() {
        assertThat(NonRetryableErrors.matches(null)).isFalse();
        assertThat(NonRetryableErrors.matches("  ")).isFalse();
    }
}
