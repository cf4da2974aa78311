package com.ryuqq.publisher.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void calculate_시도마다_지연이_두배로_증가함() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1000, 30000, 0.0);

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(1000);
        assertThat(calculator.calculate(2)).isEqualTo(2000);
        assertThat(calculator.calculate(3)).isEqualTo(4000);
        assertThat(calculator.calculate(5)).isEqualTo(16000);
    }

    @Test
    void calculate_최대_지연을_넘지_않음() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1000, 30000, 0.0);

        // when & then
        assertThat(calculator.calculate(6)).isEqualTo(30000);
        assertThat(calculator.calculate(100)).isEqualTo(30000);
    }

    @Test
    void calculate_jitter가_있어도_범위_안에_있음() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1000, 30000, 0.5);

        // when & then
        for (int i = 0; i < 50; i++) {
            assertThat(calculator.calculate(2)).isBetween(2000L, 3000L);
        }
    }

    @Test
    void calculate_attemptCount가_0이면_예외() {
        BackoffCalculator calculator = new BackoffCalculator();

        assertThatThrownBy(() -> calculator.calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attemptCount must be positive");
    }

    @Test
    void 생성자_max가_base보다_작으면_예외() {
        assertThatThrownBy(() -> new BackoffCalculator(1000, 500, 0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs must be >= baseDelayMs");
    }

    @Test
    void 생성자_jitter가_범위를_벗어나면_예외() {
        assertThatThrownBy(() -> new BackoffCalculator(1000, 2000, 1.5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jitterFactor");
    }
}
