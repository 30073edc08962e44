package com.ryuqq.monobuild.adapter.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExecutorConfig 테스트.
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
class ExecutorConfigTest {

    @Test
    void 기본_설정은_코어_수와_타임아웃_없음() {
        ExecutorConfig config = new ExecutorConfig();

        assertThat(config.concurrency()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(config.timeout()).isNull();
        assertThat(config.abortOnFirstFailure()).isFalse();
    }

    @Test
    void with_메서드는_한_필드만_변경함() {
        ExecutorConfig config = new ExecutorConfig(4, null, false)
            .withTimeout(Duration.ofMinutes(5))
            .withAbortOnFirstFailure(true);

        assertThat(config.concurrency()).isEqualTo(4);
        assertThat(config.timeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.abortOnFirstFailure()).isTrue();
    }

    @Test
    void concurrency가_0이하면_예외() {
        assertThatThrownBy(() -> new ExecutorConfig(0, null, false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency must be positive (current: 0)");
    }

    @Test
    void timeout이_0이면_예외() {
        assertThatThrownBy(() -> new ExecutorConfig(1, Duration.ZERO, false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // --parallelism 해석
    // ============================================================

    @Test
    void max는_코어_수() {
        assertThat(ExecutorConfig.parseParallelism("max", 8)).isEqualTo(8);
    }

    @Test
    void 백분율은_코어_수에_비례하고_최소_1() {
        assertThat(ExecutorConfig.parseParallelism("50%", 8)).isEqualTo(4);
        assertThat(ExecutorConfig.parseParallelism("100%", 8)).isEqualTo(8);
        assertThat(ExecutorConfig.parseParallelism("10%", 4)).isEqualTo(1);
    }

    @Test
    void 정수는_그대로_사용() {
        assertThat(ExecutorConfig.parseParallelism("3", 8)).isEqualTo(3);
        assertThat(ExecutorConfig.parseParallelism("16", 8)).isEqualTo(16);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-2", "0%", "101%", "fast", "1.5", " "})
    void 잘못된_값은_예외(String value) {
        assertThatThrownBy(() -> ExecutorConfig.parseParallelism(value, 8))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
