package com.ryuqq.operations.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationRunnerConfigTest {

    @Test
    void 기본값() {
        OperationRunnerConfig config = new OperationRunnerConfig();

        assertThat(config.concurrency()).isEqualTo(4);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(60000);
    }

    @Test
    void withX는_해당_값만_변경() {
        OperationRunnerConfig config = new OperationRunnerConfig().withConcurrency(8);

        assertThat(config.concurrency()).isEqualTo(8);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(60000);
        assertThat(config.withShutdownTimeoutMs(1000).shutdownTimeoutMs()).isEqualTo(1000);
    }

    @Test
    void 잘못된_값이면_예외() {
        assertThatThrownBy(() -> new OperationRunnerConfig(0, 1000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("concurrency must be positive (current: 0)");
        assertThatThrownBy(() -> new OperationRunnerConfig(4, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("shutdownTimeoutMs must be positive (current: 0)");
    }
}
