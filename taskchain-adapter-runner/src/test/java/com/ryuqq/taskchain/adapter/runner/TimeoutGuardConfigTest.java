package com.ryuqq.taskchain.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TimeoutGuardConfig 유닛 테스트.
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
class TimeoutGuardConfigTest {

    @Test
    void 기본_생성자는_문서화된_기본값() {
        // when
        TimeoutGuardConfig config = new TimeoutGuardConfig();

        // then
        assertThat(config.poolSize()).isEqualTo(4);
        assertThat(config.queueCapacity()).isEqualTo(64);
        assertThat(config.timedOutWorkPolicy()).isEqualTo(TimedOutWorkPolicy.INTERRUPT);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(30000);
    }

    @Test
    void withX_메서드는_해당_값만_변경() {
        // given
        TimeoutGuardConfig config = new TimeoutGuardConfig();

        // when
        TimeoutGuardConfig changed = config
            .withPoolSize(8)
            .withQueueCapacity(16)
            .withTimedOutWorkPolicy(TimedOutWorkPolicy.ABANDON)
            .withShutdownTimeoutMs(1000);

        // then
        assertThat(changed).isEqualTo(new TimeoutGuardConfig(8, 16, TimedOutWorkPolicy.ABANDON, 1000));
        assertThat(config.poolSize()).isEqualTo(4);
    }

    @Test
    void poolSize가_0이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new TimeoutGuardConfig(0, 1, TimedOutWorkPolicy.INTERRUPT, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("poolSize must be positive");
    }

    @Test
    void queueCapacity가_음수면_IllegalArgumentException() {
        assertThatThrownBy(() -> new TimeoutGuardConfig(1, -1, TimedOutWorkPolicy.INTERRUPT, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("queueCapacity must be positive");
    }

    @Test
    void policy가_null이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new TimeoutGuardConfig(1, 1, null, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timedOutWorkPolicy cannot be null");
    }

    @Test
    void shutdownTimeoutMs가_0이면_IllegalArgumentException() {
        assertThatThrownBy(() -> new TimeoutGuardConfig(1, 1, TimedOutWorkPolicy.INTERRUPT, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("shutdownTimeoutMs must be positive");
    }
}
