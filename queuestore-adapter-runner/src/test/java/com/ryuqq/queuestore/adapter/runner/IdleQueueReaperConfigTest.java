package com.ryuqq.queuestore.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * IdleQueueReaperConfig 테스트.
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
class IdleQueueReaperConfigTest {

    @Test
    void 기본값() {
        IdleQueueReaperConfig config = new IdleQueueReaperConfig();

        assertThat(config.scanIntervalMs()).isEqualTo(60000);
        assertThat(config.idleThresholdMs()).isEqualTo(300000);
        assertThat(config.batchSize()).isEqualTo(100);
    }

    @Test
    void with_메서드는_해당_값만_변경함() {
        IdleQueueReaperConfig config = new IdleQueueReaperConfig()
            .withScanIntervalMs(1000)
            .withIdleThresholdMs(2000)
            .withBatchSize(3);

        assertThat(config).isEqualTo(new IdleQueueReaperConfig(1000, 2000, 3));
    }

    @Test
    void 양수가_아닌_값은_거부됨() {
        assertThatThrownBy(() -> new IdleQueueReaperConfig(0, 1, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("scanIntervalMs");
        assertThatThrownBy(() -> new IdleQueueReaperConfig(1, -1, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("idleThresholdMs");
        assertThatThrownBy(() -> new IdleQueueReaperConfig(1, 1, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batchSize");
    }
}
