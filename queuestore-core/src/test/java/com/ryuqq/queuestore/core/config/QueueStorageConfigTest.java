package com.ryuqq.queuestore.core.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * QueueStorageConfig 테스트.
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
class QueueStorageConfigTest {

    @Test
    void 기본_설정은_무제한_깊이와_255자_목적지() {
        QueueStorageConfig config = new QueueStorageConfig();

        assertThat(config.maxDepth()).isZero();
        assertThat(config.isBounded()).isFalse();
        assertThat(config.maxDestinationLength()).isEqualTo(255);
    }

    @Test
    void withMaxDepth는_새_인스턴스를_반환함() {
        QueueStorageConfig config = new QueueStorageConfig();

        QueueStorageConfig bounded = config.withMaxDepth(100);

        assertThat(bounded.maxDepth()).isEqualTo(100);
        assertThat(bounded.isBounded()).isTrue();
        assertThat(config.maxDepth()).isZero();
    }

    @Test
    void withMaxDestinationLength는_다른_값을_유지함() {
        QueueStorageConfig config = new QueueStorageConfig().withMaxDepth(10).withMaxDestinationLength(64);

        assertThat(config.maxDepth()).isEqualTo(10);
        assertThat(config.maxDestinationLength()).isEqualTo(64);
    }

    @Test
    void 음수_maxDepth는_거부됨() {
        assertThatThrownBy(() -> new QueueStorageConfig(-1, 255))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDepth");
    }

    @Test
    void 양수가_아닌_maxDestinationLength는_거부됨() {
        assertThatThrownBy(() -> new QueueStorageConfig(0, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDestinationLength");
    }
}
