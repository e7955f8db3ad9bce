package com.ryuqq.registry.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SingleWriterConfig 유닛 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class SingleWriterConfigTest {

    @Test
    void 기본값_확인() {
        SingleWriterConfig config = new SingleWriterConfig();

        assertThat(config.queueCapacity()).isEqualTo(1024);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(5000);
    }

    @Test
    void with_메서드로_값_변경() {
        SingleWriterConfig config = new SingleWriterConfig()
            .withQueueCapacity(16)
            .withShutdownTimeoutMs(250);

        assertThat(config.queueCapacity()).isEqualTo(16);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(250);
    }

    @Test
    void 잘못된_값은_거부() {
        assertThatThrownBy(() -> new SingleWriterConfig(0, 100))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("queueCapacity");
        assertThatThrownBy(() -> new SingleWriterConfig(1, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("shutdownTimeoutMs");
    }
}
