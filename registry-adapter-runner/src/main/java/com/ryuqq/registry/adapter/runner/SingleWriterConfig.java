package com.ryuqq.registry.adapter.runner;

/**
 * SingleWriterRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>queueCapacity: 대기 큐 최대 크기 (기본 1024). 가득 차면 submit이 거부됩니다.</li>
 *   <li>shutdownTimeoutMs: shutdown 시 남은 Command 처리를 기다리는 최대 시간 (기본 5000ms)</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 * @param queueCapacity 큐 용량 (1 이상이어야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record SingleWriterConfig(
    int queueCapacity,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: queueCapacity=1024, shutdownTimeoutMs=5000ms</p>
     */
    public SingleWriterConfig() {
        this(1024, 5000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SingleWriterConfig {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException(
                "queueCapacity must be positive (current: " + queueCapacity + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * queueCapacity만 변경한 새 인스턴스 생성.
     */
    public SingleWriterConfig withQueueCapacity(int queueCapacity) {
        return new SingleWriterConfig(queueCapacity, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public SingleWriterConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new SingleWriterConfig(queueCapacity, shutdownTimeoutMs);
    }
}
