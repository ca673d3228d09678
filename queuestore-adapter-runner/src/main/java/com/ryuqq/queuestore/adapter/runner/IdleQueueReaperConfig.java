package com.ryuqq.queuestore.adapter.runner;

/**
 * IdleQueueReaper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms = 1분)</li>
 *   <li>idleThresholdMs: 유휴 임계값 (기본 300000ms = 5분)</li>
 *   <li>batchSize: 한 번에 제거할 목적지 수 (기본 100)</li>
 * </ul>
 *
 * <p>idleThresholdMs가 짧을수록 메모리는 빨리 회수되지만, 간헐적으로 쓰이는 목적지의
 * 큐가 반복 생성될 수 있습니다.</p>
 *
 * @author QueueStore Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param idleThresholdMs 유휴 임계값 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record IdleQueueReaperConfig(
    long scanIntervalMs,
    long idleThresholdMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=60000ms (1분), idleThresholdMs=300000ms (5분), batchSize=100</p>
     */
    public IdleQueueReaperConfig() {
        this(60000, 300000, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public IdleQueueReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (idleThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "idleThresholdMs must be positive (current: " + idleThresholdMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    public IdleQueueReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new IdleQueueReaperConfig(scanIntervalMs, idleThresholdMs, batchSize);
    }

    public IdleQueueReaperConfig withIdleThresholdMs(long idleThresholdMs) {
        return new IdleQueueReaperConfig(scanIntervalMs, idleThresholdMs, batchSize);
    }

    public IdleQueueReaperConfig withBatchSize(int batchSize) {
        return new IdleQueueReaperConfig(scanIntervalMs, idleThresholdMs, batchSize);
    }
}
