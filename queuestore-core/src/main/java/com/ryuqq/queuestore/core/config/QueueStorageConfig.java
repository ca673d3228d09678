package com.ryuqq.queuestore.core.config;

import com.ryuqq.queuestore.core.model.Destination;

/**
 * 큐 저장소 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxDepth: 목적지별 최대 프레임 수 (기본 0 = 무제한)</li>
 *   <li>maxDestinationLength: 목적지 이름 최대 길이 (기본 255)</li>
 * </ul>
 *
 * <p><strong>용량 설정 가이드:</strong></p>
 * <ul>
 *   <li>개발/테스트: maxDepth = 0 (무제한)</li>
 *   <li>운영: 프레임 평균 크기와 힙 여유를 고려해 설정 (예: 10000)</li>
 *   <li>초과 시 enqueue/requeue는 QueueFullException으로 실패 (백프레셔)</li>
 * </ul>
 *
 * @author QueueStore Team
 * @since 1.0.0
 * @param maxDepth 목적지별 최대 깊이 (0 이상, 0은 무제한)
 * @param maxDestinationLength 목적지 이름 최대 길이 (양수)
 */
public record QueueStorageConfig(
    int maxDepth,
    int maxDestinationLength
) {

    /**
     * 무제한 깊이를 나타내는 값.
     */
    public static final int UNBOUNDED = 0;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxDepth=0 (무제한), maxDestinationLength=255</p>
     */
    public QueueStorageConfig() {
        this(UNBOUNDED, Destination.DEFAULT_MAX_LENGTH);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueStorageConfig {
        if (maxDepth < 0) {
            throw new IllegalArgumentException(
                "maxDepth must be non-negative (current: " + maxDepth + ")"
            );
        }
        if (maxDestinationLength <= 0) {
            throw new IllegalArgumentException(
                "maxDestinationLength must be positive (current: " + maxDestinationLength + ")"
            );
        }
    }

    /**
     * 용량 제한이 있는지 확인.
     *
     * @return maxDepth가 양수이면 true
     */
    public boolean isBounded() {
        return maxDepth > UNBOUNDED;
    }

    /**
     * maxDepth만 변경한 새 인스턴스 생성.
     */
    public QueueStorageConfig withMaxDepth(int maxDepth) {
        return new QueueStorageConfig(maxDepth, maxDestinationLength);
    }

    /**
     * maxDestinationLength만 변경한 새 인스턴스 생성.
     */
    public QueueStorageConfig withMaxDestinationLength(int maxDestinationLength) {
        return new QueueStorageConfig(maxDepth, maxDestinationLength);
    }
}
