package com.ryuqq.queuestore.core.exception;

/**
 * 큐 저장소 오류 분류.
 *
 * <p>브로커는 오류 코드로 재시도, 발행자 NACK, 종료 여부를 결정합니다.</p>
 *
 * <ul>
 *   <li>{@link #NOT_STARTED}: start() 이전 또는 stop() 이후의 데이터 연산 (프로그래밍 오류)</li>
 *   <li>{@link #INVALID_DESTINATION}: 목적지 이름 검증 실패</li>
 *   <li>{@link #QUEUE_FULL}: 목적지별 최대 깊이 초과</li>
 *   <li>{@link #STORAGE_FAILURE}: 저장 매체 오류 (I/O, 인코딩 등, 영속 구현체)</li>
 *   <li>{@link #CANCELLED}: 호출자 데드라인 초과 또는 취소 (영속 구현체)</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 빈 큐에서의 dequeue는 오류가 아닙니다.</p>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public enum StorageErrorCode {

    /**
     * 저장소가 시작되지 않음.
     */
    NOT_STARTED,

    /**
     * 유효하지 않은 목적지.
     */
    INVALID_DESTINATION,

    /**
     * 큐 용량 초과.
     */
    QUEUE_FULL,

    /**
     * 저장 매체 오류.
     */
    STORAGE_FAILURE,

    /**
     * 데드라인 초과 또는 취소.
     */
    CANCELLED;

    /**
     * 재시도로 회복 가능한 오류인지 확인.
     *
     * <p>QUEUE_FULL, STORAGE_FAILURE, CANCELLED는 백오프 후 재시도할 수 있습니다.
     * NOT_STARTED, INVALID_DESTINATION은 호출자 측 오류이므로 재시도해도 성공하지 않습니다.</p>
     *
     * @return 재시도 가능하면 true
     */
    public boolean isRetryable() {
        return this == QUEUE_FULL || this == STORAGE_FAILURE || this == CANCELLED;
    }
}
