package com.ryuqq.queuestore.core.spi;

import com.ryuqq.queuestore.core.exception.StorageNotStartedException;

import java.util.List;

/**
 * 유휴 목적지 정리 SPI.
 *
 * <p>장시간 실행되는 브로커가 일시적인 목적지 이름을 많이 사용하면 빈 큐 항목이
 * 계속 쌓입니다. 이 SPI는 비어 있고 오래 사용되지 않은 목적지를 찾아 제거하는
 * 수단을 제공합니다. 제거는 관찰 가능한 동작에 영향이 없어야 합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>scanIdle(): 비어 있고 마지막 활동 이후 임계값 이상 지난 목적지 반환</li>
 *   <li>evictIfIdle(): 제거 시점에 다시 검사하여 여전히 비어 있고 유휴인 경우에만 제거</li>
 *   <li>동시성: 제거와 경쟁하는 enqueue/requeue가 프레임을 잃지 않아야 함</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * List&lt;String&gt; idle = maintenance.scanIdle(300_000, 100);
 * for (String destination : idle) {
 *     maintenance.evictIfIdle(destination, 300_000);
 * }
 * </pre>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public interface QueueMaintenance {

    /**
     * 유휴 목적지 스캔.
     *
     * @param idleThresholdMs 마지막 활동 이후 경과 시간 임계값 (밀리초, 0 이상)
     * @param batchSize 최대 반환 개수 (양수)
     * @return 비어 있고 유휴인 목적지 이름 목록 (최대 batchSize개)
     * @throws IllegalArgumentException 파라미터가 유효하지 않은 경우
     * @throws StorageNotStartedException 저장소가 시작되지 않은 경우
     */
    List<String> scanIdle(long idleThresholdMs, int batchSize);

    /**
     * 목적지가 여전히 비어 있고 유휴이면 제거.
     *
     * @param destination 목적지 이름
     * @param idleThresholdMs 유휴 임계값 (밀리초, 0 이상)
     * @return 제거되었으면 true, 존재하지 않거나 활동이 있었으면 false
     * @throws IllegalArgumentException idleThresholdMs가 음수인 경우
     * @throws StorageNotStartedException 저장소가 시작되지 않은 경우
     */
    boolean evictIfIdle(String destination, long idleThresholdMs);

    /**
     * 현재 보유 중인 목적지 수.
     *
     * @return 목적지 수
     * @throws StorageNotStartedException 저장소가 시작되지 않은 경우
     */
    int destinationCount();
}
