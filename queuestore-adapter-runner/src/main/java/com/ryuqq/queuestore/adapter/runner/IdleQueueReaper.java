package com.ryuqq.queuestore.adapter.runner;

import com.ryuqq.queuestore.application.runtime.MaintenanceTask;
import com.ryuqq.queuestore.core.spi.QueueMaintenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 유휴 목적지 큐 회수 컴포넌트.
 *
 * <p>목적지 큐는 첫 사용 시 생성되고 저장소가 멈출 때까지 남아 있습니다. 목적지 이름이
 * 계속 바뀌는 브로커(임시 reply 큐 등)에서는 빈 큐가 쌓이므로, 일정 시간 비어 있던 큐를
 * 주기적으로 제거합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. scanIdle(idleThreshold, batchSize) → [dest1, dest2, ...]
 * 2. For each destination:
 *    evictIfIdle(dest, idleThreshold)
 *    - 스캔 이후 프레임이 들어왔으면 제거하지 않음
 * 3. 제거/후보 카운트 로깅
 * </pre>
 *
 * <p>개별 목적지 제거가 실패해도 나머지 목적지 처리는 계속됩니다.</p>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public final class IdleQueueReaper implements MaintenanceTask {

    private static final Logger log = LoggerFactory.getLogger(IdleQueueReaper.class);

    private final QueueMaintenance maintenance;
    private final IdleQueueReaperConfig config;

    /**
     * 생성자.
     *
     * @param maintenance 저장소 유지보수 SPI
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public IdleQueueReaper(QueueMaintenance maintenance, IdleQueueReaperConfig config) {
        if (maintenance == null) {
            throw new IllegalArgumentException("maintenance cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.maintenance = maintenance;
        this.config = config;
    }

    /**
     * 유휴 목적지 스캔 및 제거.
     */
    @Override
    public void scan() {
        List<String> candidates = maintenance.scanIdle(config.idleThresholdMs(), config.batchSize());
        if (candidates.isEmpty()) {
            log.debug("Idle queue scan found no candidates");
            return;
        }

        int evicted = 0;
        for (String destination : candidates) {
            if (tryEvict(destination)) {
                evicted++;
            }
        }

        log.info("Idle queue scan completed: {} evicted out of {} idle", evicted, candidates.size());
    }

    /**
     * Returns the configuration of this reaper.
     *
     * @return reaper configuration
     */
    public IdleQueueReaperConfig config() {
        return config;
    }

    private boolean tryEvict(String destination) {
        try {
            return maintenance.evictIfIdle(destination, config.idleThresholdMs());
        } catch (Exception e) {
            log.error("Failed to evict idle destination '{}'", destination, e);
            return false;
        }
    }
}
