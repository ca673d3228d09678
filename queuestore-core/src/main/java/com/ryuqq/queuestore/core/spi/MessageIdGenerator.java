package com.ryuqq.queuestore.core.spi;

import com.ryuqq.queuestore.core.model.MessageId;

/**
 * message-id 생성 SPI.
 *
 * <p>생성된 값은 저장소 인스턴스 수명 동안 유일해야 합니다.
 * 여러 발행 경로에서 동시에 호출되므로 스레드 안전해야 합니다.</p>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * MessageIdGenerator uuid = () -&gt; MessageId.of(UUID.randomUUID().toString());
 * </pre>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageIdGenerator {

    /**
     * 새 message-id 생성.
     *
     * @return 이전에 반환한 적 없는 MessageId
     */
    MessageId next();
}
