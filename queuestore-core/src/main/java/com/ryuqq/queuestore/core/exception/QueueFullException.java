package com.ryuqq.queuestore.core.exception;

/**
 * 목적지 큐가 최대 깊이에 도달하여 프레임을 받을 수 없는 경우.
 *
 * <p>거부된 프레임은 큐에 저장되지 않습니다. 브로커는 발행자에게 NACK을 보내거나
 * 백오프 후 재시도할 수 있습니다.</p>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public class QueueFullException extends QueueStorageException {

    private final String destination;
    private final int maxDepth;

    /**
     * 생성자.
     *
     * @param destination 목적지 이름
     * @param maxDepth 설정된 최대 깊이
     */
    public QueueFullException(String destination, int maxDepth) {
        super(StorageErrorCode.QUEUE_FULL,
            "Queue '" + destination + "' is full (maxDepth: " + maxDepth + ")");
        this.destination = destination;
        this.maxDepth = maxDepth;
    }

    public String getDestination() {
        return destination;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
