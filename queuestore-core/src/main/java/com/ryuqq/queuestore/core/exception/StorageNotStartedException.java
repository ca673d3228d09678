package com.ryuqq.queuestore.core.exception;

/**
 * start() 이전 또는 stop() 이후에 데이터 연산을 호출한 경우.
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public class StorageNotStartedException extends QueueStorageException {

    /**
     * 생성자.
     *
     * @param operation 시도한 연산 이름 (예: enqueue)
     */
    public StorageNotStartedException(String operation) {
        super(StorageErrorCode.NOT_STARTED, "Queue storage is not started, cannot " + operation);
    }
}
