package com.ryuqq.queuestore.core.exception;

/**
 * 목적지 이름이 검증 규칙을 통과하지 못한 경우.
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public class InvalidDestinationException extends QueueStorageException {

    /**
     * 생성자.
     *
     * @param message 실패 사유
     */
    public InvalidDestinationException(String message) {
        super(StorageErrorCode.INVALID_DESTINATION, message);
    }
}
