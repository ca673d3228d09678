package com.ryuqq.queuestore.core.exception;

/**
 * 저장 매체 오류 (I/O, 인코딩, 손상 등).
 *
 * <p>인메모리 구현체에서는 발생하지 않으며, 파일/DB 기반 구현체가 사용합니다.
 * 브로커는 백오프 재시도 또는 운영자 알림으로 대응해야 합니다.</p>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public class StorageFailureException extends QueueStorageException {

    public StorageFailureException(String message) {
        super(StorageErrorCode.STORAGE_FAILURE, message);
    }

    public StorageFailureException(String message, Throwable cause) {
        super(StorageErrorCode.STORAGE_FAILURE, message, cause);
    }
}
