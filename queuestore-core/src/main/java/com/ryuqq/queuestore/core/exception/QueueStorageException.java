package com.ryuqq.queuestore.core.exception;

/**
 * 큐 저장소 연산 실패의 최상위 예외.
 *
 * <p>모든 연산 수준 실패는 저장소 내부에서 로그만 남기고 삼키지 않고
 * 즉시 호출자(브로커)에게 전파됩니다.</p>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public abstract class QueueStorageException extends RuntimeException {

    private final StorageErrorCode errorCode;

    protected QueueStorageException(StorageErrorCode errorCode, String message) {
        super(message);
        this.errorCode = requireCode(errorCode);
    }

    protected QueueStorageException(StorageErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = requireCode(errorCode);
    }

    private static StorageErrorCode requireCode(StorageErrorCode errorCode) {
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        return errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public StorageErrorCode getErrorCode() {
        return errorCode;
    }
}
