package com.ryuqq.queuestore.core.exception;

/**
 * 호출자가 지정한 데드라인 초과 또는 취소로 연산이 중단된 경우.
 *
 * <p>영속 구현체는 이 예외를 던지기 전에 큐를 일관된 상태로 되돌려야 합니다
 * (부분 추가 없음, 프레임 유실 없음).</p>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public class StorageCancelledException extends QueueStorageException {

    public StorageCancelledException(String message) {
        super(StorageErrorCode.CANCELLED, message);
    }

    public StorageCancelledException(String message, Throwable cause) {
        super(StorageErrorCode.CANCELLED, message, cause);
    }
}
