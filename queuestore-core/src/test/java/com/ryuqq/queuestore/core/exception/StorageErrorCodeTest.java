package com.ryuqq.queuestore.core.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 오류 분류 테스트.
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
class StorageErrorCodeTest {

    @Test
    void isRetryable_CallerErrors_AreNotRetryable() {
        assertFalse(StorageErrorCode.NOT_STARTED.isRetryable());
        assertFalse(StorageErrorCode.INVALID_DESTINATION.isRetryable());
    }

    @Test
    void isRetryable_TransientErrors_AreRetryable() {
        assertTrue(StorageErrorCode.QUEUE_FULL.isRetryable());
        assertTrue(StorageErrorCode.STORAGE_FAILURE.isRetryable());
        assertTrue(StorageErrorCode.CANCELLED.isRetryable());
    }

    @Test
    void exceptions_CarryMatchingErrorCode() {
        assertEquals(StorageErrorCode.NOT_STARTED, new StorageNotStartedException("enqueue").getErrorCode());
        assertEquals(StorageErrorCode.INVALID_DESTINATION, new InvalidDestinationException("bad").getErrorCode());
        assertEquals(StorageErrorCode.QUEUE_FULL, new QueueFullException("orders", 10).getErrorCode());
        assertEquals(StorageErrorCode.STORAGE_FAILURE, new StorageFailureException("disk").getErrorCode());
        assertEquals(StorageErrorCode.CANCELLED, new StorageCancelledException("deadline").getErrorCode());
    }

    @Test
    void storageFailure_KeepsCause() {
        Exception cause = new java.io.IOException("disk full");

        StorageFailureException exception = new StorageFailureException("append failed", cause);

        assertSame(cause, exception.getCause());
    }

    @Test
    void notStarted_MessageNamesOperation() {
        assertTrue(new StorageNotStartedException("dequeue").getMessage().contains("dequeue"));
    }
}
