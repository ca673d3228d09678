package com.ryuqq.queuestore.application.runtime;

/**
 * 큐 저장소 시작 실패.
 *
 * <p>브로커 기동을 중단시키는 치명적 오류입니다.</p>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public class StorageStartupException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param cause 원인 예외
     */
    public StorageStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
