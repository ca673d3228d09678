/**
 * 큐 저장소 오류 분류.
 *
 * <p>모든 예외는 {@link com.ryuqq.queuestore.core.exception.QueueStorageException}을 상속하며
 * {@link com.ryuqq.queuestore.core.exception.StorageErrorCode}를 포함합니다.</p>
 *
 * <p><strong>전파 정책:</strong> 저장소 계층은 실패를 로그만 남기고 삼키지 않습니다.
 * 재시도, 발행자 NACK, 종료 여부는 브로커가 결정합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.queuestore.core.exception;
