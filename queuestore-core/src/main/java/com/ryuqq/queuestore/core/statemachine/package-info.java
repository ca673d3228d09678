/**
 * 저장소 생명주기 상태 머신.
 *
 * <p>{@link com.ryuqq.queuestore.core.statemachine.StorageState}와 전이 검증
 * {@link com.ryuqq.queuestore.core.statemachine.StorageLifecycle}을 제공합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.queuestore.core.statemachine;
