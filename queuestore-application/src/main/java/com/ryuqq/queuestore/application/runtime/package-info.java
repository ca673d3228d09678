/**
 * 큐 저장소 런타임 컴포넌트.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.queuestore.application.runtime.StorageRuntime} - 브로커 기동/종료 시 저장소 생명주기 관리</li>
 *   <li>{@link com.ryuqq.queuestore.application.runtime.MaintenanceTask} - 주기적 유지보수 작업 인터페이스</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>MaintenanceTask 구현체는 adapter-runner 모듈의 {@code IdleQueueReaper}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.queuestore.application.runtime;
