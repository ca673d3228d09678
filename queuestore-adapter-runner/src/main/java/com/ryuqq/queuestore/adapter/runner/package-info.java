/**
 * Runner Adapter Layer - 저장소 유지보수 실행.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.queuestore.adapter.runner.IdleQueueReaper} - 빈 유휴 목적지 큐 제거</li>
 *   <li>{@link com.ryuqq.queuestore.adapter.runner.MaintenanceScheduler} - 유지보수 작업 주기 실행</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (IdleQueueReaper, MaintenanceScheduler)
 *   ↓ implements
 * application (MaintenanceTask)
 *   ↓ depends on
 * core (QueueMaintenance SPI)
 * </pre>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
package com.ryuqq.queuestore.adapter.runner;
