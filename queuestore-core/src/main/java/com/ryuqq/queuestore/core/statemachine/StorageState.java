package com.ryuqq.queuestore.core.statemachine;

/**
 * 저장소 인스턴스의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>NEW → STARTED (start)</li>
 *   <li>STARTED → STOPPED (stop)</li>
 *   <li>STOPPED → STARTED (재시작, 빈 상태로 시작)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * NEW
 *  │
 *  ▼ (start)
 * STARTED ◄────────┐
 *  │               │ (start)
 *  ▼ (stop)        │
 * STOPPED ─────────┘
 *
 * 금지된 전이:
 * - NEW → STOPPED ❌
 * - STARTED → STARTED ❌
 * - STOPPED → STOPPED ❌
 * </pre>
 *
 * <p>NEW와 STOPPED에서는 데이터 연산이 허용되지 않습니다.</p>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public enum StorageState {

    /**
     * 생성됨 (아직 시작 안 됨).
     */
    NEW,

    /**
     * 시작됨 (데이터 연산 허용).
     */
    STARTED,

    /**
     * 중지됨 (내부 상태 해제).
     */
    STOPPED;

    /**
     * 데이터 연산을 받을 수 있는 상태인지 확인.
     *
     * @return STARTED인 경우 true
     */
    public boolean acceptsOperations() {
        return this == STARTED;
    }
}
