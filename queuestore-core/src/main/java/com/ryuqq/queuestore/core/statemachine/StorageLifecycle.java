package com.ryuqq.queuestore.core.statemachine;

/**
 * 저장소 생명주기 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>NEW → STARTED</li>
 *   <li>STARTED → STOPPED</li>
 *   <li>STOPPED → STARTED</li>
 * </ul>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public final class StorageLifecycle {

    // Utility class - prevent instantiation
    private StorageLifecycle() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 생명주기 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(StorageState from, StorageState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid = switch (from) {
            case NEW, STOPPED -> to == StorageState.STARTED;
            case STARTED -> to == StorageState.STOPPED;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid storage lifecycle transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 생명주기 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static StorageState transition(StorageState current, StorageState next) {
        validate(current, next);
        return next;
    }
}
