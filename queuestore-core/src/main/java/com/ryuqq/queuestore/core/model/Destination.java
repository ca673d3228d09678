package com.ryuqq.queuestore.core.model;

import com.ryuqq.queuestore.core.exception.InvalidDestinationException;

/**
 * 메시지가 발행되고 소비되는 목적지 큐의 이름.
 *
 * <p>저장소 인스턴스 내에서 유일하며, 목적지 간 순서는 보장하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Destination.of("orders")</li>
 *   <li>Destination.of("/queue/payments")</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~maxLength자 (기본 255)</li>
 *   <li>제어 문자 불가</li>
 * </ul>
 *
 * <p>검증 실패 시 {@link IllegalArgumentException}이 아닌 {@link InvalidDestinationException}을
 * 던집니다. 목적지는 외부 입력이므로 브로커가 오류 코드로 처리할 수 있어야 합니다.</p>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public final class Destination {

    /**
     * 기본 최대 길이.
     */
    public static final int DEFAULT_MAX_LENGTH = 255;

    private final String value;

    private Destination(String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new InvalidDestinationException("Destination cannot be null or blank");
        }
        if (value.length() > maxLength) {
            throw new InvalidDestinationException(
                "Destination length cannot exceed " + maxLength + " characters (current: " + value.length() + ")"
            );
        }
        if (value.chars().anyMatch(Character::isISOControl)) {
            throw new InvalidDestinationException("Destination cannot contain control characters");
        }
        this.value = value;
    }

    /**
     * Destination 생성 (기본 최대 길이).
     *
     * @param value 목적지 이름
     * @return Destination 인스턴스
     * @throws InvalidDestinationException 유효하지 않은 값인 경우
     */
    public static Destination of(String value) {
        return new Destination(value, DEFAULT_MAX_LENGTH);
    }

    /**
     * Destination 생성 (최대 길이 지정).
     *
     * @param value 목적지 이름
     * @param maxLength 허용 최대 길이 (양수)
     * @return Destination 인스턴스
     * @throws IllegalArgumentException maxLength가 양수가 아닌 경우
     * @throws InvalidDestinationException 유효하지 않은 값인 경우
     */
    public static Destination of(String value, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive (current: " + maxLength + ")");
        }
        return new Destination(value, maxLength);
    }

    /**
     * Destination 값 조회.
     *
     * @return 목적지 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Destination that = (Destination) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Destination{" + value + '}';
    }
}
