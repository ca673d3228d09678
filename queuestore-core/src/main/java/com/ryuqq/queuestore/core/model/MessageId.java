package com.ryuqq.queuestore.core.model;

/**
 * 메시지의 고유 식별자 ({@code message-id} 헤더 값).
 *
 * <p>저장소 인스턴스 수명 동안 유일해야 합니다. 브로커는 형식이 아닌 유일성에만 의존하므로
 * 증가 카운터나 UUID 모두 사용할 수 있습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>제어 문자 불가 (헤더 값으로 직렬화되므로)</li>
 * </ul>
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
public final class MessageId {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private MessageId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MessageId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("MessageId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (value.chars().anyMatch(Character::isISOControl)) {
            throw new IllegalArgumentException("MessageId cannot contain control characters");
        }
        this.value = value;
    }

    /**
     * MessageId 생성.
     *
     * @param value MessageId 값
     * @return MessageId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static MessageId of(String value) {
        return new MessageId(value);
    }

    /**
     * MessageId 값 조회.
     *
     * @return MessageId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageId messageId = (MessageId) o;
        return value.equals(messageId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "MessageId{" + value + '}';
    }
}
