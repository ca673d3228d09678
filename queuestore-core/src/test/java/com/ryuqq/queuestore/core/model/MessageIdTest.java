package com.ryuqq.queuestore.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MessageId Value Object 테스트.
 *
 * @author QueueStore Team
 * @since 1.0.0
 */
class MessageIdTest {

    @Test
    void of_ValidValue_CreatesMessageId() {
        // Given
        String value = "msg-12345";

        // When
        MessageId messageId = MessageId.of(value);

        // Then
        assertNotNull(messageId);
        assertEquals(value, messageId.getValue());
    }

    @Test
    void of_UuidValue_CreatesMessageId() {
        String value = "3f2a9c1e-8d4b-4e0f-9a1b-2c3d4e5f6a7b";

        assertEquals(value, MessageId.of(value).getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> MessageId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> MessageId.of("   "));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        String value = "a".repeat(256);

        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> MessageId.of(value)
        );
        assertTrue(exception.getMessage().contains("255"));
    }

    @Test
    void of_MaxLengthValue_CreatesMessageId() {
        assertEquals(255, MessageId.of("a".repeat(255)).getValue().length());
    }

    @Test
    void of_ControlCharacter_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> MessageId.of("msg\n1"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        MessageId first = MessageId.of("msg-1");
        MessageId second = MessageId.of("msg-1");

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void equals_DifferentValue_ReturnsFalse() {
        assertNotEquals(MessageId.of("msg-1"), MessageId.of("msg-2"));
    }

    @Test
    void toString_ContainsValue() {
        assertEquals("MessageId{msg-1}", MessageId.of("msg-1").toString());
    }
}
