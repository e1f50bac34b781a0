package com.ryuqq.redelivery.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MessageId Value Object 테스트.
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
class MessageIdTest {

    @Test
    void of_ValidValue_CreatesMessageId() {
        // When
        MessageId messageId = MessageId.of("msg-123");

        // Then
        assertEquals("msg-123", messageId.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> MessageId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> MessageId.of("   "));
    }

    @Test
    void of_ExceedsMaxLength_ThrowsException() {
        // Given
        String tooLong = "a".repeat(129);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> MessageId.of(tooLong)
        );
        assertTrue(exception.getMessage().contains("128"));
    }

    @Test
    void of_MaxLength_CreatesMessageId() {
        // When & Then
        assertDoesNotThrow(() -> MessageId.of("a".repeat(128)));
    }

    @Test
    void random_GeneratesDistinctIds() {
        // When
        MessageId first = MessageId.random();
        MessageId second = MessageId.random();

        // Then
        assertNotEquals(first, second);
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        MessageId id1 = MessageId.of("msg-1");
        MessageId id2 = MessageId.of("msg-1");

        // When & Then
        assertEquals(id1, id2);
        assertEquals(id1.hashCode(), id2.hashCode());
    }

    @Test
    void toString_ContainsValue() {
        // When & Then
        assertEquals("MessageId{msg-1}", MessageId.of("msg-1").toString());
    }
}
