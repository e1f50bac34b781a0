package com.ryuqq.redelivery.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Message Record 테스트.
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
class MessageTest {

    @Test
    void constructor_NullProperties_CreatesEmptyMap() {
        // When
        Message message = new Message(MessageId.of("msg-1"), Payload.of("body"), null);

        // Then
        assertTrue(message.applicationProperties().isEmpty());
    }

    @Test
    void constructor_NullMessageId_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Message(null, Payload.empty(), Map.of())
        );
        assertTrue(exception.getMessage().contains("messageId cannot be null"));
    }

    @Test
    void constructor_NullPayload_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new Message(MessageId.of("msg-1"), null, Map.of()));
    }

    @Test
    void constructor_CopiesProperties() {
        // Given
        Map<String, Object> properties = new HashMap<>();
        properties.put("tenant", "acme");
        Message message = new Message(MessageId.of("msg-1"), Payload.empty(), properties);

        // When
        properties.put("tenant", "other");

        // Then
        assertEquals("acme", message.applicationProperties().get("tenant"));
    }

    @Test
    void applicationProperties_IsUnmodifiable() {
        // Given
        Message message = new Message(MessageId.of("msg-1"), Payload.empty(), Map.of("k", "v"));

        // When & Then
        assertThrows(UnsupportedOperationException.class,
            () -> message.applicationProperties().put("k2", "v2"));
    }

    @Test
    void property_MissingKey_ReturnsEmpty() {
        // Given
        Message message = Message.of(MessageId.of("msg-1"), Payload.empty());

        // When & Then
        assertTrue(message.property("missing").isEmpty());
    }

    @Test
    void withProperty_ReturnsNewMessageAndKeepsOriginal() {
        // Given
        Message original = new Message(MessageId.of("msg-1"), Payload.of("body"), Map.of("tenant", "acme"));

        // When
        Message derived = original.withProperty("AttemptNumber", 3);

        // Then
        assertEquals(3, derived.property("AttemptNumber").orElseThrow());
        assertEquals("acme", derived.property("tenant").orElseThrow());
        assertEquals(original.messageId(), derived.messageId());
        assertEquals(original.payload(), derived.payload());
        assertTrue(original.property("AttemptNumber").isEmpty());
    }

    @Test
    void withProperty_BlankKey_ThrowsException() {
        // Given
        Message message = Message.of(MessageId.of("msg-1"), Payload.empty());

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> message.withProperty(" ", 1));
    }
}
