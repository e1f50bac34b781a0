package com.ryuqq.redelivery.core.backoff;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BackoffSpec Record 테스트.
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
class BackoffSpecTest {

    @Test
    void of_WithoutMaxDelay_HasNoCap() {
        // When
        BackoffSpec spec = BackoffSpec.of(BackoffType.LINEAR, Duration.ofSeconds(1));

        // Then
        assertTrue(spec.maxDelayIfSet().isEmpty());
        assertEquals(Duration.ofSeconds(4), spec.delayFor(3));
    }

    @Test
    void delayFor_AppliesMaxDelay() {
        // Given
        BackoffSpec spec = new BackoffSpec(BackoffType.EXPONENTIAL, Duration.ofSeconds(1), Duration.ofSeconds(5));

        // When & Then
        assertEquals(Duration.ofSeconds(4), spec.delayFor(2));
        assertEquals(Duration.ofSeconds(5), spec.delayFor(3));
    }

    @Test
    void constructor_NullType_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new BackoffSpec(null, Duration.ofSeconds(1), null)
        );
        assertTrue(exception.getMessage().contains("type cannot be null"));
    }

    @Test
    void constructor_NegativeMaxDelay_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffSpec(BackoffType.CONSTANT, Duration.ofSeconds(1), Duration.ofSeconds(-1)));
    }
}
