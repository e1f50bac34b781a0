package com.ryuqq.redelivery.core.outcome;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ok Record 테스트.
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
class OkTest {

    @Test
    void constructor_ValidValue_CreatesOk() {
        // When
        Ok<String> ok = new Ok<>("Success");

        // Then
        assertEquals("Success", ok.value());
        assertTrue(ok.isOk());
        assertFalse(ok.isFail());
    }

    @Test
    void empty_CreatesOkWithNullValue() {
        // When
        Ok<Void> ok = Ok.empty();

        // Then
        assertNull(ok.value());
        assertTrue(ok.successValue().isEmpty());
        assertTrue(ok.failureCause().isEmpty());
    }
}
