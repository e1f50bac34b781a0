package com.ryuqq.redelivery.core.support;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Stages 테스트.
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
class StagesTest {

    @Test
    void safely_ReturnsStageFromCall() throws Exception {
        // When
        CompletionStage<String> stage = Stages.safely(() -> CompletableFuture.completedFuture("ok"));

        // Then
        assertEquals("ok", stage.toCompletableFuture().get());
    }

    @Test
    void safely_SynchronousThrow_ReturnsFailedStage() {
        // Given
        IllegalStateException error = new IllegalStateException("sync");

        // When
        CompletionStage<String> stage = Stages.safely(() -> {
            throw error;
        });

        // Then
        ExecutionException thrown = assertThrows(ExecutionException.class,
            () -> stage.toCompletableFuture().get());
        assertSame(error, thrown.getCause());
    }

    @Test
    void safely_NullStage_ReturnsFailedStage() {
        // When
        CompletionStage<String> stage = Stages.safely(() -> null);

        // Then
        ExecutionException thrown = assertThrows(ExecutionException.class,
            () -> stage.toCompletableFuture().get());
        assertInstanceOf(IllegalStateException.class, thrown.getCause());
    }
}
