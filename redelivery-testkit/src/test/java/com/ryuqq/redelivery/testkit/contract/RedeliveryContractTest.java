package com.ryuqq.redelivery.testkit.contract;

import com.ryuqq.redelivery.core.backoff.BackoffType;
import com.ryuqq.redelivery.core.model.Message;
import com.ryuqq.redelivery.core.outcome.Outcome;
import com.ryuqq.redelivery.core.strategy.RedeliveryConfig;
import com.ryuqq.redelivery.core.strategy.RedeliveryConstants;
import com.ryuqq.redelivery.core.strategy.RedeliveryCoordinator;
import com.ryuqq.redelivery.core.telemetry.EventSeverity;
import com.ryuqq.redelivery.core.telemetry.RedeliveryEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for message redelivery.
 *
 * <p>This test validates the redelivery cycle end to end on the in-memory broker:
 * failed messages come back with an incremented attempt number after the backoff delay,
 * and are dead-lettered once the attempt limit is reached.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Replacement invisible until the backoff delay has elapsed</li>
 *   <li>Full cycle with exponential backoff up to the dead letter queue</li>
 *   <li>Success and unhandled failures leave settlement to the handler</li>
 *   <li>Delay override and redelivery notification hooks</li>
 *   <li>Telemetry events per attempt</li>
 * </ul>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
class RedeliveryContractTest extends AbstractContractTest {

    private static final RuntimeException PROCESSING_ERROR = new IllegalStateException("processing failed");

    @Test
    void testRedelivery_WhenProcessingFails_ReplacementVisibleAfterDelay() {
        // Given
        RedeliveryCoordinator<String> coordinator = createCoordinator(new RedeliveryConfig());
        Message received = deliver(createTestMessage("MSG-001"));
        Instant start = time.now();

        // When
        Outcome<String> outcome = execute(coordinator, received, failingWith(PROCESSING_ERROR));

        // Then
        assertSame(PROCESSING_ERROR, assertFailedWith(outcome, IllegalStateException.class));
        assertNotInFlight(received.messageId());
        assertRedelivered(received.messageId(), 1, start.plus(Duration.ofSeconds(30)));

        time.advance(Duration.ofSeconds(29));
        assertTrue(broker.receive(1).isEmpty(), "Replacement should not be visible before the delay");

        time.advance(Duration.ofSeconds(1));
        List<Message> redelivered = broker.receive(1);
        assertEquals(1, redelivered.size(), "Replacement should be visible after the delay");
        assertEquals(received.payload(), redelivered.get(0).payload(), "Payload should be unchanged");
    }

    @Test
    void testRedeliveryCycle_ExponentialBackoff_DeadLetteredAfterLimit() {
        // Given
        RedeliveryCoordinator<String> coordinator = createCoordinator(new RedeliveryConfig()
                .withBackoffType(BackoffType.EXPONENTIAL)
                .withBaseDelay(Duration.ofSeconds(1))
                .withMaxRedeliveryAttempts(3));
        Message current = deliver(createTestMessage("MSG-002"));
        long[] expectedDelaySeconds = {1, 2, 4};

        // When & Then: three redeliveries with doubling delays
        for (int attempt = 0; attempt < expectedDelaySeconds.length; attempt++) {
            Instant before = time.now();
            execute(coordinator, current, failingWith(PROCESSING_ERROR));
            assertRedelivered(current.messageId(), attempt + 1, before.plusSeconds(expectedDelaySeconds[attempt]));

            time.advance(Duration.ofSeconds(expectedDelaySeconds[attempt]));
            List<Message> next = broker.receive(1);
            assertEquals(1, next.size(), "Replacement should be visible for attempt " + (attempt + 1));
            current = next.get(0);
        }

        // Final attempt is terminal
        Outcome<String> last = execute(coordinator, current, failingWith(PROCESSING_ERROR));

        assertSame(PROCESSING_ERROR, assertFailedWith(last, IllegalStateException.class));
        assertDeadLettered(current.messageId());
        assertEquals(3, broker.getSentMessages().size(), "No redelivery after the limit");
        assertEquals(0, broker.queueSize());
        assertEquals(0, broker.inFlightSize());
    }

    @Test
    void testSuccess_NothingSent_SettlementLeftToHandler() {
        // Given
        RedeliveryCoordinator<String> coordinator = createCoordinator(new RedeliveryConfig());
        Message received = deliver(createTestMessage("MSG-003"));

        // When
        Outcome<String> outcome = execute(coordinator, received, succeedingWith("done"));

        // Then
        assertEquals(Optional.of("done"), outcome.successValue());
        assertNotRedelivered(received.messageId());
        assertInFlight(received.messageId());
    }

    @Test
    void testUnhandledFailure_WhenPredicateDeclines_NothingSent() {
        // Given
        RedeliveryCoordinator<String> coordinator = new RedeliveryCoordinator<>(this.<String>optionsBuilder()
                .shouldHandle(args -> CompletableFuture.completedFuture(false))
                .build());
        Message received = deliver(createTestMessage("MSG-004"));

        // When
        Outcome<String> outcome = execute(coordinator, received, failingWith(PROCESSING_ERROR));

        // Then
        assertSame(PROCESSING_ERROR, assertFailedWith(outcome, IllegalStateException.class));
        assertNotRedelivered(received.messageId());
        assertInFlight(received.messageId());
        assertEquals(0, broker.deadLetterSize());
    }

    @Test
    void testDelayGenerator_OverridesBackoff() {
        // Given
        RedeliveryCoordinator<String> coordinator = new RedeliveryCoordinator<>(this.<String>optionsBuilder()
                .delayGenerator(args -> CompletableFuture.completedFuture(Optional.of(Duration.ofSeconds(5))))
                .build());
        Message received = deliver(createTestMessage("MSG-005", 2));

        // When
        execute(coordinator, received, failingWith(PROCESSING_ERROR));

        // Then
        assertRedelivered(received.messageId(), 3, time.now().plusSeconds(5));
    }

    @Test
    void testOnRedeliver_NotifiedBeforeReplacementSent() {
        // Given
        List<Integer> notifiedAttempts = new CopyOnWriteArrayList<>();
        List<Integer> sentCountAtNotification = new CopyOnWriteArrayList<>();
        RedeliveryCoordinator<String> coordinator = new RedeliveryCoordinator<>(this.<String>optionsBuilder()
                .onRedeliver(args -> {
                    notifiedAttempts.add(args.attemptNumber());
                    sentCountAtNotification.add(broker.getSentMessages().size());
                    return CompletableFuture.completedFuture(null);
                })
                .build());
        Message received = deliver(createTestMessage("MSG-006", 1));

        // When
        execute(coordinator, received, failingWith(PROCESSING_ERROR));

        // Then
        assertEquals(List.of(1), notifiedAttempts);
        assertEquals(List.of(0), sentCountAtNotification, "Listener should run before the send");
        assertRedelivered(received.messageId(), 2, time.now().plusSeconds(30));
    }

    @Test
    void testTelemetry_ReportsExecutionAttemptAndRedelivery() {
        // Given
        RedeliveryCoordinator<String> coordinator = createCoordinator(new RedeliveryConfig().withName("OrderRedelivery"));
        Message failed = deliver(createTestMessage("MSG-007"));

        // When
        execute(coordinator, failed, failingWith(PROCESSING_ERROR));
        Message succeeded = deliver(createTestMessage("MSG-008"));
        execute(coordinator, succeeded, succeedingWith("done"));

        // Then
        List<RedeliveryEvent> attempts = telemetry.eventsNamed(RedeliveryConstants.EXECUTION_ATTEMPT_EVENT);
        List<RedeliveryEvent> redeliveries = telemetry.eventsNamed(RedeliveryConstants.ON_REDELIVER_EVENT);

        assertEquals(2, attempts.size());
        assertEquals(EventSeverity.WARNING, attempts.get(0).severity());
        assertEquals(EventSeverity.INFORMATION, attempts.get(1).severity());
        assertEquals(1, redeliveries.size());
        assertEquals("OrderRedelivery", redeliveries.get(0).strategyName());
        assertEquals(failed.messageId(), redeliveries.get(0).context().message().messageId());
    }
}
