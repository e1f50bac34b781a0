package com.ryuqq.redelivery.adapter.inmemory.broker;

import com.ryuqq.redelivery.core.model.Message;
import com.ryuqq.redelivery.core.model.MessageId;
import com.ryuqq.redelivery.core.model.Payload;
import com.ryuqq.redelivery.core.model.ScheduledMessage;
import com.ryuqq.redelivery.core.spi.MessageSender;
import com.ryuqq.redelivery.core.spi.TimeProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;

/**
 * Unit tests for {@link InMemoryBroker}.
 *
 * <p>Time is driven through a mocked {@link TimeProvider} so scheduled delivery and
 * lock expiry can be tested without sleeping.</p>
 */
@ExtendWith(MockitoExtension.class)
class InMemoryBrokerTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private TimeProvider timeProvider;

    private final AtomicReference<Instant> now = new AtomicReference<>(START);
    private InMemoryBroker broker;

    @BeforeEach
    void setUp() {
        lenient().when(timeProvider.now()).thenAnswer(invocation -> now.get());
        broker = new InMemoryBroker(timeProvider, Duration.ofSeconds(30));
    }

    // ========== Receive ==========

    @Test
    void receive_EnqueuedMessage_LocksMessage() {
        // given
        Message message = message("msg-1");
        broker.enqueue(message);

        // when
        List<Message> received = broker.receive(10);

        // then
        assertThat(received).containsExactly(message);
        assertThat(broker.isInFlight(message.messageId())).isTrue();
        assertThat(broker.queueSize()).isZero();
    }

    @Test
    void receive_RespectsBatchSizeAndOrder() {
        // given
        broker.enqueue(message("msg-1"));
        broker.enqueue(message("msg-2"));
        broker.enqueue(message("msg-3"));

        // when
        List<Message> first = broker.receive(2);
        List<Message> second = broker.receive(2);

        // then
        assertThat(first).extracting(m -> m.messageId().getValue()).containsExactly("msg-1", "msg-2");
        assertThat(second).extracting(m -> m.messageId().getValue()).containsExactly("msg-3");
    }

    @Test
    void receive_NonPositiveBatchSize_ThrowsException() {
        assertThatThrownBy(() -> broker.receive(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========== Scheduled send ==========

    @Test
    void send_FutureEnqueueTime_InvisibleUntilTimeReached() {
        // given
        Message message = message("msg-1");
        join(broker.send(new ScheduledMessage(message, START.plusSeconds(30))));

        // when
        List<Message> early = broker.receive(10);
        now.set(START.plusSeconds(30));
        List<Message> onTime = broker.receive(10);

        // then
        assertThat(early).isEmpty();
        assertThat(onTime).containsExactly(message);
        assertThat(broker.getSentMessages()).hasSize(1);
    }

    @Test
    void send_InstantMax_NeverBecomesVisible() {
        // given
        join(broker.send(new ScheduledMessage(message("msg-1"), Instant.MAX)));

        // when
        now.set(START.plus(Duration.ofDays(365 * 1000L)));

        // then
        assertThat(broker.receive(10)).isEmpty();
        assertThat(broker.queueSize()).isEqualTo(1);
    }

    @Test
    void send_InjectedFailure_FailsOnceWithoutScheduling() {
        // given
        broker.failNextSend(new IllegalStateException("broker down"));
        ScheduledMessage scheduled = new ScheduledMessage(message("msg-1"), START);

        // when & then
        assertThatThrownBy(() -> join(broker.send(scheduled)))
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(broker.queueSize()).isZero();

        join(broker.send(scheduled));
        assertThat(broker.queueSize()).isEqualTo(1);
    }

    // ========== Settlement ==========

    @Test
    void complete_InFlightMessage_RemovesIt() {
        // given
        Message message = receiveOne("msg-1");

        // when
        join(broker.complete(message));

        // then
        assertThat(broker.inFlightSize()).isZero();
        assertThat(broker.queueSize()).isZero();
    }

    @Test
    void complete_MessageNotLocked_FailsWithLockLost() {
        // given
        Message message = message("msg-1");

        // when & then
        assertThatThrownBy(() -> join(broker.complete(message)))
            .hasCauseInstanceOf(IllegalStateException.class)
            .hasMessageContaining("lock lost");
    }

    @Test
    void abandon_InFlightMessage_RequeuesImmediately() {
        // given
        Message message = receiveOne("msg-1");

        // when
        join(broker.abandon(message));

        // then
        assertThat(broker.receive(10)).containsExactly(message);
    }

    @Test
    void defer_InFlightMessage_RetrievableOnlyById() {
        // given
        Message message = receiveOne("msg-1");

        // when
        join(broker.defer(message));

        // then
        assertThat(broker.deferredSize()).isEqualTo(1);
        assertThat(broker.receive(10)).isEmpty();
        assertThat(broker.receiveDeferred(message.messageId())).contains(message);
        assertThat(broker.isInFlight(message.messageId())).isTrue();
        assertThat(broker.receiveDeferred(MessageId.of("unknown"))).isEmpty();
    }

    @Test
    void deadLetter_InFlightMessage_MovesToDeadLetterQueue() {
        // given
        Message message = receiveOne("msg-1");
        now.set(START.plusSeconds(5));

        // when
        join(broker.deadLetter(message));

        // then
        assertThat(broker.deadLetterSize()).isEqualTo(1);
        InMemoryBroker.DeadLetterEntry entry = broker.getDeadLetterEntries().get(0);
        assertThat(entry.getMessage()).isEqualTo(message);
        assertThat(entry.getDeadLetteredAt()).isEqualTo(START.plusSeconds(5));
    }

    @Test
    void settlement_InjectedFailure_KeepsMessageLocked() {
        // given
        Message message = receiveOne("msg-1");
        broker.failNextSettlement(new IllegalStateException("settle failed"));

        // when & then
        assertThatThrownBy(() -> join(broker.deadLetter(message)))
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(broker.isInFlight(message.messageId())).isTrue();
        assertThat(broker.deadLetterSize()).isZero();
    }

    // ========== Transactional send ==========

    @Test
    void completeAndSend_CompletesOriginalAndSchedulesReplacement() {
        // given
        Message original = receiveOne("msg-1");
        Message replacement = original.withProperty("AttemptNumber", 2);

        // when
        join(broker.completeAndSend(original, broker, broker, new ScheduledMessage(replacement, START.plusSeconds(30))));

        // then
        assertThat(broker.inFlightSize()).isZero();
        assertThat(broker.queueSize()).isEqualTo(1);
        now.set(START.plusSeconds(30));
        assertThat(broker.receive(1)).containsExactly(replacement);
    }

    @Test
    void completeAndSend_InjectedFailure_AppliesNeither() {
        // given
        Message original = receiveOne("msg-1");
        broker.failNextSend(new IllegalStateException("send failed"));

        // when & then
        assertThatThrownBy(() -> join(broker.completeAndSend(original, broker, broker, new ScheduledMessage(original, START))))
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(broker.isInFlight(original.messageId())).isTrue();
        assertThat(broker.queueSize()).isZero();
        assertThat(broker.getSentMessages()).isEmpty();
    }

    @Test
    void completeAndSend_LockLost_AppliesNeither() {
        // given
        Message original = message("msg-1");

        // when & then
        assertThatThrownBy(() -> join(broker.completeAndSend(original, broker, broker, new ScheduledMessage(original, START))))
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(broker.queueSize()).isZero();
    }

    @Test
    void completeAndSend_ForeignSender_RejectsWithoutSettling() {
        // given
        Message original = receiveOne("msg-1");
        MessageSender foreignSender = scheduled -> CompletableFuture.completedFuture(null);

        // when & then
        assertThatThrownBy(() -> join(broker.completeAndSend(original, broker, foreignSender,
            new ScheduledMessage(original, START))))
            .hasCauseInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("sender must be this broker");
        assertThat(broker.holdsLock(original)).isTrue();
        assertThat(broker.queueSize()).isZero();
    }

    // ========== Lock identity ==========

    @Test
    void receive_SameMessageTwice_HandsOutDistinctLocks() {
        // given
        Message first = receiveOne("msg-1");
        broker.expireLock(first);

        // when
        Message second = broker.receive(1).get(0);

        // then
        assertThat(second).isEqualTo(first).isNotSameAs(first);
        assertThat(broker.holdsLock(first)).isFalse();
        assertThat(broker.holdsLock(second)).isTrue();
    }

    @Test
    void complete_StaleDeliveryAfterRedelivery_LeavesCurrentLockIntact() {
        // given
        Message stale = receiveOne("msg-1");
        now.set(START.plusSeconds(30));
        broker.processVisibilityTimeouts();
        Message current = broker.receive(1).get(0);

        // when & then
        assertThatThrownBy(() -> join(broker.complete(stale)))
            .hasCauseInstanceOf(IllegalStateException.class)
            .hasMessageContaining("lock lost");
        assertThat(broker.holdsLock(current)).isTrue();
        join(broker.complete(current));
        assertThat(broker.inFlightSize()).isZero();
    }

    // ========== Visibility timeout ==========

    @Test
    void processVisibilityTimeouts_ExpiredLock_RequeuesMessage() {
        // given
        Message message = receiveOne("msg-1");

        // when
        int beforeExpiry = broker.processVisibilityTimeouts();
        now.set(START.plusSeconds(30));
        int afterExpiry = broker.processVisibilityTimeouts();

        // then
        assertThat(beforeExpiry).isZero();
        assertThat(afterExpiry).isEqualTo(1);
        assertThat(broker.inFlightSize()).isZero();
        assertThatThrownBy(() -> join(broker.complete(message)))
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(broker.receive(10)).containsExactly(message);
    }

    @Test
    void expireLock_InFlightMessage_RequeuesMessage() {
        // given
        Message message = receiveOne("msg-1");

        // when & then
        assertThat(broker.expireLock(message)).isTrue();
        assertThat(broker.expireLock(message)).isFalse();
        assertThat(broker.queueSize()).isEqualTo(1);
    }

    @Test
    void clear_RemovesEverything() {
        // given
        receiveOne("msg-1");
        broker.enqueue(message("msg-2"));
        broker.failNextSend(new IllegalStateException("pending"));

        // when
        broker.clear();

        // then
        assertThat(broker.queueSize()).isZero();
        assertThat(broker.inFlightSize()).isZero();
        join(broker.send(new ScheduledMessage(message("msg-3"), START)));
        assertThat(broker.queueSize()).isEqualTo(1);
    }

    @Test
    void constructor_NonPositiveVisibilityTimeout_ThrowsException() {
        assertThatThrownBy(() -> new InMemoryBroker(timeProvider, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryBroker(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("timeProvider cannot be null");
    }

    // ========== Helpers ==========

    private Message receiveOne(String id) {
        broker.enqueue(message(id));
        return broker.receive(1).get(0);
    }

    private static Message message(String id) {
        return Message.of(MessageId.of(id), Payload.of("payload-" + id));
    }

    private static void join(CompletionStage<Void> stage) {
        stage.toCompletableFuture().join();
    }
}
