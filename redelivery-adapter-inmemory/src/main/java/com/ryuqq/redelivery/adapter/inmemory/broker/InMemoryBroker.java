package com.ryuqq.redelivery.adapter.inmemory.broker;

import com.ryuqq.redelivery.core.model.Message;
import com.ryuqq.redelivery.core.model.MessageId;
import com.ryuqq.redelivery.core.model.ScheduledMessage;
import com.ryuqq.redelivery.core.spi.MessageReceiver;
import com.ryuqq.redelivery.core.spi.MessageSender;
import com.ryuqq.redelivery.core.spi.MessageSource;
import com.ryuqq.redelivery.core.spi.TimeProvider;
import com.ryuqq.redelivery.core.spi.TransactionalTransport;
import com.ryuqq.redelivery.core.time.SystemTimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory message broker implementing the sender, receiver, source and
 * transactional transport SPIs for testing and reference purposes.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Main Queue:</strong> DelayQueue&lt;ScheduledEntry&gt; - Scheduled delivery ordered by enqueue time</li>
 *   <li><strong>In-Flight Tracking:</strong> IdentityHashMap&lt;Message, InFlightEntry&gt; - Message locks with visibility timeout</li>
 *   <li><strong>Deferred Messages:</strong> ConcurrentHashMap&lt;MessageId, Message&gt; - Retrievable only by id</li>
 *   <li><strong>Dead Letter Queue:</strong> CopyOnWriteArrayList&lt;DeadLetterEntry&gt; - Dead-lettered messages</li>
 * </ul>
 *
 * <p><strong>Time:</strong> Scheduled visibility and lock expiry are computed from the injected
 * {@link TimeProvider}, so tests can move time forward without sleeping.</p>
 *
 * <p><strong>Lock Identity:</strong> every delivery hands out a fresh {@link Message} instance and
 * that instance is the lock token. Two deliveries of the same message id hold distinct locks, so
 * a holder whose lock expired cannot settle a later delivery of the same id.</p>
 *
 * <p><strong>Settlement:</strong> complete, abandon, defer and dead-letter require the delivered
 * instance to still hold its lock. Settling a message whose lock was lost fails the returned stage
 * with {@link IllegalStateException}.</p>
 *
 * <p><strong>Atomicity:</strong> {@link #completeAndSend(Message, MessageReceiver, MessageSender, ScheduledMessage)}
 * validates both operations under a single lock and applies both or neither.</p>
 *
 * <p><strong>Fault Injection:</strong> {@link #failNextSend(RuntimeException)} and
 * {@link #failNextSettlement(RuntimeException)} make the next matching call fail once.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryBroker broker = new InMemoryBroker();
 * broker.enqueue(message);
 *
 * List&lt;Message&gt; batch = broker.receive(10);
 * for (Message received : batch) {
 *     coordinator.execute(DeliveryContext.of(received, broker, broker), handler);
 * }
 * </pre>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public class InMemoryBroker implements MessageSender, MessageReceiver, MessageSource, TransactionalTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBroker.class);

    /**
     * Default visibility timeout: 30 seconds.
     */
    public static final Duration DEFAULT_VISIBILITY_TIMEOUT = Duration.ofSeconds(30);

    private final DelayQueue<ScheduledEntry> queue = new DelayQueue<>();
    /**
     * Keyed by delivered instance. Guarded by {@link #lock}.
     */
    private final Map<Message, InFlightEntry> inFlight = new IdentityHashMap<>();
    private final ConcurrentHashMap<MessageId, Message> deferred = new ConcurrentHashMap<>();
    private final List<DeadLetterEntry> deadLetters = new CopyOnWriteArrayList<>();
    private final List<ScheduledMessage> sentLog = new CopyOnWriteArrayList<>();

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicReference<RuntimeException> nextSendFailure = new AtomicReference<>();
    private final AtomicReference<RuntimeException> nextSettlementFailure = new AtomicReference<>();

    /**
     * Serializes mutations that must be observed atomically (settlement and transactional send).
     */
    private final ReentrantLock lock = new ReentrantLock();

    private final TimeProvider timeProvider;
    private final Duration visibilityTimeout;

    /**
     * Creates a broker on the system clock with the default visibility timeout.
     */
    public InMemoryBroker() {
        this(SystemTimeProvider.instance(), DEFAULT_VISIBILITY_TIMEOUT);
    }

    /**
     * Creates a broker with the default visibility timeout.
     *
     * @param timeProvider time source for scheduling and lock expiry
     */
    public InMemoryBroker(TimeProvider timeProvider) {
        this(timeProvider, DEFAULT_VISIBILITY_TIMEOUT);
    }

    /**
     * Creates a broker.
     *
     * @param timeProvider time source for scheduling and lock expiry
     * @param visibilityTimeout how long a received message stays locked
     * @throws IllegalArgumentException if timeProvider is null or visibilityTimeout is not positive
     */
    public InMemoryBroker(TimeProvider timeProvider, Duration visibilityTimeout) {
        if (timeProvider == null) {
            throw new IllegalArgumentException("timeProvider cannot be null");
        }
        if (visibilityTimeout == null || visibilityTimeout.isNegative() || visibilityTimeout.isZero()) {
            throw new IllegalArgumentException("visibilityTimeout must be positive, but was: " + visibilityTimeout);
        }
        this.timeProvider = timeProvider;
        this.visibilityTimeout = visibilityTimeout;
    }

    // ========== Producer side ==========

    /**
     * Enqueues a message for immediate delivery.
     *
     * @param message the message
     * @throws IllegalArgumentException if message is null
     */
    public void enqueue(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        queue.put(new ScheduledEntry(message, timeProvider.now(), sequence.incrementAndGet()));
    }

    /**
     * {@inheritDoc}
     *
     * <p>The message becomes receivable once the time provider reaches its scheduled enqueue time.</p>
     */
    @Override
    public CompletionStage<Void> send(ScheduledMessage message) {
        if (message == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("message cannot be null"));
        }
        RuntimeException injected = nextSendFailure.getAndSet(null);
        if (injected != null) {
            return CompletableFuture.failedFuture(injected);
        }
        schedule(message);
        return CompletableFuture.completedFuture(null);
    }

    // ========== Consumer side ==========

    /**
     * {@inheritDoc}
     *
     * <p>Received messages are locked for the visibility timeout.</p>
     */
    @Override
    public List<Message> receive(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        List<Message> result = new ArrayList<>();
        Instant lockedUntil = timeProvider.now().plus(visibilityTimeout);

        lock.lock();
        try {
            for (int i = 0; i < batchSize; i++) {
                ScheduledEntry entry = queue.poll();
                if (entry == null) {
                    break;
                }
                result.add(lockDelivery(entry.message, lockedUntil));
            }
        } finally {
            lock.unlock();
        }

        return result;
    }

    /**
     * Receives a deferred message by id and locks it.
     *
     * @param messageId the deferred message id
     * @return the message, or empty if no deferred message has that id
     */
    public Optional<Message> receiveDeferred(MessageId messageId) {
        if (messageId == null) {
            throw new IllegalArgumentException("messageId cannot be null");
        }
        lock.lock();
        try {
            Message message = deferred.remove(messageId);
            if (message == null) {
                return Optional.empty();
            }
            return Optional.of(lockDelivery(message, timeProvider.now().plus(visibilityTimeout)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CompletionStage<Void> complete(Message message) {
        return settle(message, "complete", entry -> {
        });
    }

    /**
     * {@inheritDoc}
     *
     * <p>The message is returned to the queue immediately.</p>
     */
    @Override
    public CompletionStage<Void> abandon(Message message) {
        return settle(message, "abandon", entry ->
            queue.put(new ScheduledEntry(entry.message, timeProvider.now(), sequence.incrementAndGet())));
    }

    @Override
    public CompletionStage<Void> defer(Message message) {
        return settle(message, "defer", entry -> deferred.put(entry.message.messageId(), entry.message));
    }

    @Override
    public CompletionStage<Void> deadLetter(Message message) {
        return settle(message, "deadLetter", entry ->
            deadLetters.add(new DeadLetterEntry(entry.message, timeProvider.now())));
    }

    /**
     * {@inheritDoc}
     *
     * <p>The original must be locked by this broker, and both {@code receiver} and {@code sender}
     * must be this broker. Injected send or settlement failures abort the whole unit.</p>
     */
    @Override
    public CompletionStage<Void> completeAndSend(Message original, MessageReceiver receiver, MessageSender sender,
                                                 ScheduledMessage replacement) {
        if (original == null || replacement == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("original and replacement cannot be null"));
        }
        if (receiver != this) {
            return CompletableFuture.failedFuture(
                new IllegalArgumentException("receiver must be this broker for a transactional send"));
        }
        if (sender != this) {
            return CompletableFuture.failedFuture(
                new IllegalArgumentException("sender must be this broker for a transactional send"));
        }

        lock.lock();
        try {
            RuntimeException injected = firstNonNull(nextSettlementFailure.getAndSet(null), nextSendFailure.getAndSet(null));
            if (injected != null) {
                log.debug("Transaction rolled back by injected failure: messageId={}", original.messageId().getValue());
                return CompletableFuture.failedFuture(injected);
            }
            if (inFlight.remove(original) == null) {
                return CompletableFuture.failedFuture(lockLost(original, "completeAndSend"));
            }
            schedule(replacement);
            return CompletableFuture.completedFuture(null);
        } finally {
            lock.unlock();
        }
    }

    // ========== Visibility timeout ==========

    /**
     * Returns messages whose lock has expired to the queue.
     *
     * @return number of messages returned to the queue
     */
    public int processVisibilityTimeouts() {
        Instant now = timeProvider.now();
        int count = 0;

        lock.lock();
        try {
            Iterator<InFlightEntry> entries = inFlight.values().iterator();
            while (entries.hasNext()) {
                InFlightEntry entry = entries.next();
                if (!entry.lockedUntil.isAfter(now)) {
                    entries.remove();
                    queue.put(new ScheduledEntry(entry.message, now, sequence.incrementAndGet()));
                    count++;
                }
            }
        } finally {
            lock.unlock();
        }

        return count;
    }

    /**
     * Forces the lock held by a delivered message to expire and returns it to the queue.
     *
     * @param message the delivered instance
     * @return true if that instance still held its lock
     */
    public boolean expireLock(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }

        lock.lock();
        try {
            InFlightEntry entry = inFlight.remove(message);
            if (entry == null) {
                return false;
            }
            queue.put(new ScheduledEntry(entry.message, timeProvider.now(), sequence.incrementAndGet()));
            return true;
        } finally {
            lock.unlock();
        }
    }

    // ========== Fault injection ==========

    /**
     * Makes the next send (or transactional send) fail with the given exception.
     *
     * @param failure the exception to report
     */
    public void failNextSend(RuntimeException failure) {
        nextSendFailure.set(failure);
    }

    /**
     * Makes the next settlement (complete, abandon, defer, dead-letter or transactional send)
     * fail with the given exception.
     *
     * @param failure the exception to report
     */
    public void failNextSettlement(RuntimeException failure) {
        nextSettlementFailure.set(failure);
    }

    // ========== Inspection ==========

    /**
     * Clears every queue and pending fault. Used for test cleanup.
     */
    public void clear() {
        lock.lock();
        try {
            queue.clear();
            inFlight.clear();
            deferred.clear();
            deadLetters.clear();
            sentLog.clear();
            nextSendFailure.set(null);
            nextSettlementFailure.set(null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of queued messages, including those not yet visible.
     *
     * @return queue size
     */
    public int queueSize() {
        return queue.size();
    }

    /**
     * Returns the number of locked messages.
     *
     * @return in-flight count
     */
    public int inFlightSize() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of deferred messages.
     *
     * @return deferred count
     */
    public int deferredSize() {
        return deferred.size();
    }

    /**
     * Returns the number of dead-lettered messages.
     *
     * @return dead letter count
     */
    public int deadLetterSize() {
        return deadLetters.size();
    }

    /**
     * Returns a snapshot of dead letter entries.
     *
     * @return dead letter entries
     */
    public List<DeadLetterEntry> getDeadLetterEntries() {
        return new ArrayList<>(deadLetters);
    }

    /**
     * Returns every scheduled message accepted by this broker, in order.
     *
     * @return sent messages
     */
    public List<ScheduledMessage> getSentMessages() {
        return new ArrayList<>(sentLog);
    }

    /**
     * Returns whether any delivery of the message id is currently locked.
     *
     * @param messageId the message id
     * @return true if in flight
     */
    public boolean isInFlight(MessageId messageId) {
        lock.lock();
        try {
            for (InFlightEntry entry : inFlight.values()) {
                if (entry.message.messageId().equals(messageId)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns whether this delivered instance still holds its lock.
     *
     * @param message the delivered instance
     * @return true if its lock is held
     */
    public boolean holdsLock(Message message) {
        lock.lock();
        try {
            return inFlight.containsKey(message);
        } finally {
            lock.unlock();
        }
    }

    // ========== Internals ==========

    private void schedule(ScheduledMessage message) {
        sentLog.add(message);
        queue.put(new ScheduledEntry(message.message(), message.scheduledEnqueueTime(), sequence.incrementAndGet()));
    }

    private CompletionStage<Void> settle(Message message, String operation, Settlement settlement) {
        if (message == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("message cannot be null"));
        }

        lock.lock();
        try {
            RuntimeException injected = nextSettlementFailure.getAndSet(null);
            if (injected != null) {
                return CompletableFuture.failedFuture(injected);
            }
            InFlightEntry entry = inFlight.remove(message);
            if (entry == null) {
                return CompletableFuture.failedFuture(lockLost(message, operation));
            }
            settlement.apply(entry);
            return CompletableFuture.completedFuture(null);
        } finally {
            lock.unlock();
        }
    }

    private Message lockDelivery(Message message, Instant lockedUntil) {
        Message delivery = new Message(message.messageId(), message.payload(), message.applicationProperties());
        inFlight.put(delivery, new InFlightEntry(delivery, lockedUntil));
        return delivery;
    }

    private static IllegalStateException lockLost(Message message, String operation) {
        return new IllegalStateException(
            "Message lock lost: cannot " + operation + " messageId=" + message.messageId().getValue());
    }

    private static RuntimeException firstNonNull(RuntimeException first, RuntimeException second) {
        return first != null ? first : second;
    }

    @FunctionalInterface
    private interface Settlement {
        void apply(InFlightEntry entry);
    }

    /**
     * Queue entry that becomes available at its scheduled time, measured on the broker's time provider.
     */
    private final class ScheduledEntry implements Delayed {
        private final Message message;
        private final Instant availableAt;
        private final long sequenceNumber;

        ScheduledEntry(Message message, Instant availableAt, long sequenceNumber) {
            this.message = message;
            this.availableAt = availableAt;
            this.sequenceNumber = sequenceNumber;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            Duration remaining = Duration.between(timeProvider.now(), availableAt);
            long nanos;
            try {
                nanos = remaining.toNanos();
            } catch (ArithmeticException overflow) {
                nanos = remaining.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
            }
            return unit.convert(nanos, TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            ScheduledEntry that = (ScheduledEntry) other;
            int byTime = availableAt.compareTo(that.availableAt);
            return byTime != 0 ? byTime : Long.compare(sequenceNumber, that.sequenceNumber);
        }
    }

    private static final class InFlightEntry {
        private final Message message;
        private final Instant lockedUntil;

        InFlightEntry(Message message, Instant lockedUntil) {
            this.message = message;
            this.lockedUntil = lockedUntil;
        }
    }

    /**
     * Dead letter queue entry.
     */
    public static final class DeadLetterEntry {
        private final Message message;
        private final Instant deadLetteredAt;

        DeadLetterEntry(Message message, Instant deadLetteredAt) {
            this.message = message;
            this.deadLetteredAt = deadLetteredAt;
        }

        public Message getMessage() {
            return message;
        }

        public Instant getDeadLetteredAt() {
            return deadLetteredAt;
        }
    }
}
