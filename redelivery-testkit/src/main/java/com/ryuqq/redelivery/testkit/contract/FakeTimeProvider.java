package com.ryuqq.redelivery.testkit.contract;

import com.ryuqq.redelivery.core.spi.TimeProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Manually advanced {@link TimeProvider} for deterministic tests.
 *
 * <p>Wall-clock time and the monotonic timestamp move together on {@link #advance(Duration)}.
 * {@link #setNow(Instant)} only moves the wall clock.</p>
 *
 * <p>Thread-safe.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public class FakeTimeProvider implements TimeProvider {

    /**
     * Default starting instant.
     */
    public static final Instant DEFAULT_START = Instant.parse("2024-01-01T00:00:00Z");

    private final AtomicReference<Instant> now;
    private final AtomicLong nanos = new AtomicLong();

    /**
     * Creates a provider starting at {@link #DEFAULT_START}.
     */
    public FakeTimeProvider() {
        this(DEFAULT_START);
    }

    /**
     * Creates a provider starting at the given instant.
     *
     * @param start the initial wall-clock time
     * @throws IllegalArgumentException if start is null
     */
    public FakeTimeProvider(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = new AtomicReference<>(start);
    }

    @Override
    public Instant now() {
        return now.get();
    }

    @Override
    public long timestamp() {
        return nanos.get();
    }

    @Override
    public Duration elapsedSince(long startTimestamp) {
        return Duration.ofNanos(nanos.get() - startTimestamp);
    }

    /**
     * Moves both clocks forward.
     *
     * @param amount non-negative amount
     * @throws IllegalArgumentException if amount is null or negative
     */
    public void advance(Duration amount) {
        if (amount == null || amount.isNegative()) {
            throw new IllegalArgumentException("amount must be non-negative, but was: " + amount);
        }
        now.updateAndGet(current -> current.plus(amount));
        nanos.addAndGet(amount.toNanos());
    }

    /**
     * Sets the wall-clock time.
     *
     * @param instant the new time
     * @throws IllegalArgumentException if instant is null
     */
    public void setNow(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now.set(instant);
    }
}
