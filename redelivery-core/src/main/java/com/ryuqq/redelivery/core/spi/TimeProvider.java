package com.ryuqq.redelivery.core.spi;

import java.time.Duration;
import java.time.Instant;

/**
 * Time abstraction for scheduling and duration measurement.
 *
 * <p>Tests substitute a controllable implementation so that scheduled enqueue
 * times and elapsed durations are deterministic.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public interface TimeProvider {

    /**
     * Returns the current wall-clock instant.
     *
     * @return current instant
     */
    Instant now();

    /**
     * Returns a monotonic timestamp for measuring elapsed time.
     *
     * @return opaque timestamp
     */
    long timestamp();

    /**
     * Returns the time elapsed since a timestamp obtained from {@link #timestamp()}.
     *
     * @param startTimestamp starting timestamp
     * @return elapsed duration
     */
    Duration elapsedSince(long startTimestamp);
}
