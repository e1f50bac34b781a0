package com.ryuqq.redelivery.core.spi;

import com.ryuqq.redelivery.core.telemetry.RedeliveryEvent;

/**
 * Receives telemetry events emitted by the redelivery coordinator.
 *
 * <p>Failures thrown by {@link #report(RedeliveryEvent)} are logged by the caller and
 * never change the processing outcome.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TelemetrySink {

    /**
     * Reports one event.
     *
     * @param event the event
     */
    void report(RedeliveryEvent event);
}
