/**
 * Telemetry events emitted by the redelivery coordinator.
 *
 * <p>Events are delivered to a {@link com.ryuqq.redelivery.core.spi.TelemetrySink}.
 * {@link com.ryuqq.redelivery.core.telemetry.LoggingTelemetrySink} writes them through SLF4J.</p>
 *
 * @since 1.0.0
 * @author Redelivery Team
 */
package com.ryuqq.redelivery.core.telemetry;
