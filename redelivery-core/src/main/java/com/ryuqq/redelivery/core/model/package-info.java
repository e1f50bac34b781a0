/**
 * Core message model package.
 *
 * <p>This package defines the immutable values that flow through the redelivery
 * engine. The core never mutates a received message; redeliveries are derived copies.</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.redelivery.core.model.MessageId} - Broker message identifier (kept across redeliveries)</li>
 *   <li>{@link com.ryuqq.redelivery.core.model.Payload} - Opaque message body</li>
 *   <li>{@link com.ryuqq.redelivery.core.model.Message} - Body plus application properties</li>
 *   <li>{@link com.ryuqq.redelivery.core.model.ScheduledMessage} - Message with a future visibility time</li>
 * </ul>
 *
 * <h2>Configuration Enums</h2>
 * <ul>
 *   <li>{@link com.ryuqq.redelivery.core.model.MessageAction} - Terminal disposition once attempts are exhausted</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records and final classes with defensive copies</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Redelivery Team
 */
package com.ryuqq.redelivery.core.model;
