/**
 * Per-message delivery context.
 *
 * <ul>
 *   <li>{@link com.ryuqq.redelivery.core.context.DeliveryContext} - Message, receiver, sender and cancellation</li>
 *   <li>{@link com.ryuqq.redelivery.core.context.CancellationToken} - Cooperative cancellation flag</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Redelivery Team
 */
package com.ryuqq.redelivery.core.context;
