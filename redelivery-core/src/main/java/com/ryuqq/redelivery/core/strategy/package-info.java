/**
 * Delayed redelivery strategy package.
 *
 * <p>{@link com.ryuqq.redelivery.core.strategy.RedeliveryCoordinator} wraps a
 * {@link com.ryuqq.redelivery.core.strategy.ProcessingCallback} and, when the outcome is
 * handled, either schedules a delayed replacement message or applies the configured
 * terminal action.</p>
 *
 * <h2>Configuration</h2>
 * <ul>
 *   <li>{@link com.ryuqq.redelivery.core.strategy.RedeliveryConfig} - Backoff, attempt limit, terminal action</li>
 *   <li>{@link com.ryuqq.redelivery.core.strategy.RedeliveryOptions} - Config plus hooks and collaborators</li>
 * </ul>
 *
 * <h2>Hooks</h2>
 * <ul>
 *   <li>{@link com.ryuqq.redelivery.core.strategy.RedeliveryPredicate} - Decides whether an outcome is handled</li>
 *   <li>{@link com.ryuqq.redelivery.core.strategy.DelayGenerator} - Optional delay override</li>
 *   <li>{@link com.ryuqq.redelivery.core.strategy.OnRedeliverListener} - Optional notification before redelivery</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Redelivery Team
 */
package com.ryuqq.redelivery.core.strategy;
