/**
 * Backoff delay computation package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.redelivery.core.backoff.BackoffType} - Constant, linear or exponential growth</li>
 *   <li>{@link com.ryuqq.redelivery.core.backoff.BackoffSpec} - Type plus base and optional maximum delay</li>
 *   <li>{@link com.ryuqq.redelivery.core.backoff.DelayPolicy} - Pure delay computation with overflow and capping policy</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Redelivery Team
 */
package com.ryuqq.redelivery.core.backoff;
