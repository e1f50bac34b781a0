/**
 * Processing outcome package.
 *
 * <p>This package defines the sealed result type returned from every code path of the
 * redelivery engine. Broker failures are converted into values of this type rather than
 * thrown, so a single uniform result flows back to the caller.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.redelivery.core.outcome.Outcome} - Sealed interface (permits Ok, Fail)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.redelivery.core.outcome.Ok} - Callback returned a value</li>
 *   <li>{@link com.ryuqq.redelivery.core.outcome.Fail} - Callback or broker call failed</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Redelivery Team
 */
package com.ryuqq.redelivery.core.outcome;
