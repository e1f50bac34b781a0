/**
 * Broker-side transitions applied after a redelivery decision.
 *
 * <ul>
 *   <li>{@link com.ryuqq.redelivery.core.transition.RedeliveryTransition} - Complete original and schedule replacement</li>
 *   <li>{@link com.ryuqq.redelivery.core.transition.TerminalActionDispatcher} - Complete, abandon, defer or dead-letter</li>
 * </ul>
 *
 * <p>Both components convert broker failures into {@link com.ryuqq.redelivery.core.outcome.Fail} values.</p>
 *
 * @since 1.0.0
 * @author Redelivery Team
 */
package com.ryuqq.redelivery.core.transition;
