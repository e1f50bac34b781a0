/**
 * Redelivery phase state machine package.
 *
 * <p>Validates the order in which the coordinator moves through the phases of
 * processing a single message.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.redelivery.core.statemachine.RedeliveryPhase} - Processing phases (enum)</li>
 *   <li>{@link com.ryuqq.redelivery.core.statemachine.PhaseTransition} - Transition validation</li>
 *   <li>{@link com.ryuqq.redelivery.core.statemachine.PhaseTracker} - Current phase of one execution, validated on every move</li>
 * </ul>
 *
 * <h2>Phase Transition Rules</h2>
 * <pre>
 * EXECUTING → EVALUATING
 * EVALUATING → TERMINAL | SCHEDULING | DONE
 * TERMINAL → DONE
 * SCHEDULING → DONE
 *
 * Forbidden:
 * - DONE → * (terminal phase)
 * - TERMINAL ↔ SCHEDULING
 * </pre>
 *
 * @since 1.0.0
 * @author Redelivery Team
 */
package com.ryuqq.redelivery.core.statemachine;
