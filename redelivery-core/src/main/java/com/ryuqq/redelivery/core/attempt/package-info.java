/**
 * Attempt number tracking package.
 *
 * <p>Reads the zero-based attempt counter from message properties, decides whether
 * the redelivery budget is exhausted, and stamps the counter onto replacement messages.</p>
 *
 * @since 1.0.0
 * @author Redelivery Team
 */
package com.ryuqq.redelivery.core.attempt;
