/**
 * Default {@link com.ryuqq.redelivery.core.spi.TimeProvider} implementation.
 *
 * @since 1.0.0
 * @author Redelivery Team
 */
package com.ryuqq.redelivery.core.time;
