/**
 * Internal helpers for composing {@link java.util.concurrent.CompletionStage} pipelines.
 *
 * @since 1.0.0
 * @author Redelivery Team
 */
package com.ryuqq.redelivery.core.support;
