/**
 * In-memory broker adapter providing thread-safe queue semantics for testing and reference.
 *
 * <p>{@link com.ryuqq.redelivery.adapter.inmemory.broker.InMemoryBroker} implements every broker SPI
 * of the core ({@link com.ryuqq.redelivery.core.spi.MessageSender},
 * {@link com.ryuqq.redelivery.core.spi.MessageReceiver},
 * {@link com.ryuqq.redelivery.core.spi.MessageSource} and
 * {@link com.ryuqq.redelivery.core.spi.TransactionalTransport}).</p>
 *
 * <h2>Message Lifecycle</h2>
 *
 * <pre>
 * ┌──────────────────┐
 * │ enqueue / send   │ (send honours scheduledEnqueueTime)
 * └────────┬─────────┘
 *          │
 *          ▼
 * ┌──────────────────┐
 * │ DelayQueue       │ (wait until the time provider reaches the scheduled time)
 * └────────┬─────────┘
 *          │
 *          ▼
 * ┌──────────────────┐
 * │ receive          │ → Locked per delivered instance (visibility timeout starts)
 * └────────┬─────────┘
 *          │
 *          ├──► complete() ─────────────────► [Removed]
 *          ├──► abandon() ──────────────────► [Re-queued immediately]
 *          ├──► defer() ────────────────────► [Deferred, receiveDeferred(id)]
 *          ├──► deadLetter() ───────────────► [Dead Letter Queue]
 *          ├──► completeAndSend() ──────────► [Removed + replacement scheduled, atomically]
 *          └──► Lock expired ───────────────► [Re-queued by processVisibilityTimeouts()]
 * </pre>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>In-Memory Only:</strong> Data lost on process restart</li>
 *   <li><strong>Single JVM:</strong> No distributed queue support</li>
 *   <li><strong>Manual Timeout Processing:</strong> Requires explicit {@code processVisibilityTimeouts()} calls</li>
 * </ul>
 *
 * @see com.ryuqq.redelivery.adapter.inmemory.broker.InMemoryBroker
 * @author Redelivery Team
 * @since 1.0.0
 */
package com.ryuqq.redelivery.adapter.inmemory.broker;
