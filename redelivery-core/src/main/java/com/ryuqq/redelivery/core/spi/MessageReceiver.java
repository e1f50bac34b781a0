package com.ryuqq.redelivery.core.spi;

import com.ryuqq.redelivery.core.model.Message;

import java.util.concurrent.CompletionStage;

/**
 * Broker SPI for settling a received message.
 *
 * <p>Each method settles the message currently locked by this consumer. Settling a
 * message whose lock has been lost (already settled, or visibility timeout expired)
 * must fail the returned stage.</p>
 *
 * <p><strong>Dispositions:</strong></p>
 * <ul>
 *   <li>{@link #complete(Message)} - Remove from the queue</li>
 *   <li>{@link #abandon(Message)} - Release the lock for immediate native redelivery</li>
 *   <li>{@link #defer(Message)} - Set aside until explicitly retrieved</li>
 *   <li>{@link #deadLetter(Message)} - Move to the dead letter queue</li>
 * </ul>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public interface MessageReceiver {

    /**
     * Completes (acknowledges) the message.
     *
     * @param message the received message
     * @return stage completing once the broker has removed the message
     */
    CompletionStage<Void> complete(Message message);

    /**
     * Abandons the message, making it immediately available again.
     *
     * @param message the received message
     * @return stage completing once the lock has been released
     */
    CompletionStage<Void> abandon(Message message);

    /**
     * Defers the message.
     *
     * @param message the received message
     * @return stage completing once the message has been deferred
     */
    CompletionStage<Void> defer(Message message);

    /**
     * Moves the message to the dead letter queue.
     *
     * @param message the received message
     * @return stage completing once the message has been dead-lettered
     */
    CompletionStage<Void> deadLetter(Message message);
}
