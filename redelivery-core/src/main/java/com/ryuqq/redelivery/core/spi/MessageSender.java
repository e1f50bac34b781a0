package com.ryuqq.redelivery.core.spi;

import com.ryuqq.redelivery.core.model.ScheduledMessage;

import java.util.concurrent.CompletionStage;

/**
 * Broker SPI for enqueuing scheduled messages.
 *
 * <p>The redelivery transition uses this interface to publish the replacement
 * message that carries the incremented attempt number.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: may be called concurrently for different messages</li>
 *   <li>Scheduled visibility: the message must not be delivered before
 *       {@link ScheduledMessage#scheduledEnqueueTime()}</li>
 *   <li>Failures are reported by completing the returned stage exceptionally</li>
 * </ul>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public interface MessageSender {

    /**
     * Enqueues a message that becomes visible at its scheduled enqueue time.
     *
     * @param message the scheduled message
     * @return stage completing once the broker has accepted the message
     */
    CompletionStage<Void> send(ScheduledMessage message);
}
