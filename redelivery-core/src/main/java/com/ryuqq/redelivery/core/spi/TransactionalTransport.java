package com.ryuqq.redelivery.core.spi;

import com.ryuqq.redelivery.core.model.Message;
import com.ryuqq.redelivery.core.model.ScheduledMessage;

import java.util.concurrent.CompletionStage;

/**
 * Optional broker SPI for the atomic redelivery unit.
 *
 * <p>Implementations complete the original message and enqueue the replacement as a
 * single transaction: both take effect, or neither does. The replacement is submitted
 * through the given sender; implementations that cannot enlist that sender reject the call. When no implementation is
 * configured the redelivery transition falls back to send-then-complete, which may
 * produce a duplicate but never loses the message.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public interface TransactionalTransport {

    /**
     * Completes {@code original} and sends {@code replacement} atomically.
     *
     * @param original the message being redelivered
     * @param receiver the receiver that delivered {@code original}
     * @param sender the sender the replacement must be submitted through
     * @param replacement the scheduled replacement message
     * @return stage completing once both operations are committed; completes
     *         exceptionally if neither was applied
     */
    CompletionStage<Void> completeAndSend(
        Message original,
        MessageReceiver receiver,
        MessageSender sender,
        ScheduledMessage replacement
    );
}
