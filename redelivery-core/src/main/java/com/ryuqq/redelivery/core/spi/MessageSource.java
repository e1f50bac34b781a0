package com.ryuqq.redelivery.core.spi;

import com.ryuqq.redelivery.core.model.Message;

import java.util.List;

/**
 * Broker SPI for pulling messages.
 *
 * <p>Received messages are locked (invisible to other consumers) until they are
 * settled through a {@link MessageReceiver} or their visibility timeout expires.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public interface MessageSource {

    /**
     * Receives up to {@code batchSize} visible messages.
     *
     * @param batchSize maximum number of messages to return
     * @return received messages (may be empty)
     * @throws IllegalArgumentException if batchSize is not positive
     */
    List<Message> receive(int batchSize);
}
