package com.ryuqq.redelivery.core.model;

import java.time.Instant;

/**
 * 지정된 시각 이후에 소비자에게 보이도록 예약된 메시지.
 *
 * <p>재전달 대체 메시지는 항상 ScheduledMessage 형태로 sender에 전달됩니다.</p>
 *
 * @param message 전송할 메시지
 * @param scheduledEnqueueTime 메시지가 큐에 보이기 시작하는 시각
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public record ScheduledMessage(
    Message message,
    Instant scheduledEnqueueTime
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message 또는 scheduledEnqueueTime이 null인 경우
     */
    public ScheduledMessage {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (scheduledEnqueueTime == null) {
            throw new IllegalArgumentException("scheduledEnqueueTime cannot be null");
        }
    }

    /**
     * 메시지 ID 조회 (편의 메서드).
     *
     * @return 메시지 ID
     */
    public MessageId messageId() {
        return message.messageId();
    }
}
