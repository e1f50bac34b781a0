package com.ryuqq.redelivery.core.telemetry;

import java.time.Duration;

/**
 * {@code ExecutionAttempt} 이벤트 인자.
 *
 * @param attemptNumber 처리한 메시지의 시도 번호
 * @param duration 콜백 실행 및 predicate 평가에 걸린 시간
 * @param handled predicate가 재전달 대상으로 판단했는지 여부
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public record ExecutionAttemptArguments(
    int attemptNumber,
    Duration duration,
    boolean handled
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException duration이 null인 경우
     */
    public ExecutionAttemptArguments {
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
    }
}
