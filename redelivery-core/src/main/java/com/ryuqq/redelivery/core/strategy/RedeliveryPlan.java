package com.ryuqq.redelivery.core.strategy;

import java.time.Duration;

/**
 * 재전달 결정 결과 (일시적, 불변 record).
 *
 * @param delay 재전달 지연 시간 (0 이상)
 * @param nextAttemptNumber 대체 메시지에 기록할 시도 번호 (0 이상)
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public record RedeliveryPlan(
    Duration delay,
    int nextAttemptNumber
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException delay가 null/음수이거나 nextAttemptNumber가 음수인 경우
     */
    public RedeliveryPlan {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative (current: " + delay + ")");
        }
        if (nextAttemptNumber < 0) {
            throw new IllegalArgumentException(
                "nextAttemptNumber must be non-negative (current: " + nextAttemptNumber + ")"
            );
        }
    }
}
