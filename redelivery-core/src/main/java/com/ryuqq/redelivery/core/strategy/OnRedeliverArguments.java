package com.ryuqq.redelivery.core.strategy;

import com.ryuqq.redelivery.core.context.DeliveryContext;
import com.ryuqq.redelivery.core.outcome.Outcome;

import java.time.Duration;

/**
 * {@link OnRedeliverListener} 인자 ({@code OnRedeliver} 텔레메트리 인자로도 사용).
 *
 * @param context 처리 컨텍스트
 * @param outcome 처리 결과
 * @param attemptNumber 현재 시도 번호
 * @param redeliveryDelay 적용될 재전달 지연 시간
 * @param duration 콜백 실행 및 predicate 평가에 걸린 시간
 * @param <T> 처리 결과 타입
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public record OnRedeliverArguments<T>(
    DeliveryContext context,
    Outcome<T> outcome,
    int attemptNumber,
    Duration redeliveryDelay,
    Duration duration
) {

    @Override
    public String toString() {
        return "OnRedeliverArguments[attemptNumber=" + attemptNumber
            + ", redeliveryDelay=" + redeliveryDelay
            + ", duration=" + duration + "]";
    }
}
