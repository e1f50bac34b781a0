package com.ryuqq.redelivery.core.strategy;

import com.ryuqq.redelivery.core.context.DeliveryContext;
import com.ryuqq.redelivery.core.outcome.Outcome;

/**
 * {@link RedeliveryPredicate} 인자.
 *
 * @param context 처리 컨텍스트
 * @param outcome 처리 결과
 * @param attemptNumber 현재 시도 번호
 * @param <T> 처리 결과 타입
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public record RedeliverPredicateArguments<T>(
    DeliveryContext context,
    Outcome<T> outcome,
    int attemptNumber
) {
}
