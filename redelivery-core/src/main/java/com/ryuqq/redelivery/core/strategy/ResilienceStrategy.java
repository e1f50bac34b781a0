package com.ryuqq.redelivery.core.strategy;

import com.ryuqq.redelivery.core.context.DeliveryContext;
import com.ryuqq.redelivery.core.outcome.Outcome;

import java.util.concurrent.CompletionStage;

/**
 * 처리 콜백을 감싸 실행하는 전략.
 *
 * <p>구현체는 호출 간 상태를 갖지 않아야 하며, 여러 메시지에 대해 동시에 호출될 수 있습니다.</p>
 *
 * @param <T> 처리 결과 타입
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public interface ResilienceStrategy<T> {

    /**
     * 콜백을 실행하고 전략을 적용한 결과를 반환.
     *
     * @param context 처리 컨텍스트
     * @param callback 처리 콜백
     * @return 결과 stage. 사용자 hook 실패 시 예외로 완료됨
     */
    CompletionStage<Outcome<T>> execute(DeliveryContext context, ProcessingCallback<T> callback);
}
