package com.ryuqq.redelivery.core.strategy;

import com.ryuqq.redelivery.core.context.DeliveryContext;

import java.util.concurrent.CompletionStage;

/**
 * 메시지 처리 콜백 (사용자 비즈니스 로직).
 *
 * <p>콜백이 예외를 던지거나 stage를 예외로 완료하면 결과는 Fail이 됩니다.</p>
 *
 * @param <T> 처리 결과 타입
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProcessingCallback<T> {

    /**
     * 메시지 처리.
     *
     * @param context 처리 컨텍스트
     * @return 처리 결과 stage
     * @throws Exception 처리 실패 시
     */
    CompletionStage<T> process(DeliveryContext context) throws Exception;
}
