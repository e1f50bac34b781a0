package com.ryuqq.redelivery.core.strategy;

import java.util.concurrent.CompletionStage;

/**
 * 재전달 전환 직전에 한 번 호출되는 알림 hook.
 *
 * <p>코디네이터는 반환된 stage가 완료될 때까지 기다린 뒤 전환을 수행합니다.</p>
 *
 * @param <T> 처리 결과 타입
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OnRedeliverListener<T> {

    /**
     * 재전달 알림.
     *
     * @param arguments 알림 인자
     * @return 완료 stage
     */
    CompletionStage<Void> onRedeliver(OnRedeliverArguments<T> arguments);
}
