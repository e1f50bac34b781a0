package com.ryuqq.redelivery.core.strategy;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 처리 결과가 재전달 대상인지 판단하는 hook.
 *
 * <p>stage가 예외로 완료되면 그 예외는 호출자에게 전파됩니다.
 * null 결과는 false로 취급합니다.</p>
 *
 * @param <T> 처리 결과 타입
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RedeliveryPredicate<T> {

    /**
     * 재전달 대상 여부 판단.
     *
     * @param arguments 판단 인자
     * @return true면 재전달(또는 종료 처리) 대상
     */
    CompletionStage<Boolean> shouldHandle(RedeliverPredicateArguments<T> arguments);

    /**
     * 기본 predicate: 취소가 아닌 모든 실패를 재전달 대상으로 판단.
     *
     * @param <T> 처리 결과 타입
     * @return 기본 predicate
     */
    static <T> RedeliveryPredicate<T> handleFailures() {
        return arguments -> CompletableFuture.completedFuture(
            arguments.outcome().failureCause()
                .map(e -> !(e instanceof CancellationException))
                .orElse(false)
        );
    }
}
