package com.ryuqq.redelivery.core.support;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Callable;

/**
 * CompletionStage 보조 유틸리티.
 *
 * <p>외부 협력자(브로커, 사용자 hook)는 stage를 반환하기 전에 동기적으로 예외를 던지거나
 * null을 반환할 수 있습니다. {@link #safely(Callable)}은 이런 경우를 모두
 * 예외로 완료된 stage로 통일합니다.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class Stages {

    // Utility class - prevent instantiation
    private Stages() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * stage를 반환하는 호출을 안전하게 실행.
     *
     * @param call stage를 반환하는 호출
     * @param <T> 결과 타입
     * @return 호출이 반환한 stage, 동기 예외 또는 null 반환 시 예외로 완료된 stage
     */
    public static <T> CompletionStage<T> safely(Callable<? extends CompletionStage<T>> call) {
        try {
            CompletionStage<T> stage = call.call();
            if (stage == null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Asynchronous call returned a null CompletionStage"));
            }
            return stage;
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * 이미 완료된 Void stage.
     *
     * @return 정상 완료된 stage
     */
    public static CompletionStage<Void> done() {
        return CompletableFuture.completedFuture(null);
    }
}
