package com.ryuqq.redelivery.core.strategy;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * 계산된 기본 지연 시간을 대체하는 hook.
 *
 * <p>empty, null, 음수 값을 반환하면 기본 지연 시간이 그대로 사용됩니다.</p>
 *
 * @param <T> 처리 결과 타입
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DelayGenerator<T> {

    /**
     * 재전달 지연 시간 생성.
     *
     * @param arguments 생성 인자
     * @return 대체 지연 시간 (없으면 empty)
     */
    CompletionStage<Optional<Duration>> generate(DelayGeneratorArguments<T> arguments);
}
