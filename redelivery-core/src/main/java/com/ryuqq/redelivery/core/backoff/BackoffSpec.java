package com.ryuqq.redelivery.core.backoff;

import java.time.Duration;
import java.util.Optional;

/**
 * 지연 형태와 기본/최대 지연 시간의 조합 (불변 record).
 *
 * <p>maxDelay는 형태 계산 이후에 적용되는 절대 상한입니다.</p>
 *
 * @param type 지연 형태
 * @param baseDelay 기본 지연 시간 (0 이상)
 * @param maxDelay 최대 지연 시간 (null이면 상한 없음)
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public record BackoffSpec(
    BackoffType type,
    Duration baseDelay,
    Duration maxDelay
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffSpec {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (!DelayPolicy.isValidDelay(baseDelay)) {
            throw new IllegalArgumentException("baseDelay must be non-negative (current: " + baseDelay + ")");
        }
        if (maxDelay != null && maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must be non-negative (current: " + maxDelay + ")");
        }
    }

    /**
     * 상한 없는 BackoffSpec 생성.
     *
     * @param type 지연 형태
     * @param baseDelay 기본 지연 시간
     * @return BackoffSpec 인스턴스
     */
    public static BackoffSpec of(BackoffType type, Duration baseDelay) {
        return new BackoffSpec(type, baseDelay, null);
    }

    /**
     * 최대 지연 시간 조회.
     *
     * @return 최대 지연 시간 (없으면 empty)
     */
    public Optional<Duration> maxDelayIfSet() {
        return Optional.ofNullable(maxDelay);
    }

    /**
     * 주어진 시도 번호의 지연 시간 계산.
     *
     * @param attempt 시도 번호 (0부터 시작)
     * @return 지연 시간
     * @see DelayPolicy#computeDelay(BackoffType, int, Duration, Duration)
     */
    public Duration delayFor(int attempt) {
        return DelayPolicy.computeDelay(type, attempt, baseDelay, maxDelay);
    }
}
