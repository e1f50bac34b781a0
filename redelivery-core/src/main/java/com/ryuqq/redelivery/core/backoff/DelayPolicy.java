package com.ryuqq.redelivery.core.backoff;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 재전달 지연 시간 계산기.
 *
 * <p>상태와 I/O가 없는 순수 함수만 제공합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * baseDelay == 0      → 0 (형태와 무관)
 * CONSTANT            → baseDelay
 * LINEAR              → baseDelay * (attempt + 1)
 * EXPONENTIAL         → baseDelay * 2^attempt
 * 결과 &gt; maxDelay     → maxDelay
 * Duration 범위 초과   → maxDelay (설정 시) 또는 {@link #MAX_DELAY}
 * </pre>
 *
 * <p>오버플로는 오류가 아닙니다. "가능한 한 오래 대기"로 완만하게 저하됩니다.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class DelayPolicy {

    /**
     * 표현 가능한 최대 지연 시간.
     */
    public static final Duration MAX_DELAY = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999L);

    /**
     * 이 지수를 넘으면 1ns 기준으로도 Duration 범위를 초과합니다 (2^93ns &gt; Long.MAX_VALUE초).
     */
    private static final int MAX_EXPONENT = 93;

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    // Utility class - prevent instantiation
    private DelayPolicy() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 재전달 지연 시간 계산.
     *
     * @param type 지연 형태
     * @param attempt 현재 시도 번호 (0부터 시작)
     * @param baseDelay 기본 지연 시간 (0 이상)
     * @param maxDelay 최대 지연 시간 (null이면 상한 없음)
     * @return 계산된 지연 시간 (maxDelay 이하)
     * @throws IllegalArgumentException attempt가 음수이거나, baseDelay/maxDelay가 유효하지 않거나,
     *                                  지원하지 않는 type인 경우
     */
    public static Duration computeDelay(BackoffType type, int attempt, Duration baseDelay, Duration maxDelay) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be non-negative (current: " + attempt + ")");
        }
        if (!isValidDelay(baseDelay)) {
            throw new IllegalArgumentException("baseDelay must be non-negative (current: " + baseDelay + ")");
        }
        if (maxDelay != null && maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must be non-negative (current: " + maxDelay + ")");
        }

        try {
            Duration delay = computeUncapped(type, attempt, baseDelay);
            if (maxDelay != null && delay.compareTo(maxDelay) > 0) {
                return maxDelay;
            }
            return delay;
        } catch (ArithmeticException overflow) {
            return maxDelay != null ? maxDelay : MAX_DELAY;
        }
    }

    /**
     * 지연 시간이 유효한지 확인.
     *
     * <p>delay override hook이 반환한 값을 신뢰하기 전에 사용합니다.</p>
     *
     * @param delay 검사할 지연 시간
     * @return null이 아니고 0 이상이면 true
     */
    public static boolean isValidDelay(Duration delay) {
        return delay != null && !delay.isNegative();
    }

    private static Duration computeUncapped(BackoffType type, int attempt, Duration baseDelay) {
        if (baseDelay.isZero()) {
            return Duration.ZERO;
        }
        if (type == null) {
            throw new IllegalArgumentException("The redelivery backoff type is not supported: null");
        }

        return switch (type) {
            case CONSTANT -> baseDelay;
            case LINEAR -> multiply(baseDelay, BigInteger.valueOf(attempt).add(BigInteger.ONE));
            case EXPONENTIAL -> {
                if (attempt > MAX_EXPONENT) {
                    throw new ArithmeticException("Exponential backoff overflow (attempt: " + attempt + ")");
                }
                yield multiply(baseDelay, BigInteger.ONE.shiftLeft(attempt));
            }
        };
    }

    /**
     * Duration × factor. 결과가 Duration 범위를 넘으면 ArithmeticException.
     */
    private static Duration multiply(Duration duration, BigInteger factor) {
        BigInteger nanos = BigInteger.valueOf(duration.getSeconds())
            .multiply(NANOS_PER_SECOND)
            .add(BigInteger.valueOf(duration.getNano()))
            .multiply(factor);
        BigInteger[] secondsAndNanos = nanos.divideAndRemainder(NANOS_PER_SECOND);
        return Duration.ofSeconds(secondsAndNanos[0].longValueExact(), secondsAndNanos[1].longValue());
    }
}
