package com.ryuqq.redelivery.core.time;

import com.ryuqq.redelivery.core.spi.TimeProvider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 시스템 시계 기반 기본 TimeProvider.
 *
 * <p>{@link #now()}는 주입된 {@link Clock}을, {@link #timestamp()}는
 * {@link System#nanoTime()}을 사용합니다.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class SystemTimeProvider implements TimeProvider {

    private static final SystemTimeProvider INSTANCE = new SystemTimeProvider(Clock.systemUTC());

    private final Clock clock;

    /**
     * 지정된 Clock으로 생성.
     *
     * @param clock wall-clock 소스
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public SystemTimeProvider(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * UTC 시스템 시계 인스턴스 조회.
     *
     * @return 공유 인스턴스
     */
    public static SystemTimeProvider instance() {
        return INSTANCE;
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public long timestamp() {
        return System.nanoTime();
    }

    @Override
    public Duration elapsedSince(long startTimestamp) {
        return Duration.ofNanos(System.nanoTime() - startTimestamp);
    }
}
