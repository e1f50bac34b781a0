package com.ryuqq.redelivery.core.strategy;

import com.ryuqq.redelivery.core.spi.TelemetrySink;
import com.ryuqq.redelivery.core.spi.TimeProvider;
import com.ryuqq.redelivery.core.spi.TransactionalTransport;
import com.ryuqq.redelivery.core.telemetry.LoggingTelemetrySink;
import com.ryuqq.redelivery.core.time.SystemTimeProvider;

import java.util.Optional;

/**
 * 재전달 전략 옵션 (설정 + hook + 협력자).
 *
 * <p>Builder로 생성합니다. 지정하지 않은 항목은 기본값을 사용합니다.</p>
 *
 * <pre>{@code
 * RedeliveryOptions<String> options = RedeliveryOptions.<String>builder()
 *     .config(new RedeliveryConfig().withBackoffType(BackoffType.EXPONENTIAL))
 *     .delayGenerator(args -> CompletableFuture.completedFuture(Optional.empty()))
 *     .build();
 * }</pre>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>config: {@link RedeliveryConfig#RedeliveryConfig()}</li>
 *   <li>shouldHandle: {@link RedeliveryPredicate#handleFailures()}</li>
 *   <li>delayGenerator, onRedeliver, transactionalTransport: 없음</li>
 *   <li>telemetrySink: {@link LoggingTelemetrySink}</li>
 *   <li>timeProvider: {@link SystemTimeProvider#instance()}</li>
 * </ul>
 *
 * @param <T> 처리 결과 타입
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class RedeliveryOptions<T> {

    private final RedeliveryConfig config;
    private final RedeliveryPredicate<T> shouldHandle;
    private final DelayGenerator<T> delayGenerator;
    private final OnRedeliverListener<T> onRedeliver;
    private final TelemetrySink telemetrySink;
    private final TimeProvider timeProvider;
    private final TransactionalTransport transactionalTransport;

    private RedeliveryOptions(Builder<T> builder) {
        if (builder.config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (builder.shouldHandle == null) {
            throw new IllegalArgumentException("shouldHandle cannot be null");
        }
        if (builder.telemetrySink == null) {
            throw new IllegalArgumentException("telemetrySink cannot be null");
        }
        if (builder.timeProvider == null) {
            throw new IllegalArgumentException("timeProvider cannot be null");
        }
        this.config = builder.config;
        this.shouldHandle = builder.shouldHandle;
        this.delayGenerator = builder.delayGenerator;
        this.onRedeliver = builder.onRedeliver;
        this.telemetrySink = builder.telemetrySink;
        this.timeProvider = builder.timeProvider;
        this.transactionalTransport = builder.transactionalTransport;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * 모든 항목이 기본값인 옵션 생성.
     *
     * @param <T> 처리 결과 타입
     * @return RedeliveryOptions 인스턴스
     */
    public static <T> RedeliveryOptions<T> defaults() {
        return new Builder<T>().build();
    }

    public RedeliveryConfig config() {
        return config;
    }

    public RedeliveryPredicate<T> shouldHandle() {
        return shouldHandle;
    }

    public Optional<DelayGenerator<T>> delayGenerator() {
        return Optional.ofNullable(delayGenerator);
    }

    public Optional<OnRedeliverListener<T>> onRedeliver() {
        return Optional.ofNullable(onRedeliver);
    }

    public TelemetrySink telemetrySink() {
        return telemetrySink;
    }

    public TimeProvider timeProvider() {
        return timeProvider;
    }

    public Optional<TransactionalTransport> transactionalTransport() {
        return Optional.ofNullable(transactionalTransport);
    }

    /**
     * RedeliveryOptions Builder.
     *
     * @param <T> 처리 결과 타입
     */
    public static final class Builder<T> {
        private RedeliveryConfig config = new RedeliveryConfig();
        private RedeliveryPredicate<T> shouldHandle = RedeliveryPredicate.handleFailures();
        private DelayGenerator<T> delayGenerator;
        private OnRedeliverListener<T> onRedeliver;
        private TelemetrySink telemetrySink = new LoggingTelemetrySink();
        private TimeProvider timeProvider = SystemTimeProvider.instance();
        private TransactionalTransport transactionalTransport;

        private Builder() {
        }

        public Builder<T> config(RedeliveryConfig config) {
            this.config = config;
            return this;
        }

        public Builder<T> shouldHandle(RedeliveryPredicate<T> shouldHandle) {
            this.shouldHandle = shouldHandle;
            return this;
        }

        /**
         * 기본 지연 시간 대체 hook 설정 (null이면 해제).
         */
        public Builder<T> delayGenerator(DelayGenerator<T> delayGenerator) {
            this.delayGenerator = delayGenerator;
            return this;
        }

        /**
         * 재전달 알림 hook 설정 (null이면 해제).
         */
        public Builder<T> onRedeliver(OnRedeliverListener<T> onRedeliver) {
            this.onRedeliver = onRedeliver;
            return this;
        }

        public Builder<T> telemetrySink(TelemetrySink telemetrySink) {
            this.telemetrySink = telemetrySink;
            return this;
        }

        public Builder<T> timeProvider(TimeProvider timeProvider) {
            this.timeProvider = timeProvider;
            return this;
        }

        /**
         * 원자적 완료+전송 설정 (null이면 send-then-complete).
         */
        public Builder<T> transactionalTransport(TransactionalTransport transactionalTransport) {
            this.transactionalTransport = transactionalTransport;
            return this;
        }

        /**
         * RedeliveryOptions 생성.
         *
         * @return RedeliveryOptions 인스턴스
         * @throws IllegalArgumentException 필수 항목이 null인 경우
         */
        public RedeliveryOptions<T> build() {
            return new RedeliveryOptions<>(this);
        }
    }
}
