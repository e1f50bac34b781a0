package com.ryuqq.redelivery.core.strategy;

import com.ryuqq.redelivery.core.backoff.BackoffType;
import com.ryuqq.redelivery.core.model.MessageAction;

import java.time.Duration;

/**
 * 재전달 전략 기본값 및 한계값.
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class RedeliveryConstants {

    /**
     * 기본 전략 이름 (텔레메트리에 사용).
     */
    public static final String DEFAULT_NAME = "RedeliverMessage";

    /**
     * 매 처리 시도마다 보고되는 이벤트 이름.
     */
    public static final String EXECUTION_ATTEMPT_EVENT = "ExecutionAttempt";

    /**
     * 재전달 예약 직전에 보고되는 이벤트 이름.
     */
    public static final String ON_REDELIVER_EVENT = "OnRedeliver";

    public static final BackoffType DEFAULT_BACKOFF_TYPE = BackoffType.CONSTANT;

    public static final MessageAction DEFAULT_LAST_ATTEMPT_FAILED_ACTION = MessageAction.DEAD_LETTER;

    public static final int DEFAULT_REDELIVERY_ATTEMPTS = 5;

    public static final int MAX_REDELIVERY_ATTEMPTS = Integer.MAX_VALUE;

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(30);

    /**
     * 설정 가능한 최대 지연 시간 (baseDelay, maxDelay 공통).
     */
    public static final Duration MAX_CONFIGURABLE_DELAY = Duration.ofDays(7);

    // Utility class - prevent instantiation
    private RedeliveryConstants() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
