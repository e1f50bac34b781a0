package com.ryuqq.redelivery.core.strategy;

import com.ryuqq.redelivery.core.backoff.BackoffSpec;
import com.ryuqq.redelivery.core.backoff.BackoffType;
import com.ryuqq.redelivery.core.model.MessageAction;

import java.time.Duration;

/**
 * 재전달 전략 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: 텔레메트리에 사용할 전략 이름 (기본 "RedeliverMessage")</li>
 *   <li>backoffType: 지연 증가 형태 (기본 CONSTANT)</li>
 *   <li>baseDelay: 기본 지연 시간 (기본 30초)</li>
 *   <li>maxDelay: 최대 지연 시간 (기본 없음)</li>
 *   <li>maxRedeliveryAttempts: 최대 재전달 횟수 (기본 5)</li>
 *   <li>lastAttemptFailedAction: 한도 소진 시 처리 (기본 DEAD_LETTER)</li>
 * </ul>
 *
 * <p><strong>유효 범위:</strong> 지연 시간은 0 ~ 7일, 재전달 횟수는 1 ~ Integer.MAX_VALUE.
 * maxRedeliveryAttempts가 Integer.MAX_VALUE이면 사실상 무한 재전달입니다.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 * @param name 전략 이름 (공백 불가)
 * @param backoffType 지연 증가 형태
 * @param baseDelay 기본 지연 시간
 * @param maxDelay 최대 지연 시간 (null이면 상한 없음)
 * @param maxRedeliveryAttempts 최대 재전달 횟수
 * @param lastAttemptFailedAction 한도 소진 시 처리
 */
public record RedeliveryConfig(
    String name,
    BackoffType backoffType,
    Duration baseDelay,
    Duration maxDelay,
    int maxRedeliveryAttempts,
    MessageAction lastAttemptFailedAction
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: name="RedeliverMessage", backoffType=CONSTANT, baseDelay=30s,
     * maxDelay=없음, maxRedeliveryAttempts=5, lastAttemptFailedAction=DEAD_LETTER</p>
     */
    public RedeliveryConfig() {
        this(
            RedeliveryConstants.DEFAULT_NAME,
            RedeliveryConstants.DEFAULT_BACKOFF_TYPE,
            RedeliveryConstants.DEFAULT_BASE_DELAY,
            null,
            RedeliveryConstants.DEFAULT_REDELIVERY_ATTEMPTS,
            RedeliveryConstants.DEFAULT_LAST_ATTEMPT_FAILED_ACTION
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RedeliveryConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (backoffType == null) {
            throw new IllegalArgumentException("backoffType cannot be null");
        }
        requireConfigurableDelay("baseDelay", baseDelay);
        if (maxDelay != null) {
            requireConfigurableDelay("maxDelay", maxDelay);
        }
        if (maxRedeliveryAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxRedeliveryAttempts must be positive (current: " + maxRedeliveryAttempts + ")"
            );
        }
        if (lastAttemptFailedAction == null) {
            throw new IllegalArgumentException("lastAttemptFailedAction cannot be null");
        }
    }

    private static void requireConfigurableDelay(String field, Duration delay) {
        if (delay == null) {
            throw new IllegalArgumentException(field + " cannot be null");
        }
        if (delay.isNegative() || delay.compareTo(RedeliveryConstants.MAX_CONFIGURABLE_DELAY) > 0) {
            throw new IllegalArgumentException(
                field + " must be between 0 and " + RedeliveryConstants.MAX_CONFIGURABLE_DELAY
                    + " (current: " + delay + ")"
            );
        }
    }

    /**
     * 지연 계산용 BackoffSpec 조회.
     *
     * @return BackoffSpec 인스턴스
     */
    public BackoffSpec backoffSpec() {
        return new BackoffSpec(backoffType, baseDelay, maxDelay);
    }

    /**
     * name만 변경한 새 인스턴스 생성.
     */
    public RedeliveryConfig withName(String name) {
        return new RedeliveryConfig(name, backoffType, baseDelay, maxDelay, maxRedeliveryAttempts, lastAttemptFailedAction);
    }

    /**
     * backoffType만 변경한 새 인스턴스 생성.
     */
    public RedeliveryConfig withBackoffType(BackoffType backoffType) {
        return new RedeliveryConfig(name, backoffType, baseDelay, maxDelay, maxRedeliveryAttempts, lastAttemptFailedAction);
    }

    /**
     * baseDelay만 변경한 새 인스턴스 생성.
     */
    public RedeliveryConfig withBaseDelay(Duration baseDelay) {
        return new RedeliveryConfig(name, backoffType, baseDelay, maxDelay, maxRedeliveryAttempts, lastAttemptFailedAction);
    }

    /**
     * maxDelay만 변경한 새 인스턴스 생성 (null이면 상한 제거).
     */
    public RedeliveryConfig withMaxDelay(Duration maxDelay) {
        return new RedeliveryConfig(name, backoffType, baseDelay, maxDelay, maxRedeliveryAttempts, lastAttemptFailedAction);
    }

    /**
     * maxRedeliveryAttempts만 변경한 새 인스턴스 생성.
     */
    public RedeliveryConfig withMaxRedeliveryAttempts(int maxRedeliveryAttempts) {
        return new RedeliveryConfig(name, backoffType, baseDelay, maxDelay, maxRedeliveryAttempts, lastAttemptFailedAction);
    }

    /**
     * lastAttemptFailedAction만 변경한 새 인스턴스 생성.
     */
    public RedeliveryConfig withLastAttemptFailedAction(MessageAction lastAttemptFailedAction) {
        return new RedeliveryConfig(name, backoffType, baseDelay, maxDelay, maxRedeliveryAttempts, lastAttemptFailedAction);
    }
}
