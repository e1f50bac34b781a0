package com.ryuqq.redelivery.core.telemetry;

import com.ryuqq.redelivery.core.context.DeliveryContext;
import com.ryuqq.redelivery.core.outcome.Outcome;

/**
 * 코디네이터가 텔레메트리 sink로 보고하는 이벤트 (불변 record).
 *
 * <p><strong>이벤트 종류:</strong></p>
 * <ul>
 *   <li>{@code ExecutionAttempt}: 매 처리 시도마다 1회, arguments는 {@link ExecutionAttemptArguments}</li>
 *   <li>{@code OnRedeliver}: 재전달 예약 직전 1회, arguments는 재전달 알림 인자</li>
 * </ul>
 *
 * @param strategyName 전략 이름 (설정값)
 * @param eventName 이벤트 이름
 * @param severity 심각도
 * @param context 처리 컨텍스트
 * @param outcome 처리 결과
 * @param arguments 이벤트별 인자
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public record RedeliveryEvent(
    String strategyName,
    String eventName,
    EventSeverity severity,
    DeliveryContext context,
    Outcome<?> outcome,
    Object arguments
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public RedeliveryEvent {
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
    }
}
