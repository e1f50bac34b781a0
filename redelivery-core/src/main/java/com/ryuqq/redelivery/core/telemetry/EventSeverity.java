package com.ryuqq.redelivery.core.telemetry;

/**
 * 텔레메트리 이벤트 심각도.
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public enum EventSeverity {

    /**
     * 정상 흐름 (처리 성공 또는 재전달 대상 아님).
     */
    INFORMATION,

    /**
     * 재전달 대상 실패 또는 재전달 예약.
     */
    WARNING
}
