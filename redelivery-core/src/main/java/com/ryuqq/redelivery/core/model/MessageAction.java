package com.ryuqq.redelivery.core.model;

/**
 * 재전달 시도가 모두 소진되었을 때 메시지에 적용할 최종 처리.
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public enum MessageAction {

    /**
     * 정상 완료 처리 (큐에서 제거).
     */
    COMPLETE,

    /**
     * 잠금 해제 (브로커 기본 재전달 메커니즘으로 즉시 재전달).
     */
    ABANDON,

    /**
     * 보류 (명시적으로 다시 조회할 때까지 보관).
     */
    DEFER,

    /**
     * Dead Letter Queue로 이동.
     */
    DEAD_LETTER
}
