package com.ryuqq.redelivery.core.statemachine;

/**
 * 메시지 한 건을 처리하는 동안 코디네이터가 거치는 단계.
 *
 * <p><strong>단계 전이 다이어그램:</strong></p>
 * <pre>
 * EXECUTING
 *    │
 *    ▼ (콜백 완료)
 * EVALUATING
 *    │
 *    ├─► DONE (재전달 대상 아님 / 취소)
 *    │
 *    ├─► TERMINAL (재전달 한도 소진) ─► DONE
 *    │
 *    └─► SCHEDULING (재전달 예약) ─► DONE
 *
 * 금지된 전이:
 * - DONE → * ❌
 * - TERMINAL ↔ SCHEDULING ❌
 * - 역방향 전이 ❌
 * </pre>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public enum RedeliveryPhase {

    /**
     * 처리 콜백 실행 중.
     */
    EXECUTING,

    /**
     * predicate 평가 및 종료 판단 중.
     */
    EVALUATING,

    /**
     * 종료 처리(MessageAction) 실행 중.
     */
    TERMINAL,

    /**
     * 지연 계산, 알림, 재전달 전환 실행 중.
     */
    SCHEDULING,

    /**
     * 처리 종료.
     */
    DONE;

    /**
     * 종료 단계인지 확인.
     *
     * @return DONE인 경우 true
     */
    public boolean isTerminal() {
        return this == DONE;
    }
}
