package com.ryuqq.redelivery.core.attempt;

/**
 * 한 번의 처리 시도에 대한 재전달 판단 결과 (불변 record).
 *
 * <p>매 호출마다 새로 계산되며 캐시되지 않습니다.</p>
 *
 * @param attemptNumber 현재 시도 번호 (0 이상)
 * @param terminal 재전달 한도에 도달했는지 여부
 * @param shouldIncrement 재전달 시 시도 번호를 증가시킬지 여부
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public record AttemptState(
    int attemptNumber,
    boolean terminal,
    boolean shouldIncrement
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException attemptNumber가 음수인 경우
     */
    public AttemptState {
        if (attemptNumber < 0) {
            throw new IllegalArgumentException("attemptNumber must be non-negative (current: " + attemptNumber + ")");
        }
    }

    /**
     * 대체 메시지에 기록할 시도 번호.
     *
     * @return shouldIncrement면 attemptNumber + 1, 아니면 attemptNumber
     */
    public int nextAttemptNumber() {
        return shouldIncrement ? attemptNumber + 1 : attemptNumber;
    }
}
