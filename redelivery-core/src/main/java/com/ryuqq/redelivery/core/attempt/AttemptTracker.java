package com.ryuqq.redelivery.core.attempt;

import com.ryuqq.redelivery.core.model.Message;

/**
 * 메시지 메타데이터의 시도 번호 읽기/쓰기 및 종료 판단.
 *
 * <p>애플리케이션 속성 맵({@code Map<String, Object>})에 접근하는 유일한 지점입니다.
 * 나머지 코드는 타입이 있는 int 시도 번호만 다룹니다.</p>
 *
 * <p><strong>Unbounded sentinel:</strong> 시도 번호가 {@link #UNBOUNDED_ATTEMPTS}이면
 * 종료로 판단하지 않고, 증가시키지도 않습니다 (int 오버플로 방지).</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class AttemptTracker {

    /**
     * 시도 번호가 저장되는 애플리케이션 속성 키.
     */
    public static final String ATTEMPT_NUMBER_KEY = "AttemptNumber";

    /**
     * "무한 재전달"을 뜻하는 시도 번호.
     */
    public static final int UNBOUNDED_ATTEMPTS = Integer.MAX_VALUE;

    // Utility class - prevent instantiation
    private AttemptTracker() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 메시지의 현재 시도 번호 조회.
     *
     * <p>속성이 없거나, Integer가 아니거나, 음수이면 0을 반환합니다.</p>
     *
     * @param message 수신 메시지
     * @return 시도 번호 (0 이상)
     * @throws IllegalArgumentException message가 null인 경우
     */
    public static int currentAttempt(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        Object value = message.applicationProperties().get(ATTEMPT_NUMBER_KEY);
        if (value instanceof Integer attempt && attempt >= 0) {
            return attempt;
        }
        return 0;
    }

    /**
     * 시도 번호와 최대 재전달 횟수로 종료 여부 판단.
     *
     * @param attempt 현재 시도 번호
     * @param maxAttempts 최대 재전달 횟수
     * @return 판단 결과
     */
    public static AttemptState evaluate(int attempt, int maxAttempts) {
        if (attempt == UNBOUNDED_ATTEMPTS) {
            return new AttemptState(attempt, false, false);
        }
        return new AttemptState(attempt, attempt >= maxAttempts, true);
    }

    /**
     * 시도 번호를 기록한 새 메시지 생성.
     *
     * @param message 원본 메시지 (변경되지 않음)
     * @param attemptNumber 기록할 시도 번호
     * @return 파생된 메시지
     * @throws IllegalArgumentException message가 null이거나 attemptNumber가 음수인 경우
     */
    public static Message withAttempt(Message message, int attemptNumber) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (attemptNumber < 0) {
            throw new IllegalArgumentException("attemptNumber must be non-negative (current: " + attemptNumber + ")");
        }
        return message.withProperty(ATTEMPT_NUMBER_KEY, attemptNumber);
    }
}
