package com.ryuqq.redelivery.core.outcome;

/**
 * 실패 결과.
 *
 * <p>처리 콜백이 예외를 던졌거나, 종료 처리/재전달 전환 중 브로커 호출이 실패했음을 나타냅니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>비즈니스 처리 중 발생한 예외 (재전달 대상 여부는 predicate가 결정)</li>
 *   <li>DeadLetter 이동 실패 (브로커 연결 끊김 등)</li>
 *   <li>재전달 메시지 전송 실패</li>
 * </ul>
 *
 * @param exception 실패 원인
 * @param <T> 값 타입
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public record Fail<T>(Throwable exception) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException exception이 null인 경우
     */
    public Fail {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
    }

    /**
     * Fail 생성.
     *
     * @param exception 실패 원인
     * @param <T> 값 타입
     * @return Fail 인스턴스
     */
    public static <T> Fail<T> of(Throwable exception) {
        return new Fail<>(exception);
    }
}
