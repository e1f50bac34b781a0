package com.ryuqq.redelivery.core.outcome;

/**
 * 성공 결과.
 *
 * <p>처리 콜백이 정상적으로 값을 반환했음을 나타냅니다.
 * 브로커 작업의 성공은 {@code Ok<Void>}(값 null)로 표현합니다.</p>
 *
 * @param value 성공 값 (null 허용)
 * @param <T> 값 타입
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    /**
     * 값 없는 성공 결과 생성.
     *
     * @return Ok 인스턴스
     */
    public static Ok<Void> empty() {
        return new Ok<>(null);
    }
}
