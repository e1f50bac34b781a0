package com.ryuqq.redelivery.core.outcome;

import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 메시지 처리 시도의 결과.
 *
 * <p>Outcome은 정확히 두 가지 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Ok}: 처리 콜백이 값을 반환함</li>
 *   <li>{@link Fail}: 처리 콜백 또는 브로커 작업이 예외로 실패함</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 다른 구현체가 존재할 수 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome&lt;String&gt; outcome = Outcome.of(value, error);
 * if (outcome.isFail()) {
 *     Throwable cause = outcome.failureCause().orElseThrow();
 * }
 * </pre>
 *
 * @param <T> 성공 값 타입
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail {

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값 (null 허용)
     * @param <T> 값 타입
     * @return Ok 인스턴스
     */
    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param exception 실패 원인
     * @param <T> 값 타입
     * @return Fail 인스턴스
     * @throws IllegalArgumentException exception이 null인 경우
     */
    static <T> Outcome<T> fail(Throwable exception) {
        return new Fail<>(exception);
    }

    /**
     * 비동기 완료 결과(value, error)를 Outcome으로 변환.
     *
     * <p>{@link CompletionException}, {@link ExecutionException} 래퍼는 벗겨내고
     * 실제 원인을 Fail에 담습니다.</p>
     *
     * @param value 완료 값
     * @param error 완료 예외 (정상 완료 시 null)
     * @param <T> 값 타입
     * @return error가 null이면 Ok, 아니면 Fail
     */
    static <T> Outcome<T> of(T value, Throwable error) {
        if (error == null) {
            return new Ok<>(value);
        }
        return new Fail<>(unwrap(error));
    }

    /**
     * 비동기 래퍼 예외를 벗겨낸 실제 원인 조회.
     *
     * @param error 예외
     * @return 래퍼가 아닌 가장 안쪽 원인
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }

    /**
     * 실패 원인 조회.
     *
     * @return Fail이면 원인, Ok이면 empty
     */
    default Optional<Throwable> failureCause() {
        if (this instanceof Fail<T> fail) {
            return Optional.of(fail.exception());
        }
        return Optional.empty();
    }

    /**
     * 성공 값 조회.
     *
     * @return Ok이면 값 (null 가능), Fail이면 empty
     */
    default Optional<T> successValue() {
        if (this instanceof Ok<T> ok) {
            return Optional.ofNullable(ok.value());
        }
        return Optional.empty();
    }
}
