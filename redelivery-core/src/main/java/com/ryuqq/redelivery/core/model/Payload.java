package com.ryuqq.redelivery.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 메시지 본문 (불투명 바이트 배열).
 *
 * <p>Payload의 직렬화 형식(JSON, Avro, Protobuf 등)은 코어가 해석하지 않습니다.
 * 재전달 메시지는 원본과 동일한 Payload를 그대로 운반합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>문자열: Payload.of("{\"orderId\":123}")</li>
 *   <li>바이트: Payload.of(bytes)</li>
 *   <li>빈 Payload: Payload.empty()</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 시와 조회 시 모두 방어적 복사를 수행합니다.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(new byte[0]);

    private final byte[] value;

    private Payload(byte[] value) {
        this.value = value;
    }

    /**
     * 바이트 배열로 Payload 생성.
     *
     * @param bytes 본문 바이트 (null이면 빈 Payload)
     * @return Payload 인스턴스
     */
    public static Payload of(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new Payload(Arrays.copyOf(bytes, bytes.length));
    }

    /**
     * UTF-8 문자열로 Payload 생성.
     *
     * @param text 본문 문자열 (null이면 빈 Payload)
     * @return Payload 인스턴스
     */
    public static Payload of(String text) {
        if (text == null) {
            return EMPTY;
        }
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 빈 Payload 조회.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * 본문 바이트 복사본 조회.
     *
     * @return 본문 바이트 (복사본)
     */
    public byte[] toBytes() {
        return Arrays.copyOf(value, value.length);
    }

    /**
     * 본문을 UTF-8 문자열로 조회.
     *
     * @return 본문 문자열
     */
    public String asString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    /**
     * 본문 길이 조회.
     *
     * @return 바이트 수
     */
    public int size() {
        return value.length;
    }

    /**
     * Payload가 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return value.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return Arrays.equals(value, payload.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "Payload{" + value.length + " bytes}";
    }
}
