package com.ryuqq.redelivery.core.model;

import java.util.UUID;

/**
 * 브로커 메시지의 고유 식별자.
 *
 * <p>재전달 시 새로 만들어지는 메시지도 원본과 동일한 MessageId를 유지하므로,
 * 소비자는 이 값으로 중복 전달을 식별할 수 있습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자 (대부분의 브로커가 허용하는 최대 길이)</li>
 * </ul>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class MessageId {

    private static final int MAX_LENGTH = 128;

    private final String value;

    private MessageId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MessageId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("MessageId length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * MessageId 생성.
     *
     * @param value MessageId 값
     * @return MessageId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static MessageId of(String value) {
        return new MessageId(value);
    }

    /**
     * UUID 기반 MessageId 생성.
     *
     * @return 무작위 MessageId
     */
    public static MessageId random() {
        return new MessageId(UUID.randomUUID().toString());
    }

    /**
     * MessageId 값 조회.
     *
     * @return MessageId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageId messageId = (MessageId) o;
        return value.equals(messageId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "MessageId{" + value + '}';
    }
}
