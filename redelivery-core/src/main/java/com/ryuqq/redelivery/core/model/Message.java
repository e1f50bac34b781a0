package com.ryuqq.redelivery.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 브로커로부터 수신한 메시지.
 *
 * <p>Message는 본문(Payload)과 애플리케이션 속성(application properties)으로 구성됩니다.
 * 코어는 원본 Message를 절대 변경하지 않으며, 재전달이 필요한 경우
 * {@link #withProperty(String, Object)}로 파생된 새 Message를 만듭니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>messageId:</strong> 메시지 고유 식별자 (재전달 시에도 유지)</li>
 *   <li><strong>payload:</strong> 불투명 본문</li>
 *   <li><strong>applicationProperties:</strong> 문자열 키 → 값 매핑 (수정 불가 뷰)</li>
 * </ul>
 *
 * @param messageId 메시지 고유 식별자
 * @param payload 메시지 본문
 * @param applicationProperties 애플리케이션 속성 (null이면 빈 맵)
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public record Message(
    MessageId messageId,
    Payload payload,
    Map<String, Object> applicationProperties
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException messageId 또는 payload가 null인 경우
     */
    public Message {
        if (messageId == null) {
            throw new IllegalArgumentException("messageId cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        applicationProperties = applicationProperties == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(applicationProperties));
    }

    /**
     * 속성 없이 Message 생성.
     *
     * @param messageId 메시지 ID
     * @param payload 본문
     * @return Message 인스턴스
     */
    public static Message of(MessageId messageId, Payload payload) {
        return new Message(messageId, payload, null);
    }

    /**
     * 속성 값 조회.
     *
     * @param key 속성 키
     * @return 속성 값 (없으면 empty)
     */
    public Optional<Object> property(String key) {
        return Optional.ofNullable(applicationProperties.get(key));
    }

    /**
     * 속성 하나를 추가/교체한 새 Message 생성.
     *
     * <p>원본 Message는 변경되지 않습니다.</p>
     *
     * @param key 속성 키
     * @param value 속성 값
     * @return 새 Message 인스턴스
     * @throws IllegalArgumentException key가 null이거나 빈 문자열인 경우
     */
    public Message withProperty(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        Map<String, Object> copy = new LinkedHashMap<>(applicationProperties);
        copy.put(key, value);
        return new Message(messageId, payload, copy);
    }
}
