package com.ryuqq.redelivery.core.backoff;

/**
 * 재전달 지연 시간의 증가 형태.
 *
 * <p><strong>예시 (baseDelay=1s):</strong></p>
 * <ul>
 *   <li>CONSTANT: 1s, 1s, 1s, ...</li>
 *   <li>LINEAR: 1s, 2s, 3s, ...</li>
 *   <li>EXPONENTIAL: 1s, 2s, 4s, 8s, ...</li>
 * </ul>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public enum BackoffType {

    /**
     * 모든 시도에 동일한 지연.
     */
    CONSTANT,

    /**
     * baseDelay × (attempt + 1).
     */
    LINEAR,

    /**
     * baseDelay × 2^attempt.
     */
    EXPONENTIAL
}
