package com.ryuqq.redelivery.core.context;

import com.ryuqq.redelivery.core.model.Message;
import com.ryuqq.redelivery.core.spi.MessageReceiver;
import com.ryuqq.redelivery.core.spi.MessageSender;

/**
 * 메시지 한 건의 처리 컨텍스트 (불변 record).
 *
 * <p>코디네이터는 호출 간 상태를 갖지 않으므로, 메시지별 데이터는 모두 이 컨텍스트로 전달됩니다.</p>
 *
 * @param message 수신한 메시지
 * @param receiver 메시지를 전달한 receiver
 * @param sender 재전달에 사용할 sender
 * @param cancellationToken 취소 신호
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public record DeliveryContext(
    Message message,
    MessageReceiver receiver,
    MessageSender sender,
    CancellationToken cancellationToken
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message, receiver, sender가 null인 경우
     */
    public DeliveryContext {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        if (cancellationToken == null) {
            cancellationToken = CancellationToken.none();
        }
    }

    /**
     * 취소 불가능한 컨텍스트 생성.
     *
     * @param message 수신한 메시지
     * @param receiver receiver
     * @param sender sender
     * @return DeliveryContext 인스턴스
     */
    public static DeliveryContext of(Message message, MessageReceiver receiver, MessageSender sender) {
        return new DeliveryContext(message, receiver, sender, CancellationToken.none());
    }

    /**
     * 취소 요청 여부 확인 (편의 메서드).
     *
     * @return 취소가 요청되었으면 true
     */
    public boolean isCancellationRequested() {
        return cancellationToken.isCancellationRequested();
    }
}
