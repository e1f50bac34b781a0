package com.ryuqq.redelivery.core.transition;

import com.ryuqq.redelivery.core.model.Message;
import com.ryuqq.redelivery.core.model.MessageAction;
import com.ryuqq.redelivery.core.outcome.Outcome;
import com.ryuqq.redelivery.core.spi.MessageReceiver;
import com.ryuqq.redelivery.core.support.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionStage;

/**
 * 재전달 한도 소진 시 종료 처리 실행기.
 *
 * <p>설정된 {@link MessageAction}을 receiver 호출로 변환하고,
 * 브로커 실패(동기/비동기 모두)를 {@link Outcome#fail(Throwable)}로 변환합니다.</p>
 *
 * <p><strong>매핑:</strong></p>
 * <ul>
 *   <li>COMPLETE → {@link MessageReceiver#complete}</li>
 *   <li>ABANDON → {@link MessageReceiver#abandon}</li>
 *   <li>DEFER → {@link MessageReceiver#defer}</li>
 *   <li>DEAD_LETTER → {@link MessageReceiver#deadLetter}</li>
 * </ul>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class TerminalActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TerminalActionDispatcher.class);

    /**
     * 종료 처리 실행.
     *
     * @param action 적용할 처리
     * @param message 대상 메시지
     * @param receiver 메시지를 전달한 receiver
     * @return 처리 결과 (실패해도 stage는 정상 완료되고 Fail을 담음)
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public CompletionStage<Outcome<Void>> apply(MessageAction action, Message message, MessageReceiver receiver) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }

        CompletionStage<Void> stage = Stages.safely(() -> switch (action) {
            case COMPLETE -> receiver.complete(message);
            case ABANDON -> receiver.abandon(message);
            case DEFER -> receiver.defer(message);
            case DEAD_LETTER -> receiver.deadLetter(message);
        });

        return stage.handle((ignored, error) -> {
            Outcome<Void> outcome = Outcome.of(null, error);
            if (outcome.isFail()) {
                log.error("Terminal action {} failed: messageId={}",
                    action, message.messageId().getValue(), Outcome.unwrap(error));
            }
            return outcome;
        });
    }
}
