package com.ryuqq.redelivery.core.transition;

import com.ryuqq.redelivery.core.attempt.AttemptTracker;
import com.ryuqq.redelivery.core.model.Message;
import com.ryuqq.redelivery.core.model.ScheduledMessage;
import com.ryuqq.redelivery.core.outcome.Outcome;
import com.ryuqq.redelivery.core.spi.MessageReceiver;
import com.ryuqq.redelivery.core.spi.MessageSender;
import com.ryuqq.redelivery.core.spi.TimeProvider;
import com.ryuqq.redelivery.core.spi.TransactionalTransport;
import com.ryuqq.redelivery.core.support.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * 원본 완료 + 대체 메시지 예약 전환.
 *
 * <p>대체 메시지는 원본과 동일한 ID, 본문, 속성을 가지며
 * {@code AttemptNumber}만 다음 시도 번호로 교체됩니다.
 * 예약 시각은 {@code now + delay}이고, 범위를 넘으면 {@link Instant#MAX}로 포화됩니다.</p>
 *
 * <p><strong>원자성:</strong></p>
 * <ul>
 *   <li>{@link TransactionalTransport}가 있으면 완료와 전송을 하나의 트랜잭션으로 수행</li>
 *   <li>없으면 전송 후 완료 순서로 수행. 전송 실패 시 원본은 완료하지 않음
 *       (중복은 허용, 유실은 불허)</li>
 * </ul>
 *
 * <p>모든 예외는 {@link Outcome#fail(Throwable)}로 변환됩니다.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class RedeliveryTransition {

    private static final Logger log = LoggerFactory.getLogger(RedeliveryTransition.class);

    private final TimeProvider timeProvider;
    private final TransactionalTransport transactionalTransport;

    /**
     * 트랜잭션 없이 생성 (send-then-complete).
     *
     * @param timeProvider 현재 시각 소스
     */
    public RedeliveryTransition(TimeProvider timeProvider) {
        this(timeProvider, null);
    }

    /**
     * 생성자.
     *
     * @param timeProvider 현재 시각 소스
     * @param transactionalTransport 원자적 완료+전송 (null이면 send-then-complete)
     * @throws IllegalArgumentException timeProvider가 null인 경우
     */
    public RedeliveryTransition(TimeProvider timeProvider, TransactionalTransport transactionalTransport) {
        if (timeProvider == null) {
            throw new IllegalArgumentException("timeProvider cannot be null");
        }
        this.timeProvider = timeProvider;
        this.transactionalTransport = transactionalTransport;
    }

    /**
     * 원자적 전송 사용 여부 조회.
     *
     * @return TransactionalTransport가 설정되어 있으면 값, 아니면 empty
     */
    public Optional<TransactionalTransport> transactionalTransport() {
        return Optional.ofNullable(transactionalTransport);
    }

    /**
     * 지연 재전달 수행.
     *
     * @param message 원본 메시지
     * @param sender 대체 메시지를 보낼 sender
     * @param receiver 원본을 전달한 receiver
     * @param delay 재전달 지연 시간 (0 이상)
     * @param nextAttempt 대체 메시지에 기록할 시도 번호
     * @return 전환 결과 (실패해도 stage는 정상 완료되고 Fail을 담음)
     * @throws IllegalArgumentException 파라미터가 유효하지 않은 경우
     */
    public CompletionStage<Outcome<Void>> redeliverWithDelay(
        Message message,
        MessageSender sender,
        MessageReceiver receiver,
        Duration delay,
        int nextAttempt
    ) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative (current: " + delay + ")");
        }
        if (nextAttempt < 0) {
            throw new IllegalArgumentException("nextAttempt must be non-negative (current: " + nextAttempt + ")");
        }

        CompletionStage<Void> stage = Stages.safely(() -> {
            ScheduledMessage replacement = new ScheduledMessage(
                AttemptTracker.withAttempt(message, nextAttempt),
                scheduledTime(delay)
            );
            if (transactionalTransport != null) {
                return transactionalTransport.completeAndSend(message, receiver, sender, replacement);
            }
            return Stages.safely(() -> sender.send(replacement))
                .thenCompose(sent -> Stages.safely(() -> receiver.complete(message)));
        });

        return stage.handle((ignored, error) -> {
            Outcome<Void> outcome = Outcome.of(null, error);
            if (outcome.isFail()) {
                log.error("Redelivery transition failed: messageId={}, nextAttempt={}",
                    message.messageId().getValue(), nextAttempt, Outcome.unwrap(error));
            }
            return outcome;
        });
    }

    private Instant scheduledTime(Duration delay) {
        Instant now = timeProvider.now();
        try {
            return now.plus(delay);
        } catch (DateTimeException | ArithmeticException overflow) {
            return Instant.MAX;
        }
    }
}
