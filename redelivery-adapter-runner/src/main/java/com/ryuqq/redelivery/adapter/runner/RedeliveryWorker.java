package com.ryuqq.redelivery.adapter.runner;

import com.ryuqq.redelivery.core.context.CancellationToken;
import com.ryuqq.redelivery.core.context.DeliveryContext;
import com.ryuqq.redelivery.core.model.Message;
import com.ryuqq.redelivery.core.outcome.Outcome;
import com.ryuqq.redelivery.core.spi.MessageReceiver;
import com.ryuqq.redelivery.core.spi.MessageSender;
import com.ryuqq.redelivery.core.spi.MessageSource;
import com.ryuqq.redelivery.core.strategy.ProcessingCallback;
import com.ryuqq.redelivery.core.strategy.ResilienceStrategy;
import com.ryuqq.redelivery.core.support.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 메시지 소스에서 메시지를 가져와 하나의 공유 전략으로 처리하는 워커.
 *
 * <p>메시지마다 {@link DeliveryContext}를 만들어 {@link ResilienceStrategy#execute}에 넘깁니다.
 * 전략 인스턴스는 모든 워커 스레드가 공유하며, 메시지 간 상태를 갖지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * receive(batchSize) → [Message1, Message2, ...]
 *   ↓
 * For each Message (워커 스레드에서):
 *   1. DeliveryContext 생성 (receiver, sender, 워커 CancellationToken)
 *   2. strategy.execute(context, handler) → Outcome 대기
 *   3. Outcome 처리:
 *      - Ok → 로그 (정산은 handler 책임)
 *      - Fail → 로그 (재전달/종료 처리는 전략이 이미 수행)
 *   4. 전략 자체가 실패한 경우 (hook 예외 등) → receiver.abandon(message)
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>워커 스레드 수 = concurrency, 메시지 하나는 스레드 하나가 끝까지 처리</li>
 *   <li>동일 메시지 중복 처리 방지는 broker의 lock(visibility timeout)에 위임</li>
 *   <li>shutdown은 진행 중인 메시지가 끝나기를 먼저 기다리며, 제한 시간을 넘긴 경우에만 CancellationToken을 취소함</li>
 * </ul>
 *
 * @param <T> handler 결과 타입
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class RedeliveryWorker<T> {

    private static final Logger log = LoggerFactory.getLogger(RedeliveryWorker.class);

    private final MessageSource source;
    private final MessageReceiver receiver;
    private final MessageSender sender;
    private final ResilienceStrategy<T> strategy;
    private final ProcessingCallback<T> handler;
    private final WorkerConfig config;
    private final ExecutorService workerExecutor;
    private final CancellationToken cancellationToken = CancellationToken.create();

    /**
     * 생성자.
     *
     * @param source 메시지 소스
     * @param receiver 메시지 정산 대상 (complete, abandon 등)
     * @param sender 재전달 메시지 전송자
     * @param strategy 공유 재전달 전략
     * @param handler 메시지 처리 callback
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RedeliveryWorker(
        MessageSource source,
        MessageReceiver receiver,
        MessageSender sender,
        ResilienceStrategy<T> strategy,
        ProcessingCallback<T> handler,
        WorkerConfig config
    ) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.source = source;
        this.receiver = receiver;
        this.sender = sender;
        this.strategy = strategy;
        this.handler = handler;
        this.config = config;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    /**
     * 메시지 배치를 가져와 워커 스레드에 제출.
     *
     * @return 제출한 메시지 수
     * @throws IllegalStateException shutdown 이후 호출된 경우
     */
    public int pump() {
        if (workerExecutor.isShutdown()) {
            throw new IllegalStateException("RedeliveryWorker has been shut down");
        }

        List<Message> messages = source.receive(config.batchSize());

        for (Message message : messages) {
            workerExecutor.submit(() -> processMessage(message));
        }

        if (!messages.isEmpty()) {
            log.debug("Dispatched {} message(s)", messages.size());
        }
        return messages.size();
    }

    /**
     * 워커 종료.
     *
     * <p>ExecutorService를 graceful shutdown하여 shutdownTimeoutMs 동안 진행 중인 작업이
     * 완료되도록 대기합니다. 그래도 끝나지 않으면 CancellationToken을 취소한 뒤 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            cancellationToken.cancel();
            log.warn("Worker did not terminate within {}ms, forcing shutdown", config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
        }
    }

    /**
     * shutdown 여부.
     *
     * @return shutdown이 호출되었으면 true
     */
    public boolean isShutdown() {
        return workerExecutor.isShutdown();
    }

    /**
     * 메시지 하나를 전략으로 처리하고 결과를 기다림.
     *
     * <p>전략이 예외로 끝나면 메시지를 abandon하여 다시 받을 수 있게 합니다.</p>
     *
     * @param message 처리할 메시지
     */
    private void processMessage(Message message) {
        String messageId = message.messageId().getValue();
        DeliveryContext context = new DeliveryContext(message, receiver, sender, cancellationToken);

        try {
            Outcome<T> outcome = Stages.safely(() -> strategy.execute(context, handler))
                .toCompletableFuture()
                .get();
            logOutcome(messageId, outcome);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while processing messageId={}", messageId);

        } catch (ExecutionException e) {
            log.error("Strategy failed for messageId={}, abandoning message", messageId, e.getCause());
            abandon(message);
        }
    }

    private void logOutcome(String messageId, Outcome<T> outcome) {
        if (outcome == null) {
            log.warn("Strategy returned no outcome for messageId={}", messageId);
        } else if (outcome.isOk()) {
            log.debug("Processed messageId={}", messageId);
        } else {
            log.info("Processing failed for messageId={}: {}", messageId,
                outcome.failureCause().map(Throwable::toString).orElse("unknown"));
        }
    }

    private void abandon(Message message) {
        Stages.safely(() -> receiver.abandon(message))
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    log.error("Failed to abandon messageId={}", message.messageId().getValue(), error);
                }
            });
    }
}
