package com.ryuqq.redelivery.core.strategy;

import com.ryuqq.redelivery.core.attempt.AttemptState;
import com.ryuqq.redelivery.core.attempt.AttemptTracker;
import com.ryuqq.redelivery.core.backoff.DelayPolicy;
import com.ryuqq.redelivery.core.context.DeliveryContext;
import com.ryuqq.redelivery.core.model.Message;
import com.ryuqq.redelivery.core.outcome.Outcome;
import com.ryuqq.redelivery.core.spi.TimeProvider;
import com.ryuqq.redelivery.core.statemachine.PhaseTracker;
import com.ryuqq.redelivery.core.statemachine.RedeliveryPhase;
import com.ryuqq.redelivery.core.support.Stages;
import com.ryuqq.redelivery.core.telemetry.EventSeverity;
import com.ryuqq.redelivery.core.telemetry.ExecutionAttemptArguments;
import com.ryuqq.redelivery.core.telemetry.RedeliveryEvent;
import com.ryuqq.redelivery.core.transition.RedeliveryTransition;
import com.ryuqq.redelivery.core.transition.TerminalActionDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 지연 재전달 코디네이터.
 *
 * <p>처리 콜백이 실패하면(predicate 기준) 브로커의 즉시 재전달 대신
 * 시도 번호를 증가시킨 대체 메시지를 지연 예약하고 원본을 완료합니다.
 * 재전달 한도를 소진하면 설정된 종료 처리({@link com.ryuqq.redelivery.core.model.MessageAction})를 적용합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * EXECUTING   콜백 실행 → Outcome
 * EVALUATING  shouldHandle 평가, ExecutionAttempt 보고
 *             ├─ 취소 또는 대상 아님 → 결과 그대로 반환
 *             ├─ 한도 소진 → TERMINAL
 *             └─ 그 외 → SCHEDULING
 * TERMINAL    종료 처리 실행 (실패 시 그 예외가 결과를 대체)
 * SCHEDULING  지연 계산 (DelayGenerator 우선), OnRedeliver 보고/알림,
 *             재전달 전환 (실패 시 그 예외가 결과를 대체)
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>브로커 실패: Fail 결과로 변환 (재시도하지 않음)</li>
 *   <li>사용자 hook 실패: 반환 stage가 예외로 완료됨</li>
 *   <li>텔레메트리 실패: WARN 로그 후 무시</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 불변 설정만 보유하므로 하나의 인스턴스를 여러 메시지에 동시에 사용할 수 있습니다.
 * 메시지 하나에 대한 단계는 순차적으로 실행됩니다.</p>
 *
 * @param <T> 처리 결과 타입
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class RedeliveryCoordinator<T> implements ResilienceStrategy<T> {

    private static final Logger log = LoggerFactory.getLogger(RedeliveryCoordinator.class);

    private final RedeliveryOptions<T> options;
    private final RedeliveryConfig config;
    private final TimeProvider timeProvider;
    private final RedeliveryTransition transition;
    private final TerminalActionDispatcher dispatcher;

    /**
     * 생성자.
     *
     * @param options 전략 옵션
     * @throws IllegalArgumentException options가 null인 경우
     */
    public RedeliveryCoordinator(RedeliveryOptions<T> options) {
        this(
            options,
            options == null ? null : new RedeliveryTransition(
                options.timeProvider(),
                options.transactionalTransport().orElse(null)
            ),
            new TerminalActionDispatcher()
        );
    }

    /**
     * 생성자 (전환/종료 처리 구현 주입).
     *
     * @param options 전략 옵션
     * @param transition 재전달 전환
     * @param dispatcher 종료 처리 실행기
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    RedeliveryCoordinator(
        RedeliveryOptions<T> options,
        RedeliveryTransition transition,
        TerminalActionDispatcher dispatcher
    ) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        this.options = options;
        this.config = options.config();
        this.timeProvider = options.timeProvider();
        this.transition = transition;
        this.dispatcher = dispatcher;
    }

    @Override
    public CompletionStage<Outcome<T>> execute(DeliveryContext context, ProcessingCallback<T> callback) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }

        int attempt = AttemptTracker.currentAttempt(context.message());
        long start = timeProvider.timestamp();
        PhaseTracker phases = new PhaseTracker();

        return Stages.safely(() -> callback.process(context))
            .handle(Outcome::of)
            .thenCompose(outcome -> evaluate(context, phases, outcome, attempt, start));
    }

    private CompletionStage<Outcome<T>> evaluate(
        DeliveryContext context,
        PhaseTracker phases,
        Outcome<T> outcome,
        int attempt,
        long start
    ) {
        advance(context, phases, RedeliveryPhase.EVALUATING);

        RedeliverPredicateArguments<T> predicateArguments = new RedeliverPredicateArguments<>(context, outcome, attempt);
        return requireStage(options.shouldHandle().shouldHandle(predicateArguments), "shouldHandle")
            .thenCompose(shouldHandle -> {
                boolean handled = Boolean.TRUE.equals(shouldHandle);
                Duration elapsed = timeProvider.elapsedSince(start);

                report(new RedeliveryEvent(
                    config.name(),
                    RedeliveryConstants.EXECUTION_ATTEMPT_EVENT,
                    handled ? EventSeverity.WARNING : EventSeverity.INFORMATION,
                    context,
                    outcome,
                    new ExecutionAttemptArguments(attempt, elapsed, handled)
                ));

                if (context.isCancellationRequested() || !handled) {
                    advance(context, phases, RedeliveryPhase.DONE);
                    return CompletableFuture.completedFuture(outcome);
                }

                AttemptState state = AttemptTracker.evaluate(attempt, config.maxRedeliveryAttempts());
                if (state.terminal()) {
                    return applyTerminalAction(context, phases, outcome, state);
                }
                return scheduleRedelivery(context, phases, outcome, state, elapsed);
            });
    }

    private CompletionStage<Outcome<T>> applyTerminalAction(
        DeliveryContext context,
        PhaseTracker phases,
        Outcome<T> outcome,
        AttemptState state
    ) {
        advance(context, phases, RedeliveryPhase.TERMINAL);

        Message message = context.message();
        log.warn("Redelivery attempts exhausted: messageId={}, attempt={}, maxRedeliveryAttempts={}, action={}",
            message.messageId().getValue(), state.attemptNumber(),
            config.maxRedeliveryAttempts(), config.lastAttemptFailedAction());

        return dispatcher.apply(config.lastAttemptFailedAction(), message, context.receiver())
            .thenApply(result -> {
                advance(context, phases, RedeliveryPhase.DONE);
                return result.failureCause()
                    .<Outcome<T>>map(Outcome::fail)
                    .orElse(outcome);
            });
    }

    private CompletionStage<Outcome<T>> scheduleRedelivery(
        DeliveryContext context,
        PhaseTracker phases,
        Outcome<T> outcome,
        AttemptState state,
        Duration elapsed
    ) {
        advance(context, phases, RedeliveryPhase.SCHEDULING);

        Duration baseline = config.backoffSpec().delayFor(state.attemptNumber());

        return resolveDelay(context, outcome, state.attemptNumber(), baseline)
            .thenCompose(delay -> {
                RedeliveryPlan plan = new RedeliveryPlan(delay, state.nextAttemptNumber());
                OnRedeliverArguments<T> arguments = new OnRedeliverArguments<>(
                    context, outcome, state.attemptNumber(), plan.delay(), elapsed
                );

                report(new RedeliveryEvent(
                    config.name(),
                    RedeliveryConstants.ON_REDELIVER_EVENT,
                    EventSeverity.WARNING,
                    context,
                    outcome,
                    arguments
                ));

                CompletionStage<Void> notified = options.onRedeliver()
                    .map(listener -> requireStage(listener.onRedeliver(arguments), "onRedeliver"))
                    .orElseGet(Stages::done);

                return notified
                    .thenCompose(ignored -> transition.redeliverWithDelay(
                        context.message(),
                        context.sender(),
                        context.receiver(),
                        plan.delay(),
                        plan.nextAttemptNumber()
                    ))
                    .thenApply(result -> completeScheduling(context, phases, outcome, plan, result));
            });
    }

    private Outcome<T> completeScheduling(
        DeliveryContext context,
        PhaseTracker phases,
        Outcome<T> outcome,
        RedeliveryPlan plan,
        Outcome<Void> result
    ) {
        advance(context, phases, RedeliveryPhase.DONE);

        Optional<Throwable> failure = result.failureCause();
        if (failure.isPresent()) {
            return Outcome.fail(failure.get());
        }
        log.info("Redelivery scheduled: messageId={}, nextAttempt={}, delay={}",
            context.message().messageId().getValue(), plan.nextAttemptNumber(), plan.delay());
        return outcome;
    }

    private CompletionStage<Duration> resolveDelay(DeliveryContext context, Outcome<T> outcome, int attempt, Duration baseline) {
        Optional<DelayGenerator<T>> generator = options.delayGenerator();
        if (generator.isEmpty()) {
            return CompletableFuture.completedFuture(baseline);
        }

        DelayGeneratorArguments<T> arguments = new DelayGeneratorArguments<>(context, outcome, attempt);
        return requireStage(generator.get().generate(arguments), "delayGenerator")
            .thenApply(override -> {
                if (override != null && override.isPresent()) {
                    Duration candidate = override.get();
                    if (DelayPolicy.isValidDelay(candidate)) {
                        return candidate;
                    }
                    log.debug("Ignoring invalid delay override: messageId={}, delay={}",
                        context.message().messageId().getValue(), candidate);
                }
                return baseline;
            });
    }

    private void report(RedeliveryEvent event) {
        try {
            options.telemetrySink().report(event);
        } catch (RuntimeException e) {
            log.warn("Telemetry sink failed: event={}, messageId={}",
                event.eventName(), event.context().message().messageId().getValue(), e);
        }
    }

    private static void advance(DeliveryContext context, PhaseTracker phases, RedeliveryPhase to) {
        RedeliveryPhase from = phases.advanceTo(to);
        if (log.isDebugEnabled()) {
            log.debug("Phase transition: messageId={}, {} → {}",
                context.message().messageId().getValue(), from, to);
        }
    }

    private static <R> CompletionStage<R> requireStage(CompletionStage<R> stage, String hookName) {
        if (stage == null) {
            throw new IllegalStateException(hookName + " returned a null CompletionStage");
        }
        return stage;
    }
}
