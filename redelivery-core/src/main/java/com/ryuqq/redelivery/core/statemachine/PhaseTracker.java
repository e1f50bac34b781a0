package com.ryuqq.redelivery.core.statemachine;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 메시지 하나의 처리 단계를 추적.
 *
 * <p>실행마다 새 인스턴스를 만들며 {@link RedeliveryPhase#EXECUTING}에서 시작합니다.
 * {@link #advanceTo(RedeliveryPhase)}는 현재 단계를 기준으로 {@link PhaseTransition#validate}를 수행하므로
 * 같은 메시지에서 TERMINAL과 SCHEDULING이 모두 실행되거나 DONE 이후 다시 전이하면 실패합니다.</p>
 *
 * <p>단계는 비동기 콜백에서 서로 다른 스레드로 넘어갈 수 있으므로 compare-and-set으로 갱신합니다.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class PhaseTracker {

    private final AtomicReference<RedeliveryPhase> current = new AtomicReference<>(RedeliveryPhase.EXECUTING);

    /**
     * 현재 단계에서 다음 단계로 전이.
     *
     * @param next 다음 단계
     * @return 전이 이전 단계
     * @throws IllegalArgumentException next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이이거나 동시에 다른 전이가 일어난 경우
     */
    public RedeliveryPhase advanceTo(RedeliveryPhase next) {
        RedeliveryPhase from = current.get();
        PhaseTransition.validate(from, next);
        if (!current.compareAndSet(from, next)) {
            throw new IllegalStateException(
                String.format("Concurrent phase transition: expected %s but was %s", from, current.get())
            );
        }
        return from;
    }

    /**
     * 현재 단계 조회.
     *
     * @return 현재 단계
     */
    public RedeliveryPhase current() {
        return current.get();
    }
}
