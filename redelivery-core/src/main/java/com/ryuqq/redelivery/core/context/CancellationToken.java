package com.ryuqq.redelivery.core.context;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 협력적 취소 신호.
 *
 * <p>코디네이터는 재전달 결정 직전에 취소 여부를 확인합니다.
 * 전이(transition)가 시작된 이후에는 취소되지 않습니다.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * 취소 가능한 새 토큰 생성.
     *
     * @return CancellationToken 인스턴스
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * 취소할 수 없는 공유 토큰 조회.
     *
     * @return 절대 취소되지 않는 토큰
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * 취소 요청.
     *
     * @throws UnsupportedOperationException {@link #none()} 토큰인 경우
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        cancelled.set(true);
    }

    /**
     * 취소 요청 여부 확인.
     *
     * @return 취소가 요청되었으면 true
     */
    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
