package com.ryuqq.redelivery.core.statemachine;

/**
 * 단계 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>EXECUTING → EVALUATING</li>
 *   <li>EVALUATING → TERMINAL / SCHEDULING / DONE</li>
 *   <li>TERMINAL → DONE</li>
 *   <li>SCHEDULING → DONE</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 한 메시지에 대해 TERMINAL과 SCHEDULING은 둘 중 하나만 실행됩니다.</p>
 *
 * @author Redelivery Team
 * @since 1.0.0
 */
public final class PhaseTransition {

    // Utility class - prevent instantiation
    private PhaseTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(RedeliveryPhase from, RedeliveryPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case EXECUTING -> to == RedeliveryPhase.EVALUATING;
            case EVALUATING -> to == RedeliveryPhase.TERMINAL
                || to == RedeliveryPhase.SCHEDULING
                || to == RedeliveryPhase.DONE;
            case TERMINAL, SCHEDULING -> to == RedeliveryPhase.DONE;
            case DONE -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid phase transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RedeliveryPhase transition(RedeliveryPhase current, RedeliveryPhase next) {
        validate(current, next);
        return next;
    }
}
