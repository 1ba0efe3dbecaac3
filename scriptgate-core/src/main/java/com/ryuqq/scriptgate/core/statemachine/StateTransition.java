package com.ryuqq.scriptgate.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING, CANCELLED</li>
 *   <li>RUNNING → SUCCEEDED, FAILED, RETRYING</li>
 *   <li>RETRYING → RUNNING, FAILED</li>
 * </ul>
 *
 * <p>종료 상태(SUCCEEDED, FAILED, CANCELLED)에서는 어떤 상태로도 전이할 수 없습니다.
 * 실행 중인 Operation은 취소할 수 없습니다 (외부 엔진이 협조적 취소를 지원하지 않음).</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(OperationState from, OperationState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == OperationState.RUNNING || to == OperationState.CANCELLED;
            case RUNNING -> to == OperationState.SUCCEEDED
                || to == OperationState.FAILED
                || to == OperationState.RETRYING;
            case RETRYING -> to == OperationState.RUNNING || to == OperationState.FAILED;
            case SUCCEEDED, FAILED, CANCELLED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static OperationState transition(OperationState current, OperationState next) {
        validate(current, next);
        return next;
    }
}
