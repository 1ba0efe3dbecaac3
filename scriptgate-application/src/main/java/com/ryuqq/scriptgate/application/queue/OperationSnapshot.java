package com.ryuqq.scriptgate.application.queue;

import com.ryuqq.scriptgate.core.model.OperationId;
import com.ryuqq.scriptgate.core.model.Priority;
import com.ryuqq.scriptgate.core.result.ExecutionResult;
import com.ryuqq.scriptgate.core.statemachine.OperationState;

import java.time.Instant;

/**
 * 큐 Operation의 시점 스냅샷.
 *
 * @param operationId Operation ID
 * @param label 명령 이름
 * @param priority 우선순위
 * @param state 현재 상태
 * @param attempts 지금까지의 시도 횟수
 * @param enqueuedAt 등록 시각
 * @param startedAt 첫 실행 시각 (null 가능)
 * @param finishedAt 종료 시각 (null 가능)
 * @param result 종료 결과 (종료 전 null)
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record OperationSnapshot(
    OperationId operationId,
    String label,
    Priority priority,
    OperationState state,
    int attempts,
    Instant enqueuedAt,
    Instant startedAt,
    Instant finishedAt,
    ExecutionResult result
) {

    public OperationSnapshot {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (enqueuedAt == null) {
            throw new IllegalArgumentException("enqueuedAt cannot be null");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be non-negative (current: " + attempts + ")");
        }
        // startedAt, finishedAt, result는 null 허용
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
