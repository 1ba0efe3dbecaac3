package com.ryuqq.scriptgate.adapter.runner;

import com.ryuqq.scriptgate.application.queue.OperationSnapshot;
import com.ryuqq.scriptgate.core.contract.ScriptCommand;
import com.ryuqq.scriptgate.core.model.OperationId;
import com.ryuqq.scriptgate.core.model.Priority;
import com.ryuqq.scriptgate.core.result.ExecutionResult;
import com.ryuqq.scriptgate.core.statemachine.OperationState;
import com.ryuqq.scriptgate.core.statemachine.StateTransition;

import java.time.Instant;
import java.util.Comparator;
import java.util.concurrent.CompletableFuture;

/**
 * 큐 안의 Operation 하나.
 *
 * <p>가변 상태(state, attempts, 시각, 결과)는 큐의 상태 락 안에서만 변경됩니다.
 * 모든 상태 변경은 {@link StateTransition}으로 검증됩니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
final class QueuedOperation {

    /**
     * 실행 순서: 우선순위(HIGH 먼저) → 등록 순서.
     */
    static final Comparator<QueuedOperation> EXECUTION_ORDER = Comparator
        .comparingInt((QueuedOperation op) -> op.priority.ordinal())
        .thenComparingLong(op -> op.sequence);

    private final OperationId id;
    private final ScriptCommand command;
    private final Priority priority;
    private final long sequence;
    private final Instant enqueuedAt;
    private final CompletableFuture<ExecutionResult> future = new CompletableFuture<>();

    private OperationState state = OperationState.PENDING;
    private int attempts;
    private Instant startedAt;
    private Instant finishedAt;
    private ExecutionResult result;

    QueuedOperation(OperationId id, ScriptCommand command, Priority priority, long sequence, Instant enqueuedAt) {
        this.id = id;
        this.command = command;
        this.priority = priority;
        this.sequence = sequence;
        this.enqueuedAt = enqueuedAt;
    }

    OperationId id() {
        return id;
    }

    ScriptCommand command() {
        return command;
    }

    Instant enqueuedAt() {
        return enqueuedAt;
    }

    Instant finishedAt() {
        return finishedAt;
    }

    OperationState state() {
        return state;
    }

    CompletableFuture<ExecutionResult> future() {
        return future;
    }

    /**
     * PENDING 또는 RETRYING → RUNNING, 시도 횟수 증가.
     */
    void beginAttempt(Instant now) {
        state = StateTransition.transition(state, OperationState.RUNNING);
        attempts++;
        if (startedAt == null) {
            startedAt = now;
        }
    }

    void markRetrying() {
        state = StateTransition.transition(state, OperationState.RETRYING);
    }

    /**
     * 종료 상태로 전이하고 결과를 기록. future 완료는 호출자가 락 밖에서 수행.
     */
    void finish(OperationState terminal, ExecutionResult result, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("terminal state required (current: " + terminal + ")");
        }
        state = StateTransition.transition(state, terminal);
        this.result = result;
        this.finishedAt = now;
    }

    /**
     * 어느 비종료 상태에서든 FAILED로 마감. PENDING이면 RUNNING을 거쳐 전이합니다.
     */
    void abort(ExecutionResult result, Instant now) {
        if (state == OperationState.PENDING) {
            beginAttempt(now);
        }
        finish(OperationState.FAILED, result, now);
    }

    int attempts() {
        return attempts;
    }

    ExecutionResult result() {
        return result;
    }

    OperationSnapshot snapshot() {
        return new OperationSnapshot(id, command.label(), priority, state, attempts,
            enqueuedAt, startedAt, finishedAt, result);
    }
}
