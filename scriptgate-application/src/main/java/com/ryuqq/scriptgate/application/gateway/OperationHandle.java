package com.ryuqq.scriptgate.application.gateway;

import com.ryuqq.scriptgate.core.model.OperationId;
import com.ryuqq.scriptgate.core.result.ExecutionResult;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * 제출된 명령의 결과 핸들.
 *
 * <p><strong>두 가지 생성 경로:</strong></p>
 * <ul>
 *   <li><strong>즉시 완료 (READ):</strong> 호출자 스레드에서 실행이 끝난 결과를 담습니다.
 *       {@link #isCompletedImmediately()}가 true이며 취소할 수 없습니다.</li>
 *   <li><strong>큐 등록 (WRITE):</strong> 큐가 나중에 완료할 Future를 담습니다.
 *       PENDING 상태일 때만 {@link #cancel()}이 성공합니다.</li>
 * </ul>
 *
 * <p>Future는 예외로 완료되지 않습니다. 모든 실패는 {@code success=false}인
 * {@link ExecutionResult}로 전달됩니다 (취소는 {@code CANCELLED}).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OperationHandle handle = gateway.write(command);
 * ExecutionResult result = handle.await(Duration.ofSeconds(60));
 * if (!result.success()) {
 *     log.warn("{} failed: {}", command.label(), result.error());
 * }
 * </pre>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public final class OperationHandle {

    private final OperationId operationId;
    private final boolean completedImmediately;
    private final CompletableFuture<ExecutionResult> future;
    private final Predicate<OperationId> canceller;

    /**
     * Private constructor - 정적 팩토리 메서드 사용 권장.
     *
     * @param operationId Operation ID
     * @param completedImmediately 호출 시점에 이미 완료되었는지 여부
     * @param future 결과 Future
     * @param canceller 취소 요청 처리기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    private OperationHandle(OperationId operationId, boolean completedImmediately,
                            CompletableFuture<ExecutionResult> future,
                            Predicate<OperationId> canceller) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (future == null) {
            throw new IllegalArgumentException("future cannot be null");
        }
        if (canceller == null) {
            throw new IllegalArgumentException("canceller cannot be null");
        }
        this.operationId = operationId;
        this.completedImmediately = completedImmediately;
        this.future = future;
        this.canceller = canceller;
    }

    /**
     * 즉시 완료 핸들 생성 (READ 경로).
     *
     * @param operationId Operation ID
     * @param result 실행 결과
     * @return OperationHandle (completedImmediately=true)
     * @throws IllegalArgumentException operationId 또는 result가 null인 경우
     */
    public static OperationHandle completed(OperationId operationId, ExecutionResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null for completed handle");
        }
        return new OperationHandle(operationId, true, CompletableFuture.completedFuture(result), id -> false);
    }

    /**
     * 큐 등록 핸들 생성 (WRITE 경로).
     *
     * @param operationId Operation ID
     * @param future 큐가 완료할 Future
     * @param canceller 큐의 취소 함수 (PENDING이면 true 반환)
     * @return OperationHandle (completedImmediately=false)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static OperationHandle queued(OperationId operationId,
                                         CompletableFuture<ExecutionResult> future,
                                         Predicate<OperationId> canceller) {
        return new OperationHandle(operationId, false, future, canceller);
    }

    public OperationId getOperationId() {
        return operationId;
    }

    /**
     * 호출 시점에 이미 완료된 핸들인지 확인.
     *
     * @return READ 경로로 생성된 경우 true
     */
    public boolean isCompletedImmediately() {
        return completedImmediately;
    }

    /**
     * 결과가 준비되었는지 확인.
     */
    public boolean isDone() {
        return future.isDone();
    }

    /**
     * 완료된 경우 결과 조회 (블로킹 없음).
     *
     * @return 결과, 아직 완료되지 않았으면 empty
     */
    public Optional<ExecutionResult> resultNow() {
        return Optional.ofNullable(future.getNow(null));
    }

    /**
     * 결과가 나올 때까지 대기.
     *
     * @return 실행 결과
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public ExecutionResult await() throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Operation " + operationId.getValue() + " completed exceptionally", e.getCause());
        }
    }

    /**
     * 제한 시간 동안 결과 대기.
     *
     * <p>시간 초과는 대기만 중단하며 Operation 자체는 계속 진행됩니다.</p>
     *
     * @param timeout 최대 대기 시간
     * @return 실행 결과
     * @throws InterruptedException 대기 중 인터럽트된 경우
     * @throws TimeoutException 시간 내 완료되지 않은 경우
     */
    public ExecutionResult await(Duration timeout) throws InterruptedException, TimeoutException {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Operation " + operationId.getValue() + " completed exceptionally", e.getCause());
        }
    }

    /**
     * 아직 시작되지 않은 Operation 취소 요청.
     *
     * @return 취소되었으면 true, 이미 실행 중이거나 종료된 경우 false
     */
    public boolean cancel() {
        return canceller.test(operationId);
    }

    /**
     * 결과 Future의 읽기 전용 뷰.
     *
     * <p>반환된 stage를 완료시켜도 원본 Operation에는 영향이 없습니다.</p>
     */
    public CompletionStage<ExecutionResult> toCompletionStage() {
        return future.minimalCompletionStage();
    }

    @Override
    public String toString() {
        return "OperationHandle{operationId=" + operationId
            + ", completedImmediately=" + completedImmediately
            + ", done=" + future.isDone() + "}";
    }
}
