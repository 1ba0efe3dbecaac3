package com.ryuqq.scriptgate.adapter.runner;

import com.ryuqq.scriptgate.application.gateway.OperationHandle;
import com.ryuqq.scriptgate.application.queue.OperationQueue;
import com.ryuqq.scriptgate.application.queue.OperationSnapshot;
import com.ryuqq.scriptgate.application.queue.QueueSaturationException;
import com.ryuqq.scriptgate.application.queue.QueueStatus;
import com.ryuqq.scriptgate.core.cache.CacheInvalidationRules;
import com.ryuqq.scriptgate.core.contract.ScriptCommand;
import com.ryuqq.scriptgate.core.executor.ScriptExecutor;
import com.ryuqq.scriptgate.core.model.OperationId;
import com.ryuqq.scriptgate.core.model.Priority;
import com.ryuqq.scriptgate.core.result.ErrorKind;
import com.ryuqq.scriptgate.core.result.ExecutionResult;
import com.ryuqq.scriptgate.core.result.ScriptError;
import com.ryuqq.scriptgate.core.spi.ResultCache;
import com.ryuqq.scriptgate.core.statemachine.OperationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 쓰기 명령을 한 번에 하나씩 실행하는 OperationQueue 구현체.
 *
 * <p>외부 애플리케이션은 동시에 들어오는 변경 명령을 안전하게 처리하지 못하므로,
 * 모든 WRITE는 이 큐 하나를 거쳐 직렬로 실행됩니다.</p>
 *
 * <p><strong>구조:</strong></p>
 * <ul>
 *   <li>{@link PriorityBlockingQueue}: 우선순위 → 등록 순서로 정렬된 대기열</li>
 *   <li>단일 소비자 워커 스레드 + {@code Semaphore(1)} 실행 슬롯</li>
 *   <li>상태 락: 상태 전이, 깊이 계산, 통계를 한 곳에서 보호 (status 조회가 항상 일관됨)</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * enqueue() → PENDING
 *   ↓ (워커가 꺼냄, 슬롯 획득)
 * RUNNING → 성공 → 캐시 무효화 → SUCCEEDED → 핸들 완료
 *         → 일시적 실패 → RETRYING → (백오프, 슬롯 유지) → RUNNING ...
 *         → 영구 실패 또는 시도 소진 → FAILED → 핸들 완료
 * cancel() (PENDING일 때만) → CANCELLED → 핸들 완료
 * </pre>
 *
 * <p>재시도 중인 Operation은 슬롯을 놓지 않으므로 뒤의 Operation이 앞지르지 않습니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public class SingleFlightOperationQueue implements OperationQueue, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SingleFlightOperationQueue.class);

    private static final long POLL_INTERVAL_MS = 100;
    private static final Duration CLOSE_GRACE = Duration.ofSeconds(30);

    private final ScriptExecutor executor;
    private final ResultCache<?> cache;
    private final QueueConfig config;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    private final PriorityBlockingQueue<QueuedOperation> pending =
        new PriorityBlockingQueue<>(16, QueuedOperation.EXECUTION_ORDER);
    private final Map<OperationId, QueuedOperation> operations = new ConcurrentHashMap<>();
    private final Semaphore slot = new Semaphore(1);
    private final AtomicLong sequence = new AtomicLong();
    private final Thread worker;

    private final Object stateLock = new Object();
    private final Map<ErrorKind, Long> failureCounts = new EnumMap<>(ErrorKind.class);
    private int active;
    private long succeeded;
    private long failed;
    private long cancelled;

    private volatile boolean accepting = true;
    private volatile boolean running = true;

    /**
     * 생성자 (QueueConfig 기반 재시도 정책, 시스템 UTC 시계).
     *
     * @param executor 재시도하지 않는 Executor ({@link IsolatedScriptExecutor})
     * @param cache 성공 시 무효화할 결과 캐시
     * @param config 큐 설정
     */
    public SingleFlightOperationQueue(ScriptExecutor executor, ResultCache<?> cache, QueueConfig config) {
        this(executor, cache, config, RetryPolicy.from(config), Clock.systemUTC());
    }

    /**
     * 생성자 (재시도 정책, 시계 주입).
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SingleFlightOperationQueue(
        ScriptExecutor executor,
        ResultCache<?> cache,
        QueueConfig config,
        RetryPolicy retryPolicy,
        Clock clock
    ) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.executor = executor;
        this.cache = cache;
        this.config = config;
        this.retryPolicy = retryPolicy;
        this.clock = clock;

        this.worker = new Thread(this::runWorker, "scriptgate-queue-worker");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    @Override
    public OperationHandle enqueue(ScriptCommand command, Priority priority) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (!command.isWrite()) {
            throw new IllegalArgumentException("Only WRITE commands can be queued (label: " + command.label() + ")");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }

        QueuedOperation operation;
        int depth;
        synchronized (stateLock) {
            if (!accepting) {
                throw new IllegalStateException("Operation queue is shut down");
            }
            Instant now = clock.instant();
            pruneRetained(now);
            if (active >= config.maxDepth()) {
                throw new QueueSaturationException(active, config.maxDepth());
            }
            operation = new QueuedOperation(OperationId.generate(), command, priority, sequence.incrementAndGet(), now);
            operations.put(operation.id(), operation);
            active++;
            depth = active;
            pending.add(operation);
        }

        log.debug("Enqueued '{}' as {} (priority: {}, depth: {})",
            command.label(), operation.id().getValue(), priority, depth);
        return OperationHandle.queued(operation.id(), operation.future(), this::cancel);
    }

    @Override
    public boolean cancel(OperationId operationId) {
        if (operationId == null) {
            return false;
        }
        QueuedOperation operation = operations.get(operationId);
        if (operation == null) {
            return false;
        }

        ExecutionResult result = ExecutionResult.failure(
            ScriptError.of(ErrorKind.CANCELLED, "Operation cancelled before execution"), 0
        );
        synchronized (stateLock) {
            if (operation.state() != OperationState.PENDING) {
                return false;
            }
            operation.finish(OperationState.CANCELLED, result, clock.instant());
            pending.remove(operation);
            active--;
            cancelled++;
        }
        operation.future().complete(result);
        log.info("Cancelled '{}' ({})", operation.command().label(), operationId.getValue());
        return true;
    }

    @Override
    public QueueStatus status() {
        synchronized (stateLock) {
            Instant now = clock.instant();
            pruneRetained(now);

            int pendingCount = 0;
            int runningCount = 0;
            Instant oldestPending = null;
            for (QueuedOperation operation : operations.values()) {
                OperationState state = operation.state();
                if (state == OperationState.PENDING) {
                    pendingCount++;
                    if (oldestPending == null || operation.enqueuedAt().isBefore(oldestPending)) {
                        oldestPending = operation.enqueuedAt();
                    }
                } else if (state.holdsSlot()) {
                    runningCount++;
                }
            }

            Duration oldestPendingAge = oldestPending == null || oldestPending.isAfter(now)
                ? Duration.ZERO
                : Duration.between(oldestPending, now);
            return new QueueStatus(active, pendingCount, runningCount, oldestPendingAge,
                failureCounts, succeeded, failed, cancelled);
        }
    }

    @Override
    public Optional<OperationSnapshot> snapshot(OperationId operationId) {
        if (operationId == null) {
            return Optional.empty();
        }
        QueuedOperation operation = operations.get(operationId);
        if (operation == null) {
            return Optional.empty();
        }
        synchronized (stateLock) {
            return Optional.of(operation.snapshot());
        }
    }

    @Override
    public List<OperationSnapshot> activeOperations() {
        synchronized (stateLock) {
            List<QueuedOperation> live = new ArrayList<>();
            for (QueuedOperation operation : operations.values()) {
                if (!operation.state().isTerminal()) {
                    live.add(operation);
                }
            }
            live.sort(Comparator
                .comparing((QueuedOperation op) -> !op.state().holdsSlot())
                .thenComparing(QueuedOperation.EXECUTION_ORDER));

            List<OperationSnapshot> snapshots = new ArrayList<>(live.size());
            for (QueuedOperation operation : live) {
                snapshots.add(operation.snapshot());
            }
            return snapshots;
        }
    }

    @Override
    public boolean shutdown(Duration gracePeriod) {
        if (gracePeriod == null || gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must be non-negative (current: " + gracePeriod + ")");
        }

        List<QueuedOperation> dropped = new ArrayList<>();
        synchronized (stateLock) {
            accepting = false;
            Instant now = clock.instant();
            QueuedOperation operation;
            while ((operation = pending.poll()) != null) {
                if (operation.state() != OperationState.PENDING) {
                    continue;
                }
                operation.finish(OperationState.CANCELLED, ExecutionResult.failure(
                    ScriptError.of(ErrorKind.APPLICATION_UNAVAILABLE, "Operation queue shut down before execution"), 0
                ), now);
                active--;
                cancelled++;
                dropped.add(operation);
            }
            running = false;
        }
        for (QueuedOperation operation : dropped) {
            operation.future().complete(operation.result());
        }
        log.info("Operation queue shutting down ({} pending operations dropped)", dropped.size());

        try {
            worker.join(Math.max(1, gracePeriod.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (worker.isAlive()) {
            log.warn("Running operation did not finish within {} ms; interrupting worker", gracePeriod.toMillis());
            worker.interrupt();
            return false;
        }
        return true;
    }

    /**
     * {@code shutdown(30s)}.
     */
    @Override
    public void close() {
        shutdown(CLOSE_GRACE);
    }

    public boolean isAccepting() {
        return accepting;
    }

    // ---- worker ----

    private void runWorker() {
        log.info("Operation queue worker started (maxDepth: {}, maxAttempts: {})",
            config.maxDepth(), retryPolicy.getMaxAttempts());
        try {
            while (running) {
                QueuedOperation operation = pending.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (operation == null) {
                    continue;
                }
                slot.acquire();
                try {
                    process(operation);
                } catch (RuntimeException e) {
                    abort(operation, e);
                } finally {
                    slot.release();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Operation queue worker stopped");
    }

    private void process(QueuedOperation operation) {
        synchronized (stateLock) {
            if (operation.state() != OperationState.PENDING) {
                return;
            }
            operation.beginAttempt(clock.instant());
        }

        ScriptCommand command = operation.command();
        long startNanos = System.nanoTime();
        while (true) {
            int attempt = operation.attempts();
            ExecutionResult result = executeSafely(command);

            if (result.success()) {
                int invalidated = CacheInvalidationRules.apply(command.mutation(), cache);
                log.debug("'{}' succeeded; {} cache entries invalidated", command.label(), invalidated);
                complete(operation, OperationState.SUCCEEDED, result, attempt, startNanos);
                return;
            }
            if (!retryPolicy.shouldRetry(result, attempt)) {
                complete(operation, OperationState.FAILED, result, attempt, startNanos);
                return;
            }

            long delayMs = retryPolicy.backoffMillis(attempt);
            synchronized (stateLock) {
                operation.markRetrying();
            }
            log.warn("'{}' failed with {} (attempt {}/{}), retrying in {} ms",
                command.label(), result.errorKind(), attempt, retryPolicy.getMaxAttempts(), delayMs);
            if (result.errorKind() == ErrorKind.TIMEOUT && !command.idempotent()) {
                log.warn("'{}' is not idempotent; the timed-out attempt may already have applied {}",
                    command.label(), command.mutation());
            }
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                complete(operation, OperationState.FAILED, result, attempt, startNanos);
                return;
            }
            synchronized (stateLock) {
                operation.beginAttempt(clock.instant());
            }
        }
    }

    private ExecutionResult executeSafely(ScriptCommand command) {
        try {
            return executor.execute(command, config.commandTimeout());
        } catch (RuntimeException e) {
            log.error("Executor threw for '{}'", command.label(), e);
            return ExecutionResult.failure(ScriptError.of(ErrorKind.UNKNOWN, "Executor failed: " + e), 0);
        }
    }

    private void complete(QueuedOperation operation, OperationState terminal, ExecutionResult result,
                          int attempts, long startNanos) {
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        ExecutionResult finalResult = result.withAttempts(attempts)
            .withLatencyMillis(Math.max(elapsedMillis, result.latencyMillis()));

        synchronized (stateLock) {
            operation.finish(terminal, finalResult, clock.instant());
            active--;
            if (terminal == OperationState.SUCCEEDED) {
                succeeded++;
            } else {
                failed++;
                failureCounts.merge(finalResult.errorKind(), 1L, Long::sum);
            }
        }
        operation.future().complete(finalResult);

        if (terminal == OperationState.FAILED) {
            log.info("'{}' failed after {} attempt(s): {} {}", operation.command().label(), attempts,
                finalResult.errorKind(), finalResult.error().message());
        }
    }

    /**
     * 처리 중 예기치 않은 예외: 해당 Operation만 UNKNOWN으로 실패 처리하고 워커는 계속 돕니다.
     */
    private void abort(QueuedOperation operation, RuntimeException cause) {
        log.error("Unexpected failure while processing '{}'", operation.command().label(), cause);
        boolean unresolved;
        ExecutionResult result;
        synchronized (stateLock) {
            unresolved = !operation.state().isTerminal();
            result = ExecutionResult.failure(
                ScriptError.of(ErrorKind.UNKNOWN, "Operation failed unexpectedly: " + cause),
                0
            ).withAttempts(Math.max(1, operation.attempts()));
            if (unresolved) {
                operation.abort(result, clock.instant());
                active--;
                failed++;
                failureCounts.merge(ErrorKind.UNKNOWN, 1L, Long::sum);
            }
        }
        if (unresolved) {
            operation.future().complete(result);
        }
    }

    private void pruneRetained(Instant now) {
        Duration retention = config.retention();
        operations.values().removeIf(operation -> operation.state().isTerminal()
            && !operation.finishedAt().plus(retention).isAfter(now));
    }
}
