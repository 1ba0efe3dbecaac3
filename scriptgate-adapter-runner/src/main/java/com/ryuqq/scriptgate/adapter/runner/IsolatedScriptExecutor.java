package com.ryuqq.scriptgate.adapter.runner;

import com.ryuqq.scriptgate.core.contract.ScriptCommand;
import com.ryuqq.scriptgate.core.executor.ExecutorStats;
import com.ryuqq.scriptgate.core.executor.ScriptErrorClassifier;
import com.ryuqq.scriptgate.core.executor.ScriptExecutor;
import com.ryuqq.scriptgate.core.result.ErrorKind;
import com.ryuqq.scriptgate.core.result.ExecutionResult;
import com.ryuqq.scriptgate.core.result.ScriptError;
import com.ryuqq.scriptgate.core.spi.EngineResponse;
import com.ryuqq.scriptgate.core.spi.ScriptEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * 호출마다 별도 워커 스레드에서 엔진을 실행하는 ScriptExecutor 구현체.
 *
 * <p>호출자 스레드는 하드 타임아웃까지만 기다립니다. 엔진이 응답하지 않으면 워커를
 * 인터럽트하고(프로세스 어댑터는 자식 프로세스를 강제 종료) TIMEOUT 실패를 반환합니다.
 * WRITE 명령은 중단된 엔진 호출이 실제로 끝난 뒤에 TIMEOUT을 반환합니다 (최대 backstop + 1초).</p>
 *
 * <p><strong>결과 매핑:</strong></p>
 * <ul>
 *   <li>정상 종료 + 출력이 ResultShape에 맞음 → 성공</li>
 *   <li>비정상 종료 / {@code error:} 출력 → {@link ScriptErrorClassifier} 분류</li>
 *   <li>출력이 ResultShape에 맞지 않음 → UNEXPECTED_RESULT</li>
 *   <li>엔진 시작 실패(IOException) → APPLICATION_UNAVAILABLE</li>
 *   <li>하드 타임아웃 초과 → TIMEOUT</li>
 * </ul>
 *
 * <p>예외를 던지지 않고 항상 ExecutionResult를 반환합니다 (인자 오류 제외).
 * 재시도는 하지 않습니다 ({@link RetryingScriptExecutor} 또는 큐의 책임).</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public class IsolatedScriptExecutor implements ScriptExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IsolatedScriptExecutor.class);

    /** 엔진 자체 backstop은 하드 타임아웃보다 늦게 발동해야 함 */
    private static final Duration ENGINE_BACKSTOP_GRACE = Duration.ofSeconds(1);

    private static final AtomicInteger WORKER_SEQUENCE = new AtomicInteger();

    private final ScriptEngine engine;
    private final ScriptErrorClassifier classifier;
    private final ExecutorService workers;

    private final LongAdder calls = new LongAdder();
    private final LongAdder totalLatencyMillis = new LongAdder();
    private final Map<ErrorKind, LongAdder> failures = new ConcurrentHashMap<>();

    public IsolatedScriptExecutor(ScriptEngine engine) {
        this(engine, new ScriptErrorClassifier());
    }

    /**
     * @param engine 스크립트 엔진
     * @param classifier 오류 분류기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public IsolatedScriptExecutor(ScriptEngine engine, ScriptErrorClassifier classifier) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        this.engine = engine;
        this.classifier = classifier;
        this.workers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "scriptgate-exec-" + WORKER_SEQUENCE.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public ExecutionResult execute(ScriptCommand command, Duration timeout) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }

        long startNanos = System.nanoTime();
        ExecutionResult result = run(command, timeout, startNanos);
        track(command, result);
        return result;
    }

    private ExecutionResult run(ScriptCommand command, Duration timeout, long startNanos) {
        Duration backstop = timeout.plus(ENGINE_BACKSTOP_GRACE);
        EngineCall engineCall = new EngineCall(engine, command.script(), backstop);
        Future<EngineResponse> call;
        try {
            call = workers.submit(engineCall);
        } catch (RejectedExecutionException e) {
            return ExecutionResult.failure(ScriptError.of(ErrorKind.UNKNOWN, "Executor is closed"), 0);
        }
        try {
            EngineResponse response = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return interpret(command, response, elapsedMillis(startNanos));
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Script '{}' timed out after {} ms", command.label(), timeout.toMillis());
            if (command.isWrite()) {
                awaitSettled(command, engineCall, backstop.plus(ENGINE_BACKSTOP_GRACE));
            }
            return ExecutionResult.failure(
                ScriptError.of(ErrorKind.TIMEOUT, "Script '" + command.label() + "' timed out after " + timeout.toMillis() + " ms"),
                elapsedMillis(startNanos)
            );
        } catch (ExecutionException e) {
            return fromEngineException(command, e.getCause(), elapsedMillis(startNanos));
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return ExecutionResult.failure(
                ScriptError.of(ErrorKind.UNKNOWN, "Interrupted while waiting for script '" + command.label() + "'"),
                elapsedMillis(startNanos)
            );
        }
    }

    /**
     * 중단된 쓰기 호출이 엔진에서 실제로 빠져나올 때까지 대기.
     *
     * <p>쓰기 큐는 이 메서드가 반환된 뒤에야 다음 변경을 시작하므로, 엔진 안에서 두 변경이 겹치지 않습니다.</p>
     */
    private void awaitSettled(ScriptCommand command, EngineCall engineCall, Duration limit) {
        try {
            if (!engineCall.awaitSettled(limit)) {
                log.error("Script '{}' still inside the engine {} ms after cancellation",
                    command.label(), limit.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ExecutionResult interpret(ScriptCommand command, EngineResponse response, long latencyMillis) {
        Optional<ScriptError> error = classifier.classify(response);
        if (error.isPresent()) {
            return ExecutionResult.failure(error.get(), response.stdout(), latencyMillis);
        }
        String output = response.stdout();
        if (!command.resultShape().accepts(output)) {
            return ExecutionResult.failure(
                ScriptError.of(ErrorKind.UNEXPECTED_RESULT,
                    "Script '" + command.label() + "' returned output not matching " + command.resultShape()),
                output,
                latencyMillis
            );
        }
        return ExecutionResult.ok(output, latencyMillis);
    }

    private ExecutionResult fromEngineException(ScriptCommand command, Throwable cause, long latencyMillis) {
        if (cause instanceof IOException) {
            log.warn("Script engine could not be started for '{}': {}", command.label(), cause.getMessage());
            return ExecutionResult.failure(
                ScriptError.of(ErrorKind.APPLICATION_UNAVAILABLE, "Failed to start script engine: " + cause.getMessage()),
                latencyMillis
            );
        }
        log.error("Script engine failed unexpectedly for '{}'", command.label(), cause);
        return ExecutionResult.failure(
            ScriptError.of(ErrorKind.UNKNOWN, "Script engine failed: " + cause),
            latencyMillis
        );
    }

    private void track(ScriptCommand command, ExecutionResult result) {
        calls.increment();
        totalLatencyMillis.add(result.latencyMillis());
        if (result.success()) {
            log.debug("Script '{}' succeeded in {} ms", command.label(), result.latencyMillis());
            return;
        }
        ErrorKind kind = result.errorKind();
        failures.computeIfAbsent(kind, k -> new LongAdder()).increment();
        if (kind == ErrorKind.PERMISSION_DENIED) {
            log.warn("Script '{}' denied: {}", command.label(), result.error().message());
        } else {
            log.debug("Script '{}' failed in {} ms: {} {}", command.label(), result.latencyMillis(),
                kind, result.error().message());
        }
    }

    /**
     * 누적 통계 스냅샷.
     */
    public ExecutorStats stats() {
        Map<ErrorKind, Long> counts = new EnumMap<>(ErrorKind.class);
        failures.forEach((kind, count) -> counts.put(kind, count.sum()));
        return new ExecutorStats(calls.sum(), counts, totalLatencyMillis.sum());
    }

    /**
     * 워커 스레드 정리. 실행 중인 호출은 인터럽트됩니다.
     */
    @Override
    public void close() {
        workers.shutdownNow();
    }

    /**
     * 엔진 호출 하나. 시작 전에 취소되었는지, 시작했다면 끝났는지를 추적합니다.
     */
    private static final class EngineCall implements Callable<EngineResponse> {

        private static final int NEW = 0;
        private static final int RUNNING = 1;
        private static final int SETTLED = 2;

        private final ScriptEngine engine;
        private final String script;
        private final Duration backstop;
        private final AtomicInteger phase = new AtomicInteger(NEW);
        private final CountDownLatch settled = new CountDownLatch(1);

        EngineCall(ScriptEngine engine, String script, Duration backstop) {
            this.engine = engine;
            this.script = script;
            this.backstop = backstop;
        }

        @Override
        public EngineResponse call() throws Exception {
            if (!phase.compareAndSet(NEW, RUNNING)) {
                throw new CancellationException("Engine call abandoned before start");
            }
            try {
                return engine.run(script, backstop);
            } finally {
                phase.set(SETTLED);
                settled.countDown();
            }
        }

        boolean awaitSettled(Duration limit) throws InterruptedException {
            if (phase.compareAndSet(NEW, SETTLED)) {
                return true;
            }
            return settled.await(limit.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
