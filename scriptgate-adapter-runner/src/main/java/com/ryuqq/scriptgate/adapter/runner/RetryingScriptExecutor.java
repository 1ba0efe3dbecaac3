package com.ryuqq.scriptgate.adapter.runner;

import com.ryuqq.scriptgate.core.contract.ScriptCommand;
import com.ryuqq.scriptgate.core.executor.ScriptExecutor;
import com.ryuqq.scriptgate.core.result.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 일시적 실패를 재시도하는 ScriptExecutor 데코레이터 (읽기 경로 전용).
 *
 * <p>쓰기는 큐가 직접 재시도하므로 이 데코레이터를 거치지 않습니다.
 * 두 계층이 겹치면 시도 횟수가 곱해집니다.</p>
 *
 * <p>반환 결과의 {@code attempts}는 실제 시도 횟수, {@code latencyMillis}는 백오프를 포함한 총 경과 시간입니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public class RetryingScriptExecutor implements ScriptExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryingScriptExecutor.class);

    private final ScriptExecutor delegate;
    private final RetryPolicy retryPolicy;

    public RetryingScriptExecutor(ScriptExecutor delegate, ExecutorConfig config) {
        this(delegate, RetryPolicy.from(config));
    }

    public RetryingScriptExecutor(ScriptExecutor delegate, RetryPolicy retryPolicy) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        this.delegate = delegate;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public ExecutionResult execute(ScriptCommand command, Duration timeout) {
        long startNanos = System.nanoTime();
        int attempt = 0;
        while (true) {
            attempt++;
            ExecutionResult result = delegate.execute(command, timeout);
            if (!retryPolicy.shouldRetry(result, attempt)) {
                return finish(result, attempt, startNanos);
            }

            long delayMs = retryPolicy.backoffMillis(attempt);
            log.warn("Script '{}' failed with {} (attempt {}/{}), retrying in {} ms",
                command.label(), result.errorKind(), attempt, retryPolicy.getMaxAttempts(), delayMs);
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return finish(result, attempt, startNanos);
            }
        }
    }

    private static ExecutionResult finish(ExecutionResult result, int attempts, long startNanos) {
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        return result.withAttempts(attempts).withLatencyMillis(Math.max(elapsedMillis, result.latencyMillis()));
    }
}
