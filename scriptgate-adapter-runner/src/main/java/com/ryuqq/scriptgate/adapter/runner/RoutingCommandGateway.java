package com.ryuqq.scriptgate.adapter.runner;

import com.ryuqq.scriptgate.application.gateway.CommandGateway;
import com.ryuqq.scriptgate.application.gateway.OperationHandle;
import com.ryuqq.scriptgate.application.queue.OperationQueue;
import com.ryuqq.scriptgate.application.queue.QueueStatus;
import com.ryuqq.scriptgate.core.contract.ResultShape;
import com.ryuqq.scriptgate.core.contract.ScriptCommand;
import com.ryuqq.scriptgate.core.executor.ScriptExecutor;
import com.ryuqq.scriptgate.core.model.OperationId;
import com.ryuqq.scriptgate.core.model.Priority;
import com.ryuqq.scriptgate.core.result.ExecutionResult;
import com.ryuqq.scriptgate.core.spi.ResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 접근 모드에 따라 캐시 / Executor / 큐로 명령을 나누는 CommandGateway 구현체.
 *
 * <p><strong>의존성:</strong></p>
 * <ul>
 *   <li>readExecutor: 읽기 경로용 Executor ({@link RetryingScriptExecutor}로 감싼 것)</li>
 *   <li>cache: READ 결과 캐시 (쓰기 성공 시 큐가 같은 캐시를 무효화)</li>
 *   <li>queue: 쓰기 전용 단일 실행 큐</li>
 * </ul>
 *
 * <p><strong>구성 예시:</strong></p>
 * <pre>
 * IsolatedScriptExecutor isolated = new IsolatedScriptExecutor(new OsascriptEngine());
 * ResultCache&lt;ExecutionResult&gt; cache = new InMemoryResultCache&lt;&gt;(Clock.systemUTC());
 * SingleFlightOperationQueue queue = new SingleFlightOperationQueue(isolated, cache, new QueueConfig());
 *
 * CommandGateway gateway = new RoutingCommandGateway(
 *     new RetryingScriptExecutor(isolated, new ExecutorConfig()),
 *     cache, queue, new ExecutorConfig(), new GatewayConfig()
 * );
 * </pre>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public class RoutingCommandGateway implements CommandGateway {

    private static final Logger log = LoggerFactory.getLogger(RoutingCommandGateway.class);

    private static final String RUNNING_CHECK_LABEL = "is_application_running";

    private final ScriptExecutor readExecutor;
    private final ResultCache<ExecutionResult> cache;
    private final OperationQueue queue;
    private final Duration readTimeout;
    private final GatewayConfig config;

    /**
     * @param readExecutor 읽기 경로 Executor
     * @param cache READ 결과 캐시
     * @param queue 쓰기 큐
     * @param executorConfig 읽기 타임아웃 ({@code defaultTimeoutMs})
     * @param config Gateway 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RoutingCommandGateway(
        ScriptExecutor readExecutor,
        ResultCache<ExecutionResult> cache,
        OperationQueue queue,
        ExecutorConfig executorConfig,
        GatewayConfig config
    ) {
        if (readExecutor == null) {
            throw new IllegalArgumentException("readExecutor cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (executorConfig == null) {
            throw new IllegalArgumentException("executorConfig cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.readExecutor = readExecutor;
        this.cache = cache;
        this.queue = queue;
        this.readTimeout = executorConfig.defaultTimeout();
        this.config = config;
    }

    @Override
    public OperationHandle submit(ScriptCommand command, Priority priority) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (command.isWrite()) {
            return queue.enqueue(command, priority == null ? Priority.NORMAL : priority);
        }
        return OperationHandle.completed(OperationId.generate(), read(command));
    }

    @Override
    public ExecutionResult read(ScriptCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (!command.isRead()) {
            throw new IllegalArgumentException("read() requires a READ command (label: " + command.label() + ")");
        }

        if (command.isCacheable()) {
            return cache.getOrCompute(
                command.cacheKey(),
                config.defaultReadTtl(),
                () -> readExecutor.execute(command, readTimeout),
                ExecutionResult::success
            );
        }
        return readExecutor.execute(command, readTimeout);
    }

    @Override
    public OperationHandle write(ScriptCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (!command.isWrite()) {
            throw new IllegalArgumentException("write() requires a WRITE command (label: " + command.label() + ")");
        }
        return queue.enqueue(command, Priority.NORMAL);
    }

    @Override
    public QueueStatus queueStatus() {
        return queue.status();
    }

    @Override
    public boolean isApplicationRunning() {
        ScriptCommand runningCheck = ScriptCommand.read(RUNNING_CHECK_LABEL, config.applicationRunningScript())
            .withResultShape(ResultShape.BOOLEAN);
        ExecutionResult result = readExecutor.execute(runningCheck, readTimeout);
        if (!result.success()) {
            log.debug("Running check for {} failed: {}", config.applicationName(), result.errorKind());
            return false;
        }
        return "true".equalsIgnoreCase(result.output().trim());
    }
}
