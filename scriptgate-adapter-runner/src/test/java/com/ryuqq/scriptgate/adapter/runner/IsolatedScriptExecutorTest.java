package com.ryuqq.scriptgate.adapter.runner;

import com.ryuqq.scriptgate.core.contract.Mutation;
import com.ryuqq.scriptgate.core.contract.ResultShape;
import com.ryuqq.scriptgate.core.contract.ScriptCommand;
import com.ryuqq.scriptgate.core.executor.ExecutorStats;
import com.ryuqq.scriptgate.core.result.ErrorKind;
import com.ryuqq.scriptgate.core.result.ExecutionResult;
import com.ryuqq.scriptgate.core.spi.EngineResponse;
import com.ryuqq.scriptgate.testkit.FakeScriptEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * IsolatedScriptExecutor 유닛 테스트.
 *
 * <p>FakeScriptEngine으로 엔진 응답, 지연, 시작 실패를 흉내냅니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
class IsolatedScriptExecutorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private FakeScriptEngine engine;
    private IsolatedScriptExecutor executor;

    private final ScriptCommand getTodos = ScriptCommand.read("get_todos", "tell application \"Things3\" to get name of to dos");

    @BeforeEach
    void setUp() {
        engine = new FakeScriptEngine();
        executor = new IsolatedScriptExecutor(engine);
    }

    @AfterEach
    void tearDown() {
        engine.release();
        executor.close();
    }

    @Test
    void 정상_응답은_성공() {
        // given
        engine.respondByDefault(EngineResponse.success("Buy milk, Call mom"));

        // when
        ExecutionResult result = executor.execute(getTodos, TIMEOUT);

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("Buy milk, Call mom");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(engine.lastScript()).isEqualTo(getTodos.script());
    }

    @Test
    void 응답하지_않는_엔진은_하드_타임아웃() throws Exception {
        // given
        engine.hold();

        // when
        long start = System.nanoTime();
        ExecutionResult result = executor.execute(getTodos, Duration.ofMillis(150));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        // then
        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(result.error().message()).contains("get_todos").contains("150 ms");
        assertThat(result.latencyMillis()).isGreaterThanOrEqualTo(150);
        assertThat(elapsedMillis).isLessThan(3000);
    }

    @Test
    void 타임아웃된_호출은_인터럽트되어_엔진에서_빠져나감() throws Exception {
        // given
        engine.hold();

        // when
        executor.execute(getTodos, Duration.ofMillis(100));

        // then
        long deadline = System.nanoTime() + Duration.ofSeconds(2).toNanos();
        while (engine.inFlight() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(engine.inFlight()).isZero();
    }

    @Test
    void 쓰기_타임아웃은_엔진_호출이_실제로_끝난_뒤_반환() {
        // given
        ScriptCommand rename = ScriptCommand.write(
            "rename_todo", "tell application \"Things3\" to rename to do id \"A\" to \"x\"",
            Mutation.of("todo.update", "A")
        );
        engine.enqueue(script -> {
            long until = System.nanoTime() + Duration.ofMillis(400).toNanos();
            while (System.nanoTime() < until) {
                try {
                    Thread.sleep(Math.max(1, (until - System.nanoTime()) / 1_000_000L));
                } catch (InterruptedException e) {
                    // keeps working like an engine that cannot be aborted
                }
            }
            return EngineResponse.success("late");
        });

        // when
        ExecutionResult result = executor.execute(rename, Duration.ofMillis(100));

        // then
        assertThat(result.errorKind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(engine.inFlight()).isZero();
        assertThat(result.latencyMillis()).isGreaterThanOrEqualTo(400);
    }

    @Test
    void 엔진_시작_실패는_애플리케이션_미실행() {
        // given
        engine.enqueueSpawnFailure("Cannot run program \"osascript\"");

        // when
        ExecutionResult result = executor.execute(getTodos, TIMEOUT);

        // then
        assertThat(result.errorKind()).isEqualTo(ErrorKind.APPLICATION_UNAVAILABLE);
        assertThat(result.isTransientFailure()).isTrue();
        assertThat(result.error().message()).contains("Failed to start script engine");
    }

    @Test
    void 엔진_오류_번호로_분류() {
        // given
        engine.enqueue(EngineResponse.failure(1,
            "execution error: Things3 got an error: Can't get to do id \"X\". (-1728)"));

        // when
        ExecutionResult result = executor.execute(getTodos, TIMEOUT);

        // then
        assertThat(result.errorKind()).isEqualTo(ErrorKind.REFERENCE_NOT_FOUND);
        assertThat(result.isTransientFailure()).isFalse();
    }

    @Test
    void error_접두사_출력은_종료_코드가_0이어도_실패() {
        // given
        engine.enqueue(EngineResponse.success("error: Things3 got an error: Application isn't running. (-600)"));

        // when
        ExecutionResult result = executor.execute(getTodos, TIMEOUT);

        // then
        assertThat(result.errorKind()).isEqualTo(ErrorKind.APPLICATION_UNAVAILABLE);
    }

    @Test
    void 기대_형태와_다른_출력은_UNEXPECTED_RESULT() {
        // given
        ScriptCommand runningCheck = ScriptCommand.read("is_running", "application \"Things3\" is running")
            .withResultShape(ResultShape.BOOLEAN);
        engine.enqueue(EngineResponse.success("maybe"));

        // when
        ExecutionResult result = executor.execute(runningCheck, TIMEOUT);

        // then
        assertThat(result.errorKind()).isEqualTo(ErrorKind.UNEXPECTED_RESULT);
        assertThat(result.output()).isEqualTo("maybe");
    }

    @Test
    void 엔진_런타임_예외는_UNKNOWN() {
        // given
        engine.enqueue(script -> {
            throw new IllegalStateException("engine bug");
        });

        // when
        ExecutionResult result = executor.execute(getTodos, TIMEOUT);

        // then
        assertThat(result.errorKind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(result.error().message()).contains("engine bug");
    }

    @Test
    void 호출은_서로_병렬로_실행() throws Exception {
        // given
        engine.hold();
        Thread first = new Thread(() -> executor.execute(getTodos, TIMEOUT));
        Thread second = new Thread(() -> executor.execute(getTodos, TIMEOUT));

        // when
        first.start();
        second.start();

        // then
        assertThat(engine.awaitInFlight(2, Duration.ofSeconds(2))).isTrue();
        engine.release();
        first.join(2000);
        second.join(2000);
        assertThat(engine.maxConcurrency()).isEqualTo(2);
    }

    @Test
    void 통계는_호출과_실패_종류를_누적() {
        // given
        engine.enqueue(
            EngineResponse.success("ok"),
            EngineResponse.failure(1, "execution error: Expected end of line. (-2741)"),
            EngineResponse.failure(1, "execution error: Expected end of line. (-2741)")
        );

        // when
        executor.execute(getTodos, TIMEOUT);
        executor.execute(getTodos, TIMEOUT);
        executor.execute(getTodos, TIMEOUT);
        ExecutorStats stats = executor.stats();

        // then
        assertThat(stats.calls()).isEqualTo(3);
        assertThat(stats.failures()).containsEntry(ErrorKind.SYNTAX, 2L);
    }

    @Test
    void 닫힌_Executor는_UNKNOWN_실패() {
        // given
        executor.close();

        // when
        ExecutionResult result = executor.execute(getTodos, TIMEOUT);

        // then
        assertThat(result.errorKind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(engine.calls()).isZero();
    }

    @Test
    void 잘못된_인자는_예외() {
        assertThatThrownBy(() -> executor.execute(null, TIMEOUT))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> executor.execute(getTodos, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeout must be positive");
        assertThatThrownBy(() -> new IsolatedScriptExecutor(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
