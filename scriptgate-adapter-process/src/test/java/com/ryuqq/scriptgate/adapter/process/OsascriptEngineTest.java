package com.ryuqq.scriptgate.adapter.process;

import com.ryuqq.scriptgate.core.spi.EngineResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * OsascriptEngine 테스트.
 *
 * <p>실제 osascript 대신 {@code -e} 인자를 셸로 평가하는 가짜 실행 파일을 사용합니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class OsascriptEngineTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private Path fakeBinary;

    @BeforeEach
    void setUp() throws IOException {
        fakeBinary = tempDir.resolve("fake-osascript");
        Files.writeString(fakeBinary, String.join("\n",
            "#!/bin/sh",
            "[ \"$1\" = \"-e\" ] || { echo \"usage: fake-osascript -e script\" >&2; exit 2; }",
            "eval \"$2\"",
            ""
        ), StandardCharsets.UTF_8);
        assertThat(fakeBinary.toFile().setExecutable(true)).isTrue();
    }

    @Test
    void 명령행은_binary_e_script() {
        // given
        OsascriptEngine engine = new OsascriptEngine();

        // when & then
        assertThat(engine.command("tell application \"Things3\" to get name"))
            .containsExactly("osascript", "-e", "tell application \"Things3\" to get name");
        assertThat(engine.getBinary()).isEqualTo(OsascriptEngine.DEFAULT_BINARY);
    }

    @Test
    void 성공_출력은_마지막_개행을_제거하여_반환() throws Exception {
        // given
        OsascriptEngine engine = new OsascriptEngine(fakeBinary.toString());

        // when
        EngineResponse response = engine.run("printf 'ABC123\\n'", TIMEOUT);

        // then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.stdout()).isEqualTo("ABC123");
        assertThat(response.stderr()).isEmpty();
    }

    @Test
    void 실패시_종료코드와_stderr를_그대로_반환() throws Exception {
        // given
        OsascriptEngine engine = new OsascriptEngine(fakeBinary.toString());

        // when
        EngineResponse response = engine.run(
            "echo \"execution error: Can't get to do id \\\"X\\\". (-1728)\" >&2; exit 1", TIMEOUT
        );

        // then
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.exitCode()).isEqualTo(1);
        assertThat(response.timedOut()).isFalse();
        assertThat(response.stderr()).contains("(-1728)");
    }

    @Test
    void backstop_timeout_초과시_프로세스_종료() throws Exception {
        // given
        OsascriptEngine engine = new OsascriptEngine(fakeBinary.toString());
        long start = System.nanoTime();

        // when
        EngineResponse response = engine.run("exec sleep 5", Duration.ofMillis(200));

        // then
        assertThat(response.timedOut()).isTrue();
        assertThat(response.isSuccess()).isFalse();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(4_000L);
    }

    @Test
    void 인터럽트되면_InterruptedException_전파() throws Exception {
        // given
        OsascriptEngine engine = new OsascriptEngine(fakeBinary.toString());
        ExecutorService pool = Executors.newSingleThreadExecutor();
        CompletableFuture<Throwable> outcome = new CompletableFuture<>();
        try {
            Future<?> call = pool.submit(() -> {
                try {
                    engine.run("exec sleep 5", TIMEOUT);
                    outcome.complete(null);
                } catch (Exception e) {
                    outcome.complete(e);
                }
            });
            Thread.sleep(200);

            // when
            call.cancel(true);

            // then
            assertThat(outcome.get(4, TimeUnit.SECONDS)).isInstanceOf(InterruptedException.class);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void 출력은_최대_바이트까지만_보관() throws Exception {
        // given
        OsascriptEngine engine = new OsascriptEngine(fakeBinary.toString(), 16);

        // when
        EngineResponse response = engine.run("i=0; while [ $i -lt 100 ]; do printf 'abcdefghij'; i=$((i+1)); done", TIMEOUT);

        // then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.stdout()).hasSize(16).isEqualTo("abcdefghijabcdef");
    }

    @Test
    void 실행_파일이_없으면_IOException() {
        // given
        OsascriptEngine engine = new OsascriptEngine(tempDir.resolve("missing-binary").toString());

        // when & then
        assertThatThrownBy(() -> engine.run("return 1", TIMEOUT))
            .isInstanceOf(IOException.class);
    }

    @Test
    void 잘못된_인자는_예외() {
        assertThatThrownBy(() -> new OsascriptEngine(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("binary cannot be null or blank");
        assertThatThrownBy(() -> new OsascriptEngine("osascript", 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be positive");
        assertThatThrownBy(() -> new OsascriptEngine().run("return 1", Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
