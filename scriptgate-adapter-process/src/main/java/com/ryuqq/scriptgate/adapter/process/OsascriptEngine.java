package com.ryuqq.scriptgate.adapter.process;

import com.ryuqq.scriptgate.core.spi.EngineResponse;
import com.ryuqq.scriptgate.core.spi.ScriptEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@code osascript} 프로세스 기반 ScriptEngine 구현체.
 *
 * <p>호출마다 {@code osascript -e <script>} 프로세스를 하나 띄우고 종료 코드와 stdout/stderr를
 * 그대로 돌려줍니다. 오류 분류는 하지 않습니다 (상위 Executor 책임).</p>
 *
 * <p><strong>프로세스 수명:</strong></p>
 * <ul>
 *   <li>stdin은 즉시 닫힘 (스크립트는 인자로만 전달)</li>
 *   <li>stdout/stderr는 별도 스레드에서 읽어 파이프가 가득 차 멈추지 않도록 함</li>
 *   <li>backstop timeout 초과 시 강제 종료 후 {@link EngineResponse#timeout()}</li>
 *   <li>호출 스레드가 인터럽트되면 자식 프로세스를 강제 종료하고 InterruptedException 전파</li>
 * </ul>
 *
 * <p>출력은 스트림당 {@code maxOutputBytes}까지만 보관하고 나머지는 버립니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public class OsascriptEngine implements ScriptEngine {

    private static final Logger log = LoggerFactory.getLogger(OsascriptEngine.class);

    public static final String DEFAULT_BINARY = "osascript";
    public static final int DEFAULT_MAX_OUTPUT_BYTES = 4 * 1024 * 1024;

    private static final Duration DESTROY_GRACE = Duration.ofSeconds(1);
    private static final AtomicInteger READER_SEQUENCE = new AtomicInteger();
    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "osascript-stream-" + READER_SEQUENCE.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final String binary;
    private final int maxOutputBytes;

    /**
     * PATH의 {@code osascript}를 사용.
     */
    public OsascriptEngine() {
        this(DEFAULT_BINARY);
    }

    public OsascriptEngine(String binary) {
        this(binary, DEFAULT_MAX_OUTPUT_BYTES);
    }

    /**
     * @param binary 실행 파일 경로
     * @param maxOutputBytes 스트림당 보관할 최대 바이트 수
     * @throws IllegalArgumentException binary가 비었거나 maxOutputBytes가 양수가 아닌 경우
     */
    public OsascriptEngine(String binary, int maxOutputBytes) {
        if (binary == null || binary.isBlank()) {
            throw new IllegalArgumentException("binary cannot be null or blank");
        }
        if (maxOutputBytes <= 0) {
            throw new IllegalArgumentException("maxOutputBytes must be positive (current: " + maxOutputBytes + ")");
        }
        this.binary = binary;
        this.maxOutputBytes = maxOutputBytes;
    }

    @Override
    public EngineResponse run(String script, Duration timeout) throws IOException, InterruptedException {
        if (script == null) {
            throw new IllegalArgumentException("script cannot be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }

        long startNanos = System.nanoTime();
        Process process = new ProcessBuilder(command(script)).start();
        process.getOutputStream().close();

        CompletableFuture<String> stdout = collect(process.getInputStream());
        CompletableFuture<String> stderr = collect(process.getErrorStream());

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroy(process);
                log.warn("{} did not exit within {} ms; process destroyed", binary, timeout.toMillis());
                return EngineResponse.timeout();
            }
        } catch (InterruptedException e) {
            destroy(process);
            log.debug("{} interrupted; process destroyed", binary);
            throw e;
        }

        int exitCode = process.exitValue();
        EngineResponse response = new EngineResponse(exitCode, drain(stdout), drain(stderr), false);
        log.debug("{} exited with {} in {} ms", binary, exitCode,
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        return response;
    }

    /**
     * 실행할 명령행.
     */
    List<String> command(String script) {
        List<String> command = new ArrayList<>(3);
        command.add(binary);
        command.add("-e");
        command.add(script);
        return command;
    }

    public String getBinary() {
        return binary;
    }

    private CompletableFuture<String> collect(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return readBounded(in);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, STREAM_READERS);
    }

    private String readBounded(InputStream in) throws IOException {
        ByteArrayOutputStream kept = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        long discarded = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            int room = maxOutputBytes - kept.size();
            kept.write(buffer, 0, Math.min(room, read));
            if (read > room) {
                discarded += read - room;
            }
        }
        if (discarded > 0) {
            log.warn("{} output truncated ({} bytes discarded)", binary, discarded);
        }
        return stripTrailingNewline(kept.toString(StandardCharsets.UTF_8));
    }

    private String drain(CompletableFuture<String> output) throws IOException, InterruptedException {
        try {
            return output.get(DESTROY_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // a grandchild process may still hold the pipe open
            output.cancel(true);
            log.warn("{} output stream not closed after exit; output discarded", binary);
            return "";
        } catch (ExecutionException e) {
            if (e.getCause() instanceof UncheckedIOException io) {
                throw io.getCause();
            }
            throw new IOException("Failed to read " + binary + " output", e.getCause());
        }
    }

    private static void destroy(Process process) {
        process.destroyForcibly();
        try {
            process.waitFor(DESTROY_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String stripTrailingNewline(String text) {
        if (text.endsWith("\r\n")) {
            return text.substring(0, text.length() - 2);
        }
        if (text.endsWith("\n")) {
            return text.substring(0, text.length() - 1);
        }
        return text;
    }
}
