package com.ryuqq.scriptgate.core.spi;

import java.io.IOException;
import java.time.Duration;

/**
 * Script engine SPI: runs one script against the external application.
 *
 * <p>Implementations perform exactly one engine invocation per call and hold no
 * state between calls. Concurrency control, retries and classification of failures
 * are the caller's concern.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: reads call the engine concurrently with the running write</li>
 *   <li>Interruptible: an interrupted caller must release the engine promptly
 *       (a process-backed engine destroys its child process)</li>
 *   <li>Bounded: {@code timeout} is a backstop; the engine must not block past it</li>
 * </ul>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public interface ScriptEngine {

    /**
     * Runs a script and captures its outcome.
     *
     * @param script the script text
     * @param timeout backstop timeout for this single invocation
     * @return exit code with captured stdout/stderr
     * @throws IOException if the engine cannot be started
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    EngineResponse run(String script, Duration timeout) throws IOException, InterruptedException;
}
