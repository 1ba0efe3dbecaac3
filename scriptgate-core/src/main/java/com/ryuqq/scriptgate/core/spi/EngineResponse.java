package com.ryuqq.scriptgate.core.spi;

/**
 * Raw outcome of one engine invocation.
 *
 * @param exitCode process exit code (0 on success)
 * @param stdout captured standard output, never null
 * @param stderr captured standard error, never null
 * @param timedOut true if the engine gave up at its backstop timeout
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record EngineResponse(int exitCode, String stdout, String stderr, boolean timedOut) {

    public EngineResponse {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static EngineResponse success(String stdout) {
        return new EngineResponse(0, stdout, "", false);
    }

    public static EngineResponse failure(int exitCode, String stderr) {
        return new EngineResponse(exitCode, "", stderr, false);
    }

    public static EngineResponse timeout() {
        return new EngineResponse(-1, "", "", true);
    }

    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }
}
