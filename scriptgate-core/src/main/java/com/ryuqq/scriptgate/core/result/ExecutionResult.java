package com.ryuqq.scriptgate.core.result;

/**
 * 스크립트 실행 결과.
 *
 * <p>Executor 호출 1회(또는 큐 Operation 1건)마다 정확히 하나 생성됩니다.
 * 예상 가능한 애플리케이션 수준 실패는 예외가 아니라 {@code success=false} 결과로 표현됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>success=true → error는 null</li>
 *   <li>success=false → error는 non-null</li>
 * </ul>
 *
 * @param success 성공 여부
 * @param output 엔진 원본 출력 (실패 시 빈 문자열일 수 있음, null 불가)
 * @param error 분류된 오류 (성공 시 null)
 * @param latencyMillis 실행 소요 시간 (밀리초, 0 이상)
 * @param attempts 시도 횟수 (1 이상)
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record ExecutionResult(
    boolean success,
    String output,
    ScriptError error,
    long latencyMillis,
    int attempts
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식 위반 시
     */
    public ExecutionResult {
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
        if (success && error != null) {
            throw new IllegalArgumentException("successful result cannot carry an error");
        }
        if (!success && error == null) {
            throw new IllegalArgumentException("failed result must carry an error");
        }
        if (latencyMillis < 0) {
            throw new IllegalArgumentException("latencyMillis must be non-negative (current: " + latencyMillis + ")");
        }
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param output 엔진 출력
     * @param latencyMillis 소요 시간
     * @return ExecutionResult
     */
    public static ExecutionResult ok(String output, long latencyMillis) {
        return new ExecutionResult(true, output, null, latencyMillis, 1);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 분류된 오류
     * @param latencyMillis 소요 시간
     * @return ExecutionResult
     */
    public static ExecutionResult failure(ScriptError error, long latencyMillis) {
        return new ExecutionResult(false, "", error, latencyMillis, 1);
    }

    /**
     * 실패 결과 생성 (출력 포함).
     *
     * @param error 분류된 오류
     * @param output 엔진 출력
     * @param latencyMillis 소요 시간
     * @return ExecutionResult
     */
    public static ExecutionResult failure(ScriptError error, String output, long latencyMillis) {
        return new ExecutionResult(false, output == null ? "" : output, error, latencyMillis, 1);
    }

    /**
     * 시도 횟수만 변경한 새 인스턴스 생성.
     */
    public ExecutionResult withAttempts(int attempts) {
        return new ExecutionResult(success, output, error, latencyMillis, attempts);
    }

    /**
     * 소요 시간만 변경한 새 인스턴스 생성.
     */
    public ExecutionResult withLatencyMillis(long latencyMillis) {
        return new ExecutionResult(success, output, error, latencyMillis, attempts);
    }

    /**
     * 실패 분류 조회.
     *
     * @return 실패 시 ErrorKind, 성공 시 null
     */
    public ErrorKind errorKind() {
        return error == null ? null : error.kind();
    }

    /**
     * 재시도 가능한 실패인지 확인.
     *
     * @return 일시적 실패인 경우 true (성공이면 false)
     */
    public boolean isTransientFailure() {
        return !success && error.isTransient();
    }
}
