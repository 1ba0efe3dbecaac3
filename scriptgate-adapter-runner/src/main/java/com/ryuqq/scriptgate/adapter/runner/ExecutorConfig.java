package com.ryuqq.scriptgate.adapter.runner;

import java.time.Duration;
import java.util.Map;

/**
 * 읽기 경로 Executor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultTimeoutMs: 호출당 하드 타임아웃 (기본 30000ms)</li>
 *   <li>maxAttempts: 일시적 실패 시 최대 시도 횟수, 첫 시도 포함 (기본 3)</li>
 *   <li>baseBackoffMs: 첫 재시도 전 대기 (기본 1000ms)</li>
 *   <li>maxBackoffMs: 재시도 대기 상한 (기본 30000ms)</li>
 *   <li>jitterFactor: 백오프 jitter 비율 (기본 0.1)</li>
 * </ul>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 * @param defaultTimeoutMs 호출당 타임아웃 (밀리초, 양수여야 함)
 * @param maxAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param baseBackoffMs 기본 백오프 (밀리초, 양수여야 함)
 * @param maxBackoffMs 최대 백오프 (밀리초, baseBackoffMs 이상이어야 함)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record ExecutorConfig(
    long defaultTimeoutMs,
    int maxAttempts,
    long baseBackoffMs,
    long maxBackoffMs,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultTimeoutMs=30000ms, maxAttempts=3, baseBackoffMs=1000ms,
     * maxBackoffMs=30000ms, jitterFactor=0.1</p>
     */
    public ExecutorConfig() {
        this(30000, 3, 1000, 30000, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ExecutorConfig {
        if (defaultTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "defaultTimeoutMs must be positive (current: " + defaultTimeoutMs + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseBackoffMs <= 0) {
            throw new IllegalArgumentException(
                "baseBackoffMs must be positive (current: " + baseBackoffMs + ")"
            );
        }
        if (maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException(
                "maxBackoffMs must be >= baseBackoffMs (base: " + baseBackoffMs + ", max: " + maxBackoffMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * 환경 변수로 기본값을 덮어쓴 설정.
     *
     * <p>{@code SCRIPTGATE_TIMEOUT_MS}, {@code SCRIPTGATE_MAX_ATTEMPTS}</p>
     *
     * @param env 환경 변수 (보통 {@code System.getenv()})
     * @return 설정
     * @throws IllegalArgumentException 값이 숫자가 아니거나 검증에 실패한 경우
     */
    public static ExecutorConfig fromEnvironment(Map<String, String> env) {
        ExecutorConfig defaults = new ExecutorConfig();
        return defaults
            .withDefaultTimeoutMs(EnvironmentSettings.longValue(env, EnvironmentSettings.TIMEOUT_MS, defaults.defaultTimeoutMs()))
            .withMaxAttempts(EnvironmentSettings.intValue(env, EnvironmentSettings.MAX_ATTEMPTS, defaults.maxAttempts()));
    }

    public Duration defaultTimeout() {
        return Duration.ofMillis(defaultTimeoutMs);
    }

    /**
     * defaultTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public ExecutorConfig withDefaultTimeoutMs(long defaultTimeoutMs) {
        return new ExecutorConfig(defaultTimeoutMs, maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public ExecutorConfig withMaxAttempts(int maxAttempts) {
        return new ExecutorConfig(defaultTimeoutMs, maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor);
    }

    /**
     * 백오프 범위만 변경한 새 인스턴스 생성.
     */
    public ExecutorConfig withBackoff(long baseBackoffMs, long maxBackoffMs) {
        return new ExecutorConfig(defaultTimeoutMs, maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public ExecutorConfig withJitterFactor(double jitterFactor) {
        return new ExecutorConfig(defaultTimeoutMs, maxAttempts, baseBackoffMs, maxBackoffMs, jitterFactor);
    }
}
