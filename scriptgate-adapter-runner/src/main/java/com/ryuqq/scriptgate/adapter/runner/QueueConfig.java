package com.ryuqq.scriptgate.adapter.runner;

import java.time.Duration;
import java.util.Map;

/**
 * SingleFlightOperationQueue 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: Operation당 최대 시도 횟수, 첫 시도 포함 (기본 3)</li>
 *   <li>commandTimeoutMs: 시도당 하드 타임아웃 (기본 30000ms)</li>
 *   <li>maxDepth: 종료되지 않은 Operation 최대 개수 (기본 1000)</li>
 *   <li>retentionMs: 종료된 Operation 조회 보존 기간 (기본 300000ms = 5분)</li>
 *   <li>baseBackoffMs / maxBackoffMs: 재시도 백오프 범위 (기본 1000ms / 30000ms)</li>
 * </ul>
 *
 * <p>재시도 중인 Operation은 실행 슬롯을 유지하므로, 최악의 경우 한 Operation이 슬롯을
 * {@code maxAttempts * commandTimeoutMs + 백오프 합계}만큼 점유합니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param commandTimeoutMs 시도당 타임아웃 (밀리초, 양수여야 함)
 * @param maxDepth 최대 깊이 (1 이상이어야 함)
 * @param retentionMs 종료 Operation 보존 기간 (밀리초, 0 이상)
 * @param baseBackoffMs 기본 백오프 (밀리초, 양수여야 함)
 * @param maxBackoffMs 최대 백오프 (밀리초, baseBackoffMs 이상이어야 함)
 */
public record QueueConfig(
    int maxAttempts,
    long commandTimeoutMs,
    int maxDepth,
    long retentionMs,
    long baseBackoffMs,
    long maxBackoffMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, commandTimeoutMs=30000ms, maxDepth=1000,
     * retentionMs=300000ms, baseBackoffMs=1000ms, maxBackoffMs=30000ms</p>
     */
    public QueueConfig() {
        this(3, 30000, 1000, 300000, 1000, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (commandTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "commandTimeoutMs must be positive (current: " + commandTimeoutMs + ")"
            );
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException(
                "maxDepth must be positive (current: " + maxDepth + ")"
            );
        }
        if (retentionMs < 0) {
            throw new IllegalArgumentException(
                "retentionMs must be non-negative (current: " + retentionMs + ")"
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
    }

    /**
     * 환경 변수로 기본값을 덮어쓴 설정.
     *
     * <p>{@code SCRIPTGATE_TIMEOUT_MS}, {@code SCRIPTGATE_MAX_ATTEMPTS}, {@code SCRIPTGATE_QUEUE_MAX_DEPTH}</p>
     *
     * @param env 환경 변수
     * @return 설정
     * @throws IllegalArgumentException 값이 숫자가 아니거나 검증에 실패한 경우
     */
    public static QueueConfig fromEnvironment(Map<String, String> env) {
        QueueConfig defaults = new QueueConfig();
        return defaults
            .withCommandTimeoutMs(EnvironmentSettings.longValue(env, EnvironmentSettings.TIMEOUT_MS, defaults.commandTimeoutMs()))
            .withMaxAttempts(EnvironmentSettings.intValue(env, EnvironmentSettings.MAX_ATTEMPTS, defaults.maxAttempts()))
            .withMaxDepth(EnvironmentSettings.intValue(env, EnvironmentSettings.QUEUE_MAX_DEPTH, defaults.maxDepth()));
    }

    public Duration commandTimeout() {
        return Duration.ofMillis(commandTimeoutMs);
    }

    public Duration retention() {
        return Duration.ofMillis(retentionMs);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public QueueConfig withMaxAttempts(int maxAttempts) {
        return new QueueConfig(maxAttempts, commandTimeoutMs, maxDepth, retentionMs, baseBackoffMs, maxBackoffMs);
    }

    /**
     * commandTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public QueueConfig withCommandTimeoutMs(long commandTimeoutMs) {
        return new QueueConfig(maxAttempts, commandTimeoutMs, maxDepth, retentionMs, baseBackoffMs, maxBackoffMs);
    }

    /**
     * maxDepth만 변경한 새 인스턴스 생성.
     */
    public QueueConfig withMaxDepth(int maxDepth) {
        return new QueueConfig(maxAttempts, commandTimeoutMs, maxDepth, retentionMs, baseBackoffMs, maxBackoffMs);
    }

    /**
     * retentionMs만 변경한 새 인스턴스 생성.
     */
    public QueueConfig withRetentionMs(long retentionMs) {
        return new QueueConfig(maxAttempts, commandTimeoutMs, maxDepth, retentionMs, baseBackoffMs, maxBackoffMs);
    }

    /**
     * 백오프 범위만 변경한 새 인스턴스 생성.
     */
    public QueueConfig withBackoff(long baseBackoffMs, long maxBackoffMs) {
        return new QueueConfig(maxAttempts, commandTimeoutMs, maxDepth, retentionMs, baseBackoffMs, maxBackoffMs);
    }
}
