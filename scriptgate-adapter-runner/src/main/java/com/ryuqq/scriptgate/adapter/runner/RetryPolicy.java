package com.ryuqq.scriptgate.adapter.runner;

import com.ryuqq.scriptgate.core.result.ExecutionResult;

/**
 * 재시도 여부와 대기 시간 결정.
 *
 * <p><strong>재시도 조건 (모두 만족):</strong></p>
 * <ul>
 *   <li>실패 종류가 일시적(APPLICATION_UNAVAILABLE, TIMEOUT)</li>
 *   <li>시도 횟수가 maxAttempts 미만</li>
 * </ul>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final BackoffCalculator backoff;

    public RetryPolicy(int maxAttempts, BackoffCalculator backoff) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    public static RetryPolicy from(ExecutorConfig config) {
        return new RetryPolicy(config.maxAttempts(), BackoffCalculator.from(config));
    }

    public static RetryPolicy from(QueueConfig config) {
        return new RetryPolicy(config.maxAttempts(), BackoffCalculator.from(config));
    }

    /**
     * @param result 방금 끝난 시도의 결과
     * @param attempt 방금 끝난 시도 번호 (1부터)
     * @return 다시 시도해야 하면 true
     */
    public boolean shouldRetry(ExecutionResult result, int attempt) {
        return !result.success() && attempt < maxAttempts && result.isTransientFailure();
    }

    public long backoffMillis(int attempt) {
        return backoff.calculate(attempt);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
