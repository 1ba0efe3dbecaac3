package com.ryuqq.scriptgate.core.executor;

import com.ryuqq.scriptgate.core.result.ErrorKind;

import java.util.Map;

/**
 * Executor 호출 통계 스냅샷.
 *
 * @param calls 전체 호출 수
 * @param failures ErrorKind별 실패 수
 * @param totalLatencyMillis 누적 소요 시간
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record ExecutorStats(long calls, Map<ErrorKind, Long> failures, long totalLatencyMillis) {

    public ExecutorStats {
        if (failures == null) {
            throw new IllegalArgumentException("failures cannot be null");
        }
        failures = Map.copyOf(failures);
    }

    public long failureCount() {
        return failures.values().stream().mapToLong(Long::longValue).sum();
    }

    public long failures(ErrorKind kind) {
        return failures.getOrDefault(kind, 0L);
    }

    public double averageLatencyMillis() {
        return calls == 0 ? 0.0 : (double) totalLatencyMillis / calls;
    }
}
