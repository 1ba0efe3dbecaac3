package com.ryuqq.scriptgate.application.queue;

import com.ryuqq.scriptgate.core.result.ErrorKind;

import java.time.Duration;
import java.util.Map;

/**
 * 큐 상태 스냅샷.
 *
 * @param depth 종료되지 않은 Operation 수 (pending + running)
 * @param pending 대기 중인 Operation 수
 * @param running 슬롯을 점유한 Operation 수 (0 또는 1)
 * @param oldestPendingAge 가장 오래 대기 중인 Operation의 대기 시간 (없으면 0)
 * @param failureCounts ErrorKind별 종료 실패 수
 * @param succeeded 누적 성공 수
 * @param failed 누적 실패 수
 * @param cancelled 누적 취소 수
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record QueueStatus(
    int depth,
    int pending,
    int running,
    Duration oldestPendingAge,
    Map<ErrorKind, Long> failureCounts,
    long succeeded,
    long failed,
    long cancelled
) {

    public QueueStatus {
        if (depth < 0 || pending < 0 || running < 0) {
            throw new IllegalArgumentException(
                "counts must be non-negative (depth: " + depth + ", pending: " + pending + ", running: " + running + ")"
            );
        }
        if (running > 1) {
            throw new IllegalArgumentException("running cannot exceed 1 (current: " + running + ")");
        }
        if (oldestPendingAge == null) {
            throw new IllegalArgumentException("oldestPendingAge cannot be null");
        }
        if (failureCounts == null) {
            throw new IllegalArgumentException("failureCounts cannot be null");
        }
        failureCounts = Map.copyOf(failureCounts);
    }

    public boolean isIdle() {
        return depth == 0;
    }

    public long failures(ErrorKind kind) {
        return failureCounts.getOrDefault(kind, 0L);
    }
}
