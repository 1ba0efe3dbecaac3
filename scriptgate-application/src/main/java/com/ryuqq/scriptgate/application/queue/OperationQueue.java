package com.ryuqq.scriptgate.application.queue;

import com.ryuqq.scriptgate.application.gateway.OperationHandle;
import com.ryuqq.scriptgate.core.contract.ScriptCommand;
import com.ryuqq.scriptgate.core.model.OperationId;
import com.ryuqq.scriptgate.core.model.Priority;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 쓰기 명령을 직렬화하는 단일 실행(single-flight) 큐.
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>프로세스 전체에서 RUNNING 또는 RETRYING 상태인 Operation은 최대 1개</li>
 *   <li>완료 순서는 우선순위 → 등록 순서 (같은 우선순위 내 FIFO)</li>
 *   <li>등록된 모든 Operation은 성공 또는 보고된 종료 실패로 끝남 (조용히 버려지지 않음)</li>
 * </ul>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public interface OperationQueue {

    /**
     * WRITE 명령 등록.
     *
     * @param command WRITE 명령
     * @param priority 우선순위
     * @return 큐 핸들
     * @throws IllegalArgumentException command가 null이거나 READ인 경우
     * @throws QueueSaturationException 종료되지 않은 Operation 수가 최대 깊이에 도달한 경우
     * @throws IllegalStateException 큐가 종료된 경우
     */
    OperationHandle enqueue(ScriptCommand command, Priority priority);

    /**
     * PENDING 상태의 Operation 취소.
     *
     * @param operationId Operation ID
     * @return 취소되었으면 true (이미 실행 중, 종료, 또는 알 수 없는 ID면 false)
     */
    boolean cancel(OperationId operationId);

    /**
     * 큐 상태 조회.
     */
    QueueStatus status();

    /**
     * 단일 Operation 조회 (보존 기간 내 종료된 Operation 포함).
     *
     * @param operationId Operation ID
     * @return 스냅샷, 알 수 없는 ID면 empty
     */
    Optional<OperationSnapshot> snapshot(OperationId operationId);

    /**
     * 종료되지 않은 Operation 목록 (실행 순서).
     */
    List<OperationSnapshot> activeOperations();

    /**
     * 큐 종료.
     *
     * <p>새 등록을 거부하고, 대기 중인 Operation은 APPLICATION_UNAVAILABLE로 실패 처리하며,
     * 실행 중인 Operation은 끝날 때까지 기다립니다.</p>
     *
     * @param gracePeriod 실행 중인 Operation 대기 시간
     * @return 제한 시간 내 종료되었으면 true
     */
    boolean shutdown(Duration gracePeriod);
}
