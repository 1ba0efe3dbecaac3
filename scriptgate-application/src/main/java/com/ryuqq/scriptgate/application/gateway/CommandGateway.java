package com.ryuqq.scriptgate.application.gateway;

import com.ryuqq.scriptgate.application.queue.QueueStatus;
import com.ryuqq.scriptgate.core.contract.ScriptCommand;
import com.ryuqq.scriptgate.core.model.Priority;
import com.ryuqq.scriptgate.core.result.ExecutionResult;

/**
 * 외부 애플리케이션에 대한 단일 진입점.
 *
 * <p>명령의 접근 모드에 따라 실행 경로를 나눕니다.</p>
 *
 * <p><strong>라우팅 규칙:</strong></p>
 * <ol>
 *   <li>부수 효과 없는 READ + cacheKey → 결과 캐시 → (miss) 재시도 Executor. 성공 결과만 캐시</li>
 *   <li>그 외 READ → 재시도 Executor 직접 호출</li>
 *   <li>WRITE → 단일 실행 큐에 등록</li>
 * </ol>
 *
 * <p>READ는 큐를 기다리지 않으며 실행 중인 WRITE와 병렬로 실행됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ExecutionResult todos = gateway.read(ScriptCommand.read("get_todos", script, "todos:all"));
 *
 * OperationHandle handle = gateway.submit(renameCommand, Priority.HIGH);
 * ExecutionResult renamed = handle.await();
 * </pre>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public interface CommandGateway {

    /**
     * 명령 제출.
     *
     * @param command 실행할 명령
     * @param priority 큐 우선순위 (READ는 무시)
     * @return READ면 즉시 완료된 핸들, WRITE면 큐 핸들
     * @throws IllegalArgumentException command가 null인 경우
     * @throws com.ryuqq.scriptgate.application.queue.QueueSaturationException 큐가 가득 찬 경우
     */
    OperationHandle submit(ScriptCommand command, Priority priority);

    /**
     * READ 명령을 호출자 스레드에서 실행.
     *
     * @param command READ 명령
     * @return 실행 결과 (캐시 적중 시 캐시된 결과)
     * @throws IllegalArgumentException command가 null이거나 WRITE인 경우
     */
    ExecutionResult read(ScriptCommand command);

    /**
     * WRITE 명령을 NORMAL 우선순위로 큐에 등록.
     *
     * @param command WRITE 명령
     * @return 큐 핸들
     * @throws IllegalArgumentException command가 null이거나 READ인 경우
     */
    OperationHandle write(ScriptCommand command);

    /**
     * 큐 상태 조회.
     */
    QueueStatus queueStatus();

    /**
     * 외부 애플리케이션이 실행 중인지 확인 (캐시하지 않음).
     *
     * @return 실행 중이면 true, 확인 실패 포함 그 외 false
     */
    boolean isApplicationRunning();
}
