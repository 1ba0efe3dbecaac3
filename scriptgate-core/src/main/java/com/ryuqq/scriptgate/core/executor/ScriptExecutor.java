package com.ryuqq.scriptgate.core.executor;

import com.ryuqq.scriptgate.core.contract.ScriptCommand;
import com.ryuqq.scriptgate.core.result.ExecutionResult;

import java.time.Duration;

/**
 * 스크립트 명령 실행자.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>명령 1건을 외부 엔진에서 실행하고 정확히 하나의 {@link ExecutionResult} 반환</li>
 *   <li>모든 호출에 하드 타임아웃 적용 (초과 시 {@code TIMEOUT})</li>
 *   <li>실패를 {@link com.ryuqq.scriptgate.core.result.ErrorKind}로 분류</li>
 * </ul>
 *
 * <p>예상 가능한 애플리케이션 실패는 예외가 아니라 실패 결과로 반환합니다.
 * 예외는 계약 위반(null 인자 등)에만 사용합니다.</p>
 *
 * <p><strong>동시성:</strong> 구현체는 thread-safe해야 합니다.
 * READ는 실행 중인 WRITE와 병렬로 호출됩니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public interface ScriptExecutor {

    /**
     * 명령 실행.
     *
     * @param command 실행할 명령
     * @param timeout 하드 타임아웃 (양수)
     * @return 실행 결과
     * @throws IllegalArgumentException command가 null이거나 timeout이 양수가 아닌 경우
     */
    ExecutionResult execute(ScriptCommand command, Duration timeout);
}
