package com.ryuqq.scriptgate.core.contract;

/**
 * 명령의 접근 모드.
 *
 * <p>READ는 큐를 거치지 않고 즉시 실행되며 캐시될 수 있습니다.
 * WRITE는 항상 단일 실행 큐를 통해 직렬화됩니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public enum AccessMode {

    /**
     * 상태를 변경하지 않는 조회.
     */
    READ,

    /**
     * 외부 애플리케이션 상태를 변경하는 명령.
     */
    WRITE
}
