package com.ryuqq.scriptgate.core.statemachine;

/**
 * 큐에 등록된 쓰기 Operation의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ──► CANCELLED (실행 전 취소)
 *    │
 *    ▼ (슬롯 획득)
 * RUNNING ──► SUCCEEDED (성공)
 *    │  ▲
 *    │  └──── RETRYING (일시적 실패, 백오프 대기)
 *    │            │
 *    └─► FAILED ◄─┘ (영구 실패 / 재시도 예산 소진)
 * </pre>
 *
 * <p>RUNNING과 RETRYING은 모두 실행 슬롯을 점유한 상태입니다.
 * 프로세스 전체에서 동시에 하나의 Operation만 이 두 상태에 있을 수 있습니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public enum OperationState {

    /**
     * 대기 중 (아직 실행 시작 안 됨).
     */
    PENDING,

    /**
     * 스크립트 엔진에서 실행 중.
     */
    RUNNING,

    /**
     * 일시적 실패 후 재시도 대기 중.
     */
    RETRYING,

    /**
     * 완료 (성공).
     */
    SUCCEEDED,

    /**
     * 실패 (영구).
     */
    FAILED,

    /**
     * 실행 전 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    /**
     * 실행 슬롯을 점유한 상태인지 확인.
     *
     * @return RUNNING 또는 RETRYING인 경우 true
     */
    public boolean holdsSlot() {
        return this == RUNNING || this == RETRYING;
    }
}
