package com.ryuqq.scriptgate.core.result;

/**
 * 스크립트 실행 실패 분류.
 *
 * <p>재시도 여부는 분류에 따라 결정됩니다:</p>
 * <ul>
 *   <li>일시적 실패 (재시도 가능): {@link #TIMEOUT}, {@link #APPLICATION_UNAVAILABLE}</li>
 *   <li>영구적 실패 (재시도 불가): 나머지 전부</li>
 * </ul>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 생성된 스크립트의 문법 오류. Command Builder 결함을 의미합니다.
     */
    SYNTAX(false),

    /**
     * 대상 객체가 더 이상 존재하지 않음.
     */
    REFERENCE_NOT_FOUND(false),

    /**
     * 자동화(Apple Events) 권한이 부여되지 않음.
     */
    PERMISSION_DENIED(false),

    /**
     * 외부 애플리케이션이 실행 중이 아니거나 응답하지 않음.
     */
    APPLICATION_UNAVAILABLE(true),

    /**
     * 실행 시간 초과.
     */
    TIMEOUT(true),

    /**
     * 출력이 기대한 결과 형태와 일치하지 않음.
     */
    UNEXPECTED_RESULT(false),

    /**
     * 실행 전 취소됨.
     */
    CANCELLED(false),

    /**
     * 분류 불가.
     */
    UNKNOWN(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * 재시도하면 해소될 수 있는 실패인지 확인.
     *
     * @return 일시적 실패인 경우 true
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
