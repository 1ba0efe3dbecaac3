package com.ryuqq.scriptgate.core.result;

/**
 * 분류된 스크립트 실행 오류.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>{@code REFERENCE_NOT_FOUND}, "Can't get to do id \"X\"", -1728</li>
 *   <li>{@code TIMEOUT}, "Script execution timed out after 30000ms", null</li>
 * </ul>
 *
 * @param kind 오류 분류
 * @param message 오류 메시지
 * @param engineCode 엔진 오류 번호 (선택, null 가능)
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record ScriptError(
    ErrorKind kind,
    String message,
    Integer engineCode
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 message가 null/blank인 경우
     */
    public ScriptError {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // engineCode는 null 허용
    }

    /**
     * 엔진 오류 번호 없이 ScriptError 생성.
     *
     * @param kind 오류 분류
     * @param message 오류 메시지
     * @return ScriptError 인스턴스
     */
    public static ScriptError of(ErrorKind kind, String message) {
        return new ScriptError(kind, message, null);
    }

    /**
     * 재시도 가능한 오류인지 확인.
     *
     * @return 일시적 실패인 경우 true
     */
    public boolean isTransient() {
        return kind.isTransient();
    }
}
