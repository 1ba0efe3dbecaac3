package com.ryuqq.scriptgate.core.date;

/**
 * 날짜 입력을 해석할 수 없을 때 발생하는 예외.
 *
 * <p>재시도 대상이 아니며, 외부 엔진 호출 전에 호출자에게 보고됩니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public class InvalidDateException extends RuntimeException {

    private final String input;
    private final String reason;

    public InvalidDateException(String input, String reason) {
        super("Invalid date '" + input + "': " + reason);
        this.input = input;
        this.reason = reason;
    }

    public String getInput() {
        return input;
    }

    public String getReason() {
        return reason;
    }
}
