package com.ryuqq.scriptgate.core.model;

/**
 * 쓰기 Operation의 큐 우선순위.
 *
 * <p>선언 순서가 곧 실행 순서입니다. 같은 우선순위 안에서는 FIFO로 처리됩니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public enum Priority {

    HIGH,

    NORMAL,

    LOW;

    /**
     * 문자열에서 우선순위 파싱 (대소문자 무시).
     *
     * @param raw 우선순위 문자열 (null 또는 빈 문자열이면 NORMAL)
     * @return Priority
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
