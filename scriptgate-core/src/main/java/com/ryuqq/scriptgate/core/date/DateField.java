package com.ryuqq.scriptgate.core.date;

/**
 * 외부 엔진 날짜 객체에 대입하는 항목.
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public enum DateField {

    /**
     * 기준 객체 생성 ({@code set v to current date}).
     */
    BASE(null),

    TIME("time"),

    DAY("day"),

    YEAR("year"),

    MONTH("month");

    private final String property;

    DateField(String property) {
        this.property = property;
    }

    /**
     * AppleScript 속성 이름 (BASE는 null).
     */
    public String property() {
        return property;
    }
}
