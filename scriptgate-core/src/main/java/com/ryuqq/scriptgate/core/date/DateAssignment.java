package com.ryuqq.scriptgate.core.date;

/**
 * 날짜 객체에 대한 단일 대입.
 *
 * @param field 대입 항목
 * @param value 대입 값 (정수 또는 월 상수, BASE는 {@code current date})
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record DateAssignment(DateField field, String value) {

    public DateAssignment {
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value cannot be null or blank");
        }
    }

    /**
     * AppleScript 문장으로 렌더링.
     *
     * @param variable 날짜 변수 이름
     * @return {@code set v to current date} 또는 {@code set day of v to 15}
     */
    public String render(String variable) {
        if (field == DateField.BASE) {
            return "set " + variable + " to " + value;
        }
        return "set " + field.property() + " of " + variable + " to " + value;
    }
}
