package com.ryuqq.scriptgate.core.date;

/**
 * 해석 성공.
 *
 * @param date 해석된 날짜
 * @param input 원본 입력
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record ParsedDate(CalendarDate date, String input) implements DateParseOutcome {

    public ParsedDate {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
    }

    @Override
    public CalendarDate orElseThrow() {
        return date;
    }
}
