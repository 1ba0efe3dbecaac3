package com.ryuqq.scriptgate.core.date;

/**
 * 해석 실패.
 *
 * <p>형식 불일치, 존재하지 않는 날짜(2023-02-29), 모호한 일/월 순서가 모두 여기에 해당합니다.</p>
 *
 * @param input 원본 입력 (null 입력은 빈 문자열)
 * @param reason 실패 사유
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record InvalidDate(String input, String reason) implements DateParseOutcome {

    public InvalidDate {
        if (input == null) {
            input = "";
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    @Override
    public CalendarDate orElseThrow() {
        throw new InvalidDateException(input, reason);
    }
}
