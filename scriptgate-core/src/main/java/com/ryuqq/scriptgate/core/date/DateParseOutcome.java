package com.ryuqq.scriptgate.core.date;

/**
 * 날짜 해석 결과 (sealed).
 *
 * <p>Normalizer와 Codec의 decode는 잘못된 입력에 대해 예외를 던지지 않고
 * {@link InvalidDate}를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DateParseOutcome outcome = normalizer.normalize("2024-02-29");
 * if (outcome instanceof ParsedDate parsed) {
 *     CalendarDate date = parsed.date();
 * } else if (outcome instanceof InvalidDate invalid) {
 *     log.warn("Invalid date: {}", invalid.reason());
 * }
 * </pre>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public sealed interface DateParseOutcome permits ParsedDate, InvalidDate {

    /**
     * 해석 성공 여부.
     */
    default boolean isValid() {
        return this instanceof ParsedDate;
    }

    /**
     * 해석된 날짜 반환.
     *
     * @return 날짜
     * @throws InvalidDateException 해석 실패한 경우
     */
    CalendarDate orElseThrow();
}
