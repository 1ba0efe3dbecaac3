package com.ryuqq.scriptgate.core.date;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 사용자 날짜 입력을 {@link CalendarDate}로 정규화.
 *
 * <p><strong>허용 형식:</strong></p>
 * <ul>
 *   <li>ISO: {@code 2024-03-15}, {@code 2024-03-15T09:30}, {@code 2024-03-15T09:30:00Z}
 *       (시간대 접미사는 무시하고 벽시계 시각을 유지)</li>
 *   <li>숫자형 일/월: {@code 3/15/2024}, {@code 15.3.2024}, {@code 15-03-2024}, {@code 2024/03/15}</li>
 *   <li>키워드: {@code today}, {@code tomorrow}, {@code yesterday}</li>
 *   <li>상대 오프셋: {@code +3d}, {@code -2w}, {@code +1m}, {@code 5d}, {@code +5 days}, {@code -1 week}</li>
 *   <li>월 이름: {@code March 15, 2024}, {@code Mar 15 2024}, {@code 15 March 2024}, {@code 15 Sept 2024}</li>
 * </ul>
 *
 * <p><strong>모호성 정책:</strong></p>
 * <ul>
 *   <li>숫자형 일/월 표기에서 두 필드가 모두 12 이하이고 서로 다르면(예: {@code 02/01/2024})
 *       {@link DateFormatHint#AUTO}에서는 거부합니다.</li>
 *   <li>{@link DateFormatHint#US} 또는 {@link DateFormatHint#EUROPEAN} 힌트가 있으면 그 순서로 해석합니다.</li>
 *   <li>두 필드가 같으면({@code 12/12/2025}) 모호하지 않습니다.</li>
 *   <li>힌트와 데이터가 모순되면({@code US}인데 첫 필드가 13) 거부합니다.</li>
 *   <li>구분자({@code /}, {@code .}, {@code -})로는 순서를 추측하지 않습니다.</li>
 *   <li>{@link DateFormatHint#ISO} 힌트는 ISO 형식 외의 모든 입력(키워드, 상대 오프셋, 월 이름 포함)을 거부합니다.</li>
 * </ul>
 *
 * <p>잘못된 입력에 대해 예외를 던지지 않고 {@link InvalidDate}를 반환합니다.
 * 상대 날짜의 기준일은 주입된 {@link Clock}에서 얻습니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public final class DateNormalizer {

    private static final Pattern ISO_PATTERN = Pattern.compile(
        "^(\\d{4})-(\\d{1,2})-(\\d{1,2})"
            + "(?:[t ](\\d{1,2}):(\\d{2})(?::(\\d{2})(?:\\.\\d{1,9})?)?)?"
            + "(?:z|[+-]\\d{2}(?::?\\d{2})?)?$"
    );

    private static final Pattern YEAR_FIRST_SLASH_PATTERN =
        Pattern.compile("^(\\d{4})/(\\d{1,2})/(\\d{1,2})$");

    private static final Pattern DAY_MONTH_PATTERN =
        Pattern.compile("^(\\d{1,2})([/.\\-])(\\d{1,2})\\2(\\d{4})$");

    private static final Pattern RELATIVE_PATTERN =
        Pattern.compile("^([+-]?)(\\d{1,5})(?:([dwm])|\\s+(days?|weeks?|months?))$");

    private static final Pattern MONTH_FIRST_PATTERN =
        Pattern.compile("^([a-z]+)\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})$");

    private static final Pattern DAY_FIRST_PATTERN =
        Pattern.compile("^(\\d{1,2})(?:st|nd|rd|th)?\\s+([a-z]+)\\.?,?\\s+(\\d{4})$");

    private static final Map<String, Integer> MONTH_NAMES = Map.ofEntries(
        Map.entry("january", 1), Map.entry("jan", 1),
        Map.entry("february", 2), Map.entry("feb", 2),
        Map.entry("march", 3), Map.entry("mar", 3),
        Map.entry("april", 4), Map.entry("apr", 4),
        Map.entry("may", 5),
        Map.entry("june", 6), Map.entry("jun", 6),
        Map.entry("july", 7), Map.entry("jul", 7),
        Map.entry("august", 8), Map.entry("aug", 8),
        Map.entry("september", 9), Map.entry("sep", 9), Map.entry("sept", 9),
        Map.entry("october", 10), Map.entry("oct", 10),
        Map.entry("november", 11), Map.entry("nov", 11),
        Map.entry("december", 12), Map.entry("dec", 12)
    );

    private final Clock clock;

    /**
     * 시스템 기본 시간대 Clock으로 생성.
     */
    public DateNormalizer() {
        this(Clock.systemDefaultZone());
    }

    /**
     * 생성자.
     *
     * @param clock 상대 날짜 기준 Clock
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public DateNormalizer(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * {@link DateFormatHint#AUTO}로 정규화.
     */
    public DateParseOutcome normalize(String input) {
        return normalize(input, DateFormatHint.AUTO);
    }

    /**
     * 이미 정규화된 날짜는 그대로 반환.
     */
    public DateParseOutcome normalize(CalendarDate date) {
        if (date == null) {
            return new InvalidDate("", "date is empty");
        }
        return new ParsedDate(date, date.toIsoString());
    }

    /**
     * 입력 문자열을 정규화.
     *
     * @param input 사용자 입력 (null 가능)
     * @param hint 해석 힌트 (null이면 AUTO)
     * @return ParsedDate 또는 InvalidDate
     */
    public DateParseOutcome normalize(String input, DateFormatHint hint) {
        if (input == null || input.isBlank()) {
            return new InvalidDate(input, "date is empty");
        }
        DateFormatHint effectiveHint = hint == null ? DateFormatHint.AUTO : hint;
        String text = input.strip().toLowerCase(Locale.ROOT);

        Matcher matcher = ISO_PATTERN.matcher(text);
        if (matcher.matches()) {
            return fromIso(input, matcher);
        }
        if (effectiveHint == DateFormatHint.ISO) {
            return new InvalidDate(input, "expected ISO format YYYY-MM-DD");
        }

        switch (text) {
            case "today":
                return relativeDays(input, 0);
            case "tomorrow":
                return relativeDays(input, 1);
            case "yesterday":
                return relativeDays(input, -1);
            default:
                break;
        }

        matcher = RELATIVE_PATTERN.matcher(text);
        if (matcher.matches()) {
            return fromRelative(input, matcher);
        }

        matcher = YEAR_FIRST_SLASH_PATTERN.matcher(text);
        if (matcher.matches()) {
            return build(input, parseInt(matcher.group(1)), parseInt(matcher.group(2)), parseInt(matcher.group(3)), null);
        }

        matcher = DAY_MONTH_PATTERN.matcher(text);
        if (matcher.matches()) {
            return fromDayMonth(input, matcher, effectiveHint);
        }

        matcher = MONTH_FIRST_PATTERN.matcher(text);
        if (matcher.matches()) {
            return fromMonthName(input, matcher.group(1), matcher.group(2), matcher.group(3));
        }

        matcher = DAY_FIRST_PATTERN.matcher(text);
        if (matcher.matches()) {
            return fromMonthName(input, matcher.group(2), matcher.group(1), matcher.group(3));
        }

        return new InvalidDate(input, "unrecognized date format");
    }

    /**
     * 정규화하고 실패 시 예외 발생.
     *
     * @param input 사용자 입력
     * @param hint 해석 힌트
     * @return 정규화된 날짜
     * @throws InvalidDateException 해석 실패 시
     */
    public CalendarDate normalizeOrThrow(String input, DateFormatHint hint) {
        return normalize(input, hint).orElseThrow();
    }

    public CalendarDate normalizeOrThrow(String input) {
        return normalizeOrThrow(input, DateFormatHint.AUTO);
    }

    private DateParseOutcome fromIso(String input, Matcher matcher) {
        LocalTime time = null;
        if (matcher.group(4) != null) {
            int hour = parseInt(matcher.group(4));
            int minute = parseInt(matcher.group(5));
            int second = matcher.group(6) == null ? 0 : parseInt(matcher.group(6));
            if (hour > 23 || minute > 59 || second > 59) {
                return new InvalidDate(input, "time of day out of range");
            }
            time = LocalTime.of(hour, minute, second);
        }
        return build(input, parseInt(matcher.group(1)), parseInt(matcher.group(2)), parseInt(matcher.group(3)), time);
    }

    private DateParseOutcome fromDayMonth(String input, Matcher matcher, DateFormatHint hint) {
        int first = parseInt(matcher.group(1));
        int second = parseInt(matcher.group(3));
        int year = parseInt(matcher.group(4));

        if (hint == DateFormatHint.US) {
            return build(input, year, first, second, null);
        }
        if (hint == DateFormatHint.EUROPEAN) {
            return build(input, year, second, first, null);
        }

        if (first == second) {
            return build(input, year, first, second, null);
        }
        if (first <= 12 && second <= 12) {
            return new InvalidDate(input, "ambiguous day/month order; supply a US or EUROPEAN hint or use YYYY-MM-DD");
        }
        if (first > 12 && second <= 12) {
            return build(input, year, second, first, null);
        }
        if (second > 12 && first <= 12) {
            return build(input, year, first, second, null);
        }
        return new InvalidDate(input, "neither field is a valid month");
    }

    private DateParseOutcome fromMonthName(String input, String monthName, String day, String year) {
        Integer month = MONTH_NAMES.get(monthName);
        if (month == null) {
            return new InvalidDate(input, "unknown month name: " + monthName);
        }
        return build(input, parseInt(year), month, parseInt(day), null);
    }

    private DateParseOutcome fromRelative(String input, Matcher matcher) {
        long amount = Long.parseLong(matcher.group(2));
        if ("-".equals(matcher.group(1))) {
            amount = -amount;
        }
        String unit = matcher.group(3) != null ? matcher.group(3) : matcher.group(4).substring(0, 1);
        LocalDate today = LocalDate.now(clock);
        try {
            LocalDate target;
            switch (unit) {
                case "d":
                    target = today.plusDays(amount);
                    break;
                case "w":
                    target = today.plusWeeks(amount);
                    break;
                default:
                    target = today.plusMonths(amount);
                    break;
            }
            return new ParsedDate(CalendarDate.from(target), input);
        } catch (IllegalArgumentException | DateTimeException e) {
            return new InvalidDate(input, "relative offset out of range");
        }
    }

    private DateParseOutcome relativeDays(String input, long days) {
        try {
            return new ParsedDate(CalendarDate.from(LocalDate.now(clock).plusDays(days)), input);
        } catch (IllegalArgumentException | DateTimeException e) {
            return new InvalidDate(input, "relative offset out of range");
        }
    }

    private static DateParseOutcome build(String input, int year, int month, int day, LocalTime time) {
        if (year < CalendarDate.MIN_YEAR || year > CalendarDate.MAX_YEAR) {
            return new InvalidDate(input, "year out of range: " + year);
        }
        if (month < 1 || month > 12) {
            return new InvalidDate(input, "month out of range: " + month);
        }
        int maxDay = CalendarDate.daysInMonth(year, month);
        if (day < 1 || day > maxDay) {
            return new InvalidDate(
                input,
                String.format("day %d does not exist in %04d-%02d", day, year, month)
            );
        }
        return new ParsedDate(CalendarDate.of(year, month, day, time), input);
    }

    private static int parseInt(String digits) {
        return Integer.parseInt(digits);
    }
}
