package com.ryuqq.scriptgate.core.date;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;

/**
 * 검증된 달력 날짜 (불변).
 *
 * <p>Normalizer 또는 Codec의 decode만 생성하며, 생성 이후 변경되지 않습니다.
 * 연도 범위는 1..9999이고, day는 해당 월의 일수를 넘을 수 없습니다.</p>
 *
 * <p><strong>시각(time-of-day):</strong></p>
 * <ul>
 *   <li>선택 항목이며 초 단위로 절삭됩니다.</li>
 *   <li>자정(00:00:00)은 "시각 없음"과 동일하게 취급되어 null로 저장됩니다.
 *       외부 엔진에서 날짜만 설정한 값은 항상 time=0으로 읽히기 때문입니다.</li>
 * </ul>
 *
 * @param year 연도 (1..9999)
 * @param month 월 (1..12)
 * @param day 일 (1..해당 월 일수)
 * @param time 시각 (null 가능)
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record CalendarDate(
    int year,
    int month,
    int day,
    LocalTime time
) implements Comparable<CalendarDate> {

    public static final int MIN_YEAR = 1;
    public static final int MAX_YEAR = 9999;

    private static final Comparator<CalendarDate> ORDER = Comparator
        .comparingInt(CalendarDate::year)
        .thenComparingInt(CalendarDate::month)
        .thenComparingInt(CalendarDate::day)
        .thenComparing(d -> d.time() == null ? LocalTime.MIDNIGHT : d.time());

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 존재하지 않는 날짜인 경우
     */
    public CalendarDate {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException(
                "year must be between " + MIN_YEAR + " and " + MAX_YEAR + " (current: " + year + ")"
            );
        }
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12 (current: " + month + ")");
        }
        int maxDay = daysInMonth(year, month);
        if (day < 1 || day > maxDay) {
            throw new IllegalArgumentException(
                String.format("day must be between 1 and %d for %04d-%02d (current: %d)", maxDay, year, month, day)
            );
        }
        if (time != null) {
            time = time.truncatedTo(ChronoUnit.SECONDS);
            if (time.equals(LocalTime.MIDNIGHT)) {
                time = null;
            }
        }
    }

    public static CalendarDate of(int year, int month, int day) {
        return new CalendarDate(year, month, day, null);
    }

    public static CalendarDate of(int year, int month, int day, LocalTime time) {
        return new CalendarDate(year, month, day, time);
    }

    /**
     * {@link LocalDate}로부터 생성.
     *
     * @param date 날짜
     * @return CalendarDate
     * @throws IllegalArgumentException date가 null이거나 연도 범위를 벗어난 경우
     */
    public static CalendarDate from(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        return new CalendarDate(date.getYear(), date.getMonthValue(), date.getDayOfMonth(), null);
    }

    /**
     * 윤년 여부 (그레고리력).
     */
    public static boolean isLeapYear(int year) {
        return (year % 4 == 0 && year % 100 != 0) || year % 400 == 0;
    }

    /**
     * 해당 월의 일수.
     *
     * @param year 연도
     * @param month 월 (1..12)
     * @return 28..31
     * @throws IllegalArgumentException month가 범위를 벗어난 경우
     */
    public static int daysInMonth(int year, int month) {
        switch (month) {
            case 2:
                return isLeapYear(year) ? 29 : 28;
            case 4:
            case 6:
            case 9:
            case 11:
                return 30;
            case 1:
            case 3:
            case 5:
            case 7:
            case 8:
            case 10:
            case 12:
                return 31;
            default:
                throw new IllegalArgumentException("month must be between 1 and 12 (current: " + month + ")");
        }
    }

    public boolean hasTime() {
        return time != null;
    }

    /**
     * 시각을 초 단위로 반환 (시각이 없으면 0).
     */
    public int secondOfDay() {
        return time == null ? 0 : time.toSecondOfDay();
    }

    public CalendarDate withTime(LocalTime time) {
        return new CalendarDate(year, month, day, time);
    }

    public CalendarDate dateOnly() {
        return time == null ? this : new CalendarDate(year, month, day, null);
    }

    public LocalDate toLocalDate() {
        return LocalDate.of(year, month, day);
    }

    public CalendarDate plusDays(long days) {
        return shifted(toLocalDate().plusDays(days));
    }

    public CalendarDate plusWeeks(long weeks) {
        return shifted(toLocalDate().plusWeeks(weeks));
    }

    /**
     * 월 단위 이동. 대상 월의 일수를 넘으면 말일로 맞춥니다 (1월 31일 + 1개월 = 2월 28/29일).
     */
    public CalendarDate plusMonths(long months) {
        return shifted(toLocalDate().plusMonths(months));
    }

    private CalendarDate shifted(LocalDate shifted) {
        return new CalendarDate(shifted.getYear(), shifted.getMonthValue(), shifted.getDayOfMonth(), time);
    }

    /**
     * ISO 8601 표현.
     *
     * @return {@code 2024-02-29} 또는 {@code 2024-02-29T09:30}
     */
    public String toIsoString() {
        String date = String.format("%04d-%02d-%02d", year, month, day);
        return time == null ? date : date + "T" + time;
    }

    @Override
    public int compareTo(CalendarDate other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return toIsoString();
    }
}
