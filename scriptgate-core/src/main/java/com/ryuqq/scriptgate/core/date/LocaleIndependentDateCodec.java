package com.ryuqq.scriptgate.core.date;

import com.ryuqq.scriptgate.core.script.ScriptEscaper;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 로케일에 의존하지 않는 날짜 인코딩/디코딩.
 *
 * <p>외부 엔진의 날짜 문자열 표기는 시스템 로케일마다 달라지므로 문자열로 날짜를
 * 주고받지 않습니다. 보낼 때는 정수/월 상수 속성 대입만, 읽을 때는 숫자 속성만 사용합니다.</p>
 *
 * <p><strong>대입 순서 (고정):</strong></p>
 * <pre>
 * set v to current date
 * set time of v to 0
 * set day of v to 1          -- 이후 연/월 변경이 월 넘침을 일으키지 않도록
 * set year of v to 2024
 * set month of v to February -- 정수가 아닌 월 상수
 * set day of v to 29
 * set time of v to 34200     -- 시각이 있을 때만
 * </pre>
 *
 * <p>day를 먼저 1로 내리지 않으면 "1월 31일 → month=2" 같은 중간 상태가 3월 2일로
 * 넘어가 버립니다. 위 순서는 어떤 중간 상태도 존재하지 않는 날짜를 거치지 않습니다.</p>
 *
 * <p><strong>읽기 형식:</strong> {@code year:2024 month:2 day:29 time:0}</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public final class LocaleIndependentDateCodec {

    private static final String[] MONTH_CONSTANTS = {
        "January", "February", "March", "April", "May", "June",
        "July", "August", "September", "October", "November", "December"
    };

    private static final Pattern FIELDS_PATTERN = Pattern.compile(
        "year\\s*:\\s*(\\S+?)\\s*,?\\s*month\\s*:\\s*(\\S+?)\\s*,?\\s*day\\s*:\\s*(\\S+?)"
            + "(?:\\s*,?\\s*time\\s*:\\s*(\\S+?))?\\s*$"
    );

    private static final Pattern DIGITS = Pattern.compile("^\\d{1,9}$");

    private static final int SECONDS_PER_DAY = 24 * 60 * 60;

    /**
     * 날짜를 대입 목록으로 인코딩.
     *
     * @param date 날짜
     * @param variable 날짜 변수 이름
     * @return 순서 있는 대입 목록
     * @throws IllegalArgumentException date가 null이거나 variable이 식별자가 아닌 경우
     */
    public DateInstructions encode(CalendarDate date, String variable) {
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        ScriptEscaper.identifier(variable);

        List<DateAssignment> assignments = new ArrayList<>(7);
        assignments.add(new DateAssignment(DateField.BASE, "current date"));
        assignments.add(new DateAssignment(DateField.TIME, "0"));
        assignments.add(new DateAssignment(DateField.DAY, "1"));
        assignments.add(new DateAssignment(DateField.YEAR, Integer.toString(date.year())));
        assignments.add(new DateAssignment(DateField.MONTH, monthConstant(date.month())));
        assignments.add(new DateAssignment(DateField.DAY, Integer.toString(date.day())));
        if (date.hasTime()) {
            assignments.add(new DateAssignment(DateField.TIME, Integer.toString(date.secondOfDay())));
        }
        return new DateInstructions(variable, assignments);
    }

    /**
     * 엔진의 날짜 변수를 숫자 속성 문자열로 읽어내는 AppleScript 식.
     *
     * @param variable 날짜 변수 이름
     * @return AppleScript 식
     */
    public String readout(String variable) {
        ScriptEscaper.identifier(variable);
        return "\"year:\" & (year of " + variable + " as integer)"
            + " & \" month:\" & (month of " + variable + " as integer)"
            + " & \" day:\" & (day of " + variable + ")"
            + " & \" time:\" & (time of " + variable + ")";
    }

    /**
     * {@link #readout(String)} 출력을 날짜로 해석.
     *
     * <p>표시용 날짜 문자열은 해석하지 않습니다. 공백, 앞의 {@code date} 접두사, 감싼 따옴표는 무시합니다.</p>
     *
     * @param engineOutput 엔진 출력
     * @return ParsedDate 또는 InvalidDate
     */
    public DateParseOutcome decode(String engineOutput) {
        if (engineOutput == null || engineOutput.isBlank()) {
            return new InvalidDate(engineOutput, "engine returned no date");
        }
        String text = engineOutput.strip();
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            text = text.substring(1, text.length() - 1).strip();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.startsWith("date ")) {
            text = text.substring(5).strip();
            lower = lower.substring(5).strip();
        }
        if ("missing value".equals(lower)) {
            return new InvalidDate(engineOutput, "date is missing value");
        }

        Matcher matcher = FIELDS_PATTERN.matcher(lower);
        if (!matcher.matches()) {
            return new InvalidDate(engineOutput, "not a numeric date property readout");
        }
        String yearText = matcher.group(1);
        String monthText = matcher.group(2);
        String dayText = matcher.group(3);
        String timeText = matcher.group(4);
        if (!isDigits(yearText) || !isDigits(monthText) || !isDigits(dayText)
            || (timeText != null && !isDigits(timeText))) {
            return new InvalidDate(engineOutput, "date fields must be numeric");
        }

        int year = Integer.parseInt(yearText);
        int month = Integer.parseInt(monthText);
        int day = Integer.parseInt(dayText);
        if (year < CalendarDate.MIN_YEAR || year > CalendarDate.MAX_YEAR) {
            return new InvalidDate(engineOutput, "year out of range: " + year);
        }
        if (month < 1 || month > 12) {
            return new InvalidDate(engineOutput, "month out of range: " + month);
        }
        if (day < 1 || day > CalendarDate.daysInMonth(year, month)) {
            return new InvalidDate(engineOutput, "day out of range: " + day);
        }
        LocalTime time = null;
        if (timeText != null) {
            int seconds = Integer.parseInt(timeText);
            if (seconds >= SECONDS_PER_DAY) {
                return new InvalidDate(engineOutput, "time out of range: " + seconds);
            }
            time = LocalTime.ofSecondOfDay(seconds);
        }
        return new ParsedDate(CalendarDate.of(year, month, day, time), engineOutput);
    }

    /**
     * 월 번호에 해당하는 AppleScript 월 상수.
     *
     * @param month 1..12
     * @return {@code January} .. {@code December}
     */
    public static String monthConstant(int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12 (current: " + month + ")");
        }
        return MONTH_CONSTANTS[month - 1];
    }

    private static boolean isDigits(String text) {
        return DIGITS.matcher(text).matches();
    }
}
