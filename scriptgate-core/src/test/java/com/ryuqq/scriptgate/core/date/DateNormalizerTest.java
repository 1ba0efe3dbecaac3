package com.ryuqq.scriptgate.core.date;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DateNormalizer 테스트.
 *
 * <p>기준일은 2025-01-15 (고정 Clock).</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
class DateNormalizerTest {

    private final DateNormalizer normalizer = new DateNormalizer(
        Clock.fixed(Instant.parse("2025-01-15T10:00:00Z"), ZoneOffset.UTC)
    );

    // ========== 허용 형식 ==========

    @ParameterizedTest
    @CsvSource({
        "2024-02-29, 2024-02-29",
        "2025-1-5, 2025-01-05",
        "2025/01/15, 2025-01-15",
        "1/25/2025, 2025-01-25",
        "25.1.2025, 2025-01-25",
        "25-01-2025, 2025-01-25",
        "12/12/2025, 2025-12-12",
        "January 15 2025, 2025-01-15",
        "Jan 15 2025, 2025-01-15",
        "15 January 2025, 2025-01-15",
        "15 Jan 2025, 2025-01-15",
        "15 Sept 2025, 2025-09-15",
        "mar 1st 2024, 2024-03-01",
        "TODAY, 2025-01-15",
        "tomorrow, 2025-01-16",
        "yesterday, 2025-01-14"
    })
    void normalize_AcceptedForms_ProduceCalendarDate(String input, String expectedIso) {
        // When
        DateParseOutcome outcome = normalizer.normalize(input);

        // Then
        assertTrue(outcome.isValid(), () -> "expected valid: " + input + " but " + outcome);
        assertEquals(expectedIso, outcome.orElseThrow().toIsoString());
    }

    @Test
    void normalize_CommaSeparatedMonthName_ProducesCalendarDate() {
        assertEquals(CalendarDate.of(2024, 3, 15), normalizer.normalizeOrThrow("March 15, 2024"));
    }

    @ParameterizedTest
    @CsvSource({
        "+1d, 2025-01-16",
        "-1d, 2025-01-14",
        "+7d, 2025-01-22",
        "1d, 2025-01-16",
        "+1 day, 2025-01-16",
        "+5 days, 2025-01-20",
        "+1w, 2025-01-22",
        "-2 weeks, 2025-01-01",
        "+1m, 2025-02-15",
        "+3 months, 2025-04-15"
    })
    void normalize_RelativeOffsets_ResolveAgainstClock(String input, String expectedIso) {
        assertEquals(expectedIso, normalizer.normalizeOrThrow(input).toIsoString());
    }

    @Test
    void normalize_MonthOffsetFromMonthEnd_ClampsToLastDay() {
        // Given
        DateNormalizer endOfJanuary = new DateNormalizer(
            Clock.fixed(Instant.parse("2024-01-31T12:00:00Z"), ZoneOffset.UTC)
        );

        // When
        CalendarDate date = endOfJanuary.normalizeOrThrow("+1m");

        // Then
        assertEquals(CalendarDate.of(2024, 2, 29), date);
    }

    @Test
    void normalize_IsoWithTimeAndZone_KeepsWallClockTime() {
        // When
        CalendarDate date = normalizer.normalizeOrThrow("2025-01-15T09:30:00+05:00");

        // Then
        assertEquals(CalendarDate.of(2025, 1, 15, LocalTime.of(9, 30)), date);
        assertEquals("2025-01-15T09:30", date.toIsoString());
    }

    @Test
    void normalize_IsoRendering_RoundTripsToSameDate() {
        CalendarDate date = CalendarDate.of(2024, 2, 29, LocalTime.of(18, 5, 7));

        assertEquals(date, normalizer.normalizeOrThrow(date.toIsoString()));
        assertEquals(date, normalizer.normalize(date).orElseThrow());
    }

    // ========== 거부 형식 ==========

    @ParameterizedTest
    @ValueSource(strings = {
        "2023-02-29", "2025-04-31", "2025-00-10", "2025-13-01", "2025-01-00", "2025-01-32",
        "+d", "+1x", "++1d", "+1.5d", "1 d", "d+1",
        "next tuesday", "15 Foo 2025", "2025-01-15T25:00", "0000-01-01"
    })
    void normalize_InvalidInput_ReturnsInvalidDate(String input) {
        // When
        DateParseOutcome outcome = normalizer.normalize(input);

        // Then
        assertFalse(outcome.isValid(), () -> "expected invalid: " + input);
        assertInstanceOf(InvalidDate.class, outcome);
    }

    @Test
    void normalize_NullOrBlank_ReturnsInvalidDate() {
        assertInstanceOf(InvalidDate.class, normalizer.normalize((String) null));
        assertInstanceOf(InvalidDate.class, normalizer.normalize("   "));
    }

    // ========== 모호성 정책 ==========

    @ParameterizedTest
    @ValueSource(strings = {"02/01/2024", "03/04/2025", "01-02-2025", "1.2.2025"})
    void normalize_AmbiguousWithoutHint_ReturnsInvalidDate(String input) {
        // When
        DateParseOutcome outcome = normalizer.normalize(input, DateFormatHint.AUTO);

        // Then
        InvalidDate invalid = assertInstanceOf(InvalidDate.class, outcome);
        assertTrue(invalid.reason().contains("ambiguous"));
    }

    @Test
    void normalize_AmbiguousWithHint_ResolvesInHintOrder() {
        assertEquals(CalendarDate.of(2024, 2, 1), normalizer.normalizeOrThrow("02/01/2024", DateFormatHint.US));
        assertEquals(CalendarDate.of(2024, 1, 2), normalizer.normalizeOrThrow("02/01/2024", DateFormatHint.EUROPEAN));
    }

    @Test
    void normalize_HintContradictingData_ReturnsInvalidDate() {
        assertFalse(normalizer.normalize("13/01/2025", DateFormatHint.US).isValid());
        assertFalse(normalizer.normalize("01/13/2025", DateFormatHint.EUROPEAN).isValid());
    }

    @Test
    void normalize_IsoHintWithNumericDayMonth_ReturnsInvalidDate() {
        assertFalse(normalizer.normalize("25.1.2025", DateFormatHint.ISO).isValid());
        assertTrue(normalizer.normalize("2025-01-25", DateFormatHint.ISO).isValid());
    }

    @Test
    void normalize_IsoHintWithKeywordOrMonthName_ReturnsInvalidDate() {
        assertFalse(normalizer.normalize("March 15, 2024", DateFormatHint.ISO).isValid());
        assertFalse(normalizer.normalize("tomorrow", DateFormatHint.ISO).isValid());
        assertFalse(normalizer.normalize("+3d", DateFormatHint.ISO).isValid());
        assertTrue(normalizer.normalize("2024-03-15T09:30", DateFormatHint.ISO).isValid());
    }

    @Test
    void normalizeOrThrow_Invalid_ThrowsInvalidDateException() {
        InvalidDateException exception = assertThrows(
            InvalidDateException.class,
            () -> normalizer.normalizeOrThrow("2023-02-29")
        );
        assertEquals("2023-02-29", exception.getInput());
        assertTrue(exception.getMessage().contains("does not exist"));
    }
}
