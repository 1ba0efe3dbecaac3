package com.ryuqq.scriptgate.core.date;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CalendarDate 테스트.
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
class CalendarDateTest {

    @Test
    void of_LeapDay_ValidOnlyInLeapYears() {
        assertDoesNotThrow(() -> CalendarDate.of(2024, 2, 29));
        assertDoesNotThrow(() -> CalendarDate.of(2000, 2, 29));
        assertThrows(IllegalArgumentException.class, () -> CalendarDate.of(1900, 2, 29));
        assertThrows(IllegalArgumentException.class, () -> CalendarDate.of(2023, 2, 29));
    }

    @Test
    void of_OutOfRangeFields_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> CalendarDate.of(2025, 4, 31));
        assertThrows(IllegalArgumentException.class, () -> CalendarDate.of(2025, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> CalendarDate.of(2025, 13, 1));
        assertThrows(IllegalArgumentException.class, () -> CalendarDate.of(0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> CalendarDate.of(10000, 1, 1));
    }

    @Test
    void plusMonths_FromMonthEnd_ClampsToTargetMonthEnd() {
        assertEquals(CalendarDate.of(2023, 2, 28), CalendarDate.of(2023, 1, 31).plusMonths(1));
        assertEquals(CalendarDate.of(2024, 4, 30), CalendarDate.of(2024, 3, 31).plusMonths(1));
    }

    @Test
    void plusDays_CrossesYearBoundary() {
        assertEquals(CalendarDate.of(2025, 1, 1), CalendarDate.of(2024, 12, 31).plusDays(1));
        assertEquals(CalendarDate.of(2024, 12, 25), CalendarDate.of(2025, 1, 1).plusWeeks(-1));
    }

    @Test
    void time_MidnightIsTreatedAsDateOnly() {
        CalendarDate date = CalendarDate.of(2025, 1, 15, LocalTime.MIDNIGHT);

        assertFalse(date.hasTime());
        assertEquals(CalendarDate.of(2025, 1, 15), date);
    }

    @Test
    void time_TruncatedToSeconds() {
        CalendarDate date = CalendarDate.of(2025, 1, 15, LocalTime.of(9, 30, 15, 999_000_000));

        assertEquals(LocalTime.of(9, 30, 15), date.time());
        assertEquals(34215, date.secondOfDay());
    }

    @Test
    void compareTo_OrdersChronologically() {
        assertTrue(CalendarDate.of(2024, 12, 31).compareTo(CalendarDate.of(2025, 1, 1)) < 0);
        assertTrue(CalendarDate.of(2025, 1, 1, LocalTime.NOON).compareTo(CalendarDate.of(2025, 1, 1)) > 0);
    }

    @Test
    void toIsoString_PadsFields() {
        assertEquals("0099-03-07", CalendarDate.of(99, 3, 7).toIsoString());
        assertEquals("2025-01-15T09:05", CalendarDate.of(2025, 1, 15, LocalTime.of(9, 5)).toIsoString());
    }
}
