package com.ryuqq.scriptgate.testkit;

import com.ryuqq.scriptgate.core.date.CalendarDate;

/**
 * Mutable date object that behaves like the scripting engine's own date.
 *
 * <p>Each property assignment is applied immediately and the result is normalized the way the
 * engine does it: a day that does not exist in the current month spills into the following
 * month. Setting {@code month} to February on January 31 therefore yields March 2 or 3,
 * and setting {@code year} to 2023 on 2024-02-29 yields 2023-03-01.</p>
 *
 * <p>Every spill is counted in {@link #overflows()} so tests can prove an assignment order
 * never passes through a nonexistent date.</p>
 *
 * <p>Not thread-safe; one instance belongs to one script run.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public final class FakeEngineDate {

    private static final int SECONDS_PER_DAY = 24 * 60 * 60;

    private int year;
    private int month;
    private int day;
    private int seconds;
    private int overflows;

    public FakeEngineDate(int year, int month, int day, int seconds) {
        this.year = year;
        this.month = month;
        this.day = day;
        setTime(seconds);
        normalize();
    }

    /**
     * Copy of the given date, as {@code current date} would return it.
     */
    public static FakeEngineDate of(CalendarDate date) {
        return new FakeEngineDate(date.year(), date.month(), date.day(), date.secondOfDay());
    }

    public void setYear(int year) {
        if (year < CalendarDate.MIN_YEAR || year > CalendarDate.MAX_YEAR) {
            throw new IllegalArgumentException("year out of range: " + year);
        }
        this.year = year;
        normalize();
    }

    public void setMonth(int month) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month out of range: " + month);
        }
        this.month = month;
        normalize();
    }

    public void setDay(int day) {
        if (day < 1) {
            throw new IllegalArgumentException("day must be positive (current: " + day + ")");
        }
        this.day = day;
        normalize();
    }

    public void setTime(int seconds) {
        if (seconds < 0 || seconds >= SECONDS_PER_DAY) {
            throw new IllegalArgumentException("time out of range: " + seconds);
        }
        this.seconds = seconds;
    }

    public int year() {
        return year;
    }

    public int month() {
        return month;
    }

    public int day() {
        return day;
    }

    public int time() {
        return seconds;
    }

    public int overflows() {
        return overflows;
    }

    /**
     * Same text the numeric readout expression produces.
     *
     * @return {@code year:Y month:M day:D time:S}
     */
    public String readout() {
        return "year:" + year + " month:" + month + " day:" + day + " time:" + seconds;
    }

    private void normalize() {
        while (day > CalendarDate.daysInMonth(year, month)) {
            day -= CalendarDate.daysInMonth(year, month);
            month++;
            if (month > 12) {
                month = 1;
                year++;
            }
            overflows++;
        }
    }

    @Override
    public String toString() {
        return "FakeEngineDate{" + readout() + ", overflows=" + overflows + "}";
    }
}
