package org.Aayush.schedule.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimeUtils Calendar Tests")
class TimeUtilsTest {

    // ========== Calendar Constructor Tests ==========

    @ParameterizedTest
    @CsvSource({
            "1970, 1, 1, 0",
            "1983, 1, 1, 410227200",
            "2020, 1, 1, 1577836800",
            "2024, 2, 29, 1709164800",   // leap day
            "1969, 12, 31, -86400"       // pre-1970
    })
    void testMakeDate_KnownInstants(int year, int month, int day, long expected) {
        assertEquals(expected, TimeUtils.makeDate(year, month, day));
    }

    @ParameterizedTest
    @CsvSource({
            "2020, 2, 29",
            "1900, 3, 1",
            "2000, 2, 29",
            "1960, 7, 15",
            "2100, 12, 31"
    })
    void testMakeDate_RoundTrip(int year, int month, int day) {
        long instant = TimeUtils.makeDate(year, month, day);
        assertEquals(year, TimeUtils.yearOf(instant));
        assertEquals(month, TimeUtils.monthOf(instant));
        assertEquals(day, TimeUtils.dayOf(instant));
    }

    @ParameterizedTest
    @CsvSource({
            "2021, 2, 30",   // wraps to March 2
            "2021, 2, 29",   // not a leap year
            "1900, 2, 29",   // century, not a leap year
            "2021, 1, 33",
            "2021, 13, 1",
            "2021, 0, 1",
            "2021, 4, 0",
            "2021, 4, 31"
    })
    void testMakeDate_WrappedDateRejected(int year, int month, int day) {
        TimeMapException ex = assertThrows(TimeMapException.class, () -> TimeUtils.makeDate(year, month, day));
        assertEquals(TimeMapException.REASON_INVALID_CALENDAR_DATE, ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[" + TimeMapException.REASON_INVALID_CALENDAR_DATE + "]"));
    }

    @Test
    void testMakeDate_YearOutOfSupportedRange() {
        TimeMapException ex = assertThrows(TimeMapException.class, () -> TimeUtils.makeDate(1_000_000_000, 1, 1));
        assertEquals(TimeMapException.REASON_INVALID_CALENDAR_DATE, ex.reasonCode());
    }

    @Test
    void testMakeDateTime_TimeOfDay() {
        long midnight = TimeUtils.makeDate(2021, 1, 31);
        assertEquals(midnight + 45_015L, TimeUtils.makeDateTime(2021, 1, 31, 12, 30, 15));
        assertEquals(midnight + 86_399L, TimeUtils.makeDateTime(2021, 1, 31, 23, 59, 59));
    }

    @Test
    void testMakeDateTime_HourRollingIntoNextDayRejected() {
        TimeMapException ex = assertThrows(TimeMapException.class,
                () -> TimeUtils.makeDateTime(2021, 1, 31, 24, 0, 0));
        assertEquals(TimeMapException.REASON_INVALID_CALENDAR_DATE, ex.reasonCode());
        assertThrows(TimeMapException.class, () -> TimeUtils.makeDateTime(2021, 1, 1, -1, 0, 0));
    }

    @Test
    void testMakeDateTime_MinuteWrapWithinSameDayAccepted() {
        // Only year, month and day are checked after construction.
        long midnight = TimeUtils.makeDate(2021, 6, 1);
        assertEquals(midnight + 99 * 60L, TimeUtils.makeDateTime(2021, 6, 1, 0, 99, 0));
    }

    // ========== Field Extraction Tests ==========

    @Test
    void testFieldExtraction_NegativeInstant() {
        assertEquals(1969, TimeUtils.yearOf(-1L));
        assertEquals(12, TimeUtils.monthOf(-1L));
        assertEquals(31, TimeUtils.dayOf(-1L));
    }

    @Test
    void testFieldExtraction_LastSecondOfMonth() {
        long firstOfMarch = TimeUtils.makeDate(2020, 3, 1);
        assertEquals(2, TimeUtils.monthOf(firstOfMarch - 1));
        assertEquals(29, TimeUtils.dayOf(firstOfMarch - 1));
        assertEquals(3, TimeUtils.monthOf(firstOfMarch));
    }

    @Test
    void testToLocalDate_OutOfCalendarRange() {
        TimeMapException ex = assertThrows(TimeMapException.class, () -> TimeUtils.toLocalDate(Long.MAX_VALUE));
        assertEquals(TimeMapException.REASON_INVALID_CALENDAR_DATE, ex.reasonCode());
    }

    // ========== Arithmetic Tests ==========

    @Test
    void testForward() {
        assertEquals(110L, TimeUtils.forward(100L, 10L));
        assertEquals(90L, TimeUtils.forward(100L, -10L));
        assertEquals(10L + 3600L + 120L + 3L, TimeUtils.forward(10L, 1L, 2L, 3L));
    }

    @Test
    void testForward_Overflow() {
        assertThrows(ArithmeticException.class, () -> TimeUtils.forward(Long.MAX_VALUE, 1L));
        assertThrows(ArithmeticException.class, () -> TimeUtils.forward(0L, Long.MAX_VALUE, 0L, 0L));
    }

    @ParameterizedTest
    @CsvSource({
            "1.0, 86400",
            "1.5, 129600",
            "31, 2678400",
            "1.9999999, 172799",     // truncated, not rounded
            "0.00001, 0",
            "-0.00001, 0",           // toward zero
            "-1.5, -129600"
    })
    void testDaysToSeconds(double days, long expectedSeconds) {
        assertEquals(expectedSeconds, TimeUtils.daysToSeconds(days));
    }

    @ParameterizedTest
    @ValueSource(doubles = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY})
    void testDaysToSeconds_NonFiniteRejected(double days) {
        assertThrows(IllegalArgumentException.class, () -> TimeUtils.daysToSeconds(days));
    }
}
