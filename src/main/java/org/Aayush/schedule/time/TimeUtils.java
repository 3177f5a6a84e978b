package org.Aayush.schedule.time;

import java.time.DateTimeException;
import java.time.LocalDate;

/**
 * Shared deterministic calendar helpers for schedule time-map construction.
 *
 * <p>Instants are {@code long} seconds since 1970-01-01T00:00:00 in the proleptic
 * Gregorian calendar. No timezone is applied. All methods are safe for negative instants.</p>
 */
public final class TimeUtils {

    public static final long SECONDS_PER_DAY = 86_400L;
    private static final long SECONDS_PER_HOUR = 3600L;
    private static final long SECONDS_PER_MINUTE = 60L;

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Builds an instant at midnight of the given calendar date.
     *
     * @param year calendar year.
     * @param month calendar month in {@code [1, 12]}.
     * @param day day of month.
     * @return instant in epoch seconds.
     * @throws TimeMapException with {@link TimeMapException#REASON_INVALID_CALENDAR_DATE}
     *                          when the date does not exist.
     */
    public static long makeDate(int year, int month, int day) {
        return makeDateTime(year, month, day, 0, 0, 0);
    }

    /**
     * Builds an instant from calendar fields.
     *
     * <p>Fields are combined with wrapping arithmetic (day 33 of January lands in
     * February, hour 24 lands on the next day). The resulting date is then read back
     * and compared with the inputs: any wrap of year, month or day is rejected.
     * Wrapping of minutes and seconds inside the same day is accepted.</p>
     *
     * @param year calendar year.
     * @param month calendar month in {@code [1, 12]}.
     * @param day day of month.
     * @param hour hour of day.
     * @param minute minute of hour.
     * @param second second of minute.
     * @return instant in epoch seconds.
     * @throws TimeMapException with {@link TimeMapException#REASON_INVALID_CALENDAR_DATE}
     *                          when the fields do not round-trip.
     */
    public static long makeDateTime(int year, int month, int day, int hour, int minute, int second) {
        long epochSeconds;
        try {
            long epochDay = LocalDate.of(year, 1, 1)
                    .plusMonths(month - 1L)
                    .plusDays(day - 1L)
                    .toEpochDay();
            long timeOfDay = hour * SECONDS_PER_HOUR + minute * SECONDS_PER_MINUTE + second;
            epochSeconds = Math.addExact(Math.multiplyExact(epochDay, SECONDS_PER_DAY), timeOfDay);
        } catch (DateTimeException | ArithmeticException ex) {
            throw new TimeMapException(
                    TimeMapException.REASON_INVALID_CALENDAR_DATE,
                    "date is outside the supported range: " + describe(year, month, day),
                    ex
            );
        }

        LocalDate resolved = toLocalDate(epochSeconds);
        if (resolved.getYear() != year || resolved.getMonthValue() != month || resolved.getDayOfMonth() != day) {
            throw new TimeMapException(
                    TimeMapException.REASON_INVALID_CALENDAR_DATE,
                    "invalid input arguments for date: " + describe(year, month, day)
                            + " " + hour + ":" + minute + ":" + second
                            + " resolves to " + resolved
            );
        }
        return epochSeconds;
    }

    /**
     * Returns calendar year of an instant.
     */
    public static int yearOf(long epochSeconds) {
        return toLocalDate(epochSeconds).getYear();
    }

    /**
     * Returns calendar month of an instant in {@code [1, 12]}.
     */
    public static int monthOf(long epochSeconds) {
        return toLocalDate(epochSeconds).getMonthValue();
    }

    /**
     * Returns day of month of an instant.
     */
    public static int dayOf(long epochSeconds) {
        return toLocalDate(epochSeconds).getDayOfMonth();
    }

    /**
     * Returns calendar date containing an instant.
     *
     * @param epochSeconds instant in epoch seconds.
     * @return calendar date (floor division, so pre-1970 instants resolve to the correct day).
     * @throws TimeMapException with {@link TimeMapException#REASON_INVALID_CALENDAR_DATE}
     *                          when the instant is beyond the representable calendar range.
     */
    public static LocalDate toLocalDate(long epochSeconds) {
        try {
            return LocalDate.ofEpochDay(Math.floorDiv(epochSeconds, SECONDS_PER_DAY));
        } catch (DateTimeException ex) {
            throw new TimeMapException(
                    TimeMapException.REASON_INVALID_CALENDAR_DATE,
                    "instant has no calendar date: " + epochSeconds,
                    ex
            );
        }
    }

    /**
     * Shifts an instant forward by a number of seconds.
     *
     * @param epochSeconds base instant.
     * @param seconds seconds delta (can be negative).
     * @return shifted instant.
     * @throws ArithmeticException on overflow.
     */
    public static long forward(long epochSeconds, long seconds) {
        return Math.addExact(epochSeconds, seconds);
    }

    /**
     * Shifts an instant forward by hours, minutes and seconds.
     *
     * @throws ArithmeticException on overflow.
     */
    public static long forward(long epochSeconds, long hours, long minutes, long seconds) {
        long delta = Math.addExact(
                Math.addExact(Math.multiplyExact(hours, SECONDS_PER_HOUR), Math.multiplyExact(minutes, SECONDS_PER_MINUTE)),
                seconds
        );
        return forward(epochSeconds, delta);
    }

    /**
     * Converts a day count into whole seconds, truncating toward zero.
     *
     * @param days day count, may carry sub-day precision.
     * @return {@code (long) (days * 86400)}.
     */
    public static long daysToSeconds(double days) {
        if (!Double.isFinite(days)) {
            throw new IllegalArgumentException("days must be finite: " + days);
        }
        return (long) (days * SECONDS_PER_DAY);
    }

    private static String describe(int year, int month, int day) {
        return String.format("%04d-%02d-%02d", year, month, day);
    }
}
