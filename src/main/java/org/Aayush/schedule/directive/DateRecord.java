package org.Aayush.schedule.directive;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Objects;
import java.util.Optional;

/**
 * One date record of a {@code START} or {@code DATES} directive.
 *
 * <p>The month is kept as the raw month token (for example {@code JAN} or {@code OKT});
 * the optional time text is expected as {@code HH:MM:SS}.</p>
 */
@Getter
@ToString
@Accessors(fluent = true)
public final class DateRecord {
    /** Day of month. */
    private final int day;
    /** Month token. */
    private final String month;
    /** Calendar year. */
    private final int year;
    /** Optional time-of-day text, {@code null} when absent. */
    @Getter(AccessLevel.NONE)
    private final String time;

    private DateRecord(int day, String month, int year, String time) {
        this.day = day;
        this.month = Objects.requireNonNull(month, "month");
        this.year = year;
        this.time = time;
    }

    /**
     * Creates a date record without time text (midnight).
     */
    public static DateRecord of(int day, String month, int year) {
        return new DateRecord(day, month, year, null);
    }

    /**
     * Creates a date record with time text.
     *
     * @param time time text, may be {@code null}.
     */
    public static DateRecord of(int day, String month, int year, String time) {
        return new DateRecord(day, month, year, time);
    }

    /**
     * Optional time text.
     */
    public Optional<String> time() {
        return Optional.ofNullable(time);
    }
}
