package org.Aayush.schedule.directive;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.List;
import java.util.Objects;

/**
 * Absolute-date directive: each record jumps the timeline to one instant.
 */
@Getter
@ToString
@Accessors(fluent = true)
public final class DatesDirective implements ScheduleDirective {
    private final String keyword;
    private final List<DateRecord> records;

    /**
     * Creates a directive with an explicit keyword label.
     */
    public DatesDirective(String keyword, List<DateRecord> records) {
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.records = List.copyOf(Objects.requireNonNull(records, "records"));
    }

    /**
     * Creates a {@code DATES} directive.
     */
    public static DatesDirective of(DateRecord... records) {
        return new DatesDirective(ScheduleKeywords.DATES, List.of(records));
    }
}
