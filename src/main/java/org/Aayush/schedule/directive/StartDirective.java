package org.Aayush.schedule.directive;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Start-date directive, carrying at most one date record.
 */
@Getter
@ToString
@Accessors(fluent = true)
public final class StartDirective implements ScheduleDirective {
    private final String keyword;
    /** Start date, {@code null} when the extraction layer found no record. */
    private final DateRecord record;

    /**
     * Creates a directive with an explicit keyword label.
     */
    public StartDirective(String keyword, DateRecord record) {
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.record = record;
    }

    /**
     * Creates a {@code START} directive.
     */
    public static StartDirective of(DateRecord record) {
        return new StartDirective(ScheduleKeywords.START, record);
    }
}
