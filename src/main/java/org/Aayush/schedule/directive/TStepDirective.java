package org.Aayush.schedule.directive;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Relative-advance directive: each value advances the timeline by that many days.
 */
@Getter
@ToString
@Accessors(fluent = true)
public final class TStepDirective implements ScheduleDirective {
    private final String keyword;
    /** Step lengths in days, read-only. */
    private final DoubleList days;

    /**
     * Creates a directive with an explicit keyword label.
     */
    public TStepDirective(String keyword, double[] days) {
        this.keyword = Objects.requireNonNull(keyword, "keyword");
        this.days = DoubleLists.unmodifiable(new DoubleArrayList(Objects.requireNonNull(days, "days")));
    }

    /**
     * Creates a {@code TSTEP} directive.
     */
    public static TStepDirective of(double... days) {
        return new TStepDirective(ScheduleKeywords.TSTEP, days);
    }
}
