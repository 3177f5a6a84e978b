package org.Aayush.schedule.timeline;

import java.time.LocalDate;

/**
 * Calendar field whose change marks a boundary step.
 */
public enum BoundaryGranularity {
    MONTH {
        @Override
        boolean changed(LocalDate previous, LocalDate next) {
            return previous.getMonthValue() != next.getMonthValue();
        }
    },
    YEAR {
        @Override
        boolean changed(LocalDate previous, LocalDate next) {
            return previous.getYear() != next.getYear();
        }
    };

    /**
     * Returns {@code true} when the calendar field differs between two dates.
     *
     * <p>Only the field itself is compared: for {@code MONTH}, January 2020 followed
     * by January 2021 is not a change.</p>
     */
    abstract boolean changed(LocalDate previous, LocalDate next);
}
