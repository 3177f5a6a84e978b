package org.Aayush.schedule.directive;

/**
 * One already-parsed schedule directive in document order.
 */
public interface ScheduleDirective {

    /**
     * Keyword name as reported by the extraction layer, for example {@code DATES}.
     */
    String keyword();
}
