package org.Aayush.schedule.directive;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import org.Aayush.schedule.time.TimeMapException;
import org.Aayush.schedule.time.TimeUtils;
import org.Aayush.schedule.timeline.TimeMap;
import org.Aayush.schedule.timeline.TimeMapConfig;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link TimeMap} from schedule directives in document order.
 *
 * <p>The first {@code START} directive sets the start instant; without one the configured
 * default start is used. {@code DATES} records and {@code TSTEP} values are appended in
 * order. Every other directive is skipped.</p>
 */
public final class TimeMapBuilder {
    // Same acceptance as "%d:%d:%d": leading whitespace before each number, trailing text ignored.
    private static final Pattern TIME_OF_DAY =
            Pattern.compile("\\s*([+-]?\\d{1,9}):\\s*([+-]?\\d{1,9}):\\s*([+-]?\\d{1,9})");

    private final TimeMapConfig config;

    /**
     * Creates a builder with default configuration.
     */
    public TimeMapBuilder() {
        this(TimeMapConfig.defaults());
    }

    /**
     * Creates a builder with explicit configuration.
     */
    public TimeMapBuilder(TimeMapConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    /**
     * Builds a time map from a directive stream.
     *
     * @param directives directives in document order.
     * @return populated time map.
     * @throws TimeMapException when a directive yields an invalid or non-increasing instant.
     */
    public TimeMap build(List<? extends ScheduleDirective> directives) {
        List<? extends ScheduleDirective> nonNullDirectives = Objects.requireNonNull(directives, "directives");
        TimeMap timeMap = new TimeMap(resolveStartInstant(nonNullDirectives), config);

        for (ScheduleDirective directive : nonNullDirectives) {
            ScheduleDirective nonNullDirective = Objects.requireNonNull(directive, "directive");
            switch (ScheduleKeywords.kindOf(nonNullDirective.keyword())) {
                case ABSOLUTE_DATE:
                    addFromDatesKeyword(timeMap, nonNullDirective);
                    break;
                case RELATIVE_ADVANCE:
                    addFromTStepKeyword(timeMap, nonNullDirective);
                    break;
                default:
                    break;
            }
        }
        return timeMap;
    }

    /**
     * Appends every record of a {@code DATES} directive.
     *
     * @throws TimeMapException with {@link TimeMapException#REASON_WRONG_DIRECTIVE_KIND}
     *                          when the directive is not a {@code DATES} directive.
     */
    public static void addFromDatesKeyword(TimeMap timeMap, ScheduleDirective directive) {
        Objects.requireNonNull(timeMap, "timeMap");
        Objects.requireNonNull(directive, "directive");
        if (!ScheduleKeywords.DATES.equals(directive.keyword()) || !(directive instanceof DatesDirective)) {
            throw wrongKind(ScheduleKeywords.DATES, directive);
        }
        for (DateRecord record : ((DatesDirective) directive).records()) {
            timeMap.addTime(timeFromRecord(record));
        }
    }

    /**
     * Appends every step of a {@code TSTEP} directive.
     *
     * @throws TimeMapException with {@link TimeMapException#REASON_WRONG_DIRECTIVE_KIND}
     *                          when the directive is not a {@code TSTEP} directive.
     */
    public static void addFromTStepKeyword(TimeMap timeMap, ScheduleDirective directive) {
        Objects.requireNonNull(timeMap, "timeMap");
        Objects.requireNonNull(directive, "directive");
        if (!ScheduleKeywords.TSTEP.equals(directive.keyword()) || !(directive instanceof TStepDirective)) {
            throw wrongKind(ScheduleKeywords.TSTEP, directive);
        }
        DoubleList days = ((TStepDirective) directive).days();
        for (int i = 0; i < days.size(); i++) {
            timeMap.addTStep(TimeUtils.daysToSeconds(days.getDouble(i)));
        }
    }

    /**
     * Converts one date record to an instant.
     *
     * <p>Unparseable time text falls back to midnight.</p>
     *
     * @throws TimeMapException with {@link TimeMapException#REASON_UNKNOWN_MONTH_NAME} or
     *                          {@link TimeMapException#REASON_INVALID_CALENDAR_DATE}.
     */
    public static long timeFromRecord(DateRecord record) {
        DateRecord nonNullRecord = Objects.requireNonNull(record, "record");
        int month = MonthNames.monthIndex(nonNullRecord.month());
        int[] hms = parseTimeOfDay(nonNullRecord.time());
        return TimeUtils.makeDateTime(nonNullRecord.year(), month, nonNullRecord.day(), hms[0], hms[1], hms[2]);
    }

    /**
     * Parses {@code HH:MM:SS} text into hour, minute and second.
     *
     * @return three fields, or {@code {0, 0, 0}} when the text is absent or has fewer than three fields.
     */
    static int[] parseTimeOfDay(Optional<String> timeText) {
        if (timeText.isEmpty()) {
            return new int[]{0, 0, 0};
        }
        Matcher matcher = TIME_OF_DAY.matcher(timeText.get());
        if (!matcher.lookingAt()) {
            return new int[]{0, 0, 0};
        }
        return new int[]{
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3))
        };
    }

    private long resolveStartInstant(List<? extends ScheduleDirective> directives) {
        for (ScheduleDirective directive : directives) {
            if (directive == null || ScheduleKeywords.kindOf(directive.keyword()) != ScheduleKeywords.DirectiveKind.START) {
                continue;
            }
            if (!(directive instanceof StartDirective) || ((StartDirective) directive).record() == null) {
                throw new TimeMapException(
                        TimeMapException.REASON_START_RECORD_REQUIRED,
                        "START directive must carry one date record: " + directive
                );
            }
            return timeFromRecord(((StartDirective) directive).record());
        }
        return config.getDefaultStartInstant();
    }

    private static TimeMapException wrongKind(String expectedKeyword, ScheduleDirective directive) {
        return new TimeMapException(
                TimeMapException.REASON_WRONG_DIRECTIVE_KIND,
                "method requires " + expectedKeyword + " keyword input, got " + directive.keyword()
        );
    }
}
