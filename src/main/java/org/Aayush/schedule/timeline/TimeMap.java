package org.Aayush.schedule.timeline;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.Aayush.schedule.time.TimeMapException;
import org.Aayush.schedule.time.TimeUtils;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Ordered report-step timeline with first-of-month and first-of-year step tracking.
 *
 * <p>Instant {@code 0} is the start instant; step {@code i >= 1} spans
 * {@code [instantAt(i - 1), instantAt(i)]}. Instants are strictly increasing and are only
 * ever appended.</p>
 *
 * <p>Not thread-safe for mutation. Once construction has finished, all query methods are
 * safe for concurrent read-only use.</p>
 */
public final class TimeMap {
    private final LongArrayList timeList;
    private final BoundaryIndex firstTimestepMonths;
    private final BoundaryIndex firstTimestepYears;

    /**
     * Creates a time map holding only the start instant.
     *
     * @param startInstant start instant in epoch seconds.
     */
    public TimeMap(long startInstant) {
        this(startInstant, TimeMapConfig.defaults());
    }

    /**
     * Creates a time map holding only the start instant.
     *
     * @param startInstant start instant in epoch seconds.
     * @param config sizing configuration.
     */
    public TimeMap(long startInstant, TimeMapConfig config) {
        TimeMapConfig nonNullConfig = Objects.requireNonNull(config, "config").validate();
        // Rejects instants outside the calendar range before anything is stored.
        TimeUtils.toLocalDate(startInstant);
        this.timeList = new LongArrayList(nonNullConfig.getInitialCapacity());
        this.firstTimestepMonths = new BoundaryIndex(BoundaryGranularity.MONTH, nonNullConfig.getInitialCapacity());
        this.firstTimestepYears = new BoundaryIndex(BoundaryGranularity.YEAR, nonNullConfig.getInitialCapacity());
        timeList.add(startInstant);
    }

    /**
     * Appends one instant.
     *
     * @param newTime instant in epoch seconds; must be after the current last instant.
     * @throws TimeMapException with {@link TimeMapException#REASON_NON_MONOTONIC_TIME}
     *                          when {@code newTime} does not increase the timeline.
     */
    public void addTime(long newTime) {
        long lastTime = timeList.getLong(timeList.size() - 1);
        if (newTime <= lastTime) {
            throw new TimeMapException(
                    TimeMapException.REASON_NON_MONOTONIC_TIME,
                    "times added must be in strictly increasing order: " + newTime + " after " + lastTime
            );
        }

        int step = timeList.size();
        LocalDate lastDate = TimeUtils.toLocalDate(lastTime);
        LocalDate newDate = TimeUtils.toLocalDate(newTime);
        if (BoundaryGranularity.MONTH.changed(lastDate, newDate)) {
            firstTimestepMonths.append(step);
        }
        if (BoundaryGranularity.YEAR.changed(lastDate, newDate)) {
            firstTimestepYears.append(step);
        }
        timeList.add(newTime);
    }

    /**
     * Appends the last instant shifted by {@code seconds}.
     *
     * @param seconds step length in seconds; must be positive.
     */
    public void addTStep(long seconds) {
        addTime(TimeUtils.forward(getEndTime(), seconds));
    }

    /**
     * Number of instants, including the start instant.
     */
    public int size() {
        return timeList.size();
    }

    /**
     * Number of report steps ({@code size() - 1}).
     */
    public int numTimesteps() {
        return timeList.size() - 1;
    }

    /**
     * Index of the last report step.
     */
    public int last() {
        return numTimesteps();
    }

    /**
     * Returns instant at {@code index}.
     *
     * @throws TimeMapException with {@link TimeMapException#REASON_INDEX_OUT_OF_RANGE}
     *                          when {@code index} is not in {@code [0, size())}.
     */
    public long instantAt(int index) {
        requireInstantIndex(index);
        return timeList.getLong(index);
    }

    /**
     * Start instant of report step {@code index + 1}; same as {@link #instantAt(int)}.
     */
    public long getStartTime(int index) {
        return instantAt(index);
    }

    /**
     * Last instant.
     */
    public long getEndTime() {
        return timeList.getLong(timeList.size() - 1);
    }

    /**
     * Seconds between the start instant and instant {@code index}.
     */
    public double getTimePassedUntil(int index) {
        long deltaT = instantAt(index) - timeList.getLong(0);
        return (double) deltaT;
    }

    /**
     * Length in seconds of the step that starts at instant {@code index}.
     *
     * @throws TimeMapException with {@link TimeMapException#REASON_INDEX_OUT_OF_RANGE}
     *                          when {@code index} is not in {@code [0, numTimesteps())}.
     */
    public double getTimeStepLength(int index) {
        if (index < 0 || index >= numTimesteps()) {
            throw new TimeMapException(
                    TimeMapException.REASON_INDEX_OUT_OF_RANGE,
                    "step index " + index + " out of range [0, " + numTimesteps() + ")"
            );
        }
        long deltaT = timeList.getLong(index + 1) - timeList.getLong(index);
        return (double) deltaT;
    }

    /**
     * Seconds between first and last instant, or {@code 0} for a map without steps.
     */
    public double getTotalTime() {
        if (timeList.size() < 2) {
            return 0.0;
        }
        long deltaT = getEndTime() - timeList.getLong(0);
        return (double) deltaT;
    }

    /**
     * Read-only ascending steps whose month differs from the previous instant.
     */
    public IntList firstTimestepMonths() {
        return firstTimestepMonths.steps();
    }

    /**
     * Read-only ascending steps whose year differs from the previous instant.
     */
    public IntList firstTimestepYears() {
        return firstTimestepYears.steps();
    }

    /**
     * Boundary index for one granularity.
     */
    public BoundaryIndex boundaries(BoundaryGranularity granularity) {
        switch (Objects.requireNonNull(granularity, "granularity")) {
            case MONTH:
                return firstTimestepMonths;
            case YEAR:
                return firstTimestepYears;
            default:
                throw new IllegalArgumentException("unsupported granularity: " + granularity);
        }
    }

    /**
     * Returns {@code true} when {@code timestep} starts a new month or year and is
     * selected at {@code frequency} counting from {@code startTimestep}.
     *
     * @see PeriodicBoundaryPredicate#test(BoundaryIndex, int, int, int)
     */
    public boolean isTimestepInFirstOfMonthsYearsSequence(
            int timestep,
            BoundaryGranularity granularity,
            int startTimestep,
            int frequency
    ) {
        return PeriodicBoundaryPredicate.test(boundaries(granularity), timestep, startTimestep, frequency);
    }

    /**
     * Shorthand for {@link #isTimestepInFirstOfMonthsYearsSequence(int, BoundaryGranularity, int, int)}.
     */
    public boolean isPeriodicBoundary(int timestep, BoundaryGranularity granularity, int anchorStep, int frequency) {
        return isTimestepInFirstOfMonthsYearsSequence(timestep, granularity, anchorStep, frequency);
    }

    /**
     * Copy of all instants.
     */
    public long[] toLongArray() {
        return timeList.toLongArray();
    }

    /**
     * Returns immutable telemetry snapshot.
     */
    public TimeMapTelemetry telemetry() {
        return TimeMapTelemetry.builder()
                .numTimesteps(numTimesteps())
                .startInstant(timeList.getLong(0))
                .endInstant(getEndTime())
                .monthBoundaryCount(firstTimestepMonths.size())
                .yearBoundaryCount(firstTimestepYears.size())
                .build();
    }

    private void requireInstantIndex(int index) {
        if (index < 0 || index >= timeList.size()) {
            throw new TimeMapException(
                    TimeMapException.REASON_INDEX_OUT_OF_RANGE,
                    "index " + index + " out of range [0, " + timeList.size() + ")"
            );
        }
    }
}
