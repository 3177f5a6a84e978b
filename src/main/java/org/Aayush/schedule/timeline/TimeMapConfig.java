package org.Aayush.schedule.timeline;

import lombok.Builder;
import lombok.Value;
import org.Aayush.schedule.time.TimeMapException;
import org.Aayush.schedule.time.TimeUtils;

/**
 * Construction-time configuration for {@link TimeMap} and directive-driven builds.
 */
@Value
@Builder(toBuilder = true)
public class TimeMapConfig {
    /**
     * Start instant used when the directive stream carries no {@code START} directive.
     */
    public static final long DEFAULT_START_INSTANT = TimeUtils.makeDate(1983, 1, 1);
    public static final int DEFAULT_INITIAL_CAPACITY = 64;

    /**
     * Start instant in epoch seconds used when no {@code START} directive is present.
     */
    @Builder.Default
    long defaultStartInstant = DEFAULT_START_INSTANT;

    /**
     * Sizing hint for the instant and boundary lists; must be {@code >= 1}.
     */
    @Builder.Default
    int initialCapacity = DEFAULT_INITIAL_CAPACITY;

    /**
     * Returns default configuration.
     */
    public static TimeMapConfig defaults() {
        return TimeMapConfig.builder().build();
    }

    /**
     * Validates configuration values.
     *
     * @return this config.
     */
    public TimeMapConfig validate() {
        if (initialCapacity < 1) {
            throw new TimeMapException(
                    TimeMapException.REASON_INVALID_CONFIG,
                    "initialCapacity must be >= 1, got " + initialCapacity
            );
        }
        return this;
    }
}
