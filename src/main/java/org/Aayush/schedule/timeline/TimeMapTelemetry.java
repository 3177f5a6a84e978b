package org.Aayush.schedule.timeline;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable time-map telemetry snapshot.
 */
@Value
@Builder
public class TimeMapTelemetry {

    /**
     * Number of report steps.
     */
    int numTimesteps;

    /**
     * First instant in epoch seconds.
     */
    long startInstant;

    /**
     * Last instant in epoch seconds.
     */
    long endInstant;

    /**
     * Number of first-of-month steps.
     */
    int monthBoundaryCount;

    /**
     * Number of first-of-year steps.
     */
    int yearBoundaryCount;
}
