package org.Aayush.schedule.timeline;

import java.util.Objects;

/**
 * Periodic month/year boundary membership.
 *
 * <p>Counting starts at the resolved anchor boundary as position 1 and every
 * {@code frequency}-th boundary from there is selected. An anchor step that is not
 * itself a boundary resolves to the first boundary at or after it; an anchor past the
 * last boundary selects nothing.</p>
 */
public final class PeriodicBoundaryPredicate {

    private PeriodicBoundaryPredicate() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns {@code true} when {@code step} is a selected boundary.
     *
     * @param boundaries boundary index to consult.
     * @param step queried step index.
     * @param anchorStep step index counting starts from.
     * @param frequency select every n-th boundary; values {@code <= 1} select all boundaries.
     * @return whether {@code step} is a boundary at the requested frequency.
     */
    public static boolean test(BoundaryIndex boundaries, int step, int anchorStep, int frequency) {
        BoundaryIndex index = Objects.requireNonNull(boundaries, "boundaries");
        int stepPosition = index.positionOf(step);
        if (stepPosition == BoundaryIndex.NOT_FOUND) {
            return false;
        }
        if (frequency <= 1) {
            return true;
        }

        int anchorPosition = index.ceilingPositionOf(anchorStep);
        if (anchorPosition == BoundaryIndex.NOT_FOUND || stepPosition < anchorPosition) {
            return false;
        }
        int ordinal = stepPosition - anchorPosition + 1;
        return ordinal % frequency == 0;
    }
}
