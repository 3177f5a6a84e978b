package org.Aayush.schedule.timeline;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Append-only ascending sequence of boundary step indices for one granularity.
 *
 * <p>Positions returned by lookups are positions inside this sequence, not step values.</p>
 */
public final class BoundaryIndex {
    static final int NOT_FOUND = -1;

    private final BoundaryGranularity granularity;
    private final IntArrayList steps;
    private final IntList readOnlyView;

    BoundaryIndex(BoundaryGranularity granularity, int initialCapacity) {
        this.granularity = granularity;
        this.steps = new IntArrayList(initialCapacity);
        this.readOnlyView = IntLists.unmodifiable(steps);
    }

    /**
     * Appends one boundary step; must be greater than the current tail.
     */
    void append(int step) {
        if (step < 1) {
            throw new IllegalArgumentException("boundary step must be >= 1, got " + step);
        }
        if (!steps.isEmpty() && step <= steps.getInt(steps.size() - 1)) {
            throw new IllegalStateException(
                    granularity + " boundary steps must be strictly ascending: " + step
                            + " after " + steps.getInt(steps.size() - 1)
            );
        }
        steps.add(step);
    }

    /**
     * Granularity served by this index.
     */
    public BoundaryGranularity granularity() {
        return granularity;
    }

    /**
     * Number of boundary steps.
     */
    public int size() {
        return steps.size();
    }

    /**
     * Boundary step at a sequence position.
     */
    public int stepAt(int position) {
        return steps.getInt(position);
    }

    /**
     * Returns {@code true} when {@code step} is a boundary step.
     */
    public boolean contains(int step) {
        return positionOf(step) != NOT_FOUND;
    }

    /**
     * Returns the sequence position of {@code step}, or {@code -1} when absent.
     */
    public int positionOf(int step) {
        int found = IntArrays.binarySearch(steps.elements(), 0, steps.size(), step);
        return found >= 0 ? found : NOT_FOUND;
    }

    /**
     * Returns the position of the smallest boundary step {@code >= step}, or {@code -1} when none.
     */
    public int ceilingPositionOf(int step) {
        int found = IntArrays.binarySearch(steps.elements(), 0, steps.size(), step);
        if (found >= 0) {
            return found;
        }
        int insertionPoint = -(found + 1);
        return insertionPoint < steps.size() ? insertionPoint : NOT_FOUND;
    }

    /**
     * Read-only live view of the boundary steps.
     */
    public IntList steps() {
        return readOnlyView;
    }

    /**
     * Copy of the boundary steps.
     */
    public int[] toIntArray() {
        return steps.toIntArray();
    }

    @Override
    public String toString() {
        return "BoundaryIndex{" + granularity + "=" + steps + "}";
    }
}
