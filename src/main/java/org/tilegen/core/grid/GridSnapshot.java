package org.tilegen.core.grid;

/**
 * Frozen copy of a grid plus the latest decision taken after it was captured.
 * While the snapshot is the newest one that decision is the one being
 * committed; once a newer snapshot exists it is the last decision before it.
 * Opaque outside the solver.
 */
public final class GridSnapshot {

    private final Grid frozen;
    private final int collapseCount;
    private int decisionCell = -1;
    private int decisionPattern = -1;

    public GridSnapshot(Grid grid, int collapseCount) {
        this.frozen = grid.copy();
        this.collapseCount = collapseCount;
    }

    public void recordDecision(int cellIndex, int pattern) {
        decisionCell = cellIndex;
        decisionPattern = pattern;
    }

    public boolean hasDecision() {
        return decisionCell >= 0;
    }

    public int decisionCell() {
        return decisionCell;
    }

    public int decisionPattern() {
        return decisionPattern;
    }

    public int collapseCount() {
        return collapseCount;
    }

    /** Fresh mutable copy; the snapshot itself stays untouched. */
    public Grid restore() {
        return frozen.copy();
    }
}
