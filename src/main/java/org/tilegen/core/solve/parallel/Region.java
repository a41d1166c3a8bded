package org.tilegen.core.solve.parallel;

/**
 * A horizontal strip of full-width rows owned by one worker.
 *
 * <p>Neighbouring strips meet at a seam: the last row of the upper strip and the
 * first row of the lower one. Each worker holds a read-only halo copy of the
 * row across the seam, which only its owner may collapse.
 */
public final class Region {
    private final int id;
    private final int startY;
    private final int endY;
    private final int width;

    // -1 when there is no strip on that side
    int above = -1;
    int below = -1;
    int aboveRow = -1;
    int belowRow = -1;

    // seam rows are decided only on rounds where round % seamTurns == seamTurn
    int seamTurn;
    int seamTurns = 1;

    public Region(int id, int startY, int endY, int width) {
        this.id = id;
        this.startY = startY;
        this.endY = endY;
        this.width = width;
    }

    public int getId() { return id; }
    public int getStartY() { return startY; }
    public int getEndY() { return endY; }
    public int getHeight() { return endY - startY + 1; }
    public int getCellCount() { return getHeight() * width; }

    public int getAbove() { return above; }
    public int getBelow() { return below; }
    public boolean hasAbove() { return above >= 0; }
    public boolean hasBelow() { return below >= 0; }

    /**
     * True if this strip may make decisions on its seam rows in {@code round}.
     * Strips that share a seam never have the same turn.
     */
    public boolean seamOpen(int round) {
        return round % seamTurns == seamTurn;
    }

    /** Global row ids of the worker's view: halo above, owned rows, halo below. */
    public int[] viewRows() {
        int n = getHeight() + (hasAbove() ? 1 : 0) + (hasBelow() ? 1 : 0);
        int[] rows = new int[n];
        int k = 0;
        if (hasAbove()) rows[k++] = aboveRow;
        for (int y = startY; y <= endY; y++) rows[k++] = y;
        if (hasBelow()) rows[k] = belowRow;
        return rows;
    }

    @Override
    public String toString() {
        return String.format("Region[%d: rows %d-%d, above=%d, below=%d, %d cells]",
                id, startY, endY, above, below, getCellCount());
    }
}
