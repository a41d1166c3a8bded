package org.tilegen.core.grid;

import org.tilegen.core.model.Direction;
import org.tilegen.core.model.PatternModel;

import java.util.BitSet;

/**
 * Fixed width x height array of cells in row-major order. Neighbours are
 * computed from the index, never stored.
 */
public final class Grid {

    private final int width;
    private final int height;
    private final int patternCount;
    private final boolean wrapX;
    private final boolean wrapY;
    private final Cell[] cells;
    private int remaining;

    private Grid(int width, int height, int patternCount, boolean wrapX, boolean wrapY, Cell[] cells, int remaining) {
        this.width = width;
        this.height = height;
        this.patternCount = patternCount;
        this.wrapX = wrapX;
        this.wrapY = wrapY;
        this.cells = cells;
        this.remaining = remaining;
    }

    public static Grid create(PatternModel model, int width, int height) {
        return create(model, width, height, false);
    }

    /**
     * Every cell starts with the full pattern set. A periodic grid wraps on both
     * axes, so edge cells have four neighbours too.
     */
    public static Grid create(PatternModel model, int width, int height, boolean periodic) {
        PatternModel.checkGridSize(width, height);
        int n = model.size();
        Cell[] cells = new Cell[width * height];
        for (int i = 0; i < cells.length; i++) {
            cells[i] = new Cell(n);
        }
        return new Grid(width, height, n, periodic, periodic, cells, n == 1 ? 0 : cells.length);
    }

    public Grid copy() {
        Cell[] c = new Cell[cells.length];
        for (int i = 0; i < cells.length; i++) {
            c[i] = cells[i].copy();
        }
        return new Grid(width, height, patternCount, wrapX, wrapY, c, remaining);
    }

    /**
     * Copies the given rows, top to bottom, into a standalone grid. Horizontal
     * wrapping is kept; the stacked rows never wrap vertically.
     */
    public Grid pickRows(int[] rowIds) {
        int h = rowIds.length;
        Cell[] c = new Cell[width * h];
        int left = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < width; x++) {
                Cell src = cells[index(x, rowIds[y])];
                c[y * width + x] = src.copy();
                if (!src.isCollapsed()) left++;
            }
        }
        return new Grid(width, h, patternCount, wrapX, false, c, left);
    }

    /** Overwrites row {@code targetRow} with row {@code sourceRow} of {@code src}. */
    public void copyRowFrom(Grid src, int sourceRow, int targetRow) {
        if (src.width != width) {
            throw new IllegalArgumentException("Row width mismatch: " + src.width + " vs " + width);
        }
        for (int x = 0; x < width; x++) {
            int i = index(x, targetRow);
            Cell before = cells[i];
            Cell after = src.cells[src.index(x, sourceRow)].copy();
            cells[i] = after;
            if (before.isCollapsed() && !after.isCollapsed()) remaining++;
            else if (!before.isCollapsed() && after.isCollapsed()) remaining--;
        }
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean isPeriodic() {
        return wrapX && wrapY;
    }

    public int cellCount() {
        return cells.length;
    }

    public int index(int x, int y) {
        return y * width + x;
    }

    public int x(int index) {
        return index % width;
    }

    public int y(int index) {
        return index / width;
    }

    /** Index of the neighbour in {@code dir}, or -1 off the edge. */
    public int neighbour(int index, Direction dir) {
        int nx = x(index) + dir.dx;
        int ny = y(index) + dir.dy;
        if (nx < 0 || nx >= width) {
            if (!wrapX) return -1;
            nx = Math.floorMod(nx, width);
        }
        if (ny < 0 || ny >= height) {
            if (!wrapY) return -1;
            ny = Math.floorMod(ny, height);
        }
        return ny * width + nx;
    }

    public Cell cell(int index) {
        return cells[index];
    }

    public Cell cell(int x, int y) {
        return cells[index(x, y)];
    }

    public int remainingUncollapsed() {
        return remaining;
    }

    public boolean isFullyCollapsed() {
        return remaining == 0;
    }

    /** Intersects the cell's domain with {@code allowed}; true if it shrank. */
    public boolean restrict(int index, BitSet allowed) {
        Cell c = cells[index];
        boolean wasCollapsed = c.isCollapsed();
        boolean changed = c.and(allowed);
        track(c, wasCollapsed);
        return changed;
    }

    public boolean ban(int index, int pattern) {
        Cell c = cells[index];
        boolean wasCollapsed = c.isCollapsed();
        boolean changed = c.clear(pattern);
        track(c, wasCollapsed);
        return changed;
    }

    /** Reduces the cell to {@code pattern}; empties it if the pattern was already gone. */
    public boolean collapse(int index, int pattern) {
        Cell c = cells[index];
        boolean wasCollapsed = c.isCollapsed();
        boolean changed = c.fix(pattern);
        track(c, wasCollapsed);
        return changed;
    }

    private void track(Cell c, boolean wasCollapsed) {
        boolean now = c.isCollapsed();
        if (!wasCollapsed && now) remaining--;
        else if (wasCollapsed && !now) remaining++;
    }

    /** Domain copies of one row, for exchange between regions. */
    public BitSet[] exportRow(int y) {
        BitSet[] out = new BitSet[width];
        for (int x = 0; x < width; x++) {
            out[x] = cells[index(x, y)].domainCopy();
        }
        return out;
    }

    /** Pattern id per cell; only valid once the grid is fully collapsed. */
    public int[] toPatternIds() {
        if (!isFullyCollapsed()) {
            throw new IllegalStateException("Grid still has " + remaining + " uncollapsed cells");
        }
        int[] out = new int[cells.length];
        for (int i = 0; i < cells.length; i++) {
            out[i] = cells[i].collapsed;
        }
        return out;
    }
}
