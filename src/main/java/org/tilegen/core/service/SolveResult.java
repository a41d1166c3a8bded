package org.tilegen.core.service;

import org.tilegen.core.solve.ExhaustedAttemptsException;
import org.tilegen.core.solve.SolveStats;

/**
 * Either a collapsed grid or a terminal failure carrying the seed and the
 * number of attempts used.
 */
public final class SolveResult {

    private final CollapsedGrid grid;
    private final long seed;
    private final int attemptsUsed;
    private final int lastContradictionCell;
    private final SolveStats stats;

    private SolveResult(CollapsedGrid grid, long seed, int attemptsUsed, int lastContradictionCell, SolveStats stats) {
        this.grid = grid;
        this.seed = seed;
        this.attemptsUsed = attemptsUsed;
        this.lastContradictionCell = lastContradictionCell;
        this.stats = stats;
    }

    static SolveResult success(CollapsedGrid grid, long seed, int attemptsUsed, SolveStats stats) {
        return new SolveResult(grid, seed, attemptsUsed, -1, stats);
    }

    static SolveResult failure(long seed, int attemptsUsed, int lastContradictionCell, SolveStats stats) {
        return new SolveResult(null, seed, attemptsUsed, lastContradictionCell, stats);
    }

    public boolean isSuccess() {
        return grid != null;
    }

    /** Present only on success. */
    public CollapsedGrid grid() {
        return grid;
    }

    public long seed() {
        return seed;
    }

    public int attemptsUsed() {
        return attemptsUsed;
    }

    /** Cell of the contradiction that ended the last attempt, or -1. */
    public int lastContradictionCell() {
        return lastContradictionCell;
    }

    public SolveStats stats() {
        return stats;
    }

    /**
     * @throws ExhaustedAttemptsException if this is a failure
     */
    public CollapsedGrid orElseThrow() {
        if (grid == null) {
            throw new ExhaustedAttemptsException(seed, attemptsUsed);
        }
        return grid;
    }
}
