package org.tilegen.core.solve;

import org.tilegen.core.grid.Grid;
import org.tilegen.core.model.PatternModel;

import java.util.Random;
import java.util.function.IntPredicate;

/**
 * One forced decision per {@link #step}: the lowest-entropy candidate cell is
 * collapsed to a weight-proportional draw and the change is propagated.
 *
 * <p>Candidates are the cells in {@code [fromIndex, toIndex)}; a region worker
 * passes its owned rows, the sequential solver the whole grid. Propagation
 * itself is not limited to candidates.
 */
public final class CollapseScheduler {

    /** Nothing left to decide. */
    public static final int NONE = -1;
    /** Undecided candidates remain, but none is eligible right now. */
    public static final int DEFERRED = -2;

    private final PatternModel model;
    private final Propagator propagator;
    private final EntropyQueue queue;
    private Grid bound;

    public CollapseScheduler(PatternModel model, long[] tieBreaks, int fromIndex, int toIndex) {
        this.model = model;
        this.propagator = new Propagator(model);
        this.queue = new EntropyQueue(model, tieBreaks, fromIndex, toIndex);
        this.propagator.setChangeSink(i -> queue.offer(bound, i));
    }

    public static CollapseScheduler forWholeGrid(PatternModel model, Grid grid, long[] tieBreaks) {
        CollapseScheduler s = new CollapseScheduler(model, tieBreaks, 0, grid.cellCount());
        s.bind(grid);
        return s;
    }

    /** Points the scheduler at {@code grid} and rebuilds the candidate heap from it. */
    public void bind(Grid grid) {
        this.bound = grid;
        queue.rebuild(grid);
    }

    public Grid grid() {
        return bound;
    }

    /** Next cell to decide, or -1 when every candidate is collapsed. */
    public int select() {
        return queue.poll(bound);
    }

    public int decide(int cellIndex, Random random) {
        return WeightedPicker.pick(model, bound.cell(cellIndex).domain(), random);
    }

    /** Collapses and propagates; returns the number of neighbour changes. */
    public int commit(int cellIndex, int pattern) {
        bound.collapse(cellIndex, pattern);
        return propagator.propagate(bound, cellIndex);
    }

    /**
     * Runs select, decide and commit.
     *
     * @return the collapsed cell, or -1 if there was nothing left to collapse
     * @throws ContradictionException if propagation emptied a domain
     */
    public int step(Random random) {
        int cell = select();
        if (cell < 0) return NONE;
        commit(cell, decide(cell, random));
        return cell;
    }

    /**
     * Like {@link #step(Random)} but only over cells accepted by {@code eligible}.
     *
     * @return the collapsed cell, {@link #NONE}, or {@link #DEFERRED}
     */
    public int step(Random random, IntPredicate eligible) {
        int cell = queue.poll(bound, eligible);
        if (cell < 0) return cell;
        commit(cell, decide(cell, random));
        return cell;
    }

    /** Propagates from externally changed cells (merges, bans) and requeues them. */
    public int propagateFrom(int[] seeds, int seedCount) {
        for (int i = 0; i < seedCount; i++) {
            queue.offer(bound, seeds[i]);
        }
        return propagator.propagate(bound, seeds, seedCount);
    }

    public int propagateAll() {
        int changes = propagator.propagateAll(bound);
        queue.rebuild(bound);
        return changes;
    }
}
