package org.tilegen.core.solve.parallel;

import org.tilegen.core.grid.Grid;
import org.tilegen.core.model.PatternModel;
import org.tilegen.core.solve.CollapseScheduler;
import org.tilegen.core.solve.ContradictionException;
import org.tilegen.core.solve.SeedStreams;

import java.util.BitSet;
import java.util.Random;
import java.util.function.IntPredicate;

/**
 * One region's private view of the grid (owned rows plus halo rows) and the
 * three round phases run on it. Only the owning thread touches the view.
 */
final class RegionWorker {

    private final Region region;
    private final Grid view;
    private final int[] rowIds;
    private final int width;
    private final CollapseScheduler scheduler;
    private final int collapsesPerRound;

    private final int topOwnedRow;
    private final int bottomOwnedRow;

    private final int[] seeds;
    long collapses;
    // set by work() when seam cells were left for a later round
    boolean deferred;

    RegionWorker(PatternModel model, Region region, Grid view, int[] rowIds, long[] globalTieBreaks, int collapsesPerRound) {
        this.region = region;
        this.view = view;
        this.rowIds = rowIds;
        this.width = view.width();
        this.collapsesPerRound = collapsesPerRound;

        this.topOwnedRow = region.hasAbove() ? 1 : 0;
        this.bottomOwnedRow = topOwnedRow + region.getHeight() - 1;
        this.seeds = new int[4 * width];

        long[] localTies = new long[view.cellCount()];
        for (int i = 0; i < localTies.length; i++) {
            localTies[i] = globalTieBreaks[toGlobal(i)];
        }
        int from = topOwnedRow * width;
        int to = (bottomOwnedRow + 1) * width;
        this.scheduler = new CollapseScheduler(model, localTies, from, to);
        this.scheduler.bind(view);
    }

    int id() {
        return region.getId();
    }

    int toGlobal(int localIndex) {
        return rowIds[localIndex / width] * width + localIndex % width;
    }

    /**
     * Up to {@code collapsesPerRound} decisions on owned cells. Seam rows are
     * only decided on this region's seam turn, so two strips never fix both
     * sides of a seam in the same round.
     *
     * @return true if anything was collapsed
     * @throws ContradictionException with a view-local cell index
     */
    boolean work(long attemptSeed, int round) {
        Random random = SeedStreams.workerRandom(attemptSeed, region.getId(), round);
        IntPredicate eligible = region.seamOpen(round) ? i -> true : i -> !isSeamCell(i);
        boolean changed = false;
        deferred = false;
        for (int k = 0; k < collapsesPerRound; k++) {
            int cell = scheduler.step(random, eligible);
            if (cell == CollapseScheduler.DEFERRED) {
                deferred = true;
                break;
            }
            if (cell < 0) break;
            collapses++;
            changed = true;
        }
        return changed;
    }

    private boolean isSeamCell(int localIndex) {
        int row = localIndex / width;
        return (row == topOwnedRow && region.hasAbove()) || (row == bottomOwnedRow && region.hasBelow());
    }

    void publish(BoundaryExchange exchange) {
        int id = region.getId();
        if (region.hasAbove()) {
            exchange.ownedTop[id] = view.exportRow(topOwnedRow);
            exchange.haloAbove[id] = view.exportRow(0);
        }
        if (region.hasBelow()) {
            exchange.ownedBottom[id] = view.exportRow(bottomOwnedRow);
            exchange.haloBelow[id] = view.exportRow(view.height() - 1);
        }
    }

    /**
     * Intersects seam rows with what the neighbours published and re-propagates.
     *
     * @return true if any domain in the view shrank
     */
    boolean merge(BoundaryExchange exchange) {
        int count = 0;
        if (region.hasAbove()) {
            int a = region.getAbove();
            count = intersectRow(0, exchange.ownedBottom[a], count);
            count = intersectRow(topOwnedRow, exchange.haloBelow[a], count);
        }
        if (region.hasBelow()) {
            int b = region.getBelow();
            count = intersectRow(view.height() - 1, exchange.ownedTop[b], count);
            count = intersectRow(bottomOwnedRow, exchange.haloAbove[b], count);
        }
        if (count == 0) return false;
        scheduler.propagateFrom(seeds, count);
        return true;
    }

    private int intersectRow(int localRow, BitSet[] incoming, int count) {
        if (incoming == null) return count;
        for (int x = 0; x < width; x++) {
            int i = localRow * width + x;
            if (view.restrict(i, incoming[x])) {
                if (view.cell(i).isEmpty()) {
                    throw new ContradictionException(i);
                }
                seeds[count++] = i;
            }
        }
        return count;
    }

    /** Copies the owned rows back into the full grid. */
    void writeOwnedRows(Grid target) {
        for (int local = topOwnedRow; local <= bottomOwnedRow; local++) {
            target.copyRowFrom(view, local, rowIds[local]);
        }
    }
}
