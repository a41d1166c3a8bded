package org.tilegen.core.solve;

import org.tilegen.core.grid.Grid;
import org.tilegen.core.grid.GridSnapshot;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Snapshot-based local backtracking for one attempt.
 *
 * <p>A snapshot is taken every {@code interval} collapses and remembers the latest
 * decision made after it. On a contradiction the newest snapshot is restored and
 * the decision whose commit failed is banned at its cell; decisions made between
 * the snapshot and the failing one are replayed by the scheduler. If the ban
 * empties the cell or propagation contradicts, the snapshot is dropped and the
 * next older one is restored with the last decision taken before the dropped
 * snapshot banned. Returns {@code null} once no snapshot or backtrack budget is
 * left; the caller then restarts the attempt.
 */
public final class BacktrackManager {

    private final int interval;
    private final int maxSnapshots;
    private final int maxBacktracks;

    private final Deque<GridSnapshot> snapshots = new ArrayDeque<>();
    private int collapses;
    private int lastSnapshotAt = Integer.MIN_VALUE;
    private int backtracks;

    public BacktrackManager(int interval, int maxSnapshots, int maxBacktracks) {
        this.interval = interval;
        this.maxSnapshots = maxSnapshots;
        this.maxBacktracks = maxBacktracks;
    }

    public void beforeDecision(Grid grid) {
        if (snapshots.isEmpty() || collapses - lastSnapshotAt >= interval) {
            push(new GridSnapshot(grid, collapses));
        }
    }

    public void onDecision(int cellIndex, int pattern) {
        GridSnapshot top = snapshots.peekFirst();
        if (top != null) {
            top.recordDecision(cellIndex, pattern);
        }
        collapses++;
    }

    /**
     * @return a consistent grid to resume from, or {@code null} if backtracking gave up
     */
    public Grid recover(CollapseScheduler scheduler) {
        while (!snapshots.isEmpty() && backtracks < maxBacktracks) {
            GridSnapshot top = snapshots.pollFirst();
            if (!top.hasDecision()) {
                continue;
            }
            backtracks++;

            Grid grid = top.restore();
            int cell = top.decisionCell();
            grid.ban(cell, top.decisionPattern());
            if (grid.cell(cell).isEmpty()) {
                continue;
            }

            scheduler.bind(grid);
            try {
                scheduler.propagateFrom(new int[]{cell}, 1);
            } catch (ContradictionException e) {
                continue;
            }
            push(new GridSnapshot(grid, top.collapseCount()));
            return grid;
        }
        return null;
    }

    public int backtracks() {
        return backtracks;
    }

    public int snapshotCount() {
        return snapshots.size();
    }

    private void push(GridSnapshot s) {
        snapshots.addFirst(s);
        lastSnapshotAt = collapses;
        while (snapshots.size() > maxSnapshots) {
            snapshots.pollLast();
        }
    }
}
