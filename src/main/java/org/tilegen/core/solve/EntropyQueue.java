package org.tilegen.core.solve;

import org.tilegen.core.grid.Cell;
import org.tilegen.core.grid.Grid;
import org.tilegen.core.model.PatternModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.function.IntPredicate;

/**
 * Min-heap of candidate cells ordered by (entropy, tie-break, index).
 * Entries go stale when their cell changes; they are skipped on poll.
 */
final class EntropyQueue {

    private record Entry(double entropy, long tieBreak, int index, int revision) {
    }

    private static final Comparator<Entry> ORDER = Comparator
            .comparingDouble(Entry::entropy)
            .thenComparingLong(Entry::tieBreak)
            .thenComparingInt(Entry::index);

    private final PatternModel model;
    private final long[] tieBreaks;
    private final int fromIndex;
    private final int toIndex;
    private final PriorityQueue<Entry> heap = new PriorityQueue<>(ORDER);

    /**
     * @param tieBreaks one value per grid cell
     * @param fromIndex first candidate cell (inclusive)
     * @param toIndex   last candidate cell (exclusive)
     */
    EntropyQueue(PatternModel model, long[] tieBreaks, int fromIndex, int toIndex) {
        this.model = model;
        this.tieBreaks = tieBreaks;
        this.fromIndex = fromIndex;
        this.toIndex = toIndex;
    }

    void rebuild(Grid grid) {
        heap.clear();
        for (int i = fromIndex; i < toIndex; i++) {
            offer(grid, i);
        }
    }

    void offer(Grid grid, int index) {
        if (index < fromIndex || index >= toIndex) return;
        Cell c = grid.cell(index);
        if (c.isCollapsed() || c.isEmpty()) return;
        heap.add(new Entry(c.entropy(model), tieBreaks[index], index, c.revision()));
    }

    /** Lowest-entropy uncollapsed candidate, or {@link CollapseScheduler#NONE} if none is left. */
    int poll(Grid grid) {
        return poll(grid, i -> true);
    }

    /**
     * Lowest-entropy candidate accepted by {@code eligible}. Live candidates it
     * rejects stay queued; if only those are left, returns
     * {@link CollapseScheduler#DEFERRED}.
     */
    int poll(Grid grid, IntPredicate eligible) {
        List<Entry> held = null;
        int found = CollapseScheduler.NONE;
        while (!heap.isEmpty()) {
            Entry e = heap.poll();
            Cell c = grid.cell(e.index());
            if (c.isCollapsed() || c.revision() != e.revision()) continue;
            if (!eligible.test(e.index())) {
                if (held == null) held = new ArrayList<>();
                held.add(e);
                continue;
            }
            found = e.index();
            break;
        }
        if (held != null) {
            heap.addAll(held);
            if (found < 0) return CollapseScheduler.DEFERRED;
        }
        return found;
    }
}
