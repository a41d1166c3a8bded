package org.tilegen.core.solve;

import org.tilegen.core.grid.Grid;
import org.tilegen.core.model.Direction;
import org.tilegen.core.model.PatternModel;

import java.util.BitSet;
import java.util.function.IntConsumer;

/**
 * Worklist propagation to a fixpoint.
 *
 * <p>For a changed cell {@code c} and each neighbour {@code n} in direction {@code d},
 * {@code n} keeps only the patterns that some pattern still in {@code c} allows in
 * {@code d}. Every shrunk neighbour goes back on the worklist. Terminates because
 * domains only shrink over a finite pattern set.
 *
 * <p>Not thread-safe; one instance per grid owner.
 */
public final class Propagator {

    private final PatternModel model;
    private final BitSet allowed;

    // FIFO ring; a cell is queued at most once at a time
    private int[] ring = new int[0];
    private boolean[] queued = new boolean[0];
    private int head;
    private int count;

    private IntConsumer changeSink = i -> { };

    public Propagator(PatternModel model) {
        this.model = model;
        this.allowed = new BitSet(model.size());
    }

    /** Called for every cell whose domain shrank during propagation. */
    public void setChangeSink(IntConsumer sink) {
        this.changeSink = (sink == null) ? i -> { } : sink;
    }

    public int propagate(Grid grid, int seed) {
        return propagate(grid, new int[]{seed}, 1);
    }

    /** Seeds every cell; used right after a grid is created. */
    public int propagateAll(Grid grid) {
        int n = grid.cellCount();
        int[] seeds = new int[n];
        for (int i = 0; i < n; i++) seeds[i] = i;
        return propagate(grid, seeds, n);
    }

    /**
     * Propagates from {@code seeds[0..seedCount)}.
     *
     * @return number of neighbour domain changes
     * @throws ContradictionException when a domain empties; the grid is then unusable
     */
    public int propagate(Grid grid, int[] seeds, int seedCount) {
        ensureCapacity(grid.cellCount());
        clearQueue();
        for (int i = 0; i < seedCount; i++) {
            int s = seeds[i];
            if (grid.cell(s).isEmpty()) {
                throw new ContradictionException(s);
            }
            enqueue(s);
        }

        int changes = 0;
        try {
            while (count > 0) {
                int c = dequeue();
                BitSet domain = grid.cell(c).domain();

                for (int d = 0; d < Direction.COUNT; d++) {
                    Direction dir = Direction.byIndex(d);
                    int n = grid.neighbour(c, dir);
                    if (n < 0) continue;

                    allowed.clear();
                    for (int p = domain.nextSetBit(0); p >= 0; p = domain.nextSetBit(p + 1)) {
                        allowed.or(model.compatibleRow(p, dir));
                    }

                    if (grid.restrict(n, allowed)) {
                        changes++;
                        if (grid.cell(n).isEmpty()) {
                            throw new ContradictionException(n);
                        }
                        changeSink.accept(n);
                        enqueue(n);
                    }
                }
            }
        } finally {
            clearQueue();
        }
        return changes;
    }

    private void ensureCapacity(int cells) {
        if (ring.length < cells) {
            ring = new int[cells];
            queued = new boolean[cells];
        }
    }

    private void enqueue(int i) {
        if (queued[i]) return;
        queued[i] = true;
        ring[(head + count) % ring.length] = i;
        count++;
    }

    private int dequeue() {
        int i = ring[head];
        head = (head + 1) % ring.length;
        count--;
        queued[i] = false;
        return i;
    }

    private void clearQueue() {
        while (count > 0) {
            dequeue();
        }
        head = 0;
    }
}
