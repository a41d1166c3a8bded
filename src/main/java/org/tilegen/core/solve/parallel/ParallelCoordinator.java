package org.tilegen.core.solve.parallel;

import org.tilegen.core.grid.Grid;
import org.tilegen.core.model.PatternModel;
import org.tilegen.core.model.config.SolverSettings;
import org.tilegen.core.solve.AttemptRunner;
import org.tilegen.core.solve.ContradictionException;
import org.tilegen.core.solve.Propagator;
import org.tilegen.core.solve.SeedStreams;
import org.tilegen.core.solve.SolveStats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Solves one attempt with one worker per horizontal strip, in synchronised rounds:
 * <ol>
 *   <li>work: each worker collapses and propagates inside its own view;</li>
 *   <li>publish: seam rows go into the {@link BoundaryExchange};</li>
 *   <li>barrier, which fixes whether this round merges at all;</li>
 *   <li>merge: seam rows are intersected with the neighbours' copies and re-propagated;</li>
 *   <li>barrier; stop on contradiction or failure, or once a round changed nothing
 *       and no seam cell is waiting for its turn.</li>
 * </ol>
 *
 * <p>Workers never write to the same cell, and seam rows are only read across
 * regions between the two barriers. The output is reproducible for a fixed
 * (seed, worker count) pair because every worker's stream is derived from
 * (attempt seed, region, round) and merges are order independent.
 */
public class ParallelCoordinator implements AttemptRunner {

    private final PatternModel model;
    private final int width;
    private final int height;
    private final SolverSettings settings;
    private final Region[] regions;
    private final ExecutorService pool;

    /** Runs on each worker thread before its work phase. */
    interface WorkerHook {
        void beforeWork(int region, int round);
    }

    WorkerHook workerHook = (region, round) -> { };

    public ParallelCoordinator(PatternModel model, int width, int height, SolverSettings settings) {
        PatternModel.checkGridSize(width, height);
        this.model = model;
        this.width = width;
        this.height = height;
        this.settings = settings;
        this.regions = RegionPartitioner.createHorizontalStrips(width, height, settings.workerCount, settings.periodic);

        AtomicInteger threadNo = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(regions.length, r -> {
            Thread th = new Thread(r, "tilegen-worker-" + threadNo.getAndIncrement());
            th.setDaemon(true);
            return th;
        });
    }

    public int regionCount() {
        return regions.length;
    }

    @Override
    public Grid run(int attempt, long attemptSeed, SolveStats stats) {
        Grid grid = Grid.create(model, width, height, settings.periodic);
        new Propagator(model).propagateAll(grid);

        long[] ties = SeedStreams.tieBreaks(attemptSeed, grid.cellCount());
        RegionWorker[] workers = new RegionWorker[regions.length];
        for (int i = 0; i < regions.length; i++) {
            Region r = regions[i];
            int[] rows = r.viewRows();
            Grid view = (regions.length == 1) ? grid.copy() : grid.pickRows(rows);
            workers[i] = new RegionWorker(model, r, view, rows, ties, settings.collapsesPerRound);
        }

        RoundState state = new RoundState(regions.length);
        BoundaryExchange exchange = new BoundaryExchange(regions.length);
        CyclicBarrier published = new CyclicBarrier(regions.length, state::closeWork);
        CyclicBarrier merged = new CyclicBarrier(regions.length, state::endRound);

        List<Future<?>> futures = new ArrayList<>(workers.length);
        for (RegionWorker w : workers) {
            futures.add(pool.submit(() -> workerLoop(w, attemptSeed, state, exchange, published, merged)));
        }
        awaitAll(futures, state);

        for (RegionWorker w : workers) {
            stats.collapses += w.collapses;
        }
        stats.rounds += state.round;

        for (int i = 0; i < regions.length; i++) {
            if (state.failures[i] != null) {
                throw new WorkerFailureException(i, state.failures[i]);
            }
        }
        for (int i = 0; i < regions.length; i++) {
            if (state.contradictionCells[i] >= 0) {
                throw new ContradictionException(state.contradictionCells[i]);
            }
        }

        for (RegionWorker w : workers) {
            w.writeOwnedRows(grid);
        }
        return grid;
    }

    private void workerLoop(RegionWorker w,
                            long attemptSeed,
                            RoundState state,
                            BoundaryExchange exchange,
                            CyclicBarrier published,
                            CyclicBarrier merged) {
        int id = w.id();
        while (true) {
            // a previous abort already ended the loop, so every worker works every round
            try {
                workerHook.beforeWork(id, state.round);
                if (w.work(attemptSeed, state.round)) state.changed[id] = true;
                if (w.deferred) state.pending[id] = true;
                w.publish(exchange);
            } catch (ContradictionException e) {
                state.contradiction(id, w.toGlobal(e.cellIndex()));
            } catch (Throwable t) {
                // the barrier must still be reached, or every other worker waits forever
                state.fail(id, t);
            }
            if (!await(published, id, state)) return;

            // frozen by the published barrier; aborts raised while merging do not change it
            if (state.mergeAllowed) {
                try {
                    if (w.merge(exchange)) state.changed[id] = true;
                } catch (ContradictionException e) {
                    state.contradiction(id, w.toGlobal(e.cellIndex()));
                } catch (Throwable t) {
                    state.fail(id, t);
                }
            }
            if (!await(merged, id, state)) return;

            if (state.stop) return;
        }
    }

    private static boolean await(CyclicBarrier barrier, int id, RoundState state) {
        try {
            barrier.await();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.fail(id, e);
            return false;
        } catch (BrokenBarrierException e) {
            // another worker already recorded why
            if (!state.aborted) state.fail(id, e);
            return false;
        }
    }

    private static void awaitAll(List<Future<?>> futures, RoundState state) {
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WorkerFailureException(i, e);
            } catch (ExecutionException e) {
                state.fail(i, e.getCause());
            }
        }
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    /**
     * Shared per-attempt flags. Each worker writes only its own slot; the merged
     * barrier's action reads them all, and the barrier publishes the result.
     */
    static final class RoundState {
        final boolean[] changed;
        final boolean[] pending;
        final int[] contradictionCells;
        final Throwable[] failures;

        volatile boolean aborted;
        volatile boolean mergeAllowed;
        volatile boolean stop;
        volatile int round;

        RoundState(int workers) {
            this.changed = new boolean[workers];
            this.pending = new boolean[workers];
            this.contradictionCells = new int[workers];
            this.failures = new Throwable[workers];
            Arrays.fill(contradictionCells, -1);
        }

        void contradiction(int worker, int globalCell) {
            contradictionCells[worker] = globalCell;
            aborted = true;
        }

        void fail(int worker, Throwable cause) {
            if (failures[worker] == null) failures[worker] = cause;
            aborted = true;
        }

        /** Action of the published barrier: the merge phase runs only if the work phase was clean. */
        void closeWork() {
            mergeAllowed = !aborted;
        }

        void endRound() {
            boolean any = false;
            for (int i = 0; i < changed.length; i++) {
                any |= changed[i] | pending[i];
                changed[i] = false;
                pending[i] = false;
            }
            if (aborted || !any) {
                stop = true;
            }
            round++;
        }
    }
}
