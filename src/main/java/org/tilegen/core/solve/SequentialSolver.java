package org.tilegen.core.solve;

import org.tilegen.core.grid.Grid;
import org.tilegen.core.model.PatternModel;
import org.tilegen.core.model.config.RetryPolicy;
import org.tilegen.core.model.config.SolverSettings;

import java.util.Random;

/**
 * Single-threaded attempt: collapse the lowest-entropy cell, propagate, repeat.
 * With {@link RetryPolicy#SNAPSHOT_BACKTRACK} contradictions are first handled
 * by {@link BacktrackManager}; whatever it cannot fix ends the attempt.
 */
public class SequentialSolver implements AttemptRunner {

    private final PatternModel model;
    private final int width;
    private final int height;
    private final SolverSettings settings;
    private final SolveListener listener;

    public SequentialSolver(PatternModel model, int width, int height, SolverSettings settings, SolveListener listener) {
        PatternModel.checkGridSize(width, height);
        this.model = model;
        this.width = width;
        this.height = height;
        this.settings = settings;
        this.listener = listener;
    }

    @Override
    public Grid run(int attempt, long attemptSeed, SolveStats stats) {
        Grid grid = Grid.create(model, width, height, settings.periodic);
        long[] ties = SeedStreams.tieBreaks(attemptSeed, grid.cellCount());
        CollapseScheduler scheduler = CollapseScheduler.forWholeGrid(model, grid, ties);
        scheduler.propagateAll();

        Random random = SeedStreams.workerRandom(attemptSeed, 0, 0);
        BacktrackManager backtrack = (settings.retryPolicy == RetryPolicy.SNAPSHOT_BACKTRACK)
                ? new BacktrackManager(settings.snapshotInterval, settings.maxSnapshots, settings.maxBacktracksPerAttempt)
                : null;

        try {
            while (true) {
                if (backtrack != null) backtrack.beforeDecision(grid);

                int cell = scheduler.select();
                if (cell < 0) break;
                int pattern = scheduler.decide(cell, random);
                if (backtrack != null) backtrack.onDecision(cell, pattern);

                try {
                    scheduler.commit(cell, pattern);
                    stats.collapses++;
                } catch (ContradictionException e) {
                    if (backtrack == null) throw e;

                    Grid resumed = backtrack.recover(scheduler);
                    if (resumed == null) throw e;

                    // recovered locally; terminal ones are counted by the caller
                    stats.contradictions++;
                    listener.onContradiction(attempt, e.cellIndex());
                    grid = resumed;
                    listener.onBacktrack(attempt, backtrack.backtracks());
                }
            }
        } finally {
            if (backtrack != null) stats.backtracks += backtrack.backtracks();
        }
        return grid;
    }
}
