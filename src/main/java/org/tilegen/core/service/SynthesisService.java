package org.tilegen.core.service;

import org.tilegen.core.grid.Grid;
import org.tilegen.core.model.PatternModel;
import org.tilegen.core.model.config.RetryPolicy;
import org.tilegen.core.model.config.SolverSettings;
import org.tilegen.core.solve.AttemptRunner;
import org.tilegen.core.solve.ContradictionException;
import org.tilegen.core.solve.LoggingSolveListener;
import org.tilegen.core.solve.SeedStreams;
import org.tilegen.core.solve.SequentialSolver;
import org.tilegen.core.solve.SolveListener;
import org.tilegen.core.solve.SolveStats;
import org.tilegen.core.solve.Validation;
import org.tilegen.core.solve.parallel.ParallelCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the core: runs attempts until one collapses the whole grid or
 * the attempt budget is spent.
 *
 * <p>Each attempt starts from a fresh grid and its own derived seed, so a
 * contradiction never leaks state into the next attempt. Model errors and worker
 * failures are not retried.
 */
public class SynthesisService {

    private static final Logger LOG = LoggerFactory.getLogger(SynthesisService.class);

    private final SolveListener listener;

    public SynthesisService() {
        this(new LoggingSolveListener());
    }

    public SynthesisService(SolveListener listener) {
        this.listener = (listener != null) ? listener : new LoggingSolveListener();
    }

    public SolveResult solve(PatternModel model, int width, int height, SolverSettings settings) {
        PatternModel.checkGridSize(width, height);
        settings.validate();
        if (settings.workerCount > 1 && settings.retryPolicy == RetryPolicy.SNAPSHOT_BACKTRACK) {
            LOG.warn("Snapshot backtracking runs single-worker only; {} workers fall back to full restarts",
                    settings.workerCount);
        }

        SolveStats stats = new SolveStats();
        long start = System.currentTimeMillis();
        int lastCell = -1;

        try (AttemptRunner runner = createRunner(model, width, height, settings)) {
            for (int attempt = 1; attempt <= settings.maxAttempts; attempt++) {
                long attemptSeed = SeedStreams.attemptSeed(settings.seed, attempt - 1);
                long attemptStart = System.currentTimeMillis();
                listener.onAttemptStart(attempt, attemptSeed);
                stats.attempts = attempt;

                boolean ok = false;
                try {
                    Grid grid = runner.run(attempt, attemptSeed, stats);
                    if (settings.validateResult) {
                        Validation.afterSolve(model, grid);
                    }
                    CollapsedGrid out = new CollapsedGrid(width, height, grid.toPatternIds());
                    ok = true;
                    stats.success = true;
                    return SolveResult.success(out, settings.seed, attempt, stats);
                } catch (ContradictionException e) {
                    stats.contradictions++;
                    lastCell = e.cellIndex();
                    listener.onContradiction(attempt, e.cellIndex());
                } finally {
                    listener.onAttemptEnd(attempt, ok, System.currentTimeMillis() - attemptStart);
                }
            }
            return SolveResult.failure(settings.seed, settings.maxAttempts, lastCell, stats);
        } finally {
            stats.elapsedMs = System.currentTimeMillis() - start;
            listener.onSolveEnd(stats);
        }
    }

    private AttemptRunner createRunner(PatternModel model, int width, int height, SolverSettings settings) {
        if (settings.workerCount > 1) {
            return new ParallelCoordinator(model, width, height, settings);
        }
        return new SequentialSolver(model, width, height, settings, listener);
    }
}
