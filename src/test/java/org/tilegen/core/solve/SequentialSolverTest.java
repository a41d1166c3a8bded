package org.tilegen.core.solve;

import org.junit.jupiter.api.Test;
import org.tilegen.core.TestModels;
import org.tilegen.core.grid.Grid;
import org.tilegen.core.model.PatternModel;
import org.tilegen.core.model.config.RetryPolicy;
import org.tilegen.core.model.config.SolverSettings;

import static org.junit.jupiter.api.Assertions.*;

public class SequentialSolverTest {

    private static SolverSettings settings(RetryPolicy policy) {
        SolverSettings s = new SolverSettings();
        s.retryPolicy = policy;
        s.snapshotInterval = 1;
        return s;
    }

    @Test
    void permissiveModelAlwaysCompletes() {
        PatternModel model = TestModels.permissive(4);
        SequentialSolver solver = new SequentialSolver(model, 12, 9, settings(RetryPolicy.FULL_RESTART), new RecordingSolveListener());
        SolveStats stats = new SolveStats();

        Grid g = solver.run(1, SeedStreams.attemptSeed(99, 0), stats);

        assertTrue(g.isFullyCollapsed());
        Validation.afterSolve(model, g);
        assertEquals(12 * 9, stats.collapses);
    }

    @Test
    void sameAttemptSeedGivesSameGrid() {
        PatternModel model = TestModels.gradient(5);
        SequentialSolver solver = new SequentialSolver(model, 10, 10, settings(RetryPolicy.FULL_RESTART), new RecordingSolveListener());
        long seed = SeedStreams.attemptSeed(7, 0);

        int[] first = solver.run(1, seed, new SolveStats()).toPatternIds();
        int[] second = solver.run(1, seed, new SolveStats()).toPatternIds();
        assertArrayEquals(first, second);
    }

    @Test
    void fullRestartSurfacesContradiction() {
        PatternModel model = TestModels.ab();
        SequentialSolver solver = new SequentialSolver(model, 4, 4, settings(RetryPolicy.FULL_RESTART), new RecordingSolveListener());

        int failures = 0;
        for (long seed = 0; seed < 20; seed++) {
            try {
                Grid g = solver.run(1, SeedStreams.attemptSeed(seed, 0), new SolveStats());
                Validation.afterSolve(model, g);
            } catch (ContradictionException e) {
                assertTrue(e.cellIndex() >= 0 && e.cellIndex() < 16);
                failures++;
            }
        }
        assertTrue(failures > 0, "an early A followed by any B must contradict on some seed");
    }

    @Test
    void backtrackingRecoversWithinOneAttempt() {
        PatternModel model = TestModels.ab();
        RecordingSolveListener listener = new RecordingSolveListener();
        SequentialSolver solver = new SequentialSolver(model, 4, 4, settings(RetryPolicy.SNAPSHOT_BACKTRACK), listener);

        long totalBacktracks = 0;
        for (long seed = 0; seed < 20; seed++) {
            SolveStats stats = new SolveStats();
            Grid g = solver.run(1, SeedStreams.attemptSeed(seed, 0), stats);

            Validation.afterSolve(model, g);
            int first = g.cell(0).collapsedPattern();
            for (int i = 0; i < g.cellCount(); i++) {
                assertEquals(first, g.cell(i).collapsedPattern(), "A/B grids are uniform");
            }
            assertEquals(stats.contradictions, stats.backtracks);
            totalBacktracks += stats.backtracks;
        }
        assertTrue(totalBacktracks > 0);
        assertEquals(totalBacktracks, listener.count("backtrack"));
    }

    @Test
    void rejectsEmptyGrid() {
        assertThrows(IllegalArgumentException.class,
                () -> new SequentialSolver(TestModels.ab(), 0, 3, new SolverSettings(), new RecordingSolveListener()));
    }
}
