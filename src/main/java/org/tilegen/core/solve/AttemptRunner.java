package org.tilegen.core.solve;

import org.tilegen.core.grid.Grid;

/**
 * Runs one solve attempt from a fresh grid to a fully collapsed one.
 */
public interface AttemptRunner extends AutoCloseable {

    /**
     * @throws ContradictionException if the attempt cannot finish
     */
    Grid run(int attempt, long attemptSeed, SolveStats stats);

    @Override
    default void close() {
    }
}
