package org.tilegen.core.solve;

import org.tilegen.core.grid.Grid;
import org.tilegen.core.model.Direction;
import org.tilegen.core.model.PatternModel;

public final class Validation {

    private Validation() {}

    /**
     * Every cell collapsed, and every adjacent pair allowed by the model in both
     * directions.
     */
    public static void afterSolve(PatternModel model, Grid grid) {
        if (!grid.isFullyCollapsed()) {
            throw new IllegalStateException("Grid not fully collapsed: " + grid.remainingUncollapsed() + " cells left");
        }
        for (int i = 0; i < grid.cellCount(); i++) {
            int a = grid.cell(i).collapsedPattern();
            if (a < 0) {
                throw new IllegalStateException("Cell " + i + " has no pattern");
            }
            for (Direction d : Direction.values()) {
                int n = grid.neighbour(i, d);
                if (n < 0) continue;
                int b = grid.cell(n).collapsedPattern();
                if (!model.isCompatible(a, b, d)) {
                    throw new IllegalStateException("Adjacency violated: cell (" + grid.x(i) + "," + grid.y(i)
                            + ")=" + a + " has " + b + " to the " + d);
                }
            }
        }
    }
}
