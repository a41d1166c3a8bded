package org.tilegen.core.solve;

import org.junit.jupiter.api.Test;
import org.tilegen.core.TestModels;
import org.tilegen.core.grid.Grid;
import org.tilegen.core.model.PatternModel;

import static org.junit.jupiter.api.Assertions.*;
import static org.tilegen.core.TestModels.A;
import static org.tilegen.core.TestModels.B;

public class ValidationTest {

    private final PatternModel model = TestModels.ab();

    @Test
    void acceptsUniformGrid() {
        Grid g = Grid.create(model, 3, 2);
        for (int i = 0; i < g.cellCount(); i++) g.collapse(i, B);
        assertDoesNotThrow(() -> Validation.afterSolve(model, g));
    }

    @Test
    void rejectsBNextToA() {
        Grid g = Grid.create(model, 2, 1);
        g.collapse(0, A);
        g.collapse(1, B);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> Validation.afterSolve(model, g));
        assertTrue(e.getMessage().contains("Adjacency violated"));
    }

    @Test
    void rejectsUnfinishedGrid() {
        Grid g = Grid.create(model, 2, 2);
        g.collapse(0, A);
        assertThrows(IllegalStateException.class, () -> Validation.afterSolve(model, g));
    }

    @Test
    void checksWrapAroundSeamsOnPeriodicGrid() {
        PatternModel gradient = TestModels.gradient(3);
        Grid open = Grid.create(gradient, 3, 1);
        Grid wrapped = Grid.create(gradient, 3, 1, true);
        for (int x = 0; x < 3; x++) {
            open.collapse(x, x);
            wrapped.collapse(x, x);
        }
        assertDoesNotThrow(() -> Validation.afterSolve(gradient, open));
        // 2 at the right edge touches 0 at the left edge
        assertThrows(IllegalStateException.class, () -> Validation.afterSolve(gradient, wrapped));
    }
}
