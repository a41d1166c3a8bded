package org.tilegen.core.solve;

import org.junit.jupiter.api.Test;
import org.tilegen.core.TestModels;
import org.tilegen.core.grid.Grid;
import org.tilegen.core.model.PatternModel;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.tilegen.core.TestModels.A;
import static org.tilegen.core.TestModels.B;

public class PropagatorTest {

    @Test
    void collapsingBForcesWholeGridToB() {
        PatternModel m = TestModels.ab();
        Grid g = Grid.create(m, 3, 3);
        Propagator p = new Propagator(m);

        g.collapse(g.index(1, 1), B);
        p.propagate(g, g.index(1, 1));

        assertTrue(g.isFullyCollapsed());
        for (int i = 0; i < g.cellCount(); i++) {
            assertEquals(B, g.cell(i).collapsedPattern());
        }
    }

    @Test
    void collapsingALeavesNeighboursOpen() {
        PatternModel m = TestModels.ab();
        Grid g = Grid.create(m, 3, 3);
        g.collapse(0, A);
        int changes = new Propagator(m).propagate(g, 0);

        assertEquals(0, changes);
        assertEquals(8, g.remainingUncollapsed());
    }

    @Test
    void bNextToCollapsedAContradicts() {
        PatternModel m = TestModels.ab();
        Grid g = Grid.create(m, 3, 3);
        Propagator p = new Propagator(m);

        g.collapse(0, A);
        p.propagate(g, 0);
        g.collapse(1, B);
        ContradictionException e = assertThrows(ContradictionException.class, () -> p.propagate(g, 1));
        assertEquals(0, e.cellIndex());
    }

    @Test
    void mutuallyIncompatibleSingleCellContradictsOnFirstPropagation() {
        PatternModel m = TestModels.mutuallyIncompatible();
        Grid g = Grid.create(m, 1, 1, true);
        assertEquals(2, g.cell(0).size());

        ContradictionException e = assertThrows(ContradictionException.class, () -> new Propagator(m).propagateAll(g));
        assertEquals(0, e.cellIndex());
    }

    @Test
    void uniqueModelSettlesWithoutAnyDecision() {
        PatternModel m = TestModels.unique();
        Grid g = Grid.create(m, 5, 4);
        new Propagator(m).propagateAll(g);
        assertTrue(g.isFullyCollapsed());
        for (int i = 0; i < g.cellCount(); i++) {
            assertEquals(0, g.cell(i).collapsedPattern());
        }
    }

    @Test
    void gradientBoundsGrowWithDistance() {
        PatternModel m = TestModels.gradient(5);
        Grid g = Grid.create(m, 6, 1);
        g.collapse(0, 0);
        new Propagator(m).propagate(g, 0);

        // cell at distance d may hold heights 0..d
        for (int x = 1; x < 6; x++) {
            assertEquals(Math.min(x + 1, 5), g.cell(x, 0).size(), "x=" + x);
        }
    }

    @Test
    void changeSinkSeesEveryShrink() {
        PatternModel m = TestModels.ab();
        Grid g = Grid.create(m, 2, 2);
        Propagator p = new Propagator(m);
        List<Integer> seen = new ArrayList<>();
        p.setChangeSink(seen::add);

        g.collapse(0, B);
        int changes = p.propagate(g, 0);
        assertEquals(3, changes);
        assertEquals(3, seen.size());
        assertFalse(seen.contains(0));
    }
}
