package org.tilegen.core.grid;

import org.junit.jupiter.api.Test;
import org.tilegen.core.TestModels;
import org.tilegen.core.model.Direction;
import org.tilegen.core.model.InvalidModelException;
import org.tilegen.core.model.PatternModel;

import java.util.BitSet;

import static org.junit.jupiter.api.Assertions.*;

public class GridTest {

    private final PatternModel model = TestModels.permissive(3);

    @Test
    void freshGridHasFullDomains() {
        Grid g = Grid.create(model, 4, 3);
        assertEquals(12, g.cellCount());
        assertEquals(12, g.remainingUncollapsed());
        for (int i = 0; i < g.cellCount(); i++) {
            assertEquals(3, g.cell(i).size());
            assertFalse(g.cell(i).isCollapsed());
        }
    }

    @Test
    void nonPositiveDimensionsAreRejected() {
        assertThrows(InvalidModelException.class, () -> Grid.create(model, 0, 5));
        assertThrows(InvalidModelException.class, () -> Grid.create(model, 5, 0));
    }

    @Test
    void neighboursStopAtEdges() {
        Grid g = Grid.create(model, 4, 3);
        int corner = g.index(0, 0);
        assertEquals(-1, g.neighbour(corner, Direction.NORTH));
        assertEquals(-1, g.neighbour(corner, Direction.WEST));
        assertEquals(g.index(1, 0), g.neighbour(corner, Direction.EAST));
        assertEquals(g.index(0, 1), g.neighbour(corner, Direction.SOUTH));
    }

    @Test
    void periodicGridWraps() {
        Grid g = Grid.create(model, 4, 3, true);
        int corner = g.index(0, 0);
        assertEquals(g.index(0, 2), g.neighbour(corner, Direction.NORTH));
        assertEquals(g.index(3, 0), g.neighbour(corner, Direction.WEST));

        Grid single = Grid.create(model, 1, 1, true);
        for (Direction d : Direction.values()) {
            assertEquals(0, single.neighbour(0, d));
        }
    }

    @Test
    void restrictShrinksAndTracksCollapse() {
        Grid g = Grid.create(model, 2, 2);
        BitSet allowed = new BitSet();
        allowed.set(0);
        allowed.set(2);

        assertTrue(g.restrict(0, allowed));
        assertEquals(2, g.cell(0).size());
        assertFalse(g.restrict(0, allowed), "same mask twice is not a change");

        BitSet only2 = new BitSet();
        only2.set(2);
        assertTrue(g.restrict(0, only2));
        assertTrue(g.cell(0).isCollapsed());
        assertEquals(2, g.cell(0).collapsedPattern());
        assertEquals(3, g.remainingUncollapsed());
    }

    @Test
    void collapseToMissingPatternEmptiesCell() {
        Grid g = Grid.create(model, 1, 2);
        g.ban(0, 1);
        assertTrue(g.collapse(0, 1));
        assertTrue(g.cell(0).isEmpty());
        assertFalse(g.cell(0).isCollapsed());
    }

    @Test
    void entropyIsRecomputedAfterChange() {
        PatternModel uniform = PatternModel.builder().pattern(0, 1).pattern(1, 1).pattern(2, 1).pattern(3, 1).build();
        Grid g = Grid.create(uniform, 1, 1);
        assertEquals(Math.log(4), g.cell(0).entropy(uniform), 1e-12);

        g.ban(0, 3);
        g.ban(0, 2);
        assertEquals(Math.log(2), g.cell(0).entropy(uniform), 1e-12);

        g.ban(0, 1);
        assertEquals(0.0, g.cell(0).entropy(uniform), 1e-12);
    }

    @Test
    void copyIsIndependent() {
        Grid g = Grid.create(model, 2, 2);
        Grid c = g.copy();
        g.collapse(0, 1);
        assertEquals(3, c.cell(0).size());
        assertEquals(4, c.remainingUncollapsed());
        assertEquals(3, g.remainingUncollapsed());
    }

    @Test
    void pickRowsAndCopyRowBack() {
        Grid g = Grid.create(model, 3, 4, true);
        g.collapse(g.index(1, 3), 2);

        Grid view = g.pickRows(new int[]{3, 0});
        assertEquals(2, view.height());
        assertFalse(view.isPeriodic());
        assertEquals(2, view.cell(1, 0).collapsedPattern());
        assertEquals(-1, view.neighbour(view.index(0, 0), Direction.NORTH));
        assertEquals(view.index(2, 0), view.neighbour(view.index(0, 0), Direction.WEST));

        view.collapse(view.index(0, 1), 0);
        g.copyRowFrom(view, 1, 0);
        assertEquals(0, g.cell(0, 0).collapsedPattern());
        assertEquals(12 - 2, g.remainingUncollapsed());
    }

    @Test
    void exportRowCopiesDomains() {
        Grid g = Grid.create(model, 2, 1);
        BitSet[] row = g.exportRow(0);
        row[0].clear();
        assertEquals(3, g.cell(0).size());
    }

    @Test
    void patternIdsNeedFullCollapse() {
        Grid g = Grid.create(model, 2, 1);
        assertThrows(IllegalStateException.class, g::toPatternIds);
        g.collapse(0, 0);
        g.collapse(1, 2);
        assertArrayEquals(new int[]{0, 2}, g.toPatternIds());
    }

    @Test
    void singlePatternModelStartsCollapsed() {
        PatternModel one = PatternModel.builder().pattern(0, 1).allDirections(0, 0).build();
        Grid g = Grid.create(one, 3, 3);
        assertTrue(g.isFullyCollapsed());
    }
}
