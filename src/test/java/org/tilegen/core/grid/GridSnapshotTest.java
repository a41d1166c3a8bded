package org.tilegen.core.grid;

import org.junit.jupiter.api.Test;
import org.tilegen.core.TestModels;

import static org.junit.jupiter.api.Assertions.*;

public class GridSnapshotTest {

    @Test
    void restoreReturnsFrozenState() {
        Grid g = Grid.create(TestModels.permissive(2), 2, 2);
        GridSnapshot s = new GridSnapshot(g, 5);
        g.collapse(0, 1);

        Grid back = s.restore();
        assertEquals(2, back.cell(0).size());
        assertEquals(5, s.collapseCount());

        back.collapse(1, 0);
        assertEquals(2, s.restore().cell(1).size(), "restore hands out copies");
    }

    @Test
    void latestDecisionIsKept() {
        GridSnapshot s = new GridSnapshot(Grid.create(TestModels.permissive(2), 2, 2), 0);
        assertFalse(s.hasDecision());
        s.recordDecision(3, 1);
        s.recordDecision(0, 0);
        assertTrue(s.hasDecision());
        assertEquals(0, s.decisionCell());
        assertEquals(0, s.decisionPattern());
    }
}
