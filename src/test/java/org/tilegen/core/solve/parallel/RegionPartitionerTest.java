package org.tilegen.core.solve.parallel;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RegionPartitionerTest {

    @Test
    void stripsCoverEveryRowOnce() {
        Region[] rs = RegionPartitioner.createHorizontalStrips(8, 10, 3, false);
        assertEquals(3, rs.length);
        assertEquals(4, rs[0].getHeight());
        assertEquals(3, rs[1].getHeight());
        assertEquals(3, rs[2].getHeight());

        int next = 0;
        for (Region r : rs) {
            assertEquals(next, r.getStartY());
            next = r.getEndY() + 1;
            assertEquals(r.getHeight() * 8, r.getCellCount());
        }
        assertEquals(10, next);
    }

    @Test
    void openGridLinksOnlyInnerSeams() {
        Region[] rs = RegionPartitioner.createHorizontalStrips(4, 9, 3, false);
        assertFalse(rs[0].hasAbove());
        assertEquals(1, rs[0].getBelow());
        assertEquals(0, rs[1].getAbove());
        assertEquals(2, rs[1].getBelow());
        assertEquals(1, rs[2].getAbove());
        assertFalse(rs[2].hasBelow());

        assertArrayEquals(new int[]{0, 1, 2, 3}, rs[0].viewRows());
        assertArrayEquals(new int[]{2, 3, 4, 5, 6}, rs[1].viewRows());
        assertArrayEquals(new int[]{5, 6, 7, 8}, rs[2].viewRows());
    }

    @Test
    void periodicGridLinksLastStripToFirst() {
        Region[] rs = RegionPartitioner.createHorizontalStrips(4, 9, 3, true);
        assertEquals(2, rs[0].getAbove());
        assertEquals(0, rs[2].getBelow());
        assertArrayEquals(new int[]{8, 0, 1, 2, 3}, rs[0].viewRows());
        assertArrayEquals(new int[]{5, 6, 7, 8, 0}, rs[2].viewRows());
    }

    @Test
    void regionCountIsClippedToHeight() {
        Region[] rs = RegionPartitioner.createHorizontalStrips(5, 2, 8, false);
        assertEquals(2, rs.length);
        for (Region r : rs) {
            assertEquals(1, r.getHeight());
        }
    }

    @Test
    void neighbouringStripsNeverShareASeamTurn() {
        for (boolean periodic : new boolean[]{false, true}) {
            for (int count = 2; count <= 7; count++) {
                Region[] rs = RegionPartitioner.createHorizontalStrips(3, 14, count, periodic);
                for (Region r : rs) {
                    if (!r.hasBelow()) continue;
                    Region below = rs[r.getBelow()];
                    for (int round = 0; round < 12; round++) {
                        assertFalse(r.seamOpen(round) && below.seamOpen(round),
                                "strips " + r.getId() + "/" + below.getId() + " round " + round);
                    }
                }
                for (Region r : rs) {
                    boolean opens = false;
                    for (int round = 0; round < 3; round++) opens |= r.seamOpen(round);
                    assertTrue(opens, "strip " + r.getId() + " never gets a turn");
                }
            }
        }
    }

    @Test
    void singleStripHasNoSeams() {
        Region[] rs = RegionPartitioner.createHorizontalStrips(5, 5, 1, true);
        assertEquals(1, rs.length);
        assertFalse(rs[0].hasAbove());
        assertFalse(rs[0].hasBelow());
        assertArrayEquals(new int[]{0, 1, 2, 3, 4}, rs[0].viewRows());
    }
}
