package org.tilegen.core.solve.parallel;

public final class RegionPartitioner {

    private RegionPartitioner() {
    }

    /**
     * Splits the grid into at most {@code regionCount} horizontal strips whose
     * heights differ by at most one row. A periodic grid also links the last
     * strip to the first.
     */
    public static Region[] createHorizontalStrips(int gridWidth, int gridHeight, int regionCount, boolean periodic) {
        int count = Math.max(1, Math.min(regionCount, gridHeight));
        Region[] regions = new Region[count];
        int stripHeight = gridHeight / count;
        int remainder = gridHeight % count;

        int currentY = 0;
        for (int i = 0; i < count; i++) {
            int thisHeight = stripHeight + (i < remainder ? 1 : 0);
            regions[i] = new Region(i, currentY, currentY + thisHeight - 1, gridWidth);
            currentY += thisHeight;
        }

        if (count == 1) {
            return regions;
        }
        // two turns alternate along the strips; a periodic ring of odd length needs a third
        int turns = (periodic && count % 2 == 1) ? 3 : 2;
        for (int i = 0; i < count; i++) {
            Region r = regions[i];
            if (i > 0) {
                r.above = i - 1;
            } else if (periodic) {
                r.above = count - 1;
            }
            if (i < count - 1) {
                r.below = i + 1;
            } else if (periodic) {
                r.below = 0;
            }
            r.seamTurns = turns;
            r.seamTurn = (turns == 3 && i == count - 1) ? 2 : i % 2;
            if (r.above >= 0) r.aboveRow = regions[r.above].getEndY();
            if (r.below >= 0) r.belowRow = regions[r.below].getStartY();
        }
        return regions;
    }
}
