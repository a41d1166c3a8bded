package org.tilegen.core.solve.parallel;

import java.util.BitSet;

/**
 * Per-round mailbox for seam rows. Each worker writes only its own slots before
 * the exchange barrier and reads its neighbours' slots after it, so no locking
 * is needed.
 */
final class BoundaryExchange {

    // indexed by region id
    final BitSet[][] ownedTop;
    final BitSet[][] haloAbove;
    final BitSet[][] ownedBottom;
    final BitSet[][] haloBelow;

    BoundaryExchange(int regionCount) {
        this.ownedTop = new BitSet[regionCount][];
        this.haloAbove = new BitSet[regionCount][];
        this.ownedBottom = new BitSet[regionCount][];
        this.haloBelow = new BitSet[regionCount][];
    }
}
