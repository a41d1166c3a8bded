package org.tilegen.core.solve;

import org.tilegen.core.model.PatternModel;

import java.util.BitSet;
import java.util.Random;

final class WeightedPicker {

    private WeightedPicker() {
    }

    /** Draws one pattern of {@code domain} with probability proportional to its weight. */
    static int pick(PatternModel model, BitSet domain, Random random) {
        double total = 0;
        for (int p = domain.nextSetBit(0); p >= 0; p = domain.nextSetBit(p + 1)) {
            total += model.weight(p);
        }
        if (total <= 0) {
            throw new IllegalStateException("Cannot draw from an empty domain");
        }

        double r = random.nextDouble() * total;
        double acc = 0;
        int last = -1;
        for (int p = domain.nextSetBit(0); p >= 0; p = domain.nextSetBit(p + 1)) {
            acc += model.weight(p);
            if (r < acc) return p;
            last = p;
        }
        // rounding
        return last;
    }
}
