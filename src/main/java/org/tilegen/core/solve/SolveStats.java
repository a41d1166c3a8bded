package org.tilegen.core.solve;

import java.util.Locale;

/**
 * Counters for one solve. Workers keep their own counts; the coordinator adds
 * them here after each attempt, so no synchronisation is needed.
 */
public final class SolveStats {

    public int attempts;
    public long collapses;
    public long contradictions;
    public long backtracks;
    public long rounds;
    public long elapsedMs;
    public boolean success;

    public String report() {
        return String.format(Locale.ROOT,
                "=== SOLVE STATS === %s attempts=%d collapses=%d contradictions=%d backtracks=%d rounds=%d elapsed=%dms",
                success ? "OK" : "FAILED", attempts, collapses, contradictions, backtracks, rounds, elapsedMs);
    }
}
