package org.tilegen.core.solve;

import java.util.ArrayList;
import java.util.List;

/** Collects listener callbacks as plain strings. */
public class RecordingSolveListener implements SolveListener {

    public final List<String> events = new ArrayList<>();
    public SolveStats finalStats;

    @Override
    public synchronized void onAttemptStart(int attempt, long attemptSeed) {
        events.add("start " + attempt);
    }

    @Override
    public synchronized void onContradiction(int attempt, int cellIndex) {
        events.add("contradiction " + attempt + " " + cellIndex);
    }

    @Override
    public synchronized void onBacktrack(int attempt, int backtracks) {
        events.add("backtrack " + attempt + " " + backtracks);
    }

    @Override
    public synchronized void onAttemptEnd(int attempt, boolean success, long elapsedMs) {
        events.add("end " + attempt + " " + success);
    }

    @Override
    public synchronized void onSolveEnd(SolveStats stats) {
        finalStats = stats;
        events.add("solved " + stats.success);
    }

    public synchronized long count(String prefix) {
        return events.stream().filter(e -> e.startsWith(prefix)).count();
    }
}
