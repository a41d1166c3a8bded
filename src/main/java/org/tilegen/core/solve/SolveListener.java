package org.tilegen.core.solve;

public interface SolveListener {
    void onAttemptStart(int attempt, long attemptSeed);
    void onContradiction(int attempt, int cellIndex);
    void onBacktrack(int attempt, int backtracks);
    void onAttemptEnd(int attempt, boolean success, long elapsedMs);
    void onSolveEnd(SolveStats stats);
}
