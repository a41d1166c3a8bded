package org.tilegen.core.solve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingSolveListener implements SolveListener {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingSolveListener.class);

    @Override
    public void onAttemptStart(int attempt, long attemptSeed) {
        LOG.debug("[ATTEMPT START] #{} seed={}", attempt, attemptSeed);
    }

    @Override
    public void onContradiction(int attempt, int cellIndex) {
        LOG.debug("[CONTRADICTION] attempt #{} at cell {}", attempt, cellIndex);
    }

    @Override
    public void onBacktrack(int attempt, int backtracks) {
        LOG.trace("[BACKTRACK] attempt #{} total={}", attempt, backtracks);
    }

    @Override
    public void onAttemptEnd(int attempt, boolean success, long elapsedMs) {
        LOG.debug("[ATTEMPT END]   #{} {} ({} ms)", attempt, success ? "collapsed" : "failed", elapsedMs);
    }

    @Override
    public void onSolveEnd(SolveStats stats) {
        LOG.info(stats.report());
    }
}
