package org.tilegen.core.model.config;

public class SolverSettings {

    public long seed;

    // Wrap both axes (edge cells see the opposite edge)
    public boolean periodic = false;

    // Parallelism
    public int workerCount = 1;
    public int collapsesPerRound = 4;

    // Retry / backtracking
    public int maxAttempts = 10;
    public RetryPolicy retryPolicy = RetryPolicy.FULL_RESTART;
    public int snapshotInterval = 16;   // collapses between snapshots
    public int maxSnapshots = 8;
    public int maxBacktracksPerAttempt = 64;

    // Re-check every adjacent pair once the grid is collapsed
    public boolean validateResult = true;

    public SolverSettings() {
        this(0L);
    }

    public SolverSettings(long seed) {
        this.seed = seed;
    }

    public SolverSettings copy() {
        SolverSettings c = new SolverSettings(seed);
        c.periodic = periodic;
        c.workerCount = workerCount;
        c.collapsesPerRound = collapsesPerRound;
        c.maxAttempts = maxAttempts;
        c.retryPolicy = retryPolicy;
        c.snapshotInterval = snapshotInterval;
        c.maxSnapshots = maxSnapshots;
        c.maxBacktracksPerAttempt = maxBacktracksPerAttempt;
        c.validateResult = validateResult;
        return c;
    }

    public void validate() {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, was " + workerCount);
        }
        if (collapsesPerRound < 1) {
            throw new IllegalArgumentException("collapsesPerRound must be >= 1, was " + collapsesPerRound);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy is not set");
        }
        if (snapshotInterval < 1) {
            throw new IllegalArgumentException("snapshotInterval must be >= 1, was " + snapshotInterval);
        }
        if (maxSnapshots < 1) {
            throw new IllegalArgumentException("maxSnapshots must be >= 1, was " + maxSnapshots);
        }
        if (maxBacktracksPerAttempt < 0) {
            throw new IllegalArgumentException("maxBacktracksPerAttempt must be >= 0, was " + maxBacktracksPerAttempt);
        }
    }

    @Override
    public String toString() {
        return "SolverSettings{seed=" + seed
                + ", periodic=" + periodic
                + ", workers=" + workerCount
                + ", collapsesPerRound=" + collapsesPerRound
                + ", maxAttempts=" + maxAttempts
                + ", retryPolicy=" + retryPolicy
                + ", snapshotInterval=" + snapshotInterval
                + ", maxSnapshots=" + maxSnapshots
                + ", maxBacktracks=" + maxBacktracksPerAttempt
                + "}";
    }
}
