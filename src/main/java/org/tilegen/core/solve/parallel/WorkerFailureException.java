package org.tilegen.core.solve.parallel;

/**
 * A worker failed with something other than a contradiction. The whole solve is
 * aborted; partial results are never used.
 */
public class WorkerFailureException extends RuntimeException {

    private final int region;

    public WorkerFailureException(int region, Throwable cause) {
        super("Worker for region " + region + " failed: " + cause, cause);
        this.region = region;
    }

    public int region() {
        return region;
    }
}
