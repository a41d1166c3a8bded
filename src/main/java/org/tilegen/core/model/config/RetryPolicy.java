package org.tilegen.core.model.config;

public enum RetryPolicy {
    /** Throw the grid away and start over with the next derived seed. */
    FULL_RESTART,
    /** Restore the newest snapshot and ban the failed choice; falls back to a restart. */
    SNAPSHOT_BACKTRACK
}
