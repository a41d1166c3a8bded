package org.tilegen.core.solve;

public class ExhaustedAttemptsException extends RuntimeException {

    private final long seed;
    private final int attemptsUsed;

    public ExhaustedAttemptsException(long seed, int attemptsUsed) {
        super("No consistent grid after " + attemptsUsed + " attempts (seed=" + seed + ")");
        this.seed = seed;
        this.attemptsUsed = attemptsUsed;
    }

    public long seed() {
        return seed;
    }

    public int attemptsUsed() {
        return attemptsUsed;
    }
}
