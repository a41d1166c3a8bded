package org.tilegen.core.model;

/**
 * One tile extracted from the sample. The weight is its sampled frequency and
 * drives both entropy and the collapse draw.
 */
public final class Pattern {

    public final int id;
    public final double weight;

    public Pattern(int id, double weight) {
        this.id = id;
        this.weight = weight;
    }

    @Override
    public String toString() {
        return "Pattern[" + id + ", w=" + weight + "]";
    }
}
