package org.tilegen.core.grid;

import org.tilegen.core.model.PatternModel;

import java.util.BitSet;

/**
 * One grid position.
 *
 * Rules:
 * - domain only shrinks inside an attempt (restrict/ban/collapse all intersect);
 * - collapsed != -1 exactly when the domain holds a single pattern;
 * - an empty domain is a contradiction, never a result.
 *
 * Mutation goes through {@link Grid} so the uncollapsed counter stays in sync.
 */
public final class Cell {

    final BitSet domain;
    int size;
    int collapsed = -1;

    /** Bumped on every domain change; lets heaps drop stale entries. */
    int revision;

    private double entropy = Double.NaN;

    Cell(int patternCount) {
        this.domain = new BitSet(patternCount);
        this.domain.set(0, patternCount);
        this.size = patternCount;
        if (patternCount == 1) {
            collapsed = 0;
        }
    }

    private Cell(Cell src) {
        this.domain = (BitSet) src.domain.clone();
        this.size = src.size;
        this.collapsed = src.collapsed;
        this.revision = src.revision;
        this.entropy = src.entropy;
    }

    Cell copy() {
        return new Cell(this);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isCollapsed() {
        return collapsed >= 0;
    }

    public int collapsedPattern() {
        return collapsed;
    }

    public int revision() {
        return revision;
    }

    /** Live view of the domain; do not mutate. */
    public BitSet domain() {
        return domain;
    }

    public BitSet domainCopy() {
        return (BitSet) domain.clone();
    }

    /**
     * Shannon entropy of the weighted domain: ln W - (sum w ln w) / W.
     * Cached until the next domain change.
     */
    public double entropy(PatternModel model) {
        if (Double.isNaN(entropy)) {
            double sumW = 0;
            double sumWlw = 0;
            for (int p = domain.nextSetBit(0); p >= 0; p = domain.nextSetBit(p + 1)) {
                sumW += model.weight(p);
                sumWlw += model.weightLogWeight(p);
            }
            entropy = (sumW <= 0) ? 0.0 : Math.log(sumW) - sumWlw / sumW;
        }
        return entropy;
    }

    /** Returns true if the domain shrank. */
    boolean and(BitSet allowed) {
        domain.and(allowed);
        return settle();
    }

    boolean clear(int pattern) {
        if (!domain.get(pattern)) return false;
        domain.clear(pattern);
        return settle();
    }

    boolean fix(int pattern) {
        boolean had = domain.get(pattern);
        domain.clear();
        if (had) domain.set(pattern);
        return settle();
    }

    private boolean settle() {
        int now = domain.cardinality();
        if (now == size) return false;
        size = now;
        collapsed = (now == 1) ? domain.nextSetBit(0) : -1;
        entropy = Double.NaN;
        revision++;
        return true;
    }
}
