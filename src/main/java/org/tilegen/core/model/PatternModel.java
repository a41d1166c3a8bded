package org.tilegen.core.model;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * Immutable pattern set plus the directional compatibility table.
 *
 * <p>The table is flat and indexed by {@code (a, direction, b)}; a {@link BitSet}
 * per {@code (a, direction)} mirrors it so propagation can union whole rows.
 * Ids are dense: pattern {@code i} sits at index {@code i}.
 *
 * <p>Shared read-only across attempts and workers.
 */
public final class PatternModel {

    private final List<Pattern> patterns;
    private final double[] weights;
    private final double[] weightLogWeights;
    private final double totalWeight;
    private final double totalWeightLogWeight;

    private final boolean[] table;
    private final BitSet[] rows;

    private PatternModel(List<Pattern> patterns, boolean[] table) {
        int n = patterns.size();
        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
        this.table = table;

        this.weights = new double[n];
        this.weightLogWeights = new double[n];
        double sumW = 0;
        double sumWlw = 0;
        for (int i = 0; i < n; i++) {
            double w = patterns.get(i).weight;
            weights[i] = w;
            weightLogWeights[i] = w * Math.log(w);
            sumW += w;
            sumWlw += weightLogWeights[i];
        }
        this.totalWeight = sumW;
        this.totalWeightLogWeight = sumWlw;

        this.rows = new BitSet[n * Direction.COUNT];
        for (int a = 0; a < n; a++) {
            for (int d = 0; d < Direction.COUNT; d++) {
                BitSet row = new BitSet(n);
                int base = (a * Direction.COUNT + d) * n;
                for (int b = 0; b < n; b++) {
                    if (table[base + b]) row.set(b);
                }
                rows[a * Direction.COUNT + d] = row;
            }
        }
    }

    public int size() {
        return patterns.size();
    }

    public double weight(int id) {
        return weights[id];
    }

    public double weightLogWeight(int id) {
        return weightLogWeights[id];
    }

    public double totalWeight() {
        return totalWeight;
    }

    /** Entropy of a cell that still allows every pattern. */
    public double startingEntropy() {
        return Math.log(totalWeight) - totalWeightLogWeight / totalWeight;
    }

    /** True if pattern {@code b} may sit in {@code dir} of pattern {@code a}. */
    public boolean isCompatible(int a, int b, Direction dir) {
        int n = patterns.size();
        return table[(a * Direction.COUNT + dir.ordinal()) * n + b];
    }

    /**
     * Patterns allowed in {@code dir} of {@code a}. The returned set is shared; callers must not mutate it.
     */
    public BitSet compatibleRow(int a, Direction dir) {
        return rows[a * Direction.COUNT + dir.ordinal()];
    }

    public List<Integer> compatibleNeighbours(int a, Direction dir) {
        BitSet row = compatibleRow(a, dir);
        List<Integer> out = new ArrayList<>(row.cardinality());
        for (int b = row.nextSetBit(0); b >= 0; b = row.nextSetBit(b + 1)) {
            out.add(b);
        }
        return out;
    }

    public static void checkGridSize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidModelException("Grid dimensions must be positive: " + width + "x" + height);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Pattern> patterns = new ArrayList<>();
        private final List<AdjacencyRule> rules = new ArrayList<>();

        public Builder pattern(int id, double weight) {
            patterns.add(new Pattern(id, weight));
            return this;
        }

        public Builder rule(int a, int b, Direction dir) {
            rules.add(new AdjacencyRule(a, b, dir));
            return this;
        }

        /** Adds {@code a -> b} and the mirrored {@code b -> a} for the opposite direction. */
        public Builder symmetricRule(int a, int b, Direction dir) {
            rules.add(new AdjacencyRule(a, b, dir));
            rules.add(new AdjacencyRule(b, a, dir.opposite()));
            return this;
        }

        public Builder allDirections(int a, int b) {
            for (Direction d : Direction.values()) {
                rules.add(new AdjacencyRule(a, b, d));
            }
            return this;
        }

        public Builder rules(List<AdjacencyRule> more) {
            rules.addAll(more);
            return this;
        }

        public PatternModel build() {
            if (patterns.isEmpty()) {
                throw new InvalidModelException("Pattern model has no patterns");
            }

            int n = patterns.size();
            Pattern[] byId = new Pattern[n];
            for (Pattern p : patterns) {
                if (p.id < 0 || p.id >= n) {
                    throw new InvalidModelException("Pattern id out of range [0," + (n - 1) + "]: " + p.id);
                }
                if (byId[p.id] != null) {
                    throw new InvalidModelException("Duplicate pattern id: " + p.id);
                }
                if (!(p.weight > 0) || Double.isInfinite(p.weight)) {
                    throw new InvalidModelException("Pattern " + p.id + " has non-positive weight: " + p.weight);
                }
                byId[p.id] = p;
            }

            boolean[] table = new boolean[n * Direction.COUNT * n];
            for (AdjacencyRule r : rules) {
                if (r.direction() == null) {
                    throw new InvalidModelException("Adjacency rule without direction: " + r);
                }
                if (r.a() < 0 || r.a() >= n || r.b() < 0 || r.b() >= n) {
                    throw new InvalidModelException("Adjacency rule references unknown pattern: " + r);
                }
                table[(r.a() * Direction.COUNT + r.direction().ordinal()) * n + r.b()] = true;
            }

            List<Pattern> ordered = new ArrayList<>(n);
            Collections.addAll(ordered, byId);
            return new PatternModel(ordered, table);
        }
    }
}
