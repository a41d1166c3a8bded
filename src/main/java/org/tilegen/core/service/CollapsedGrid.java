package org.tilegen.core.service;

import java.util.Arrays;

/**
 * Finished output: one pattern id per cell, row-major. Immutable.
 */
public final class CollapsedGrid {

    private final int width;
    private final int height;
    private final int[] patternIds;

    public CollapsedGrid(int width, int height, int[] patternIds) {
        if (patternIds.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " cells, got " + patternIds.length);
        }
        this.width = width;
        this.height = height;
        this.patternIds = patternIds.clone();
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int patternAt(int x, int y) {
        return patternIds[y * width + x];
    }

    public int[] toArray() {
        return patternIds.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CollapsedGrid)) return false;
        CollapsedGrid other = (CollapsedGrid) o;
        return width == other.width && height == other.height && Arrays.equals(patternIds, other.patternIds);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(patternIds);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (x > 0) sb.append(' ');
                sb.append(patternAt(x, y));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
