package org.tilegen.core.model;

/**
 * "{@code b} may sit in {@code direction} of {@code a}".
 */
public record AdjacencyRule(int a, int b, Direction direction) {
}
