package org.tilegen.core.solve;

/**
 * A cell's domain became empty. Thrown out of propagation and caught by the
 * retry loop; it only reaches callers through {@link ExhaustedAttemptsException}.
 */
public class ContradictionException extends RuntimeException {

    private final int cellIndex;

    public ContradictionException(int cellIndex) {
        // raised many times per solve; no stack trace
        super("Contradiction at cell " + cellIndex, null, false, false);
        this.cellIndex = cellIndex;
    }

    public int cellIndex() {
        return cellIndex;
    }
}
