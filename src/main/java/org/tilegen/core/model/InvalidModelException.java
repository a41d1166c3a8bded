package org.tilegen.core.model;

/**
 * Structural problem with the pattern model or the requested grid. Never retried.
 */
public class InvalidModelException extends IllegalArgumentException {

    public InvalidModelException(String message) {
        super(message);
    }
}
