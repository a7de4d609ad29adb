package io.bimcollab.core;

/**
 * Base class for the engine's caller-facing failures.
 * Unchecked: every failure is surfaced synchronously and never retried.
 */
public class CollaborationException extends RuntimeException {
    public CollaborationException(String message) {
        super(message);
    }
}
