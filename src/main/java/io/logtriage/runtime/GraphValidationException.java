package io.logtriage.runtime;

/**
 * A pipeline graph that cannot be scheduled. Raised once, before any stage runs, and never retried.
 */
public final class GraphValidationException extends IllegalArgumentException {
    public GraphValidationException(String message) {
        super(message);
    }
}
