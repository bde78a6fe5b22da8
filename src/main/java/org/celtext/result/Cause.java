package org.celtext.result;

/**
 * Reason of a failed {@link Result}.
 */
public interface Cause {
    /**
     * Human-readable description suitable for diagnostics.
     */
    String message();
}
