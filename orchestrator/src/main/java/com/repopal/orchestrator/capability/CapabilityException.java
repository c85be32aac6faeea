package com.repopal.orchestrator.capability;

/**
 * An external capability call failed.
 *
 * {@code transientFailure} is true for rate limits, timeouts and 5xx responses;
 * false when the answer itself was unusable.
 */
public class CapabilityException extends RuntimeException {

    private final boolean transientFailure;

    public CapabilityException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public CapabilityException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() { return transientFailure; }
}
