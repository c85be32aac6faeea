package com.repopal.orchestrator.executor;

/**
 * A git CLI invocation failed. {@link #getFailure()} is derived from git's stderr.
 */
public class GitException extends RuntimeException {

    public enum Failure {
        /** Credential rejected, missing or lacking permission. */
        AUTH,
        /** Remote repository or branch does not exist. */
        NOT_FOUND,
        /** DNS, connection, timeout, rate limit or server-side 5xx. */
        NETWORK,
        OTHER
    }

    private final Failure failure;

    public GitException(Failure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public GitException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public Failure getFailure() { return failure; }
}
