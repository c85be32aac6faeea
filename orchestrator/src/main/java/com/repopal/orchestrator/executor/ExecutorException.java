package com.repopal.orchestrator.executor;

/**
 * The executor could not produce an {@code ExecutionResult}.
 *
 * The kind is the executor's own classification; the orchestrator does not re-classify it.
 * A command that ran and failed is not an exception: it is an ExecutionResult with
 * {@code success = false}.
 */
public class ExecutorException extends RuntimeException {

    public enum Kind {
        /** Worth retrying: network blips, rate limits, sandbox launch flakiness. */
        TRANSIENT,
        /** Retrying cannot help: quota, revoked credentials, unknown branch. */
        FATAL,
        /** The request itself is malformed: unknown command, bad arguments. */
        VALIDATION,
        /** The pipeline was cancelled while the command was running. */
        CANCELLED
    }

    private final Kind kind;

    public ExecutorException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExecutorException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
