package com.repopal.orchestrator.stage;

/**
 * A stage handler's classified failure. The orchestrator acts on the kind as given.
 */
public class StageException extends RuntimeException {

    public enum Kind {
        /** Bad input; retrying would produce the same answer. */
        VALIDATION,
        /** Retried with backoff until the retry budget runs out. */
        TRANSIENT,
        /** Fails the pipeline immediately. */
        FATAL
    }

    private final Kind kind;

    public StageException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StageException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static StageException validation(String message, Throwable cause) {
        return new StageException(Kind.VALIDATION, message, cause);
    }

    public static StageException transientFailure(String message, Throwable cause) {
        return new StageException(Kind.TRANSIENT, message, cause);
    }

    public static StageException fatal(String message, Throwable cause) {
        return new StageException(Kind.FATAL, message, cause);
    }

    public Kind getKind() { return kind; }
}
