package com.repopal.orchestrator.command;

/**
 * A command was asked for with arguments or an environment it cannot run with.
 *
 * Unchecked; the stage handlers map it to a validation or fatal stage failure.
 */
public class CommandException extends RuntimeException {

    public enum Kind { INVALID_ARGUMENTS, MISSING_ENVIRONMENT }

    private final Kind kind;

    public CommandException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
