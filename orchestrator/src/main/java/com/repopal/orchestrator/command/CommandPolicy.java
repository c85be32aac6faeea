package com.repopal.orchestrator.command;

/**
 * Execution constraints the executor enforces for a command.
 *
 * @param networkAllowed false unless the command needs egress (e.g. dependency updates)
 * @param writeAllowed   true if the command's changes may be committed
 */
public record CommandPolicy(boolean networkAllowed, boolean writeAllowed) {

    /** Offline, may write: formatters, codemods. */
    public static CommandPolicy offlineWriter() {
        return new CommandPolicy(false, true);
    }

    /** Offline, read-only: linters, reports. */
    public static CommandPolicy readOnly() {
        return new CommandPolicy(false, false);
    }
}
