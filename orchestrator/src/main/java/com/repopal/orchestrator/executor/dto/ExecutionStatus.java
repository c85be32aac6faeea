package com.repopal.orchestrator.executor.dto;

/**
 * Outcome of the sandboxed process.
 *
 * @param exitCode -1 when the process never produced one (timeout, cancellation)
 * @param error    human-readable reason when {@code success} is false
 */
public record ExecutionStatus(boolean success, int exitCode, String error, boolean timedOut) {

    public static ExecutionStatus succeeded() {
        return new ExecutionStatus(true, 0, null, false);
    }

    public static ExecutionStatus exited(int exitCode, String error) {
        return new ExecutionStatus(false, exitCode, error, false);
    }

    public static ExecutionStatus timeout(int limitSeconds) {
        return new ExecutionStatus(false, -1,
                "Command exceeded the " + limitSeconds + "s execution limit", true);
    }
}
