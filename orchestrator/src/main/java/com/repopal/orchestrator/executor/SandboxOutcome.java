package com.repopal.orchestrator.executor;

/**
 * How the sandboxed process ended.
 *
 * @param exitCode -1 if the process was killed before exiting on its own
 */
public record SandboxOutcome(int exitCode, String stdout, String stderr, boolean timedOut, boolean cancelled) {

    public static SandboxOutcome exited(int exitCode, String stdout, String stderr) {
        return new SandboxOutcome(exitCode, stdout, stderr, false, false);
    }

    public static SandboxOutcome timedOut(String stdout, String stderr) {
        return new SandboxOutcome(-1, stdout, stderr, true, false);
    }

    public static SandboxOutcome cancelled(String stdout, String stderr) {
        return new SandboxOutcome(-1, stdout, stderr, false, true);
    }
}
