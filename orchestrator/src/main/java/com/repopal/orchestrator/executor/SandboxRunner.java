package com.repopal.orchestrator.executor;

import java.nio.file.Path;

/**
 * Runs one command in an isolated, resource-limited execution context with only
 * {@code workspace} mounted (read-write, at /workspace).
 *
 * Implementations tear the sandbox down before returning, on every path.
 */
public interface SandboxRunner {

    /**
     * @throws ExecutorException kind TRANSIENT if the sandbox could not be launched
     */
    SandboxOutcome run(SandboxSpec spec, Path workspace, SandboxLimits limits, CancellationCheck cancellation);
}
