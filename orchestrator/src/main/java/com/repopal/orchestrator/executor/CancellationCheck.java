package com.repopal.orchestrator.executor;

/**
 * Polled by the executor between phases and while the sandbox runs.
 */
@FunctionalInterface
public interface CancellationCheck {

    CancellationCheck NEVER = () -> false;

    boolean isCancelled();
}
