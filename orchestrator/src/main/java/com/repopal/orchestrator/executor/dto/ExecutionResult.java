package com.repopal.orchestrator.executor.dto;

/**
 * What the Command Executor hands to the Result Processor. Immutable.
 */
public record ExecutionResult(
        ExecutionStatus status,
        String          stdout,
        String          stderr,
        ChangeSet       changeSet,
        WorkspaceInfo   workspace) {

    public boolean success() {
        return status != null && status.success();
    }
}
