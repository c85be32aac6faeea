package com.repopal.orchestrator.executor;

import com.repopal.orchestrator.executor.dto.CommandRequest;
import com.repopal.orchestrator.executor.dto.ExecutionResult;

/**
 * Turns a {@link CommandRequest} into an {@link ExecutionResult}, isolated from the
 * host and from other executions.
 */
public interface CommandExecutor {

    /**
     * @throws ExecutorException when no result can be produced; its kind says whether
     *                           a retry can help
     */
    ExecutionResult execute(CommandRequest request, CancellationCheck cancellation);

    default ExecutionResult execute(CommandRequest request) {
        return execute(request, CancellationCheck.NEVER);
    }
}
