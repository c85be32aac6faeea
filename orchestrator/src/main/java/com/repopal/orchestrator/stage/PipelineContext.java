package com.repopal.orchestrator.stage;

import com.repopal.orchestrator.capability.ArgumentGenerator;
import com.repopal.orchestrator.capability.CommandSelector;
import com.repopal.orchestrator.command.CommandRegistry;
import com.repopal.orchestrator.executor.CancellationCheck;
import com.repopal.orchestrator.executor.CommandExecutor;
import com.repopal.orchestrator.result.ResultProcessor;

/**
 * The collaborators a stage handler may use, passed explicitly on every call.
 *
 * {@code cancellation} is bound to the pipeline being processed.
 */
public record PipelineContext(
        CommandRegistry   commands,
        CommandSelector   selector,
        ArgumentGenerator arguments,
        CommandExecutor   executor,
        ResultProcessor   results,
        CancellationCheck cancellation) {

    public PipelineContext withCancellation(CancellationCheck check) {
        return new PipelineContext(commands, selector, arguments, executor, results, check);
    }
}
