package com.repopal.orchestrator.config;

import com.repopal.orchestrator.capability.ArgumentGenerator;
import com.repopal.orchestrator.capability.CommandSelector;
import com.repopal.orchestrator.command.CommandRegistry;
import com.repopal.orchestrator.executor.CancellationCheck;
import com.repopal.orchestrator.executor.CommandExecutor;
import com.repopal.orchestrator.result.ResultProcessor;
import com.repopal.orchestrator.stage.PipelineContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Collaborators handed to stage handlers. The orchestrator binds the
 * cancellation check per pipeline.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public PipelineContext pipelineContext(CommandRegistry commands,
                                           CommandSelector selector,
                                           ArgumentGenerator arguments,
                                           CommandExecutor executor,
                                           ResultProcessor results) {
        return new PipelineContext(commands, selector, arguments, executor, results, CancellationCheck.NEVER);
    }
}
