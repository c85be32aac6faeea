package com.repopal.orchestrator.stage;

import com.repopal.orchestrator.capability.CapabilityException;
import com.repopal.orchestrator.capability.GeneratedArguments;
import com.repopal.orchestrator.command.Command;
import com.repopal.orchestrator.command.CommandException;
import com.repopal.orchestrator.command.UnknownCommandException;
import com.repopal.orchestrator.event.StandardizedEvent;
import com.repopal.orchestrator.executor.dto.CommandRequest;
import com.repopal.orchestrator.executor.dto.ExecutionContext;
import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * DISPATCH: generate and validate arguments, then build the CommandRequest.
 */
@Component
public class DispatchStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(DispatchStageHandler.class);

    static final String BRANCH_PREFIX = "repopal/";

    @Override
    public Stage stage() { return Stage.DISPATCH; }

    @Override
    public StageOutcome handle(PipelineContext context, Pipeline pipeline, StagePayload payload) {
        StandardizedEvent event = payload.event();

        Command command;
        try {
            command = context.commands().get(payload.command());
        } catch (UnknownCommandException e) {
            throw StageException.fatal(e.getMessage(), e);
        }

        GeneratedArguments args;
        try {
            args = context.arguments().generateArguments(command.manifest(), event.requestText(),
                    event.referencedFiles(), event.referencedBranches());
        } catch (CapabilityException e) {
            throw new StageException(e.isTransient() ? StageException.Kind.TRANSIENT : StageException.Kind.FATAL,
                    "Argument generation failed: " + e.getMessage(), e);
        }

        try {
            command.validateArgs(args.required(), args.optional());
        } catch (CommandException e) {
            throw StageException.validation(e.getMessage(), e);
        }

        ExecutionContext executionContext = new ExecutionContext(
                event.repository().name(),
                event.repository().cloneUrl(),
                event.baseBranch(),
                targetBranch(pipeline, event),
                event.repository().canWrite());

        CommandRequest request = new CommandRequest(pipeline.getId(), payload.command(),
                args.required(), args.optional(), executionContext);
        log.info("Dispatching '{}' with {} required / {} optional arguments onto branch {}",
                payload.command(), args.required().size(), args.optional().size(), executionContext.targetBranch());

        return StageOutcome.advance(payload.withRequest(request),
                Map.of("targetBranch", executionContext.targetBranch()));
    }

    /** The event's target branch, else a branch of our own so the base is never written to. */
    static String targetBranch(Pipeline pipeline, StandardizedEvent event) {
        if (event.environment() != null) {
            String target = event.environment().targetBranch();
            if (target != null && !target.isBlank()) return target;
        }
        return BRANCH_PREFIX + pipeline.getId().toString().substring(0, 8);
    }
}
