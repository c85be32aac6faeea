package com.repopal.orchestrator.stage;

import com.repopal.orchestrator.capability.CapabilityException;
import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * PROCESS: pick the command the request asks for.
 */
@Component
public class ProcessStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(ProcessStageHandler.class);

    @Override
    public Stage stage() { return Stage.PROCESS; }

    @Override
    public StageOutcome handle(PipelineContext context, Pipeline pipeline, StagePayload payload) {
        String command;
        try {
            command = context.selector().selectCommand(
                    payload.event().requestText(), context.commands().manifests());
        } catch (CapabilityException e) {
            throw new StageException(e.isTransient() ? StageException.Kind.TRANSIENT : StageException.Kind.FATAL,
                    "Command selection failed: " + e.getMessage(), e);
        }

        if (!context.commands().contains(command)) {
            throw StageException.fatal("Unknown command selected: " + command, null);
        }

        log.info("Selected command '{}'", command);
        return StageOutcome.advance(payload.withCommand(command), Map.of("command", command));
    }
}
