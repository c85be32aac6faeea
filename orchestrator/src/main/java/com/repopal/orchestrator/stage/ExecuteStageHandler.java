package com.repopal.orchestrator.stage;

import com.repopal.orchestrator.executor.ExecutorException;
import com.repopal.orchestrator.executor.dto.ExecutionResult;
import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.model.Stage;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * EXECUTE: run the command in the sandbox.
 *
 * A command that ran and failed still advances; PROCESS_RESULTS reports it.
 */
@Component
public class ExecuteStageHandler implements StageHandler {

    @Override
    public Stage stage() { return Stage.EXECUTE; }

    @Override
    public StageOutcome handle(PipelineContext context, Pipeline pipeline, StagePayload payload) {
        ExecutionResult result;
        try {
            result = context.executor().execute(payload.request(), context.cancellation());
        } catch (ExecutorException e) {
            throw switch (e.getKind()) {
                case TRANSIENT  -> StageException.transientFailure(e.getMessage(), e);
                case VALIDATION -> StageException.validation(e.getMessage(), e);
                case FATAL      -> StageException.fatal(e.getMessage(), e);
                case CANCELLED  -> StageException.fatal("cancelled", e);
            };
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("exitCode", result.status().exitCode());
        metadata.put("timedOut", result.status().timedOut());
        metadata.put("filesChanged", result.changeSet().files().size());
        if (result.changeSet().finalCommit() != null) {
            metadata.put("finalCommit", result.changeSet().finalCommit());
        }
        return StageOutcome.advance(payload.withResult(result), metadata);
    }
}
