package com.repopal.orchestrator.stage;

import com.repopal.orchestrator.executor.dto.ExecutionResult;
import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.model.Stage;
import com.repopal.orchestrator.result.ChangeRequestException;
import com.repopal.orchestrator.result.InvalidResultException;
import com.repopal.orchestrator.result.PipelineSummary;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * PROCESS_RESULTS: publish the change request and notify services.
 * A failed execution ends the pipeline FAILED once it has been reported.
 */
@Component
public class ProcessResultsStageHandler implements StageHandler {

    @Override
    public Stage stage() { return Stage.PROCESS_RESULTS; }

    @Override
    public StageOutcome handle(PipelineContext context, Pipeline pipeline, StagePayload payload) {
        ExecutionResult result = payload.result();
        PipelineSummary summary;
        try {
            summary = context.results().process(pipeline.getId(), payload.event(), payload.command(),
                    payload.request() == null ? null : payload.request().context().targetBranch(), result);
        } catch (InvalidResultException e) {
            throw StageException.validation(e.getMessage(), e);
        } catch (ChangeRequestException e) {
            throw StageException.transientFailure(e.getMessage(), e);
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("changeSummary", summary.changeSummary());
        if (summary.changeRequestUrl() != null) {
            metadata.put("changeRequestUrl", summary.changeRequestUrl());
        }

        if (!summary.success()) {
            return StageOutcome.failed(payload, summary.error(), metadata);
        }
        return StageOutcome.advance(payload, metadata);
    }
}
