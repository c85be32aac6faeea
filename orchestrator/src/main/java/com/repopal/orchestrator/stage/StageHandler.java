package com.repopal.orchestrator.stage;

import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.model.Stage;

/**
 * The work of one stage.
 *
 * Handlers never write pipeline state: they return an outcome or throw a
 * {@link StageException}, and the orchestrator decides what happens next.
 */
public interface StageHandler {

    Stage stage();

    /**
     * @param pipeline detached snapshot of the pipeline at the task's expected version
     * @throws StageException classified failure
     */
    StageOutcome handle(PipelineContext context, Pipeline pipeline, StagePayload payload);
}
