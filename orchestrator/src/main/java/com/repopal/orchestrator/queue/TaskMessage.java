package com.repopal.orchestrator.queue;

import com.repopal.orchestrator.model.Stage;
import com.repopal.orchestrator.model.StageTask;

import java.util.UUID;

/**
 * A stage-work item as it travels through the queue.
 *
 * @param payload JSON of the stage input (event, CommandRequest or ExecutionResult)
 * @param attempt retry attempt of this stage, 0 for the first try
 */
public record TaskMessage(
        UUID   taskId,
        UUID   pipelineId,
        long   expectedVersion,
        Stage  stage,
        String payload,
        String idempotencyKey,
        int    attempt) {

    public static TaskMessage of(UUID taskId, UUID pipelineId, long expectedVersion,
                                 Stage stage, String payload, int attempt) {
        return new TaskMessage(taskId, pipelineId, expectedVersion, stage, payload,
                idempotencyKey(pipelineId, stage, expectedVersion), attempt);
    }

    /** Same pipeline, stage and version always yield the same key. */
    public static String idempotencyKey(UUID pipelineId, Stage stage, long expectedVersion) {
        return pipelineId + ":" + stage.name() + ":" + expectedVersion;
    }

    public static TaskMessage from(StageTask task) {
        return new TaskMessage(task.getId(), task.getPipelineId(), task.getExpectedVersion(),
                task.getStage(), task.getPayloadJson(), task.getIdempotencyKey(), task.getAttempt());
    }
}
