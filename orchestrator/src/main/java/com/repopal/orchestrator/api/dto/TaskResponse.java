package com.repopal.orchestrator.api.dto;

import com.repopal.orchestrator.model.Lane;
import com.repopal.orchestrator.model.Stage;
import com.repopal.orchestrator.model.StageTask;
import com.repopal.orchestrator.model.TaskState;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a stage task returned by GET /pipelines/{id}/tasks.
 */
public record TaskResponse(
        UUID      id,
        Stage     stage,
        Lane      lane,
        TaskState state,
        long      expectedVersion,
        int       attempt,
        int       deliveries,
        String    workerId,
        Instant   createdAt,
        Instant   availableAt,
        Instant   startedAt,
        Instant   finishedAt,
        Instant   heartbeatAt,
        String    lastError
) {
    public static TaskResponse from(StageTask t) {
        return new TaskResponse(
                t.getId(),
                t.getStage(),
                t.getLane(),
                t.getState(),
                t.getExpectedVersion(),
                t.getAttempt(),
                t.getDeliveries(),
                t.getWorkerId(),
                t.getCreatedAt(),
                t.getAvailableAt(),
                t.getStartedAt(),
                t.getFinishedAt(),
                t.getHeartbeatAt(),
                t.getLastError()
        );
    }
}
