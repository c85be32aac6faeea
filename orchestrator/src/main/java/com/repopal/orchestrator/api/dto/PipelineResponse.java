package com.repopal.orchestrator.api.dto;

import com.repopal.orchestrator.model.Pipeline;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for POST /pipelines and GET /pipelines/{id}.
 */
public record PipelineResponse(
        UUID                id,
        String              state,
        long                version,
        String              service,
        String              repository,
        UUID                currentTaskId,
        String              error,
        boolean             cancelRequested,
        Map<String, Object> metadata,
        Instant             createdAt,
        Instant             updatedAt
) {
    public static PipelineResponse from(Pipeline p) {
        return new PipelineResponse(
                p.getId(),
                p.getState().name(),
                p.getVersion(),
                p.getService(),
                p.getRepository(),
                p.getCurrentTaskId(),
                p.getError(),
                p.isCancelRequested(),
                p.getMetadata(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
