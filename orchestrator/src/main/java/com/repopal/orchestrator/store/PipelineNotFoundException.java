package com.repopal.orchestrator.store;

import java.util.UUID;

public class PipelineNotFoundException extends RuntimeException {

    private final UUID pipelineId;

    public PipelineNotFoundException(UUID pipelineId) {
        super("Pipeline not found: " + pipelineId);
        this.pipelineId = pipelineId;
    }

    public UUID getPipelineId() { return pipelineId; }
}
