package com.repopal.orchestrator.store;

import com.repopal.orchestrator.model.PipelineState;

import java.util.UUID;

/**
 * The requested state change is not allowed by the state machine, e.g. leaving
 * COMPLETED/FAILED or moving backwards. Distinct from {@link VersionConflictException}.
 */
public class IllegalTransitionException extends RuntimeException {

    private final PipelineState from;
    private final PipelineState to;

    public IllegalTransitionException(UUID pipelineId, PipelineState from, PipelineState to) {
        super("Pipeline %s cannot transition %s → %s".formatted(pipelineId, from, to));
        this.from = from;
        this.to   = to;
    }

    public PipelineState getFrom() { return from; }
    public PipelineState getTo()   { return to; }
}
