package com.repopal.orchestrator.model;

/**
 * One phase of the pipeline, realised as one task-queue item.
 *
 * Each stage knows the pipeline state that is current while its task is live,
 * the lane it runs on, and whether re-running it after a hard timeout is safe.
 * What comes next is decided by the orchestrator's transition table, not here.
 */
public enum Stage {
    PROCESS(PipelineState.PROCESSING, Lane.CONTROL, true),                  // command selection
    DISPATCH(PipelineState.DISPATCHING, Lane.CONTROL, true),                // argument generation
    EXECUTE(PipelineState.EXECUTING, Lane.EXECUTION, false),                // sandboxed run
    PROCESS_RESULTS(PipelineState.PROCESSING_RESULTS, Lane.CONTROL, true);  // change request + notify

    private final PipelineState activeState;
    private final Lane lane;
    private final boolean idempotent;

    Stage(PipelineState activeState, Lane lane, boolean idempotent) {
        this.activeState = activeState;
        this.lane        = lane;
        this.idempotent  = idempotent;
    }

    public PipelineState activeState() { return activeState; }
    public Lane          lane()        { return lane; }
    public boolean       idempotent()  { return idempotent; }
}
