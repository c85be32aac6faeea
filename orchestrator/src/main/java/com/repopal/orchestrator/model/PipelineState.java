package com.repopal.orchestrator.model;

/**
 * States of a pipeline.
 *
 * Transitions (happy path):
 *   RECEIVED → PROCESSING → DISPATCHING → EXECUTING → PROCESSING_RESULTS → COMPLETED
 *
 * Any non-terminal state can jump to FAILED. COMPLETED and FAILED are absorbing.
 * A non-terminal state may also "transition" to itself; the orchestrator uses that
 * to record retry metadata without advancing the pipeline.
 */
public enum PipelineState {
    RECEIVED,
    PROCESSING,
    DISPATCHING,
    EXECUTING,
    PROCESSING_RESULTS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** True if moving from this state to {@code next} keeps the observed sequence canonical. */
    public boolean canTransitionTo(PipelineState next) {
        if (isTerminal()) return false;
        if (next == FAILED || next == this) return true;
        return next.ordinal() == this.ordinal() + 1;
    }
}
