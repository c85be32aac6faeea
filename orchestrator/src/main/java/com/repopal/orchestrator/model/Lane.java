package com.repopal.orchestrator.model;

/**
 * Worker lanes. Each lane has its own worker pool so that long sandbox runs
 * on the EXECUTION lane never starve the lightweight CONTROL stages.
 */
public enum Lane {
    CONTROL,
    EXECUTION
}
