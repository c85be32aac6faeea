package com.repopal.orchestrator.model;

/**
 * Delivery state of a single stage task.
 *
 * Transitions:
 *   PENDING → RUNNING (claimed by a worker)
 *   RUNNING → DONE    (acknowledged: stage finished, failed terminally, or was a stale no-op)
 *   RUNNING → PENDING (visibility timeout expired; redelivered)
 *   RUNNING → FAILED  (redelivery budget exhausted)
 */
public enum TaskState {
    PENDING,
    RUNNING,
    DONE,
    FAILED
}
