package com.repopal.orchestrator.queue;

import com.repopal.orchestrator.model.Lane;
import com.repopal.orchestrator.model.StageTask;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * At-least-once delivery of stage tasks to the worker pools.
 *
 * A claimed task belongs to one worker until it is acknowledged, failed, or its
 * heartbeat goes stale for longer than the visibility timeout, after which it is
 * handed out again.
 */
public interface TaskQueue {

    /**
     * Enqueue a task that becomes claimable after {@code delay}.
     *
     * @return false if a task with the same idempotency key already exists (nothing enqueued)
     */
    boolean enqueue(TaskMessage message, Duration delay);

    Optional<TaskMessage> claimNext(Lane lane, String workerId);

    /** The task is finished, whatever its outcome for the pipeline. */
    void acknowledge(UUID taskId);

    /** The task could not be processed and will not be redelivered. */
    void fail(UUID taskId, String reason);

    void heartbeat(UUID taskId);

    /**
     * Redeliver tasks whose worker stopped heartbeating more than {@code visibilityTimeout} ago.
     *
     * @return the tasks that exceeded {@code maxDeliveries} and were marked FAILED instead
     */
    List<TaskMessage> recoverExpired(Duration visibilityTimeout, int maxDeliveries);

    /** All tasks of a pipeline in creation order. */
    List<StageTask> tasksFor(UUID pipelineId);
}
