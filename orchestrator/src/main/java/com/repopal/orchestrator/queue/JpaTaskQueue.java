package com.repopal.orchestrator.queue;

import com.repopal.orchestrator.model.Lane;
import com.repopal.orchestrator.model.StageTask;
import com.repopal.orchestrator.model.TaskState;
import com.repopal.orchestrator.repository.StageTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link TaskQueue} on the stage_tasks table.
 *
 * The DB is the queue: SELECT FOR UPDATE is the dequeue, the heartbeat column
 * is the visibility timeout, and the unique idempotency_key column keeps a
 * (pipeline, stage, version) from being enqueued twice.
 */
@Component
public class JpaTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(JpaTaskQueue.class);

    private final StageTaskRepository taskRepo;

    public JpaTaskQueue(StageTaskRepository taskRepo) {
        this.taskRepo = taskRepo;
    }

    @Override
    @Transactional
    public boolean enqueue(TaskMessage message, Duration delay) {
        if (taskRepo.existsByIdempotencyKey(message.idempotencyKey())) {
            log.info("Task {} already enqueued, skipping duplicate", message.idempotencyKey());
            return false;
        }
        taskRepo.save(new StageTask(message.taskId(), message.pipelineId(), message.stage(),
                message.expectedVersion(), message.payload(), message.idempotencyKey(),
                message.attempt(), Instant.now().plus(delay)));
        log.debug("Enqueued {} (attempt {}, delay {}s)",
                message.idempotencyKey(), message.attempt(), delay.toSeconds());
        return true;
    }

    @Override
    @Transactional
    public Optional<TaskMessage> claimNext(Lane lane, String workerId) {
        Optional<StageTask> opt = taskRepo.claimNextPending(lane, Instant.now());
        opt.ifPresent(task -> {
            Instant now = Instant.now();
            task.setState(TaskState.RUNNING);
            task.setWorkerId(workerId);
            task.setStartedAt(now);
            task.setHeartbeatAt(now);
            task.incrementDeliveries();
            taskRepo.save(task);
            log.info("Worker '{}' claimed task {} (pipeline={}, stage={}, delivery={})",
                    workerId, task.getId(), task.getPipelineId(), task.getStage(), task.getDeliveries());
        });
        return opt.map(TaskMessage::from);
    }

    @Override
    @Transactional
    public void acknowledge(UUID taskId) {
        taskRepo.findById(taskId).ifPresent(task -> {
            task.setState(TaskState.DONE);
            task.setFinishedAt(Instant.now());
            taskRepo.save(task);
        });
    }

    @Override
    @Transactional
    public void fail(UUID taskId, String reason) {
        taskRepo.findById(taskId).ifPresent(task -> {
            task.setState(TaskState.FAILED);
            task.setFinishedAt(Instant.now());
            task.setLastError(reason);
            taskRepo.save(task);
        });
    }

    @Override
    @Transactional
    public void heartbeat(UUID taskId) {
        taskRepo.findById(taskId).ifPresent(task -> {
            if (task.getState() == TaskState.RUNNING) {
                task.setHeartbeatAt(Instant.now());
                taskRepo.save(task);
            }
        });
    }

    @Override
    @Transactional
    public List<TaskMessage> recoverExpired(Duration visibilityTimeout, int maxDeliveries) {
        Instant cutoff = Instant.now().minus(visibilityTimeout);
        List<TaskMessage> abandoned = new ArrayList<>();
        for (StageTask task : taskRepo.findByStateAndHeartbeatAtBefore(TaskState.RUNNING, cutoff)) {
            if (task.getDeliveries() < maxDeliveries) {
                log.warn("Redelivering stalled task {} (worker={}, last heartbeat={})",
                        task.getId(), task.getWorkerId(), task.getHeartbeatAt());
                task.setState(TaskState.PENDING);
                task.setWorkerId(null);
                task.setStartedAt(null);
            } else {
                log.error("Task {} stalled on delivery {}/{}, giving up",
                        task.getId(), task.getDeliveries(), maxDeliveries);
                task.setState(TaskState.FAILED);
                task.setFinishedAt(Instant.now());
                task.setLastError("Worker heartbeat timed out after " + visibilityTimeout.toSeconds() + "s");
                abandoned.add(TaskMessage.from(task));
            }
            taskRepo.save(task);
        }
        return abandoned;
    }

    @Override
    @Transactional(readOnly = true)
    public List<StageTask> tasksFor(UUID pipelineId) {
        return taskRepo.findByPipelineIdOrderByCreatedAtAsc(pipelineId);
    }
}
