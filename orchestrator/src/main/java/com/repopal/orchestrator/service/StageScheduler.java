package com.repopal.orchestrator.service;

import com.repopal.orchestrator.config.RepoPalProperties;
import com.repopal.orchestrator.model.Lane;
import com.repopal.orchestrator.queue.TaskMessage;
import com.repopal.orchestrator.queue.TaskQueue;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Background scheduler that feeds claimed stage tasks to the lane worker pools.
 *
 * The DB is the queue: every tick claims PENDING tasks for a lane while that lane
 * has an idle worker. CONTROL and EXECUTION have separate pools and separate ticks,
 * so long sandbox runs never hold up command selection or notifications.
 *
 * While a task runs, its heartbeat is refreshed; a task whose heartbeat goes stale
 * is redelivered by {@link #recoverStalled()}.
 */
@Component
@EnableScheduling
public class StageScheduler {

    private static final Logger log = LoggerFactory.getLogger(StageScheduler.class);

    /** Fixed pool plus a permit per worker, so we never claim more than we can run. */
    private record LanePool(ExecutorService workers, Semaphore idle) {}

    private final PipelineOrchestrator orchestrator;
    private final TaskQueue queue;
    private final RepoPalProperties.Pipeline config;
    private final Map<Lane, LanePool> pools = new EnumMap<>(Lane.class);
    private final ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor();
    private final String nodeId = UUID.randomUUID().toString().substring(0, 8);

    public StageScheduler(PipelineOrchestrator orchestrator, TaskQueue queue, RepoPalProperties properties) {
        this.orchestrator = orchestrator;
        this.queue        = queue;
        this.config       = properties.getPipeline();
        pools.put(Lane.CONTROL,   newPool(config.getControlWorkers()));
        pools.put(Lane.EXECUTION, newPool(config.getExecutionWorkers()));
    }

    private static LanePool newPool(int workers) {
        return new LanePool(Executors.newFixedThreadPool(workers), new Semaphore(workers));
    }

    @Scheduled(fixedDelayString = "${repopal.pipeline.poll-interval-ms:2000}")
    public void tickControl() {
        drain(Lane.CONTROL);
    }

    @Scheduled(fixedDelayString = "${repopal.pipeline.poll-interval-ms:2000}")
    public void tickExecution() {
        drain(Lane.EXECUTION);
    }

    /**
     * Redeliver tasks whose worker went quiet; fail the pipelines of tasks that
     * have already been delivered too often.
     */
    @Scheduled(fixedDelayString = "${repopal.pipeline.recovery-interval-ms:60000}")
    public void recoverStalled() {
        List<TaskMessage> abandoned = queue.recoverExpired(
                Duration.ofSeconds(config.getVisibilityTimeoutSeconds()), config.getMaxDeliveries());
        abandoned.forEach(orchestrator::handleAbandoned);
    }

    /** Claim tasks for {@code lane} until it has no idle worker or nothing is pending. */
    void drain(Lane lane) {
        LanePool pool = pools.get(lane);
        while (pool.idle().tryAcquire()) {
            Optional<TaskMessage> claimed;
            try {
                claimed = queue.claimNext(lane, workerId(lane));
            } catch (RuntimeException e) {
                pool.idle().release();
                log.error("Could not claim a {} task: {}", lane, e.getMessage(), e);
                return;
            }
            if (claimed.isEmpty()) {
                pool.idle().release();
                return;
            }
            TaskMessage task = claimed.get();
            pool.workers().submit(() -> runTask(pool, task));
        }
    }

    private void runTask(LanePool pool, TaskMessage task) {
        long interval = Math.max(1, config.getHeartbeatIntervalSeconds());
        ScheduledFuture<?> beat = heartbeats.scheduleAtFixedRate(
                () -> heartbeat(task), interval, interval, TimeUnit.SECONDS);
        try {
            orchestrator.process(task);
        } catch (Exception e) {
            // The task stays RUNNING without heartbeats and is redelivered after the visibility timeout.
            log.error("Unhandled error processing task {} (pipeline={}, stage={}): {}",
                    task.taskId(), task.pipelineId(), task.stage(), e.getMessage(), e);
        } finally {
            beat.cancel(false);
            pool.idle().release();
        }
    }

    private void heartbeat(TaskMessage task) {
        try {
            queue.heartbeat(task.taskId());
        } catch (RuntimeException e) {
            log.warn("Heartbeat for task {} failed: {}", task.taskId(), e.getMessage());
        }
    }

    private String workerId(Lane lane) {
        return nodeId + "-" + lane.name().toLowerCase() + "-" + Thread.currentThread().getId();
    }

    @PreDestroy
    void shutdown() {
        heartbeats.shutdownNow();
        pools.values().forEach(p -> p.workers().shutdownNow());
    }
}
