package com.repopal.orchestrator.service;

import com.repopal.orchestrator.event.StandardizedEvent;
import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.model.PipelineState;
import com.repopal.orchestrator.model.Stage;
import com.repopal.orchestrator.queue.TaskMessage;
import com.repopal.orchestrator.queue.TaskQueue;
import com.repopal.orchestrator.stage.PipelineContext;
import com.repopal.orchestrator.stage.StageException;
import com.repopal.orchestrator.stage.StageHandler;
import com.repopal.orchestrator.stage.StageOutcome;
import com.repopal.orchestrator.stage.StagePayload;
import com.repopal.orchestrator.store.IllegalTransitionException;
import com.repopal.orchestrator.store.VersionConflictException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives pipelines through their stages.
 *
 * One call to {@link #process} runs one stage task:
 *  1. Re-read the pipeline; drop the task if the pipeline is gone, terminal or
 *     has moved past the task's expected version. A cancelled pipeline is failed.
 *  2. Run the stage handler under its soft and hard time limits.
 *  3. On success, transition to the next state and enqueue the next stage in one
 *     transaction. On failure, retry with backoff or fail the pipeline.
 *
 * Handlers never write state; only this class does, and only with the version the
 * task was created for. Whatever finishes second loses the compare-and-set.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String CANCELLED = "cancelled";

    private final PipelineStateManager states;
    private final TaskQueue queue;
    private final Map<Stage, StageHandler> handlers;
    private final PipelineContext context;
    private final StagePolicy policy;
    private final PayloadCodec codec;
    private final TransactionOperations tx;
    private final MeterRegistry meters;

    // Stage handlers run here so the worker thread can enforce the hard limit.
    private final ExecutorService stageRunner = Executors.newCachedThreadPool();

    public PipelineOrchestrator(PipelineStateManager states,
                                TaskQueue queue,
                                List<StageHandler> handlers,
                                PipelineContext context,
                                StagePolicy policy,
                                PayloadCodec codec,
                                TransactionOperations tx,
                                MeterRegistry meters) {
        this.states   = states;
        this.queue    = queue;
        this.context  = context;
        this.policy   = policy;
        this.codec    = codec;
        this.tx       = tx;
        this.meters   = meters;

        Map<Stage, StageHandler> byStage = new EnumMap<>(Stage.class);
        for (StageHandler handler : handlers) {
            if (byStage.put(handler.stage(), handler) != null) {
                throw new IllegalStateException("Two handlers registered for stage " + handler.stage());
            }
        }
        for (Stage stage : Stage.values()) {
            if (!byStage.containsKey(stage)) {
                throw new IllegalStateException("No handler registered for stage " + stage);
            }
        }
        this.handlers = byStage;
    }

    @PreDestroy
    void shutdown() {
        stageRunner.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Ingress
    // ------------------------------------------------------------------

    /**
     * Create a pipeline for {@code event} and enqueue its first stage.
     * The pipeline row and its first task are written in one transaction.
     *
     * @throws IllegalArgumentException if the event has no service or repository
     */
    public UUID createPipeline(StandardizedEvent event) {
        if (event == null || event.service() == null || event.service().isBlank()) {
            throw new IllegalArgumentException("Event must name its originating service");
        }
        if (event.repository() == null || event.repository().name() == null || event.repository().name().isBlank()) {
            throw new IllegalArgumentException("Event must name a target repository");
        }

        UUID pipelineId = tx.execute(status -> {
            Pipeline created = states.create(event);
            UUID taskId = UUID.randomUUID();
            Pipeline processing = states.transition(created.getId(), created.getVersion(),
                    PipelineState.PROCESSING, taskId, null, Map.of());
            queue.enqueue(TaskMessage.of(taskId, created.getId(), processing.getVersion(),
                    Stage.PROCESS, codec.encode(StagePayload.of(event)), 0), Duration.ZERO);
            return created.getId();
        });
        log.info("Pipeline {} created for {} ({})", pipelineId, event.repository().name(), event.service());
        return pipelineId;
    }

    public Pipeline cancel(UUID pipelineId) {
        return states.requestCancellation(pipelineId);
    }

    // ------------------------------------------------------------------
    // Stage tasks (called by the scheduler on a lane worker thread)
    // ------------------------------------------------------------------

    /**
     * Run one claimed task to completion and acknowledge it.
     * Exceptions escaping this method leave the task RUNNING for redelivery.
     */
    public void process(TaskMessage task) {
        MDC.put("pipelineId", task.pipelineId().toString());
        MDC.put("stage", task.stage().name());
        MDC.put("taskId", task.taskId().toString());
        MDC.put("attempt", String.valueOf(task.attempt()));
        try {
            Optional<Pipeline> found = states.find(task.pipelineId());
            if (found.isEmpty()) {
                log.warn("Pipeline no longer exists, dropping task");
                queue.acknowledge(task.taskId());
                return;
            }
            Pipeline pipeline = found.get();

            if (pipeline.getState().isTerminal()) {
                stale(task, pipeline);
                return;
            }
            if (pipeline.isCancelRequested()) {
                failCancelled(pipeline, task.stage(), task.payload());
                queue.fail(task.taskId(), CANCELLED);
                return;
            }
            if (pipeline.getVersion() != task.expectedVersion()) {
                stale(task, pipeline);
                return;
            }

            String failure = run(task, pipeline);
            if (failure == null) {
                queue.acknowledge(task.taskId());
            } else {
                queue.fail(task.taskId(), failure);
            }
        } finally {
            MDC.remove("pipelineId");
            MDC.remove("stage");
            MDC.remove("taskId");
            MDC.remove("attempt");
        }
    }

    /**
     * A task whose worker stopped heartbeating once too often: fail its pipeline
     * unless the pipeline has moved on without it.
     */
    public void handleAbandoned(TaskMessage task) {
        MDC.put("pipelineId", task.pipelineId().toString());
        MDC.put("stage", task.stage().name());
        MDC.put("taskId", task.taskId().toString());
        try {
            Optional<Pipeline> found = states.find(task.pipelineId());
            if (found.isEmpty() || found.get().getState().isTerminal()) {
                return;
            }
            Pipeline pipeline = found.get();
            if (pipeline.isCancelRequested()) {
                failCancelled(pipeline, task.stage(), task.payload());
                return;
            }
            if (pipeline.getVersion() != task.expectedVersion()) {
                log.info("Abandoned task is stale (pipeline at v{}), ignoring", pipeline.getVersion());
                return;
            }
            String error = "Stage " + task.stage() + " was abandoned: its worker stopped responding";
            states.transition(pipeline.getId(), pipeline.getVersion(), PipelineState.FAILED, null, error,
                    failureMetadata(error, task.stage(), StageException.Kind.FATAL));
            log.error("Pipeline FAILED: {}", error);
            notifyFailure(pipeline, task.payload(), error);
        } catch (VersionConflictException | IllegalTransitionException e) {
            log.info("Abandoned task lost a race, pipeline already moved on: {}", e.getMessage());
        } finally {
            MDC.remove("pipelineId");
            MDC.remove("stage");
            MDC.remove("taskId");
        }
    }

    // ------------------------------------------------------------------
    // Stage execution
    // ------------------------------------------------------------------

    /** @return why the stage failed the pipeline, or null if the task finished normally */
    private String run(TaskMessage task, Pipeline pipeline) {
        Stage stage = task.stage();
        Timer.Sample sample = Timer.start(meters);
        String outcome;
        String failure = null;
        try {
            try {
                StagePayload payload = codec.decode(task.payload());
                StageOutcome result = invoke(handlers.get(stage), pipeline, payload);
                outcome = applyOutcome(task, pipeline, result);
                if (result.failed()) {
                    failure = Objects.requireNonNullElse(result.error(), "Stage " + stage + " failed");
                }
            } catch (StageException e) {
                outcome = handleFailure(task, pipeline, e);
                if (!"retry".equals(outcome)) {
                    failure = Objects.requireNonNullElse(e.getMessage(), e.getClass().getSimpleName());
                }
            }
        } catch (VersionConflictException | IllegalTransitionException e) {
            outcome = "stale";
            lostRace(task, e);
        }
        sample.stop(meters.timer("repopal.stage.duration", "stage", stage.name(), "outcome", outcome));
        meters.counter("repopal.stage.outcomes", "stage", stage.name(), "outcome", outcome).increment();
        return failure;
    }

    /**
     * Run the handler on the stage runner and wait for it: a warning past the soft
     * limit, interruption past the hard limit.
     */
    private StageOutcome invoke(StageHandler handler, Pipeline pipeline, StagePayload payload) {
        Stage stage = handler.stage();
        UUID pipelineId = pipeline.getId();
        PipelineContext bound = context.withCancellation(
                () -> Thread.currentThread().isInterrupted() || states.isCancelRequested(pipelineId));
        Pipeline snapshot = pipeline.copy();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        Future<StageOutcome> future = stageRunner.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return handler.handle(bound, snapshot, payload);
            } finally {
                MDC.clear();
            }
        });

        long soft = policy.softLimit(stage).toMillis();
        long hard = policy.hardLimit(stage).toMillis();
        try {
            if (soft < hard) {
                try {
                    return future.get(soft, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    log.warn("Stage {} passed its soft limit of {}s and is still running", stage, soft / 1000);
                }
                return future.get(hard - soft, TimeUnit.MILLISECONDS);
            }
            return future.get(hard, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            String message = "Stage %s exceeded its hard time limit of %ds".formatted(stage, hard / 1000);
            // Re-running a non-idempotent stage after an unknown partial effect is not safe.
            throw new StageException(stage.idempotent() ? StageException.Kind.TRANSIENT : StageException.Kind.FATAL,
                    message, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StageException stageException) {
                throw stageException;
            }
            log.error("Unexpected error in stage {}", stage, cause);
            throw StageException.fatal("Unexpected error in stage " + stage + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw StageException.transientFailure("Interrupted while waiting for stage " + stage, e);
        }
    }

    /**
     * Apply a handler's normal return. A cancellation flagged while the stage ran
     * does not undo work the stage already did: its outcome is applied on top of
     * the flag, and the next stage then fails as cancelled.
     */
    private String applyOutcome(TaskMessage task, Pipeline pipeline, StageOutcome result) {
        try {
            return complete(task, pipeline, task.expectedVersion(), result);
        } catch (VersionConflictException e) {
            Pipeline flagged = cancelledMeanwhile(pipeline).orElseThrow(() -> e);
            log.info("Cancellation arrived after stage {} finished, applying its outcome at v{}",
                    task.stage(), flagged.getVersion());
            return complete(task, pipeline, flagged.getVersion(), result);
        }
    }

    /** The pipeline as stored, if the only write since {@code before} was the cancellation flag. */
    private Optional<Pipeline> cancelledMeanwhile(Pipeline before) {
        return states.find(before.getId())
                .filter(p -> !before.isCancelRequested() && p.isCancelRequested())
                .filter(p -> p.getState() == before.getState())
                .filter(p -> p.getVersion() == before.getVersion() + 1)
                .filter(p -> Objects.equals(p.getCurrentTaskId(), before.getCurrentTaskId()));
    }

    private String complete(TaskMessage task, Pipeline pipeline, long expectedVersion, StageOutcome result) {
        Stage stage = task.stage();

        if (result.failed()) {
            String error = Objects.requireNonNullElse(result.error(), "Stage " + stage + " failed");
            Map<String, Object> metadata = new LinkedHashMap<>(result.metadata());
            metadata.putAll(failureMetadata(error, stage, StageException.Kind.FATAL));
            states.transition(pipeline.getId(), expectedVersion, PipelineState.FAILED, null, error, metadata);
            log.warn("Pipeline FAILED at {}: {}", stage, error);
            return "failed";
        }

        StageTransitions.Transition next = StageTransitions.after(stage);
        if (next.next() == null) {
            states.transition(pipeline.getId(), expectedVersion, next.onSuccess(), null, null, result.metadata());
            log.info("Pipeline {}", next.onSuccess());
            return "success";
        }

        UUID nextTaskId = UUID.randomUUID();
        String payload = codec.encode(result.payload());
        tx.executeWithoutResult(status -> {
            Pipeline advanced = states.transition(pipeline.getId(), expectedVersion, next.onSuccess(),
                    nextTaskId, null, result.metadata());
            queue.enqueue(TaskMessage.of(nextTaskId, pipeline.getId(), advanced.getVersion(),
                    next.next(), payload, 0), Duration.ZERO);
        });
        return "success";
    }

    /** Retry a transient failure while the budget lasts; otherwise fail the pipeline. */
    private String handleFailure(TaskMessage task, Pipeline pipeline, StageException e) {
        Stage stage = task.stage();
        String error = Objects.requireNonNullElse(e.getMessage(), e.getClass().getSimpleName());

        if (e.getKind() == StageException.Kind.TRANSIENT && policy.canRetry(task.attempt())) {
            int retryCount = retryCount(pipeline) + 1;
            Duration delay = policy.backoff(task.attempt());
            UUID retryTaskId = UUID.randomUUID();
            Map<String, Object> metadata = Map.of(
                    "retryCount", retryCount,
                    "lastRetryError", error,
                    "lastRetryStage", stage.name());
            tx.executeWithoutResult(status -> {
                Pipeline retried = states.transition(pipeline.getId(), task.expectedVersion(), pipeline.getState(),
                        retryTaskId, null, metadata);
                queue.enqueue(TaskMessage.of(retryTaskId, pipeline.getId(), retried.getVersion(), stage,
                        task.payload(), task.attempt() + 1), delay);
            });
            log.warn("Stage {} failed (attempt {}), retrying in {}s: {}",
                    stage, task.attempt() + 1, delay.toSeconds(), error);
            return "retry";
        }

        states.transition(pipeline.getId(), task.expectedVersion(), PipelineState.FAILED, null, error,
                failureMetadata(error, stage, e.getKind()));
        if (e.getKind() == StageException.Kind.TRANSIENT) {
            log.error("Pipeline FAILED at {}: retries exhausted after {} attempts: {}",
                    stage, task.attempt() + 1, error);
        } else {
            log.error("Pipeline FAILED at {} ({}): {}", stage, e.getKind(), error);
        }
        notifyFailure(pipeline, task.payload(), error);
        return e.getKind().name().toLowerCase();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void stale(TaskMessage task, Pipeline pipeline) {
        log.info("Stale task (expected v{}, pipeline at v{} in {}), acknowledging without work",
                task.expectedVersion(), pipeline.getVersion(), pipeline.getState());
        meters.counter("repopal.tasks.stale").increment();
        queue.acknowledge(task.taskId());
    }

    /**
     * Our write was rejected. Usually a duplicate delivery finished first; if the
     * pipeline was cancelled meanwhile, it still has to be failed.
     */
    private void lostRace(TaskMessage task, RuntimeException e) {
        log.info("Dropping stage result, pipeline moved on: {}", e.getMessage());
        meters.counter("repopal.tasks.stale").increment();
        states.find(task.pipelineId())
                .filter(p -> !p.getState().isTerminal() && p.isCancelRequested())
                .ifPresent(p -> failCancelled(p, task.stage(), task.payload()));
    }

    private void failCancelled(Pipeline pipeline, Stage stage, String payloadJson) {
        try {
            states.transition(pipeline.getId(), pipeline.getVersion(), PipelineState.FAILED, null, CANCELLED,
                    failureMetadata(CANCELLED, stage, StageException.Kind.FATAL));
            log.info("Pipeline cancelled before {}", stage);
            notifyFailure(pipeline, payloadJson, "The pipeline was cancelled");
        } catch (VersionConflictException | IllegalTransitionException e) {
            log.info("Cancellation already applied by another worker: {}", e.getMessage());
        }
    }

    private void notifyFailure(Pipeline pipeline, String payloadJson, String error) {
        StagePayload payload;
        try {
            payload = codec.decode(payloadJson);
        } catch (StageException e) {
            log.warn("Cannot notify services about pipeline {}: {}", pipeline.getId(), e.getMessage());
            return;
        }
        try {
            context.results().notifyFailure(pipeline.getId(), payload.event(), payload.command(), error);
        } catch (RuntimeException e) {
            log.warn("Failure notification for pipeline {} failed: {}", pipeline.getId(), e.getMessage());
        }
    }

    private static Map<String, Object> failureMetadata(String error, Stage stage, StageException.Kind kind) {
        return Map.of(
                "error", error,
                "failedStage", stage.name(),
                "errorKind", kind.name());
    }

    private static int retryCount(Pipeline pipeline) {
        return pipeline.getMetadata().get("retryCount") instanceof Number n ? n.intValue() : 0;
    }
}
