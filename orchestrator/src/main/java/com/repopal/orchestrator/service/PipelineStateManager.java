package com.repopal.orchestrator.service;

import com.repopal.orchestrator.event.StandardizedEvent;
import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.model.PipelineState;
import com.repopal.orchestrator.store.IllegalTransitionException;
import com.repopal.orchestrator.store.PipelineNotFoundException;
import com.repopal.orchestrator.store.PipelineStore;
import com.repopal.orchestrator.store.VersionConflictException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The pipeline state machine on top of the {@link PipelineStore}.
 *
 * Every write is a compare-and-set against the caller's expected version, so a
 * stale caller can never overwrite newer state.
 */
@Service
public class PipelineStateManager {

    private static final Logger log = LoggerFactory.getLogger(PipelineStateManager.class);

    private static final int CANCEL_ATTEMPTS = 5;

    private final PipelineStore store;
    private final MeterRegistry meters;

    public PipelineStateManager(PipelineStore store, MeterRegistry meters) {
        this.store  = store;
        this.meters = meters;
    }

    /** New pipeline in RECEIVED at version 1. */
    public Pipeline create(StandardizedEvent event) {
        Pipeline pipeline = store.createIfAbsent(
                new Pipeline(UUID.randomUUID(), event.service(), event.repository().name()));
        log.info("Pipeline {} RECEIVED from {} for {}", pipeline.getId(), event.service(), event.repository().name());
        return pipeline;
    }

    public Optional<Pipeline> find(UUID id) {
        return store.get(id);
    }

    public Pipeline get(UUID id) {
        return store.get(id).orElseThrow(() -> new PipelineNotFoundException(id));
    }

    /**
     * Move a pipeline to {@code newState}.
     *
     * @param taskId        new current task id, or null to keep the existing one
     * @param error         replaces the stored error when non-null
     * @param metadataPatch merged into the stored metadata
     * @throws VersionConflictException   if the stored version is not {@code expectedVersion}
     * @throws IllegalTransitionException if the state machine forbids the move
     */
    public Pipeline transition(UUID id, long expectedVersion, PipelineState newState,
                               UUID taskId, String error, Map<String, ?> metadataPatch) {
        Pipeline current = get(id);
        if (current.getVersion() != expectedVersion) {
            throw new VersionConflictException(id, expectedVersion, current.getVersion());
        }
        if (!current.getState().canTransitionTo(newState)) {
            throw new IllegalTransitionException(id, current.getState(), newState);
        }

        Pipeline next = current.copy();
        next.setState(newState);
        if (taskId != null) next.setCurrentTaskId(taskId);
        if (error != null) next.setError(error);
        next.mergeMetadata(metadataPatch);

        Pipeline stored = store.compareAndSet(expectedVersion, next);
        meters.counter("repopal.pipeline.transitions", "state", newState.name()).increment();
        if (current.getState() == newState) {
            log.debug("Pipeline {} stays {} (v{})", id, newState, stored.getVersion());
        } else {
            log.info("Pipeline {} {} → {} (v{})", id, current.getState(), newState, stored.getVersion());
        }
        return stored;
    }

    /**
     * Raise the cancellation flag. The stage loop notices it before the next stage,
     * and a running sandbox notices it on its next poll.
     *
     * @return the pipeline as stored; unchanged if it was already terminal or flagged
     */
    public Pipeline requestCancellation(UUID id) {
        for (int i = 0; i < CANCEL_ATTEMPTS; i++) {
            Pipeline current = get(id);
            if (current.getState().isTerminal() || current.isCancelRequested()) {
                return current;
            }
            Pipeline flagged = current.copy();
            flagged.setCancelRequested(true);
            try {
                Pipeline stored = store.compareAndSet(current.getVersion(), flagged);
                log.info("Cancellation requested for pipeline {} in state {}", id, current.getState());
                return stored;
            } catch (VersionConflictException e) {
                log.debug("Cancellation of {} raced a concurrent update, retrying", id);
            }
        }
        throw new IllegalStateException("Could not flag pipeline " + id + " for cancellation after "
                + CANCEL_ATTEMPTS + " attempts");
    }

    public boolean isCancelRequested(UUID id) {
        return store.get(id).map(Pipeline::isCancelRequested).orElse(false);
    }

    /** Pipelines per state, every state present. */
    public Map<PipelineState, Long> countByState() {
        Map<PipelineState, Long> counts = new EnumMap<>(PipelineState.class);
        for (PipelineState state : PipelineState.values()) counts.put(state, 0L);
        counts.putAll(store.countByState());
        return counts;
    }
}
