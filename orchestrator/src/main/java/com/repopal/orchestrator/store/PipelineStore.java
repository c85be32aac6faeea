package com.repopal.orchestrator.store;

import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.model.PipelineState;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record store for pipelines, keyed by pipeline id.
 *
 * Implementations hand out detached copies: mutating a returned Pipeline
 * never changes stored state until it goes back through {@link #compareAndSet}.
 */
public interface PipelineStore {

    Optional<Pipeline> get(UUID id);

    /**
     * Persist {@code pipeline} unless a record with the same id already exists.
     *
     * @return the stored record (the existing one if there was one)
     */
    Pipeline createIfAbsent(Pipeline pipeline);

    /**
     * Atomically replace the stored record with {@code newRecord} if, and only if,
     * the stored version equals {@code expectedVersion}. The stored version becomes
     * {@code expectedVersion + 1}.
     *
     * @return the record as stored after the update
     * @throws VersionConflictException  if the stored version differs; nothing is written
     * @throws PipelineNotFoundException if no record exists for the id
     */
    Pipeline compareAndSet(long expectedVersion, Pipeline newRecord);

    /** Number of pipelines per state (states with no pipelines may be absent). */
    Map<PipelineState, Long> countByState();
}
