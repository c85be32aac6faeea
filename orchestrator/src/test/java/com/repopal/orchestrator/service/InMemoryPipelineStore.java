package com.repopal.orchestrator.service;

import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.model.PipelineState;
import com.repopal.orchestrator.store.PipelineNotFoundException;
import com.repopal.orchestrator.store.PipelineStore;
import com.repopal.orchestrator.store.VersionConflictException;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * PipelineStore fake with the same copy-in/copy-out and CAS semantics as the JPA store.
 */
class InMemoryPipelineStore implements PipelineStore {

    private final Map<UUID, Pipeline> rows = new HashMap<>();

    @Override
    public synchronized Optional<Pipeline> get(UUID id) {
        return Optional.ofNullable(rows.get(id)).map(Pipeline::copy);
    }

    @Override
    public synchronized Pipeline createIfAbsent(Pipeline pipeline) {
        return rows.computeIfAbsent(pipeline.getId(), id -> pipeline.copy()).copy();
    }

    @Override
    public synchronized Pipeline compareAndSet(long expectedVersion, Pipeline newRecord) {
        Pipeline stored = rows.get(newRecord.getId());
        if (stored == null) throw new PipelineNotFoundException(newRecord.getId());
        if (stored.getVersion() != expectedVersion) {
            throw new VersionConflictException(newRecord.getId(), expectedVersion, stored.getVersion());
        }
        stored.copyStateFrom(newRecord);
        stored.setVersion(expectedVersion + 1);
        stored.setUpdatedAt(Instant.now());
        return stored.copy();
    }

    @Override
    public synchronized Map<PipelineState, Long> countByState() {
        Map<PipelineState, Long> counts = new EnumMap<>(PipelineState.class);
        rows.values().forEach(p -> counts.merge(p.getState(), 1L, Long::sum));
        return counts;
    }

    /** Bump the version behind the orchestrator's back, as a concurrent writer would. */
    synchronized void touch(UUID id) {
        Pipeline p = rows.get(id);
        p.setVersion(p.getVersion() + 1);
    }
}
