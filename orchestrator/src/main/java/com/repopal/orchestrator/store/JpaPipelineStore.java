package com.repopal.orchestrator.store;

import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.model.PipelineState;
import com.repopal.orchestrator.repository.PipelineRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link PipelineStore} on the pipelines table.
 *
 * The compare-and-set takes a row lock (SELECT FOR UPDATE), compares the
 * version and writes, all in one transaction.
 */
@Component
public class JpaPipelineStore implements PipelineStore {

    private final PipelineRepository pipelineRepo;

    public JpaPipelineStore(PipelineRepository pipelineRepo) {
        this.pipelineRepo = pipelineRepo;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Pipeline> get(UUID id) {
        return pipelineRepo.findById(id).map(Pipeline::copy);
    }

    @Override
    @Transactional
    public Pipeline createIfAbsent(Pipeline pipeline) {
        Optional<Pipeline> existing = pipelineRepo.findForUpdate(pipeline.getId());
        if (existing.isPresent()) {
            return existing.get().copy();
        }
        return pipelineRepo.save(pipeline.copy()).copy();
    }

    @Override
    @Transactional
    public Pipeline compareAndSet(long expectedVersion, Pipeline newRecord) {
        Pipeline stored = pipelineRepo.findForUpdate(newRecord.getId())
                .orElseThrow(() -> new PipelineNotFoundException(newRecord.getId()));
        if (stored.getVersion() != expectedVersion) {
            throw new VersionConflictException(newRecord.getId(), expectedVersion, stored.getVersion());
        }
        stored.copyStateFrom(newRecord);
        stored.setVersion(expectedVersion + 1);
        stored.setUpdatedAt(Instant.now());
        return pipelineRepo.save(stored).copy();
    }

    @Override
    @Transactional(readOnly = true)
    public Map<PipelineState, Long> countByState() {
        Map<PipelineState, Long> counts = new EnumMap<>(PipelineState.class);
        for (Object[] row : pipelineRepo.countByState()) {
            counts.put((PipelineState) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }
}
