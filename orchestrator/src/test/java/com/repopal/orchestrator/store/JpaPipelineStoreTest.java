package com.repopal.orchestrator.store;

import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.model.PipelineState;
import com.repopal.orchestrator.repository.PipelineRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaPipelineStoreTest {

    @Mock PipelineRepository pipelineRepo;

    JpaPipelineStore store;

    @BeforeEach
    void setUp() {
        store = new JpaPipelineStore(pipelineRepo);
    }

    @Test
    void compareAndSet_matchingVersion_writesAndBumpsVersion() {
        Pipeline stored = pipeline();
        when(pipelineRepo.findForUpdate(stored.getId())).thenReturn(Optional.of(stored));
        when(pipelineRepo.save(any())).thenAnswer(inv -> inv.getArgument(0));

        Pipeline update = stored.copy();
        update.setState(PipelineState.PROCESSING);
        Pipeline result = store.compareAndSet(1, update);

        assertThat(result.getState()).isEqualTo(PipelineState.PROCESSING);
        assertThat(result.getVersion()).isEqualTo(2);
        assertThat(stored.getVersion()).isEqualTo(2);
    }

    @Test
    void compareAndSet_staleVersion_throwsWithoutWriting() {
        Pipeline stored = pipeline();
        stored.setVersion(4);
        when(pipelineRepo.findForUpdate(stored.getId())).thenReturn(Optional.of(stored));

        Pipeline update = stored.copy();
        update.setState(PipelineState.FAILED);

        assertThatThrownBy(() -> store.compareAndSet(3, update))
                .isInstanceOf(VersionConflictException.class)
                .hasMessageContaining("is at version 4");
        assertThat(stored.getState()).isEqualTo(PipelineState.RECEIVED);
        verify(pipelineRepo, never()).save(any());
    }

    @Test
    void compareAndSet_unknownPipeline_throwsNotFound() {
        Pipeline update = pipeline();
        when(pipelineRepo.findForUpdate(update.getId())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.compareAndSet(1, update))
                .isInstanceOf(PipelineNotFoundException.class);
    }

    @Test
    void createIfAbsent_existingRow_returnsItUnchanged() {
        Pipeline existing = pipeline();
        existing.setState(PipelineState.EXECUTING);
        when(pipelineRepo.findForUpdate(existing.getId())).thenReturn(Optional.of(existing));

        Pipeline result = store.createIfAbsent(new Pipeline(existing.getId(), "github", "org/repo"));

        assertThat(result.getState()).isEqualTo(PipelineState.EXECUTING);
        verify(pipelineRepo, never()).save(any());
    }

    @Test
    void get_returnsDetachedCopy() {
        Pipeline stored = pipeline();
        when(pipelineRepo.findById(stored.getId())).thenReturn(Optional.of(stored));

        Pipeline copy = store.get(stored.getId()).orElseThrow();
        copy.setState(PipelineState.FAILED);
        copy.mergeMetadata(Map.of("x", 1));

        assertThat(stored.getState()).isEqualTo(PipelineState.RECEIVED);
        assertThat(stored.getMetadata()).isEmpty();
    }

    @Test
    void countByState_mapsRows() {
        when(pipelineRepo.countByState()).thenReturn(List.of(
                new Object[]{PipelineState.COMPLETED, 7L},
                new Object[]{PipelineState.FAILED, 2L}));

        assertThat(store.countByState())
                .containsEntry(PipelineState.COMPLETED, 7L)
                .containsEntry(PipelineState.FAILED, 2L)
                .hasSize(2);
    }

    private static Pipeline pipeline() {
        return new Pipeline(UUID.randomUUID(), "github", "org/repo");
    }
}
