package com.repopal.orchestrator.repository;

import com.repopal.orchestrator.model.Pipeline;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + locking queries for the pipelines table.
 */
public interface PipelineRepository extends JpaRepository<Pipeline, UUID> {

    /**
     * Load a pipeline row with SELECT FOR UPDATE.
     *
     * Held until the surrounding transaction commits, so the version check and
     * the write that follows it form one atomic compare-and-set.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Pipeline p WHERE p.id = :id")
    Optional<Pipeline> findForUpdate(@Param("id") UUID id);

    /** Rows of [PipelineState, Long]: pipeline count per state. */
    @Query("SELECT p.state, COUNT(p) FROM Pipeline p GROUP BY p.state")
    List<Object[]> countByState();
}
