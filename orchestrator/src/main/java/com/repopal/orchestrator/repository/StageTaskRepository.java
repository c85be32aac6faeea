package com.repopal.orchestrator.repository;

import com.repopal.orchestrator.model.Lane;
import com.repopal.orchestrator.model.StageTask;
import com.repopal.orchestrator.model.TaskState;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + queue queries for the stage_tasks table.
 */
public interface StageTaskRepository extends JpaRepository<StageTask, UUID> {

    /**
     * Claim the oldest due PENDING task on a lane.
     *
     * Runs inside the caller's transaction; the caller must set state = RUNNING
     * before committing, otherwise the row lock is released with the task still PENDING.
     * Lock timeout -2 is Hibernate's SKIP LOCKED: rows another worker holds are passed over.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT t FROM StageTask t
            WHERE t.state = 'PENDING'
              AND t.lane = :lane
              AND t.availableAt <= :now
            ORDER BY t.availableAt ASC, t.createdAt ASC
            LIMIT 1
            """)
    Optional<StageTask> claimNextPending(@Param("lane") Lane lane, @Param("now") Instant now);

    boolean existsByIdempotencyKey(String idempotencyKey);

    /** All tasks of a pipeline, in creation order. */
    List<StageTask> findByPipelineIdOrderByCreatedAtAsc(UUID pipelineId);

    /** RUNNING tasks whose worker stopped heartbeating before {@code cutoff}. */
    List<StageTask> findByStateAndHeartbeatAtBefore(TaskState state, Instant cutoff);
}
