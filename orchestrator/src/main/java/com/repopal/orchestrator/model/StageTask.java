package com.repopal.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One queued unit of stage work.
 *
 * The scheduler claims a PENDING task via SELECT FOR UPDATE, sets
 * state = RUNNING and worker_id, then a worker thread runs the stage and
 * acknowledges the task. A RUNNING task whose heartbeat goes stale is
 * redelivered (the queue's visibility timeout).
 *
 * DB table: stage_tasks
 */
@Entity
@Table(name = "stage_tasks",
       uniqueConstraints = @UniqueConstraint(name = "uk_stage_tasks_idempotency_key",
                                             columnNames = "idempotency_key"))
public class StageTask {

    @Id
    private UUID id;

    @Column(name = "pipeline_id", nullable = false)
    private UUID pipelineId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Stage stage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Lane lane;

    // Pipeline version this task was issued against; the worker's version guard.
    @Column(name = "expected_version", nullable = false)
    private long expectedVersion;

    @Column(name = "payload_json", columnDefinition = "TEXT")
    private String payloadJson;

    @Column(name = "idempotency_key", nullable = false)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskState state = TaskState.PENDING;

    // Retry attempt of the stage this task carries (0 = first try).
    @Column(nullable = false)
    private int attempt = 0;

    // Number of times the queue has handed this very task to a worker.
    @Column(nullable = false)
    private int deliveries = 0;

    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    // Not claimable before this instant (retry backoff).
    @Column(name = "available_at", nullable = false)
    private Instant availableAt = Instant.now();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected StageTask() {}   // required by JPA

    public StageTask(UUID id, UUID pipelineId, Stage stage, long expectedVersion,
                     String payloadJson, String idempotencyKey, int attempt, Instant availableAt) {
        this.id              = id;
        this.pipelineId      = pipelineId;
        this.stage           = stage;
        this.lane            = stage.lane();
        this.expectedVersion = expectedVersion;
        this.payloadJson     = payloadJson;
        this.idempotencyKey  = idempotencyKey;
        this.attempt         = attempt;
        this.availableAt     = availableAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID      getId()              { return id; }
    public UUID      getPipelineId()      { return pipelineId; }
    public Stage     getStage()           { return stage; }
    public Lane      getLane()            { return lane; }
    public long      getExpectedVersion() { return expectedVersion; }
    public String    getPayloadJson()     { return payloadJson; }
    public String    getIdempotencyKey()  { return idempotencyKey; }
    public TaskState getState()           { return state; }
    public int       getAttempt()         { return attempt; }
    public int       getDeliveries()      { return deliveries; }
    public String    getWorkerId()        { return workerId; }
    public Instant   getHeartbeatAt()     { return heartbeatAt; }
    public Instant   getAvailableAt()     { return availableAt; }
    public Instant   getCreatedAt()       { return createdAt; }
    public Instant   getStartedAt()       { return startedAt; }
    public Instant   getFinishedAt()      { return finishedAt; }
    public String    getLastError()       { return lastError; }

    public void setState(TaskState state)        { this.state = state; }
    public void setWorkerId(String workerId)     { this.workerId = workerId; }
    public void setHeartbeatAt(Instant t)        { this.heartbeatAt = t; }
    public void setStartedAt(Instant t)          { this.startedAt = t; }
    public void setFinishedAt(Instant t)         { this.finishedAt = t; }
    public void setLastError(String lastError)   { this.lastError = lastError; }
    public void incrementDeliveries()            { this.deliveries++; }
}
