package com.repopal.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One durable execution of the event → command → result flow.
 *
 * Only the orchestrator mutates a Pipeline, and only through
 * {@code PipelineStore.compareAndSet}: every successful update bumps
 * {@link #version}, and an update carrying a stale expected version is rejected.
 *
 * DB table: pipelines
 */
@Entity
@Table(name = "pipelines")
public class Pipeline {

    @Id
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineState state = PipelineState.RECEIVED;

    // Id of the stage task that is currently live for this pipeline.
    @Column(name = "current_task_id")
    private UUID currentTaskId;

    @Column(nullable = false)
    private String service;

    @Column(nullable = false)
    private String repository;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(columnDefinition = "TEXT")
    private String error;

    @Convert(converter = MetadataConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    // Managed by the store, not by JPA's @Version: the CAS compares it explicitly.
    @Column(nullable = false)
    private long version = 1;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested = false;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Pipeline() {}   // required by JPA

    public Pipeline(UUID id, String service, String repository) {
        this.id         = id;
        this.service    = service;
        this.repository = repository;
    }

    /** Detached copy; stores hand these out so callers never alias stored state. */
    public Pipeline copy() {
        Pipeline p = new Pipeline(id, service, repository);
        p.state           = state;
        p.currentTaskId   = currentTaskId;
        p.createdAt       = createdAt;
        p.updatedAt       = updatedAt;
        p.error           = error;
        p.metadata        = new LinkedHashMap<>(metadata);
        p.version         = version;
        p.cancelRequested = cancelRequested;
        return p;
    }

    /** Overwrite every mutable field with {@code source}'s values. */
    public void copyStateFrom(Pipeline source) {
        this.state           = source.state;
        this.currentTaskId   = source.currentTaskId;
        this.updatedAt       = source.updatedAt;
        this.error           = source.error;
        this.metadata        = new LinkedHashMap<>(source.metadata);
        this.version         = source.version;
        this.cancelRequested = source.cancelRequested;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()              { return id; }
    public PipelineState getState()           { return state; }
    public UUID          getCurrentTaskId()   { return currentTaskId; }
    public String        getService()         { return service; }
    public String        getRepository()      { return repository; }
    public Instant       getCreatedAt()       { return createdAt; }
    public Instant       getUpdatedAt()       { return updatedAt; }
    public String        getError()           { return error; }
    public Map<String, Object> getMetadata()  { return metadata; }
    public long          getVersion()         { return version; }
    public boolean       isCancelRequested()  { return cancelRequested; }

    public void setState(PipelineState state)          { this.state = state; }
    public void setCurrentTaskId(UUID currentTaskId)   { this.currentTaskId = currentTaskId; }
    public void setUpdatedAt(Instant updatedAt)        { this.updatedAt = updatedAt; }
    public void setError(String error)                 { this.error = error; }
    public void setVersion(long version)               { this.version = version; }
    public void setCancelRequested(boolean v)          { this.cancelRequested = v; }

    public void mergeMetadata(Map<String, ?> patch) {
        if (patch != null) metadata.putAll(patch);
    }
}
