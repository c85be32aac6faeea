package com.repopal.orchestrator.store;

import java.util.UUID;

/**
 * A compare-and-set lost against a concurrent writer.
 *
 * Not a user-visible error: the caller re-reads the pipeline and decides
 * whether its work has become a stale duplicate.
 */
public class VersionConflictException extends RuntimeException {

    private final UUID pipelineId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(UUID pipelineId, long expectedVersion, long actualVersion) {
        super("Pipeline %s is at version %d, expected %d".formatted(pipelineId, actualVersion, expectedVersion));
        this.pipelineId      = pipelineId;
        this.expectedVersion = expectedVersion;
        this.actualVersion   = actualVersion;
    }

    public UUID getPipelineId()      { return pipelineId; }
    public long getExpectedVersion() { return expectedVersion; }
    public long getActualVersion()   { return actualVersion; }
}
