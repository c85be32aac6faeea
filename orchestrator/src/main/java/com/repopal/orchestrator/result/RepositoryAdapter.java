package com.repopal.orchestrator.result;

import com.repopal.orchestrator.executor.dto.FileChange;

import java.util.List;

/**
 * Opens change requests on the hosting service of a repository.
 *
 * The same {@code finalCommit} can be offered more than once when a stage is
 * redelivered after a crash; implementations return the existing change request
 * for it instead of opening a second one.
 */
public interface RepositoryAdapter {

    /**
     * @throws RuntimeException on any failure; the caller treats it as transient
     */
    ChangeRequestRef createChangeRequest(String repository, String baseBranch, String targetBranch,
                                         String originalCommit, String finalCommit, List<FileChange> files);
}
