package com.repopal.orchestrator.result;

import com.repopal.orchestrator.executor.dto.ChangeSet;
import com.repopal.orchestrator.executor.dto.ExecutionResult;
import com.repopal.orchestrator.executor.dto.FileChange;

import java.util.HashSet;
import java.util.Set;

/**
 * Shape checks on an ExecutionResult before anything is published from it.
 */
public final class ResultValidator {

    private ResultValidator() {}

    /**
     * @throws InvalidResultException describing the first problem found
     */
    public static void validate(ExecutionResult result) {
        if (result == null) {
            throw new InvalidResultException("Execution result is missing");
        }
        if (result.status() == null) {
            throw new InvalidResultException("Execution result has no status");
        }
        ChangeSet changes = result.changeSet();
        if (changes == null) {
            throw new InvalidResultException("Execution result has no change set");
        }
        if (changes.files() == null) {
            throw new InvalidResultException("Change set has no file list");
        }
        if (changes.originalCommit() == null || changes.originalCommit().isBlank()) {
            throw new InvalidResultException("Change set has no original commit");
        }
        Set<String> seen = new HashSet<>();
        for (FileChange file : changes.files()) {
            if (file == null || file.path() == null || file.path().isBlank()) {
                throw new InvalidResultException("Change set contains a file without a path");
            }
            if (file.status() == null) {
                throw new InvalidResultException("File " + file.path() + " has no change status");
            }
            if (!seen.add(file.path())) {
                throw new InvalidResultException("File " + file.path() + " appears twice in the change set");
            }
        }
        if (changes.finalCommit() != null && changes.files().isEmpty()) {
            throw new InvalidResultException("Change set has a final commit but no files");
        }
    }
}
