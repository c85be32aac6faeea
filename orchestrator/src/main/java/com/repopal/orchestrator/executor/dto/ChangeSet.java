package com.repopal.orchestrator.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * File changes produced by a command, anchored by before/after commit ids.
 *
 * @param finalCommit null when nothing was committed (read-only command, failure, no changes)
 */
public record ChangeSet(List<FileChange> files, String originalCommit, String finalCommit) {

    public static ChangeSet empty(String originalCommit) {
        return new ChangeSet(List.of(), originalCommit, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return files == null || files.isEmpty();
    }
}
