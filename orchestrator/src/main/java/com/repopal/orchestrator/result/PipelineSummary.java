package com.repopal.orchestrator.result;

import com.repopal.orchestrator.executor.dto.FileChange;

import java.util.List;
import java.util.UUID;

/**
 * Service-agnostic outcome of one pipeline, handed to every {@link ServiceAdapter}.
 *
 * @param changeSummary  e.g. "2 modified, 1 added"; "no changes" when the file list is empty
 * @param changeRequestUrl null when no change request was opened
 * @param error          null on success
 */
public record PipelineSummary(
        UUID             pipelineId,
        String           repository,
        String           command,
        boolean          success,
        List<FileChange> files,
        String           changeSummary,
        String           changeRequestUrl,
        String           error) {

    public PipelineSummary {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
