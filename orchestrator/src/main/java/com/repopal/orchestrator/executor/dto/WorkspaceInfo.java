package com.repopal.orchestrator.executor.dto;

/**
 * Where the command ran and how large the workspace was when it finished.
 * The directory itself no longer exists once the result is returned.
 */
public record WorkspaceInfo(String path, long sizeBytes) {}
