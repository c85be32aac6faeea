package com.repopal.orchestrator.result;

/**
 * A change request (pull request, merge request) opened by a {@link RepositoryAdapter}.
 */
public record ChangeRequestRef(String id, String url) {}
