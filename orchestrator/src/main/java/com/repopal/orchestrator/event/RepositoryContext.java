package com.repopal.orchestrator.event;

/**
 * Repository the event refers to, as resolved by the ingress adapter.
 *
 * @param name          "owner/name" identifier, e.g. "org/repo"
 * @param cloneUrl      URL the executor clones from; derived from {@code name} when null
 */
public record RepositoryContext(
        String  name,
        String  cloneUrl,
        String  defaultBranch,
        String  language,
        boolean canRead,
        boolean canWrite) {}
