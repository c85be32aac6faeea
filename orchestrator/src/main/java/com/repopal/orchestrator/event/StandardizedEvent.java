package com.repopal.orchestrator.event;

import java.util.List;
import java.util.Map;

/**
 * Service-agnostic event produced by an ingress adapter (GitHub comment,
 * Slack message, Linear ticket update...). Immutable; consumed once per pipeline.
 *
 * {@code metadata} may carry {@code notify}: a list of extra service names that
 * should receive the result notification besides the originating service.
 */
public record StandardizedEvent(
        String               service,
        String               requestText,
        List<String>         referencedFiles,
        List<String>         referencedBranches,
        RepositoryContext    repository,
        ExecutionEnvironment environment,
        Map<String, Object>  metadata) {

    public StandardizedEvent {
        referencedFiles    = referencedFiles    == null ? List.of() : List.copyOf(referencedFiles);
        referencedBranches = referencedBranches == null ? List.of() : List.copyOf(referencedBranches);
        metadata           = metadata           == null ? Map.of()  : Map.copyOf(metadata);
    }

    /** Branch the command starts from: the explicit base, else the repository default. */
    public String baseBranch() {
        if (environment != null && environment.baseBranch() != null && !environment.baseBranch().isBlank()) {
            return environment.baseBranch();
        }
        return repository.defaultBranch() != null ? repository.defaultBranch() : "main";
    }
}
