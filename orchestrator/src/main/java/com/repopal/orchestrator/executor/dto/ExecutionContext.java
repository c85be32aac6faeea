package com.repopal.orchestrator.executor.dto;

/**
 * Where and with which permissions a command runs.
 *
 * @param cloneUrl URL to clone from; {@code https://github.com/<repository>.git} when null
 */
public record ExecutionContext(
        String  repository,
        String  cloneUrl,
        String  baseBranch,
        String  targetBranch,
        boolean canWrite) {}
