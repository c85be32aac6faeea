package com.repopal.orchestrator.executor;

/**
 * Resource bounds applied to every sandbox.
 *
 * @param user non-root "uid:gid" the command runs as
 */
public record SandboxLimits(long memoryBytes, double cpus, int timeoutSeconds, String user) {}
