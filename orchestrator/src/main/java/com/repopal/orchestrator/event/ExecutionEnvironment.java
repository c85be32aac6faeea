package com.repopal.orchestrator.event;

/**
 * Where a command's changes should land.
 */
public record ExecutionEnvironment(String targetBranch, String baseBranch, boolean production) {}
