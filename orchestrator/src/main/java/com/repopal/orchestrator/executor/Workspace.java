package com.repopal.orchestrator.executor;

import java.nio.file.Path;

/**
 * A uniquely named directory owned by one execution.
 */
public record Workspace(String name, Path dir) {}
