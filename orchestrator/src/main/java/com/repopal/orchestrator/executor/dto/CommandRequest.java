package com.repopal.orchestrator.executor.dto;

import java.util.Map;
import java.util.UUID;

/**
 * A resolved command plus its arguments, ready for the executor.
 *
 * {@code pipelineId} names the workspace and tags logs; it is not part of the command itself.
 */
public record CommandRequest(
        UUID                pipelineId,
        String              command,
        Map<String, String> requiredArgs,
        Map<String, String> optionalArgs,
        ExecutionContext    context) {

    public CommandRequest {
        requiredArgs = requiredArgs == null ? Map.of() : Map.copyOf(requiredArgs);
        optionalArgs = optionalArgs == null ? Map.of() : Map.copyOf(optionalArgs);
    }
}
