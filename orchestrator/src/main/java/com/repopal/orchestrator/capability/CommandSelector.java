package com.repopal.orchestrator.capability;

import com.repopal.orchestrator.command.CommandManifest;

import java.util.List;

/**
 * Picks which registered command a request asks for.
 *
 * Pure from the pipeline's point of view: its only effect is its return value.
 */
public interface CommandSelector {

    /**
     * @return the name of one of {@code availableCommands}, or whatever the capability
     *         produced (the caller validates it against the registry)
     * @throws CapabilityException if the capability could not answer
     */
    String selectCommand(String requestText, List<CommandManifest> availableCommands);
}
