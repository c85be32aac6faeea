package com.repopal.orchestrator.capability;

import com.repopal.orchestrator.command.CommandManifest;

import java.util.List;

/**
 * Fills in a selected command's arguments from the request.
 */
public interface ArgumentGenerator {

    /**
     * @throws CapabilityException if the capability could not answer
     */
    GeneratedArguments generateArguments(CommandManifest command, String requestText,
                                         List<String> referencedFiles, List<String> referencedBranches);
}
