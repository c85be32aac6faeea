package com.repopal.orchestrator.command;

import java.util.List;

/**
 * Identity and documentation contract for a command.
 *
 * @param name         unique key in the registry; what command selection returns
 * @param version      semantic version of the command definition
 * @param description  one sentence shown to command selection and in GET /commands
 * @param requiredArgs argument names that must be supplied
 * @param optionalArgs argument names that may be supplied
 * @param requiredEnv  host environment variables passed through to the sandbox
 */
public record CommandManifest(
        String       name,
        String       version,
        String       description,
        List<String> requiredArgs,
        List<String> optionalArgs,
        List<String> requiredEnv) {

    public CommandManifest {
        requiredArgs = requiredArgs == null ? List.of() : List.copyOf(requiredArgs);
        optionalArgs = optionalArgs == null ? List.of() : List.copyOf(optionalArgs);
        requiredEnv  = requiredEnv  == null ? List.of() : List.copyOf(requiredEnv);
    }
}
