package com.repopal.orchestrator.api.dto;

import com.repopal.orchestrator.command.Command;

import java.util.List;

/** One entry of GET /commands. */
public record CommandResponse(
        String       name,
        String       version,
        String       description,
        List<String> requiredArgs,
        List<String> optionalArgs,
        boolean      networkAllowed,
        boolean      writeAllowed,
        String       documentation
) {
    public static CommandResponse from(Command c) {
        return new CommandResponse(
                c.manifest().name(),
                c.manifest().version(),
                c.manifest().description(),
                c.manifest().requiredArgs(),
                c.manifest().optionalArgs(),
                c.policy().networkAllowed(),
                c.policy().writeAllowed(),
                c.documentation()
        );
    }
}
