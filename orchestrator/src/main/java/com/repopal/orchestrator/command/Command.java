package com.repopal.orchestrator.command;

import com.repopal.orchestrator.executor.SandboxSpec;

import java.util.Map;

/**
 * Capability set of one runnable command.
 *
 * Commands are registered once at startup in the {@link CommandRegistry};
 * nothing is looked up or loaded by name at runtime beyond that map.
 */
public interface Command {

    /** Identity, documentation and argument contract. */
    CommandManifest manifest();

    /** Network and write permissions enforced by the executor. */
    CommandPolicy policy();

    /**
     * Check an argument set against {@link #manifest()}.
     *
     * @throws CommandException with kind INVALID_ARGUMENTS on missing or unknown arguments
     */
    default void validateArgs(Map<String, String> required, Map<String, String> optional) {
        CommandManifest m = manifest();
        for (String name : m.requiredArgs()) {
            String value = required.get(name);
            if (value == null || value.isBlank()) {
                throw new CommandException(CommandException.Kind.INVALID_ARGUMENTS,
                        "Command '" + m.name() + "' requires argument '" + name + "'");
            }
        }
        for (String name : required.keySet()) {
            if (!m.requiredArgs().contains(name)) {
                throw new CommandException(CommandException.Kind.INVALID_ARGUMENTS,
                        "Command '" + m.name() + "' has no required argument '" + name + "'");
            }
        }
        for (String name : optional.keySet()) {
            if (!m.optionalArgs().contains(name)) {
                throw new CommandException(CommandException.Kind.INVALID_ARGUMENTS,
                        "Command '" + m.name() + "' has no optional argument '" + name + "'");
            }
        }
    }

    /**
     * Build the sandbox invocation for validated arguments.
     *
     * @param environment values of {@link CommandManifest#requiredEnv()} read from the host
     */
    SandboxSpec invocation(Map<String, String> required, Map<String, String> optional,
                           Map<String, String> environment);

    /** One documentation line, e.g. for command selection prompts. */
    default String documentation() {
        CommandManifest m = manifest();
        StringBuilder sb = new StringBuilder(m.name()).append(": ").append(m.description());
        if (!m.requiredArgs().isEmpty()) sb.append(" Required: ").append(String.join(", ", m.requiredArgs())).append('.');
        if (!m.optionalArgs().isEmpty()) sb.append(" Optional: ").append(String.join(", ", m.optionalArgs())).append('.');
        return sb.toString();
    }
}
