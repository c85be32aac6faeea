package com.repopal.orchestrator.command;

import com.repopal.orchestrator.config.RepoPalProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Immutable name → {@link Command} map, assembled once at startup.
 *
 * Sources, in order: every {@code Command} bean, then every entry under
 * {@code repopal.commands}. A name defined twice is a startup error.
 */
@Component
public class CommandRegistry {

    private static final Logger log = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, Command> commands;
    private final Function<String, String> environment;

    @Autowired
    public CommandRegistry(List<Command> commandBeans, RepoPalProperties properties) {
        this(commandBeans, properties, System::getenv);
    }

    CommandRegistry(List<Command> commandBeans, RepoPalProperties properties,
                    Function<String, String> environment) {
        Map<String, Command> all = new LinkedHashMap<>();
        for (Command command : commandBeans) {
            register(all, command);
        }
        properties.getCommands().forEach((name, def) -> register(all, new ContainerCommand(name, def)));
        this.commands    = Map.copyOf(all);
        this.environment = environment;
    }

    private static void register(Map<String, Command> all, Command command) {
        String name = command.manifest().name();
        if (all.putIfAbsent(name, command) != null) {
            throw new IllegalStateException("Command '" + name + "' is defined more than once");
        }
        log.info("Registered command '{}' v{} (network={}, write={})",
                name, command.manifest().version(),
                command.policy().networkAllowed(), command.policy().writeAllowed());
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Command get(String name) {
        Command command = name == null ? null : commands.get(name);
        if (command == null) {
            throw new UnknownCommandException(name);
        }
        return command;
    }

    public boolean contains(String name) {
        return name != null && commands.containsKey(name);
    }

    /** All registered command names (sorted). */
    public List<String> names() {
        return commands.keySet().stream().sorted().toList();
    }

    public List<CommandManifest> manifests() {
        return names().stream().map(n -> commands.get(n).manifest()).toList();
    }

    /**
     * Read the host values of a command's required environment variables.
     *
     * @throws CommandException with kind MISSING_ENVIRONMENT if one is unset
     */
    public Map<String, String> resolveEnvironment(Command command) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String var : command.manifest().requiredEnv()) {
            String value = environment.apply(var);
            if (value == null || value.isBlank()) {
                throw new CommandException(CommandException.Kind.MISSING_ENVIRONMENT,
                        "Command '" + command.manifest().name() + "' needs environment variable " + var);
            }
            values.put(var, value);
        }
        return values;
    }

    /** The AVAILABLE COMMANDS block given to command selection. */
    public String buildDocumentation() {
        StringBuilder sb = new StringBuilder("AVAILABLE COMMANDS:\n");
        names().forEach(n -> sb.append("  - ").append(commands.get(n).documentation()).append('\n'));
        return sb.toString();
    }
}
