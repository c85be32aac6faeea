package com.repopal.orchestrator.command;

import com.repopal.orchestrator.config.RepoPalProperties.CommandDefinition;
import com.repopal.orchestrator.executor.SandboxSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A command defined in configuration: a container image plus an argv template.
 *
 * <pre>
 *   repopal.commands.format-code:
 *     image: ghcr.io/repopal/formatter:1
 *     argv: ["format", "{path}"]
 *     optional-args: [path]
 * </pre>
 *
 * Arguments are also exported to the sandbox as {@code REPOPAL_ARG_<NAME>}.
 */
public class ContainerCommand implements Command {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_\\-]+)}");

    private final CommandManifest manifest;
    private final CommandPolicy   policy;
    private final String          image;
    private final List<String>    argvTemplate;

    public ContainerCommand(String name, CommandDefinition def) {
        if (def.getImage() == null || def.getImage().isBlank()) {
            throw new IllegalArgumentException("Command '" + name + "' has no image");
        }
        this.manifest = new CommandManifest(name, def.getVersion(), def.getDescription(),
                def.getRequiredArgs(), def.getOptionalArgs(), def.getRequiredEnv());
        this.policy       = new CommandPolicy(def.isNetwork(), def.isWrite());
        this.image        = def.getImage();
        this.argvTemplate = List.copyOf(def.getArgv());
    }

    @Override public CommandManifest manifest() { return manifest; }
    @Override public CommandPolicy   policy()   { return policy; }

    @Override
    public SandboxSpec invocation(Map<String, String> required, Map<String, String> optional,
                                  Map<String, String> environment) {
        Map<String, String> args = new LinkedHashMap<>(optional);
        args.putAll(required);

        List<String> argv = new ArrayList<>();
        for (String part : argvTemplate) {
            String expanded = expand(part, args);
            if (expanded != null) argv.add(expanded);
        }

        Map<String, String> env = new LinkedHashMap<>(environment);
        args.forEach((k, v) -> env.put("REPOPAL_ARG_" + k.toUpperCase(Locale.ROOT).replace('-', '_'), v));
        return new SandboxSpec(image, argv, env, policy.networkAllowed());
    }

    /** Substitute placeholders; null if one of them names an absent argument. */
    static String expand(String part, Map<String, String> args) {
        Matcher m = PLACEHOLDER.matcher(part);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = args.get(m.group(1));
            if (value == null) return null;
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
