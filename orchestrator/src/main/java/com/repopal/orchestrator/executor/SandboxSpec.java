package com.repopal.orchestrator.executor;

import java.util.List;
import java.util.Map;

/**
 * What to run in the sandbox: image, argv (empty = the image's default command),
 * environment, and whether the container gets a network.
 */
public record SandboxSpec(String image, List<String> argv, Map<String, String> env, boolean network) {

    public SandboxSpec {
        argv = argv == null ? List.of() : List.copyOf(argv);
        env  = env  == null ? Map.of()  : Map.copyOf(env);
    }
}
