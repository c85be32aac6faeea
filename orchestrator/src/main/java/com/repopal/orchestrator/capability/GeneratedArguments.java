package com.repopal.orchestrator.capability;

import java.util.Map;

public record GeneratedArguments(Map<String, String> required, Map<String, String> optional) {

    public GeneratedArguments {
        required = required == null ? Map.of() : Map.copyOf(required);
        optional = optional == null ? Map.of() : Map.copyOf(optional);
    }

    public static GeneratedArguments none() {
        return new GeneratedArguments(Map.of(), Map.of());
    }
}
