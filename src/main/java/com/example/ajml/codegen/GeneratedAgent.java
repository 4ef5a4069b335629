package com.example.ajml.codegen;

import java.util.Objects;

/**
 * Generated Python module for one agent.
 *
 * @param moduleName importable module name, {@code compiled_<agent>}; subgraph nodes import it
 */
public record GeneratedAgent(String agentName, String moduleName, String source) {

    public static final String MODULE_PREFIX = "compiled_";

    public GeneratedAgent {
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(moduleName, "moduleName");
        Objects.requireNonNull(source, "source");
    }

    public static String moduleNameOf(String agentName) {
        return MODULE_PREFIX + agentName;
    }

    public String fileName() {
        return moduleName + ".py";
    }
}
