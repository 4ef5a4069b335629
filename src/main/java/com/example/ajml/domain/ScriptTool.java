package com.example.ajml.domain;

import java.util.List;
import java.util.Objects;

/**
 * Tool backed by a script under {@code tools/} with an explicit, typed parameter list.
 */
public record ScriptTool(String id, String description, String src, List<Parameter> parameters, int line)
        implements Tool {

    public ScriptTool {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(src, "src");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    @Override
    public List<String> inputNames() {
        return parameters.stream().map(Parameter::name).toList();
    }

    public record Parameter(String name, String type, String description) {
    }
}
