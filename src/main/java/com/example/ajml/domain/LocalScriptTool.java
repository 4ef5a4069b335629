package com.example.ajml.domain;

import java.util.List;
import java.util.Objects;

/**
 * Tool backed by a script under {@code tools/}; parameters pass through untyped.
 */
public record LocalScriptTool(String id, String description, String path, int line) implements Tool {
    public LocalScriptTool {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(path, "path");
    }

    @Override
    public List<String> inputNames() {
        return List.of();
    }
}
