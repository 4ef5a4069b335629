package com.example.ajml.domain;

import java.util.Objects;

/**
 * Node delegating to a script module under {@code tools/}.
 */
public record ScriptNode(String id, String path, int line) implements Node {
    public ScriptNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(path, "path");
    }
}
