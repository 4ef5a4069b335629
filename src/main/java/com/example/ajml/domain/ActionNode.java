package com.example.ajml.domain;

import java.util.Objects;

/**
 * Node invoking a declared tool with arguments read from state.
 */
public record ActionNode(String id, String toolRef, int line) implements Node {
    public ActionNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(toolRef, "toolRef");
    }
}
