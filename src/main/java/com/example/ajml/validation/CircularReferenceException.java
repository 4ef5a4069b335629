package com.example.ajml.validation;

import lombok.Getter;

import java.util.List;

/**
 * Subgraph references form a cycle; {@link #getCyclePath()} starts and ends with the same agent.
 */
@Getter
public class CircularReferenceException extends CompilationException {

    private final List<String> cyclePath;

    public CircularReferenceException(List<String> cyclePath, String file) {
        super(DiagnosticCode.CIRCULAR_SUBGRAPH,
                "Circular subgraph dependency detected: " + String.join(" -> ", cyclePath) + ".",
                file);
        this.cyclePath = List.copyOf(cyclePath);
    }
}
