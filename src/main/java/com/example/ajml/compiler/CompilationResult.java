package com.example.ajml.compiler;

import com.example.ajml.codegen.GeneratedAgent;
import com.example.ajml.domain.Agent;
import com.example.ajml.domain.Project;
import com.example.ajml.validation.Diagnostic;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successful compilation. {@code generated} is empty when only validation ran.
 */
public record CompilationResult(
        Project project,
        List<Agent> agents,
        List<GeneratedAgent> generated,
        List<Diagnostic> warnings
) {
    public CompilationResult {
        Objects.requireNonNull(project, "project");
        agents = List.copyOf(agents);
        generated = generated != null ? List.copyOf(generated) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
