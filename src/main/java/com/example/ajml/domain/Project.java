package com.example.ajml.domain;

import java.util.List;
import java.util.Objects;

/**
 * Project-wide settings read from {@code _project.ajml}. One per compilation unit.
 */
public record Project(
        String name,
        String languageVersion,
        LlmConfig llm,
        ServerConfig server,
        List<EnvVar> envVars,
        String sourceFile
) {
    public Project {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(languageVersion, "languageVersion");
        Objects.requireNonNull(llm, "llm");
        Objects.requireNonNull(server, "server");
        envVars = envVars != null ? List.copyOf(envVars) : List.of();
        Objects.requireNonNull(sourceFile, "sourceFile");
    }
}
