package com.example.ajml.api.v1.dto;

import com.example.ajml.compiler.ProjectSources;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Set;

/**
 * Request body for compiling or validating a project.
 * <p>
 * {@code project} may be omitted, in which case compilation fails with E003. {@code scripts} lists the
 * script paths present under {@code tools/}.
 * </p>
 */
public record CompileRequest(
        @Valid SourceDocumentDto project,
        @NotNull @NotEmpty @Valid List<SourceDocumentDto> agents,
        List<String> scripts
) {

    public ProjectSources toSources() {
        return new ProjectSources(
                project != null ? project.toSource() : null,
                agents.stream().map(SourceDocumentDto::toSource).toList(),
                scripts != null ? Set.copyOf(scripts) : Set.of()
        );
    }
}
