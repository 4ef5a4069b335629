package com.example.ajml.api.v1.dto;

import com.example.ajml.compiler.CompilationResult;

import java.util.List;

/**
 * Response for POST /api/v1/compile: generated modules and warnings.
 */
public record CompileResponse(String projectName, List<GeneratedAgentDto> modules, List<DiagnosticDto> warnings) {

    public static CompileResponse from(CompilationResult result) {
        return new CompileResponse(
                result.project().name(),
                result.generated().stream().map(GeneratedAgentDto::from).toList(),
                result.warnings().stream().map(DiagnosticDto::from).toList()
        );
    }
}
