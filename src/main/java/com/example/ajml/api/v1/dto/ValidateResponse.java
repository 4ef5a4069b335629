package com.example.ajml.api.v1.dto;

import com.example.ajml.compiler.CompilationResult;
import com.example.ajml.domain.Agent;

import java.util.List;

/**
 * Response for POST /api/v1/validate: validated agent names and warnings.
 */
public record ValidateResponse(String projectName, List<String> agentNames, List<DiagnosticDto> warnings) {

    public static ValidateResponse from(CompilationResult result) {
        return new ValidateResponse(
                result.project().name(),
                result.agents().stream().map(Agent::name).toList(),
                result.warnings().stream().map(DiagnosticDto::from).toList()
        );
    }
}
