package com.example.ajml.validation;

import com.example.ajml.domain.Agent;

import java.util.List;
import java.util.Objects;

/**
 * A validated agent plus the non-fatal diagnostics raised while validating it.
 */
public record AgentValidationResult(Agent agent, List<Diagnostic> warnings) {
    public AgentValidationResult {
        Objects.requireNonNull(agent, "agent");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
