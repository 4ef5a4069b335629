package com.example.ajml.validation;

/**
 * Groups of the diagnostic catalogue. Only {@link #WARNING} diagnostics are non-fatal.
 */
public enum DiagnosticCategory {
    STRUCTURE,
    UNIQUENESS,
    TYPE,
    STATE,
    GRAPH,
    CONFIGURATION,
    EXPRESSION,
    WARNING;

    public boolean isFatal() {
        return this != WARNING;
    }
}
