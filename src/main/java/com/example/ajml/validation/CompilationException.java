package com.example.ajml.validation;

import lombok.Getter;

/**
 * Thrown on the first fatal diagnostic of a document or project; no output is produced for that unit.
 * <p>
 * Mapped to HTTP 400 with the diagnostic in the body by {@link com.example.ajml.api.GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class CompilationException extends RuntimeException {

    private final Diagnostic diagnostic;

    public CompilationException(Diagnostic diagnostic) {
        super(diagnostic.format());
        if (!diagnostic.isFatal()) {
            throw new IllegalArgumentException("Warning " + diagnostic.code().code() + " cannot abort compilation");
        }
        this.diagnostic = diagnostic;
    }

    public CompilationException(DiagnosticCode code, String message, String file, int line) {
        this(Diagnostic.of(code, message, file, line));
    }

    public CompilationException(DiagnosticCode code, String message, String file) {
        this(code, message, file, 0);
    }

    public DiagnosticCode getCode() {
        return diagnostic.code();
    }
}
