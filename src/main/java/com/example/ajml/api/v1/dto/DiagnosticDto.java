package com.example.ajml.api.v1.dto;

import com.example.ajml.validation.Diagnostic;

/**
 * A diagnostic as returned by the API. {@code summary} is the catalogue title of the code;
 * {@code line} is {@code null} when unknown.
 */
public record DiagnosticDto(
        String code,
        String category,
        String severity,
        String summary,
        String message,
        String file,
        Integer line
) {

    public static DiagnosticDto from(Diagnostic diagnostic) {
        return new DiagnosticDto(
                diagnostic.code().code(),
                diagnostic.code().category().name(),
                diagnostic.isFatal() ? "ERROR" : "WARNING",
                diagnostic.code().summary(),
                diagnostic.message(),
                diagnostic.file(),
                diagnostic.line()
        );
    }
}
