package com.example.ajml.api;

import com.example.ajml.api.v1.dto.DiagnosticDto;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Standard error response body (4xx/5xx): message, optional field errors and, for rejected
 * compilations, the fatal diagnostic.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String message, List<ValidationError> errors, DiagnosticDto diagnostic) {

    public ErrorResponse(String message) {
        this(message, null, null);
    }

    public static ErrorResponse withErrors(String message, List<ValidationError> errors) {
        return new ErrorResponse(message, errors != null ? List.copyOf(errors) : null, null);
    }

    public static ErrorResponse withDiagnostic(String message, DiagnosticDto diagnostic) {
        return new ErrorResponse(message, null, diagnostic);
    }
}
