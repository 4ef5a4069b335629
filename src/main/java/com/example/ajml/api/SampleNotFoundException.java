package com.example.ajml.api;

import lombok.Getter;

/**
 * Thrown when no bundled sample project has the requested name.
 * <p>
 * Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 * </p>
 */
@Getter
public class SampleNotFoundException extends RuntimeException {

    private final String sampleName;

    public SampleNotFoundException(String sampleName) {
        super("Sample project not found: " + sampleName);
        this.sampleName = sampleName;
    }
}
