package com.example.ajml.markup;

import lombok.Getter;

/**
 * Thrown when a document is not well-formed even after pre-processing.
 */
@Getter
public class MarkupSyntaxException extends RuntimeException {

    private final int line;

    public MarkupSyntaxException(String message, int line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }
}
