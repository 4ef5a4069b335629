package com.example.ajml.compiler;

import java.util.Objects;

/**
 * One AJML document: its file name relative to the project root and its raw text.
 */
public record SourceDocument(String fileName, String content) {
    public SourceDocument {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(content, "content");
    }
}
