package com.example.ajml.api.v1.dto;

import com.example.ajml.compiler.SourceDocument;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One submitted AJML document.
 */
public record SourceDocumentDto(@NotBlank String fileName, @NotNull String content) {

    public SourceDocument toSource() {
        return new SourceDocument(fileName, content);
    }
}
