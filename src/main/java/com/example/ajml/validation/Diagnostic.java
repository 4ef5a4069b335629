package com.example.ajml.validation;

import java.util.Objects;

/**
 * A compiler diagnostic: code, human message, source file and optional line ({@code null} when unknown).
 */
public record Diagnostic(DiagnosticCode code, String message, String file, Integer line) {

    public Diagnostic {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        file = file != null ? file : "";
        line = line != null && line > 0 ? line : null;
    }

    public static Diagnostic of(DiagnosticCode code, String message, String file, int line) {
        return new Diagnostic(code, message, file, line);
    }

    public boolean isFatal() {
        return code.isFatal();
    }

    /** Console form, e.g. {@code AJMLCompilationError [E101]: Duplicate node ID `a`.} plus location. */
    public String format() {
        StringBuilder detail = new StringBuilder()
                .append(isFatal() ? "AJMLCompilationError" : "AJMLWarning")
                .append(" [").append(code.code()).append("]: ").append(message);
        if (!file.isEmpty()) {
            detail.append("\n  -> File: ").append(file);
            if (line != null) {
                detail.append(", Line: ").append(line);
            }
        }
        return detail.toString();
    }
}
