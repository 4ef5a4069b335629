package com.example.ajml.codegen;

/**
 * Line-oriented text buffer for generated Python. Lines end with {@code \n}; indentation is part of
 * the line text.
 */
final class SourceWriter {

    private final StringBuilder text = new StringBuilder();

    SourceWriter line(String line) {
        text.append(line).append('\n');
        return this;
    }

    SourceWriter blank() {
        text.append('\n');
        return this;
    }

    /** Two blank lines, the separator between top-level definitions. */
    SourceWriter gap() {
        return blank().blank();
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
