package com.example.ajml.domain;

import java.util.List;
import java.util.Objects;

/**
 * LLM call node.
 *
 * @param systemPrompt prompt template with {@code ${field}} placeholders; empty when absent
 * @param toolBindings ids of the tools the model may call
 */
public record LlmNode(
        String id,
        String systemPrompt,
        List<OutputField> outputSchema,
        List<String> toolBindings,
        int line
) implements Node {

    public LlmNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(systemPrompt, "systemPrompt");
        outputSchema = outputSchema != null ? List.copyOf(outputSchema) : List.of();
        toolBindings = toolBindings != null ? List.copyOf(toolBindings) : List.of();
    }

    public boolean hasToolBindings() {
        return !toolBindings.isEmpty();
    }

    public boolean hasOutputSchema() {
        return !outputSchema.isEmpty();
    }

    public record OutputField(String name, String type, String description, List<String> enumValues) {
        public OutputField {
            enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
        }
    }
}
