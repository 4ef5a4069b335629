package com.example.ajml.domain;

import java.util.List;
import java.util.Objects;

/**
 * One declared field of an agent's state.
 *
 * @param defaultValue default literal, {@code null} when the document declares none
 * @param enumValues   declared values for {@link FieldType#ENUM}, empty otherwise
 */
public record StateField(
        String name,
        FieldType type,
        boolean required,
        String defaultValue,
        Reducer reducer,
        boolean expose,
        List<String> enumValues,
        int line
) {
    public StateField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(reducer, "reducer");
        enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
    }
}
