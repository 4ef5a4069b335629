package com.example.ajml.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Catalogue of state field types: the simple types, the parameterised list/dict types and {@code enum}.
 * <p>
 * Parameterised types delegate reducer rules to their base type, so {@code list[string]} accepts
 * exactly the reducers {@code list} accepts.
 * </p>
 */
public enum FieldType {

    STRING("string", null, "str"),
    INT("int", null, "int"),
    FLOAT("float", null, "float"),
    BOOL("bool", null, "bool"),
    LIST("list", null, "list"),
    DICT("dict", null, "dict"),
    ENUM("enum", null, "str"),
    LIST_OF_STRING("list[string]", LIST, "list[str]"),
    LIST_OF_INT("list[int]", LIST, "list[int]"),
    LIST_OF_FLOAT("list[float]", LIST, "list[float]"),
    LIST_OF_DICT("list[dict]", LIST, "list[dict]"),
    DICT_OF_STRING("dict[string]", DICT, "dict[str, str]"),
    DICT_OF_INT("dict[int]", DICT, "dict[str, int]"),
    DICT_OF_ANY("dict[any]", DICT, "dict");

    private final String token;
    private final FieldType base;
    private final String pythonType;

    FieldType(String token, FieldType base, String pythonType) {
        this.token = token;
        this.base = base;
        this.pythonType = pythonType;
    }

    public String token() {
        return token;
    }

    public String pythonType() {
        return pythonType;
    }

    /** The simple type used for reducer rules; a simple type is its own base. */
    public FieldType baseType() {
        return base != null ? base : this;
    }

    public boolean isListShaped() {
        return baseType() == LIST;
    }

    public Set<Reducer> allowedReducers() {
        EnumSet<Reducer> allowed = EnumSet.of(Reducer.OVERWRITE);
        switch (baseType()) {
            case STRING -> allowed.add(Reducer.CONCAT);
            case INT, FLOAT -> allowed.add(Reducer.ADD);
            case LIST -> allowed.add(Reducer.APPEND);
            case DICT -> allowed.add(Reducer.MERGE);
            default -> {
            }
        }
        return Collections.unmodifiableSet(allowed);
    }

    public static Optional<FieldType> fromToken(String token) {
        return Arrays.stream(values())
                .filter(t -> t.token.equals(token))
                .findFirst();
    }

    /**
     * Maps a loosely typed token (tool parameters, output schema fields) to its Python annotation,
     * falling back to {@code str} for anything outside the catalogue.
     */
    public static String pythonTypeOf(String token) {
        return fromToken(token).map(FieldType::pythonType).orElse("str");
    }
}
