package com.example.ajml.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Merge policy applied when several partial updates target the same state field.
 */
public enum Reducer {

    /** Last write wins. */
    OVERWRITE("overwrite"),
    APPEND("append"),
    ADD("add"),
    /** Shallow key union; the right side wins on conflicting keys. */
    MERGE("merge"),
    CONCAT("concat");

    private final String token;

    Reducer(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static Optional<Reducer> fromToken(String token) {
        return Arrays.stream(values())
                .filter(r -> r.token.equals(token))
                .findFirst();
    }
}
