package com.example.ajml.validation;

import com.example.ajml.domain.Agent;
import com.example.ajml.domain.Edge;

import java.util.Set;

/**
 * Names authors may not declare as field, tool or node ids.
 */
public final class Identifiers {

    public static final Set<String> RESERVED_WORDS = Set.of(
            Edge.ENTRY, Edge.TERMINAL, Agent.MESSAGES_FIELD, "__root__", "__config__", "__state__");

    private Identifiers() {
    }

    public static boolean isReserved(String name) {
        return RESERVED_WORDS.contains(name);
    }
}
