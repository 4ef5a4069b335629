package com.example.ajml.domain;

import java.util.List;
import java.util.Objects;

/**
 * Node running another agent of the project as a child graph.
 * <p>
 * Input mappings copy parent field {@code source} into child field {@code target}; output mappings copy
 * child field {@code source} back into parent field {@code target}.
 * </p>
 */
public record SubgraphNode(
        String id,
        String agentRef,
        List<FieldMapping> inputMap,
        List<FieldMapping> outputMap,
        int line
) implements Node {

    public SubgraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(agentRef, "agentRef");
        inputMap = inputMap != null ? List.copyOf(inputMap) : List.of();
        outputMap = outputMap != null ? List.copyOf(outputMap) : List.of();
    }

    public record FieldMapping(String source, String target) {
    }
}
