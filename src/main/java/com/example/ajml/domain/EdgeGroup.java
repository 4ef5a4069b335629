package com.example.ajml.domain;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The outgoing edges of one source, in declaration order.
 */
public record EdgeGroup(String source, List<Edge> edges) {

    public enum Kind {
        PLAIN, CONDITIONAL, FAN_OUT
    }

    public EdgeGroup {
        Objects.requireNonNull(source, "source");
        edges = List.copyOf(edges);
    }

    /** Groups edges by source, ordered by each source's first appearance. */
    public static List<EdgeGroup> groupBySource(List<Edge> edges) {
        Map<String, List<Edge>> bySource = new LinkedHashMap<>();
        for (Edge edge : edges) {
            bySource.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
        }
        return bySource.entrySet().stream()
                .map(e -> new EdgeGroup(e.getKey(), e.getValue()))
                .toList();
    }

    /**
     * Every classification present in the group; a valid group has exactly one. A fan-out edge that
     * also carries a condition or default counts as both.
     */
    public Set<Kind> kinds() {
        EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        for (Edge edge : edges) {
            if (edge.isFanOut()) {
                kinds.add(Kind.FAN_OUT);
            }
            if (edge.isConditional()) {
                kinds.add(Kind.CONDITIONAL);
            }
            if (!edge.isFanOut() && !edge.isConditional()) {
                kinds.add(Kind.PLAIN);
            }
        }
        return kinds;
    }

    /** Classification of a validated, homogeneous group. */
    public Kind kind() {
        Set<Kind> kinds = kinds();
        if (kinds.contains(Kind.FAN_OUT)) {
            return Kind.FAN_OUT;
        }
        if (kinds.contains(Kind.CONDITIONAL)) {
            return Kind.CONDITIONAL;
        }
        return Kind.PLAIN;
    }

    public List<Edge> defaults() {
        return edges.stream().filter(Edge::isDefault).toList();
    }

    public boolean isEntry() {
        return Edge.ENTRY.equals(source);
    }
}
