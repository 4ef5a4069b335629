package com.example.ajml.validation;

import com.example.ajml.domain.Agent;
import com.example.ajml.domain.Edge;
import com.example.ajml.domain.EdgeGroup;
import com.example.ajml.domain.Node;
import com.example.ajml.domain.StateField;
import com.example.ajml.validation.expression.ConditionExpressionValidator;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Graph-level rules of one agent, raised in a fixed order.
 * <p>
 * Per edge: endpoints, default-with-condition, fan-out items field. Then the entry edge, the shape of
 * every edge group, condition expressions, reachability from {@code __START__} and exit coverage.
 * </p>
 */
public final class GraphIntegrityAnalyzer {

    private GraphIntegrityAnalyzer() {
    }

    public static void analyze(Agent agent) {
        String file = agent.sourceFile();
        Set<String> nodeIds = agent.nodes().stream().map(Node::id).collect(Collectors.toSet());

        for (Edge edge : agent.edges()) {
            checkEndpoints(edge, nodeIds, file);
            if (edge.isDefault() && edge.hasCondition()) {
                throw new CompilationException(DiagnosticCode.DEFAULT_WITH_CONDITION,
                        "Edge with `default=\"true\"` must not also contain a `<condition>`.", file, edge.line());
            }
            if (edge.isFanOut()) {
                checkFanOut(agent, edge);
            }
        }

        if (agent.edges().stream().noneMatch(e -> Edge.ENTRY.equals(e.source()))) {
            throw new CompilationException(DiagnosticCode.NO_ENTRY_POINT,
                    "No entry point found. At least one edge must have `source=\"__START__\"`.", file);
        }

        for (EdgeGroup group : agent.edgeGroups()) {
            checkGroupShape(group, file);
        }

        for (Edge edge : agent.edges()) {
            if (edge.hasCondition()) {
                ConditionExpressionValidator.validate(edge.condition(), file, edge.line());
            }
        }

        checkReachability(agent);
        checkCoverage(agent);
    }

    private static void checkEndpoints(Edge edge, Set<String> nodeIds, String file) {
        if (!Edge.ENTRY.equals(edge.source()) && !nodeIds.contains(edge.source())) {
            throw new CompilationException(DiagnosticCode.UNKNOWN_EDGE_SOURCE,
                    "Edge source `" + edge.source() + "` does not match any declared node ID or `__START__`.",
                    file, edge.line());
        }
        if (!Edge.TERMINAL.equals(edge.target()) && !nodeIds.contains(edge.target())) {
            throw new CompilationException(DiagnosticCode.UNKNOWN_EDGE_TARGET,
                    "Edge target `" + edge.target() + "` does not match any declared node ID or `__END__`.",
                    file, edge.line());
        }
    }

    private static void checkFanOut(Agent agent, Edge edge) {
        String file = agent.sourceFile();
        Edge.FanOut fanOut = edge.fanOut();
        if (fanOut.itemsField().isEmpty() || fanOut.itemVar().isEmpty()) {
            throw new CompilationException(DiagnosticCode.FAN_OUT_NOT_LIST,
                    "Map edge from `" + edge.source() + "` needs a `<map_config>` with `items_field` and `item_var`.",
                    file, edge.line());
        }
        Optional<StateField> field = agent.field(fanOut.itemsField());
        if (field.isEmpty() || !field.get().type().isListShaped()) {
            throw new CompilationException(DiagnosticCode.FAN_OUT_NOT_LIST,
                    "Map edge `items_field` `" + fanOut.itemsField() + "` must reference a list-type state field.",
                    file, edge.line());
        }
    }

    private static void checkGroupShape(EdgeGroup group, String file) {
        int line = group.edges().get(0).line();
        Set<EdgeGroup.Kind> kinds = group.kinds();
        boolean multipleFanOuts = kinds.contains(EdgeGroup.Kind.FAN_OUT) && group.edges().size() > 1;
        if (kinds.size() > 1 || multipleFanOuts) {
            throw new CompilationException(DiagnosticCode.MIXED_EDGE_TYPES,
                    "Mixed edge types from source `" + group.source() + "`. A node's outgoing edges must be all "
                            + "unconditional, all conditional, or a single map edge.", file, line);
        }
        if (group.kind() == EdgeGroup.Kind.CONDITIONAL) {
            List<Edge> defaults = group.defaults();
            if (defaults.isEmpty()) {
                throw new CompilationException(DiagnosticCode.MISSING_DEFAULT_EDGE,
                        "Conditional edge group from `" + group.source() + "` is missing a `default=\"true\"` edge.",
                        file, line);
            }
            if (defaults.size() > 1) {
                throw new CompilationException(DiagnosticCode.MULTIPLE_DEFAULT_EDGES,
                        "Multiple `default=\"true\"` edges from source `" + group.source() + "`.",
                        file, defaults.get(1).line());
            }
        }
    }

    private static void checkReachability(Agent agent) {
        Set<String> reachable = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(Edge.ENTRY);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Edge edge : agent.edges()) {
                if (edge.source().equals(current) && !edge.targetsTerminal() && reachable.add(edge.target())) {
                    queue.add(edge.target());
                }
            }
        }
        for (Node node : agent.nodes()) {
            if (!reachable.contains(node.id())) {
                throw new CompilationException(DiagnosticCode.UNREACHABLE_NODE,
                        "Node `" + node.id() + "` is unreachable from `__START__`.", agent.sourceFile(), node.line());
            }
        }
    }

    private static void checkCoverage(Agent agent) {
        Set<String> sources = agent.edges().stream().map(Edge::source).collect(Collectors.toSet());
        for (Node node : agent.nodes()) {
            if (!sources.contains(node.id())) {
                throw new CompilationException(DiagnosticCode.DEAD_END_NODE,
                        "Node `" + node.id() + "` has no outgoing edges.", agent.sourceFile(), node.line());
            }
        }
    }
}
