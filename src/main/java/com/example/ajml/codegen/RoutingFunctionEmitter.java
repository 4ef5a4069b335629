package com.example.ajml.codegen;

import com.example.ajml.domain.Edge;
import com.example.ajml.domain.EdgeGroup;
import com.example.ajml.domain.LlmNode;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Emits routing functions: one per conditional group, one per fan-out group and one per tool-bound
 * LLM node.
 */
final class RoutingFunctionEmitter {

    private RoutingFunctionEmitter() {
    }

    /** {@code route_start} for the entry group, {@code route_<source>} otherwise. */
    static String routeName(String source) {
        return Edge.ENTRY.equals(source) ? "route_start" : "route_" + source;
    }

    static String toolRouteName(String nodeId) {
        return "route_" + nodeId + "_tools";
    }

    static boolean needsRoute(EdgeGroup group) {
        return group.kind() != EdgeGroup.Kind.PLAIN;
    }

    static void emit(EdgeGroup group, SourceWriter out) {
        if (group.kind() == EdgeGroup.Kind.CONDITIONAL) {
            conditional(group, out);
        } else if (group.kind() == EdgeGroup.Kind.FAN_OUT) {
            fanOut(group, out);
        }
    }

    private static void conditional(EdgeGroup group, SourceWriter out) {
        out.line("def " + routeName(group.source()) + "(state: AgentState):");
        for (Edge edge : group.edges()) {
            if (edge.hasCondition()) {
                out.line("    if " + condition(edge.condition()) + ":");
                out.line("        return " + PythonSyntax.target(edge.target()));
            }
        }
        group.defaults().forEach(edge -> out.line("    return " + PythonSyntax.target(edge.target())));
    }

    private static void fanOut(EdgeGroup group, SourceWriter out) {
        Edge edge = group.edges().get(0);
        out.line("def " + routeName(group.source()) + "(state: AgentState):");
        out.line("    items = state.get(" + PythonSyntax.quote(edge.fanOut().itemsField()) + ", [])");
        out.line("    if not items:");
        out.line("        return []");
        out.line("    return [");
        out.line("        Send(" + PythonSyntax.quote(edge.target()) + ", {**state, "
                + PythonSyntax.quote(edge.fanOut().itemVar()) + ": item})");
        out.line("        for item in items");
        out.line("    ]");
    }

    /**
     * Loops back to the companion tool node while the last message carries tool calls, then continues
     * along the node's own outgoing edges.
     */
    static void toolLoop(LlmNode node, Optional<EdgeGroup> outgoing, SourceWriter out) {
        out.line("def " + toolRouteName(node.id()) + "(state: AgentState):");
        out.line("    last_message = state[\"messages\"][-1]");
        out.line("    if hasattr(last_message, \"tool_calls\") and last_message.tool_calls:");
        out.line("        return " + PythonSyntax.quote(NodeFunctionEmitter.toolNodeName(node.id())));
        if (outgoing.isEmpty()) {
            out.line("    return END");
            return;
        }
        EdgeGroup group = outgoing.get();
        if (needsRoute(group)) {
            out.line("    return " + routeName(group.source()) + "(state)");
            return;
        }
        List<Edge> edges = group.edges();
        if (edges.size() == 1) {
            out.line("    return " + PythonSyntax.target(edges.get(0).target()));
        } else {
            out.line("    return [" + edges.stream().map(e -> PythonSyntax.target(e.target()))
                    .collect(Collectors.joining(", ")) + "]");
        }
    }

    private static String condition(String condition) {
        String trimmed = condition.trim();
        return trimmed.contains("\n") ? "(" + trimmed + ")" : trimmed;
    }
}
