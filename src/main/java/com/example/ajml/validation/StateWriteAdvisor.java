package com.example.ajml.validation;

import com.example.ajml.domain.Agent;
import com.example.ajml.domain.ApiCallTool;
import com.example.ajml.domain.Edge;
import com.example.ajml.domain.EdgeGroup;
import com.example.ajml.domain.LlmNode;
import com.example.ajml.domain.Node;
import com.example.ajml.domain.Reducer;
import com.example.ajml.domain.ScriptNode;
import com.example.ajml.domain.StateField;
import com.example.ajml.domain.SubgraphNode;
import com.example.ajml.domain.Tool;
import com.example.ajml.validation.expression.ConditionExpressionValidator;
import com.example.ajml.validation.expression.ConditionParser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Non-fatal advisories over a validated agent.
 * <p>
 * W301 is conservative: every {@code overwrite} field is reported for every source with more than one
 * plain outgoing edge, whether or not the branches actually write it. W302 reports internal
 * ({@code expose="false"}) fields that nothing in the agent reads or writes; it is skipped when a script
 * node receives the whole state.
 * </p>
 */
public final class StateWriteAdvisor {

    private StateWriteAdvisor() {
    }

    public static List<Diagnostic> advise(Agent agent) {
        List<Diagnostic> warnings = new ArrayList<>(parallelWrites(agent));
        warnings.addAll(unusedFields(agent));
        return warnings;
    }

    static List<Diagnostic> parallelWrites(Agent agent) {
        List<Diagnostic> warnings = new ArrayList<>();
        for (EdgeGroup group : agent.edgeGroups()) {
            if (group.edges().size() < 2 || group.kind() != EdgeGroup.Kind.PLAIN) {
                continue;
            }
            for (StateField field : agent.stateFields()) {
                if (field.reducer() == Reducer.OVERWRITE) {
                    warnings.add(Diagnostic.of(DiagnosticCode.PARALLEL_OVERWRITE,
                            "Parallel branches from `" + group.source() + "` may both write to field `" + field.name()
                                    + "` which uses the `overwrite` reducer. Result may be non-deterministic.",
                            agent.sourceFile(), group.edges().get(0).line()));
                }
            }
        }
        return warnings;
    }

    static List<Diagnostic> unusedFields(Agent agent) {
        if (agent.nodes().stream().anyMatch(n -> n instanceof ScriptNode)) {
            return List.of();
        }
        Set<String> referenced = referencedFields(agent);
        List<Diagnostic> warnings = new ArrayList<>();
        for (StateField field : agent.stateFields()) {
            if (!field.expose() && !referenced.contains(field.name())) {
                warnings.add(Diagnostic.of(DiagnosticCode.UNUSED_FIELD,
                        "Internal state field `" + field.name() + "` is never read or written by any node, tool or edge.",
                        agent.sourceFile(), field.line()));
            }
        }
        return warnings;
    }

    private static Set<String> referencedFields(Agent agent) {
        Set<String> referenced = new HashSet<>();
        for (Tool tool : agent.tools()) {
            referenced.addAll(tool.inputNames());
            if (tool instanceof ApiCallTool api) {
                if (api.body() != null) {
                    api.body().fields().forEach(f -> referenced.add(f.fromState()));
                }
                api.returns().forEach(r -> referenced.add(r.stateField()));
            }
        }
        for (Node node : agent.nodes()) {
            if (node instanceof LlmNode llm) {
                referenced.addAll(ConditionExpressionValidator.validatePromptPlaceholders(
                        llm.systemPrompt(), llm.id(), agent.sourceFile(), llm.line()));
                llm.outputSchema().forEach(f -> referenced.add(f.name()));
            } else if (node instanceof SubgraphNode subgraph) {
                subgraph.inputMap().forEach(m -> referenced.add(m.source()));
                subgraph.outputMap().forEach(m -> referenced.add(m.target()));
            }
        }
        for (Edge edge : agent.edges()) {
            if (edge.hasCondition()) {
                referenced.addAll(ConditionExpressionValidator.stateReads(ConditionParser.parse(edge.condition())));
            }
            if (edge.isFanOut()) {
                referenced.add(edge.fanOut().itemsField());
                referenced.add(edge.fanOut().itemVar());
            }
        }
        return referenced;
    }
}
