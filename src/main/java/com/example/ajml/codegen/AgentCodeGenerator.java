package com.example.ajml.codegen;

import com.example.ajml.domain.Agent;
import com.example.ajml.domain.ApiCallTool;
import com.example.ajml.domain.Edge;
import com.example.ajml.domain.EdgeGroup;
import com.example.ajml.domain.FieldType;
import com.example.ajml.domain.LlmConfig;
import com.example.ajml.domain.LlmNode;
import com.example.ajml.domain.LlmProvider;
import com.example.ajml.domain.LocalScriptTool;
import com.example.ajml.domain.Node;
import com.example.ajml.domain.Project;
import com.example.ajml.domain.Reducer;
import com.example.ajml.domain.RetryPolicy;
import com.example.ajml.domain.ScriptNode;
import com.example.ajml.domain.ScriptTool;
import com.example.ajml.domain.StateField;
import com.example.ajml.domain.SubgraphNode;
import com.example.ajml.domain.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Translates one validated {@link Agent} into a Python module targeting the LangGraph runtime.
 * <p>
 * Output layout: imports, optional logger and {@code ToolExecutionError}, the {@code AgentState}
 * TypedDict, the chat model, tool wrappers, node functions, routing functions and graph assembly.
 * The same agent and project always produce the same text.
 * </p>
 */
public class AgentCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(AgentCodeGenerator.class);

    public GeneratedAgent generate(Agent agent, Project project) {
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(project, "project");
        LlmConfig llm = agent.effectiveLlm(project);
        log.debug("Generating agent={} provider={} nodes={} tools={}", agent.name(), llm.provider(),
                agent.nodes().size(), agent.tools().size());

        SourceWriter out = new SourceWriter();
        imports(agent, llm, out);
        if (hasApiTools(agent)) {
            out.blank();
            out.line("logger = logging.getLogger(__name__)");
        }
        out.gap();
        if (hasApiTools(agent)) {
            out.line("class ToolExecutionError(Exception):");
            out.line("    pass");
            out.gap();
        }
        stateDeclaration(agent, out);
        out.gap();
        chatModel(llm, out);
        out.gap();

        for (Tool tool : agent.tools()) {
            ToolWrapperEmitter.emit(tool, out);
            out.gap();
        }
        for (Node node : agent.nodes()) {
            NodeFunctionEmitter.emit(node, agent, out);
            out.gap();
        }
        for (EdgeGroup group : agent.edgeGroups()) {
            if (RoutingFunctionEmitter.needsRoute(group)) {
                RoutingFunctionEmitter.emit(group, out);
                out.gap();
            }
        }
        for (LlmNode node : toolBoundNodes(agent)) {
            RoutingFunctionEmitter.toolLoop(node, agent.edgeGroup(node.id()), out);
            out.gap();
        }
        assembly(agent, out);

        return new GeneratedAgent(agent.name(), GeneratedAgent.moduleNameOf(agent.name()), out.toString());
    }

    private void imports(Agent agent, LlmConfig llm, SourceWriter out) {
        Set<String> standard = new TreeSet<>();
        if (agent.stateFields().stream().anyMatch(f -> f.reducer() != Reducer.OVERWRITE && f.reducer() != Reducer.MERGE)) {
            standard.add("import operator");
        }
        if (hasApiTools(agent)) {
            standard.add("import logging");
            standard.add("import os");
        }
        boolean loadsScripts = agent.tools().stream().anyMatch(t -> t instanceof LocalScriptTool || t instanceof ScriptTool)
                || agent.nodes().stream().anyMatch(n -> n instanceof ScriptNode);
        if (loadsScripts) {
            standard.add("import importlib");
        }
        standard.forEach(out::line);
        out.line(needsLiteral(agent) ? "from typing import Annotated, Literal, TypedDict" : "from typing import Annotated, TypedDict");
        out.blank();

        if (hasApiTools(agent)) {
            out.line("import httpx");
        }
        Set<String> external = new TreeSet<>();
        external.add("from langchain_core.messages import AIMessage, SystemMessage");
        external.add("from langgraph.graph import END, START, StateGraph");
        external.add("from langgraph.graph.message import add_messages");
        if (!agent.tools().isEmpty()) {
            external.add("from langchain_core.tools import tool");
        }
        if (!agent.tools().isEmpty() || structuredNodes(agent)) {
            external.add("from pydantic import BaseModel, Field");
        }
        if (!toolBoundNodes(agent).isEmpty()) {
            external.add("from langgraph.prebuilt import ToolNode");
        }
        if (agent.edges().stream().anyMatch(Edge::isFanOut)) {
            external.add("from langgraph.constants import Send");
        }
        tenacityImport(agent).ifPresent(external::add);
        LlmProvider.fromToken(llm.provider())
                .ifPresent(p -> external.add("from " + p.pythonPackage() + " import " + p.chatClass()));
        external.forEach(out::line);

        Set<String> children = new TreeSet<>();
        for (Node node : agent.nodes()) {
            if (node instanceof SubgraphNode subgraph) {
                children.add("from " + GeneratedAgent.moduleNameOf(subgraph.agentRef()) + " import graph as "
                        + NodeFunctionEmitter.childGraphAlias(subgraph.agentRef()));
            }
        }
        if (!children.isEmpty()) {
            out.blank();
            children.forEach(out::line);
        }
    }

    private Optional<String> tenacityImport(Agent agent) {
        Set<String> names = new TreeSet<>();
        for (Tool tool : agent.tools()) {
            if (tool instanceof ApiCallTool api && api.retry().enabled()) {
                names.add("retry");
                names.add("stop_after_attempt");
                names.add(api.retry().retryStatusCodes().isEmpty() ? "retry_if_exception_type" : "retry_if_exception");
                names.add(api.retry().backoff() == RetryPolicy.Backoff.EXPONENTIAL ? "wait_exponential" : "wait_fixed");
            }
        }
        return names.isEmpty() ? Optional.empty() : Optional.of("from tenacity import " + String.join(", ", names));
    }

    private void stateDeclaration(Agent agent, SourceWriter out) {
        out.line("class AgentState(TypedDict):");
        out.line("    " + Agent.MESSAGES_FIELD + ": Annotated[list, add_messages]");
        for (StateField field : agent.stateFields()) {
            String type = field.type().pythonType();
            String annotation = switch (field.reducer()) {
                case OVERWRITE -> type;
                case APPEND, ADD -> "Annotated[" + type + ", operator.add]";
                case CONCAT -> "Annotated[" + type + ", operator.concat]";
                case MERGE -> "Annotated[" + type + ", lambda a, b: {**a, **b}]";
            };
            out.line("    " + field.name() + ": " + annotation);
        }
    }

    private void chatModel(LlmConfig llm, SourceWriter out) {
        Optional<LlmProvider> provider = LlmProvider.fromToken(llm.provider());
        if (provider.isPresent()) {
            out.line("llm = " + provider.get().chatClass() + "(model=" + PythonSyntax.quote(llm.model())
                    + ", max_retries=" + llm.maxRetries() + ")");
        } else {
            out.line("# No LLM provider configured; assign llm before running the graph");
            out.line("llm = None");
        }
    }

    private void assembly(Agent agent, SourceWriter out) {
        out.line("graph_builder = StateGraph(AgentState)");
        out.blank();
        out.line("# Add all nodes");
        for (Node node : agent.nodes()) {
            out.line("graph_builder.add_node(" + PythonSyntax.quote(node.id()) + ", " + node.id() + ")");
            if (node instanceof LlmNode llm && llm.hasToolBindings()) {
                String companion = NodeFunctionEmitter.toolNodeName(llm.id());
                out.line("graph_builder.add_node(" + PythonSyntax.quote(companion) + ", " + companion + ")");
            }
        }
        out.blank();

        List<String> toolBound = toolBoundNodes(agent).stream().map(LlmNode::id).toList();
        out.line("# Add edges");
        for (EdgeGroup group : agent.edgeGroups()) {
            if (toolBound.contains(group.source())) {
                continue;
            }
            String source = group.isEntry() ? "START" : PythonSyntax.quote(group.source());
            switch (group.kind()) {
                case PLAIN -> group.edges().forEach(edge -> out.line(
                        "graph_builder.add_edge(" + source + ", " + PythonSyntax.target(edge.target()) + ")"));
                case CONDITIONAL -> out.line("graph_builder.add_conditional_edges(" + source + ", "
                        + RoutingFunctionEmitter.routeName(group.source()) + ")");
                case FAN_OUT -> out.line("graph_builder.add_conditional_edges(" + source + ", "
                        + RoutingFunctionEmitter.routeName(group.source()) + ", ["
                        + PythonSyntax.quote(group.edges().get(0).target()) + "])");
            }
        }
        for (String nodeId : toolBound) {
            out.line("graph_builder.add_conditional_edges(" + PythonSyntax.quote(nodeId) + ", "
                    + RoutingFunctionEmitter.toolRouteName(nodeId) + ")");
            out.line("graph_builder.add_edge(" + PythonSyntax.quote(NodeFunctionEmitter.toolNodeName(nodeId)) + ", "
                    + PythonSyntax.quote(nodeId) + ")");
        }
        out.blank();
        out.line("# Compile");
        out.line("graph = graph_builder.compile()");
    }

    private static boolean hasApiTools(Agent agent) {
        return agent.tools().stream().anyMatch(ApiCallTool.class::isInstance);
    }

    private static boolean structuredNodes(Agent agent) {
        return agent.nodes().stream()
                .anyMatch(n -> n instanceof LlmNode llm && NodeFunctionEmitter.usesStructuredOutput(llm));
    }

    private static boolean needsLiteral(Agent agent) {
        return agent.nodes().stream()
                .filter(n -> n instanceof LlmNode llm && NodeFunctionEmitter.usesStructuredOutput(llm))
                .flatMap(n -> ((LlmNode) n).outputSchema().stream())
                .anyMatch(f -> FieldType.ENUM.token().equals(f.type()) && !f.enumValues().isEmpty());
    }

    private static List<LlmNode> toolBoundNodes(Agent agent) {
        List<LlmNode> nodes = new ArrayList<>();
        for (Node node : agent.nodes()) {
            if (node instanceof LlmNode llm && llm.hasToolBindings()) {
                nodes.add(llm);
            }
        }
        return nodes;
    }
}
