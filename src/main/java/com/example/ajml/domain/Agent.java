package com.example.ajml.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One validated agent document.
 *
 * @param llmOverride per-agent LLM settings, {@code null} to use the project defaults
 */
public record Agent(
        String name,
        String version,
        String description,
        LlmConfig llmOverride,
        List<StateField> stateFields,
        List<Tool> tools,
        List<Node> nodes,
        List<Edge> edges,
        String sourceFile
) {

    /** Framework-managed message history channel present in every agent state. */
    public static final String MESSAGES_FIELD = "messages";

    public Agent {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(description, "description");
        stateFields = stateFields != null ? List.copyOf(stateFields) : List.of();
        tools = tools != null ? List.copyOf(tools) : List.of();
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        Objects.requireNonNull(sourceFile, "sourceFile");
    }

    public Optional<StateField> field(String fieldName) {
        return stateFields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
    }

    public Optional<Tool> tool(String toolId) {
        return tools.stream().filter(t -> t.id().equals(toolId)).findFirst();
    }

    public Optional<Node> node(String nodeId) {
        return nodes.stream().filter(n -> n.id().equals(nodeId)).findFirst();
    }

    public List<EdgeGroup> edgeGroups() {
        return EdgeGroup.groupBySource(edges);
    }

    public Optional<EdgeGroup> edgeGroup(String source) {
        return edgeGroups().stream().filter(g -> g.source().equals(source)).findFirst();
    }

    /**
     * The LLM settings that apply to this agent. Provider and model left empty by the override fall back
     * to the project defaults; the retry count always comes from the override when one is declared.
     */
    public LlmConfig effectiveLlm(Project project) {
        LlmConfig defaults = project.llm();
        if (llmOverride == null) {
            return defaults;
        }
        return new LlmConfig(
                llmOverride.provider().isEmpty() ? defaults.provider() : llmOverride.provider(),
                llmOverride.model().isEmpty() ? defaults.model() : llmOverride.model(),
                llmOverride.maxRetries()
        );
    }
}
