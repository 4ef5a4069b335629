package com.example.ajml.validation;

import com.example.ajml.domain.ActionNode;
import com.example.ajml.domain.Agent;
import com.example.ajml.domain.ApiCallTool;
import com.example.ajml.domain.Edge;
import com.example.ajml.domain.LlmConfig;
import com.example.ajml.domain.LlmNode;
import com.example.ajml.domain.LocalScriptTool;
import com.example.ajml.domain.Node;
import com.example.ajml.domain.RetryPolicy;
import com.example.ajml.domain.ScriptNode;
import com.example.ajml.domain.ScriptTool;
import com.example.ajml.domain.StateField;
import com.example.ajml.domain.SubgraphNode;
import com.example.ajml.domain.Tool;
import com.example.ajml.markup.MarkupElement;
import com.example.ajml.validation.expression.ConditionExpressionValidator;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds one {@link Agent} from its parsed document and enforces the per-document rules.
 * <p>
 * Checks run in a fixed order so the first reported error is reproducible: root and required blocks,
 * LLM override, state fields, tools, nodes, action parameters, then {@link GraphIntegrityAnalyzer}.
 * Warnings from {@link StateWriteAdvisor} are returned only when every fatal check passed.
 * </p>
 */
public final class AgentDocumentValidator {

    private static final Set<String> TOOL_TYPES = Set.of("api_call", "local_script", "script_tool");
    private static final Set<String> NODE_TYPES = Set.of("llm", "action", "script", "subgraph");
    private static final Set<String> HTTP_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");
    private static final Set<String> BACKOFF_STRATEGIES = Set.of("exponential", "fixed");
    private static final Set<String> PARAMETER_LOCATIONS = Set.of("path", "query");
    private static final String DEFAULT_VERSION = "1.0";

    private AgentDocumentValidator() {
    }

    public static AgentValidationResult validate(MarkupElement root, String file, ScriptLocator scripts) {
        if (!"agent".equals(root.tag())) {
            throw new CompilationException(DiagnosticCode.ROOT_MISMATCH,
                    "Root element must be `<agent>` with a `name` attribute.", file, root.line());
        }
        String name = root.attribute("name", "");
        if (name.isEmpty()) {
            throw new CompilationException(DiagnosticCode.ROOT_MISMATCH,
                    "Root element `<agent>` must have a `name` attribute.", file, root.line());
        }
        MarkupElement state = requiredBlock(root, "state", file);
        MarkupElement graph = requiredBlock(root, "graph", file);

        LlmConfig llmOverride = root.child("config")
                .flatMap(config -> config.child("llm"))
                .map(llm -> ProjectDocumentValidator.llmConfig(llm, file))
                .orElse(null);

        List<StateField> fields = stateFields(state, file);
        List<Tool> tools = tools(root, file, scripts);
        List<Node> nodes = nodes(graph, tools, file, scripts);
        checkActionParameters(nodes, tools, fields, file);
        List<Edge> edges = edges(graph, file);

        Agent agent = new Agent(name, root.attribute("version", DEFAULT_VERSION), root.attribute("description", ""),
                llmOverride, fields, tools, nodes, edges, file);
        GraphIntegrityAnalyzer.analyze(agent);
        return new AgentValidationResult(agent, StateWriteAdvisor.advise(agent));
    }

    private static MarkupElement requiredBlock(MarkupElement root, String tag, String file) {
        return root.child(tag).orElseThrow(() -> new CompilationException(DiagnosticCode.MISSING_BLOCK,
                "Required block `<" + tag + ">` is missing.", file, root.line()));
    }

    private static List<StateField> stateFields(MarkupElement state, String file) {
        List<StateField> fields = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (MarkupElement element : state.children("field")) {
            String name = element.attribute("name", "");
            if (Identifiers.isReserved(name)) {
                if (Agent.MESSAGES_FIELD.equals(name)) {
                    throw new CompilationException(DiagnosticCode.MESSAGES_FIELD_DECLARED,
                            "Cannot declare state field `messages`. This field is implicitly managed by the framework.",
                            file, element.line());
                }
                throw reserved(name, "field name", file, element.line());
            }
            if (!names.add(name)) {
                throw new CompilationException(DiagnosticCode.DUPLICATE_FIELD_NAME,
                        "Duplicate state field name `" + name + "`.", file, element.line());
            }
            fields.add(StateFieldValidator.validate(element, file));
        }
        return fields;
    }

    private static List<Tool> tools(MarkupElement root, String file, ScriptLocator scripts) {
        List<Tool> tools = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        List<MarkupElement> elements = root.child("tools").map(t -> t.children("tool")).orElse(List.of());
        for (MarkupElement element : elements) {
            String id = element.attribute("id", "");
            String type = element.attribute("type", "");
            if (Identifiers.isReserved(id)) {
                throw reserved(id, "tool ID", file, element.line());
            }
            if (!ids.add(id)) {
                throw new CompilationException(DiagnosticCode.DUPLICATE_TOOL_ID,
                        "Duplicate tool ID `" + id + "`.", file, element.line());
            }
            if (!TOOL_TYPES.contains(type)) {
                throw new CompilationException(DiagnosticCode.INVALID_TOOL_TYPE,
                        "Invalid tool type `" + type + "`. Must be one of: " + sorted(TOOL_TYPES) + ".",
                        file, element.line());
            }
            String description = element.attribute("description", "");
            switch (type) {
                case "api_call" -> tools.add(apiCallTool(element, id, description, file));
                case "local_script" -> {
                    String path = element.attribute("path", "");
                    scripts.require(path, file, element.line());
                    tools.add(new LocalScriptTool(id, description, path, element.line()));
                }
                default -> {
                    String src = element.attribute("src", "");
                    scripts.require(src, file, element.line());
                    List<ScriptTool.Parameter> parameters = element.child("parameters")
                            .map(p -> p.children("param").stream()
                                    .map(param -> new ScriptTool.Parameter(param.attribute("name", ""),
                                            param.attribute("type", ""), param.attribute("description", "")))
                                    .toList())
                            .orElse(List.of());
                    tools.add(new ScriptTool(id, description, src, parameters, element.line()));
                }
            }
        }
        return tools;
    }

    private static ApiCallTool apiCallTool(MarkupElement element, String id, String description, String file) {
        RetryPolicy retry = new RetryPolicy(
                AttributeValues.intValue(element, "max_retries", 0, file),
                RetryPolicy.Backoff.fromToken(
                        AttributeValues.choice(element, "backoff", "exponential", BACKOFF_STRATEGIES, false, file)),
                AttributeValues.doubleValue(element, "backoff_base", 1.0, file),
                AttributeValues.intList(element, "retry_status_codes", RetryPolicy.DEFAULT_STATUS_CODES, file));
        double timeout = AttributeValues.doubleValue(element, "timeout", ApiCallTool.DEFAULT_TIMEOUT_SECONDS, file);

        MarkupElement endpoint = element.child("endpoint").orElse(null);
        String url = endpoint != null ? endpoint.attribute("url", "") : "";
        String method = endpoint != null
                ? AttributeValues.choice(endpoint, "method", "GET", HTTP_METHODS, true, file)
                : "GET";

        List<ApiCallTool.Header> headers = element.child("headers")
                .map(h -> h.children("header").stream()
                        .map(header -> new ApiCallTool.Header(header.attribute("name", ""), header.attribute("value", "")))
                        .toList())
                .orElse(List.of());
        List<ApiCallTool.Parameter> parameters = element.child("parameters")
                .map(p -> p.children("param").stream()
                        .map(param -> new ApiCallTool.Parameter(
                                param.attribute("name", ""),
                                param.attribute("type", ""),
                                param.attribute("map_to", ""),
                                ApiCallTool.ParameterLocation.fromToken(
                                        AttributeValues.choice(param, "in", "", PARAMETER_LOCATIONS, false, file)),
                                param.attribute("description", "")))
                        .toList())
                .orElse(List.of());
        ApiCallTool.RequestBody body = element.child("body")
                .map(b -> new ApiCallTool.RequestBody(b.attribute("format", "json"), b.children("field").stream()
                        .map(f -> new ApiCallTool.BodyField(f.attribute("name", ""), f.attribute("type", ""),
                                f.attribute("from_state", "")))
                        .toList()))
                .orElse(null);
        List<ApiCallTool.ResponseMapping> returns = element.child("returns")
                .map(r -> r.children("map").stream()
                        .map(m -> new ApiCallTool.ResponseMapping(m.attribute("api_field", ""), m.attribute("state_field", "")))
                        .toList())
                .orElse(List.of());

        return new ApiCallTool(id, description, method, url, headers, parameters, body, retry, timeout, returns,
                element.line());
    }

    private static List<Node> nodes(MarkupElement graph, List<Tool> tools, String file, ScriptLocator scripts) {
        Set<String> toolIds = new HashSet<>();
        tools.forEach(t -> toolIds.add(t.id()));
        List<Node> nodes = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (MarkupElement element : graph.children("node")) {
            String id = element.attribute("id", "");
            String type = element.attribute("type", "");
            int line = element.line();
            if (Identifiers.isReserved(id)) {
                throw reserved(id, "node ID", file, line);
            }
            if (!ids.add(id)) {
                throw new CompilationException(DiagnosticCode.DUPLICATE_NODE_ID, "Duplicate node ID `" + id + "`.",
                        file, line);
            }
            if (!NODE_TYPES.contains(type)) {
                throw new CompilationException(DiagnosticCode.INVALID_NODE_TYPE,
                        "Invalid node type `" + type + "`. Must be one of: " + sorted(NODE_TYPES) + ".", file, line);
            }
            switch (type) {
                case "llm" -> nodes.add(llmNode(element, id, toolIds, file));
                case "action" -> {
                    String toolRef = element.attribute("tool_ref", "");
                    requireTool(toolRef, toolIds, file, line);
                    nodes.add(new ActionNode(id, toolRef, line));
                }
                case "script" -> {
                    String path = element.attribute("path", "");
                    scripts.require(path, file, line);
                    nodes.add(new ScriptNode(id, path, line));
                }
                default -> nodes.add(new SubgraphNode(id, element.attribute("agent_ref", ""),
                        fieldMappings(element, "input_map"), fieldMappings(element, "output_map"), line));
            }
        }
        return nodes;
    }

    private static LlmNode llmNode(MarkupElement element, String id, Set<String> toolIds, String file) {
        List<LlmNode.OutputField> outputSchema = element.child("output_schema")
                .map(s -> s.children("field").stream()
                        .map(f -> new LlmNode.OutputField(f.attribute("name", ""), f.attribute("type", ""),
                                f.attribute("description", ""), AttributeValues.csv(f.attribute("values"))))
                        .toList())
                .orElse(List.of());
        List<String> bindings = new ArrayList<>();
        for (MarkupElement bind : element.children("tool_bind")) {
            String ref = bind.attribute("ref", "");
            requireTool(ref, toolIds, file, bind.line());
            bindings.add(ref);
        }
        String prompt = element.childText("system_prompt");
        ConditionExpressionValidator.validatePromptPlaceholders(prompt, id, file, element.line());
        return new LlmNode(id, prompt, outputSchema, bindings, element.line());
    }

    private static List<SubgraphNode.FieldMapping> fieldMappings(MarkupElement node, String tag) {
        return node.child(tag)
                .map(m -> m.children("map").stream()
                        .map(map -> new SubgraphNode.FieldMapping(map.attribute("source", ""), map.attribute("target", "")))
                        .toList())
                .orElse(List.of());
    }

    private static void requireTool(String ref, Set<String> toolIds, String file, int line) {
        if (!toolIds.contains(ref)) {
            throw new CompilationException(DiagnosticCode.UNKNOWN_TOOL_REF,
                    "Tool reference `" + ref + "` does not match any declared tool ID.", file, line);
        }
    }

    /** Action nodes read each declared tool parameter from the state field of the same name. */
    private static void checkActionParameters(List<Node> nodes, List<Tool> tools, List<StateField> fields,
                                              String file) {
        Set<String> fieldNames = new HashSet<>();
        fields.forEach(f -> fieldNames.add(f.name()));
        Map<String, Tool> toolsById = new LinkedHashMap<>();
        tools.forEach(t -> toolsById.put(t.id(), t));
        for (Node node : nodes) {
            if (!(node instanceof ActionNode action)) {
                continue;
            }
            Tool tool = toolsById.get(action.toolRef());
            for (String parameter : tool.inputNames()) {
                if (!fieldNames.contains(parameter)) {
                    throw new CompilationException(DiagnosticCode.ACTION_PARAM_NOT_IN_STATE,
                            "Action node `" + action.id() + "` passes parameter `" + parameter + "` to tool `"
                                    + tool.id() + "`, but no state field `" + parameter + "` is declared.",
                            file, action.line());
                }
            }
        }
    }

    private static List<Edge> edges(MarkupElement graph, String file) {
        List<Edge> edges = new ArrayList<>();
        for (MarkupElement element : graph.children("edge")) {
            String type = element.attribute("type", "");
            Edge.FanOut fanOut = null;
            if ("map".equals(type)) {
                fanOut = element.child("map_config")
                        .map(c -> new Edge.FanOut(c.attribute("items_field", ""), c.attribute("item_var", "")))
                        .orElse(new Edge.FanOut("", ""));
            } else if (!type.isEmpty()) {
                throw new CompilationException(DiagnosticCode.INVALID_ATTRIBUTE_VALUE,
                        "Edge `type` must be `map` when present, got `" + type + "`.", file, element.line());
            }
            String condition = element.childText("condition");
            edges.add(new Edge(
                    element.attribute("source", ""),
                    element.attribute("target", ""),
                    element.flag("default", false),
                    condition.isEmpty() ? null : condition,
                    fanOut,
                    element.line()));
        }
        return edges;
    }

    private static CompilationException reserved(String name, String role, String file, int line) {
        return new CompilationException(DiagnosticCode.RESERVED_WORD,
                "`" + name + "` is a reserved word and cannot be used as a " + role + ".", file, line);
    }

    private static String sorted(Set<String> values) {
        return String.join(", ", values.stream().sorted().toList());
    }
}
