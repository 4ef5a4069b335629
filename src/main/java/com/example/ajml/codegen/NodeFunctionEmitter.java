package com.example.ajml.codegen;

import com.example.ajml.domain.ActionNode;
import com.example.ajml.domain.Agent;
import com.example.ajml.domain.FieldType;
import com.example.ajml.domain.LlmNode;
import com.example.ajml.domain.Node;
import com.example.ajml.domain.ScriptNode;
import com.example.ajml.domain.SubgraphNode;
import com.example.ajml.domain.Tool;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Emits the Python function for each node kind. Every node function takes {@code state: AgentState}
 * and returns a partial state update.
 */
final class NodeFunctionEmitter {

    private NodeFunctionEmitter() {
    }

    static void emit(Node node, Agent agent, SourceWriter out) {
        if (node instanceof LlmNode llm) {
            llm(llm, out);
        } else if (node instanceof ActionNode action) {
            action(action, agent, out);
        } else if (node instanceof ScriptNode script) {
            script(script, out);
        } else if (node instanceof SubgraphNode subgraph) {
            subgraph(subgraph, out);
        }
    }

    /** Module alias a subgraph node imports the child's compiled graph under. */
    static String childGraphAlias(String agentRef) {
        return agentRef + "_graph";
    }

    /** Companion {@code ToolNode} of a tool-bound LLM node. */
    static String toolNodeName(String nodeId) {
        return nodeId + "_tools";
    }

    /** True when the structured-output path is taken, which needs the pydantic output model. */
    static boolean usesStructuredOutput(LlmNode node) {
        return node.hasOutputSchema() && !node.hasToolBindings();
    }

    private static void llm(LlmNode node, SourceWriter out) {
        String id = node.id();
        String outputModel = PythonSyntax.pascalCase(id) + "Output";
        if (usesStructuredOutput(node)) {
            out.line("class " + outputModel + "(BaseModel):");
            for (LlmNode.OutputField field : node.outputSchema()) {
                String type = FieldType.pythonTypeOf(field.type());
                if (FieldType.ENUM.token().equals(field.type()) && !field.enumValues().isEmpty()) {
                    type = "Literal[" + field.enumValues().stream().map(PythonSyntax::quote)
                            .collect(Collectors.joining(", ")) + "]";
                }
                String declaration = "    " + field.name() + ": " + type;
                if (!field.description().isEmpty()) {
                    declaration += " = Field(description=" + PythonSyntax.quote(field.description()) + ")";
                }
                out.line(declaration);
            }
            out.gap();
        }

        out.line("def " + id + "(state: AgentState):");
        systemContent(node.systemPrompt(), out);
        out.line("    messages = [SystemMessage(content=system_content)] + state[\"messages\"]");
        out.blank();

        if (usesStructuredOutput(node)) {
            out.line("    structured_llm = llm.with_structured_output(" + outputModel + ")");
            out.line("    result = structured_llm.invoke(messages)");
            out.blank();
            out.line("    updates = {}");
            out.line("    result_dict = result.model_dump()");
            out.line("    for key, value in result_dict.items():");
            out.line("        if key in AgentState.__annotations__:");
            out.line("            updates[key] = value");
            out.blank();
            out.line("    updates[\"messages\"] = [AIMessage(content=str(result_dict))]");
            out.line("    return updates");
        } else if (node.hasToolBindings()) {
            String tools = String.join(", ", node.toolBindings());
            out.line("    bound_llm = llm.bind_tools([" + tools + "])");
            out.line("    response = bound_llm.invoke(messages)");
            out.blank();
            out.line("    return {\"messages\": [response]}");
            out.gap();
            out.line(toolNodeName(id) + " = ToolNode(");
            out.line("    [" + tools + "],");
            out.line("    handle_tool_errors=True");
            out.line(")");
        } else {
            out.line("    response = llm.invoke(messages)");
            out.blank();
            out.line("    return {\"messages\": [response]}");
        }
    }

    private static void systemContent(String prompt, SourceWriter out) {
        if (prompt.isEmpty()) {
            out.line("    system_content = \"\"");
            return;
        }
        List<String> lines = prompt.lines().map(PythonSyntax::stateInterpolated).toList();
        if (lines.size() == 1) {
            out.line("    system_content = f\"" + lines.get(0) + "\"");
            return;
        }
        out.line("    system_content = (");
        for (int i = 0; i < lines.size(); i++) {
            String newline = i < lines.size() - 1 ? "\\n" : "";
            out.line("        f\"" + lines.get(i) + newline + "\"");
        }
        out.line("    )");
    }

    private static void action(ActionNode node, Agent agent, SourceWriter out) {
        List<String> inputs = agent.tool(node.toolRef()).map(Tool::inputNames).orElse(List.of());
        String arguments = inputs.stream()
                .map(name -> PythonSyntax.quote(name) + ": state.get(" + PythonSyntax.quote(name) + ")")
                .collect(Collectors.joining(", "));
        out.line("def " + node.id() + "(state: AgentState):");
        out.line("    result = " + node.toolRef() + ".invoke({" + arguments + "})");
        filterToState(out);
    }

    private static void script(ScriptNode node, SourceWriter out) {
        String module = ToolWrapperEmitter.moduleVariable(node.id());
        out.line("# Script node: " + node.id() + " (" + node.path() + ")");
        out.line(module + " = importlib.import_module("
                + PythonSyntax.quote("tools." + PythonSyntax.moduleName(node.path())) + ")");
        out.gap();
        out.line("def " + node.id() + "(state: AgentState):");
        out.line("    result = " + module + ".run(dict(state))");
        filterToState(out);
    }

    private static void subgraph(SubgraphNode node, SourceWriter out) {
        out.line("def " + node.id() + "(state: AgentState):");
        out.line("    child_input = {");
        out.line("        \"messages\": state[\"messages\"],");
        for (SubgraphNode.FieldMapping mapping : node.inputMap()) {
            out.line("        " + PythonSyntax.quote(mapping.target()) + ": state.get("
                    + PythonSyntax.quote(mapping.source()) + "),");
        }
        out.line("    }");
        out.line("    child_result = " + childGraphAlias(node.agentRef()) + ".invoke(child_input)");
        out.blank();
        out.line("    updates = {}");
        for (SubgraphNode.FieldMapping mapping : node.outputMap()) {
            out.line("    updates[" + PythonSyntax.quote(mapping.target()) + "] = child_result.get("
                    + PythonSyntax.quote(mapping.source()) + ")");
        }
        out.line("    return updates");
    }

    private static void filterToState(SourceWriter out) {
        out.line("    # Filter to known state fields only");
        out.line("    updates = {}");
        out.line("    for key, value in result.items():");
        out.line("        if key in AgentState.__annotations__:");
        out.line("            updates[key] = value");
        out.line("    return updates");
    }
}
