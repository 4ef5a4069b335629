package com.example.ajml.codegen;

import com.example.ajml.domain.ApiCallTool;
import com.example.ajml.domain.FieldType;
import com.example.ajml.domain.LocalScriptTool;
import com.example.ajml.domain.RetryPolicy;
import com.example.ajml.domain.ScriptTool;
import com.example.ajml.domain.Tool;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Emits one LangChain {@code @tool} wrapper per declared tool, preceded by its pydantic input model.
 */
final class ToolWrapperEmitter {

    private ToolWrapperEmitter() {
    }

    static void emit(Tool tool, SourceWriter out) {
        if (tool instanceof ApiCallTool api) {
            apiCall(api, out);
        } else if (tool instanceof LocalScriptTool local) {
            localScript(local, out);
        } else if (tool instanceof ScriptTool script) {
            scriptTool(script, out);
        }
    }

    /** Name of the module-level variable holding an imported script module. */
    static String moduleVariable(String id) {
        return "_" + id + "_module";
    }

    private static void apiCall(ApiCallTool tool, SourceWriter out) {
        String id = tool.id();
        List<Argument> arguments = new ArrayList<>();
        tool.parameters().forEach(p -> arguments.add(new Argument(p.name(), p.type(), p.description())));
        tool.bodyInputs().forEach(f -> arguments.add(new Argument(f.fromState(), f.type(), "")));

        inputModel(id, arguments, out);

        RetryPolicy retry = tool.retry();
        out.line("@tool(" + PythonSyntax.quote(id) + ", args_schema=" + inputModelName(id) + ")");
        if (retry.enabled()) {
            String base = PythonSyntax.floatLiteral(retry.baseDelaySeconds());
            out.line("@retry(");
            out.line("    stop=stop_after_attempt(" + (retry.maxRetries() + 1) + "),");
            if (retry.backoff() == RetryPolicy.Backoff.EXPONENTIAL) {
                out.line("    wait=wait_exponential(multiplier=" + base + ", min=" + base + ", max="
                        + PythonSyntax.floatLiteral(RetryPolicy.MAX_BACKOFF_SECONDS) + "),");
            } else {
                out.line("    wait=wait_fixed(" + base + "),");
            }
            out.line("    retry=" + retryPredicate(retry) + ",");
            out.line(")");
        }
        out.line("def " + id + "(" + signature(arguments) + ") -> dict:");
        docstring(tool.description(), "Calls the " + id + " API.", out);

        String url = PythonSyntax.envInterpolated(tool.url());
        for (ApiCallTool.Parameter parameter : tool.parametersIn(ApiCallTool.ParameterLocation.PATH)) {
            url = url.replace("${" + parameter.wireName() + "}", "{" + parameter.name() + "}");
        }
        out.line("    url = f\"" + url + "\"");

        List<String> callArguments = new ArrayList<>();
        callArguments.add("url");
        if (!tool.headers().isEmpty()) {
            out.line("    headers = {");
            for (ApiCallTool.Header header : tool.headers()) {
                out.line("        " + PythonSyntax.quote(header.name()) + ": f\""
                        + PythonSyntax.envInterpolated(header.value()) + "\",");
            }
            out.line("    }");
            callArguments.add("headers=headers");
        }
        List<ApiCallTool.Parameter> query = tool.parametersIn(ApiCallTool.ParameterLocation.QUERY);
        if (!query.isEmpty()) {
            out.line("    params = {");
            query.forEach(p -> out.line("        " + PythonSyntax.quote(p.wireName()) + ": " + p.name() + ","));
            out.line("    }");
            callArguments.add("params=params");
        }
        if (tool.body() != null && !tool.body().fields().isEmpty()) {
            out.line("    json_body = {");
            for (ApiCallTool.BodyField field : tool.body().fields()) {
                String value = field.fromState().isEmpty() ? "None" : field.fromState();
                out.line("        " + PythonSyntax.quote(field.name()) + ": " + value + ",");
            }
            out.line("    }");
            callArguments.add("json=json_body");
        }
        callArguments.add("timeout=" + PythonSyntax.floatLiteral(tool.timeoutSeconds()));
        out.line("    response = httpx." + tool.method().toLowerCase(Locale.ROOT) + "("
                + String.join(", ", callArguments) + ")");
        out.blank();

        out.line("    # Non-2xx codes raise; only the configured ones are retried");
        out.line("    response.raise_for_status()");
        out.blank();
        out.line("    content_type = response.headers.get(\"content-type\", \"\")");
        out.line("    if \"application/json\" not in content_type:");
        out.line("        raise ToolExecutionError(");
        out.line("            f\"Expected JSON response, got {content_type}: \"");
        out.line("            f\"{response.text[:200]}\"");
        out.line("        )");
        out.blank();
        out.line("    data = response.json()");
        out.blank();

        if (tool.returns().isEmpty()) {
            out.line("    return data");
            return;
        }
        out.line("    # Map response fields to state");
        for (ApiCallTool.ResponseMapping mapping : tool.returns()) {
            out.line("    " + mapping.stateField() + " = " + responseAccess(mapping.apiField()));
            out.line("    if " + mapping.stateField() + " is None:");
            out.line("        logger.warning(\"" + PythonSyntax.escape(id) + ": API field '"
                    + PythonSyntax.escape(mapping.apiField()) + "' not found in response\")");
        }
        out.blank();
        out.line("    return {" + tool.returns().stream()
                .map(m -> PythonSyntax.quote(m.stateField()) + ": " + m.stateField())
                .collect(Collectors.joining(", ")) + "}");
    }

    /**
     * Timeouts are always retried; HTTP errors only when their status is in the configured set.
     */
    static String retryPredicate(RetryPolicy retry) {
        if (retry.retryStatusCodes().isEmpty()) {
            return "retry_if_exception_type(httpx.TimeoutException)";
        }
        String codes = retry.retryStatusCodes().stream().map(String::valueOf).collect(Collectors.joining(", "));
        if (retry.retryStatusCodes().size() == 1) {
            codes += ",";
        }
        return "retry_if_exception(lambda e: isinstance(e, httpx.TimeoutException) or ("
                + "isinstance(e, httpx.HTTPStatusError) and e.response.status_code in (" + codes + ")))";
    }

    /** {@code main.temp} becomes {@code data.get("main", {}).get("temp")}. */
    static String responseAccess(String apiField) {
        String[] parts = apiField.split("\\.");
        StringBuilder access = new StringBuilder("data");
        for (int i = 0; i < parts.length - 1; i++) {
            access.append(".get(").append(PythonSyntax.quote(parts[i])).append(", {})");
        }
        access.append(".get(").append(PythonSyntax.quote(parts[parts.length - 1])).append(")");
        return access.toString();
    }

    private static void localScript(LocalScriptTool tool, SourceWriter out) {
        String id = tool.id();
        out.line("# Tool: " + id + " (local_script: " + tool.path() + ")");
        out.line(moduleVariable(id) + " = importlib.import_module("
                + PythonSyntax.quote("tools." + PythonSyntax.moduleName(tool.path())) + ")");
        out.gap();
        out.line("class " + inputModelName(id) + "(BaseModel):");
        out.line("    class Config:");
        out.line("        extra = \"allow\"");
        out.gap();
        out.line("@tool(" + PythonSyntax.quote(id) + ", args_schema=" + inputModelName(id) + ")");
        out.line("def " + id + "(**kwargs) -> dict:");
        docstring(tool.description(), "Runs " + tool.path() + ".", out);
        out.line("    return " + moduleVariable(id) + ".run(**kwargs)");
    }

    private static void scriptTool(ScriptTool tool, SourceWriter out) {
        String id = tool.id();
        List<Argument> arguments = tool.parameters().stream()
                .map(p -> new Argument(p.name(), p.type(), p.description()))
                .toList();
        out.line("# Tool: " + id + " (script_tool: " + tool.src() + ")");
        out.line(moduleVariable(id) + " = importlib.import_module("
                + PythonSyntax.quote("tools." + PythonSyntax.moduleName(tool.src())) + ")");
        out.gap();
        inputModel(id, arguments, out);
        out.line("@tool(" + PythonSyntax.quote(id) + ", args_schema=" + inputModelName(id) + ")");
        out.line("def " + id + "(" + signature(arguments) + ") -> dict:");
        docstring(tool.description(), "Runs " + tool.src() + ".", out);
        out.line("    return " + moduleVariable(id) + ".run("
                + arguments.stream().map(a -> a.name() + "=" + a.name()).collect(Collectors.joining(", ")) + ")");
    }

    private static void inputModel(String id, List<Argument> arguments, SourceWriter out) {
        out.line("class " + inputModelName(id) + "(BaseModel):");
        if (arguments.isEmpty()) {
            out.line("    pass");
        }
        for (Argument argument : arguments) {
            String declaration = "    " + argument.name() + ": " + FieldType.pythonTypeOf(argument.type());
            if (!argument.description().isEmpty()) {
                declaration += " = Field(description=" + PythonSyntax.quote(argument.description()) + ")";
            }
            out.line(declaration);
        }
        out.gap();
    }

    private static String inputModelName(String id) {
        return PythonSyntax.pascalCase(id) + "Input";
    }

    private static String signature(List<Argument> arguments) {
        return arguments.stream()
                .map(a -> a.name() + ": " + FieldType.pythonTypeOf(a.type()))
                .collect(Collectors.joining(", "));
    }

    private static void docstring(String description, String fallback, SourceWriter out) {
        String text = description.isEmpty() ? fallback : description;
        out.line("    \"\"\"" + text.replace("\\", "\\\\").replace("\"\"\"", "\\\"\\\"\\\"") + "\"\"\"");
    }

    private record Argument(String name, String type, String description) {
        Argument {
            description = description != null ? description : "";
        }
    }
}
