package com.example.ajml.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * HTTP tool. The URL template may contain {@code ${env:VAR}} and {@code ${param}} placeholders.
 *
 * @param body request body, {@code null} when the tool sends none
 */
public record ApiCallTool(
        String id,
        String description,
        String method,
        String url,
        List<Header> headers,
        List<Parameter> parameters,
        RequestBody body,
        RetryPolicy retry,
        double timeoutSeconds,
        List<ResponseMapping> returns,
        int line
) implements Tool {

    public static final double DEFAULT_TIMEOUT_SECONDS = 30.0;

    public ApiCallTool {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        headers = headers != null ? List.copyOf(headers) : List.of();
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        Objects.requireNonNull(retry, "retry");
        returns = returns != null ? List.copyOf(returns) : List.of();
    }

    public List<Parameter> parametersIn(ParameterLocation location) {
        return parameters.stream().filter(p -> p.location() == location).toList();
    }

    /** Body fields filled from a state value that is not already a declared parameter. */
    public List<BodyField> bodyInputs() {
        if (body == null) {
            return List.of();
        }
        Set<String> parameterNames = parameters.stream().map(Parameter::name).collect(Collectors.toSet());
        return body.fields().stream()
                .filter(f -> !f.fromState().isEmpty() && !parameterNames.contains(f.fromState()))
                .toList();
    }

    /** Declared parameters followed by {@link #bodyInputs()}. */
    @Override
    public List<String> inputNames() {
        List<String> names = new ArrayList<>();
        parameters.forEach(p -> names.add(p.name()));
        bodyInputs().forEach(f -> names.add(f.fromState()));
        return names;
    }

    public record Header(String name, String value) {
    }

    /**
     * @param mapTo name used on the wire (path placeholder or query key); falls back to {@code name}
     */
    public record Parameter(String name, String type, String mapTo, ParameterLocation location, String description) {

        public String wireName() {
            return mapTo == null || mapTo.isEmpty() ? name : mapTo;
        }
    }

    public enum ParameterLocation {
        PATH, QUERY, NONE;

        public static ParameterLocation fromToken(String token) {
            if ("path".equals(token)) {
                return PATH;
            }
            if ("query".equals(token)) {
                return QUERY;
            }
            if (token == null || token.isEmpty()) {
                return NONE;
            }
            throw new IllegalArgumentException("Unknown parameter location: " + token);
        }
    }

    public record RequestBody(String format, List<BodyField> fields) {
        public RequestBody {
            fields = fields != null ? List.copyOf(fields) : List.of();
        }
    }

    public record BodyField(String name, String type, String fromState) {
    }

    /**
     * @param apiField response field, dotted for nested objects ({@code main.temp})
     */
    public record ResponseMapping(String apiField, String stateField) {
    }
}
