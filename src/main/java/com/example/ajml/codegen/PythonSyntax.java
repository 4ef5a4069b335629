package com.example.ajml.codegen;

import com.example.ajml.domain.Edge;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Helpers for rendering identifiers, literals and f-string fragments in generated Python.
 */
final class PythonSyntax {

    private static final Pattern ENV_PLACEHOLDER = Pattern.compile("\\$\\{env:(\\w+)}");
    private static final Pattern FIELD_PLACEHOLDER = Pattern.compile("\\$\\{\\s*(\\w+)\\s*}");

    private PythonSyntax() {
    }

    /** {@code weather_lookup} becomes {@code WeatherLookup}. */
    static String pascalCase(String snake) {
        return Arrays.stream(snake.split("_"))
                .filter(part -> !part.isEmpty())
                .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1).toLowerCase())
                .collect(Collectors.joining());
    }

    /** Double-quoted string literal. */
    static String quote(String value) {
        return "\"" + escape(value) + "\"";
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    /** Python float literal: {@code 30.0}, {@code 0.5}, {@code 0.0001}. */
    static String floatLiteral(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return (long) value + ".0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /** Dotted module path of a script under {@code tools/}: {@code lib/clean.py} becomes {@code lib.clean}. */
    static String moduleName(String scriptPath) {
        String module = scriptPath.replace('\\', '/');
        if (module.endsWith(".py")) {
            module = module.substring(0, module.length() - 3);
        }
        return module.replace('/', '.');
    }

    /** Target expression for a routing return or edge endpoint: {@code END} or a quoted node id. */
    static String target(String nodeIdOrTerminal) {
        return Edge.TERMINAL.equals(nodeIdOrTerminal) ? "END" : quote(nodeIdOrTerminal);
    }

    /**
     * Escapes text for the inside of a double-quoted f-string and rewrites {@code ${env:VAR}} to
     * {@code {os.getenv('VAR')}}.
     */
    static String envInterpolated(String template) {
        String escaped = escapeFString(template);
        return ENV_PLACEHOLDER.matcher(escaped).replaceAll(m -> Matcher.quoteReplacement(
                "{os.getenv('" + m.group(1) + "')}"));
    }

    /**
     * Escapes one prompt line for a double-quoted f-string and rewrites {@code ${field}} to
     * {@code {state.get('field', '')}}.
     */
    static String stateInterpolated(String line) {
        StringBuilder out = new StringBuilder();
        Matcher matcher = FIELD_PLACEHOLDER.matcher(line);
        int last = 0;
        while (matcher.find()) {
            out.append(escapeFString(line.substring(last, matcher.start())));
            out.append("{state.get('").append(matcher.group(1)).append("', '')}");
            last = matcher.end();
        }
        out.append(escapeFString(line.substring(last)));
        return out.toString();
    }

    /** Escapes quotes and backslashes and doubles literal braces, leaving {@code ${...}} intact. */
    private static String escapeFString(String text) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '$' && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                int close = text.indexOf('}', i);
                if (close > 0) {
                    out.append(text, i, close + 1);
                    i = close;
                    continue;
                }
            }
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '{' -> out.append("{{");
                case '}' -> out.append("}}");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
