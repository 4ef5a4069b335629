package com.example.ajml.validation;

import com.example.ajml.markup.MarkupElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Attribute readers shared by the document validators. Malformed or negative numbers and values outside
 * a closed set raise E006.
 */
final class AttributeValues {

    private AttributeValues() {
    }

    static int intValue(MarkupElement element, String name, int defaultValue, String file) {
        String raw = element.attribute(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw invalid(element, name, raw, "a non-negative integer", file);
        }
        if (value < 0) {
            throw invalid(element, name, raw, "a non-negative integer", file);
        }
        return value;
    }

    static double doubleValue(MarkupElement element, String name, double defaultValue, String file) {
        String raw = element.attribute(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw invalid(element, name, raw, "a non-negative number", file);
        }
        if (!Double.isFinite(value) || value < 0) {
            throw invalid(element, name, raw, "a non-negative number", file);
        }
        return value;
    }

    /**
     * Reads an attribute restricted to {@code allowed}; an absent attribute yields {@code defaultValue}.
     * Comparison is exact unless {@code ignoreCase}, in which case the allowed values are upper case and
     * the result is upper-cased.
     */
    static String choice(MarkupElement element, String name, String defaultValue, Set<String> allowed,
                         boolean ignoreCase, String file) {
        String raw = element.attribute(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        String value = ignoreCase ? raw.trim().toUpperCase(Locale.ROOT) : raw.trim();
        if (!allowed.contains(value)) {
            throw invalid(element, name, raw, "one of " + String.join(", ", allowed.stream().sorted().toList()),
                    file);
        }
        return value;
    }

    /** Comma-separated integer list such as {@code "429, 500, 503"}. */
    static List<Integer> intList(MarkupElement element, String name, String defaultValue, String file) {
        String raw = element.attribute(name, defaultValue);
        List<Integer> values = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                values.add(Integer.parseInt(part.trim()));
            } catch (NumberFormatException e) {
                throw invalid(element, name, raw, "a comma-separated list of integers", file);
            }
        }
        return values;
    }

    /** Splits a comma-separated value list, trimming each entry and dropping empty ones. */
    static List<String> csv(String raw) {
        List<String> values = new ArrayList<>();
        if (raw == null) {
            return values;
        }
        for (String part : raw.split(",")) {
            String value = part.trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }

    private static CompilationException invalid(MarkupElement element, String name, String raw, String expected,
                                                String file) {
        return new CompilationException(DiagnosticCode.INVALID_ATTRIBUTE_VALUE,
                "Attribute `" + name + "` of <" + element.tag() + "> must be " + expected + ", got `" + raw + "`.",
                file, element.line());
    }
}
