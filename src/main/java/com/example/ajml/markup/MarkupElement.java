package com.example.ajml.markup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One element of a parsed AJML document: tag, attributes in document order, child elements,
 * trimmed text content and the line the element starts on (0 when unknown).
 */
public record MarkupElement(
        String tag,
        Map<String, String> attributes,
        List<MarkupElement> children,
        String text,
        int line
) {
    public MarkupElement {
        Objects.requireNonNull(tag, "tag");
        attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
        children = children != null ? List.copyOf(children) : List.of();
        text = text != null ? text : "";
    }

    /** Attribute value, or {@code null} when the attribute is absent. */
    public String attribute(String name) {
        return attributes.get(name);
    }

    public String attribute(String name, String defaultValue) {
        return attributes.getOrDefault(name, defaultValue);
    }

    public boolean flag(String name, boolean defaultValue) {
        String value = attributes.get(name);
        return value != null ? "true".equalsIgnoreCase(value) : defaultValue;
    }

    /** First child with the given tag. */
    public Optional<MarkupElement> child(String childTag) {
        return children.stream().filter(c -> c.tag.equals(childTag)).findFirst();
    }

    /** All direct children with the given tag, in document order. */
    public List<MarkupElement> children(String childTag) {
        return children.stream().filter(c -> c.tag.equals(childTag)).toList();
    }

    /** Text of the first child with the given tag; empty when the child is absent. */
    public String childText(String childTag) {
        return child(childTag).map(MarkupElement::text).orElse("");
    }
}
