package com.example.ajml.domain;

import java.util.Objects;

/**
 * Directed edge between two nodes or one of the sentinels.
 *
 * @param condition restricted boolean expression, {@code null} when the edge has none
 * @param fanOut    fan-out configuration of a {@code type="map"} edge, {@code null} otherwise
 */
public record Edge(String source, String target, boolean isDefault, String condition, FanOut fanOut, int line) {

    public static final String ENTRY = "__START__";
    public static final String TERMINAL = "__END__";

    public Edge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    public boolean hasCondition() {
        return condition != null && !condition.isEmpty();
    }

    public boolean isFanOut() {
        return fanOut != null;
    }

    public boolean isConditional() {
        return hasCondition() || isDefault;
    }

    public boolean targetsTerminal() {
        return TERMINAL.equals(target);
    }

    /**
     * Dispatches one invocation of the target per element of {@code itemsField}, binding the element
     * as {@code itemVar}. Both names are empty when the document omitted {@code <map_config>}.
     */
    public record FanOut(String itemsField, String itemVar) {
        public FanOut {
            Objects.requireNonNull(itemsField, "itemsField");
            Objects.requireNonNull(itemVar, "itemVar");
        }
    }
}
