package com.example.ajml.validation;

/**
 * Closed catalogue of compiler diagnostics with their stable codes.
 */
public enum DiagnosticCode {

    ROOT_MISMATCH("E001", DiagnosticCategory.STRUCTURE, "Root element must be <agent> or <project> with a name"),
    MISSING_BLOCK("E002", DiagnosticCategory.STRUCTURE, "Required block missing"),
    MISSING_PROJECT("E003", DiagnosticCategory.STRUCTURE, "Missing _project.ajml"),
    INVALID_LANGUAGE_VERSION("E004", DiagnosticCategory.STRUCTURE, "Invalid ajml_version"),
    MALFORMED_DOCUMENT("E005", DiagnosticCategory.STRUCTURE, "Document is not well-formed"),
    INVALID_ATTRIBUTE_VALUE("E006", DiagnosticCategory.STRUCTURE, "Attribute value has the wrong format"),

    DUPLICATE_NODE_ID("E101", DiagnosticCategory.UNIQUENESS, "Duplicate node ID"),
    DUPLICATE_TOOL_ID("E102", DiagnosticCategory.UNIQUENESS, "Duplicate tool ID"),
    DUPLICATE_FIELD_NAME("E103", DiagnosticCategory.UNIQUENESS, "Duplicate state field name"),
    RESERVED_WORD("E104", DiagnosticCategory.UNIQUENESS, "Reserved word used"),

    INVALID_NODE_TYPE("E105", DiagnosticCategory.TYPE, "Invalid node type"),
    INVALID_TOOL_TYPE("E106", DiagnosticCategory.TYPE, "Invalid tool type"),
    INVALID_FIELD_TYPE("E107", DiagnosticCategory.TYPE, "Invalid state field type"),
    INVALID_REDUCER("E108", DiagnosticCategory.TYPE, "Invalid reducer for type"),
    ENUM_DEFAULT_NOT_IN_VALUES("E109", DiagnosticCategory.TYPE, "Enum default not in values"),

    MESSAGES_FIELD_DECLARED("E201", DiagnosticCategory.STATE, "Cannot declare 'messages' field"),
    REQUIRED_WITH_DEFAULT("E202", DiagnosticCategory.STATE, "Required field cannot have default"),

    NO_ENTRY_POINT("E301", DiagnosticCategory.GRAPH, "No entry point"),
    UNKNOWN_EDGE_TARGET("E302", DiagnosticCategory.GRAPH, "Edge target not found"),
    UNKNOWN_EDGE_SOURCE("E303", DiagnosticCategory.GRAPH, "Edge source not found"),
    MISSING_DEFAULT_EDGE("E304", DiagnosticCategory.GRAPH, "Conditional group missing default"),
    DEFAULT_WITH_CONDITION("E305", DiagnosticCategory.GRAPH, "Default edge has condition"),
    MULTIPLE_DEFAULT_EDGES("E306", DiagnosticCategory.GRAPH, "Multiple defaults from same source"),
    UNKNOWN_TOOL_REF("E307", DiagnosticCategory.GRAPH, "Tool reference not found"),
    SCRIPT_NOT_FOUND("E308", DiagnosticCategory.GRAPH, "Script file not found"),
    UNKNOWN_AGENT_REF("E309", DiagnosticCategory.GRAPH, "Agent reference not found"),
    INPUT_MAP_TARGET_NOT_IN_CHILD("E310", DiagnosticCategory.GRAPH, "Input map target not in child state"),
    OUTPUT_MAP_SOURCE_NOT_IN_CHILD("E311", DiagnosticCategory.GRAPH, "Output map source not in child state"),
    UNREACHABLE_NODE("E312", DiagnosticCategory.GRAPH, "Unreachable node"),
    DEAD_END_NODE("E313", DiagnosticCategory.GRAPH, "Node has no outgoing edges"),
    MIXED_EDGE_TYPES("E314", DiagnosticCategory.GRAPH, "Mixed edge types"),
    FAN_OUT_NOT_LIST("E315", DiagnosticCategory.GRAPH, "Map items_field not a list"),
    ACTION_PARAM_NOT_IN_STATE("E316", DiagnosticCategory.GRAPH, "Action node params not in state"),

    UNKNOWN_PROVIDER("E401", DiagnosticCategory.CONFIGURATION, "Unknown LLM provider"),
    CIRCULAR_SUBGRAPH("E402", DiagnosticCategory.CONFIGURATION, "Circular subgraph dependency"),
    DUPLICATE_AGENT_NAME("E403", DiagnosticCategory.CONFIGURATION, "Duplicate agent name"),

    UNBOUND_NAME("E501", DiagnosticCategory.EXPRESSION, "Condition references undefined name"),
    INVALID_INTERPOLATION("E502", DiagnosticCategory.EXPRESSION, "Invalid interpolation syntax"),
    INVALID_EXPRESSION_SYNTAX("E503", DiagnosticCategory.EXPRESSION, "Condition expression syntax error"),

    PARALLEL_OVERWRITE("W301", DiagnosticCategory.WARNING, "Parallel branches may write to same overwrite field"),
    UNUSED_FIELD("W302", DiagnosticCategory.WARNING, "Internal state field is never referenced");

    private final String code;
    private final DiagnosticCategory category;
    private final String summary;

    DiagnosticCode(String code, DiagnosticCategory category, String summary) {
        this.code = code;
        this.category = category;
        this.summary = summary;
    }

    public String code() {
        return code;
    }

    public DiagnosticCategory category() {
        return category;
    }

    public String summary() {
        return summary;
    }

    public boolean isFatal() {
        return category.isFatal();
    }
}
