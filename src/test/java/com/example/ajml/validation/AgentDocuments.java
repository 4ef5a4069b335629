package com.example.ajml.validation;

import com.example.ajml.markup.MarkupReader;

import java.util.List;

/**
 * Builds small agent documents for tests.
 */
public final class AgentDocuments {

    public static final String FILE = "test.ajml";

    public static final String SINGLE_NODE_GRAPH = """
            <graph>
                <node id="a" type="llm"><system_prompt>Hello</system_prompt></node>
                <edge source="__START__" target="a" />
                <edge source="a" target="__END__" />
            </graph>
            """;

    private AgentDocuments() {
    }

    public static String agentNamed(String name, String body) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<agent name=\"" + name + "\">\n" + body + "\n</agent>";
    }

    public static String agent(String body) {
        return agentNamed("test", body);
    }

    /** An agent with the given state fields and graph. */
    public static String withState(String fields, String graph) {
        return agent("<state>\n" + fields + "\n</state>\n" + graph);
    }

    public static AgentValidationResult validate(String document, String... scripts) {
        return AgentDocumentValidator.validate(MarkupReader.read(document), FILE, ScriptLocator.of(List.of(scripts)));
    }
}
