package com.example.ajml.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.ajml.validation.AgentDocuments.validate;
import static com.example.ajml.validation.AgentDocuments.withState;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@DisplayName("StateWriteAdvisor")
class StateWriteAdvisorTest {

    private static final String DIAMOND = """
            <graph>
                <node id="split" type="llm"><system_prompt>Split</system_prompt></node>
                <node id="a" type="llm"><system_prompt>A</system_prompt></node>
                <node id="b" type="llm"><system_prompt>B</system_prompt></node>
                <node id="join" type="llm"><system_prompt>Join</system_prompt></node>
                <edge source="__START__" target="split" />
                <edge source="split" target="a" />
                <edge source="split" target="b" />
                <edge source="a" target="join" />
                <edge source="b" target="join" />
                <edge source="join" target="__END__" />
            </graph>
            """;

    @Nested
    @DisplayName("parallel overwrite (W301)")
    class ParallelOverwrite {

        @Test
        @DisplayName("warns once for the fan-out source and the overwrite field")
        void diamond() {
            List<Diagnostic> warnings = validate(withState("""
                    <field name="result" type="string" default="" />
                    <field name="log" type="list[string]" reducer="append" />
                    """, DIAMOND)).warnings();

            assertEquals(1, warnings.size());
            Diagnostic warning = warnings.get(0);
            assertEquals(DiagnosticCode.PARALLEL_OVERWRITE, warning.code());
            assertFalse(warning.isFatal());
            assertThat(warning.message()).contains("`split`").contains("`result`");
        }

        @Test
        @DisplayName("stays silent when every field has a merging reducer")
        void mergingReducers() {
            List<Diagnostic> warnings = validate(withState("""
                    <field name="log" type="list[string]" reducer="append" />
                    <field name="total" type="int" default="0" reducer="add" />
                    """, DIAMOND)).warnings();
            assertThat(warnings).isEmpty();
        }
    }

    @Nested
    @DisplayName("unused internal field (W302)")
    class UnusedField {

        private static final String GRAPH = """
                <graph>
                    <node id="a" type="llm"><system_prompt>Topic is ${topic}</system_prompt></node>
                    <edge source="__START__" target="a" />
                    <edge source="a" target="a"><condition>state.get('attempts', 0) &lt; 3</condition></edge>
                    <edge source="a" target="__END__" default="true" />
                </graph>
                """;

        @Test
        @DisplayName("warns for an internal field nothing touches")
        void unusedInternalField() {
            List<Diagnostic> warnings = validate(withState("""
                    <field name="topic" type="string" default="" />
                    <field name="attempts" type="int" default="0" reducer="add" expose="false" />
                    <field name="scratch" type="string" default="" expose="false" />
                    """, GRAPH)).warnings();

            assertThat(warnings).extracting(Diagnostic::code).containsExactly(DiagnosticCode.UNUSED_FIELD);
            assertThat(warnings.get(0).message()).contains("`scratch`");
        }

        @Test
        @DisplayName("does not warn for exposed fields")
        void exposedField() {
            List<Diagnostic> warnings = validate(withState("""
                    <field name="topic" type="string" default="" />
                    <field name="attempts" type="int" default="0" reducer="add" />
                    <field name="scratch" type="string" default="" />
                    """, GRAPH)).warnings();
            assertThat(warnings).isEmpty();
        }
    }
}
