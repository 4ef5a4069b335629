package com.example.ajml.markup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MarkupReader")
class MarkupReaderTest {

    @Nested
    @DisplayName("well-formed documents")
    class WellFormed {

        @Test
        @DisplayName("builds the element tree with attributes and line numbers")
        void tree() {
            MarkupElement root = MarkupReader.read("""
                    <?xml version="1.0" encoding="UTF-8"?>
                    <agent name="demo">
                        <state>
                            <field name="x" type="string" />
                        </state>
                    </agent>
                    """);

            assertEquals("agent", root.tag());
            assertEquals("demo", root.attribute("name"));
            MarkupElement field = root.child("state").orElseThrow().children("field").get(0);
            assertEquals("string", field.attribute("type"));
            assertEquals(4, field.line());
        }

        @Test
        @DisplayName("keeps raw comparison and boolean characters in conditions")
        void rawCondition() {
            MarkupElement edge = MarkupReader.read(
                    "<edge source=\"a\" target=\"b\"><condition>state['n'] < 3 & True</condition></edge>");
            assertEquals("state['n'] < 3 & True", edge.childText("condition"));
        }

        @Test
        @DisplayName("leaves existing entities in prompts untouched")
        void existingEntities() {
            MarkupElement node = MarkupReader.read(
                    "<node id=\"a\"><system_prompt>Use &lt;b&gt; tags & be brief</system_prompt></node>");
            assertEquals("Use <b> tags & be brief", node.childText("system_prompt"));
        }

        @Test
        @DisplayName("absent attributes fall back to defaults")
        void defaults() {
            MarkupElement element = MarkupReader.read("<field name=\"x\" expose=\"FALSE\" />");
            assertEquals("overwrite", element.attribute("reducer", "overwrite"));
            assertThat(element.flag("expose", true)).isFalse();
            assertTrue(element.flag("required", true));
        }
    }

    @Nested
    @DisplayName("malformed documents")
    class Malformed {

        @Test
        @DisplayName("reports the line of an unclosed element")
        void unclosed() {
            MarkupSyntaxException ex = assertThrows(MarkupSyntaxException.class, () -> MarkupReader.read("""
                    <agent name="demo">
                        <state>
                    </agent>
                    """));
            assertEquals(3, ex.getLine());
        }

        @Test
        @DisplayName("rejects an empty document")
        void empty() {
            assertThrows(MarkupSyntaxException.class, () -> MarkupReader.read(""));
        }

        @Test
        @DisplayName("rejects DOCTYPE declarations")
        void doctype() {
            assertThrows(MarkupSyntaxException.class, () -> MarkupReader.read("""
                    <?xml version="1.0"?>
                    <!DOCTYPE agent [<!ENTITY x "y">]>
                    <agent name="&x;" />
                    """));
        }
    }
}
