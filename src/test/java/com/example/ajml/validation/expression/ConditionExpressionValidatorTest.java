package com.example.ajml.validation.expression;

import com.example.ajml.validation.CompilationException;
import com.example.ajml.validation.DiagnosticCode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("ConditionExpressionValidator")
class ConditionExpressionValidatorTest {

    @Nested
    @DisplayName("conditions")
    class Conditions {

        @Test
        @DisplayName("allows state and the builtin helpers")
        void allowedNames() {
            assertDoesNotThrow(() -> ConditionExpressionValidator.validate(
                    "len(state['items']) > max(1, int(state.get('limit', '2'))) and bool(state.flag)", "a.ajml", 3));
        }

        @Test
        @DisplayName("E501 names the first undefined name")
        void undefinedName() {
            CompilationException ex = assertThrows(CompilationException.class,
                    () -> ConditionExpressionValidator.validate("state['x'] == y or z", "a.ajml", 7));
            assertEquals(DiagnosticCode.UNBOUND_NAME, ex.getCode());
            assertThat(ex.getDiagnostic().message()).contains("`y`");
            assertEquals(7, ex.getDiagnostic().line());
        }

        @Test
        @DisplayName("E501 for a call to eval")
        void evalCall() {
            CompilationException ex = assertThrows(CompilationException.class,
                    () -> ConditionExpressionValidator.validate("eval('1') == 1", "a.ajml", 1));
            assertEquals(DiagnosticCode.UNBOUND_NAME, ex.getCode());
        }

        @Test
        @DisplayName("checks names inside dict displays")
        void dictDisplay() {
            assertDoesNotThrow(() -> ConditionExpressionValidator.validate(
                    "len(state.get('m', {})) > 0", "a.ajml", 1));
            CompilationException ex = assertThrows(CompilationException.class,
                    () -> ConditionExpressionValidator.validate("state.get('m', {'k': secret}) == {}", "a.ajml", 1));
            assertEquals(DiagnosticCode.UNBOUND_NAME, ex.getCode());
            assertThat(ex.getDiagnostic().message()).contains("`secret`");
        }

        @Test
        @DisplayName("keyword argument names are not references")
        void keywordNames() {
            assertDoesNotThrow(() -> ConditionExpressionValidator.validate("max(1, 2, key=None) > 0", "a.ajml", 1));
        }

        @Test
        @DisplayName("E503 quotes the expression")
        void syntaxError() {
            CompilationException ex = assertThrows(CompilationException.class,
                    () -> ConditionExpressionValidator.validate("state[", "a.ajml", 1));
            assertEquals(DiagnosticCode.INVALID_EXPRESSION_SYNTAX, ex.getCode());
            assertThat(ex.getDiagnostic().message()).startsWith("Invalid condition expression `state[`");
        }
    }

    @Nested
    @DisplayName("state reads")
    class StateReads {

        @Test
        @DisplayName("collects subscript, get and attribute reads")
        void reads() {
            ConditionExpression expression = ConditionParser.parse(
                    "state['a'] > 0 and state.get(\"b\") and state.c");
            assertThat(ConditionExpressionValidator.stateReads(expression)).containsExactlyInAnyOrder("a", "b", "c");
        }
    }

    @Nested
    @DisplayName("prompt placeholders")
    class Placeholders {

        @Test
        @DisplayName("returns placeholder names in order")
        void names() {
            assertThat(ConditionExpressionValidator.validatePromptPlaceholders(
                    "Write about ${topic} for ${ audience }.", "writer", "a.ajml", 4))
                    .containsExactly("topic", "audience");
        }

        @Test
        @DisplayName("E502 for an unterminated placeholder")
        void unterminated() {
            CompilationException ex = assertThrows(CompilationException.class,
                    () -> ConditionExpressionValidator.validatePromptPlaceholders("Hello ${name", "writer", "a.ajml", 4));
            assertEquals(DiagnosticCode.INVALID_INTERPOLATION, ex.getCode());
        }

        @Test
        @DisplayName("E502 for an expression placeholder")
        void expressionPlaceholder() {
            CompilationException ex = assertThrows(CompilationException.class,
                    () -> ConditionExpressionValidator.validatePromptPlaceholders("Total ${a + b}", "writer", "a.ajml", 4));
            assertEquals(DiagnosticCode.INVALID_INTERPOLATION, ex.getCode());
            assertThat(ex.getDiagnostic().message()).contains("`writer`");
        }
    }
}
