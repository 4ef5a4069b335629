package com.example.ajml.validation.expression;

import com.example.ajml.validation.expression.ConditionExpression.BooleanOperation;
import com.example.ajml.validation.expression.ConditionExpression.Call;
import com.example.ajml.validation.expression.ConditionExpression.Comparison;
import com.example.ajml.validation.expression.ConditionExpression.Dict;
import com.example.ajml.validation.expression.ConditionExpression.Literal;
import com.example.ajml.validation.expression.ConditionExpression.Name;
import com.example.ajml.validation.expression.ConditionExpression.Sequence;
import com.example.ajml.validation.expression.ConditionExpression.Subscript;
import com.example.ajml.validation.expression.ConditionExpression.Unary;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("ConditionParser")
class ConditionParserTest {

    @Nested
    @DisplayName("precedence")
    class Precedence {

        @Test
        @DisplayName("and binds tighter than or")
        void andBeforeOr() {
            BooleanOperation or = assertInstanceOf(BooleanOperation.class, ConditionParser.parse("a or b and c"));
            assertEquals("or", or.operator());
            assertEquals(new Name("a", 0), or.operands().get(0));
            BooleanOperation and = assertInstanceOf(BooleanOperation.class, or.operands().get(1));
            assertEquals("and", and.operator());
        }

        @Test
        @DisplayName("not applies to the whole comparison")
        void notOverComparison() {
            Unary not = assertInstanceOf(Unary.class, ConditionParser.parse("not x == 1"));
            assertEquals("not", not.operator());
            assertInstanceOf(Comparison.class, not.operand());
        }

        @Test
        @DisplayName("comparisons chain")
        void chainedComparison() {
            Comparison comparison = assertInstanceOf(Comparison.class, ConditionParser.parse("0 <= x < 10"));
            assertEquals(List.of("<=", "<"), comparison.operators());
            assertEquals(2, comparison.operands().size());
        }

        @Test
        @DisplayName("reads two-word membership and identity operators")
        void twoWordOperators() {
            Comparison notIn = assertInstanceOf(Comparison.class, ConditionParser.parse("x not in y"));
            assertEquals(List.of("not in"), notIn.operators());
            Comparison isNot = assertInstanceOf(Comparison.class, ConditionParser.parse("x is not None"));
            assertEquals(List.of("is not"), isNot.operators());
            assertEquals(new Literal("None"), isNot.operands().get(0));
        }
    }

    @Nested
    @DisplayName("postfix and atoms")
    class Atoms {

        @Test
        @DisplayName("parses state.get with a default and keyword arguments")
        void methodCall() {
            Call call = assertInstanceOf(Call.class, ConditionParser.parse("state.get('count', default=0)"));
            assertThat(call.arguments()).containsExactly(new Literal("'count'"));
            assertThat(call.keywords()).extracting(ConditionExpression.KeywordArgument::name).containsExactly("default");
        }

        @Test
        @DisplayName("parses subscripts and list displays")
        void subscriptAndList() {
            Comparison comparison = assertInstanceOf(Comparison.class,
                    ConditionParser.parse("state['status'] in ['done', 'failed']"));
            assertInstanceOf(Subscript.class, comparison.left());
            Sequence list = assertInstanceOf(Sequence.class, comparison.operands().get(0));
            assertEquals(2, list.elements().size());
        }

        @Test
        @DisplayName("parses dict displays as a state.get default")
        void dictDefault() {
            Comparison comparison = assertInstanceOf(Comparison.class,
                    ConditionParser.parse("len(state.get('m', {})) > 0"));
            Call len = assertInstanceOf(Call.class, comparison.left());
            Call get = assertInstanceOf(Call.class, len.arguments().get(0));
            Dict empty = assertInstanceOf(Dict.class, get.arguments().get(1));
            assertThat(empty.keys()).isEmpty();

            Dict pairs = assertInstanceOf(Dict.class, ConditionParser.parse("{'a': 1, 'b': state['x'],}"));
            assertThat(pairs.keys()).containsExactly(new Literal("'a'"), new Literal("'b'"));
            assertEquals(new Literal("1"), pairs.values().get(0));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "len(state.get('items', [])) > 0",
                "state['score'] ** 2 >= 0.5",
                "-state['delta'] % 3 != 1",
                "(state['a'], state['b']) == (1, 2)",
                "'prefix' 'suffix' == state['name']",
                "any([True, False]) and not all([])"
        })
        @DisplayName("accepts expressions within the grammar")
        void accepted(String source) {
            assertDoesNotThrow(() -> ConditionParser.parse(source));
        }
    }

    @Nested
    @DisplayName("rejected input")
    class Rejected {

        @ParameterizedTest
        @ValueSource(strings = {
                "",
                "   ",
                "state['a'] ==",
                "lambda: 1",
                "x if y else z",
                "state['a'] = 1",
                "f(a=1, 2)",
                "state.import",
                "'unterminated",
                "a && b",
                "(1, 2",
                "{'a'}",
                "{'a': }",
                "{'a': 1"
        })
        @DisplayName("raises a syntax error")
        void syntaxErrors(String source) {
            assertThrows(ExpressionSyntaxException.class, () -> ConditionParser.parse(source));
        }

        @Test
        @DisplayName("reports the position of a trailing token")
        void trailingTokenPosition() {
            ExpressionSyntaxException ex = assertThrows(ExpressionSyntaxException.class,
                    () -> ConditionParser.parse("x y"));
            assertEquals(2, ex.getPosition());
        }
    }
}
