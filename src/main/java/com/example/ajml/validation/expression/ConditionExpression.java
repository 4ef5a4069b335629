package com.example.ajml.validation.expression;

import java.util.List;

/**
 * Syntax tree of a restricted condition expression.
 */
public sealed interface ConditionExpression {

    /** A bare identifier such as {@code state} or {@code len}. */
    record Name(String id, int position) implements ConditionExpression {
    }

    /** Number, string or keyword constant, kept as written. */
    record Literal(String text) implements ConditionExpression {
    }

    record Attribute(ConditionExpression target, String name, int position) implements ConditionExpression {
    }

    /** Call with positional arguments and keyword arguments (keyword names are not references). */
    record Call(ConditionExpression callee, List<ConditionExpression> arguments, List<KeywordArgument> keywords)
            implements ConditionExpression {
        public Call {
            arguments = List.copyOf(arguments);
            keywords = List.copyOf(keywords);
        }
    }

    record KeywordArgument(String name, ConditionExpression value) {
    }

    record Subscript(ConditionExpression target, ConditionExpression index) implements ConditionExpression {
    }

    record Unary(String operator, ConditionExpression operand) implements ConditionExpression {
    }

    record Binary(String operator, ConditionExpression left, ConditionExpression right) implements ConditionExpression {
    }

    /** Chained comparison {@code a < b <= c}: {@code operators.size() == operands.size()}. */
    record Comparison(ConditionExpression left, List<String> operators, List<ConditionExpression> operands)
            implements ConditionExpression {
        public Comparison {
            operators = List.copyOf(operators);
            operands = List.copyOf(operands);
        }
    }

    /** {@code and} / {@code or} over two or more operands. */
    record BooleanOperation(String operator, List<ConditionExpression> operands) implements ConditionExpression {
        public BooleanOperation {
            operands = List.copyOf(operands);
        }
    }

    /** Dict display {@code {k: v, ...}}; {@code keys.get(i)} maps to {@code values.get(i)}. */
    record Dict(List<ConditionExpression> keys, List<ConditionExpression> values) implements ConditionExpression {
        public Dict {
            keys = List.copyOf(keys);
            values = List.copyOf(values);
        }
    }

    /** List ({@code [a, b]}) or tuple ({@code (a, b)}) display. */
    record Sequence(boolean tuple, List<ConditionExpression> elements) implements ConditionExpression {
        public Sequence {
            elements = List.copyOf(elements);
        }
    }
}
