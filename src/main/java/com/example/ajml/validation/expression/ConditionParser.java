package com.example.ajml.validation.expression;

import com.example.ajml.validation.expression.ConditionExpression.Attribute;
import com.example.ajml.validation.expression.ConditionExpression.Binary;
import com.example.ajml.validation.expression.ConditionExpression.BooleanOperation;
import com.example.ajml.validation.expression.ConditionExpression.Call;
import com.example.ajml.validation.expression.ConditionExpression.Comparison;
import com.example.ajml.validation.expression.ConditionExpression.Dict;
import com.example.ajml.validation.expression.ConditionExpression.KeywordArgument;
import com.example.ajml.validation.expression.ConditionExpression.Literal;
import com.example.ajml.validation.expression.ConditionExpression.Name;
import com.example.ajml.validation.expression.ConditionExpression.Sequence;
import com.example.ajml.validation.expression.ConditionExpression.Subscript;
import com.example.ajml.validation.expression.ConditionExpression.Unary;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for condition expressions.
 * <p>
 * Precedence, loosest first: {@code or}, {@code and}, {@code not}, comparisons, {@code + -},
 * {@code * / // %}, unary sign, {@code **}, then attribute/call/subscript postfixes.
 * </p>
 */
public final class ConditionParser {

    private static final Set<String> CONSTANTS = Set.of("True", "False", "None");
    private static final Set<String> COMPARISON_OPERATORS = Set.of("==", "!=", "<", ">", "<=", ">=");
    private static final Set<String> KEYWORDS = Set.of(
            "and", "or", "not", "in", "is", "if", "else", "elif", "for", "while", "lambda", "import", "from",
            "def", "class", "return", "yield", "await", "async", "with", "as", "del", "global", "nonlocal",
            "pass", "raise", "try", "except", "finally", "assert", "break", "continue");

    private final List<Token> tokens;
    private int index;

    private ConditionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static ConditionExpression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ExpressionSyntaxException("Empty expression", 0);
        }
        ConditionParser parser = new ConditionParser(new ConditionLexer(source).tokenize());
        ConditionExpression expression = parser.orTest();
        Token trailing = parser.peek();
        if (trailing.type() != Token.Type.END) {
            throw new ExpressionSyntaxException("Unexpected '" + trailing.text() + "'", trailing.position());
        }
        return expression;
    }

    private ConditionExpression orTest() {
        return booleanChain("or", this::andTest);
    }

    private ConditionExpression andTest() {
        return booleanChain("and", this::notTest);
    }

    private ConditionExpression booleanChain(String keyword, Rule operand) {
        ConditionExpression first = operand.parse();
        if (!peek().isKeyword(keyword)) {
            return first;
        }
        List<ConditionExpression> operands = new ArrayList<>();
        operands.add(first);
        while (peek().isKeyword(keyword)) {
            advance();
            operands.add(operand.parse());
        }
        return new BooleanOperation(keyword, operands);
    }

    private ConditionExpression notTest() {
        if (peek().isKeyword("not")) {
            advance();
            return new Unary("not", notTest());
        }
        return comparison();
    }

    private ConditionExpression comparison() {
        ConditionExpression left = arithmetic();
        List<String> operators = new ArrayList<>();
        List<ConditionExpression> operands = new ArrayList<>();
        String operator;
        while ((operator = comparisonOperator()) != null) {
            operators.add(operator);
            operands.add(arithmetic());
        }
        return operators.isEmpty() ? left : new Comparison(left, operators, operands);
    }

    private String comparisonOperator() {
        Token token = peek();
        if (token.type() == Token.Type.OPERATOR && COMPARISON_OPERATORS.contains(token.text())) {
            advance();
            return token.text();
        }
        if (token.isKeyword("in")) {
            advance();
            return "in";
        }
        if (token.isKeyword("not") && peekAhead(1).isKeyword("in")) {
            advance();
            advance();
            return "not in";
        }
        if (token.isKeyword("is")) {
            advance();
            if (peek().isKeyword("not")) {
                advance();
                return "is not";
            }
            return "is";
        }
        return null;
    }

    private ConditionExpression arithmetic() {
        ConditionExpression left = term();
        while (peek().isOperator("+") || peek().isOperator("-")) {
            String operator = advance().text();
            left = new Binary(operator, left, term());
        }
        return left;
    }

    private ConditionExpression term() {
        ConditionExpression left = factor();
        while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("//") || peek().isOperator("%")) {
            String operator = advance().text();
            left = new Binary(operator, left, factor());
        }
        return left;
    }

    private ConditionExpression factor() {
        if (peek().isOperator("-") || peek().isOperator("+")) {
            String operator = advance().text();
            return new Unary(operator, factor());
        }
        return power();
    }

    private ConditionExpression power() {
        ConditionExpression base = postfix();
        if (peek().isOperator("**")) {
            advance();
            return new Binary("**", base, factor());
        }
        return base;
    }

    private ConditionExpression postfix() {
        ConditionExpression expression = atom();
        while (true) {
            Token token = peek();
            if (token.isOperator(".")) {
                advance();
                Token name = expect(Token.Type.NAME, "attribute name");
                if (KEYWORDS.contains(name.text())) {
                    throw new ExpressionSyntaxException("Keyword '" + name.text() + "' cannot be an attribute", name.position());
                }
                expression = new Attribute(expression, name.text(), name.position());
            } else if (token.isOperator("(")) {
                advance();
                expression = callArguments(expression);
            } else if (token.isOperator("[")) {
                advance();
                ConditionExpression index = orTest();
                expectOperator("]");
                expression = new Subscript(expression, index);
            } else {
                return expression;
            }
        }
    }

    private ConditionExpression callArguments(ConditionExpression callee) {
        List<ConditionExpression> arguments = new ArrayList<>();
        List<KeywordArgument> keywords = new ArrayList<>();
        while (!peek().isOperator(")")) {
            if (peek().type() == Token.Type.NAME && peekAhead(1).isOperator("=")) {
                String name = advance().text();
                advance();
                keywords.add(new KeywordArgument(name, orTest()));
            } else if (!keywords.isEmpty()) {
                throw new ExpressionSyntaxException("Positional argument follows keyword argument", peek().position());
            } else {
                arguments.add(orTest());
            }
            if (!peek().isOperator(",")) {
                break;
            }
            advance();
        }
        expectOperator(")");
        return new Call(callee, arguments, keywords);
    }

    private ConditionExpression atom() {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
                return new Literal(token.text());
            case STRING: {
                StringBuilder text = new StringBuilder(token.text());
                while (peek().type() == Token.Type.STRING) {
                    text.append(' ').append(advance().text());
                }
                return new Literal(text.toString());
            }
            case NAME:
                if (CONSTANTS.contains(token.text())) {
                    return new Literal(token.text());
                }
                if (KEYWORDS.contains(token.text())) {
                    throw new ExpressionSyntaxException("Unexpected keyword '" + token.text() + "'", token.position());
                }
                return new Name(token.text(), token.position());
            case OPERATOR:
                if (token.text().equals("(")) {
                    return parenthesised(token);
                }
                if (token.text().equals("[")) {
                    return new Sequence(false, elementsUntil("]"));
                }
                if (token.text().equals("{")) {
                    return dict();
                }
                throw new ExpressionSyntaxException("Unexpected '" + token.text() + "'", token.position());
            default:
                throw new ExpressionSyntaxException("Unexpected end of expression", token.position());
        }
    }

    private ConditionExpression parenthesised(Token open) {
        if (peek().isOperator(")")) {
            advance();
            return new Sequence(true, List.of());
        }
        ConditionExpression first = orTest();
        if (peek().isOperator(")")) {
            advance();
            return first;
        }
        if (!peek().isOperator(",")) {
            throw new ExpressionSyntaxException("Expected ')' to close '(' opened", open.position());
        }
        advance();
        List<ConditionExpression> elements = new ArrayList<>();
        elements.add(first);
        elements.addAll(elementsUntil(")"));
        return new Sequence(true, elements);
    }

    private ConditionExpression dict() {
        List<ConditionExpression> keys = new ArrayList<>();
        List<ConditionExpression> values = new ArrayList<>();
        while (!peek().isOperator("}")) {
            keys.add(orTest());
            expectOperator(":");
            values.add(orTest());
            if (!peek().isOperator(",")) {
                break;
            }
            advance();
        }
        expectOperator("}");
        return new Dict(keys, values);
    }

    private List<ConditionExpression> elementsUntil(String closing) {
        List<ConditionExpression> elements = new ArrayList<>();
        while (!peek().isOperator(closing)) {
            elements.add(orTest());
            if (!peek().isOperator(",")) {
                break;
            }
            advance();
        }
        expectOperator(closing);
        return elements;
    }

    private Token expect(Token.Type type, String description) {
        Token token = advance();
        if (token.type() != type) {
            throw new ExpressionSyntaxException("Expected " + description + " but found '" + token.text() + "'", token.position());
        }
        return token;
    }

    private void expectOperator(String operator) {
        Token token = advance();
        if (!token.isOperator(operator)) {
            String found = token.type() == Token.Type.END ? "end of expression" : "'" + token.text() + "'";
            throw new ExpressionSyntaxException("Expected '" + operator + "' but found " + found, token.position());
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (token.type() != Token.Type.END) {
            index++;
        }
        return token;
    }

    @FunctionalInterface
    private interface Rule {
        ConditionExpression parse();
    }
}
