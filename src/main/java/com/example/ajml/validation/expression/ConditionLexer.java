package com.example.ajml.validation.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a condition into names, numbers, quoted strings and operators.
 */
final class ConditionLexer {

    private static final List<String> OPERATORS = List.of(
            "**", "//", "==", "!=", "<=", ">=",
            "<", ">", "+", "-", "*", "/", "%", "(", ")", "[", "]", "{", "}", ",", ".", ":", "=");

    private final String source;
    private int pos;

    ConditionLexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Type.END, "", pos));
                return tokens;
            }
            char c = source.charAt(pos);
            if (Character.isLetter(c) || c == '_') {
                tokens.add(name());
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
                tokens.add(number());
            } else if (c == '\'' || c == '"') {
                tokens.add(string(c));
            } else {
                tokens.add(operator());
            }
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private Token name() {
        int start = pos;
        while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        return new Token(Token.Type.NAME, source.substring(start, pos), start);
    }

    private Token number() {
        int start = pos;
        boolean seenDot = false;
        boolean seenExponent = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c) || c == '_') {
                pos++;
            } else if (c == '.' && !seenDot && !seenExponent) {
                seenDot = true;
                pos++;
            } else if ((c == 'e' || c == 'E') && !seenExponent) {
                seenExponent = true;
                pos++;
                if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
            } else {
                break;
            }
        }
        if (pos < source.length() && (Character.isLetter(source.charAt(pos)) || source.charAt(pos) == '_')) {
            throw new ExpressionSyntaxException("Invalid numeric literal '" + source.substring(start, pos + 1) + "'", start);
        }
        return new Token(Token.Type.NUMBER, source.substring(start, pos), start);
    }

    private Token string(char quote) {
        int start = pos;
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '\n') {
                break;
            }
            pos++;
            if (c == quote) {
                return new Token(Token.Type.STRING, source.substring(start, pos), start);
            }
        }
        throw new ExpressionSyntaxException("Unterminated string literal", start);
    }

    private Token operator() {
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                Token token = new Token(Token.Type.OPERATOR, op, pos);
                pos += op.length();
                return token;
            }
        }
        throw new ExpressionSyntaxException("Unexpected character '" + source.charAt(pos) + "'", pos);
    }
}
