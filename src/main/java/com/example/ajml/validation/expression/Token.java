package com.example.ajml.validation.expression;

/**
 * Lexical token of a condition expression.
 */
record Token(Type type, String text, int position) {

    enum Type {
        NAME, NUMBER, STRING, OPERATOR, END
    }

    boolean is(Type expected, String value) {
        return type == expected && text.equals(value);
    }

    boolean isOperator(String value) {
        return is(Type.OPERATOR, value);
    }

    boolean isKeyword(String value) {
        return is(Type.NAME, value);
    }
}
