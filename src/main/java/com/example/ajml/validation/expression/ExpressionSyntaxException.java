package com.example.ajml.validation.expression;

import lombok.Getter;

/**
 * Raised by {@link ConditionLexer} and {@link ConditionParser} for text outside the condition grammar.
 */
@Getter
public class ExpressionSyntaxException extends RuntimeException {

    /** Zero-based character offset of the offending token. */
    private final int position;

    public ExpressionSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }
}
