package com.example.ajml.validation.expression;

import com.example.ajml.validation.CompilationException;
import com.example.ajml.validation.DiagnosticCode;
import com.example.ajml.validation.expression.ConditionExpression.Attribute;
import com.example.ajml.validation.expression.ConditionExpression.Binary;
import com.example.ajml.validation.expression.ConditionExpression.BooleanOperation;
import com.example.ajml.validation.expression.ConditionExpression.Call;
import com.example.ajml.validation.expression.ConditionExpression.Comparison;
import com.example.ajml.validation.expression.ConditionExpression.Dict;
import com.example.ajml.validation.expression.ConditionExpression.Literal;
import com.example.ajml.validation.expression.ConditionExpression.Name;
import com.example.ajml.validation.expression.ConditionExpression.Sequence;
import com.example.ajml.validation.expression.ConditionExpression.Subscript;
import com.example.ajml.validation.expression.ConditionExpression.Unary;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks edge conditions and prompt placeholders without evaluating anything.
 * <p>
 * A condition may only reference {@code state} and a handful of builtins; attribute names starting
 * with an underscore are treated as unbound names as well.
 * </p>
 */
public final class ConditionExpressionValidator {

    public static final Set<String> ALLOWED_NAMES = Set.of(
            "state", "len", "any", "all", "abs", "min", "max", "str", "int", "float", "bool",
            "True", "False", "None");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]*)}");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private ConditionExpressionValidator() {
    }

    /**
     * Parses and checks one condition. Throws {@link CompilationException} with E503 for text outside
     * the grammar and E501 for the first disallowed name in source order.
     */
    public static ConditionExpression validate(String condition, String file, int line) {
        ConditionExpression expression;
        try {
            expression = ConditionParser.parse(condition);
        } catch (ExpressionSyntaxException e) {
            throw new CompilationException(DiagnosticCode.INVALID_EXPRESSION_SYNTAX,
                    "Invalid condition expression `" + condition + "`: " + e.getMessage() + ".", file, line);
        }
        for (String name : referencedNames(expression)) {
            if (!ALLOWED_NAMES.contains(name)) {
                throw new CompilationException(DiagnosticCode.UNBOUND_NAME,
                        "Condition expression references undefined name `" + name
                                + "`. Only `state` and allowed builtins are available.", file, line);
            }
        }
        return expression;
    }

    /**
     * Names a condition touches, in source order: bare identifiers plus underscore-prefixed attribute
     * names. Keyword argument names are not references.
     */
    public static List<String> referencedNames(ConditionExpression root) {
        List<String> names = new ArrayList<>();
        Deque<ConditionExpression> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            ConditionExpression expression = pending.pop();
            if (expression instanceof Name name) {
                names.add(name.id());
            } else if (expression instanceof Attribute attribute && attribute.name().startsWith("_")) {
                names.add(attribute.name());
            }
            pushAll(pending, children(expression));
        }
        return names;
    }

    /**
     * State fields read through {@code state.get('f')}, {@code state['f']} or {@code state.f}.
     */
    public static List<String> stateReads(ConditionExpression root) {
        List<String> fields = new ArrayList<>();
        Deque<ConditionExpression> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            ConditionExpression expression = pending.pop();
            if (expression instanceof Subscript subscript && isState(subscript.target())
                    && subscript.index() instanceof Literal key) {
                fields.add(unquote(key.text()));
            } else if (expression instanceof Call call && call.callee() instanceof Attribute method
                    && isState(method.target()) && method.name().equals("get")
                    && !call.arguments().isEmpty() && call.arguments().get(0) instanceof Literal key) {
                fields.add(unquote(key.text()));
            } else if (expression instanceof Attribute attribute && isState(attribute.target())
                    && !attribute.name().equals("get")) {
                fields.add(attribute.name());
            }
            pushAll(pending, children(expression));
        }
        return fields;
    }

    /**
     * Checks every {@code ${...}} placeholder of a prompt template and returns the referenced names in
     * order. An unterminated {@code ${} or a non-identifier placeholder yields E502.
     */
    public static List<String> validatePromptPlaceholders(String template, String nodeId, String file, int line) {
        List<String> names = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        int consumed = 0;
        while (matcher.find()) {
            checkNoStrayOpening(template.substring(consumed, matcher.start()), nodeId, file, line);
            String name = matcher.group(1).trim();
            if (!IDENTIFIER.matcher(name).matches()) {
                throw new CompilationException(DiagnosticCode.INVALID_INTERPOLATION,
                        "Invalid interpolation `${" + matcher.group(1) + "}` in system prompt of node `"
                                + nodeId + "`. Use `${field_name}`.", file, line);
            }
            names.add(name);
            consumed = matcher.end();
        }
        checkNoStrayOpening(template.substring(consumed), nodeId, file, line);
        return names;
    }

    private static void checkNoStrayOpening(String segment, String nodeId, String file, int line) {
        if (segment.contains("${")) {
            throw new CompilationException(DiagnosticCode.INVALID_INTERPOLATION,
                    "Unterminated interpolation in system prompt of node `" + nodeId + "`.", file, line);
        }
    }

    private static boolean isState(ConditionExpression expression) {
        return expression instanceof Name name && name.id().equals("state");
    }

    private static String unquote(String literal) {
        if (literal.length() >= 2 && (literal.startsWith("'") || literal.startsWith("\""))) {
            return literal.substring(1, literal.length() - 1);
        }
        return literal;
    }

    private static List<ConditionExpression> children(ConditionExpression expression) {
        if (expression instanceof Attribute attribute) {
            return List.of(attribute.target());
        }
        if (expression instanceof Call call) {
            List<ConditionExpression> children = new ArrayList<>();
            children.add(call.callee());
            children.addAll(call.arguments());
            call.keywords().forEach(k -> children.add(k.value()));
            return children;
        }
        if (expression instanceof Subscript subscript) {
            return List.of(subscript.target(), subscript.index());
        }
        if (expression instanceof Unary unary) {
            return List.of(unary.operand());
        }
        if (expression instanceof Binary binary) {
            return List.of(binary.left(), binary.right());
        }
        if (expression instanceof Comparison comparison) {
            List<ConditionExpression> children = new ArrayList<>();
            children.add(comparison.left());
            children.addAll(comparison.operands());
            return children;
        }
        if (expression instanceof BooleanOperation operation) {
            return operation.operands();
        }
        if (expression instanceof Sequence sequence) {
            return sequence.elements();
        }
        if (expression instanceof Dict dict) {
            List<ConditionExpression> children = new ArrayList<>();
            for (int i = 0; i < dict.keys().size(); i++) {
                children.add(dict.keys().get(i));
                children.add(dict.values().get(i));
            }
            return children;
        }
        return List.of();
    }

    private static void pushAll(Deque<ConditionExpression> pending, List<ConditionExpression> expressions) {
        for (int i = expressions.size() - 1; i >= 0; i--) {
            pending.push(expressions.get(i));
        }
    }
}
