package com.example.ajml.validation;

import com.example.ajml.domain.FieldType;
import com.example.ajml.domain.Reducer;
import com.example.ajml.domain.StateField;
import com.example.ajml.markup.MarkupElement;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Type and reducer rules for one {@code <field>} whose name already passed the uniqueness checks.
 * <p>
 * Checks run in a fixed order: type, required/default conflict, reducer, enum values, enum default.
 * An illegal reducer is always rejected, never replaced by {@code overwrite}.
 * </p>
 */
public final class StateFieldValidator {

    private StateFieldValidator() {
    }

    public static StateField validate(MarkupElement element, String file) {
        String name = element.attribute("name", "");
        String typeToken = element.attribute("type", "");
        boolean required = element.flag("required", false);
        String defaultValue = element.attribute("default");
        String reducerToken = element.attribute("reducer", Reducer.OVERWRITE.token());
        int line = element.line();

        FieldType type = FieldType.fromToken(typeToken)
                .orElseThrow(() -> new CompilationException(DiagnosticCode.INVALID_FIELD_TYPE,
                        "Invalid state field type `" + typeToken + "`. Must be a valid simple type, "
                                + "parameterised type, or enum.", file, line));

        if (required && defaultValue != null) {
            throw new CompilationException(DiagnosticCode.REQUIRED_WITH_DEFAULT,
                    "Required field `" + name + "` cannot have a default value.", file, line);
        }

        Reducer reducer = Reducer.fromToken(reducerToken)
                .filter(r -> type.allowedReducers().contains(r))
                .orElseThrow(() -> new CompilationException(DiagnosticCode.INVALID_REDUCER,
                        "Reducer `" + reducerToken + "` is not valid for type `" + typeToken + "` of field `" + name
                                + "`. Valid reducers: " + sortedTokens(type.allowedReducers()) + ".", file, line));

        List<String> enumValues = List.of();
        if (type == FieldType.ENUM) {
            enumValues = AttributeValues.csv(element.attribute("values"));
            if (enumValues.isEmpty()) {
                throw new CompilationException(DiagnosticCode.INVALID_FIELD_TYPE,
                        "Enum field `" + name + "` must have a `values` attribute.", file, line);
            }
            if (defaultValue != null && !defaultValue.isEmpty() && !enumValues.contains(defaultValue)) {
                throw new CompilationException(DiagnosticCode.ENUM_DEFAULT_NOT_IN_VALUES,
                        "Enum default value `" + defaultValue + "` is not in the declared values list: "
                                + String.join(", ", enumValues) + ".", file, line);
            }
        }

        return new StateField(name, type, required, defaultValue, reducer, element.flag("expose", true),
                enumValues, line);
    }

    private static String sortedTokens(Set<Reducer> reducers) {
        return reducers.stream().map(Reducer::token).sorted().collect(Collectors.joining(", "));
    }
}
