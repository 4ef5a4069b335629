package com.example.ajml.validation;

import com.example.ajml.domain.FieldType;
import com.example.ajml.domain.Reducer;
import com.example.ajml.domain.StateField;
import com.example.ajml.markup.MarkupReader;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("StateFieldValidator")
class StateFieldValidatorTest {

    private static StateField field(String attributes) {
        return StateFieldValidator.validate(MarkupReader.read("<field " + attributes + " />"), "agent.ajml");
    }

    private static DiagnosticCode failure(String attributes) {
        return assertThrows(CompilationException.class, () -> field(attributes)).getCode();
    }

    @Test
    @DisplayName("defaults to the overwrite reducer and exposed")
    void defaults() {
        StateField field = field("name=\"title\" type=\"string\"");
        assertEquals(FieldType.STRING, field.type());
        assertEquals(Reducer.OVERWRITE, field.reducer());
        assertThat(field.expose()).isTrue();
    }

    @ParameterizedTest(name = "{0} accepts {1}")
    @CsvSource({
            "string, concat",
            "int, add",
            "float, add",
            "list[dict], append",
            "dict[string], merge",
            "bool, overwrite"
    })
    @DisplayName("accepts the reducers the base type allows")
    void allowedReducers(String type, String reducer) {
        StateField field = field("name=\"f\" type=\"" + type + "\" reducer=\"" + reducer + "\"");
        assertEquals(reducer, field.reducer().token());
    }

    @ParameterizedTest(name = "{0} rejects {1}")
    @CsvSource({
            "string, append",
            "bool, add",
            "list, merge",
            "dict, concat",
            "int, sum"
    })
    @DisplayName("E108 for reducers the type does not allow, never downgraded to overwrite")
    void illegalReducers(String type, String reducer) {
        assertEquals(DiagnosticCode.INVALID_REDUCER, failure("name=\"f\" type=\"" + type + "\" reducer=\"" + reducer + "\""));
    }

    @Test
    @DisplayName("E107 for an unknown type")
    void unknownType() {
        assertEquals(DiagnosticCode.INVALID_FIELD_TYPE, failure("name=\"f\" type=\"text\""));
    }

    @Test
    @DisplayName("E202 checked before the reducer")
    void requiredWithDefaultFirst() {
        assertEquals(DiagnosticCode.REQUIRED_WITH_DEFAULT,
                failure("name=\"f\" type=\"string\" required=\"true\" default=\"x\" reducer=\"add\""));
    }

    @Test
    @DisplayName("E107 for an enum without values")
    void enumWithoutValues() {
        assertEquals(DiagnosticCode.INVALID_FIELD_TYPE, failure("name=\"mood\" type=\"enum\""));
    }

    @Test
    @DisplayName("E109 for an enum default outside its values")
    void enumDefaultOutsideValues() {
        CompilationException ex = assertThrows(CompilationException.class,
                () -> field("name=\"mood\" type=\"enum\" values=\"happy, sad\" default=\"angry\""));
        assertEquals(DiagnosticCode.ENUM_DEFAULT_NOT_IN_VALUES, ex.getCode());
        assertThat(ex.getDiagnostic().message()).contains("happy, sad");
    }

    @Test
    @DisplayName("reads enum values and the expose flag")
    void enumField() {
        StateField field = field("name=\"mood\" type=\"enum\" values=\"happy,sad\" default=\"sad\" expose=\"false\"");
        assertThat(field.enumValues()).containsExactly("happy", "sad");
        assertEquals("sad", field.defaultValue());
        assertFalse(field.expose());
    }
}
