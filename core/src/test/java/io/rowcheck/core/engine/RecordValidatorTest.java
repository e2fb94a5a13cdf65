package io.rowcheck.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rowcheck.core.model.Row;
import io.rowcheck.core.model.Schema;
import io.rowcheck.core.model.ValidationOutcome;
import io.rowcheck.core.schema.SchemaReader;
import io.rowcheck.core.schema.SchemaValidator;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Record validation")
class RecordValidatorTest {

    private static Schema schema(String yaml) {
        return new SchemaValidator()
                .validate(new SchemaReader().read(yaml, "inline.yaml").orElseThrow(), "inline.yaml")
                .orElseThrow();
    }

    private static RecordValidator validatorFor(String yaml) {
        return RecordValidator.builder().schema(schema(yaml)).build();
    }

    @Nested
    @DisplayName("Field count")
    class FieldCount {

        @Test
        @DisplayName("First record fixes the contract; a later mismatch cites both counts")
        void firstRecord_fixesContract() {
            RecordValidator validator = RecordValidator.builder().build();

            assertThat(validator.expectedFieldCount()).isEmpty();
            assertThat(validator.checkFieldCount(4).valid()).isTrue();
            assertThat(validator.expectedFieldCount()).hasValue(4);

            ValidationOutcome outcome = validator.checkFieldCount(5);

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.diagnostic()).contains("4").contains("5");
            assertThat(validator.expectedFieldCount()).hasValue(4);
        }

        @Test
        @DisplayName("Configured count: 2 fields against 3 expected")
        void configuredCount_mismatch() {
            RecordValidator validator =
                    RecordValidator.builder().expectedFieldCount(3).build();

            ValidationOutcome outcome = validator.checkFieldCount(2);

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.diagnostic()).isEqualTo("bad field count - should be 3 but is: 2");
            assertThat(validator.lastError()).isEqualTo(outcome.diagnostic());
        }

        @Test
        @DisplayName("A matching count clears the previous diagnostic")
        void match_clearsLastError() {
            RecordValidator validator =
                    RecordValidator.builder().expectedFieldCount(2).build();

            validator.checkFieldCount(1);
            assertThat(validator.lastError()).isNotNull();

            assertThat(validator.checkFieldCount(2).valid()).isTrue();
            assertThat(validator.lastError()).isNull();
        }

        @Test
        void configuredCount_mustBePositive() {
            assertThatThrownBy(() -> RecordValidator.builder().expectedFieldCount(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("A count failure skips the schema checks")
        void countFailure_skipsSchema() {
            RecordValidator validator = RecordValidator.builder()
                    .schema(schema("items:\n  - numericKind: integer\n  - {}\n  - {}\n"))
                    .expectedFieldCount(3)
                    .build();

            ValidationOutcome outcome = validator.validate(Row.of(1, List.of("abc", "x")));

            assertThat(outcome.diagnostic()).isEqualTo("bad field count - should be 3 but is: 2");
        }
    }

    @Nested
    @DisplayName("Numeric type")
    class NumericType {

        @Test
        @DisplayName("Non-integer value names the numericKind check and the value")
        void notAnInteger() {
            RecordValidator validator = validatorFor("items:\n  - numericKind: integer\n");

            ValidationOutcome outcome = validator.checkSchema(List.of("abc"));

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.diagnostic())
                    .isEqualTo("field 0 failed numericKind:integer check with value: abc");
        }

        @Test
        @DisplayName("Diagnostic includes the title when present")
        void titledField() {
            RecordValidator validator =
                    validatorFor("items:\n  - {}\n  - title: price\n    numericKind: float\n");

            ValidationOutcome outcome = validator.checkSchema(List.of("x", "cheap"));

            assertThat(outcome.diagnostic())
                    .isEqualTo("field 1 (price) failed numericKind:float check with value: cheap");
        }

        @Test
        @DisplayName("Float columns accept integers and decimals")
        void floatAcceptsNumbers() {
            RecordValidator validator = validatorFor("items:\n  - numericKind: float\n");

            assertThat(validator.checkSchema(List.of("3")).valid()).isTrue();
            assertThat(validator.checkSchema(List.of("3.25")).valid()).isTrue();
            assertThat(validator.checkSchema(List.of("-1e2")).valid()).isTrue();
        }

        @Test
        @DisplayName("Record shorter than the schema reports a delimiter problem, not a type error")
        void shortRecord_delimiterDiagnostic() {
            RecordValidator validator =
                    validatorFor("items:\n  - {}\n  - title: qty\n    numericKind: integer\n");

            ValidationOutcome outcome = validator.checkSchema(List.of("1;2"));

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.diagnostic())
                    .contains("field 1 (qty) is missing")
                    .contains("delimiter")
                    .doesNotContain("numericKind");
        }

        @Test
        @DisplayName("Only the first failing column is reported")
        void firstFailureOnly() {
            RecordValidator validator =
                    validatorFor("items:\n  - numericKind: integer\n  - numericKind: integer\n");

            ValidationOutcome outcome = validator.checkSchema(List.of("one", "two"));

            assertThat(outcome.diagnostic()).contains("field 0").doesNotContain("field 1");
        }

        @Test
        @DisplayName("A string numericKind performs no coercion")
        void stringKind_noCheck() {
            RecordValidator validator = validatorFor("items:\n  - numericKind: string\n");

            assertThat(validator.checkSchema(List.of("anything")).valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("Numeric range")
    class NumericRange {

        @Test
        @DisplayName("Value below numericMinimum: -5 against 0")
        void belowMinimum() {
            RecordValidator validator =
                    validatorFor("items:\n  - numericKind: integer\n    numericMinimum: 0\n");

            ValidationOutcome outcome = validator.checkSchema(List.of("-5"));

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.diagnostic()).contains("numericMinimum").contains("-5");
        }

        @Test
        @DisplayName("Value above numericMaximum")
        void aboveMaximum() {
            RecordValidator validator =
                    validatorFor("items:\n  - numericKind: float\n    numericMaximum: 2.5\n");

            ValidationOutcome outcome = validator.checkSchema(List.of("2.51"));

            assertThat(outcome.diagnostic()).isEqualTo("field 0 failed numericMaximum:2.5 check with value: 2.51");
        }

        @Test
        @DisplayName("Limits are inclusive")
        void limitsInclusive() {
            RecordValidator validator = validatorFor(
                    "items:\n  - numericKind: integer\n    numericMinimum: 1\n    numericMaximum: 10\n");

            assertThat(validator.checkSchema(List.of("1")).valid()).isTrue();
            assertThat(validator.checkSchema(List.of("10")).valid()).isTrue();
            assertThat(validator.checkSchema(List.of("11")).valid()).isFalse();
        }

        @Test
        @DisplayName("Type errors anywhere win over range errors")
        void typeBeforeRange() {
            RecordValidator validator = validatorFor(
                    "items:\n  - numericKind: integer\n    numericMaximum: 10\n  - numericKind: integer\n");

            ValidationOutcome outcome = validator.checkSchema(List.of("99", "abc"));

            assertThat(outcome.diagnostic()).contains("numericKind:integer").contains("abc");
        }
    }

    @Nested
    @DisplayName("Generic structural checks")
    class Structural {

        @Test
        @DisplayName("Enum violation is reported by the generic engine")
        void enumViolation() {
            RecordValidator validator = validatorFor("items:\n  - enum: [red, green]\n");

            ValidationOutcome outcome = validator.checkSchema(List.of("blue"));

            assertThat(outcome.valid()).isFalse();
            assertThat(outcome.diagnostic()).contains("enum");
        }

        @Test
        @DisplayName("Editing the schema's JSON views cannot change the accepted rules")
        void schemaViewsAreCopies() {
            Schema accepted = schema("items:\n  - maxLength: 3\n");

            accepted.rules().get(0).structural().put("maxLength", 0);
            ((ObjectNode) accepted.structuralSchema()).put("minItems", 5);
            RecordValidator validator = RecordValidator.builder().schema(accepted).build();

            assertThat(validator.checkSchema(List.of("ab")).valid()).isTrue();
            assertThat(accepted.rules().get(0).structural().get("maxLength").intValue()).isEqualTo(3);
            assertThat(accepted.structuralSchema().has("minItems")).isFalse();
        }

        @Test
        @DisplayName("Validators built from one schema share its compiled form")
        void compiledOnce() {
            Schema accepted = schema("items:\n  - maxLength: 3\n");

            RecordValidator first = RecordValidator.builder().schema(accepted).build();
            RecordValidator second = RecordValidator.builder().schema(accepted).build();

            assertThat(first.schema().orElseThrow().structuralValidator())
                    .isSameAs(second.schema().orElseThrow().structuralValidator());
            assertThat(second.checkSchema(List.of("abcd")).valid()).isFalse();
        }

        @Test
        @DisplayName("Pattern violation is reported by the generic engine")
        void patternViolation() {
            RecordValidator validator = validatorFor("items:\n  - pattern: \"^[A-Z]{3}$\"\n");

            assertThat(validator.checkSchema(List.of("ABC")).valid()).isTrue();
            assertThat(validator.checkSchema(List.of("abc")).valid()).isFalse();
        }

        @Test
        @DisplayName("maxLength is enforced on text")
        void maxLength() {
            RecordValidator validator = validatorFor("items:\n  - maxLength: 3\n");

            assertThat(validator.checkSchema(List.of("abcd")).valid()).isFalse();
        }

        @Test
        @DisplayName("blank: false rejects empty values")
        void blankFalse() {
            RecordValidator validator = validatorFor("items:\n  - blank: false\n");

            assertThat(validator.checkSchema(List.of("")).valid()).isFalse();
            assertThat(validator.checkSchema(List.of("x")).valid()).isTrue();
        }

        @Test
        @DisplayName("Blank values are allowed unless blank: false")
        void blankDefault() {
            RecordValidator validator = validatorFor("items:\n  - type: string\n");

            assertThat(validator.checkSchema(List.of("")).valid()).isTrue();
        }

        @Test
        @DisplayName("required: true needs the column to be present")
        void required() {
            RecordValidator validator = validatorFor("items:\n  - {}\n  - required: true\n");

            assertThat(validator.checkSchema(List.of("a")).valid()).isFalse();
            assertThat(validator.checkSchema(List.of("a", "b")).valid()).isTrue();
        }

        @Test
        @DisplayName("Numeric type failure in field 0 hides a structural failure in field 1")
        void numericBeforeStructural() {
            RecordValidator validator =
                    validatorFor("items:\n  - numericKind: integer\n  - enum: [red, green]\n");

            ValidationOutcome outcome = validator.checkSchema(List.of("abc", "blue"));

            assertThat(outcome.diagnostic())
                    .isEqualTo("field 0 failed numericKind:integer check with value: abc");
        }
    }

    @Nested
    @DisplayName("Full record sequence")
    class Sequence {

        private static final String PEOPLE = """
                items:
                  - title: id
                    numericKind: integer
                  - title: name
                    maxLength: 10
                  - title: age
                    numericKind: integer
                    numericMinimum: 0
                """;

        @Test
        @DisplayName("Valid record passes every check")
        void validRecord() {
            RecordValidator validator = validatorFor(PEOPLE);

            ValidationOutcome outcome = validator.validate(Row.of(1, List.of("1", "Ada", "36")));

            assertThat(outcome.valid()).isTrue();
            assertThat(validator.lastError()).isNull();
        }

        @Test
        @DisplayName("Header row is accepted without schema checks and fixes the field count")
        void headerRow() {
            RecordValidator validator = validatorFor(PEOPLE);

            ValidationOutcome header = validator.validate(new Row(1, List.of("id", "name", "age"), true));

            assertThat(header.valid()).isTrue();
            assertThat(validator.expectedFieldCount()).hasValue(3);
            assertThat(validator.validate(Row.of(2, List.of("1", "Ada"))).diagnostic())
                    .isEqualTo("bad field count - should be 3 but is: 2");
        }

        @Test
        @DisplayName("Validating the same record twice gives identical outcomes")
        void idempotent() {
            RecordValidator validator = validatorFor(PEOPLE);
            Row row = Row.of(1, List.of("1", "Ada", "-1"));

            ValidationOutcome first = validator.validate(row);
            String firstError = validator.lastError();
            ValidationOutcome second = validator.validate(row);

            assertThat(second).isEqualTo(first);
            assertThat(validator.lastError()).isEqualTo(firstError);
            assertThat(first.diagnostic()).contains("numericMinimum");
        }

        @Test
        @DisplayName("Without a schema only the field count is checked")
        void noSchema() {
            RecordValidator validator = RecordValidator.builder().build();

            assertThat(validator.schema()).isEmpty();
            assertThat(validator.validate(Row.of(1, List.of("a", "b"))).valid()).isTrue();
            assertThat(validator.validate(Row.of(2, List.of("not", "a", "number"))).valid()).isFalse();
            assertThat(validator.checkSchema(List.of("anything")).valid()).isTrue();
        }
    }
}
