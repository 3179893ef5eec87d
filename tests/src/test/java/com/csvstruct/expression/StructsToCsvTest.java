package com.csvstruct.expression;

import com.csvstruct.exception.AnalysisException;
import com.csvstruct.row.Row;
import com.csvstruct.test.TestBase;
import com.csvstruct.test.TestCategories;
import com.csvstruct.types.ArrayType;
import com.csvstruct.types.IntegerType;
import com.csvstruct.types.SchemaParser;
import com.csvstruct.types.StructType;
import com.csvstruct.types.TimestampType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the to_csv expression.
 *
 * <p>Test ID prefix: TC-TO-CSV-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("StructsToCsv Tests")
public class StructsToCsvTest extends TestBase {

    private static StructLiteralExpression namedStruct(Object... namesAndValues) {
        List<String> names = new ArrayList<>();
        List<Expression> values = new ArrayList<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            names.add((String) namesAndValues[i]);
            values.add((Expression) namesAndValues[i + 1]);
        }
        return new StructLiteralExpression(names, values);
    }

    @Nested
    @DisplayName("Encoding")
    class Encoding {

        @Test
        @DisplayName("TC-TO-CSV-001: Encode a struct literal")
        void testSimple() {
            StructsToCsv expr = new StructsToCsv(Map.of(),
                namedStruct("a", Literal.of(1), "b", Literal.of(2)), "UTC");

            assertThat(expr.eval(null)).isEqualTo("1,2");
        }

        @Test
        @DisplayName("TC-TO-CSV-002: Null struct gives a null result")
        void testNullStruct() {
            StructsToCsv expr = new StructsToCsv(Map.of(),
                Literal.nullValue(SchemaParser.parse("a INT")), "UTC");

            assertThat(expr.eval(null)).isNull();
        }

        @Test
        @DisplayName("TC-TO-CSV-003: Null fields use nullValue")
        void testNullField() {
            StructsToCsv expr = new StructsToCsv(Map.of("nullValue", "-"),
                namedStruct("a", Literal.nullValue(IntegerType.get()), "b", Literal.of("x")), "UTC");

            assertThat(expr.eval(null)).isEqualTo("-,x");
        }

        @Test
        @DisplayName("TC-TO-CSV-004: Options control separator and timestamp format")
        void testOptions() {
            Literal ts = new Literal(Instant.parse("2015-08-26T18:00:00Z"), TimestampType.get());
            StructsToCsv expr = new StructsToCsv(
                Map.of("sep", "|", "timestampFormat", "yyyy-MM-dd HH:mm", "timeZone", "Asia/Tokyo"),
                namedStruct("id", Literal.of(7L), "ts", ts), "UTC");

            assertThat(expr.eval(null)).isEqualTo("7|2015-08-27 03:00");
        }

        @Test
        @DisplayName("TC-TO-CSV-005: Arrays are rendered and quoted when needed")
        void testArrayField() {
            Literal array = new Literal(List.of(1, 2), new ArrayType(IntegerType.get()));
            StructsToCsv expr = new StructsToCsv(Map.of(), namedStruct("xs", array), "UTC");

            assertThat(expr.eval(null)).isEqualTo("\"[1, 2]\"");
        }

        @Test
        @DisplayName("TC-TO-CSV-006: Compiled evaluation matches interpreted evaluation")
        void testCompile() {
            StructType schema = SchemaParser.parse("a INT, b STRING");
            StructsToCsv expr = new StructsToCsv(Map.of(), ColumnReference.of("s", 0, schema), "UTC");
            CompiledExpression compiled = expr.compile();

            for (Row input : List.of(Row.of(Row.of(1, "x")), Row.of(Row.of(2, "a,b")), Row.of((Object) null))) {
                assertThat(compiled.evaluate(input)).isEqualTo(expr.eval(input));
            }
            assertThat(compiled.evaluate(Row.of(Row.of(2, "a,b")))).isEqualTo("2,\"a,b\"");
        }
    }

    @Nested
    @DisplayName("Checks")
    class Checks {

        @Test
        @DisplayName("TC-TO-CSV-007: Non-struct input fails the type check")
        void testNonStruct() {
            StructsToCsv expr = new StructsToCsv(Map.of(), Literal.of(1), "UTC");

            TypeCheckResult.DataTypeMismatch mismatch = (TypeCheckResult.DataTypeMismatch) expr.checkInputDataTypes();

            assertThat(mismatch.errorSubClass()).isEqualTo("UNSUPPORTED_INPUT_TYPE");
            assertThat(mismatch.messageParameters())
                .containsEntry("functionName", "`to_csv`")
                .containsEntry("dataType", "\"INT\"");
        }

        @Test
        @DisplayName("TC-TO-CSV-008: Variant fields fail the type check")
        void testVariantField() {
            StructsToCsv expr = new StructsToCsv(Map.of(),
                ColumnReference.of("s", 0, SchemaParser.parse("v VARIANT")), "UTC");

            TypeCheckResult result = expr.checkInputDataTypes();

            assertThat(result.isFailure()).isTrue();
            assertThat(((TypeCheckResult.DataTypeMismatch) result).messageParameters())
                .containsEntry("dataType", "\"STRUCT<v: VARIANT>\"");
        }

        @Test
        @DisplayName("TC-TO-CSV-009: Evaluation requires a time zone")
        void testUnbound() {
            StructsToCsv unbound = new StructsToCsv(Map.of(), namedStruct("a", Literal.of(1)));

            assertThatThrownBy(() -> unbound.eval(null)).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> unbound.compile().evaluate(null)).isInstanceOf(IllegalStateException.class);
            assertThat(unbound.withTimeZone("UTC").eval(null)).isEqualTo("1");
        }

        @Test
        @DisplayName("TC-TO-CSV-010: Result type, nullability and SQL")
        void testProperties() {
            StructsToCsv expr = new StructsToCsv(Map.of("sep", "|"),
                namedStruct("a", Literal.of(1), "b", Literal.of(2)), "UTC");

            assertThat(expr.dataType().sql()).isEqualTo("STRING");
            assertThat(expr.nullable()).isTrue();
            assertThat(expr.foldable()).isTrue();
            assertThat(expr.toSQL()).isEqualTo("to_csv(named_struct('a', 1, 'b', 2), map('sep', '|'))");
            assertThat(expr).isEqualTo(new StructsToCsv(Map.of("sep", "|"),
                namedStruct("a", Literal.of(1), "b", Literal.of(2)), "UTC"));
        }
    }

    @Test
    @DisplayName("TC-TO-CSV-011: Invalid timestamp format fails at construction")
    void testInvalidTimestampFormat() {
        assertThatThrownBy(() -> new StructsToCsv(Map.of("timestampFormat", "yyyy-MM-dd HH:mm:ss{"),
            namedStruct("a", Literal.of(1)), "UTC"))
            .isInstanceOf(AnalysisException.class)
            .hasMessageContaining("timestampFormat");
    }
}
