package com.csvstruct.expression;

import com.csvstruct.row.Row;
import com.csvstruct.test.TestBase;
import com.csvstruct.test.TestCategories;
import com.csvstruct.types.SchemaParser;
import com.csvstruct.types.StringType;
import com.csvstruct.types.StructType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Encodes rows with to_csv and decodes the text with from_csv.
 *
 * <p>Test ID prefix: TC-ROUNDTRIP-*
 */
@TestCategories.Tier2
@TestCategories.Integration
@TestCategories.Csv
@DisplayName("CSV Round Trip Tests")
public class CsvRoundTripTest extends TestBase {

    private static final StructType SCHEMA = SchemaParser.parse(
        "id BIGINT, name STRING, price DECIMAL(10,2), ratio DOUBLE, active BOOLEAN, day DATE, seen TIMESTAMP");

    private static Object roundTrip(Row row, Map<String, String> options) {
        StructsToCsv encode = new StructsToCsv(options, ColumnReference.of("s", 0, SCHEMA), "UTC");
        String csv = encode.eval(Row.of(row));

        CsvToStructs decode = new CsvToStructs(SCHEMA, options, ColumnReference.of("csv", 0, encode.dataType()),
            "UTC", null);
        return decode.eval(Row.of(csv));
    }

    @Test
    @DisplayName("TC-ROUNDTRIP-001: Scalars survive encode and decode")
    void testScalars() {
        Row row = Row.of(42L, "widget, large", new BigDecimal("19.99"), 0.25, true,
            LocalDate.of(2015, 8, 26), Instant.parse("2015-08-26T18:00:00.123Z"));

        logStep("Default options");
        assertThat(roundTrip(row, Map.of())).isEqualTo(row);

        logStep("Custom separator and quote");
        assertThat(roundTrip(row, Map.of("sep", ";", "quote", "'"))).isEqualTo(row);
    }

    @Test
    @DisplayName("TC-ROUNDTRIP-002: Null fields survive with a custom null value")
    void testNulls() {
        Row row = Row.of(1L, null, null, null, false, null, null);

        assertThat(roundTrip(row, Map.of("nullValue", "NA"))).isEqualTo(row);
    }

    @Test
    @DisplayName("TC-ROUNDTRIP-003: Embedded line breaks stay in one value")
    void testLineBreak() {
        Row row = Row.of(7L, "line one\nline two", new BigDecimal("0.00"), 1.0, false,
            LocalDate.of(2020, 2, 29), Instant.parse("2020-02-29T00:00:00Z"));

        assertThat(roundTrip(row, Map.of())).isEqualTo(row);
    }

    @Test
    @DisplayName("TC-ROUNDTRIP-004: Inferred schema of encoded text")
    void testInferEncoded() {
        StructsToCsv encode = new StructsToCsv(Map.of(),
            ColumnReference.of("s", 0, SchemaParser.parse("a INT, b DOUBLE, c STRING")), "UTC");
        String csv = encode.eval(Row.of(Row.of(1, 2.5, "x")));

        assertThat(new SchemaOfCsv(Literal.of(csv)).eval(null))
            .isEqualTo("STRUCT<_c0: INT, _c1: DOUBLE, _c2: STRING>");
    }

    @Test
    @DisplayName("TC-ROUNDTRIP-005: Backslashes survive decode and encode")
    void testBackslashes() {
        StructType schema = SchemaParser.parse("a INT, b STRING");
        CsvToStructs decode = new CsvToStructs(schema, Map.of(), ColumnReference.of("csv", 0, StringType.get()),
            "UTC", null);

        logStep("Decode raw text");
        assertThat(decode.eval(Row.of("1,C:\\temp"))).isEqualTo(Row.of(1, "C:\\temp"));
        assertThat(decode.eval(Row.of("1,\"C:\\temp\\x\""))).isEqualTo(Row.of(1, "C:\\temp\\x"));

        logStep("Encode then decode");
        Row row = Row.of(2, "\\d+ \"q\" C:\\temp\\");
        StructsToCsv encode = new StructsToCsv(Map.of(), ColumnReference.of("s", 0, schema), "UTC");
        assertThat(decode.eval(Row.of(encode.eval(Row.of(row))))).isEqualTo(row);
    }
}
