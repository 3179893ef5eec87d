package com.csvstruct.types;

import com.csvstruct.test.TestBase;
import com.csvstruct.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaParser.
 *
 * <p>Covers the DDL column list form used by {@code from_csv}, the
 * {@code struct<...>} form and the JSON form.
 *
 * <p>Test ID prefix: TC-SCHEMA-PARSER-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.TypeMapping
@DisplayName("SchemaParser Tests")
public class SchemaParserTest extends TestBase {

    // ==================== DDL Parsing ====================

    @Nested
    @DisplayName("DDL Parsing")
    class DdlParsing {

        @Test
        @DisplayName("TC-SCHEMA-PARSER-001: Parse DDL column list")
        void testParseDdlColumnList() {
            StructType schema = SchemaParser.parse("a INT, b DOUBLE");

            assertThat(schema.fieldNames()).containsExactly("a", "b");
            assertThat(schema.fieldAt(0).dataType()).isEqualTo(IntegerType.get());
            assertThat(schema.fieldAt(1).dataType()).isEqualTo(DoubleType.get());
            assertThat(schema.fieldAt(0).nullable()).isTrue();
        }

        @Test
        @DisplayName("TC-SCHEMA-PARSER-002: NOT NULL marks a field non-nullable")
        void testNotNull() {
            StructType schema = SchemaParser.parse("id BIGINT NOT NULL, name STRING");

            assertThat(schema.fieldAt(0).dataType()).isEqualTo(LongType.get());
            assertThat(schema.fieldAt(0).nullable()).isFalse();
            assertThat(schema.fieldAt(1).nullable()).isTrue();
        }

        @Test
        @DisplayName("TC-SCHEMA-PARSER-003: Back-quoted names may contain spaces and commas")
        void testQuotedNames() {
            StructType schema = SchemaParser.parse("`first name` STRING, `a,b` INT");

            assertThat(schema.fieldNames()).containsExactly("first name", "a,b");
        }

        @Test
        @DisplayName("TC-SCHEMA-PARSER-004: toDDL output parses back to an equal schema")
        void testToDdlParsesBack() {
            StructType original = SchemaParser.parse(
                "a INT NOT NULL, `odd name` DECIMAL(10,2), tags ARRAY<STRING>, m MAP<STRING, INT>");

            StructType reparsed = SchemaParser.parse(original.toDDL());

            assertThat(reparsed).isEqualTo(original);
        }

        @Test
        @DisplayName("TC-SCHEMA-PARSER-005: sql() output parses back to an equal schema")
        void testSqlParsesBack() {
            StructType original = SchemaParser.parse("a INT, inner STRUCT<x: DATE, y: TIMESTAMP>");

            assertThat(SchemaParser.parse(original.sql())).isEqualTo(original);
        }
    }

    // ==================== Struct Format ====================

    @Nested
    @DisplayName("Struct Format")
    class StructFormat {

        @Test
        @DisplayName("TC-SCHEMA-PARSER-006: Parse struct with colon separators")
        void testStructFormat() {
            StructType schema = SchemaParser.parse("struct<id:int,name:string>");

            assertThat(schema.size()).isEqualTo(2);
            assertThat(schema.fieldAt(1).dataType()).isEqualTo(StringType.get());
        }

        @Test
        @DisplayName("TC-SCHEMA-PARSER-007: Empty struct parses to an empty schema")
        void testEmptyStruct() {
            assertThat(SchemaParser.parse("struct<>")).isEqualTo(StructType.EMPTY);
        }

        @Test
        @DisplayName("TC-SCHEMA-PARSER-008: Nested containers")
        void testNestedContainers() {
            StructType schema = SchemaParser.parse("struct<groups:map<string,array<int>>>");

            MapType mapType = (MapType) schema.fieldAt(0).dataType();
            assertThat(mapType.keyType()).isEqualTo(StringType.get());
            assertThat(((ArrayType) mapType.valueType()).elementType()).isEqualTo(IntegerType.get());
        }
    }

    // ==================== Type Aliases ====================

    @Nested
    @DisplayName("Type Aliases")
    class TypeAliases {

        @ParameterizedTest(name = "Type {0} parses to IntegerType")
        @ValueSource(strings = {"int", "integer", "INT"})
        @DisplayName("TC-SCHEMA-PARSER-009: Integer aliases")
        void testIntegerAliases(String typeName) {
            assertThat(SchemaParser.parseDataType(typeName)).isEqualTo(IntegerType.get());
        }

        @ParameterizedTest(name = "Type {0} parses to StringType")
        @ValueSource(strings = {"string", "varchar", "varchar(20)", "char(3)", "text"})
        @DisplayName("TC-SCHEMA-PARSER-010: String aliases")
        void testStringAliases(String typeName) {
            assertThat(SchemaParser.parseDataType(typeName)).isEqualTo(StringType.get());
        }

        @Test
        @DisplayName("TC-SCHEMA-PARSER-011: Decimal with and without precision")
        void testDecimal() {
            assertThat(SchemaParser.parseDataType("decimal(10,2)")).isEqualTo(new DecimalType(10, 2));
            assertThat(SchemaParser.parseDataType("numeric(18)")).isEqualTo(new DecimalType(18, 0));
            assertThat(SchemaParser.parseDataType("decimal")).isEqualTo(DecimalType.USER_DEFAULT);
        }

        @Test
        @DisplayName("TC-SCHEMA-PARSER-012: Variant and void")
        void testVariantAndVoid() {
            assertThat(SchemaParser.parseDataType("variant")).isEqualTo(VariantType.get());
            assertThat(SchemaParser.parseDataType("void")).isEqualTo(NullType.get());
        }
    }

    // ==================== JSON Format ====================

    @Nested
    @DisplayName("JSON Format")
    class JsonFormat {

        @Test
        @DisplayName("TC-SCHEMA-PARSER-013: Parse JSON struct schema")
        void testJsonSchema() {
            String json = "{\"type\":\"struct\",\"fields\":["
                + "{\"name\":\"id\",\"type\":\"integer\",\"nullable\":false},"
                + "{\"name\":\"tags\",\"type\":{\"type\":\"array\",\"elementType\":\"string\",\"containsNull\":true}}"
                + "]}";

            StructType schema = SchemaParser.parse(json);

            assertThat(schema.fieldNames()).containsExactly("id", "tags");
            assertThat(schema.fieldAt(0).nullable()).isFalse();
            assertThat(schema.fieldAt(1).dataType()).isEqualTo(new ArrayType(StringType.get(), true));
        }

        @Test
        @DisplayName("TC-SCHEMA-PARSER-014: Malformed JSON is rejected")
        void testMalformedJson() {
            assertThatThrownBy(() -> SchemaParser.parse("{\"type\":"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to parse JSON schema");
        }
    }

    // ==================== Error Handling ====================

    @Nested
    @DisplayName("Error Handling")
    class ErrorHandling {

        @Test
        @DisplayName("TC-SCHEMA-PARSER-015: Null or blank schema string")
        void testNullOrBlank() {
            assertThatThrownBy(() -> SchemaParser.parse(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("null or empty");
            assertThatThrownBy(() -> SchemaParser.parse("   "))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("TC-SCHEMA-PARSER-016: Unknown type name")
        void testUnknownType() {
            assertThatThrownBy(() -> SchemaParser.parse("a FOO"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported type");
        }

        @Test
        @DisplayName("TC-SCHEMA-PARSER-017: Field without a type")
        void testFieldWithoutType() {
            assertThatThrownBy(() -> SchemaParser.parse("struct<invalid>"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid field definition");
        }

        @Test
        @DisplayName("TC-SCHEMA-PARSER-018: Unbalanced brackets")
        void testUnbalanced() {
            assertThatThrownBy(() -> SchemaParser.parse("a ARRAY<INT, b STRING"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
