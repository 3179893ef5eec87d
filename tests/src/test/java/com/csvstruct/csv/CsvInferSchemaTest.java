package com.csvstruct.csv;

import com.csvstruct.test.TestBase;
import com.csvstruct.test.TestCategories;
import com.csvstruct.types.BooleanType;
import com.csvstruct.types.DataType;
import com.csvstruct.types.DateType;
import com.csvstruct.types.DecimalType;
import com.csvstruct.types.DoubleType;
import com.csvstruct.types.IntegerType;
import com.csvstruct.types.LongType;
import com.csvstruct.types.NullType;
import com.csvstruct.types.StringType;
import com.csvstruct.types.TimestampType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CsvInferSchema.
 *
 * <p>Test ID prefix: TC-INFER-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Csv
@DisplayName("CsvInferSchema Tests")
public class CsvInferSchemaTest extends TestBase {

    private static CsvInferSchema infer(Map<String, String> options) {
        return new CsvInferSchema(new CsvOptions(options, true, "UTC"));
    }

    @Nested
    @DisplayName("Single Tokens")
    class SingleTokens {

        @ParameterizedTest(name = "''{0}'' infers {1}")
        @CsvSource({
            "1, INT",
            "-42, INT",
            "3000000000, BIGINT",
            "1.5, DOUBLE",
            "NaN, DOUBLE",
            "-Inf, DOUBLE",
            "2015-08-26, TIMESTAMP",
            "2015-08-26 18:00:00, TIMESTAMP",
            "true, BOOLEAN",
            "False, BOOLEAN",
            "abc, STRING"
        })
        @DisplayName("TC-INFER-001: Widening chain with default options")
        void testDefaultChain(String token, String expectedSql) {
            DataType type = infer(Map.of()).inferField(NullType.get(), token);

            assertThat(type.sql()).isEqualTo(expectedSql);
        }

        @Test
        @DisplayName("TC-INFER-002: prefersDecimal infers decimals before doubles")
        void testPrefersDecimal() {
            CsvInferSchema inference = infer(Map.of("prefersDecimal", "true"));

            assertThat(inference.inferField(NullType.get(), "1.50")).isEqualTo(new DecimalType(3, 2));
            assertThat(inference.inferField(NullType.get(), "12345678901234567890"))
                .isEqualTo(new DecimalType(20, 0));
        }

        @Test
        @DisplayName("TC-INFER-003: inferDate infers dates before timestamps")
        void testInferDate() {
            CsvInferSchema inference = infer(Map.of("inferDate", "true"));

            assertThat(inference.inferField(NullType.get(), "2015-08-26")).isEqualTo(DateType.get());
            assertThat(inference.inferField(NullType.get(), "2015-08-26T18:00:00Z"))
                .isEqualTo(TimestampType.get());
        }

        @Test
        @DisplayName("TC-INFER-004: Null tokens keep the type so far")
        void testNullToken() {
            CsvInferSchema inference = infer(Map.of("nullValue", "NA"));

            assertThat(inference.inferField(LongType.get(), "NA")).isEqualTo(LongType.get());
            assertThat(inference.inferField(IntegerType.get(), null)).isEqualTo(IntegerType.get());
        }

        @Test
        @DisplayName("TC-INFER-005: A wider type so far is never narrowed")
        void testNoNarrowing() {
            CsvInferSchema inference = infer(Map.of());

            assertThat(inference.inferField(DoubleType.get(), "1")).isEqualTo(DoubleType.get());
            assertThat(inference.inferField(StringType.get(), "1")).isEqualTo(StringType.get());
            assertThat(inference.inferField(BooleanType.get(), "1")).isEqualTo(StringType.get());
        }
    }

    @Nested
    @DisplayName("Records")
    class Records {

        @Test
        @DisplayName("TC-INFER-006: Merging records widens each column")
        void testMergeRecords() {
            CsvInferSchema inference = infer(Map.of());

            DataType[] types = inference.startType(3);
            types = inference.inferRowType(types, new String[] {"1", "x", ""});
            types = inference.inferRowType(types, new String[] {"2.5", "2", ""});

            assertThat(types).containsExactly(DoubleType.get(), StringType.get(), NullType.get());
            assertThat(inference.toStructType(types).sql())
                .isEqualTo("STRUCT<_c0: DOUBLE, _c1: STRING, _c2: STRING>");
        }

        @Test
        @DisplayName("TC-INFER-007: A wider record adds columns")
        void testWiderRecord() {
            CsvInferSchema inference = infer(Map.of());

            DataType[] types = inference.inferRowType(inference.startType(1), new String[] {"1", "true"});

            assertThat(types).containsExactly(IntegerType.get(), BooleanType.get());
        }
    }

    @Nested
    @DisplayName("Compatible Types")
    class CompatibleTypes {

        @Test
        @DisplayName("TC-INFER-008: Integral and floating combinations")
        void testNumeric() {
            assertThat(CsvInferSchema.compatibleType(IntegerType.get(), LongType.get())).contains(LongType.get());
            assertThat(CsvInferSchema.compatibleType(LongType.get(), DoubleType.get())).contains(DoubleType.get());
            assertThat(CsvInferSchema.compatibleType(new DecimalType(5, 2), IntegerType.get()))
                .contains(new DecimalType(12, 2));
        }

        @Test
        @DisplayName("TC-INFER-009: Dates widen to timestamps, unrelated types have no common type")
        void testTemporalAndIncompatible() {
            assertThat(CsvInferSchema.compatibleType(DateType.get(), TimestampType.get()))
                .contains(TimestampType.get());
            assertThat(CsvInferSchema.compatibleType(BooleanType.get(), IntegerType.get())).isEmpty();
            assertThat(CsvInferSchema.compatibleType(NullType.get(), BooleanType.get()))
                .contains(BooleanType.get());
        }
    }
}
