package com.csvstruct.csv;

import com.csvstruct.exception.AnalysisException;
import com.csvstruct.test.TestBase;
import com.csvstruct.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.ZoneId;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CsvOptions and ParseMode.
 *
 * <p>Test ID prefix: TC-CSV-OPT-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Csv
@DisplayName("CsvOptions Tests")
public class CsvOptionsTest extends TestBase {

    private static CsvOptions options(Map<String, String> params) {
        return new CsvOptions(params, true, "UTC");
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("TC-CSV-OPT-001: Default separator, quote, escape and null value")
        void testDefaults() {
            CsvOptions opts = options(Map.of());

            assertThat(opts.delimiter()).isEqualTo(',');
            assertThat(opts.quote()).isEqualTo('"');
            assertThat(opts.escape()).isEqualTo('\\');
            assertThat(opts.isCommentSet()).isFalse();
            assertThat(opts.nullValue()).isEmpty();
            assertThat(opts.nanValue()).isEqualTo("NaN");
            assertThat(opts.positiveInf()).isEqualTo("Inf");
            assertThat(opts.negativeInf()).isEqualTo("-Inf");
            assertThat(opts.parseMode()).isEqualTo(ParseMode.PERMISSIVE);
            assertThat(opts.lineSeparator()).isEmpty();
            assertThat(opts.quoteAll()).isFalse();
        }

        @Test
        @DisplayName("TC-CSV-OPT-002: Whitespace trimming defaults differ for read and write")
        void testWhitespaceDefaults() {
            CsvOptions opts = options(Map.of());

            assertThat(opts.ignoreLeadingWhiteSpaceInRead()).isFalse();
            assertThat(opts.ignoreTrailingWhiteSpaceInRead()).isFalse();
            assertThat(opts.ignoreLeadingWhiteSpaceInWrite()).isTrue();
            assertThat(opts.ignoreTrailingWhiteSpaceInWrite()).isTrue();
        }

        @Test
        @DisplayName("TC-CSV-OPT-003: Corrupt-record column falls back to the session default")
        void testCorruptColumnDefault() {
            CsvOptions opts = options(Map.of());

            assertThat(opts.columnNameOfCorruptRecord()).isEqualTo("_corrupt_record");
            assertThat(opts.corruptRecordColumnExplicit()).isFalse();

            CsvOptions explicit = options(Map.of("columnNameOfCorruptRecord", "bad"));
            assertThat(explicit.columnNameOfCorruptRecord()).isEqualTo("bad");
            assertThat(explicit.corruptRecordColumnExplicit()).isTrue();
        }
    }

    @Nested
    @DisplayName("Parsing Option Values")
    class ParsingValues {

        @ParameterizedTest(name = "sep ''{0}'' is char {1}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            ";|59",
            "\\t|9",
            "\\u0001|1"
        })
        @DisplayName("TC-CSV-OPT-004: Delimiter escapes")
        void testDelimiterEscapes(String sep, int expected) {
            assertThat((int) options(Map.of("sep", sep)).delimiter()).isEqualTo(expected);
        }

        @Test
        @DisplayName("TC-CSV-OPT-005: Option keys are case-insensitive")
        void testCaseInsensitiveKeys() {
            CsvOptions opts = options(Map.of("DELIMITER", ";", "NullValue", "-", "MODE", "failfast"));

            assertThat(opts.delimiter()).isEqualTo(';');
            assertThat(opts.nullValue()).isEqualTo("-");
            assertThat(opts.parseMode()).isEqualTo(ParseMode.FAIL_FAST);
        }

        @Test
        @DisplayName("TC-CSV-OPT-006: timeZone option overrides the session zone")
        void testTimeZoneOverride() {
            CsvOptions opts = options(Map.of("timeZone", "Asia/Tokyo"));

            assertThat(opts.zoneId()).isEqualTo(ZoneId.of("Asia/Tokyo"));
        }

        @Test
        @DisplayName("TC-CSV-OPT-007: Missing zone is reported when a zone is needed")
        void testMissingZone() {
            CsvOptions opts = new CsvOptions(Map.of(), true, null);

            assertThatThrownBy(opts::zoneId)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("time zone");
        }

        @Test
        @DisplayName("TC-CSV-OPT-008: with replaces one option")
        void testWith() {
            CsvOptions opts = options(Map.of("lineSep", "\n", "sep", ";"));

            CsvOptions replaced = opts.with("LINESEP", "|", "UTC", "_corrupt_record");

            assertThat(replaced.lineSeparator()).contains("|");
            assertThat(replaced.delimiter()).isEqualTo(';');
            assertThat(opts.lineSeparator()).contains("\n");
        }

        @Test
        @DisplayName("TC-CSV-OPT-009: Empty quote disables quoting")
        void testEmptyQuote() {
            assertThat(options(Map.of("quote", "")).quote()).isEqualTo(CsvOptions.NO_CHAR);
        }
    }

    @Nested
    @DisplayName("Invalid Values")
    class InvalidValues {

        @ParameterizedTest(name = "option {0}={1}")
        @CsvSource({
            "header, maybe",
            "quoteAll, 1",
            "mode, LENIENT",
            "timeZone, Mars/Olympus",
            "sep, ab",
            "quote, ab"
        })
        @DisplayName("TC-CSV-OPT-010: Invalid values raise INVALID_OPTION_VALUE")
        void testInvalidValues(String key, String value) {
            assertThatThrownBy(() -> options(Map.of(key, value)))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> assertThat(((AnalysisException) e).getErrorClass())
                    .isEqualTo("INVALID_OPTION_VALUE"));
        }

        @Test
        @DisplayName("TC-CSV-OPT-011: Empty lineSep is rejected")
        void testEmptyLineSep() {
            assertThatThrownBy(() -> options(Map.of("lineSep", "")))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("lineSep");
        }

        @Test
        @DisplayName("TC-CSV-OPT-012: Quote equal to the delimiter is rejected")
        void testQuoteEqualsDelimiter() {
            assertThatThrownBy(() -> options(Map.of("sep", ";", "quote", ";")))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Quote character");
        }

        @Test
        @DisplayName("TC-CSV-OPT-013: Unsupported backslash escape in the delimiter")
        void testUnsupportedDelimiterEscape() {
            assertThatThrownBy(() -> options(Map.of("sep", "\\x")))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Unsupported special character");
        }

        @ParameterizedTest(name = "{0} = {1}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "dateFormat|yyyy-MM-dd'",
            "timestampFormat|yyyy-MM-dd'T'HH:mm:ss{",
            "dateFormat|yyyy-MM-bb"
        })
        @DisplayName("TC-CSV-OPT-016: Invalid datetime patterns are rejected up front")
        void testInvalidDatetimePattern(String key, String pattern) {
            assertThatThrownBy(() -> options(Map.of(key, pattern)))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Invalid datetime pattern")
                .satisfies(e -> assertThat(((AnalysisException) e).getMessageParameters())
                    .containsEntry("option", key)
                    .containsEntry("value", pattern));
        }
    }

    @Nested
    @DisplayName("Parse Mode")
    class ParseModes {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"permissive", "PERMISSIVE", " Permissive "})
        @DisplayName("TC-CSV-OPT-014: Mode names are case-insensitive")
        void testModeNames(String name) {
            assertThat(ParseMode.fromString(name)).isEqualTo(ParseMode.PERMISSIVE);
        }

        @Test
        @DisplayName("TC-CSV-OPT-015: Mode option names and defaults")
        void testOptionNames() {
            assertThat(ParseMode.fromString(null)).isEqualTo(ParseMode.PERMISSIVE);
            assertThat(ParseMode.DROP_MALFORMED.optionName()).isEqualTo("DROPMALFORMED");
            assertThat(ParseMode.FAIL_FAST.toString()).isEqualTo("FAILFAST");
            assertThatThrownBy(() -> ParseMode.fromString("STRICT"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("STRICT");
        }
    }
}
