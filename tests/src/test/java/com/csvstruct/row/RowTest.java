package com.csvstruct.row;

import com.csvstruct.test.TestBase;
import com.csvstruct.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Row and RowBuilder.
 *
 * <p>Test ID prefix: TC-ROW-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Row Tests")
public class RowTest extends TestBase {

    @Test
    @DisplayName("TC-ROW-001: Rows compare by value, including byte arrays")
    void testDeepEquality() {
        Row left = Row.of(1, "x", new byte[] {1, 2});
        Row right = Row.of(1, "x", new byte[] {1, 2});

        assertThat(left).isEqualTo(right);
        assertThat(left.hashCode()).isEqualTo(right.hashCode());
        assertThat(left).isNotEqualTo(Row.of(1, "y", new byte[] {1, 2}));
    }

    @Test
    @DisplayName("TC-ROW-002: Null row has every slot null")
    void testNullRow() {
        Row row = Row.nullRow(3);

        assertThat(row.size()).isEqualTo(3);
        assertThat(row.allNull()).isTrue();
        assertThat(row.isNullAt(2)).isTrue();
    }

    @Test
    @DisplayName("TC-ROW-003: toString lists values without spaces")
    void testToString() {
        assertThat(Row.of(1, 0.8).toString()).isEqualTo("[1,0.8]");
        assertThat(Row.fromList(Arrays.asList(null, "a")).toString()).isEqualTo("[null,a]");
    }

    @Test
    @DisplayName("TC-ROW-004: values view is read-only")
    void testValuesReadOnly() {
        Row row = Row.of("a", "b");

        assertThatThrownBy(() -> row.values().set(0, "z"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("TC-ROW-005: Builder produces a row once")
    void testBuilder() {
        RowBuilder builder = new RowBuilder(2).set(0, "a").set(1, 7);

        assertThat(builder.build()).isEqualTo(Row.of("a", 7));
        assertThatThrownBy(builder::build)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already built");
    }
}
