package com.csvstruct.csv;

import java.util.Locale;

/**
 * Policy for records that cannot be parsed.
 *
 * <ul>
 *   <li>{@code PERMISSIVE} (default): a malformed record becomes a row of nulls; the raw
 *       text is kept in the corrupt-record column when one is configured</li>
 *   <li>{@code DROPMALFORMED}: malformed records are dropped. The single-value codecs
 *       reject it since they must always produce a row</li>
 *   <li>{@code FAILFAST}: the first malformed record aborts the operation</li>
 * </ul>
 */
public enum ParseMode {

    PERMISSIVE("PERMISSIVE"),
    DROP_MALFORMED("DROPMALFORMED"),
    FAIL_FAST("FAILFAST");

    private final String optionName;

    ParseMode(String optionName) {
        this.optionName = optionName;
    }

    /**
     * Returns the option value naming this mode.
     *
     * @return the name used in the {@code mode} option
     */
    public String optionName() {
        return optionName;
    }

    /**
     * Parse a mode name (case-insensitive).
     *
     * @param value "PERMISSIVE", "DROPMALFORMED" or "FAILFAST"
     * @return the parsed mode, {@code PERMISSIVE} for null
     * @throws IllegalArgumentException if value is not recognized
     */
    public static ParseMode fromString(String value) {
        if (value == null) {
            return PERMISSIVE;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "PERMISSIVE" -> PERMISSIVE;
            case "DROPMALFORMED" -> DROP_MALFORMED;
            case "FAILFAST" -> FAIL_FAST;
            default -> throw new IllegalArgumentException(
                "Unknown parse mode: '%s'. Valid values: PERMISSIVE, DROPMALFORMED, FAILFAST".formatted(value));
        };
    }

    @Override
    public String toString() {
        return optionName;
    }
}
