package com.csvstruct.csv;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

/**
 * Date and timestamp conversions driven by {@link CsvOptions}.
 *
 * <p>Dates use {@code dateFormat} (default {@code yyyy-MM-dd}) in both directions.
 * Timestamps are parsed with {@code timestampFormat} when set, otherwise with a lenient
 * ISO-8601 parser that accepts a {@code T} or space separator, optional seconds,
 * up to nine fractional digits and an optional offset. Values without an offset are
 * interpreted in the options' zone. Timestamps are written with {@code timestampFormat}
 * or {@code yyyy-MM-dd'T'HH:mm:ss.SSSXXX}.
 */
public final class TemporalFormatters {

    private static final DateTimeFormatter LENIENT_TIMESTAMP = new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
            .optionalStart()
                .appendLiteral(':')
                .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
                .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .optionalEnd()
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
        .optionalEnd()
        .toFormatter(Locale.US);

    private final DateTimeFormatter dateFormatter;
    private final DateTimeFormatter timestampParser;
    private final DateTimeFormatter timestampWriter;
    private final CsvOptions options;

    public TemporalFormatters(CsvOptions options) {
        this.options = options;
        Locale locale = options.locale();
        this.dateFormatter = DateTimeFormatter.ofPattern(
            options.dateFormat().orElse(CsvOptions.DEFAULT_DATE_FORMAT), locale);
        this.timestampParser = options.timestampFormat()
            .map(pattern -> DateTimeFormatter.ofPattern(pattern, locale))
            .orElse(LENIENT_TIMESTAMP);
        this.timestampWriter = DateTimeFormatter.ofPattern(
            options.timestampFormat().orElse(CsvOptions.DEFAULT_TIMESTAMP_WRITE_FORMAT), locale);
    }

    /**
     * Parses a date.
     *
     * @param text the date text
     * @return the date
     * @throws java.time.format.DateTimeParseException if the text does not match the date format
     */
    public LocalDate parseDate(String text) {
        return LocalDate.parse(text, dateFormatter);
    }

    public String formatDate(LocalDate date) {
        return dateFormatter.format(date);
    }

    /**
     * Parses a timestamp. Text without an offset is read in the configured zone, and
     * text without a time of day is read as the start of that day.
     *
     * @param text the timestamp text
     * @return the instant
     * @throws java.time.DateTimeException if the text cannot be parsed
     */
    public Instant parseTimestamp(String text) {
        TemporalAccessor parsed = timestampParser.parseBest(text,
            ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
        ZoneId zone = options.zoneId();
        if (parsed instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (parsed instanceof LocalDateTime local) {
            return local.atZone(zone).toInstant();
        }
        return ((LocalDate) parsed).atStartOfDay(zone).toInstant();
    }

    public String formatTimestamp(Instant instant) {
        return timestampWriter.withZone(options.zoneId()).format(instant);
    }
}
