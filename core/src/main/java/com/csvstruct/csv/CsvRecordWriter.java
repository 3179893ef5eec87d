package com.csvstruct.csv;

import com.csvstruct.row.Row;
import com.csvstruct.types.ArrayType;
import com.csvstruct.types.BinaryType;
import com.csvstruct.types.DataType;
import com.csvstruct.types.DateType;
import com.csvstruct.types.DecimalType;
import com.csvstruct.types.MapType;
import com.csvstruct.types.StructType;
import com.csvstruct.types.TimestampType;
import com.csvstruct.types.UserDefinedType;
import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;

import java.io.CharArrayWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Writes rows of a fixed schema as CSV records.
 *
 * <p>Each field is rendered to text according to its type and the options, then the
 * fields are joined by opencsv with quoting and escaping applied. No line terminator
 * is written. Nested values render as {@code [a, b]} for arrays, {@code {k -> v}} for
 * maps and {@code {a, b}} for structs, with {@code null} for nested nulls. Top-level
 * nulls render as the {@code nullValue} option.
 *
 * <p>Not thread-safe: the buffer is reused across calls.
 */
public class CsvRecordWriter {

    @FunctionalInterface
    private interface ValueWriter {
        String write(Object value);
    }

    private final StructType schema;
    private final CharArrayWriter buffer;
    private final ICSVWriter csvWriter;
    private final CsvOptions options;
    private final TemporalFormatters temporal;
    private final ValueWriter[] fieldWriters;

    /**
     * Creates a writer.
     *
     * @param schema the schema of the rows to write
     * @param buffer the buffer records are written into
     * @param options the CSV options
     */
    public CsvRecordWriter(StructType schema, CharArrayWriter buffer, CsvOptions options) {
        this.schema = schema;
        this.buffer = buffer;
        this.options = options;
        this.temporal = new TemporalFormatters(options);
        this.csvWriter = new CSVWriterBuilder(buffer)
            .withSeparator(options.delimiter())
            .withQuoteChar(options.quote() == CsvOptions.NO_CHAR ? ICSVWriter.NO_QUOTE_CHARACTER : options.quote())
            .withEscapeChar(options.escape() == CsvOptions.NO_CHAR ? ICSVWriter.NO_ESCAPE_CHARACTER : options.escape())
            .withLineEnd("")
            .build();

        this.fieldWriters = new ValueWriter[schema.size()];
        for (int i = 0; i < schema.size(); i++) {
            fieldWriters[i] = makeWriter(schema.fieldAt(i).dataType());
        }
    }

    /**
     * Writes one row and returns the record text, leaving the buffer empty.
     *
     * @param row the row, aligned to the schema
     * @return the CSV record without a line terminator
     * @throws UncheckedIOException if the underlying writer fails
     */
    public String writeToString(Row row) {
        write(row);
        flush();
        String record = buffer.toString();
        buffer.reset();
        return record;
    }

    /**
     * Writes one row into the buffer.
     *
     * @param row the row, aligned to the schema
     */
    public void write(Row row) {
        if (row.size() != fieldWriters.length) {
            throw new IllegalArgumentException(
                "Row has " + row.size() + " values but the schema has " + fieldWriters.length + " fields");
        }
        String[] fields = new String[fieldWriters.length];
        for (int i = 0; i < fieldWriters.length; i++) {
            Object value = row.get(i);
            fields[i] = value == null ? options.nullValue() : trim(fieldWriters[i].write(value));
        }
        csvWriter.writeNext(fields, options.quoteAll());
    }

    public void flush() {
        try {
            csvWriter.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV record", e);
        }
        if (csvWriter.checkError()) {
            throw new UncheckedIOException(new IOException("Failed to write CSV record"));
        }
    }

    public StructType schema() {
        return schema;
    }

    private String trim(String text) {
        String result = text;
        if (options.ignoreLeadingWhiteSpaceInWrite()) {
            result = result.stripLeading();
        }
        if (options.ignoreTrailingWhiteSpaceInWrite()) {
            result = result.stripTrailing();
        }
        return result;
    }

    private ValueWriter makeWriter(DataType dataType) {
        if (dataType instanceof DateType) {
            return value -> temporal.formatDate((LocalDate) value);
        }
        if (dataType instanceof TimestampType) {
            return value -> temporal.formatTimestamp((Instant) value);
        }
        if (dataType instanceof DecimalType) {
            return value -> ((BigDecimal) value).toPlainString();
        }
        if (dataType instanceof BinaryType) {
            return value -> new String((byte[]) value, StandardCharsets.UTF_8);
        }
        if (dataType instanceof UserDefinedType<?> udt) {
            ValueWriter inner = makeWriter(udt.sqlType());
            return value -> {
                Object serialized = udt.serializeObject(value);
                return serialized == null ? "null" : inner.write(serialized);
            };
        }
        if (dataType instanceof ArrayType array) {
            ValueWriter element = makeWriter(array.elementType());
            return value -> {
                StringBuilder sb = new StringBuilder("[");
                Iterator<?> it = ((List<?>) value).iterator();
                while (it.hasNext()) {
                    appendNested(sb, it.next(), element);
                    if (it.hasNext()) {
                        sb.append(", ");
                    }
                }
                return sb.append(']').toString();
            };
        }
        if (dataType instanceof MapType map) {
            ValueWriter key = makeWriter(map.keyType());
            ValueWriter val = makeWriter(map.valueType());
            return value -> {
                StringBuilder sb = new StringBuilder("{");
                Iterator<? extends Map.Entry<?, ?>> it = ((Map<?, ?>) value).entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<?, ?> entry = it.next();
                    appendNested(sb, entry.getKey(), key);
                    sb.append(" -> ");
                    appendNested(sb, entry.getValue(), val);
                    if (it.hasNext()) {
                        sb.append(", ");
                    }
                }
                return sb.append('}').toString();
            };
        }
        if (dataType instanceof StructType struct) {
            ValueWriter[] nested = new ValueWriter[struct.size()];
            for (int i = 0; i < nested.length; i++) {
                nested[i] = makeWriter(struct.fieldAt(i).dataType());
            }
            return value -> {
                Row row = (Row) value;
                StringBuilder sb = new StringBuilder("{");
                for (int i = 0; i < nested.length; i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    appendNested(sb, row.get(i), nested[i]);
                }
                return sb.append('}').toString();
            };
        }
        return String::valueOf;
    }

    private static void appendNested(StringBuilder sb, Object value, ValueWriter writer) {
        sb.append(value == null ? "null" : writer.write(value));
    }
}
