package com.csvstruct.csv;

import com.csvstruct.exception.AnalysisException;
import com.csvstruct.types.StringType;
import com.csvstruct.types.StructField;
import com.csvstruct.types.StructType;

import java.util.Map;
import java.util.Objects;

/**
 * Derives the schema views used by the CSV decoder and validates the
 * corrupt-record column against the declared schema.
 *
 * <p>Resolution is pure: resolving the same inputs twice yields equal results,
 * and resolving an already nullable schema leaves it unchanged.
 */
public final class SchemaResolver {

    private SchemaResolver() {}

    /**
     * Resolves the schema views for a decoder.
     *
     * @param declared the declared schema
     * @param requiredSchema the pruned output schema, or null to output every declared field
     * @param corruptColumnName the corrupt-record column name, may be null
     * @param explicitlyConfigured whether the name was set by an option rather than a session default
     * @return the resolved views
     * @throws AnalysisException if the corrupt-record column is invalid
     */
    public static ResolvedSchema resolve(StructType declared, StructType requiredSchema,
                                         String corruptColumnName, boolean explicitlyConfigured) {
        Objects.requireNonNull(declared, "declared must not be null");
        StructType nullableSchema = declared.asNullable();
        verifyCorruptRecordColumn(nullableSchema, corruptColumnName, explicitlyConfigured);

        StructType outputSchema = requiredSchema == null ? nullableSchema : requiredSchema.asNullable();
        StructType actualSchema = nullableSchema.without(corruptColumnName);
        StructType actualRequiredSchema = outputSchema.without(corruptColumnName);
        int corruptFieldIndex = corruptColumnName == null ? -1 : outputSchema.fieldIndex(corruptColumnName);

        return new ResolvedSchema(nullableSchema, outputSchema, actualSchema, actualRequiredSchema,
            corruptColumnName, corruptFieldIndex);
    }

    /**
     * Checks that a corrupt-record column, if present in the schema, is a string.
     * A name that was explicitly configured must also be present.
     *
     * @param schema the schema to check
     * @param corruptColumnName the corrupt-record column name, may be null
     * @param explicitlyConfigured whether absence is an error
     * @throws AnalysisException {@code INVALID_CORRUPT_RECORD_TYPE} or {@code CORRUPT_RECORD_COLUMN_NOT_FOUND}
     */
    public static void verifyCorruptRecordColumn(StructType schema, String corruptColumnName,
                                                 boolean explicitlyConfigured) {
        if (corruptColumnName == null) {
            return;
        }
        StructField field = schema.fieldByName(corruptColumnName);
        if (field == null) {
            if (explicitlyConfigured) {
                throw new AnalysisException("CORRUPT_RECORD_COLUMN_NOT_FOUND",
                    "The corrupt record column `" + corruptColumnName + "` is not in the schema "
                        + schema.sql() + ".",
                    Map.of("columnName", corruptColumnName));
            }
            return;
        }
        if (!(field.dataType() instanceof StringType)) {
            throw new AnalysisException("INVALID_CORRUPT_RECORD_TYPE",
                "The column `" + corruptColumnName + "` for corrupt records must have the nullable "
                    + "STRING type, but got " + field.dataType().sql() + ".",
                Map.of("columnName", corruptColumnName, "actualType", field.dataType().sql()));
        }
    }
}
