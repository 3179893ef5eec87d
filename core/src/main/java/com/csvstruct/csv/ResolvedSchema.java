package com.csvstruct.csv;

import com.csvstruct.types.StructType;

/**
 * The schema views a CSV decoder works with, derived once at bind time.
 *
 * @param nullableSchema the declared schema with every field forced nullable
 * @param outputSchema the shape of produced rows: the nullable required schema
 *                     when one was given, otherwise {@code nullableSchema}
 * @param actualSchema {@code nullableSchema} without the corrupt-record field; the fields
 *                     expected in the text, in token order
 * @param actualRequiredSchema {@code outputSchema} without the corrupt-record field; the
 *                             fields the parser must convert
 * @param corruptColumnName the corrupt-record column name, may be null
 * @param corruptFieldIndex the corrupt field's position in {@code outputSchema}, or -1
 */
public record ResolvedSchema(
    StructType nullableSchema,
    StructType outputSchema,
    StructType actualSchema,
    StructType actualRequiredSchema,
    String corruptColumnName,
    int corruptFieldIndex) {

    public boolean hasCorruptField() {
        return corruptFieldIndex >= 0;
    }
}
