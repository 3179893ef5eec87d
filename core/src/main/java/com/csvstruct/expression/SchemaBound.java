package com.csvstruct.expression;

import com.csvstruct.types.StructType;

import java.util.Optional;

/**
 * An expression that produces rows of a declared schema and can be asked to
 * produce only a subset of its fields.
 */
public interface SchemaBound {

    /**
     * Returns the declared schema with every field forced nullable.
     *
     * @return the nullable schema
     */
    StructType nullableSchema();

    /**
     * Returns the pruned output schema, if one was requested.
     *
     * @return the required schema
     */
    Optional<StructType> requiredSchema();

    /**
     * Returns a copy of this expression producing only the given fields.
     *
     * @param requiredSchema a subset of the declared fields
     * @return the pruned expression
     */
    Expression withRequiredSchema(StructType requiredSchema);
}
