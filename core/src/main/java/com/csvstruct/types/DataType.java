package com.csvstruct.types;

/**
 * Sealed interface for all data types in the csvstruct type system.
 *
 * <p>The hierarchy mirrors Spark's catalyst types closely enough that schema strings
 * written for Spark ({@code a INT, b DOUBLE}, {@code struct<a:int>}) parse into the
 * same shapes here.
 *
 * <p>Data types fall into these groups:
 * <ul>
 *   <li>Scalar types: BooleanType, ByteType, ShortType, IntegerType, LongType,
 *       FloatType, DoubleType, DecimalType, StringType, BinaryType</li>
 *   <li>Temporal types: DateType, TimestampType</li>
 *   <li>Container types: ArrayType, MapType, StructType</li>
 *   <li>Special types: NullType, VariantType, and user-defined types</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, ByteType, ShortType, IntegerType, LongType,
            FloatType, DoubleType, DecimalType, StringType,
            DateType, TimestampType, BinaryType, NullType, VariantType,
            ArrayType, MapType, StructType, UserDefinedType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the DDL rendering of this type, e.g. {@code INT} or
     * {@code STRUCT<a: INT, b: STRING>}.
     *
     * @return the SQL type string
     */
    String sql();

    /**
     * Returns the default size in bytes for values of this type.
     *
     * <p>Returns -1 for variable-length types (e.g., String, Array).
     *
     * @return the default size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }

    /**
     * Returns this type with every nested nullability flag forced to true.
     *
     * @return the nullable form of this type
     */
    default DataType asNullable() {
        return this;
    }
}
