package com.csvstruct.csv;

import com.csvstruct.types.ArrayType;
import com.csvstruct.types.DataType;
import com.csvstruct.types.MapType;
import com.csvstruct.types.StructField;
import com.csvstruct.types.StructType;
import com.csvstruct.types.UserDefinedType;
import com.csvstruct.types.VariantType;

/**
 * Decides which data types the CSV codecs can handle.
 */
public final class CsvTypeSupport {

    private CsvTypeSupport() {}

    /**
     * Returns whether values of the given type can be written as CSV.
     * Scalars are supported; containers are supported when everything they contain is;
     * user-defined types follow their underlying type; variant is never supported.
     *
     * @param dataType the type to check
     * @return true if supported
     */
    public static boolean isSupported(DataType dataType) {
        if (dataType instanceof VariantType) {
            return false;
        }
        if (dataType instanceof ArrayType array) {
            return isSupported(array.elementType());
        }
        if (dataType instanceof MapType map) {
            return isSupported(map.keyType()) && isSupported(map.valueType());
        }
        if (dataType instanceof StructType struct) {
            for (StructField field : struct.fields()) {
                if (!isSupported(field.dataType())) {
                    return false;
                }
            }
            return true;
        }
        if (dataType instanceof UserDefinedType<?> udt) {
            return isSupported(udt.sqlType());
        }
        return true;
    }

    /**
     * Returns whether a column of the given type can be read from a CSV token.
     * Only scalars, and user-defined types over scalars, can.
     *
     * @param dataType the type to check
     * @return true if decodable
     */
    public static boolean isDecodable(DataType dataType) {
        if (dataType instanceof UserDefinedType<?> udt) {
            return isDecodable(udt.sqlType());
        }
        return !(dataType instanceof ArrayType
            || dataType instanceof MapType
            || dataType instanceof StructType
            || dataType instanceof VariantType);
    }
}
