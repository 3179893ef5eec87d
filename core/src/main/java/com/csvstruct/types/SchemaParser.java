package com.csvstruct.types;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses schema strings into StructType objects.
 *
 * <p>Supports three formats:
 * <ul>
 *   <li>DDL column list: {@code a INT, b DOUBLE NOT NULL}</li>
 *   <li>Struct format: {@code struct<name:type,name2:type2>} or {@code STRUCT<a: INT>}</li>
 *   <li>JSON format: {@code {"type":"struct","fields":[{"name":"id","type":"integer","nullable":false},...]}}</li>
 * </ul>
 *
 * <p>Examples:
 * <ul>
 *   <li>{@code a INT, b DOUBLE}</li>
 *   <li>{@code struct<tags:array<string>>}</li>
 *   <li>{@code struct<data:map<string,int>,inner:struct<x:int>>}</li>
 *   <li>{@code `odd name` STRING}</li>
 * </ul>
 *
 * <p>The output of {@link StructType#sql()} and {@link StructType#toDDL()} parses back
 * into an equal schema.
 */
public class SchemaParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private SchemaParser() {}

    /**
     * Parses a schema string into a StructType.
     *
     * @param schemaStr the schema string in DDL, struct or JSON format
     * @return the parsed StructType
     * @throws IllegalArgumentException if the schema string is invalid
     */
    public static StructType parse(String schemaStr) {
        if (schemaStr == null || schemaStr.isBlank()) {
            throw new IllegalArgumentException("Schema string cannot be null or empty");
        }

        String trimmed = schemaStr.trim();

        if (trimmed.startsWith("{")) {
            return parseJsonSchema(trimmed);
        }

        if (isWrapped(trimmed, "struct<")) {
            return parseStructFields(trimmed.substring(7, trimmed.length() - 1));
        }

        return parseStructFields(trimmed);
    }

    /**
     * Parses a single type string such as {@code array<int>} or {@code DECIMAL(10,2)}.
     *
     * @param typeStr the type string
     * @return the parsed DataType
     * @throws IllegalArgumentException if the type string is invalid
     */
    public static DataType parseDataType(String typeStr) {
        if (typeStr == null || typeStr.isBlank()) {
            throw new IllegalArgumentException("Type string cannot be null or empty");
        }
        return parseType(typeStr.trim());
    }

    private static StructType parseJsonSchema(String jsonStr) {
        JsonNode root;
        try {
            root = objectMapper.readTree(jsonStr);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse JSON schema: " + e.getMessage(), e);
        }
        return parseJsonStructType(root);
    }

    private static StructType parseJsonStructType(JsonNode node) {
        JsonNode fieldsNode = node.get("fields");
        if (fieldsNode == null || !fieldsNode.isArray()) {
            return new StructType(new ArrayList<>());
        }

        List<StructField> fields = new ArrayList<>();
        for (JsonNode fieldNode : fieldsNode) {
            JsonNode nameNode = fieldNode.get("name");
            if (nameNode == null) {
                throw new IllegalArgumentException("JSON schema field without a name: " + fieldNode);
            }
            boolean nullable = !fieldNode.has("nullable") || fieldNode.get("nullable").asBoolean();
            DataType dataType = parseJsonDataType(fieldNode.get("type"));
            fields.add(new StructField(nameNode.asText(), dataType, nullable));
        }

        return new StructType(fields);
    }

    /**
     * Handles both simple types ("integer") and complex types ({"type":"array",...}).
     */
    private static DataType parseJsonDataType(JsonNode typeNode) {
        if (typeNode == null) {
            throw new IllegalArgumentException("Type node cannot be null");
        }

        if (typeNode.isTextual()) {
            return parseType(typeNode.asText());
        }

        if (typeNode.isObject()) {
            String typeName = typeNode.path("type").asText().toLowerCase(Locale.ROOT);

            switch (typeName) {
                case "array":
                    return new ArrayType(
                        parseJsonDataType(typeNode.get("elementType")),
                        !typeNode.has("containsNull") || typeNode.get("containsNull").asBoolean());

                case "map":
                    return new MapType(
                        parseJsonDataType(typeNode.get("keyType")),
                        parseJsonDataType(typeNode.get("valueType")),
                        !typeNode.has("valueContainsNull") || typeNode.get("valueContainsNull").asBoolean());

                case "struct":
                    return parseJsonStructType(typeNode);

                default:
                    return parseType(typeName);
            }
        }

        throw new IllegalArgumentException("Unsupported type node: " + typeNode);
    }

    private static StructType parseStructFields(String fieldsStr) {
        List<StructField> fields = new ArrayList<>();
        for (String fieldDef : splitTopLevel(fieldsStr, ',')) {
            fields.add(parseField(fieldDef));
        }
        return new StructType(fields);
    }

    /**
     * Parses a single field definition: {@code name:type}, {@code name type},
     * optionally followed by {@code NOT NULL}. Names may be back-quoted.
     */
    private static StructField parseField(String fieldDef) {
        String name;
        String rest;
        if (fieldDef.startsWith("`")) {
            int end = closingBacktick(fieldDef);
            name = fieldDef.substring(1, end).replace("``", "`");
            rest = fieldDef.substring(end + 1);
        } else {
            int sep = 0;
            while (sep < fieldDef.length()
                && fieldDef.charAt(sep) != ':'
                && !Character.isWhitespace(fieldDef.charAt(sep))) {
                sep++;
            }
            name = fieldDef.substring(0, sep);
            rest = fieldDef.substring(sep);
        }

        rest = rest.trim();
        if (rest.startsWith(":")) {
            rest = rest.substring(1).trim();
        }
        if (name.isEmpty() || rest.isEmpty()) {
            throw new IllegalArgumentException("Invalid field definition: " + fieldDef);
        }

        boolean nullable = true;
        String upper = rest.toUpperCase(Locale.ROOT);
        if (upper.endsWith("NOT NULL")) {
            String typePart = rest.substring(0, rest.length() - "NOT NULL".length()).trim();
            if (!typePart.isEmpty()) {
                nullable = false;
                rest = typePart;
            }
        }

        return new StructField(name, parseType(rest), nullable);
    }

    private static int closingBacktick(String str) {
        int i = 1;
        while (i < str.length()) {
            if (str.charAt(i) == '`') {
                if (i + 1 < str.length() && str.charAt(i + 1) == '`') {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        throw new IllegalArgumentException("Unterminated quoted identifier: " + str);
    }

    private static DataType parseType(String typeStr) {
        String trimmed = typeStr.trim();

        if (isWrapped(trimmed, "array<")) {
            return new ArrayType(parseType(trimmed.substring(6, trimmed.length() - 1)));
        }

        if (isWrapped(trimmed, "map<")) {
            String inner = trimmed.substring(4, trimmed.length() - 1);
            List<String> parts = splitTopLevel(inner, ',');
            if (parts.size() != 2) {
                throw new IllegalArgumentException("Invalid map type: " + typeStr);
            }
            return new MapType(parseType(parts.get(0)), parseType(parts.get(1)));
        }

        if (isWrapped(trimmed, "struct<")) {
            return parseStructFields(trimmed.substring(7, trimmed.length() - 1));
        }

        return parsePrimitiveType(trimmed.toLowerCase(Locale.ROOT).replace(" ", ""));
    }

    private static DataType parsePrimitiveType(String typeStr) {
        switch (typeStr) {
            case "byte":
            case "tinyint":
                return ByteType.get();
            case "short":
            case "smallint":
                return ShortType.get();
            case "int":
            case "integer":
                return IntegerType.get();
            case "long":
            case "bigint":
                return LongType.get();

            case "float":
            case "real":
                return FloatType.get();
            case "double":
                return DoubleType.get();

            case "string":
            case "varchar":
            case "text":
                return StringType.get();
            case "boolean":
            case "bool":
                return BooleanType.get();

            case "date":
                return DateType.get();
            case "timestamp":
                return TimestampType.get();

            case "binary":
            case "blob":
                return BinaryType.get();

            case "void":
            case "null":
                return NullType.get();
            case "variant":
                return VariantType.get();

            case "decimal":
            case "dec":
            case "numeric":
                return DecimalType.USER_DEFAULT;

            default:
                if (typeStr.startsWith("varchar(") || typeStr.startsWith("char(")) {
                    return StringType.get();
                }
                if (typeStr.startsWith("decimal(") || typeStr.startsWith("dec(")
                    || typeStr.startsWith("numeric(")) {
                    return parseDecimalType(typeStr);
                }
                throw new IllegalArgumentException("Unsupported type: " + typeStr);
        }
    }

    private static DecimalType parseDecimalType(String typeStr) {
        int start = typeStr.indexOf('(');
        int end = typeStr.indexOf(')');
        if (end < start) {
            throw new IllegalArgumentException("Invalid decimal type: " + typeStr);
        }

        String[] parts = typeStr.substring(start + 1, end).split(",");
        try {
            int precision = Integer.parseInt(parts[0].trim());
            int scale = parts.length > 1 ? Integer.parseInt(parts[1].trim()) : 0;
            return new DecimalType(precision, scale);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid decimal type: " + typeStr, e);
        }
    }

    private static boolean isWrapped(String str, String lowerPrefix) {
        return str.length() > lowerPrefix.length()
            && str.regionMatches(true, 0, lowerPrefix, 0, lowerPrefix.length())
            && str.endsWith(">");
    }

    /**
     * Splits a string by a delimiter, respecting nested brackets and back-quoted names.
     */
    private static List<String> splitTopLevel(String str, char delimiter) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean quoted = false;
        int start = 0;

        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            if (c == '`') {
                quoted = !quoted;
            } else if (quoted) {
                continue;
            } else if (c == '<' || c == '(') {
                depth++;
            } else if (c == '>' || c == ')') {
                depth--;
            } else if (c == delimiter && depth == 0) {
                addPart(parts, str.substring(start, i));
                start = i + 1;
            }
        }
        if (depth != 0 || quoted) {
            throw new IllegalArgumentException("Unbalanced schema string: " + str);
        }

        addPart(parts, str.substring(start));
        return parts;
    }

    private static void addPart(List<String> parts, String part) {
        String trimmed = part.trim();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }
}
