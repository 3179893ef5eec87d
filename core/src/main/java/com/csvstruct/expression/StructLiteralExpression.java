package com.csvstruct.expression;

import com.csvstruct.row.Row;
import com.csvstruct.row.RowBuilder;
import com.csvstruct.types.StructField;
import com.csvstruct.types.StructType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a struct constructor,
 * {@code named_struct('field1', val1, 'field2', val2)}.
 *
 * <p>The type is a StructType whose fields take their types and nullability from
 * the value expressions. Evaluates to a {@link Row}.
 */
public final class StructLiteralExpression implements Expression {

    private final List<String> fieldNames;
    private final List<Expression> fieldValues;

    /**
     * Creates a struct literal expression.
     *
     * @param fieldNames the field names (must match fieldValues size)
     * @param fieldValues the field values
     * @throws IllegalArgumentException if fieldNames and fieldValues have different sizes,
     *         or if fieldNames is empty
     */
    public StructLiteralExpression(List<String> fieldNames, List<Expression> fieldValues) {
        Objects.requireNonNull(fieldNames, "fieldNames must not be null");
        Objects.requireNonNull(fieldValues, "fieldValues must not be null");

        if (fieldNames.size() != fieldValues.size()) {
            throw new IllegalArgumentException(
                "fieldNames and fieldValues must have the same size: " +
                fieldNames.size() + " vs " + fieldValues.size());
        }

        if (fieldNames.isEmpty()) {
            throw new IllegalArgumentException("Struct literal requires at least one field");
        }

        this.fieldNames = new ArrayList<>(fieldNames);
        this.fieldValues = new ArrayList<>(fieldValues);
    }

    public List<String> fieldNames() {
        return Collections.unmodifiableList(fieldNames);
    }

    public List<Expression> fieldValues() {
        return Collections.unmodifiableList(fieldValues);
    }

    public int size() {
        return fieldNames.size();
    }

    @Override
    public StructType dataType() {
        List<StructField> fields = new ArrayList<>();
        for (int i = 0; i < fieldNames.size(); i++) {
            Expression value = fieldValues.get(i);
            fields.add(new StructField(fieldNames.get(i), value.dataType(), value.nullable()));
        }
        return new StructType(fields);
    }

    /**
     * Struct constructors never produce null.
     *
     * @return false
     */
    @Override
    public boolean nullable() {
        return false;
    }

    @Override
    public boolean foldable() {
        return fieldValues.stream().allMatch(Expression::foldable);
    }

    @Override
    public List<Expression> children() {
        return fieldValues();
    }

    @Override
    public Row eval(Row input) {
        RowBuilder row = new RowBuilder(fieldValues.size());
        for (int i = 0; i < fieldValues.size(); i++) {
            row.set(i, fieldValues.get(i).eval(input));
        }
        return row.build();
    }

    /**
     * Generates the SQL representation of this struct literal.
     *
     * @return SQL string in the form "named_struct('field1', val1, 'field2', val2)"
     */
    @Override
    public String toSQL() {
        StringBuilder sql = new StringBuilder("named_struct(");
        for (int i = 0; i < fieldNames.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            String quotedName = "'" + fieldNames.get(i).replace("'", "\\'") + "'";
            sql.append(quotedName).append(", ").append(fieldValues.get(i).toSQL());
        }
        sql.append(")");
        return sql.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StructLiteralExpression)) return false;
        StructLiteralExpression that = (StructLiteralExpression) obj;
        return Objects.equals(fieldNames, that.fieldNames) &&
               Objects.equals(fieldValues, that.fieldValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldNames, fieldValues);
    }

    @Override
    public String toString() {
        return "StructLiteral(" + fieldNames.size() + " fields)";
    }
}
