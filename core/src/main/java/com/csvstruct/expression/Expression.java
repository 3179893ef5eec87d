package com.csvstruct.expression;

import com.csvstruct.row.Row;
import com.csvstruct.types.DataType;

import java.util.List;

/**
 * Base interface for all expressions evaluated by the engine.
 *
 * <p>Expressions represent computations that produce values, such as:
 * <ul>
 *   <li>Literals (constants)</li>
 *   <li>Column references into the input row</li>
 *   <li>Map and struct constructors</li>
 *   <li>CSV codecs: {@code from_csv}, {@code to_csv}, {@code schema_of_csv}</li>
 * </ul>
 *
 * <p>An expression is bound once and then evaluated against many input rows.
 * Optional capabilities (type checking, time zone binding, schema pruning,
 * compilation) are expressed by the interfaces in this package that an
 * expression may additionally implement.
 */
public interface Expression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();

    /**
     * Returns whether this expression evaluates to the same value for every input row,
     * so it can be evaluated once at analysis time.
     *
     * @return true if foldable
     */
    default boolean foldable() {
        return false;
    }

    /**
     * Evaluates this expression against an input row.
     *
     * @param input the input row; may be null when the expression is foldable
     * @return the value, or null
     */
    Object eval(Row input);

    /**
     * Returns the direct child expressions.
     *
     * @return the children, empty for leaves
     */
    default List<Expression> children() {
        return List.of();
    }

    /**
     * Converts this expression to its SQL string representation.
     *
     * @return the SQL string representation
     */
    String toSQL();
}
