package com.csvstruct.expression;

import com.csvstruct.row.Row;
import com.csvstruct.types.DataType;
import com.csvstruct.types.MapType;
import com.csvstruct.types.NullType;
import com.csvstruct.types.StringType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a map constructor, {@code map(k1, v1, k2, v2, ...)}.
 *
 * <p>This is how option maps reach the CSV functions, e.g.
 * {@code map('sep', ';', 'mode', 'FAILFAST')}.
 *
 * <p>Type inference:
 * <ul>
 *   <li>Empty map: MapType(StringType, StringType, false)</li>
 *   <li>Non-empty: MapType(keyType, valueType, valueContainsNull), where all keys and
 *       all values must share one type (NULL literals adopt it)</li>
 * </ul>
 */
public final class MapLiteralExpression implements Expression {

    private final List<Expression> keys;
    private final List<Expression> values;
    private final MapType dataType;

    /**
     * Creates a map literal expression.
     *
     * @param keys the map keys (must match values size)
     * @param values the map values
     * @throws IllegalArgumentException if keys and values have different sizes, or their
     *         types cannot be unified
     */
    public MapLiteralExpression(List<Expression> keys, List<Expression> values) {
        Objects.requireNonNull(keys, "keys must not be null");
        Objects.requireNonNull(values, "values must not be null");

        if (keys.size() != values.size()) {
            throw new IllegalArgumentException(
                "keys and values must have the same size: " +
                keys.size() + " vs " + values.size());
        }

        this.keys = new ArrayList<>(keys);
        this.values = new ArrayList<>(values);
        this.dataType = new MapType(unify(keys, "key"), unify(values, "value"),
            values.stream().anyMatch(Expression::nullable));
    }

    /**
     * Creates a map literal of string keys and values.
     *
     * @param entries the entries, in order
     * @return the map literal
     */
    public static MapLiteralExpression ofStrings(Map<String, String> entries) {
        List<Expression> keys = new ArrayList<>(entries.size());
        List<Expression> values = new ArrayList<>(entries.size());
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            keys.add(Literal.of(entry.getKey()));
            values.add(Literal.of(entry.getValue()));
        }
        return new MapLiteralExpression(keys, values);
    }

    private static DataType unify(List<Expression> expressions, String role) {
        DataType result = NullType.get();
        for (Expression expression : expressions) {
            DataType next = expression.dataType();
            if (next instanceof NullType || next.equals(result)) {
                continue;
            }
            if (!(result instanceof NullType)) {
                throw new IllegalArgumentException(
                    "Map " + role + "s must share one type, found " + result.sql() + " and " + next.sql());
            }
            result = next;
        }
        return result instanceof NullType && expressions.isEmpty() ? StringType.get() : result;
    }

    public List<Expression> keys() {
        return Collections.unmodifiableList(keys);
    }

    public List<Expression> values() {
        return Collections.unmodifiableList(values);
    }

    public int size() {
        return keys.size();
    }

    @Override
    public MapType dataType() {
        return dataType;
    }

    /**
     * Map constructors never produce null, though they may contain null values.
     *
     * @return false
     */
    @Override
    public boolean nullable() {
        return false;
    }

    @Override
    public boolean foldable() {
        return children().stream().allMatch(Expression::foldable);
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>(keys.size() * 2);
        for (int i = 0; i < keys.size(); i++) {
            children.add(keys.get(i));
            children.add(values.get(i));
        }
        return children;
    }

    /**
     * Evaluates to an insertion-ordered map; a repeated key keeps its last value.
     *
     * @throws IllegalArgumentException if a key evaluates to null
     */
    @Override
    public Map<Object, Object> eval(Row input) {
        Map<Object, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            Object key = keys.get(i).eval(input);
            if (key == null) {
                throw new IllegalArgumentException("Cannot use null as map key");
            }
            result.put(key, values.get(i).eval(input));
        }
        return result;
    }

    /**
     * Generates the SQL representation of this map literal.
     *
     * @return SQL string in the form "map(key1, val1, key2, val2)"
     */
    @Override
    public String toSQL() {
        return children().stream()
            .map(Expression::toSQL)
            .collect(Collectors.joining(", ", "map(", ")"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof MapLiteralExpression)) return false;
        MapLiteralExpression that = (MapLiteralExpression) obj;
        return Objects.equals(keys, that.keys) &&
               Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, values);
    }

    @Override
    public String toString() {
        return "MapLiteral(" + keys.size() + " entries)";
    }
}
