package com.csvstruct.validation;

import com.csvstruct.exception.AnalysisException;
import com.csvstruct.expression.Expression;
import com.csvstruct.expression.TimeZoneAware;
import com.csvstruct.expression.TypeCheckResult;
import com.csvstruct.expression.TypeChecked;

import java.util.Objects;

/**
 * Validates expression trees before evaluation.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>Every {@link TypeChecked} expression must pass its input type check</li>
 *   <li>Every {@link TimeZoneAware} expression must be bound to a time zone</li>
 * </ul>
 *
 * <p>Children are validated before their parents, so the reported error is the
 * innermost one.
 *
 * <p>Example usage:
 * <pre>
 *   Expression expr = new SchemaOfCsv(ColumnReference.of("line", 0, StringType.get()));
 *   ExpressionValidator.validate(expr);
 *   // AnalysisException: [DATATYPE_MISMATCH.NON_FOLDABLE_INPUT] ...
 * </pre>
 */
public class ExpressionValidator {

    private ExpressionValidator() {}

    /**
     * Validates an expression tree.
     *
     * @param expression the root expression
     * @throws AnalysisException if validation fails
     * @throws NullPointerException if expression is null
     */
    public static void validate(Expression expression) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        validateRecursive(expression);
    }

    private static void validateRecursive(Expression expression) {
        for (Expression child : expression.children()) {
            validateRecursive(child);
        }

        if (expression instanceof TypeChecked checked) {
            TypeCheckResult result = checked.checkInputDataTypes();
            if (result instanceof TypeCheckResult.DataTypeMismatch mismatch) {
                throw new AnalysisException("DATATYPE_MISMATCH." + mismatch.errorSubClass(),
                    "Cannot resolve " + expression.toSQL() + " due to data type mismatch: "
                        + mismatch.errorSubClass() + " " + mismatch.messageParameters(),
                    mismatch.messageParameters());
            }
        }

        if (expression instanceof TimeZoneAware aware && !aware.timeZoneResolved()) {
            throw new AnalysisException("UNRESOLVED_TIME_ZONE",
                "Expression " + expression.toSQL() + " is not bound to a time zone.");
        }
    }
}
