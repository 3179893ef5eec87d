package com.csvstruct.expression;

/**
 * An expression that validates the types of its inputs at analysis time.
 */
public interface TypeChecked {

    /**
     * Checks the input types of this expression.
     *
     * @return {@link TypeCheckResult#SUCCESS} or a {@link TypeCheckResult.DataTypeMismatch}
     */
    TypeCheckResult checkInputDataTypes();
}
