package com.csvstruct.expression;

import com.csvstruct.row.Row;

/**
 * A compiled evaluator produced by {@link CodeGenerable#compile()}.
 */
@FunctionalInterface
public interface CompiledExpression {

    Object evaluate(Row input);

    /**
     * Compiles an expression if it supports compilation, otherwise wraps its interpreted form.
     *
     * @param expression the expression
     * @return the evaluator
     */
    static CompiledExpression of(Expression expression) {
        if (expression instanceof CodeGenerable generable) {
            return generable.compile();
        }
        return expression::eval;
    }
}
