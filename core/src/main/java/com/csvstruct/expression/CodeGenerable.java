package com.csvstruct.expression;

/**
 * An expression that can be compiled into a specialized evaluator.
 *
 * <p>The compiled evaluator must return exactly what {@link Expression#eval} returns
 * for every input.
 */
public interface CodeGenerable {

    CompiledExpression compile();
}
