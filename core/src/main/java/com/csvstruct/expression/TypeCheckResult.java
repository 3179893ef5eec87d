package com.csvstruct.expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of an expression's input type check.
 */
public sealed interface TypeCheckResult
    permits TypeCheckResult.TypeCheckSuccess, TypeCheckResult.DataTypeMismatch {

    TypeCheckSuccess SUCCESS = new TypeCheckSuccess();

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    record TypeCheckSuccess() implements TypeCheckResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * A failed type check.
     *
     * @param errorSubClass the sub-class under {@code DATATYPE_MISMATCH}, e.g. {@code NON_FOLDABLE_INPUT}
     * @param messageParameters values describing the mismatch
     */
    record DataTypeMismatch(String errorSubClass, Map<String, String> messageParameters)
        implements TypeCheckResult {

        public DataTypeMismatch {
            messageParameters = Collections.unmodifiableMap(new LinkedHashMap<>(messageParameters));
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
