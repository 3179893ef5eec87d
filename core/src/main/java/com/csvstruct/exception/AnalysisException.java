package com.csvstruct.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exception thrown when an expression cannot be bound or type checked.
 *
 * <p>Analysis errors surface before any row is processed: an unsupported parse
 * mode, a missing or mistyped corrupt-record column, a data type the codec cannot
 * handle, a schema or options argument that is not a constant, or an input type
 * mismatch reported by an expression's type check. They are never retried.
 *
 * <p>Each exception carries a stable error class (for example
 * {@code PARSE_MODE_UNSUPPORTED} or {@code DATATYPE_MISMATCH.NON_FOLDABLE_INPUT})
 * and the parameters used to build its message, so callers can produce precise
 * diagnostics without parsing message text.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       ExpressionValidator.validate(expr);
 *   } catch (AnalysisException e) {
 *       if (e.getErrorClass().startsWith("DATATYPE_MISMATCH")) {
 *           ...
 *       }
 *   }
 * </pre>
 */
public class AnalysisException extends RuntimeException {

    private final String errorClass;
    private final Map<String, String> messageParameters;

    /**
     * Creates an analysis exception.
     *
     * @param errorClass the error class, e.g. {@code INVALID_CORRUPT_RECORD_TYPE}
     * @param message the human-readable message
     * @param messageParameters the values interpolated into the message
     */
    public AnalysisException(String errorClass, String message, Map<String, String> messageParameters) {
        super("[" + errorClass + "] " + message);
        this.errorClass = Objects.requireNonNull(errorClass, "errorClass must not be null");
        this.messageParameters = Collections.unmodifiableMap(new LinkedHashMap<>(messageParameters));
    }

    /**
     * Creates an analysis exception with a cause.
     *
     * @param errorClass the error class
     * @param message the human-readable message
     * @param messageParameters the values interpolated into the message
     * @param cause the underlying cause
     */
    public AnalysisException(String errorClass, String message, Map<String, String> messageParameters,
                             Throwable cause) {
        this(errorClass, message, messageParameters);
        initCause(cause);
    }

    /**
     * Creates an analysis exception without message parameters.
     *
     * @param errorClass the error class
     * @param message the human-readable message
     */
    public AnalysisException(String errorClass, String message) {
        this(errorClass, message, Collections.emptyMap());
    }

    public String getErrorClass() {
        return errorClass;
    }

    public Map<String, String> getMessageParameters() {
        return messageParameters;
    }
}
