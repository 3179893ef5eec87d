package com.csvstruct.exception;

/**
 * Exception thrown when schema inference fails.
 */
public class SchemaInferenceException extends RuntimeException {

    public SchemaInferenceException(String message) {
        super(message);
    }

    public SchemaInferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
