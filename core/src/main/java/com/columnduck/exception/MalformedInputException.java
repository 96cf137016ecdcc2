package com.columnduck.exception;

/**
 * Exception thrown when binary or text input cannot be parsed as a value of
 * the target data type.
 *
 * <p>Per-value deserialization guarantees that the destination column is left
 * exactly as it was before the failing call.
 */
public class MalformedInputException extends DataTypeException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, String typeName) {
        super(message, typeName);
    }

    public MalformedInputException(String message, String typeName, Throwable cause) {
        super(message, typeName, cause);
    }
}
