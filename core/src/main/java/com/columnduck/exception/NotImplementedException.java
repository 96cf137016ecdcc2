package com.columnduck.exception;

/**
 * Exception thrown when a data type does not support an optional capability,
 * such as a fixed per-value size for variable-length strings.
 */
public class NotImplementedException extends DataTypeException {

    public NotImplementedException(String message, String typeName) {
        super(message, typeName);
    }
}
