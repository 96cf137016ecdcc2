package com.columnduck.exception;

/**
 * Base class for failures raised by data type descriptors.
 *
 * <p>Descriptors never log or retry: every failure is thrown to the immediate
 * caller, which decides whether to skip the row, substitute a default or abort
 * the batch.
 *
 * <p>Subclasses map to the three failure kinds a descriptor can report:
 * <ul>
 *   <li>{@link NotImplementedException} - an optional capability is missing</li>
 *   <li>{@link MalformedInputException} - bytes or text cannot be parsed</li>
 *   <li>{@link StreamExhaustedException} - a value was cut off by end of stream</li>
 * </ul>
 */
public class DataTypeException extends RuntimeException {

    private final String typeName;

    public DataTypeException(String message) {
        this(message, null, null);
    }

    /**
     * Creates an exception attributed to a data type.
     *
     * @param message the error message
     * @param typeName the canonical name of the data type, or null if unknown
     */
    public DataTypeException(String message, String typeName) {
        this(message, typeName, null);
    }

    /**
     * Creates an exception attributed to a data type with a cause.
     *
     * @param message the error message
     * @param typeName the canonical name of the data type, or null if unknown
     * @param cause the underlying cause
     */
    public DataTypeException(String message, String typeName, Throwable cause) {
        super(message, cause);
        this.typeName = typeName;
    }

    /**
     * Returns the canonical name of the data type that failed.
     *
     * @return the type name, or null when the failure happened below the type level
     */
    public String getTypeName() {
        return typeName;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (typeName != null) {
            sb.append("Data type: ").append(typeName).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
