package com.columnduck.exception;

/**
 * Exception thrown when a stream ends in the middle of a value.
 *
 * <p>A bulk read that finds the stream exhausted at a value boundary is a short
 * read, not an error; this exception is reserved for truncated values.
 */
public class StreamExhaustedException extends DataTypeException {

    private final long position;

    /**
     * Creates a stream exhausted exception.
     *
     * @param message the error message
     * @param position the number of bytes consumed from the stream when it ran out
     */
    public StreamExhaustedException(String message, long position) {
        super(message + " (at byte " + position + ")");
        this.position = position;
    }

    /**
     * Returns the stream position at which the input ran out.
     *
     * @return the number of bytes consumed before the failure
     */
    public long getPosition() {
        return position;
    }
}
