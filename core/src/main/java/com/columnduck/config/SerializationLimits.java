package com.columnduck.config;

/**
 * Limits and sizing constants for serialization.
 */
public final class SerializationLimits {

    private SerializationLimits() {} // Utility class

    /** Default buffer size in bytes for read and write buffers */
    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    /** Largest string length accepted when reading a length-prefixed string */
    public static final long MAX_STRING_SIZE = 1L << 30;

    /** Largest element count accepted for a single array value */
    public static final long MAX_ARRAY_SIZE = 1L << 30;

    /** Upper bound on rows used when pre-sizing a column from a read limit */
    public static final int MAX_RESERVE_ROWS = 1 << 20;

    /**
     * Validate a length read from a stream against a limit.
     *
     * @param size the length read from the stream
     * @param max the largest accepted length
     * @return true if the length is within bounds
     */
    public static boolean isWithin(long size, long max) {
        return size >= 0 && size <= max;
    }
}
