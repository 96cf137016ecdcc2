package com.columnduck.column;

/**
 * A column of integral values accessed as 64-bit longs, whatever the storage width.
 */
public interface IntegralColumn extends Column {

    long getLong(int row);

    /**
     * Appends a value, truncating it to the storage width.
     */
    void addLong(long value);
}
