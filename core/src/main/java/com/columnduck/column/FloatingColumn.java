package com.columnduck.column;

/**
 * A column of floating point values accessed as doubles, whatever the storage width.
 */
public interface FloatingColumn extends Column {

    double getDouble(int row);

    /**
     * Appends a value, rounding it to the storage precision.
     */
    void addDouble(double value);
}
