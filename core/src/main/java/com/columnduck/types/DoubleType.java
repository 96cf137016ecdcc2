package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.DoubleColumn;
import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.TextEncoding;
import com.columnduck.io.WriteBuffer;

/**
 * Data type representing a 64-bit floating point number.
 */
public final class DoubleType extends AbstractFloatingType {

    private static final DoubleType INSTANCE = new DoubleType();

    private DoubleType() {}

    public static DoubleType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "double";
    }

    @Override
    public DataType clone() {
        return INSTANCE;
    }

    @Override
    public int getSizeOfField() {
        return 8;
    }

    @Override
    public Column createColumn() {
        return new DoubleColumn();
    }

    @Override
    protected void writeValue(double value, WriteBuffer out) {
        BinaryEncoding.writeDoubleLE(value, out);
    }

    @Override
    protected double readValue(ReadBuffer in) {
        return BinaryEncoding.readDoubleLE(in);
    }

    @Override
    protected String formatValue(double value) {
        return TextEncoding.formatDouble(value);
    }
}
