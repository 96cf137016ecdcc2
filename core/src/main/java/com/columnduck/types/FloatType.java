package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.FloatColumn;
import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.TextEncoding;
import com.columnduck.io.WriteBuffer;

/**
 * Data type representing a 32-bit floating point number.
 */
public final class FloatType extends AbstractFloatingType {

    private static final FloatType INSTANCE = new FloatType();

    private FloatType() {}

    public static FloatType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "float";
    }

    @Override
    public DataType clone() {
        return INSTANCE;
    }

    @Override
    public int getSizeOfField() {
        return 4;
    }

    @Override
    public Column createColumn() {
        return new FloatColumn();
    }

    @Override
    protected void writeValue(double value, WriteBuffer out) {
        BinaryEncoding.writeFloatLE((float) value, out);
    }

    @Override
    protected double readValue(ReadBuffer in) {
        return BinaryEncoding.readFloatLE(in);
    }

    @Override
    protected String formatValue(double value) {
        return TextEncoding.formatFloat((float) value);
    }
}
