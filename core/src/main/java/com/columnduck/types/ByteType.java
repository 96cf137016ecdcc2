package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.IntColumn;

/**
 * Data type representing an 8-bit signed integer.
 */
public final class ByteType extends AbstractIntegralType {

    private static final ByteType INSTANCE = new ByteType();

    private ByteType() {
        super(1);
    }

    public static ByteType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "byte";
    }

    @Override
    public DataType clone() {
        return INSTANCE;
    }

    @Override
    public Column createColumn() {
        return new IntColumn();
    }
}
