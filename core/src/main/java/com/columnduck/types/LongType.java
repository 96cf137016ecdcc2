package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.LongColumn;

/**
 * Data type representing a 64-bit signed integer.
 */
public final class LongType extends AbstractIntegralType {

    private static final LongType INSTANCE = new LongType();

    private LongType() {
        super(8);
    }

    public static LongType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "long";
    }

    @Override
    public DataType clone() {
        return INSTANCE;
    }

    @Override
    public Column createColumn() {
        return new LongColumn();
    }
}
