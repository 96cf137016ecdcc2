package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.IntColumn;

/**
 * Data type representing a 32-bit signed integer.
 */
public final class IntegerType extends AbstractIntegralType {

    private static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {
        super(4);
    }

    public static IntegerType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "integer";
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
