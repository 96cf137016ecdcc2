package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.IntColumn;

/**
 * Data type representing a 16-bit signed integer.
 */
public final class ShortType extends AbstractIntegralType {

    private static final ShortType INSTANCE = new ShortType();

    private ShortType() {
        super(2);
    }

    public static ShortType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "short";
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
