package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.ConstColumn;
import com.columnduck.value.ScalarValue;

/**
 * Base class for descriptors: identity by type name, constant columns and
 * shared argument checks.
 */
public abstract class AbstractDataType implements DataType {

    @Override
    public abstract DataType clone();

    @Override
    public Column createConstColumn(int size, ScalarValue value) {
        Column single = createColumn();
        single.insert(value);
        return new ConstColumn(single, size);
    }

    /**
     * Returns the end row of a bulk serialization range.
     *
     * @throws IllegalArgumentException if {@code offset} is past the end of the column
     */
    protected static int bulkEnd(Column column, int offset, int limit) {
        int size = column.size();
        if (offset < 0 || offset > size) {
            throw new IllegalArgumentException("offset " + offset + " out of range for column of size " + size);
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative, got: " + limit);
        }
        if (limit == 0 || limit > size - offset) {
            return size;
        }
        return offset + limit;
    }

    /**
     * Returns {@code column}, materialized if constant, as the column class this type works with.
     *
     * @throws IllegalArgumentException if the column is of another kind
     */
    protected <C extends Column> C columnAs(Column column, Class<C> columnClass) {
        Column full = column.convertToFullColumn();
        if (!columnClass.isInstance(full)) {
            throw new IllegalArgumentException("Data type " + typeName() + " expects a "
                + columnClass.getSimpleName() + ", got " + full.getClass().getSimpleName());
        }
        return columnClass.cast(full);
    }

    /**
     * Returns {@code column} as the column class this type appends to.
     *
     * @throws IllegalArgumentException if the column is constant or of another kind
     */
    protected <C extends Column> C targetAs(Column column, Class<C> columnClass) {
        if (column.isConst()) {
            throw new IllegalArgumentException("Cannot deserialize into a constant column of " + typeName());
        }
        return columnAs(column, columnClass);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || obj.getClass() != getClass()) return false;
        return typeName().equals(((DataType) obj).typeName());
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
