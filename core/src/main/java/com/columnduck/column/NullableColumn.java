package com.columnduck.column;

import com.columnduck.value.ScalarValue;

import java.util.Arrays;
import java.util.Objects;

/**
 * Column wrapper that adds a null flag per row.
 *
 * <p>A null row still occupies a (default) slot in the nested column, so row
 * {@code i} of this column is row {@code i} of the nested column.
 */
public class NullableColumn implements Column {

    private final Column nested;
    private byte[] nullMap = new byte[16];
    private int size;

    /**
     * Wraps an empty nested column.
     *
     * @param nested the column holding the non-null values
     */
    public NullableColumn(Column nested) {
        this.nested = Objects.requireNonNull(nested, "nested must not be null");
        if (!nested.isEmpty()) {
            throw new IllegalArgumentException("nested column must be empty");
        }
    }

    public Column nested() {
        return nested;
    }

    public boolean isNullAt(int row) {
        Column.checkIndex(row, size);
        return nullMap[row] != 0;
    }

    /**
     * Records the null flag of a row whose nested value has just been appended.
     * Callers must keep the nested column exactly one row ahead of the flags.
     */
    public void addNullFlag(boolean isNull) {
        if (nested.size() != size + 1) {
            throw new IllegalStateException("Nested column has " + nested.size()
                + " rows, expected " + (size + 1) + " before adding a null flag");
        }
        if (size == nullMap.length) {
            nullMap = Arrays.copyOf(nullMap, nullMap.length * 2);
        }
        nullMap[size++] = (byte) (isNull ? 1 : 0);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public ScalarValue get(int row) {
        return isNullAt(row) ? ScalarValue.NULL : nested.get(row);
    }

    @Override
    public void insert(ScalarValue value) {
        if (value.isNull()) {
            nested.insertDefault();
            addNullFlag(true);
        } else {
            nested.insert(value);
            addNullFlag(false);
        }
    }

    @Override
    public void insertDefault() {
        nested.insertDefault();
        addNullFlag(true);
    }

    @Override
    public void popBack(int n) {
        Column.checkPopBack(n, size);
        nested.popBack(n);
        size -= n;
    }

    @Override
    public Column cloneEmpty() {
        return new NullableColumn(nested.cloneEmpty());
    }

    @Override
    public void reserve(int capacity) {
        nested.reserve(capacity);
        if (capacity > nullMap.length) {
            nullMap = Arrays.copyOf(nullMap, capacity);
        }
    }
}
