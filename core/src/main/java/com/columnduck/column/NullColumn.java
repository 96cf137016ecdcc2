package com.columnduck.column;

import com.columnduck.value.ScalarValue;

/**
 * Column whose every value is null. Stores only its size.
 */
public class NullColumn implements Column {

    private int size;

    @Override
    public int size() {
        return size;
    }

    @Override
    public ScalarValue get(int row) {
        Column.checkIndex(row, size);
        return ScalarValue.NULL;
    }

    @Override
    public void insert(ScalarValue value) {
        if (!value.isNull()) {
            throw new IllegalStateException("Null column accepts only NULL, got " + value.kind());
        }
        size++;
    }

    @Override
    public void insertDefault() {
        size++;
    }

    @Override
    public void popBack(int n) {
        Column.checkPopBack(n, size);
        size -= n;
    }

    @Override
    public Column cloneEmpty() {
        return new NullColumn();
    }
}
