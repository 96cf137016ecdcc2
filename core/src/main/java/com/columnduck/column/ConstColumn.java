package com.columnduck.column;

import com.columnduck.value.ScalarValue;

import java.util.Objects;

/**
 * Column holding one value repeated {@code size} times.
 *
 * <p>The value lives in a single-row column of the underlying kind. Constant
 * columns cannot be appended to; serializers materialize them with
 * {@link #convertToFullColumn()}.
 */
public class ConstColumn implements Column {

    private final Column data;
    private int size;

    /**
     * Creates a constant column.
     *
     * @param data a column holding exactly one value
     * @param size the number of rows
     */
    public ConstColumn(Column data, int size) {
        this.data = Objects.requireNonNull(data, "data must not be null");
        if (data.size() != 1) {
            throw new IllegalArgumentException("data must hold exactly one value, got " + data.size());
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative, got: " + size);
        }
        this.size = size;
    }

    public ScalarValue value() {
        return data.get(0);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public ScalarValue get(int row) {
        Column.checkIndex(row, size);
        return data.get(0);
    }

    @Override
    public void insert(ScalarValue value) {
        throw new UnsupportedOperationException("Cannot insert into a constant column");
    }

    @Override
    public void insertDefault() {
        throw new UnsupportedOperationException("Cannot insert into a constant column");
    }

    @Override
    public void popBack(int n) {
        Column.checkPopBack(n, size);
        size -= n;
    }

    @Override
    public Column cloneEmpty() {
        return new ConstColumn(data, 0);
    }

    @Override
    public boolean isConst() {
        return true;
    }

    @Override
    public Column convertToFullColumn() {
        Column full = data.cloneEmpty();
        full.reserve(size);
        ScalarValue value = data.get(0);
        for (int i = 0; i < size; i++) {
            full.insert(value);
        }
        return full;
    }
}
