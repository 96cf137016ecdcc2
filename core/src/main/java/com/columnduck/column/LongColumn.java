package com.columnduck.column;

import com.columnduck.value.ScalarValue;

import java.util.Arrays;

/**
 * Column of 64-bit integers. Also backs timestamps.
 */
public class LongColumn implements IntegralColumn {

    private long[] data = new long[16];
    private int size;

    @Override
    public long getLong(int row) {
        Column.checkIndex(row, size);
        return data[row];
    }

    @Override
    public void addLong(long value) {
        if (size == data.length) {
            data = Arrays.copyOf(data, data.length * 2);
        }
        data[size++] = value;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public ScalarValue get(int row) {
        return ScalarValue.ofLong(getLong(row));
    }

    @Override
    public void insert(ScalarValue value) {
        addLong(value.asLong());
    }

    @Override
    public void insertDefault() {
        addLong(0);
    }

    @Override
    public void popBack(int n) {
        Column.checkPopBack(n, size);
        size -= n;
    }

    @Override
    public Column cloneEmpty() {
        return new LongColumn();
    }

    @Override
    public void reserve(int capacity) {
        if (capacity > data.length) {
            data = Arrays.copyOf(data, capacity);
        }
    }
}
