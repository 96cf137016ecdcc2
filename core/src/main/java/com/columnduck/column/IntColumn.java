package com.columnduck.column;

import com.columnduck.value.ScalarValue;

import java.util.Arrays;

/**
 * Column of 32-bit integers. Also backs 8 and 16 bit integers and dates.
 */
public class IntColumn implements IntegralColumn {

    private int[] data = new int[16];
    private int size;

    public int getInt(int row) {
        Column.checkIndex(row, size);
        return data[row];
    }

    public void add(int value) {
        if (size == data.length) {
            data = Arrays.copyOf(data, data.length * 2);
        }
        data[size++] = value;
    }

    @Override
    public long getLong(int row) {
        return getInt(row);
    }

    @Override
    public void addLong(long value) {
        add((int) value);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public ScalarValue get(int row) {
        return ScalarValue.ofLong(getInt(row));
    }

    @Override
    public void insert(ScalarValue value) {
        add((int) value.asLong());
    }

    @Override
    public void insertDefault() {
        add(0);
    }

    @Override
    public void popBack(int n) {
        Column.checkPopBack(n, size);
        size -= n;
    }

    @Override
    public Column cloneEmpty() {
        return new IntColumn();
    }

    @Override
    public void reserve(int capacity) {
        if (capacity > data.length) {
            data = Arrays.copyOf(data, capacity);
        }
    }
}
