package com.columnduck.column;

import com.columnduck.value.ScalarValue;

import java.util.Arrays;

/**
 * Column of 64-bit floating point values.
 */
public class DoubleColumn implements FloatingColumn {

    private double[] data = new double[16];
    private int size;

    @Override
    public double getDouble(int row) {
        Column.checkIndex(row, size);
        return data[row];
    }

    @Override
    public void addDouble(double value) {
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
        return ScalarValue.ofDouble(getDouble(row));
    }

    @Override
    public void insert(ScalarValue value) {
        addDouble(value.asDouble());
    }

    @Override
    public void insertDefault() {
        addDouble(0d);
    }

    @Override
    public void popBack(int n) {
        Column.checkPopBack(n, size);
        size -= n;
    }

    @Override
    public Column cloneEmpty() {
        return new DoubleColumn();
    }

    @Override
    public void reserve(int capacity) {
        if (capacity > data.length) {
            data = Arrays.copyOf(data, capacity);
        }
    }
}
