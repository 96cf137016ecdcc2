package com.columnduck.column;

import com.columnduck.value.ScalarValue;

import java.util.Arrays;

/**
 * Column of 32-bit floating point values.
 */
public class FloatColumn implements FloatingColumn {

    private float[] data = new float[16];
    private int size;

    public float getFloat(int row) {
        Column.checkIndex(row, size);
        return data[row];
    }

    public void add(float value) {
        if (size == data.length) {
            data = Arrays.copyOf(data, data.length * 2);
        }
        data[size++] = value;
    }

    @Override
    public double getDouble(int row) {
        return getFloat(row);
    }

    @Override
    public void addDouble(double value) {
        add((float) value);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public ScalarValue get(int row) {
        return ScalarValue.ofDouble(getFloat(row));
    }

    @Override
    public void insert(ScalarValue value) {
        add((float) value.asDouble());
    }

    @Override
    public void insertDefault() {
        add(0f);
    }

    @Override
    public void popBack(int n) {
        Column.checkPopBack(n, size);
        size -= n;
    }

    @Override
    public Column cloneEmpty() {
        return new FloatColumn();
    }

    @Override
    public void reserve(int capacity) {
        if (capacity > data.length) {
            data = Arrays.copyOf(data, capacity);
        }
    }
}
