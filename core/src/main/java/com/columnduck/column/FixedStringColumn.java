package com.columnduck.column;

import com.columnduck.value.ScalarValue;

import java.util.Arrays;

/**
 * Column of byte strings of exactly {@code n} bytes each. Shorter values are
 * padded with zero bytes on insertion.
 */
public class FixedStringColumn implements Column {

    private final int n;
    private byte[] chars;
    private int size;

    public FixedStringColumn(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive, got: " + n);
        }
        this.n = n;
        this.chars = new byte[n * 16];
    }

    public int n() {
        return n;
    }

    /**
     * Returns the backing byte array; value {@code row} starts at {@code row * n}.
     * Valid until the next append.
     */
    public byte[] rawChars() {
        return chars;
    }

    public byte[] getBytes(int row) {
        Column.checkIndex(row, size);
        return Arrays.copyOfRange(chars, row * n, (row + 1) * n);
    }

    /**
     * Appends a value of at most {@code n} bytes.
     *
     * @throws IllegalArgumentException if the value is longer than {@code n}
     */
    public void add(byte[] value, int offset, int length) {
        if (length > n) {
            throw new IllegalArgumentException("Value of " + length + " bytes does not fit fixed string of " + n);
        }
        reserve(size + 1);
        int start = size * n;
        System.arraycopy(value, offset, chars, start, length);
        Arrays.fill(chars, start + length, start + n, (byte) 0);
        size++;
    }

    public void add(byte[] value) {
        add(value, 0, value.length);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public ScalarValue get(int row) {
        return ScalarValue.ofBytes(getBytes(row));
    }

    @Override
    public void insert(ScalarValue value) {
        add(value.asBytes());
    }

    @Override
    public void insertDefault() {
        add(new byte[0]);
    }

    @Override
    public void popBack(int n) {
        Column.checkPopBack(n, size);
        size -= n;
    }

    @Override
    public Column cloneEmpty() {
        return new FixedStringColumn(n);
    }

    @Override
    public void reserve(int capacity) {
        long needed = (long) capacity * n;
        if (needed > chars.length) {
            chars = Arrays.copyOf(chars, (int) Math.max(needed, (long) chars.length * 2));
        }
    }
}
