package com.columnduck.column;

import com.columnduck.value.ScalarValue;

import java.util.Arrays;

/**
 * Column of variable-length byte strings.
 *
 * <p>All values share one contiguous byte array; {@code offsets[i]} is the end of
 * value {@code i}, so value {@code i} spans {@code [offsets[i-1], offsets[i])}.
 * <pre>
 *   values:  "ab", "", "cde"
 *   chars:   a b c d e
 *   offsets: 2 2 5
 * </pre>
 */
public class StringColumn implements Column {

    private byte[] chars = new byte[64];
    private int[] offsets = new int[16];
    private int size;

    /**
     * Returns the start offset of {@code row} in {@link #rawChars()}.
     */
    public int offsetAt(int row) {
        Column.checkIndex(row, size);
        return row == 0 ? 0 : offsets[row - 1];
    }

    public int lengthAt(int row) {
        return offsets[row] - offsetAt(row);
    }

    /**
     * Returns the backing byte array. Valid until the next append.
     */
    public byte[] rawChars() {
        return chars;
    }

    /**
     * Returns a copy of the bytes of {@code row}.
     */
    public byte[] getBytes(int row) {
        int start = offsetAt(row);
        return Arrays.copyOfRange(chars, start, offsets[row]);
    }

    /**
     * Returns the number of bytes used by all values.
     */
    public int charsSize() {
        return size == 0 ? 0 : offsets[size - 1];
    }

    public void add(byte[] value) {
        add(value, 0, value.length);
    }

    public void add(byte[] value, int offset, int length) {
        int start = charsSize();
        reserveChars(start + length);
        System.arraycopy(value, offset, chars, start, length);
        if (size == offsets.length) {
            offsets = Arrays.copyOf(offsets, offsets.length * 2);
        }
        offsets[size++] = start + length;
    }

    /**
     * Pre-sizes the byte storage for {@code capacity} bytes in total.
     */
    public void reserveChars(int capacity) {
        if (capacity > chars.length) {
            chars = Arrays.copyOf(chars, Math.max(capacity, chars.length * 2));
        }
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
        return new StringColumn();
    }

    @Override
    public void reserve(int capacity) {
        if (capacity > offsets.length) {
            offsets = Arrays.copyOf(offsets, capacity);
        }
    }
}
