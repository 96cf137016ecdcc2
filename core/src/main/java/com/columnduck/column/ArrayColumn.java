package com.columnduck.column;

import com.columnduck.value.ScalarValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Column of arrays stored as one flattened element column plus end offsets.
 *
 * <pre>
 *   values:  [1, 2, 3], [], [4, 5]
 *   data:    1 2 3 4 5
 *   offsets: 3 3 5
 * </pre>
 */
public class ArrayColumn implements Column {

    private final Column data;
    private int[] offsets = new int[16];
    private int size;

    /**
     * Wraps an empty element column.
     *
     * @param data the column receiving the flattened elements
     */
    public ArrayColumn(Column data) {
        this.data = Objects.requireNonNull(data, "data must not be null");
        if (!data.isEmpty()) {
            throw new IllegalArgumentException("data column must be empty");
        }
    }

    public Column data() {
        return data;
    }

    /**
     * Returns the index in {@link #data()} of the first element of {@code row}.
     */
    public int offsetAt(int row) {
        Column.checkIndex(row, size);
        return row == 0 ? 0 : offsets[row - 1];
    }

    /**
     * Returns the index in {@link #data()} just past the last element of {@code row}.
     */
    public int endOffsetAt(int row) {
        Column.checkIndex(row, size);
        return offsets[row];
    }

    public int sizeAt(int row) {
        return endOffsetAt(row) - offsetAt(row);
    }

    /**
     * Closes a row whose elements have already been appended to {@link #data()}.
     *
     * @param endOffset the size of the data column after the row's elements
     */
    public void addOffset(int endOffset) {
        int previous = size == 0 ? 0 : offsets[size - 1];
        if (endOffset < previous || endOffset > data.size()) {
            throw new IllegalStateException("Offset " + endOffset + " outside [" + previous + ", " + data.size() + "]");
        }
        if (size == offsets.length) {
            offsets = Arrays.copyOf(offsets, offsets.length * 2);
        }
        offsets[size++] = endOffset;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public ScalarValue get(int row) {
        int start = offsetAt(row);
        int end = offsets[row];
        List<ScalarValue> elements = new ArrayList<>(end - start);
        for (int i = start; i < end; i++) {
            elements.add(data.get(i));
        }
        return ScalarValue.ofArray(elements);
    }

    @Override
    public void insert(ScalarValue value) {
        List<ScalarValue> elements = value.asArray();
        int before = data.size();
        try {
            for (ScalarValue element : elements) {
                data.insert(element);
            }
        } catch (RuntimeException e) {
            data.popBack(data.size() - before);
            throw e;
        }
        addOffset(data.size());
    }

    @Override
    public void insertDefault() {
        addOffset(data.size());
    }

    @Override
    public void popBack(int n) {
        Column.checkPopBack(n, size);
        size -= n;
        int end = size == 0 ? 0 : offsets[size - 1];
        data.popBack(data.size() - end);
    }

    @Override
    public Column cloneEmpty() {
        return new ArrayColumn(data.cloneEmpty());
    }

    @Override
    public void reserve(int capacity) {
        if (capacity > offsets.length) {
            offsets = Arrays.copyOf(offsets, capacity);
        }
    }
}
