package com.columnduck.column;

import com.columnduck.value.ScalarValue;

/**
 * An append-only, randomly indexable sequence of values of one data type.
 *
 * <p>A column is mutated only by appends and by removing values from its end
 * ({@link #popBack(int)}), which is how deserializers roll back a failed append.
 * Columns are not thread-safe: at most one thread may mutate a column, and
 * concurrent readers are safe only while nobody mutates it.
 *
 * <p>Implementations:
 * <ul>
 *   <li>Fixed-width values: {@link IntColumn}, {@link LongColumn}, {@link FloatColumn}, {@link DoubleColumn}</li>
 *   <li>Bytes: {@link StringColumn}, {@link FixedStringColumn}</li>
 *   <li>Composite: {@link NullableColumn}, {@link ArrayColumn}</li>
 *   <li>Special: {@link NullColumn}, {@link ConstColumn}</li>
 * </ul>
 */
public interface Column {

    /**
     * Returns the number of values.
     */
    int size();

    /**
     * Returns the value at {@code row} as a scalar value.
     *
     * @throws IndexOutOfBoundsException if {@code row} is out of range
     */
    ScalarValue get(int row);

    /**
     * Appends a value.
     *
     * @throws IllegalStateException if the value is of the wrong kind; the column is unchanged
     */
    void insert(ScalarValue value);

    /**
     * Appends the zero or empty value of the column's type.
     */
    void insertDefault();

    /**
     * Removes the last {@code n} values.
     */
    void popBack(int n);

    /**
     * Returns a new empty column of the same kind and parameters.
     */
    Column cloneEmpty();

    /**
     * Pre-sizes the column for {@code capacity} values in total.
     */
    default void reserve(int capacity) {
    }

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns true for columns that hold one value repeated.
     */
    default boolean isConst() {
        return false;
    }

    /**
     * Returns a column in which every row is materialized; a non-constant column returns itself.
     */
    default Column convertToFullColumn() {
        return this;
    }

    static void checkIndex(int row, int size) {
        if (row < 0 || row >= size) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for column of size " + size);
        }
    }

    static void checkPopBack(int n, int size) {
        if (n < 0 || n > size) {
            throw new IllegalArgumentException("Cannot pop " + n + " values from column of size " + size);
        }
    }
}
