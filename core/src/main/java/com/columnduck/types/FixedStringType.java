package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.FixedStringColumn;
import com.columnduck.config.SerializationLimits;
import com.columnduck.exception.MalformedInputException;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.WriteBuffer;
import com.columnduck.value.ScalarValue;

import java.util.Arrays;

/**
 * Data type representing a string of exactly {@code n} bytes.
 *
 * <p>Shorter values are padded with zero bytes; longer values are rejected.
 * Binary form is the {@code n} bytes themselves.
 *
 * <p>Example: {@code fixedstring(16)} for a binary UUID.
 */
public final class FixedStringType extends AbstractStringType {

    private final int n;

    /**
     * Creates a fixed string type.
     *
     * @param n the value length in bytes (positive)
     */
    public FixedStringType(int n) {
        if (n <= 0 || n > SerializationLimits.MAX_STRING_SIZE) {
            throw new IllegalArgumentException("fixedstring length must be between 1 and "
                + SerializationLimits.MAX_STRING_SIZE + ", got: " + n);
        }
        this.n = n;
    }

    /**
     * Returns the value length in bytes.
     */
    public int n() {
        return n;
    }

    @Override
    public String typeName() {
        return "fixedstring(" + n + ")";
    }

    @Override
    public DataType clone() {
        return new FixedStringType(n);
    }

    @Override
    public int getSizeOfField() {
        return n;
    }

    @Override
    public Column createColumn() {
        return new FixedStringColumn(n);
    }

    @Override
    public ScalarValue getDefault() {
        return ScalarValue.ofBytes(new byte[n]);
    }

    @Override
    protected byte[] bytesAt(Column column, int row) {
        return columnAs(column, FixedStringColumn.class).getBytes(row);
    }

    @Override
    protected void appendBytes(Column column, byte[] value) {
        FixedStringColumn strings = targetAs(column, FixedStringColumn.class);
        if (value.length > n) {
            throw new MalformedInputException("Too large value for " + typeName() + ": " + value.length + " bytes", typeName());
        }
        strings.add(value);
    }

    // ==================== Binary ====================

    @Override
    public void serializeBinaryBulk(Column column, WriteBuffer out, int offset, int limit) {
        FixedStringColumn strings = columnAs(column, FixedStringColumn.class);
        int end = bulkEnd(strings, offset, limit);
        out.write(strings.rawChars(), offset * n, (end - offset) * n);
    }

    @Override
    public void deserializeBinaryBulk(Column column, ReadBuffer in, int limit, double avgValueSizeHint) {
        FixedStringColumn strings = targetAs(column, FixedStringColumn.class);
        strings.reserve(strings.size() + Math.min(limit, SerializationLimits.MAX_RESERVE_ROWS));
        byte[] value = new byte[n];
        for (int i = 0; i < limit && !in.eof(); i++) {
            in.readFully(value, 0, n);
            strings.add(value);
        }
    }

    @Override
    public void serializeBinary(ScalarValue value, WriteBuffer out) {
        byte[] bytes = value.asBytes();
        if (bytes.length > n) {
            throw new IllegalArgumentException("Value of " + bytes.length + " bytes does not fit " + typeName());
        }
        out.write(Arrays.copyOf(bytes, n));
    }

    @Override
    public ScalarValue deserializeBinary(ReadBuffer in) {
        byte[] value = new byte[n];
        in.readFully(value, 0, n);
        return ScalarValue.ofBytes(value);
    }

    @Override
    public void serializeBinary(Column column, int row, WriteBuffer out) {
        out.write(columnAs(column, FixedStringColumn.class).getBytes(row));
    }

    @Override
    public void deserializeBinary(Column column, ReadBuffer in) {
        FixedStringColumn strings = targetAs(column, FixedStringColumn.class);
        byte[] value = new byte[n];
        in.readFully(value, 0, n);
        strings.add(value);
    }
}
