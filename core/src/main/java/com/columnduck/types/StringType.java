package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.StringColumn;
import com.columnduck.config.SerializationLimits;
import com.columnduck.exception.MalformedInputException;
import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.WriteBuffer;
import com.columnduck.value.ScalarValue;

/**
 * Data type representing a variable-length string of arbitrary bytes.
 *
 * <p>Binary form: ULEB128 length followed by the bytes. There is no fixed
 * value size, so {@link #getSizeOfField()} is not implemented.
 */
public final class StringType extends AbstractStringType {

    private static final StringType INSTANCE = new StringType();

    private StringType() {}

    public static StringType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public DataType clone() {
        return INSTANCE;
    }

    @Override
    public Column createColumn() {
        return new StringColumn();
    }

    @Override
    public ScalarValue getDefault() {
        return ScalarValue.ofBytes(new byte[0]);
    }

    @Override
    protected byte[] bytesAt(Column column, int row) {
        return columnAs(column, StringColumn.class).getBytes(row);
    }

    @Override
    protected void appendBytes(Column column, byte[] value) {
        targetAs(column, StringColumn.class).add(value);
    }

    private byte[] readSizedBytes(ReadBuffer in) {
        long size = BinaryEncoding.readVarUInt(in);
        if (!SerializationLimits.isWithin(size, SerializationLimits.MAX_STRING_SIZE)) {
            throw new MalformedInputException("Too large string size: " + size, typeName());
        }
        byte[] value = new byte[(int) size];
        in.readFully(value, 0, value.length);
        return value;
    }

    // ==================== Binary ====================

    @Override
    public void serializeBinaryBulk(Column column, WriteBuffer out, int offset, int limit) {
        StringColumn strings = columnAs(column, StringColumn.class);
        int end = bulkEnd(strings, offset, limit);
        for (int row = offset; row < end; row++) {
            BinaryEncoding.writeSizedBytes(strings.rawChars(), strings.offsetAt(row), strings.lengthAt(row), out);
        }
    }

    @Override
    public void deserializeBinaryBulk(Column column, ReadBuffer in, int limit, double avgValueSizeHint) {
        StringColumn strings = targetAs(column, StringColumn.class);
        if (avgValueSizeHint > 0 && limit > 0) {
            int rows = Math.min(limit, SerializationLimits.MAX_RESERVE_ROWS);
            double expected = strings.charsSize() + Math.ceil(avgValueSizeHint * rows);
            strings.reserveChars((int) Math.min(expected, SerializationLimits.MAX_STRING_SIZE));
            strings.reserve(strings.size() + rows);
        }
        for (int i = 0; i < limit && !in.eof(); i++) {
            strings.add(readSizedBytes(in));
        }
    }

    @Override
    public void serializeBinary(ScalarValue value, WriteBuffer out) {
        byte[] bytes = value.asBytes();
        BinaryEncoding.writeSizedBytes(bytes, 0, bytes.length, out);
    }

    @Override
    public ScalarValue deserializeBinary(ReadBuffer in) {
        return ScalarValue.ofBytes(readSizedBytes(in));
    }

    @Override
    public void serializeBinary(Column column, int row, WriteBuffer out) {
        StringColumn strings = columnAs(column, StringColumn.class);
        BinaryEncoding.writeSizedBytes(strings.rawChars(), strings.offsetAt(row), strings.lengthAt(row), out);
    }

    @Override
    public void deserializeBinary(Column column, ReadBuffer in) {
        StringColumn strings = targetAs(column, StringColumn.class);
        strings.add(readSizedBytes(in));
    }
}
