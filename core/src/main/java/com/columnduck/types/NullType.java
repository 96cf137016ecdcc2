package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.NullColumn;
import com.columnduck.exception.MalformedInputException;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.TextEncoding;
import com.columnduck.io.WriteBuffer;
import com.columnduck.value.ScalarValue;

/**
 * Data type of the NULL literal: every value is null.
 *
 * <p>Binary form is one zero byte per value, so a stream still records how many
 * rows it holds.
 */
public final class NullType extends AbstractDataType {

    private static final NullType INSTANCE = new NullType();

    private NullType() {}

    public static NullType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "null";
    }

    @Override
    public boolean isNull() {
        return true;
    }

    @Override
    public boolean isNullable() {
        return true;
    }

    @Override
    public DataType clone() {
        return INSTANCE;
    }

    @Override
    public Column createColumn() {
        return new NullColumn();
    }

    @Override
    public ScalarValue getDefault() {
        return ScalarValue.NULL;
    }

    @Override
    public int getSizeOfField() {
        return 1;
    }

    private void readMarker(ReadBuffer in) {
        int b = in.readStrict();
        if (b != 0) {
            throw new MalformedInputException("Unexpected byte " + b + " for null value", typeName());
        }
    }

    // ==================== Binary ====================

    @Override
    public void serializeBinaryBulk(Column column, WriteBuffer out, int offset, int limit) {
        int end = bulkEnd(column, offset, limit);
        for (int row = offset; row < end; row++) {
            out.write(0);
        }
    }

    @Override
    public void deserializeBinaryBulk(Column column, ReadBuffer in, int limit, double avgValueSizeHint) {
        NullColumn nulls = targetAs(column, NullColumn.class);
        for (int i = 0; i < limit && !in.eof(); i++) {
            readMarker(in);
            nulls.insertDefault();
        }
    }

    @Override
    public void serializeBinary(ScalarValue value, WriteBuffer out) {
        if (!value.isNull()) {
            throw new IllegalArgumentException("Data type null cannot hold " + value);
        }
        out.write(0);
    }

    @Override
    public ScalarValue deserializeBinary(ReadBuffer in) {
        readMarker(in);
        return ScalarValue.NULL;
    }

    @Override
    public void serializeBinary(Column column, int row, WriteBuffer out) {
        Column.checkIndex(row, column.size());
        out.write(0);
    }

    @Override
    public void deserializeBinary(Column column, ReadBuffer in) {
        NullColumn nulls = targetAs(column, NullColumn.class);
        readMarker(in);
        nulls.insertDefault();
    }

    // ==================== Text ====================

    @Override
    public void serializeTextEscaped(Column column, int row, WriteBuffer out) {
        out.writeAscii("\\N");
    }

    @Override
    public void deserializeTextEscaped(Column column, ReadBuffer in) {
        NullColumn nulls = targetAs(column, NullColumn.class);
        TextEncoding.assertString(in, "\\N");
        nulls.insertDefault();
    }

    @Override
    public void serializeTextQuoted(Column column, int row, WriteBuffer out) {
        out.writeAscii("NULL");
    }

    @Override
    public void deserializeTextQuoted(Column column, ReadBuffer in) {
        NullColumn nulls = targetAs(column, NullColumn.class);
        TextEncoding.assertString(in, "NULL");
        nulls.insertDefault();
    }

    @Override
    public void serializeTextCSV(Column column, int row, WriteBuffer out) {
        out.writeAscii("\\N");
    }

    @Override
    public void deserializeTextCSV(Column column, ReadBuffer in, byte delimiter) {
        deserializeTextEscaped(column, in);
    }

    @Override
    public void serializeText(Column column, int row, WriteBuffer out) {
        out.writeAscii("NULL");
    }

    @Override
    public void serializeTextJSON(Column column, int row, WriteBuffer out, boolean forceQuoting64BitIntegers) {
        out.writeAscii("null");
    }

    @Override
    public void deserializeTextJSON(Column column, ReadBuffer in) {
        NullColumn nulls = targetAs(column, NullColumn.class);
        TextEncoding.assertString(in, "null");
        nulls.insertDefault();
    }
}
