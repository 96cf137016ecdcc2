package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.NullableColumn;
import com.columnduck.exception.MalformedInputException;
import com.columnduck.exception.StreamExhaustedException;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.TextEncoding;
import com.columnduck.io.WriteBuffer;
import com.columnduck.value.ScalarValue;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Objects;

/**
 * Data type wrapper that makes values of a nested type nullable.
 *
 * <p>Example: {@code nullable<integer>}
 *
 * <p>Multi-stream layout: a null map stream with one byte per row (1 for null),
 * then the nested type's streams. The null map suffix is {@code .null} at the
 * top level and {@code .null<level>} inside arrays, so stream names stay unique. A null row still has a default
 * value in the nested streams. Every other operation forwards to the nested type
 * after handling the null flag.
 */
public final class NullableType extends AbstractDataType {

    static final String NULL_MAP_SUFFIX = ".null";

    private static final int FLAG_CHUNK = 8192;

    private final DataType nestedType;

    /**
     * Creates a nullable type.
     *
     * @param nestedType the type of the non-null values; must not itself be nullable
     */
    public NullableType(DataType nestedType) {
        this.nestedType = Objects.requireNonNull(nestedType, "nestedType must not be null");
        if (nestedType.isNullable()) {
            throw new IllegalArgumentException("Nested type " + nestedType.typeName() + " cannot be inside nullable");
        }
    }

    /**
     * Returns the type of the non-null values.
     *
     * @return the nested type
     */
    public DataType nestedType() {
        return nestedType;
    }

    @Override
    public String typeName() {
        return "nullable<" + nestedType.typeName() + ">";
    }

    @Override
    public boolean isNullable() {
        return true;
    }

    @Override
    public boolean isNumeric() {
        return nestedType.isNumeric();
    }

    @Override
    public boolean isNumericNotNullable() {
        return false;
    }

    @Override
    public boolean behavesAsNumber() {
        return nestedType.behavesAsNumber();
    }

    @Override
    public DataType clone() {
        return new NullableType(nestedType.clone());
    }

    @Override
    public Column createColumn() {
        return new NullableColumn(nestedType.createColumn());
    }

    @Override
    public ScalarValue getDefault() {
        return ScalarValue.NULL;
    }

    @Override
    public int getSizeOfField() {
        return 1 + nestedType.getSizeOfField();
    }

    private static boolean readFlag(ReadBuffer in) {
        int flag = in.readStrict();
        if (flag > 1) {
            throw new MalformedInputException("Invalid null flag " + flag);
        }
        return flag == 1;
    }

    private static void insertNull(NullableColumn column) {
        column.nested().insertDefault();
        column.addNullFlag(true);
    }

    // ==================== Multi-stream binary ====================

    @Override
    public void describeMultipleStreams(List<String> out, int level) {
        out.add(level == 0 ? NULL_MAP_SUFFIX : NULL_MAP_SUFFIX + level);
        nestedType.describeMultipleStreams(out, level);
    }

    @Override
    public void serializeBinaryBulkWithMultipleStreams(Column column, List<WriteBuffer> streams,
                                                       boolean positionIndependentEncoding,
                                                       int offset, int limit) {
        NullableColumn nullable = columnAs(column, NullableColumn.class);
        int end = bulkEnd(nullable, offset, limit);
        checkStreams(streams.size());
        WriteBuffer nullMap = streams.get(0);
        for (int row = offset; row < end; row++) {
            nullMap.write(nullable.isNullAt(row) ? 1 : 0);
        }
        if (end > offset) {
            nestedType.serializeBinaryBulkWithMultipleStreams(nullable.nested(), streams.subList(1, streams.size()),
                positionIndependentEncoding, offset, end - offset);
        }
    }

    @Override
    public void deserializeBinaryBulkWithMultipleStreams(Column column, List<ReadBuffer> streams,
                                                         boolean positionIndependentEncoding,
                                                         int limit, double avgValueSizeHint) {
        NullableColumn nullable = targetAs(column, NullableColumn.class);
        checkStreams(streams.size());
        ReadBuffer nullMap = streams.get(0);
        byte[] flags = readFlags(nullMap, limit);
        if (flags.length == 0) {
            return;
        }

        Column nested = nullable.nested();
        int before = nested.size();
        try {
            nestedType.deserializeBinaryBulkWithMultipleStreams(nested, streams.subList(1, streams.size()),
                positionIndependentEncoding, flags.length, avgValueSizeHint);
        } catch (RuntimeException e) {
            nested.popBack(nested.size() - before);
            throw e;
        }
        int added = nested.size() - before;
        if (added != flags.length) {
            nested.popBack(added);
            throw new StreamExhaustedException("Null map holds " + flags.length
                + " rows but nested streams hold " + added, nullMap.count());
        }
        for (byte flag : flags) {
            nullable.addNullFlag(flag != 0);
        }
    }

    private byte[] readFlags(ReadBuffer nullMap, int limit) {
        ByteArrayOutputStream flags = new ByteArrayOutputStream();
        byte[] chunk = new byte[FLAG_CHUNK];
        int total = 0;
        while (total < limit) {
            int read = nullMap.readAvailable(chunk, 0, Math.min(chunk.length, limit - total));
            if (read == 0) {
                break;
            }
            for (int i = 0; i < read; i++) {
                if (chunk[i] != 0 && chunk[i] != 1) {
                    throw new MalformedInputException("Invalid null flag " + chunk[i], typeName());
                }
            }
            flags.write(chunk, 0, read);
            total += read;
        }
        return flags.toByteArray();
    }

    private void checkStreams(int count) {
        if (count < 2) {
            throw new IllegalArgumentException(typeName() + " needs a null map stream and nested streams, got " + count);
        }
    }

    // ==================== Bulk binary (single stream) ====================

    @Override
    public void serializeBinaryBulk(Column column, WriteBuffer out, int offset, int limit) {
        NullableColumn nullable = columnAs(column, NullableColumn.class);
        int end = bulkEnd(nullable, offset, limit);
        for (int row = offset; row < end; row++) {
            serializeBinary(nullable, row, out);
        }
    }

    @Override
    public void deserializeBinaryBulk(Column column, ReadBuffer in, int limit, double avgValueSizeHint) {
        NullableColumn nullable = targetAs(column, NullableColumn.class);
        for (int i = 0; i < limit && !in.eof(); i++) {
            deserializeBinary(nullable, in);
        }
    }

    // ==================== Per-value binary ====================

    @Override
    public void serializeBinary(ScalarValue value, WriteBuffer out) {
        if (value.isNull()) {
            out.write(1);
        } else {
            out.write(0);
            nestedType.serializeBinary(value, out);
        }
    }

    @Override
    public ScalarValue deserializeBinary(ReadBuffer in) {
        return readFlag(in) ? ScalarValue.NULL : nestedType.deserializeBinary(in);
    }

    @Override
    public void serializeBinary(Column column, int row, WriteBuffer out) {
        NullableColumn nullable = columnAs(column, NullableColumn.class);
        if (nullable.isNullAt(row)) {
            out.write(1);
        } else {
            out.write(0);
            nestedType.serializeBinary(nullable.nested(), row, out);
        }
    }

    @Override
    public void deserializeBinary(Column column, ReadBuffer in) {
        NullableColumn nullable = targetAs(column, NullableColumn.class);
        if (readFlag(in)) {
            insertNull(nullable);
        } else {
            nestedType.deserializeBinary(nullable.nested(), in);
            nullable.addNullFlag(false);
        }
    }

    // ==================== Text ====================

    @Override
    public void serializeTextEscaped(Column column, int row, WriteBuffer out) {
        NullableColumn nullable = columnAs(column, NullableColumn.class);
        if (nullable.isNullAt(row)) {
            out.writeAscii("\\N");
        } else {
            nestedType.serializeTextEscaped(nullable.nested(), row, out);
        }
    }

    @Override
    public void deserializeTextEscaped(Column column, ReadBuffer in) {
        NullableColumn nullable = targetAs(column, NullableColumn.class);
        if (TextEncoding.lookingAt(in, "\\N")) {
            TextEncoding.assertString(in, "\\N");
            insertNull(nullable);
        } else {
            nestedType.deserializeTextEscaped(nullable.nested(), in);
            nullable.addNullFlag(false);
        }
    }

    @Override
    public void serializeTextQuoted(Column column, int row, WriteBuffer out) {
        NullableColumn nullable = columnAs(column, NullableColumn.class);
        if (nullable.isNullAt(row)) {
            out.writeAscii("NULL");
        } else {
            nestedType.serializeTextQuoted(nullable.nested(), row, out);
        }
    }

    @Override
    public void deserializeTextQuoted(Column column, ReadBuffer in) {
        NullableColumn nullable = targetAs(column, NullableColumn.class);
        if (TextEncoding.lookingAt(in, "NULL")) {
            TextEncoding.assertString(in, "NULL");
            insertNull(nullable);
        } else {
            nestedType.deserializeTextQuoted(nullable.nested(), in);
            nullable.addNullFlag(false);
        }
    }

    @Override
    public void serializeTextCSV(Column column, int row, WriteBuffer out) {
        NullableColumn nullable = columnAs(column, NullableColumn.class);
        if (nullable.isNullAt(row)) {
            out.writeAscii("\\N");
        } else {
            nestedType.serializeTextCSV(nullable.nested(), row, out);
        }
    }

    @Override
    public void deserializeTextCSV(Column column, ReadBuffer in, byte delimiter) {
        NullableColumn nullable = targetAs(column, NullableColumn.class);
        if (TextEncoding.lookingAt(in, "\\N")) {
            TextEncoding.assertString(in, "\\N");
            insertNull(nullable);
        } else {
            nestedType.deserializeTextCSV(nullable.nested(), in, delimiter);
            nullable.addNullFlag(false);
        }
    }

    @Override
    public void serializeText(Column column, int row, WriteBuffer out) {
        NullableColumn nullable = columnAs(column, NullableColumn.class);
        if (nullable.isNullAt(row)) {
            out.writeAscii("NULL");
        } else {
            nestedType.serializeText(nullable.nested(), row, out);
        }
    }

    @Override
    public void serializeTextJSON(Column column, int row, WriteBuffer out, boolean forceQuoting64BitIntegers) {
        NullableColumn nullable = columnAs(column, NullableColumn.class);
        if (nullable.isNullAt(row)) {
            out.writeAscii("null");
        } else {
            nestedType.serializeTextJSON(nullable.nested(), row, out, forceQuoting64BitIntegers);
        }
    }

    @Override
    public void deserializeTextJSON(Column column, ReadBuffer in) {
        NullableColumn nullable = targetAs(column, NullableColumn.class);
        if (TextEncoding.lookingAt(in, "null")) {
            TextEncoding.assertString(in, "null");
            insertNull(nullable);
        } else {
            nestedType.deserializeTextJSON(nullable.nested(), in);
            nullable.addNullFlag(false);
        }
    }

    @Override
    public void serializeTextXML(Column column, int row, WriteBuffer out) {
        NullableColumn nullable = columnAs(column, NullableColumn.class);
        if (nullable.isNullAt(row)) {
            out.writeAscii("NULL");
        } else {
            nestedType.serializeTextXML(nullable.nested(), row, out);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NullableType)) return false;
        return nestedType.equals(((NullableType) obj).nestedType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NullableType.class, nestedType);
    }
}
