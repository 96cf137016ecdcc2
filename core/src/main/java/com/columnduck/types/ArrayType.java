package com.columnduck.types;

import com.columnduck.column.ArrayColumn;
import com.columnduck.column.Column;
import com.columnduck.config.SerializationLimits;
import com.columnduck.exception.MalformedInputException;
import com.columnduck.exception.StreamExhaustedException;
import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.TextEncoding;
import com.columnduck.io.WriteBuffer;
import com.columnduck.value.ScalarValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Data type representing a variable-length array of elements of one type.
 *
 * <p>Example: {@code array<nullable<string>>}
 *
 * <p>Multi-stream layout: a {@code .size<level>} stream of UInt64 values, then
 * the element type's streams one level deeper. With position-independent
 * encoding each value is a row's element count. Otherwise it is the row's
 * end offset in the source element column, and a reader continues from the last
 * end offset of the destination column. Such blocks read back when they are
 * written in row order from the first row and read in order into one column,
 * in chunks of any size.
 */
public final class ArrayType extends AbstractDataType {

    static final String SIZES_SUFFIX = ".size";

    private final DataType elementType;

    /**
     * Creates an array type.
     *
     * @param elementType the type of the elements
     */
    public ArrayType(DataType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
    }

    public DataType elementType() {
        return elementType;
    }

    @Override
    public String typeName() {
        return "array<" + elementType.typeName() + ">";
    }

    @Override
    public DataType clone() {
        return new ArrayType(elementType.clone());
    }

    @Override
    public Column createColumn() {
        return new ArrayColumn(elementType.createColumn());
    }

    @Override
    public ScalarValue getDefault() {
        return ScalarValue.ofArray(List.of());
    }

    private int readArraySize(ReadBuffer in) {
        long size = BinaryEncoding.readVarUInt(in);
        if (!SerializationLimits.isWithin(size, SerializationLimits.MAX_ARRAY_SIZE)) {
            throw new MalformedInputException("Too large array size: " + size, typeName());
        }
        return (int) size;
    }

    private static void rollback(Column data, int before) {
        data.popBack(data.size() - before);
    }

    // ==================== Multi-stream binary ====================

    @Override
    public void describeMultipleStreams(List<String> out, int level) {
        out.add(SIZES_SUFFIX + level);
        elementType.describeMultipleStreams(out, level + 1);
    }

    @Override
    public void serializeBinaryBulkWithMultipleStreams(Column column, List<WriteBuffer> streams,
                                                       boolean positionIndependentEncoding,
                                                       int offset, int limit) {
        ArrayColumn arrays = columnAs(column, ArrayColumn.class);
        int end = bulkEnd(arrays, offset, limit);
        checkStreams(streams.size());
        WriteBuffer sizes = streams.get(0);
        for (int row = offset; row < end; row++) {
            long value = positionIndependentEncoding ? arrays.sizeAt(row) : arrays.endOffsetAt(row);
            BinaryEncoding.writeIntegerLE(value, 8, sizes);
        }
        if (end == offset) {
            return;
        }
        int dataStart = arrays.offsetAt(offset);
        int dataEnd = arrays.endOffsetAt(end - 1);
        // A zero limit means "to the end" for the element type, so empty ranges are skipped.
        if (dataEnd > dataStart) {
            elementType.serializeBinaryBulkWithMultipleStreams(arrays.data(), streams.subList(1, streams.size()),
                positionIndependentEncoding, dataStart, dataEnd - dataStart);
        }
    }

    @Override
    public void deserializeBinaryBulkWithMultipleStreams(Column column, List<ReadBuffer> streams,
                                                         boolean positionIndependentEncoding,
                                                         int limit, double avgValueSizeHint) {
        ArrayColumn arrays = targetAs(column, ArrayColumn.class);
        checkStreams(streams.size());
        ReadBuffer sizes = streams.get(0);

        int[] rowSizes = new int[Math.min(Math.max(limit, 0), 1024)];
        int rows = 0;
        long total = 0;
        // Offsets continue from the elements already in the destination column.
        long previousEnd = arrays.size() == 0 ? 0 : arrays.endOffsetAt(arrays.size() - 1);
        while (rows < limit && !sizes.eof()) {
            long value = BinaryEncoding.readIntegerLE(sizes, 8);
            long size = positionIndependentEncoding ? value : value - previousEnd;
            if (!positionIndependentEncoding) {
                previousEnd = value;
            }
            if (!SerializationLimits.isWithin(size, SerializationLimits.MAX_ARRAY_SIZE)) {
                throw new MalformedInputException("Invalid array size " + size + " at row " + rows, typeName());
            }
            total += size;
            if (total > Integer.MAX_VALUE) {
                throw new MalformedInputException("Too many array elements: " + total, typeName());
            }
            if (rows == rowSizes.length) {
                rowSizes = Arrays.copyOf(rowSizes, Math.max(16, rowSizes.length * 2));
            }
            rowSizes[rows++] = (int) size;
        }
        if (rows == 0) {
            return;
        }

        Column data = arrays.data();
        int before = data.size();
        if (total > 0) {
            try {
                elementType.deserializeBinaryBulkWithMultipleStreams(data, streams.subList(1, streams.size()),
                    positionIndependentEncoding, (int) total, 0);
            } catch (RuntimeException e) {
                rollback(data, before);
                throw e;
            }
        }
        int added = data.size() - before;
        if (added != total) {
            rollback(data, before);
            throw new StreamExhaustedException("Array sizes describe " + total
                + " elements but element streams hold " + added, sizes.count());
        }
        int endOffset = before;
        for (int i = 0; i < rows; i++) {
            endOffset += rowSizes[i];
            arrays.addOffset(endOffset);
        }
    }

    private void checkStreams(int count) {
        if (count < 2) {
            throw new IllegalArgumentException(typeName() + " needs a sizes stream and element streams, got " + count);
        }
    }

    // ==================== Bulk binary (single stream) ====================

    @Override
    public void serializeBinaryBulk(Column column, WriteBuffer out, int offset, int limit) {
        ArrayColumn arrays = columnAs(column, ArrayColumn.class);
        int end = bulkEnd(arrays, offset, limit);
        for (int row = offset; row < end; row++) {
            serializeBinary(arrays, row, out);
        }
    }

    @Override
    public void deserializeBinaryBulk(Column column, ReadBuffer in, int limit, double avgValueSizeHint) {
        ArrayColumn arrays = targetAs(column, ArrayColumn.class);
        for (int i = 0; i < limit && !in.eof(); i++) {
            deserializeBinary(arrays, in);
        }
    }

    // ==================== Per-value binary ====================

    @Override
    public void serializeBinary(ScalarValue value, WriteBuffer out) {
        List<ScalarValue> elements = value.asArray();
        BinaryEncoding.writeVarUInt(elements.size(), out);
        for (ScalarValue element : elements) {
            elementType.serializeBinary(element, out);
        }
    }

    @Override
    public ScalarValue deserializeBinary(ReadBuffer in) {
        int size = readArraySize(in);
        List<ScalarValue> elements = new ArrayList<>(Math.min(size, SerializationLimits.MAX_RESERVE_ROWS));
        for (int i = 0; i < size; i++) {
            elements.add(elementType.deserializeBinary(in));
        }
        return ScalarValue.ofArray(elements);
    }

    @Override
    public void serializeBinary(Column column, int row, WriteBuffer out) {
        ArrayColumn arrays = columnAs(column, ArrayColumn.class);
        int start = arrays.offsetAt(row);
        int end = arrays.endOffsetAt(row);
        BinaryEncoding.writeVarUInt(end - start, out);
        for (int i = start; i < end; i++) {
            elementType.serializeBinary(arrays.data(), i, out);
        }
    }

    @Override
    public void deserializeBinary(Column column, ReadBuffer in) {
        ArrayColumn arrays = targetAs(column, ArrayColumn.class);
        int size = readArraySize(in);
        Column data = arrays.data();
        int before = data.size();
        try {
            for (int i = 0; i < size; i++) {
                elementType.deserializeBinary(data, in);
            }
        } catch (RuntimeException e) {
            rollback(data, before);
            throw e;
        }
        arrays.addOffset(data.size());
    }

    // ==================== Text ====================

    private void writeQuotedElements(ArrayColumn arrays, int row, WriteBuffer out) {
        int start = arrays.offsetAt(row);
        int end = arrays.endOffsetAt(row);
        out.write('[');
        for (int i = start; i < end; i++) {
            if (i > start) {
                out.write(',');
            }
            elementType.serializeTextQuoted(arrays.data(), i, out);
        }
        out.write(']');
    }

    /**
     * Reads {@code [e1,e2,...]} and closes a new row. Elements are in JSON form when
     * {@code json} is set, in quoted form otherwise.
     */
    private void readElements(ArrayColumn arrays, ReadBuffer in, boolean json) {
        Column data = arrays.data();
        int before = data.size();
        try {
            TextEncoding.assertChar(in, '[');
            TextEncoding.skipWhitespace(in);
            if (!in.checkChar(']')) {
                while (true) {
                    TextEncoding.skipWhitespace(in);
                    if (json) {
                        elementType.deserializeTextJSON(data, in);
                    } else {
                        elementType.deserializeTextQuoted(data, in);
                    }
                    TextEncoding.skipWhitespace(in);
                    if (in.checkChar(',')) {
                        continue;
                    }
                    TextEncoding.assertChar(in, ']');
                    break;
                }
            }
        } catch (RuntimeException e) {
            rollback(data, before);
            throw e;
        }
        arrays.addOffset(data.size());
    }

    @Override
    public void serializeTextEscaped(Column column, int row, WriteBuffer out) {
        writeQuotedElements(columnAs(column, ArrayColumn.class), row, out);
    }

    @Override
    public void deserializeTextEscaped(Column column, ReadBuffer in) {
        readElements(targetAs(column, ArrayColumn.class), in, false);
    }

    @Override
    public void serializeTextQuoted(Column column, int row, WriteBuffer out) {
        writeQuotedElements(columnAs(column, ArrayColumn.class), row, out);
    }

    @Override
    public void deserializeTextQuoted(Column column, ReadBuffer in) {
        readElements(targetAs(column, ArrayColumn.class), in, false);
    }

    @Override
    public void serializeTextCSV(Column column, int row, WriteBuffer out) {
        WriteBuffer text = WriteBuffer.inMemory();
        writeQuotedElements(columnAs(column, ArrayColumn.class), row, text);
        byte[] bytes = text.toBytes();
        TextEncoding.writeCSVString(bytes, 0, bytes.length, out);
    }

    @Override
    public void deserializeTextCSV(Column column, ReadBuffer in, byte delimiter) {
        ArrayColumn arrays = targetAs(column, ArrayColumn.class);
        ReadBuffer field = ReadBuffer.of(TextEncoding.readCSVString(in, delimiter));
        readElements(arrays, field, false);
        if (!field.eof()) {
            arrays.popBack(1);
            throw new MalformedInputException("Unexpected text after array in CSV field", typeName());
        }
    }

    @Override
    public void serializeText(Column column, int row, WriteBuffer out) {
        writeQuotedElements(columnAs(column, ArrayColumn.class), row, out);
    }

    @Override
    public void serializeTextJSON(Column column, int row, WriteBuffer out, boolean forceQuoting64BitIntegers) {
        ArrayColumn arrays = columnAs(column, ArrayColumn.class);
        int start = arrays.offsetAt(row);
        int end = arrays.endOffsetAt(row);
        out.write('[');
        for (int i = start; i < end; i++) {
            if (i > start) {
                out.write(',');
            }
            elementType.serializeTextJSON(arrays.data(), i, out, forceQuoting64BitIntegers);
        }
        out.write(']');
    }

    @Override
    public void deserializeTextJSON(Column column, ReadBuffer in) {
        readElements(targetAs(column, ArrayColumn.class), in, true);
    }

    @Override
    public void serializeTextXML(Column column, int row, WriteBuffer out) {
        ArrayColumn arrays = columnAs(column, ArrayColumn.class);
        int start = arrays.offsetAt(row);
        int end = arrays.endOffsetAt(row);
        out.writeAscii("<array>");
        for (int i = start; i < end; i++) {
            out.writeAscii("<elem>");
            elementType.serializeTextXML(arrays.data(), i, out);
            out.writeAscii("</elem>");
        }
        out.writeAscii("</array>");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayType)) return false;
        return elementType.equals(((ArrayType) obj).elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ArrayType.class, elementType);
    }
}
