package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.exception.NotImplementedException;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.WriteBuffer;
import com.columnduck.value.ScalarValue;

import java.util.List;

/**
 * Descriptor of a column data type: naming, classification, column factories
 * and every serialization format a column of the type can be stored in or
 * exchanged through.
 *
 * <p>Descriptors are immutable and may be shared by any number of threads and
 * columns. Adding a type means adding an implementation; callers never need the
 * concrete class.
 *
 * <p>Serialization paths:
 * <ul>
 *   <li>Bulk binary: a range of column rows to or from one stream, raw concatenation
 *       of per-value encodings with no count prefix</li>
 *   <li>Multi-stream binary: composite types split rows over several named streams
 *       (see {@link #describeMultipleStreams(List, int)})</li>
 *   <li>Per-value binary: one value to or from a stream, either as a {@link ScalarValue}
 *       or as a column row; the encoding of a composite value is self-contained and may
 *       differ from its bulk encoding</li>
 *   <li>Text: Escaped, Quoted, CSV, Plain, JSON and XML forms of one column row</li>
 * </ul>
 *
 * <p>Every method that deserializes a single value into a column leaves the
 * column unchanged when it throws. Bulk deserialization keeps values appended
 * earlier in the same call; callers needing atomicity read into a scratch
 * column and swap it in on success.
 *
 * @see DataTypeCatalog
 * @see DataTypeFactory
 */
public interface DataType {

    /**
     * Returns the canonical name, unique per type configuration (e.g. {@code fixedstring(16)}).
     *
     * @return the type name
     */
    String typeName();

    /**
     * Is this the type of the NULL literal?
     */
    default boolean isNull() {
        return false;
    }

    /**
     * Can values of this type be null?
     */
    default boolean isNullable() {
        return false;
    }

    /**
     * Is this type numeric? Dates and timestamps count as numeric.
     */
    default boolean isNumeric() {
        return false;
    }

    /**
     * Is this type numeric and not nullable?
     */
    default boolean isNumericNotNullable() {
        return isNumeric();
    }

    /**
     * If this type is numeric, do arithmetic and numeric casts apply to it directly?
     * True for numbers, false for dates and timestamps.
     */
    default boolean behavesAsNumber() {
        return false;
    }

    /**
     * Returns an independent descriptor of the same logical type.
     */
    DataType clone();

    /**
     * Creates an empty column of this type.
     */
    Column createColumn();

    /**
     * Creates a column of {@code size} rows that all hold {@code value}.
     */
    Column createConstColumn(int size, ScalarValue value);

    /**
     * Returns the zero or empty value of this type.
     */
    ScalarValue getDefault();

    /**
     * Returns the approximate size in bytes of one value.
     *
     * @throws NotImplementedException if the type has no fixed value size
     */
    default int getSizeOfField() {
        throw new NotImplementedException(
            "getSizeOfField() method is not implemented for data type " + typeName(), typeName());
    }

    // ==================== Bulk binary ====================

    /**
     * Writes rows {@code [offset, offset + limit)} of {@code column}.
     *
     * @param column the column to read from
     * @param out the destination stream
     * @param offset the first row; must not exceed the column size
     * @param limit the number of rows, 0 meaning up to the end; a range past the end stops at the end
     */
    void serializeBinaryBulk(Column column, WriteBuffer out, int offset, int limit);

    /**
     * Reads at most {@code limit} values and appends them to {@code column}.
     * Stops early, without error, if the stream ends at a value boundary.
     *
     * @param column the column to append to
     * @param in the source stream
     * @param limit the maximum number of values to read
     * @param avgValueSizeHint if non-zero, the expected average value size in bytes; used only to pre-size storage
     */
    void deserializeBinaryBulk(Column column, ReadBuffer in, int limit, double avgValueSizeHint);

    // ==================== Multi-stream binary ====================

    /**
     * Appends one suffix per stream this type needs at nesting {@code level}, for
     * example {@code ".null"}, {@code ".size0"}, {@code ""}. Concatenated with a base
     * name, the suffixes name the physical streams.
     */
    default void describeMultipleStreams(List<String> out, int level) {
        out.add("");
    }

    /**
     * Writes rows {@code [offset, offset + limit)} over the streams named by
     * {@link #describeMultipleStreams(List, int)}, in the same order.
     *
     * @param positionIndependentEncoding if true, write no absolute offsets so the streams stay
     *        valid when concatenated or read from another position
     */
    default void serializeBinaryBulkWithMultipleStreams(Column column, List<WriteBuffer> streams,
                                                        boolean positionIndependentEncoding,
                                                        int offset, int limit) {
        serializeBinaryBulk(column, streams.get(0), offset, limit);
    }

    /**
     * Reads at most {@code limit} values from the streams named by
     * {@link #describeMultipleStreams(List, int)} and appends them to {@code column}.
     */
    default void deserializeBinaryBulkWithMultipleStreams(Column column, List<ReadBuffer> streams,
                                                          boolean positionIndependentEncoding,
                                                          int limit, double avgValueSizeHint) {
        deserializeBinaryBulk(column, streams.get(0), limit, avgValueSizeHint);
    }

    // ==================== Per-value binary ====================

    void serializeBinary(ScalarValue value, WriteBuffer out);

    ScalarValue deserializeBinary(ReadBuffer in);

    /**
     * Writes the value at {@code row}.
     */
    void serializeBinary(Column column, int row, WriteBuffer out);

    /**
     * Reads one value and appends it. On failure the column is left unchanged.
     */
    void deserializeBinary(Column column, ReadBuffer in);

    // ==================== Text ====================

    /**
     * Writes the value at {@code row} with backslash escaping and no quoting.
     */
    void serializeTextEscaped(Column column, int row, WriteBuffer out);

    void deserializeTextEscaped(Column column, ReadBuffer in);

    /**
     * Writes the value at {@code row} as a literal that can be inserted into a query.
     */
    void serializeTextQuoted(Column column, int row, WriteBuffer out);

    void deserializeTextQuoted(Column column, ReadBuffer in);

    void serializeTextCSV(Column column, int row, WriteBuffer out);

    /**
     * Reads one CSV field.
     *
     * @param delimiter the byte that ends an unquoted field; it is not consumed
     */
    void deserializeTextCSV(Column column, ReadBuffer in, byte delimiter);

    /**
     * Writes the value at {@code row} for display, without escaping or quoting.
     */
    void serializeText(Column column, int row, WriteBuffer out);

    /**
     * Writes the value at {@code row} as a JSON value.
     *
     * @param forceQuoting64BitIntegers write 64-bit integers as JSON strings, since many JSON
     *        readers cannot represent them exactly as numbers
     */
    void serializeTextJSON(Column column, int row, WriteBuffer out, boolean forceQuoting64BitIntegers);

    void deserializeTextJSON(Column column, ReadBuffer in);

    /**
     * Writes the value at {@code row} as XML element content. Types whose text can hold
     * XML special characters override this.
     */
    default void serializeTextXML(Column column, int row, WriteBuffer out) {
        serializeText(column, row, out);
    }
}
