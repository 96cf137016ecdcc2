package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.TextEncoding;
import com.columnduck.io.WriteBuffer;

/**
 * Base class for byte string types. Holds the text formats, which are the same
 * for variable and fixed length strings; subclasses supply storage and binary layout.
 *
 * <p>Every text reader parses the whole value before appending it, so a parse
 * failure never leaves a partial value in the column.
 */
public abstract class AbstractStringType extends AbstractDataType {

    /**
     * Returns a copy of the bytes at {@code row}.
     */
    protected abstract byte[] bytesAt(Column column, int row);

    /**
     * Appends a parsed value.
     */
    protected abstract void appendBytes(Column column, byte[] value);

    @Override
    public void serializeText(Column column, int row, WriteBuffer out) {
        out.write(bytesAt(column, row));
    }

    @Override
    public void serializeTextEscaped(Column column, int row, WriteBuffer out) {
        byte[] value = bytesAt(column, row);
        TextEncoding.writeEscapedString(value, 0, value.length, out);
    }

    @Override
    public void deserializeTextEscaped(Column column, ReadBuffer in) {
        appendBytes(column, TextEncoding.readEscapedString(in));
    }

    @Override
    public void serializeTextQuoted(Column column, int row, WriteBuffer out) {
        byte[] value = bytesAt(column, row);
        TextEncoding.writeQuotedString(value, 0, value.length, out);
    }

    @Override
    public void deserializeTextQuoted(Column column, ReadBuffer in) {
        appendBytes(column, TextEncoding.readQuotedString(in));
    }

    @Override
    public void serializeTextCSV(Column column, int row, WriteBuffer out) {
        byte[] value = bytesAt(column, row);
        TextEncoding.writeCSVString(value, 0, value.length, out);
    }

    @Override
    public void deserializeTextCSV(Column column, ReadBuffer in, byte delimiter) {
        appendBytes(column, TextEncoding.readCSVString(in, delimiter));
    }

    @Override
    public void serializeTextJSON(Column column, int row, WriteBuffer out, boolean forceQuoting64BitIntegers) {
        byte[] value = bytesAt(column, row);
        TextEncoding.writeJSONString(value, 0, value.length, out);
    }

    @Override
    public void deserializeTextJSON(Column column, ReadBuffer in) {
        appendBytes(column, TextEncoding.readJSONString(in));
    }

    @Override
    public void serializeTextXML(Column column, int row, WriteBuffer out) {
        byte[] value = bytesAt(column, row);
        TextEncoding.writeXMLString(value, 0, value.length, out);
    }
}
