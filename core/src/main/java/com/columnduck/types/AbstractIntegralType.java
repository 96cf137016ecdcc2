package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.IntegralColumn;
import com.columnduck.config.SerializationLimits;
import com.columnduck.exception.MalformedInputException;
import com.columnduck.io.BinaryEncoding;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.TextEncoding;
import com.columnduck.io.WriteBuffer;
import com.columnduck.value.ScalarValue;

/**
 * Base class for signed integral types stored as fixed-width little-endian values.
 *
 * <p>Subclasses pick the width and may replace the decimal text form (dates and
 * timestamps render as calendar text and are quoted in Quoted, CSV and JSON output).
 */
public abstract class AbstractIntegralType extends AbstractDataType {

    private final int width;
    private final long minValue;
    private final long maxValue;

    /**
     * @param width the value width in bytes: 1, 2, 4 or 8
     */
    protected AbstractIntegralType(int width) {
        if (width != 1 && width != 2 && width != 4 && width != 8) {
            throw new IllegalArgumentException("width must be 1, 2, 4 or 8, got: " + width);
        }
        this.width = width;
        this.minValue = width == 8 ? Long.MIN_VALUE : -(1L << (8 * width - 1));
        this.maxValue = width == 8 ? Long.MAX_VALUE : (1L << (8 * width - 1)) - 1;
    }

    @Override
    public boolean isNumeric() {
        return true;
    }

    @Override
    public boolean behavesAsNumber() {
        return true;
    }

    @Override
    public int getSizeOfField() {
        return width;
    }

    @Override
    public ScalarValue getDefault() {
        return ScalarValue.ofLong(0);
    }

    /**
     * Whether Quoted, CSV and JSON output wrap the text form in quotes.
     */
    protected boolean quotedInText() {
        return false;
    }

    protected void writeTextValue(long value, WriteBuffer out) {
        out.writeAscii(Long.toString(value));
    }

    protected long readTextValue(ReadBuffer in) {
        return TextEncoding.readLongText(in);
    }

    private long checkRange(long value) {
        if (value < minValue || value > maxValue) {
            throw new MalformedInputException("Value " + value + " out of range for " + typeName(), typeName());
        }
        return value;
    }

    // ==================== Binary ====================

    @Override
    public void serializeBinaryBulk(Column column, WriteBuffer out, int offset, int limit) {
        IntegralColumn values = columnAs(column, IntegralColumn.class);
        int end = bulkEnd(values, offset, limit);
        for (int row = offset; row < end; row++) {
            BinaryEncoding.writeIntegerLE(values.getLong(row), width, out);
        }
    }

    @Override
    public void deserializeBinaryBulk(Column column, ReadBuffer in, int limit, double avgValueSizeHint) {
        IntegralColumn values = targetAs(column, IntegralColumn.class);
        values.reserve(values.size() + Math.min(limit, SerializationLimits.MAX_RESERVE_ROWS));
        for (int i = 0; i < limit && !in.eof(); i++) {
            values.addLong(BinaryEncoding.readIntegerLE(in, width));
        }
    }

    @Override
    public void serializeBinary(ScalarValue value, WriteBuffer out) {
        BinaryEncoding.writeIntegerLE(value.asLong(), width, out);
    }

    @Override
    public ScalarValue deserializeBinary(ReadBuffer in) {
        return ScalarValue.ofLong(BinaryEncoding.readIntegerLE(in, width));
    }

    @Override
    public void serializeBinary(Column column, int row, WriteBuffer out) {
        BinaryEncoding.writeIntegerLE(columnAs(column, IntegralColumn.class).getLong(row), width, out);
    }

    @Override
    public void deserializeBinary(Column column, ReadBuffer in) {
        IntegralColumn values = targetAs(column, IntegralColumn.class);
        values.addLong(BinaryEncoding.readIntegerLE(in, width));
    }

    // ==================== Text ====================

    @Override
    public void serializeText(Column column, int row, WriteBuffer out) {
        writeTextValue(columnAs(column, IntegralColumn.class).getLong(row), out);
    }

    @Override
    public void serializeTextEscaped(Column column, int row, WriteBuffer out) {
        serializeText(column, row, out);
    }

    @Override
    public void serializeTextQuoted(Column column, int row, WriteBuffer out) {
        writeWrapped(column, row, out, quotedInText() ? '\'' : 0);
    }

    @Override
    public void serializeTextCSV(Column column, int row, WriteBuffer out) {
        writeWrapped(column, row, out, quotedInText() ? '"' : 0);
    }

    @Override
    public void serializeTextJSON(Column column, int row, WriteBuffer out, boolean forceQuoting64BitIntegers) {
        boolean quoted = quotedInText() || (forceQuoting64BitIntegers && width == 8);
        writeWrapped(column, row, out, quoted ? '"' : 0);
    }

    private void writeWrapped(Column column, int row, WriteBuffer out, char quote) {
        if (quote != 0) {
            out.write(quote);
        }
        serializeText(column, row, out);
        if (quote != 0) {
            out.write(quote);
        }
    }

    @Override
    public void deserializeTextEscaped(Column column, ReadBuffer in) {
        IntegralColumn values = targetAs(column, IntegralColumn.class);
        values.addLong(checkRange(readTextValue(in)));
    }

    @Override
    public void deserializeTextQuoted(Column column, ReadBuffer in) {
        IntegralColumn values = targetAs(column, IntegralColumn.class);
        long value;
        if (quotedInText()) {
            TextEncoding.assertChar(in, '\'');
            value = readTextValue(in);
            TextEncoding.assertChar(in, '\'');
        } else {
            value = readTextValue(in);
        }
        values.addLong(checkRange(value));
    }

    @Override
    public void deserializeTextCSV(Column column, ReadBuffer in, byte delimiter) {
        readOptionallyQuoted(column, in, '"');
    }

    @Override
    public void deserializeTextJSON(Column column, ReadBuffer in) {
        readOptionallyQuoted(column, in, '"');
    }

    private void readOptionallyQuoted(Column column, ReadBuffer in, char quote) {
        IntegralColumn values = targetAs(column, IntegralColumn.class);
        boolean quoted = in.checkChar(quote);
        long value = readTextValue(in);
        if (quoted) {
            TextEncoding.assertChar(in, quote);
        }
        values.addLong(checkRange(value));
    }
}
