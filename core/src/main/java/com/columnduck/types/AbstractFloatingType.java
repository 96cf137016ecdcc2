package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.FloatingColumn;
import com.columnduck.config.SerializationLimits;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.TextEncoding;
import com.columnduck.io.WriteBuffer;
import com.columnduck.value.ScalarValue;

/**
 * Base class for IEEE 754 floating point types.
 *
 * <p>Non-finite values render as {@code nan}, {@code inf} and {@code -inf};
 * JSON has no literal for them and gets {@code null}.
 */
public abstract class AbstractFloatingType extends AbstractDataType {

    @Override
    public boolean isNumeric() {
        return true;
    }

    @Override
    public boolean behavesAsNumber() {
        return true;
    }

    @Override
    public ScalarValue getDefault() {
        return ScalarValue.ofDouble(0d);
    }

    protected abstract void writeValue(double value, WriteBuffer out);

    protected abstract double readValue(ReadBuffer in);

    protected abstract String formatValue(double value);

    // ==================== Binary ====================

    @Override
    public void serializeBinaryBulk(Column column, WriteBuffer out, int offset, int limit) {
        FloatingColumn values = columnAs(column, FloatingColumn.class);
        int end = bulkEnd(values, offset, limit);
        for (int row = offset; row < end; row++) {
            writeValue(values.getDouble(row), out);
        }
    }

    @Override
    public void deserializeBinaryBulk(Column column, ReadBuffer in, int limit, double avgValueSizeHint) {
        FloatingColumn values = targetAs(column, FloatingColumn.class);
        values.reserve(values.size() + Math.min(limit, SerializationLimits.MAX_RESERVE_ROWS));
        for (int i = 0; i < limit && !in.eof(); i++) {
            values.addDouble(readValue(in));
        }
    }

    @Override
    public void serializeBinary(ScalarValue value, WriteBuffer out) {
        writeValue(value.asDouble(), out);
    }

    @Override
    public ScalarValue deserializeBinary(ReadBuffer in) {
        return ScalarValue.ofDouble(readValue(in));
    }

    @Override
    public void serializeBinary(Column column, int row, WriteBuffer out) {
        writeValue(columnAs(column, FloatingColumn.class).getDouble(row), out);
    }

    @Override
    public void deserializeBinary(Column column, ReadBuffer in) {
        FloatingColumn values = targetAs(column, FloatingColumn.class);
        values.addDouble(readValue(in));
    }

    // ==================== Text ====================

    @Override
    public void serializeText(Column column, int row, WriteBuffer out) {
        out.writeAscii(formatValue(columnAs(column, FloatingColumn.class).getDouble(row)));
    }

    @Override
    public void serializeTextEscaped(Column column, int row, WriteBuffer out) {
        serializeText(column, row, out);
    }

    @Override
    public void serializeTextQuoted(Column column, int row, WriteBuffer out) {
        serializeText(column, row, out);
    }

    @Override
    public void serializeTextCSV(Column column, int row, WriteBuffer out) {
        serializeText(column, row, out);
    }

    @Override
    public void serializeTextJSON(Column column, int row, WriteBuffer out, boolean forceQuoting64BitIntegers) {
        double value = columnAs(column, FloatingColumn.class).getDouble(row);
        if (Double.isFinite(value)) {
            out.writeAscii(formatValue(value));
        } else {
            out.writeAscii("null");
        }
    }

    @Override
    public void deserializeTextEscaped(Column column, ReadBuffer in) {
        FloatingColumn values = targetAs(column, FloatingColumn.class);
        values.addDouble(TextEncoding.readDoubleText(in));
    }

    @Override
    public void deserializeTextQuoted(Column column, ReadBuffer in) {
        deserializeTextEscaped(column, in);
    }

    @Override
    public void deserializeTextCSV(Column column, ReadBuffer in, byte delimiter) {
        readOptionallyQuoted(column, in);
    }

    @Override
    public void deserializeTextJSON(Column column, ReadBuffer in) {
        readOptionallyQuoted(column, in);
    }

    private void readOptionallyQuoted(Column column, ReadBuffer in) {
        FloatingColumn values = targetAs(column, FloatingColumn.class);
        boolean quoted = in.checkChar('"');
        double value = TextEncoding.readDoubleText(in);
        if (quoted) {
            TextEncoding.assertChar(in, '"');
        }
        values.addDouble(value);
    }
}
