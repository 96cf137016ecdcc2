package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.IntColumn;
import com.columnduck.exception.MalformedInputException;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.WriteBuffer;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Data type representing a date (year, month, day) without time information.
 *
 * <p>Stored as a 32-bit count of days since Unix epoch (1970-01-01). Numeric,
 * but arithmetic and numeric casts do not apply to it directly. Text form is
 * {@code yyyy-MM-dd}.
 */
public final class DateType extends AbstractIntegralType {

    private static final DateType INSTANCE = new DateType();

    private DateType() {
        super(4); // 32-bit days since epoch
    }

    public static DateType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "date";
    }

    @Override
    public DataType clone() {
        return INSTANCE;
    }

    @Override
    public boolean behavesAsNumber() {
        return false;
    }

    @Override
    public Column createColumn() {
        return new IntColumn();
    }

    @Override
    protected boolean quotedInText() {
        return true;
    }

    @Override
    protected void writeTextValue(long value, WriteBuffer out) {
        out.writeAscii(LocalDate.ofEpochDay(value).toString());
    }

    @Override
    protected long readTextValue(ReadBuffer in) {
        return readDate(in, typeName()).toEpochDay();
    }

    /**
     * Reads a {@code yyyy-MM-dd} date; years beyond four digits carry a sign.
     */
    static LocalDate readDate(ReadBuffer in, String typeName) {
        StringBuilder text = new StringBuilder();
        int c = in.peek();
        if (c == '+' || c == '-') {
            text.append((char) in.read());
        }
        while (((c = in.peek()) >= '0' && c <= '9') || c == '-') {
            text.append((char) in.read());
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new MalformedInputException("Cannot parse date from '" + text + "'", typeName, e);
        }
    }
}
