package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.LongColumn;
import com.columnduck.exception.MalformedInputException;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.TextEncoding;
import com.columnduck.io.WriteBuffer;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Data type representing a timestamp (date and time with microsecond precision).
 *
 * <p>Stored as a 64-bit count of microseconds since Unix epoch
 * (1970-01-01 00:00:00 UTC). Text form is {@code yyyy-MM-dd HH:mm:ss}, followed
 * by {@code .ffffff} when the value has a fractional second.
 */
public final class TimestampType extends AbstractIntegralType {

    private static final TimestampType INSTANCE = new TimestampType();

    private static final DateTimeFormatter SECONDS_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");
    private static final long MICROS_PER_SECOND = 1_000_000L;

    private TimestampType() {
        super(8);
    }

    public static TimestampType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "timestamp";
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
        return new LongColumn();
    }

    @Override
    protected boolean quotedInText() {
        return true;
    }

    @Override
    protected void writeTextValue(long value, WriteBuffer out) {
        long seconds = Math.floorDiv(value, MICROS_PER_SECOND);
        int micros = (int) Math.floorMod(value, MICROS_PER_SECOND);
        LocalDateTime dateTime = LocalDateTime.ofEpochSecond(seconds, micros * 1000, ZoneOffset.UTC);
        out.writeAscii(SECONDS_FORMAT.format(dateTime));
        if (micros != 0) {
            out.writeAscii(String.format(".%06d", micros));
        }
    }

    @Override
    protected long readTextValue(ReadBuffer in) {
        LocalDate date = DateType.readDate(in, typeName());
        TextEncoding.assertChar(in, ' ');
        StringBuilder text = new StringBuilder();
        int c;
        while (((c = in.peek()) >= '0' && c <= '9') || c == ':' || c == '.') {
            text.append((char) in.read());
        }
        try {
            LocalDateTime dateTime = LocalDateTime.of(date, LocalTime.parse(text));
            long seconds = dateTime.toEpochSecond(ZoneOffset.UTC);
            return Math.addExact(Math.multiplyExact(seconds, MICROS_PER_SECOND), dateTime.getNano() / 1000);
        } catch (DateTimeParseException | ArithmeticException e) {
            throw new MalformedInputException("Cannot parse timestamp time part '" + text + "'", typeName(), e);
        }
    }
}
