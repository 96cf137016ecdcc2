package com.columnduck.io;

import com.columnduck.exception.MalformedInputException;
import com.columnduck.exception.StreamExhaustedException;

/**
 * Little-endian fixed-width and variable-length integer encodings.
 *
 * <p>Variable-length unsigned integers use ULEB128: seven payload bits per byte,
 * least significant group first, high bit set on every byte but the last.
 */
public final class BinaryEncoding {

    private static final int MAX_VAR_UINT_BYTES = 10;

    private BinaryEncoding() {} // Utility class

    /**
     * Writes the low {@code width} bytes of {@code value}, least significant first.
     *
     * @param value the value
     * @param width the number of bytes (1 to 8)
     * @param out the destination
     */
    public static void writeIntegerLE(long value, int width, WriteBuffer out) {
        for (int i = 0; i < width; i++) {
            out.write((int) (value >>> (8 * i)));
        }
    }

    /**
     * Reads a {@code width}-byte little-endian integer and sign-extends it to 64 bits.
     *
     * @throws StreamExhaustedException if fewer than {@code width} bytes remain
     */
    public static long readIntegerLE(ReadBuffer in, int width) {
        long result = 0;
        for (int i = 0; i < width; i++) {
            int b = in.read();
            if (b < 0) {
                throw new StreamExhaustedException(
                    "Cannot read all data: expected " + width + " bytes, got " + i, in.count());
            }
            result |= ((long) b) << (8 * i);
        }
        if (width < 8) {
            int shift = 64 - 8 * width;
            result = (result << shift) >> shift;
        }
        return result;
    }

    public static void writeFloatLE(float value, WriteBuffer out) {
        writeIntegerLE(Float.floatToRawIntBits(value), 4, out);
    }

    public static float readFloatLE(ReadBuffer in) {
        return Float.intBitsToFloat((int) readIntegerLE(in, 4));
    }

    public static void writeDoubleLE(double value, WriteBuffer out) {
        writeIntegerLE(Double.doubleToRawLongBits(value), 8, out);
    }

    public static double readDoubleLE(ReadBuffer in) {
        return Double.longBitsToDouble(readIntegerLE(in, 8));
    }

    /**
     * Writes an unsigned value as ULEB128.
     */
    public static void writeVarUInt(long value, WriteBuffer out) {
        long remaining = value;
        while ((remaining & ~0x7FL) != 0) {
            out.write((int) ((remaining & 0x7F) | 0x80));
            remaining >>>= 7;
        }
        out.write((int) remaining);
    }

    /**
     * Reads a ULEB128 unsigned value.
     *
     * @throws StreamExhaustedException if the stream ends inside the value
     * @throws MalformedInputException if the value is longer than ten bytes
     */
    public static long readVarUInt(ReadBuffer in) {
        long result = 0;
        for (int i = 0; i < MAX_VAR_UINT_BYTES; i++) {
            int b = in.read();
            if (b < 0) {
                throw new StreamExhaustedException("Unexpected end of stream in variable-length integer", in.count());
            }
            result |= (long) (b & 0x7F) << (7 * i);
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new MalformedInputException("Variable-length integer is longer than " + MAX_VAR_UINT_BYTES + " bytes");
    }

    /**
     * Writes a length-prefixed byte range.
     */
    public static void writeSizedBytes(byte[] bytes, int offset, int length, WriteBuffer out) {
        writeVarUInt(length, out);
        out.write(bytes, offset, length);
    }
}
