package com.columnduck.io;

import com.columnduck.config.SerializationLimits;
import com.columnduck.exception.StreamExhaustedException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Buffered sequential byte source with look-ahead.
 *
 * <p>Look-ahead ({@link #peek()}, {@link #peek(int)}) never consumes input, which
 * lets text parsers stop in front of a delimiter and leave it for the caller.
 *
 * <p>A read buffer is single-consumer: it must not be shared by concurrent calls.
 * I/O failures of the underlying stream are rethrown as {@link UncheckedIOException}.
 */
public class ReadBuffer {

    private final InputStream in;
    private byte[] buffer;
    private int position;
    private int limit;
    private long consumedBeforeBuffer;
    private boolean endOfInput;

    public ReadBuffer(InputStream in) {
        this(in, SerializationLimits.DEFAULT_BUFFER_SIZE);
    }

    /**
     * Creates a read buffer over an input stream.
     *
     * @param in the underlying stream
     * @param bufferSize the initial buffer size in bytes
     */
    public ReadBuffer(InputStream in, int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive, got: " + bufferSize);
        }
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.buffer = new byte[bufferSize];
    }

    private ReadBuffer(byte[] bytes) {
        this.in = null;
        this.buffer = bytes;
        this.limit = bytes.length;
        this.endOfInput = true;
    }

    /**
     * Creates a read buffer over an in-memory byte array. The array is not copied.
     *
     * @param bytes the bytes to read
     * @return the read buffer
     */
    public static ReadBuffer of(byte[] bytes) {
        return new ReadBuffer(Objects.requireNonNull(bytes, "bytes must not be null"));
    }

    /**
     * Returns true if no more bytes can be read.
     */
    public boolean eof() {
        return !ensureAvailable(1);
    }

    /**
     * Returns the next byte without consuming it.
     *
     * @return the next byte as 0-255, or -1 at end of stream
     */
    public int peek() {
        return peek(0);
    }

    /**
     * Returns the byte {@code ahead} positions after the current one without consuming anything.
     *
     * @param ahead how many bytes to look past the current position
     * @return the byte as 0-255, or -1 if the stream ends before it
     */
    public int peek(int ahead) {
        if (!ensureAvailable(ahead + 1)) {
            return -1;
        }
        return buffer[position + ahead] & 0xFF;
    }

    /**
     * Consumes and returns the next byte.
     *
     * @return the byte as 0-255, or -1 at end of stream
     */
    public int read() {
        if (!ensureAvailable(1)) {
            return -1;
        }
        return buffer[position++] & 0xFF;
    }

    /**
     * Consumes the next byte, failing if the stream is exhausted.
     *
     * @return the byte as 0-255
     * @throws StreamExhaustedException if the stream has ended
     */
    public int readStrict() {
        int b = read();
        if (b < 0) {
            throw new StreamExhaustedException("Cannot read all data: expected 1 more byte", count());
        }
        return b;
    }

    /**
     * Reads exactly {@code length} bytes.
     *
     * @throws StreamExhaustedException if the stream ends first
     */
    public void readFully(byte[] dst, int offset, int length) {
        int read = readAvailable(dst, offset, length);
        if (read < length) {
            throw new StreamExhaustedException(
                "Cannot read all data: expected " + length + " bytes, got " + read, count());
        }
    }

    /**
     * Reads up to {@code length} bytes; returns fewer only at end of stream.
     *
     * @return the number of bytes read
     */
    public int readAvailable(byte[] dst, int offset, int length) {
        int copied = 0;
        while (copied < length) {
            if (!ensureAvailable(1)) {
                break;
            }
            int chunk = Math.min(length - copied, limit - position);
            System.arraycopy(buffer, position, dst, offset + copied, chunk);
            position += chunk;
            copied += chunk;
        }
        return copied;
    }

    /**
     * Consumes the next byte if it equals {@code expected}.
     *
     * @return true if the byte matched and was consumed
     */
    public boolean checkChar(char expected) {
        if (peek() == expected) {
            position++;
            return true;
        }
        return false;
    }

    /**
     * Returns the total number of bytes consumed so far.
     */
    public long count() {
        return consumedBeforeBuffer + position;
    }

    private boolean ensureAvailable(int n) {
        while (limit - position < n) {
            if (endOfInput) {
                return false;
            }
            fill();
        }
        return true;
    }

    private void fill() {
        if (position > 0) {
            int remaining = limit - position;
            System.arraycopy(buffer, position, buffer, 0, remaining);
            consumedBeforeBuffer += position;
            limit = remaining;
            position = 0;
        }
        if (limit == buffer.length) {
            buffer = Arrays.copyOf(buffer, buffer.length * 2);
        }
        try {
            int read = in.read(buffer, limit, buffer.length - limit);
            if (read < 0) {
                endOfInput = true;
            } else {
                limit += read;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from underlying stream", e);
        }
    }
}
