package com.columnduck.io;

import com.columnduck.config.SerializationLimits;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Buffered sequential byte sink.
 *
 * <p>Bytes reach the underlying stream on {@link #flush()} or when the buffer
 * fills up. A write buffer is single-producer: it must not be shared by
 * concurrent calls. I/O failures are rethrown as {@link UncheckedIOException}.
 *
 * <p>Example usage:
 * <pre>
 *   WriteBuffer out = WriteBuffer.inMemory();
 *   LongType.get().serializeBinaryBulk(column, out, 0, 0);
 *   byte[] bytes = out.toBytes();
 * </pre>
 */
public class WriteBuffer {

    private final OutputStream out;
    private final ByteArrayOutputStream memory;
    private final byte[] buffer;
    private int position;
    private long flushed;

    public WriteBuffer(OutputStream out) {
        this(out, SerializationLimits.DEFAULT_BUFFER_SIZE);
    }

    /**
     * Creates a write buffer over an output stream.
     *
     * @param out the underlying stream
     * @param bufferSize the buffer size in bytes
     */
    public WriteBuffer(OutputStream out, int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive, got: " + bufferSize);
        }
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.memory = out instanceof ByteArrayOutputStream ? (ByteArrayOutputStream) out : null;
        this.buffer = new byte[bufferSize];
    }

    /**
     * Creates a write buffer that collects bytes in memory.
     *
     * @return the write buffer; use {@link #toBytes()} to obtain the written bytes
     */
    public static WriteBuffer inMemory() {
        return new WriteBuffer(new ByteArrayOutputStream());
    }

    public void write(int b) {
        if (position == buffer.length) {
            flushBuffer();
        }
        buffer[position++] = (byte) b;
    }

    public void write(byte[] bytes) {
        write(bytes, 0, bytes.length);
    }

    public void write(byte[] bytes, int offset, int length) {
        if (length > buffer.length - position) {
            flushBuffer();
            if (length > buffer.length) {
                writeThrough(bytes, offset, length);
                return;
            }
        }
        System.arraycopy(bytes, offset, buffer, position, length);
        position += length;
    }

    /**
     * Writes the characters of an ASCII string, one byte each.
     */
    public void writeAscii(String text) {
        for (int i = 0; i < text.length(); i++) {
            write(text.charAt(i));
        }
    }

    /**
     * Writes a string encoded as UTF-8.
     */
    public void writeUtf8(String text) {
        write(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the total number of bytes written so far, flushed or not.
     */
    public long count() {
        return flushed + position;
    }

    /**
     * Pushes buffered bytes to the underlying stream and flushes it.
     */
    public void flush() {
        flushBuffer();
        try {
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush underlying stream", e);
        }
    }

    /**
     * Returns every byte written so far, for buffers created by {@link #inMemory()}
     * or over a {@link ByteArrayOutputStream}.
     *
     * @return a copy of the written bytes
     * @throws IllegalStateException if the buffer writes to another kind of stream
     */
    public byte[] toBytes() {
        if (memory == null) {
            throw new IllegalStateException("toBytes() requires an in-memory write buffer");
        }
        flushBuffer();
        return memory.toByteArray();
    }

    private void flushBuffer() {
        if (position > 0) {
            writeThrough(buffer, 0, position);
            position = 0;
        }
    }

    private void writeThrough(byte[] bytes, int offset, int length) {
        try {
            out.write(bytes, offset, length);
            flushed += length;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write to underlying stream", e);
        }
    }
}
