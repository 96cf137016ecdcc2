package com.columnduck.io;

import com.columnduck.exception.StreamExhaustedException;
import com.columnduck.test.TestBase;
import com.columnduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ReadBuffer and WriteBuffer.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Buffer Tests")
public class BufferTest extends TestBase {

    @Nested
    @DisplayName("ReadBuffer")
    class Reading {

        @Test
        @DisplayName("Peek does not consume; read does")
        void testPeekAndRead() {
            ReadBuffer in = ReadBuffer.of(new byte[] {1, 2, (byte) 0xFF});

            assertThat(in.peek()).isEqualTo(1);
            assertThat(in.peek(2)).isEqualTo(0xFF);
            assertThat(in.peek(3)).isEqualTo(-1);
            assertThat(in.read()).isEqualTo(1);
            assertThat(in.count()).isEqualTo(1);
            assertThat(in.read()).isEqualTo(2);
            assertThat(in.read()).isEqualTo(0xFF);
            assertThat(in.eof()).isTrue();
            assertThat(in.read()).isEqualTo(-1);
        }

        @Test
        @DisplayName("Small buffers refill and grow for look-ahead")
        void testRefill() {
            byte[] data = "abcdefghij".getBytes(StandardCharsets.US_ASCII);
            ReadBuffer in = new ReadBuffer(new ByteArrayInputStream(data), 2);

            assertThat(in.peek(5)).isEqualTo('f');
            byte[] first = new byte[4];
            in.readFully(first, 0, 4);
            assertThat(new String(first, StandardCharsets.US_ASCII)).isEqualTo("abcd");
            assertThat(in.checkChar('e')).isTrue();
            assertThat(in.checkChar('x')).isFalse();
            assertThat(in.count()).isEqualTo(5);

            byte[] rest = new byte[10];
            assertThat(in.readAvailable(rest, 0, 10)).isEqualTo(5);
            assertThat(in.eof()).isTrue();
        }

        @Test
        @DisplayName("readFully past the end reports the position")
        void testReadFullyShort() {
            ReadBuffer in = ReadBuffer.of(new byte[] {1, 2});

            assertThatThrownBy(() -> in.readFully(new byte[3], 0, 3))
                .isInstanceOf(StreamExhaustedException.class)
                .hasMessageContaining("at byte 2");
        }

        @Test
        @DisplayName("readStrict at the end is stream exhaustion")
        void testReadStrict() {
            assertThatThrownBy(() -> ReadBuffer.of(new byte[0]).readStrict())
                .isInstanceOf(StreamExhaustedException.class);
        }

        @Test
        @DisplayName("I/O failures surface as UncheckedIOException")
        void testIoFailure() {
            InputStream failing = new InputStream() {
                @Override
                public int read() throws IOException {
                    throw new IOException("disk gone");
                }

                @Override
                public int read(byte[] b, int off, int len) throws IOException {
                    throw new IOException("disk gone");
                }
            };
            ReadBuffer in = new ReadBuffer(failing);

            assertThatThrownBy(in::peek)
                .isInstanceOf(UncheckedIOException.class)
                .hasRootCauseMessage("disk gone");
        }

        @Test
        @DisplayName("Non-positive buffer size is rejected")
        void testBadBufferSize() {
            assertThatThrownBy(() -> new ReadBuffer(new ByteArrayInputStream(new byte[0]), 0))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("WriteBuffer")
    class Writing {

        @Test
        @DisplayName("Bytes reach the stream on flush")
        void testFlush() {
            ByteArrayOutputStream sink = new ByteArrayOutputStream();
            WriteBuffer out = new WriteBuffer(sink, 4);

            out.write(1);
            out.writeAscii("ab");
            assertThat(sink.size()).isZero();
            assertThat(out.count()).isEqualTo(3);

            out.flush();
            assertThat(sink.toByteArray()).containsExactly(1, 'a', 'b');
        }

        @Test
        @DisplayName("Writes larger than the buffer go straight through")
        void testLargeWrite() {
            ByteArrayOutputStream sink = new ByteArrayOutputStream();
            WriteBuffer out = new WriteBuffer(sink, 4);

            out.write(9);
            out.write(new byte[] {1, 2, 3, 4, 5, 6});
            out.writeUtf8("é");
            out.flush();

            assertThat(sink.toByteArray()).containsExactly(9, 1, 2, 3, 4, 5, 6, 0xC3, 0xA9);
            assertThat(out.count()).isEqualTo(9);
        }

        @Test
        @DisplayName("toBytes requires an in-memory sink")
        void testToBytes() {
            WriteBuffer memory = WriteBuffer.inMemory();
            memory.write(new byte[] {7, 8}, 1, 1);
            assertThat(memory.toBytes()).containsExactly(8);

            WriteBuffer other = new WriteBuffer(OutputStream.nullOutputStream());
            assertThatThrownBy(other::toBytes).isInstanceOf(IllegalStateException.class);
        }
    }
}
