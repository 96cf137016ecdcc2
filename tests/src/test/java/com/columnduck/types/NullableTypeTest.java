package com.columnduck.types;

import com.columnduck.column.Column;
import com.columnduck.column.NullableColumn;
import com.columnduck.exception.MalformedInputException;
import com.columnduck.exception.StreamExhaustedException;
import com.columnduck.io.MemoryStreamSet;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.WriteBuffer;
import com.columnduck.test.TestBase;
import com.columnduck.test.TestCategories;
import com.columnduck.value.ScalarValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.columnduck.types.TypeFixtures.bytes;
import static com.columnduck.types.TypeFixtures.column;
import static com.columnduck.types.TypeFixtures.in;
import static com.columnduck.types.TypeFixtures.parse;
import static com.columnduck.types.TypeFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for NullableType.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("NullableType Tests")
public class NullableTypeTest extends TestBase {

    private final NullableType type = new NullableType(IntegerType.get());

    @Nested
    @DisplayName("Descriptor")
    class Descriptor {

        @Test
        @DisplayName("Classification forwards to the nested type")
        void testClassification() {
            assertThat(type.typeName()).isEqualTo("nullable<integer>");
            assertThat(type.isNullable()).isTrue();
            assertThat(type.isNull()).isFalse();
            assertThat(type.isNumeric()).isTrue();
            assertThat(type.isNumericNotNullable()).isFalse();
            assertThat(type.behavesAsNumber()).isTrue();
            assertThat(new NullableType(DateType.get()).behavesAsNumber()).isFalse();
            assertThat(new NullableType(StringType.get()).isNumeric()).isFalse();
        }

        @Test
        @DisplayName("Default is NULL and field size adds the flag byte")
        void testDefaultAndSize() {
            assertThat(type.getDefault()).isEqualTo(ScalarValue.NULL);
            assertThat(type.getSizeOfField()).isEqualTo(5);
            assertThat(type.createColumn()).isInstanceOf(NullableColumn.class);
        }

        @Test
        @DisplayName("Clone is an equal, independent descriptor")
        void testClone() {
            DataType clone = type.clone();

            assertThat(clone).isEqualTo(type).isNotSameAs(type);
            assertThat(clone.hashCode()).isEqualTo(type.hashCode());
            assertThat(new NullableType(LongType.get())).isNotEqualTo(type);
        }

        @Test
        @DisplayName("Nullable of a nullable type is rejected")
        void testNestedNullable() {
            assertThatThrownBy(() -> new NullableType(type))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new NullableType(NullType.get()))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Binary")
    class Binary {

        @Test
        @DisplayName("Per-value binary is a flag byte then the nested value")
        void testPerValueLayout() {
            assertThat(bytes(out -> type.serializeBinary(ScalarValue.NULL, out))).containsExactly(1);
            assertThat(bytes(out -> type.serializeBinary(ScalarValue.ofLong(3), out)))
                .containsExactly(0, 3, 0, 0, 0);
        }

        @Test
        @DisplayName("Invalid flag byte is malformed")
        void testInvalidFlag() {
            Column column = type.createColumn();

            assertThatThrownBy(() -> type.deserializeBinary(column, in(new byte[] {2})))
                .isInstanceOf(MalformedInputException.class);
            assertThat(column.size()).isZero();
        }

        @Test
        @DisplayName("Multi-stream layout writes the null map and keeps a slot for null rows")
        void testMultiStreamLayout() {
            Column column = column(type, ScalarValue.ofLong(1), ScalarValue.NULL, ScalarValue.ofLong(3));
            WriteBuffer nullMap = WriteBuffer.inMemory();
            WriteBuffer values = WriteBuffer.inMemory();

            type.serializeBinaryBulkWithMultipleStreams(column, List.of(nullMap, values), true, 0, 0);

            assertThat(nullMap.toBytes()).containsExactly(0, 1, 0);
            assertThat(values.toBytes()).containsExactly(1, 0, 0, 0, 0, 0, 0, 0, 3, 0, 0, 0);
        }

        @Test
        @DisplayName("Multi-stream range writes only the selected rows")
        void testMultiStreamRange() {
            Column column = column(type, ScalarValue.ofLong(1), ScalarValue.NULL, ScalarValue.ofLong(3));
            WriteBuffer nullMap = WriteBuffer.inMemory();
            WriteBuffer values = WriteBuffer.inMemory();

            type.serializeBinaryBulkWithMultipleStreams(column, List.of(nullMap, values), true, 2, 1);
            type.serializeBinaryBulkWithMultipleStreams(column, List.of(nullMap, values), true, 3, 0);

            assertThat(nullMap.toBytes()).containsExactly(0);
            assertThat(values.toBytes()).containsExactly(3, 0, 0, 0);
        }

        @Test
        @DisplayName("Nested stream shorter than the null map is stream exhaustion")
        void testMismatchedStreams() {
            Column column = type.createColumn();
            List<ReadBuffer> streams = List.of(in(new byte[] {0, 0}), in(new byte[] {7, 0, 0, 0}));

            assertThatThrownBy(() -> type.deserializeBinaryBulkWithMultipleStreams(column, streams, true, 10, 0))
                .isInstanceOf(StreamExhaustedException.class);
            assertThat(column.size()).isZero();
            assertThat(((NullableColumn) column).nested().size()).isZero();
        }

        @ParameterizedTest(name = "positionIndependent={0}")
        @ValueSource(booleans = {true, false})
        @DisplayName("Nullable array streams read back in several limited calls")
        void testNullableArrayChunkedRead(boolean positionIndependent) {
            NullableType arrays = new NullableType(new ArrayType(IntegerType.get()));
            Column source = column(arrays,
                ScalarValue.ofArray(ScalarValue.ofLong(1)),
                ScalarValue.NULL,
                ScalarValue.ofArray(ScalarValue.ofLong(2), ScalarValue.ofLong(3)),
                ScalarValue.ofArray(ScalarValue.ofLong(4)));
            MemoryStreamSet streams = new MemoryStreamSet("n", arrays);
            streams.write(source, positionIndependent);
            List<ReadBuffer> readers = streams.openReaders();

            Column target = arrays.createColumn();
            arrays.deserializeBinaryBulkWithMultipleStreams(target, readers, positionIndependent, 2, 0);
            arrays.deserializeBinaryBulkWithMultipleStreams(target, readers, positionIndependent, 2, 0);

            assertThat(target.size()).isEqualTo(4);
            for (int row = 0; row < 4; row++) {
                assertThat(target.get(row)).isEqualTo(source.get(row));
            }
        }

        @Test
        @DisplayName("A single stream is not enough for multi-stream output")
        void testTooFewStreams() {
            Column column = column(type, ScalarValue.ofLong(1));

            assertThatThrownBy(() -> type.serializeBinaryBulkWithMultipleStreams(
                    column, List.of(WriteBuffer.inMemory()), true, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Text")
    class Text {

        private final Column column = column(type, ScalarValue.NULL, ScalarValue.ofLong(-4));

        @Test
        @DisplayName("Null markers per format")
        void testNullMarkers() {
            assertThat(text(column, 0, type::serializeTextEscaped)).isEqualTo("\\N");
            assertThat(text(column, 0, type::serializeTextCSV)).isEqualTo("\\N");
            assertThat(text(column, 0, type::serializeTextQuoted)).isEqualTo("NULL");
            assertThat(text(column, 0, type::serializeText)).isEqualTo("NULL");
            assertThat(text(column, 0, type::serializeTextXML)).isEqualTo("NULL");
            assertThat(text(column, 0, (c, r, out) -> type.serializeTextJSON(c, r, out, false))).isEqualTo("null");
        }

        @Test
        @DisplayName("Non-null rows use the nested form")
        void testNonNull() {
            assertThat(text(column, 1, type::serializeTextEscaped)).isEqualTo("-4");
            assertThat(text(column, 1, (c, r, out) -> type.serializeTextJSON(c, r, out, false))).isEqualTo("-4");
        }

        @Test
        @DisplayName("Null markers parse as NULL")
        void testParseNulls() {
            assertThat(parse(type, "\\N", type::deserializeTextEscaped).get(0)).isEqualTo(ScalarValue.NULL);
            assertThat(parse(type, "NULL", type::deserializeTextQuoted).get(0)).isEqualTo(ScalarValue.NULL);
            assertThat(parse(type, "null", type::deserializeTextJSON).get(0)).isEqualTo(ScalarValue.NULL);
            Column csv = type.createColumn();
            type.deserializeTextCSV(csv, in("\\N,1"), (byte) ',');
            assertThat(csv.get(0)).isEqualTo(ScalarValue.NULL);
        }

        @Test
        @DisplayName("Nested parse failure appends neither value nor flag")
        void testNestedFailure() {
            Column target = column(type, ScalarValue.ofLong(1));

            assertThatThrownBy(() -> type.deserializeTextQuoted(target, in("nope")))
                .isInstanceOf(MalformedInputException.class);
            assertThat(target.size()).isEqualTo(1);
            assertThat(((NullableColumn) target).nested().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Escaped backslash-N string is not mistaken for NULL")
        void testEscapedBackslashN() {
            NullableType strings = new NullableType(StringType.get());
            Column source = column(strings, ScalarValue.ofString("\\N"));

            String escaped = text(source, 0, strings::serializeTextEscaped);
            Column parsed = parse(strings, escaped, strings::deserializeTextEscaped);

            assertThat(escaped).isEqualTo("\\\\N");
            assertThat(parsed.get(0)).isEqualTo(ScalarValue.ofString("\\N"));
        }
    }
}
