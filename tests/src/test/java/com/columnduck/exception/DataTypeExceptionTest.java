package com.columnduck.exception;

import com.columnduck.column.Column;
import com.columnduck.io.ReadBuffer;
import com.columnduck.test.TestBase;
import com.columnduck.test.TestCategories;
import com.columnduck.types.DataType;
import com.columnduck.types.DataTypeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for the error taxonomy raised by data types.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Data Type Error Handling Tests")
public class DataTypeExceptionTest extends TestBase {

    @Test
    @DisplayName("Malformed input carries the type name and cause")
    void testMalformedCarriesType() {
        DataType type = DataTypeFactory.parse("date");
        Column column = type.createColumn();

        MalformedInputException e = catchThrowableOfType(
            () -> type.deserializeTextEscaped(column, ReadBuffer.of("2020-99-99".getBytes(StandardCharsets.US_ASCII))),
            MalformedInputException.class);

        assertThat(e.getTypeName()).isEqualTo("date");
        assertThat(e.getCause()).isNotNull();
        assertThat(e.getTechnicalMessage())
            .contains("MalformedInputException")
            .contains("Data type: date")
            .contains("Cause: java.time.format.DateTimeParseException");
    }

    @Test
    @DisplayName("Stream exhaustion reports the byte position")
    void testStreamExhaustedPosition() {
        DataType type = DataTypeFactory.parse("long");
        ReadBuffer in = ReadBuffer.of(new byte[] {1, 2, 3});

        StreamExhaustedException e = catchThrowableOfType(() -> type.deserializeBinary(in),
            StreamExhaustedException.class);

        assertThat(e.getPosition()).isEqualTo(3);
        assertThat(e.getMessage()).endsWith("(at byte 3)");
        assertThat(e.getTypeName()).isNull();
    }

    @Test
    @DisplayName("Missing capability is not implemented")
    void testNotImplemented() {
        DataType type = DataTypeFactory.parse("array<string>");

        NotImplementedException e = catchThrowableOfType(type::getSizeOfField, NotImplementedException.class);

        assertThat(e).isInstanceOf(DataTypeException.class);
        assertThat(e.getTypeName()).isEqualTo("array<string>");
    }
}
