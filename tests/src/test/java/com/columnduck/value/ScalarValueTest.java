package com.columnduck.value;

import com.columnduck.test.TestBase;
import com.columnduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ScalarValue Tests")
public class ScalarValueTest extends TestBase {

    @Test
    @DisplayName("Values compare by kind and content")
    void testEquality() {
        assertThat(ScalarValue.ofLong(5)).isEqualTo(ScalarValue.ofLong(5)).isNotEqualTo(ScalarValue.ofDouble(5));
        assertThat(ScalarValue.ofString("ab")).isEqualTo(ScalarValue.ofBytes(new byte[] {'a', 'b'}));
        assertThat(ScalarValue.ofString("ab").hashCode()).isEqualTo(ScalarValue.ofBytes(new byte[] {'a', 'b'}).hashCode());
        assertThat(ScalarValue.ofDouble(Double.NaN)).isEqualTo(ScalarValue.ofDouble(Double.NaN));
        assertThat(ScalarValue.ofArray(ScalarValue.NULL)).isEqualTo(ScalarValue.ofArray(List.of(ScalarValue.NULL)));
    }

    @Test
    @DisplayName("Byte payloads are copied on construction and access")
    void testCopies() {
        byte[] raw = {1, 2};
        ScalarValue value = ScalarValue.ofBytes(raw);
        raw[0] = 9;
        value.asBytes()[1] = 9;

        assertThat(value.asBytes()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Array payload is immutable")
    void testArrayImmutable() {
        List<ScalarValue> elements = new ArrayList<>(List.of(ScalarValue.ofLong(1)));
        ScalarValue value = ScalarValue.ofArray(elements);
        elements.add(ScalarValue.ofLong(2));

        assertThat(value.asArray()).hasSize(1);
        assertThatThrownBy(() -> value.asArray().add(ScalarValue.NULL))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Accessors check the kind; longs widen to double")
    void testAccessors() {
        assertThat(ScalarValue.ofLong(3).asDouble()).isEqualTo(3.0);
        assertThat(ScalarValue.NULL.isNull()).isTrue();
        assertThat(ScalarValue.ofString("é").asString()).isEqualTo("é");
        assertThatThrownBy(() -> ScalarValue.ofDouble(1).asLong())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("LONG");
        assertThatThrownBy(() -> ScalarValue.NULL.asArray()).isInstanceOf(IllegalStateException.class);
    }
}
