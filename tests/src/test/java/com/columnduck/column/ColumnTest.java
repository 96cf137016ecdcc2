package com.columnduck.column;

import com.columnduck.test.TestBase;
import com.columnduck.test.TestCategories;
import com.columnduck.value.ScalarValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the column containers.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Column Tests")
public class ColumnTest extends TestBase {

    @Nested
    @DisplayName("Flat columns")
    class Flat {

        @Test
        @DisplayName("Integral columns grow and pop back")
        void testIntColumn() {
            IntColumn column = new IntColumn();
            for (int i = 0; i < 100; i++) {
                column.add(i);
            }
            column.popBack(98);

            assertThat(column.size()).isEqualTo(2);
            assertThat(column.get(1)).isEqualTo(ScalarValue.ofLong(1));
            assertThatThrownBy(() -> column.get(2)).isInstanceOf(IndexOutOfBoundsException.class);
            assertThatThrownBy(() -> column.popBack(3)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Float column widens to double values")
        void testFloatColumn() {
            FloatColumn column = new FloatColumn();
            column.insert(ScalarValue.ofDouble(0.5));
            column.insertDefault();

            assertThat(column.getDouble(0)).isEqualTo(0.5);
            assertThat(column.get(1)).isEqualTo(ScalarValue.ofDouble(0));
        }

        @Test
        @DisplayName("Wrong value kind is an illegal state")
        void testWrongKind() {
            assertThatThrownBy(() -> new LongColumn().insert(ScalarValue.ofString("x")))
                .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("String column keeps contiguous chars and offsets")
        void testStringColumn() {
            StringColumn column = new StringColumn();
            column.insert(ScalarValue.ofString("ab"));
            column.insert(ScalarValue.ofString(""));
            column.insert(ScalarValue.ofString("cde"));

            assertThat(column.offsetAt(2)).isEqualTo(2);
            assertThat(column.lengthAt(2)).isEqualTo(3);
            assertThat(column.charsSize()).isEqualTo(5);

            column.popBack(1);
            assertThat(column.charsSize()).isEqualTo(2);
            assertThat(column.get(1)).isEqualTo(ScalarValue.ofString(""));
        }

        @Test
        @DisplayName("Fixed string column pads and rejects long values")
        void testFixedStringColumn() {
            FixedStringColumn column = new FixedStringColumn(3);
            column.add(new byte[] {'a'});

            assertThat(column.getBytes(0)).containsExactly('a', 0, 0);
            assertThatThrownBy(() -> column.add(new byte[] {1, 2, 3, 4}))
                .isInstanceOf(IllegalArgumentException.class);
            assertThat(column.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Composite columns")
    class Composite {

        @Test
        @DisplayName("Nullable column keeps a nested slot for nulls")
        void testNullableColumn() {
            NullableColumn column = new NullableColumn(new IntColumn());
            column.insert(ScalarValue.ofLong(4));
            column.insert(ScalarValue.NULL);

            assertThat(column.nested().size()).isEqualTo(2);
            assertThat(column.isNullAt(1)).isTrue();
            assertThat(column.get(1)).isEqualTo(ScalarValue.NULL);

            column.popBack(1);
            assertThat(column.nested().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Null flag requires the nested value first")
        void testNullFlagOrder() {
            NullableColumn column = new NullableColumn(new IntColumn());

            assertThatThrownBy(() -> column.addNullFlag(false)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Array column flattens elements behind end offsets")
        void testArrayColumn() {
            ArrayColumn column = new ArrayColumn(new IntColumn());
            column.insert(ScalarValue.ofArray(ScalarValue.ofLong(1), ScalarValue.ofLong(2)));
            column.insertDefault();
            column.insert(ScalarValue.ofArray(ScalarValue.ofLong(3)));

            assertThat(column.endOffsetAt(0)).isEqualTo(2);
            assertThat(column.sizeAt(1)).isZero();
            assertThat(column.offsetAt(2)).isEqualTo(2);
            assertThat(column.data().size()).isEqualTo(3);

            column.popBack(1);
            assertThat(column.data().size()).isEqualTo(2);
        }

        @Test
        @DisplayName("Failed array insert leaves no elements behind")
        void testArrayInsertFailure() {
            ArrayColumn column = new ArrayColumn(new IntColumn());

            assertThatThrownBy(() -> column.insert(ScalarValue.ofArray(ScalarValue.ofLong(1), ScalarValue.ofString("x"))))
                .isInstanceOf(IllegalStateException.class);
            assertThat(column.size()).isZero();
            assertThat(column.data().size()).isZero();
        }

        @Test
        @DisplayName("Wrappers require an empty inner column")
        void testNonEmptyInner() {
            IntColumn filled = new IntColumn();
            filled.add(1);

            assertThatThrownBy(() -> new ArrayColumn(filled)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new NullableColumn(filled)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Constant column repeats one value and materializes")
        void testConstColumn() {
            IntColumn single = new IntColumn();
            single.add(7);
            ConstColumn column = new ConstColumn(single, 3);

            assertThat(column.isConst()).isTrue();
            assertThat(column.get(2)).isEqualTo(ScalarValue.ofLong(7));
            assertThatThrownBy(() -> column.insert(ScalarValue.ofLong(1)))
                .isInstanceOf(UnsupportedOperationException.class);

            Column full = column.convertToFullColumn();
            assertThat(full.isConst()).isFalse();
            assertThat(full.size()).isEqualTo(3);
            assertThat(full.get(0)).isEqualTo(ScalarValue.ofLong(7));
        }

        @Test
        @DisplayName("Null column holds only nulls")
        void testNullColumn() {
            NullColumn column = new NullColumn();
            column.insert(ScalarValue.NULL);

            assertThat(column.get(0)).isEqualTo(ScalarValue.NULL);
            assertThatThrownBy(() -> column.insert(ScalarValue.ofLong(1))).isInstanceOf(IllegalStateException.class);
        }
    }
}
