package com.columnduck.types;

import com.columnduck.test.TestBase;
import com.columnduck.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for DataTypeFactory and DataTypeCatalog.
 *
 * <p>Test ID prefix: TC-TYPE-FACTORY-*
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.TypeMapping
@DisplayName("DataTypeFactory Tests")
public class DataTypeFactoryTest extends TestBase {

    @Nested
    @DisplayName("Catalog")
    class Catalog {

        @Test
        @DisplayName("TC-TYPE-FACTORY-001: Catalog lists every simple type under its own name")
        void testCatalogNames() {
            assertThat(DataTypeCatalog.simpleTypes()).containsOnlyKeys(
                "null", "byte", "short", "integer", "long", "float", "double", "date", "timestamp", "string");
            DataTypeCatalog.simpleTypes().forEach((name, type) -> assertThat(type.typeName()).isEqualTo(name));
        }

        @Test
        @DisplayName("TC-TYPE-FACTORY-002: Unknown names are absent")
        void testCatalogMiss() {
            assertThat(DataTypeCatalog.find("decimal")).isEmpty();
            assertThat(DataTypeCatalog.find("integer")).containsSame(IntegerType.get());
        }
    }

    @Nested
    @DisplayName("Type Names")
    class TypeNames {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "integer, integer",
            "INT, integer",
            "BIGINT, long",
            "tinyint, byte",
            "SmallInt, short",
            "real, float",
            "double precision, double",
            "VARCHAR, string",
            "text, string",
            "datetime, timestamp",
            "date, date"
        })
        @DisplayName("TC-TYPE-FACTORY-003: Simple names and aliases")
        void testSimpleNames(String input, String expected) {
            assertThat(DataTypeFactory.parse(input).typeName()).isEqualTo(expected);
        }

        @Test
        @DisplayName("TC-TYPE-FACTORY-004: Parameterized and nested names")
        void testNestedNames() {
            assertThat(DataTypeFactory.parse("fixedstring(16)")).isEqualTo(new FixedStringType(16));
            assertThat(DataTypeFactory.parse("array<nullable<string>>"))
                .isEqualTo(new ArrayType(new NullableType(StringType.get())));
            assertThat(DataTypeFactory.parse("Array<Array<INT>>"))
                .isEqualTo(new ArrayType(new ArrayType(IntegerType.get())));
            assertThat(DataTypeFactory.parse("integer[]")).isEqualTo(new ArrayType(IntegerType.get()));
        }

        @Test
        @DisplayName("TC-TYPE-FACTORY-005: Canonical names parse back to equal types")
        void testCanonicalRoundTrip() {
            for (TypeFixtures.Sample sample : TypeFixtures.samples()) {
                assertThat(DataTypeFactory.parse(sample.type.typeName())).isEqualTo(sample.type);
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"decimal", "array<>", "fixedstring(0)", "fixedstring(x)", "nullable<nullable<int>>",
            "nullable<null>", "  "})
        @DisplayName("TC-TYPE-FACTORY-006: Invalid names are rejected")
        void testInvalidNames(String input) {
            assertThatThrownBy(() -> DataTypeFactory.parse(input))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("TC-TYPE-FACTORY-007: Null input is rejected")
        void testNull() {
            assertThatThrownBy(() -> DataTypeFactory.parse(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("null or empty");
        }
    }

    @Nested
    @DisplayName("JSON Form")
    class JsonForm {

        @Test
        @DisplayName("TC-TYPE-FACTORY-008: Nested JSON type objects")
        void testJsonNested() {
            DataType type = DataTypeFactory.parse(
                "{\"type\":\"array\",\"elementType\":{\"type\":\"nullable\",\"nestedType\":\"long\"}}");

            assertThat(type).isEqualTo(new ArrayType(new NullableType(LongType.get())));
        }

        @Test
        @DisplayName("TC-TYPE-FACTORY-009: JSON fixedstring with length")
        void testJsonFixedString() {
            assertThat(DataTypeFactory.parse("{\"type\":\"fixedstring\",\"length\":8}"))
                .isEqualTo(new FixedStringType(8));
        }

        @Test
        @DisplayName("TC-TYPE-FACTORY-010: JSON primitive object and string element")
        void testJsonPrimitive() {
            assertThat(DataTypeFactory.parse("{\"type\":\"double\"}")).isSameAs(DoubleType.get());
            assertThat(DataTypeFactory.parse("{\"type\":\"array\",\"elementType\":\"date\"}"))
                .isEqualTo(new ArrayType(DateType.get()));
        }

        @Test
        @DisplayName("TC-TYPE-FACTORY-011: Broken JSON is rejected")
        void testBrokenJson() {
            assertThatThrownBy(() -> DataTypeFactory.parse("{\"type\":"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to parse JSON type");
            assertThatThrownBy(() -> DataTypeFactory.parse("{\"type\":\"array\"}"))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> DataTypeFactory.parse("{\"type\":\"fixedstring\"}"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
