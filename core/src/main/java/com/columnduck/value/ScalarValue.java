package com.columnduck.value;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single value of any supported type, or null.
 *
 * <p>Scalar values carry defaults and single-value binary round trips where
 * allocating a column would be wasteful. The representation is a tagged union:
 * <ul>
 *   <li>{@link Kind#LONG} - every integral type, dates (days) and timestamps (microseconds)</li>
 *   <li>{@link Kind#DOUBLE} - floating point types</li>
 *   <li>{@link Kind#STRING} - raw bytes of string and fixed string types</li>
 *   <li>{@link Kind#ARRAY} - an ordered list of element values</li>
 * </ul>
 *
 * <p>Instances are immutable.
 */
public final class ScalarValue {

    /**
     * The tag of a scalar value.
     */
    public enum Kind {
        NULL, LONG, DOUBLE, STRING, ARRAY
    }

    public static final ScalarValue NULL = new ScalarValue(Kind.NULL, null);

    private final Kind kind;
    private final Object value;

    private ScalarValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static ScalarValue ofLong(long value) {
        return new ScalarValue(Kind.LONG, value);
    }

    public static ScalarValue ofDouble(double value) {
        return new ScalarValue(Kind.DOUBLE, value);
    }

    /**
     * Creates a string value from the UTF-8 encoding of {@code value}.
     */
    public static ScalarValue ofString(String value) {
        Objects.requireNonNull(value, "value must not be null");
        return new ScalarValue(Kind.STRING, value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates a string value from raw bytes. The array is copied.
     */
    public static ScalarValue ofBytes(byte[] value) {
        Objects.requireNonNull(value, "value must not be null");
        return new ScalarValue(Kind.STRING, value.clone());
    }

    public static ScalarValue ofArray(List<ScalarValue> elements) {
        Objects.requireNonNull(elements, "elements must not be null");
        return new ScalarValue(Kind.ARRAY, List.copyOf(elements));
    }

    public static ScalarValue ofArray(ScalarValue... elements) {
        return ofArray(Arrays.asList(elements));
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Returns the integral payload.
     *
     * @throws IllegalStateException if this is not a LONG value
     */
    public long asLong() {
        checkKind(Kind.LONG);
        return (Long) value;
    }

    /**
     * Returns the floating point payload; LONG values are widened.
     *
     * @throws IllegalStateException if this is neither a DOUBLE nor a LONG value
     */
    public double asDouble() {
        if (kind == Kind.LONG) {
            return (Long) value;
        }
        checkKind(Kind.DOUBLE);
        return (Double) value;
    }

    /**
     * Returns a copy of the string payload bytes.
     */
    public byte[] asBytes() {
        checkKind(Kind.STRING);
        return ((byte[]) value).clone();
    }

    /**
     * Returns the string payload decoded as UTF-8.
     */
    public String asString() {
        checkKind(Kind.STRING);
        return new String((byte[]) value, StandardCharsets.UTF_8);
    }

    @SuppressWarnings("unchecked")
    public List<ScalarValue> asArray() {
        checkKind(Kind.ARRAY);
        return (List<ScalarValue>) value;
    }

    private void checkKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected " + expected + " value, got " + kind);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ScalarValue)) return false;
        ScalarValue that = (ScalarValue) obj;
        if (kind != that.kind) return false;
        switch (kind) {
            case NULL:
                return true;
            case DOUBLE:
                return Double.compare((Double) value, (Double) that.value) == 0;
            case STRING:
                return Arrays.equals((byte[]) value, (byte[]) that.value);
            default:
                return value.equals(that.value);
        }
    }

    @Override
    public int hashCode() {
        if (kind == Kind.STRING) {
            return 31 * kind.ordinal() + Arrays.hashCode((byte[]) value);
        }
        return 31 * kind.ordinal() + Objects.hashCode(value);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NULL:
                return "NULL";
            case STRING:
                return "'" + asString() + "'";
            case ARRAY:
                return asArray().stream().map(ScalarValue::toString).collect(Collectors.joining(", ", "[", "]"));
            default:
                return String.valueOf(value);
        }
    }
}
