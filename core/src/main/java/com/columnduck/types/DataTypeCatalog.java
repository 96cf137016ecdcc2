package com.columnduck.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the parameterless data types by canonical name.
 *
 * <p>Parameterized types ({@code fixedstring(n)}, {@code nullable<T>},
 * {@code array<T>}) are not listed; {@link DataTypeFactory} builds them.
 */
public final class DataTypeCatalog {

    private static final Map<String, DataType> SIMPLE_TYPES = buildSimpleTypes();

    private DataTypeCatalog() {}

    private static Map<String, DataType> buildSimpleTypes() {
        Map<String, DataType> types = new LinkedHashMap<>();
        register(types, NullType.get());
        register(types, ByteType.get());
        register(types, ShortType.get());
        register(types, IntegerType.get());
        register(types, LongType.get());
        register(types, FloatType.get());
        register(types, DoubleType.get());
        register(types, DateType.get());
        register(types, TimestampType.get());
        register(types, StringType.get());
        return Collections.unmodifiableMap(types);
    }

    private static void register(Map<String, DataType> types, DataType type) {
        types.put(type.typeName(), type);
    }

    /**
     * Looks up a parameterless type by its canonical name.
     *
     * @param name the canonical type name, e.g. {@code "integer"}
     * @return the type, or empty if no simple type has that name
     */
    public static Optional<DataType> find(String name) {
        return Optional.ofNullable(SIMPLE_TYPES.get(name));
    }

    /**
     * Returns all parameterless types in registration order, keyed by canonical name.
     */
    public static Map<String, DataType> simpleTypes() {
        return SIMPLE_TYPES;
    }
}
