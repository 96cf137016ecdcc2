package com.columnduck.io;

import com.columnduck.types.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Derives physical stream names for a column of a given type.
 *
 * <p>Example for a column {@code tags} of type {@code array<nullable<string>>}:
 * <pre>
 *   tags.size0
 *   tags.null1
 *   tags
 * </pre>
 */
public final class StreamNames {

    private static final Logger logger = LoggerFactory.getLogger(StreamNames.class);

    private StreamNames() {}

    /**
     * Returns the stream suffixes of {@code type}, in stream order, starting at level 0.
     */
    public static List<String> suffixes(DataType type) {
        List<String> suffixes = new ArrayList<>();
        type.describeMultipleStreams(suffixes, 0);
        if (suffixes.isEmpty()) {
            throw new IllegalStateException("Data type " + type.typeName() + " described no streams");
        }
        return Collections.unmodifiableList(suffixes);
    }

    /**
     * Returns the full stream names of a column: the column name followed by each suffix.
     *
     * @param columnName the base name of the column
     * @param type the column's data type
     * @return stream names in stream order
     * @throws IllegalStateException if two streams would share a name
     */
    public static List<String> streamNames(String columnName, DataType type) {
        List<String> names = new ArrayList<>();
        for (String suffix : suffixes(type)) {
            String name = columnName + suffix;
            if (names.contains(name)) {
                throw new IllegalStateException("Duplicate stream name " + name + " for type " + type.typeName());
            }
            names.add(name);
        }
        logger.debug("Streams for column {} of type {}: {}", columnName, type.typeName(), names);
        return Collections.unmodifiableList(names);
    }
}
