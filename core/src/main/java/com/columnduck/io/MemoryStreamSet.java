package com.columnduck.io;

import com.columnduck.column.Column;
import com.columnduck.types.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named in-memory streams holding one column in multi-stream form.
 *
 * <p>Example usage:
 * <pre>
 *   MemoryStreamSet streams = new MemoryStreamSet("tags", type);
 *   streams.write(column, true);
 *   Column copy = streams.read(column.size(), true);
 * </pre>
 *
 * <p>Writes append to the existing stream contents, so several blocks can be
 * written before reading. Without position-independent encoding, array offsets
 * are end offsets in the source column: blocks must then cover consecutive rows
 * starting at the first row. Not thread-safe.
 */
public class MemoryStreamSet {

    private static final Logger logger = LoggerFactory.getLogger(MemoryStreamSet.class);

    private final String columnName;
    private final DataType type;
    private final Map<String, WriteBuffer> buffers = new LinkedHashMap<>();

    /**
     * Creates empty streams for a column.
     *
     * @param columnName the base name of the streams
     * @param type the column's data type
     */
    public MemoryStreamSet(String columnName, DataType type) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        for (String name : StreamNames.streamNames(columnName, type)) {
            buffers.put(name, WriteBuffer.inMemory());
        }
    }

    public String columnName() {
        return columnName;
    }

    public DataType type() {
        return type;
    }

    /**
     * Returns the stream names in stream order.
     */
    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(buffers.keySet()));
    }

    /**
     * Writes all rows of {@code column}.
     */
    public void write(Column column, boolean positionIndependentEncoding) {
        write(column, positionIndependentEncoding, 0, 0);
    }

    /**
     * Writes rows {@code [offset, offset + limit)} of {@code column}; a zero limit means to the end.
     */
    public void write(Column column, boolean positionIndependentEncoding, int offset, int limit) {
        List<WriteBuffer> streams = new ArrayList<>(buffers.values());
        type.serializeBinaryBulkWithMultipleStreams(column, streams, positionIndependentEncoding, offset, limit);
        int rows = (limit == 0 ? column.size() : Math.min(column.size(), offset + limit)) - offset;
        logger.debug("Wrote {} rows of {} from offset {} into {} streams",
            rows, type.typeName(), offset, streams.size());
    }

    /**
     * Returns the bytes written so far to the stream with the given name.
     *
     * @throws IllegalArgumentException if the name is not one of {@link #names()}
     */
    public byte[] bytes(String streamName) {
        WriteBuffer buffer = buffers.get(streamName);
        if (buffer == null) {
            throw new IllegalArgumentException("Unknown stream " + streamName + ", expected one of " + buffers.keySet());
        }
        return buffer.toBytes();
    }

    /**
     * Opens fresh readers over the current contents of every stream, in stream order.
     */
    public List<ReadBuffer> openReaders() {
        List<ReadBuffer> readers = new ArrayList<>(buffers.size());
        for (WriteBuffer buffer : buffers.values()) {
            readers.add(ReadBuffer.of(buffer.toBytes()));
        }
        return readers;
    }

    /**
     * Reads up to {@code limit} rows into a new column.
     */
    public Column read(int limit, boolean positionIndependentEncoding) {
        Column column = type.createColumn();
        type.deserializeBinaryBulkWithMultipleStreams(column, openReaders(), positionIndependentEncoding, limit, 0);
        logger.debug("Read {} rows of {} from {} streams", column.size(), type.typeName(), buffers.size());
        return column;
    }
}
