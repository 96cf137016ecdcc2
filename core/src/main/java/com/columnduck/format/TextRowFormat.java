package com.columnduck.format;

import com.columnduck.column.Column;
import com.columnduck.config.FormatSettings;
import com.columnduck.io.ReadBuffer;
import com.columnduck.io.TextEncoding;
import com.columnduck.io.WriteBuffer;
import com.columnduck.types.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes rows of columns as lines of text.
 *
 * <p>Each field is handled by its column's data type:
 * <ul>
 *   <li>{@link Kind#CSV}: CSV fields joined by the configured delimiter</li>
 *   <li>{@link Kind#TAB_SEPARATED}: escaped fields joined by tabs</li>
 *   <li>{@link Kind#JSON_COMPACT}: one JSON array per line</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   TextRowFormat format = new TextRowFormat(TextRowFormat.Kind.CSV,
 *       List.of(IntegerType.get(), StringType.get()), FormatSettings.defaults());
 *   List&lt;Column&gt; columns = format.createColumns();
 *   format.readRows(columns, in);
 * </pre>
 *
 * <p>A row that fails to parse is removed from every column before the error
 * propagates, so the columns always have equal sizes.
 */
public class TextRowFormat {

    private static final Logger logger = LoggerFactory.getLogger(TextRowFormat.class);

    /** Supported line formats. */
    public enum Kind {
        CSV,
        TAB_SEPARATED,
        JSON_COMPACT
    }

    private final Kind kind;
    private final List<DataType> types;
    private final FormatSettings settings;

    /**
     * Creates a row format.
     *
     * @param kind the line format
     * @param types one data type per field
     * @param settings delimiter and JSON settings
     */
    public TextRowFormat(Kind kind, List<DataType> types, FormatSettings settings) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.types = List.copyOf(types);
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        if (this.types.isEmpty()) {
            throw new IllegalArgumentException("A row needs at least one field");
        }
    }

    public Kind kind() {
        return kind;
    }

    public List<DataType> types() {
        return types;
    }

    /**
     * Creates one empty column per field.
     */
    public List<Column> createColumns() {
        List<Column> columns = new ArrayList<>(types.size());
        for (DataType type : types) {
            columns.add(type.createColumn());
        }
        return columns;
    }

    // ==================== Writing ====================

    /**
     * Writes row {@code row} of {@code columns} followed by a newline.
     */
    public void writeRow(List<Column> columns, int row, WriteBuffer out) {
        checkColumns(columns);
        if (kind == Kind.JSON_COMPACT) {
            out.write('[');
        }
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) {
                out.write(fieldSeparator());
            }
            writeField(types.get(i), columns.get(i), row, out);
        }
        if (kind == Kind.JSON_COMPACT) {
            out.write(']');
        }
        out.write('\n');
    }

    /**
     * Writes every row of {@code columns}.
     *
     * @return the number of rows written
     */
    public int writeRows(List<Column> columns, WriteBuffer out) {
        checkColumns(columns);
        int rows = columns.get(0).size();
        for (int row = 0; row < rows; row++) {
            writeRow(columns, row, out);
        }
        logger.debug("Wrote {} {} rows", rows, kind);
        return rows;
    }

    private void writeField(DataType type, Column column, int row, WriteBuffer out) {
        switch (kind) {
            case CSV:
                type.serializeTextCSV(column, row, out);
                break;
            case TAB_SEPARATED:
                type.serializeTextEscaped(column, row, out);
                break;
            case JSON_COMPACT:
                type.serializeTextJSON(column, row, out, settings.quote64BitIntegers());
                break;
            default:
                throw new IllegalStateException("Unknown row format: " + kind);
        }
    }

    // ==================== Reading ====================

    /**
     * Reads one row and appends a value to each column.
     *
     * @return false if the input was already exhausted
     */
    public boolean readRow(List<Column> columns, ReadBuffer in) {
        checkColumns(columns);
        if (kind == Kind.JSON_COMPACT) {
            TextEncoding.skipWhitespace(in);
        }
        if (in.eof()) {
            return false;
        }

        int completed = 0;
        try {
            if (kind == Kind.JSON_COMPACT) {
                TextEncoding.assertChar(in, '[');
            }
            for (int i = 0; i < types.size(); i++) {
                if (i > 0) {
                    readFieldSeparator(in);
                }
                readField(types.get(i), columns.get(i), in);
                completed++;
            }
            readRowEnd(in);
        } catch (RuntimeException e) {
            logger.debug("Discarding partial row after field {}: {}", completed, e.getMessage());
            for (int i = 0; i < completed; i++) {
                columns.get(i).popBack(1);
            }
            throw e;
        }
        return true;
    }

    /**
     * Reads rows until the input is exhausted.
     *
     * @return the number of rows read
     */
    public int readRows(List<Column> columns, ReadBuffer in) {
        int rows = 0;
        while (readRow(columns, in)) {
            rows++;
        }
        logger.debug("Read {} {} rows", rows, kind);
        return rows;
    }

    private void readField(DataType type, Column column, ReadBuffer in) {
        switch (kind) {
            case CSV:
                type.deserializeTextCSV(column, in, settings.csvDelimiter());
                break;
            case TAB_SEPARATED:
                type.deserializeTextEscaped(column, in);
                break;
            case JSON_COMPACT:
                type.deserializeTextJSON(column, in);
                break;
            default:
                throw new IllegalStateException("Unknown row format: " + kind);
        }
    }

    private void readFieldSeparator(ReadBuffer in) {
        if (kind == Kind.JSON_COMPACT) {
            TextEncoding.skipWhitespace(in);
            TextEncoding.assertChar(in, ',');
            TextEncoding.skipWhitespace(in);
        } else {
            TextEncoding.assertChar(in, (char) fieldSeparator());
        }
    }

    private void readRowEnd(ReadBuffer in) {
        if (kind == Kind.JSON_COMPACT) {
            TextEncoding.skipWhitespace(in);
            TextEncoding.assertChar(in, ']');
            return;
        }
        in.checkChar('\r');
        if (!in.eof()) {
            TextEncoding.assertChar(in, '\n');
        }
    }

    private int fieldSeparator() {
        switch (kind) {
            case CSV:
                return settings.csvDelimiter() & 0xFF;
            case TAB_SEPARATED:
                return '\t';
            default:
                return ',';
        }
    }

    private void checkColumns(List<Column> columns) {
        if (columns.size() != types.size()) {
            throw new IllegalArgumentException("Expected " + types.size() + " columns, got " + columns.size());
        }
    }
}
