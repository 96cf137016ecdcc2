package com.columnduck.types;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Parses type names into data types.
 *
 * <p>Supports two formats:
 * <ul>
 *   <li>Type names: {@code integer}, {@code fixedstring(16)}, {@code array<nullable<string>>}</li>
 *   <li>JSON: {@code {"type":"array","elementType":"integer"}} or
 *       {@code {"type":"nullable","nestedType":"string"}} or
 *       {@code {"type":"fixedstring","length":16}}</li>
 * </ul>
 *
 * <p>Names are case-insensitive. SQL spellings are accepted as aliases:
 * <pre>
 *   "TINYINT"  → byte        "SMALLINT" → short
 *   "INT"      → integer     "BIGINT"   → long
 *   "REAL"     → float       "VARCHAR"  → string
 *   "DATETIME" → timestamp   "INTEGER[]" → array&lt;integer&gt;
 * </pre>
 */
public class DataTypeFactory {

    private static final Logger logger = LoggerFactory.getLogger(DataTypeFactory.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private DataTypeFactory() {}

    /**
     * Parses a type name or JSON type description.
     *
     * @param typeStr the type string
     * @return the data type
     * @throws IllegalArgumentException if the string names no known type
     */
    public static DataType parse(String typeStr) {
        if (typeStr == null || typeStr.isBlank()) {
            throw new IllegalArgumentException("Type string cannot be null or empty");
        }
        String trimmed = typeStr.trim();
        DataType type = trimmed.startsWith("{") ? parseJson(trimmed) : parseName(trimmed);
        logger.debug("Parsed type '{}' as {}", typeStr, type.typeName());
        return type;
    }

    private static DataType parseName(String typeStr) {
        String normalized = typeStr.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Empty type name");
        }

        DataType simple = parseSimpleName(normalized);
        if (simple != null) {
            return simple;
        }

        if (normalized.startsWith("array<") && normalized.endsWith(">")) {
            return new ArrayType(parseName(normalized.substring(6, normalized.length() - 1)));
        }
        if (normalized.startsWith("nullable<") && normalized.endsWith(">")) {
            return new NullableType(parseName(normalized.substring(9, normalized.length() - 1)));
        }
        if (normalized.endsWith("[]")) {
            return new ArrayType(parseName(normalized.substring(0, normalized.length() - 2)));
        }
        if (normalized.startsWith("fixedstring(") && normalized.endsWith(")")) {
            return new FixedStringType(parseLength(normalized.substring(12, normalized.length() - 1), typeStr));
        }

        throw new IllegalArgumentException("Unknown data type: " + typeStr);
    }

    private static DataType parseSimpleName(String normalized) {
        return switch (normalized) {
            case "tinyint", "int8"              -> ByteType.get();
            case "smallint", "int16"            -> ShortType.get();
            case "int", "int32"                 -> IntegerType.get();
            case "bigint", "int64"              -> LongType.get();
            case "real", "float32"              -> FloatType.get();
            case "double precision", "float64"  -> DoubleType.get();
            case "varchar", "text"              -> StringType.get();
            case "datetime"                     -> TimestampType.get();
            default -> DataTypeCatalog.find(normalized).orElse(null);
        };
    }

    private static int parseLength(String lengthStr, String typeStr) {
        int length;
        try {
            length = Integer.parseInt(lengthStr.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid length in type: " + typeStr, e);
        }
        if (length <= 0) {
            throw new IllegalArgumentException("Length must be positive in type: " + typeStr);
        }
        return length;
    }

    private static DataType parseJson(String jsonStr) {
        JsonNode root;
        try {
            root = objectMapper.readTree(jsonStr);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse JSON type: " + e.getMessage(), e);
        }
        return parseJsonDataType(root);
    }

    /**
     * Parses a JSON node that is either a type name string or a type object.
     */
    private static DataType parseJsonDataType(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            throw new IllegalArgumentException("Type node cannot be null");
        }
        if (typeNode.isTextual()) {
            return parseName(typeNode.asText());
        }
        if (!typeNode.isObject() || !typeNode.has("type")) {
            throw new IllegalArgumentException("Unsupported type node: " + typeNode);
        }

        String typeName = typeNode.get("type").asText().toLowerCase(Locale.ROOT);
        switch (typeName) {
            case "array":
                return new ArrayType(parseJsonDataType(typeNode.get("elementType")));
            case "nullable":
                return new NullableType(parseJsonDataType(typeNode.get("nestedType")));
            case "fixedstring":
                JsonNode length = typeNode.get("length");
                if (length == null || !length.canConvertToInt()) {
                    throw new IllegalArgumentException("fixedstring needs an integer length: " + typeNode);
                }
                return new FixedStringType(parseLength(length.asText(), typeNode.toString()));
            default:
                return parseName(typeName);
        }
    }
}
