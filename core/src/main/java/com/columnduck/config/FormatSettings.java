package com.columnduck.config;

/**
 * Settings for text row formats.
 *
 * <p>Example usage:
 * <pre>
 *   FormatSettings settings = FormatSettings.defaults()
 *       .withCsvDelimiter(';')
 *       .withQuote64BitIntegers(true);
 * </pre>
 */
public class FormatSettings {

    /** Field delimiter for CSV input and output */
    private byte csvDelimiter = ',';

    /** Whether 64-bit integers are written as JSON strings */
    private boolean quote64BitIntegers = false;

    /**
     * Creates settings with default values: comma delimiter, bare JSON numbers.
     *
     * @return the settings
     */
    public static FormatSettings defaults() {
        return new FormatSettings();
    }

    /**
     * Sets the CSV field delimiter.
     *
     * @param delimiter a single-byte delimiter character
     * @return this settings object
     */
    public FormatSettings withCsvDelimiter(char delimiter) {
        if (delimiter > 0x7F || delimiter == '"' || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Invalid CSV delimiter: '" + delimiter + "'");
        }
        this.csvDelimiter = (byte) delimiter;
        return this;
    }

    /**
     * Sets whether 64-bit integers are quoted in JSON output.
     *
     * @param quote true to write 64-bit integers as JSON strings
     * @return this settings object
     */
    public FormatSettings withQuote64BitIntegers(boolean quote) {
        this.quote64BitIntegers = quote;
        return this;
    }

    public byte csvDelimiter() {
        return csvDelimiter;
    }

    public boolean quote64BitIntegers() {
        return quote64BitIntegers;
    }
}
