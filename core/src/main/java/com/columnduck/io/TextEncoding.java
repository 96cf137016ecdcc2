package com.columnduck.io;

import com.columnduck.exception.MalformedInputException;
import com.columnduck.exception.StreamExhaustedException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Text codecs shared by the data types: escaped, quoted, CSV, JSON and XML
 * string forms, plus number and keyword parsing.
 *
 * <p>Readers never consume the byte that terminates an unquoted value, so the
 * caller can inspect the delimiter or line break that follows.
 */
public final class TextEncoding {

    private static final JsonStringEncoder JSON_ENCODER = JsonStringEncoder.getInstance();

    private TextEncoding() {} // Utility class

    // ==================== Escaped / Quoted ====================

    /**
     * Writes bytes with backslash escapes for control characters, backslash and single quote.
     */
    public static void writeEscapedString(byte[] bytes, int offset, int length, WriteBuffer out) {
        for (int i = offset; i < offset + length; i++) {
            byte b = bytes[i];
            switch (b) {
                case '\b': out.write('\\'); out.write('b'); break;
                case '\f': out.write('\\'); out.write('f'); break;
                case '\n': out.write('\\'); out.write('n'); break;
                case '\r': out.write('\\'); out.write('r'); break;
                case '\t': out.write('\\'); out.write('t'); break;
                case 0:    out.write('\\'); out.write('0'); break;
                case '\\': out.write('\\'); out.write('\\'); break;
                case '\'': out.write('\\'); out.write('\''); break;
                default:   out.write(b);
            }
        }
    }

    /**
     * Writes bytes as a single-quoted literal with backslash escapes.
     */
    public static void writeQuotedString(byte[] bytes, int offset, int length, WriteBuffer out) {
        out.write('\'');
        writeEscapedString(bytes, offset, length, out);
        out.write('\'');
    }

    /**
     * Reads an escaped string up to, not including, the next unescaped tab or line feed.
     */
    public static byte[] readEscapedString(ReadBuffer in) {
        ByteArrayOutputStream value = new ByteArrayOutputStream();
        while (true) {
            int c = in.peek();
            if (c < 0 || c == '\t' || c == '\n') {
                return value.toByteArray();
            }
            in.read();
            if (c == '\\') {
                value.write(readEscapeSequence(in));
            } else {
                value.write(c);
            }
        }
    }

    /**
     * Reads a single-quoted string literal, consuming both quotes.
     */
    public static byte[] readQuotedString(ReadBuffer in) {
        assertChar(in, '\'');
        ByteArrayOutputStream value = new ByteArrayOutputStream();
        while (true) {
            int c = in.read();
            if (c < 0) {
                throw new StreamExhaustedException("Cannot parse quoted string: expected closing quote", in.count());
            }
            if (c == '\'') {
                return value.toByteArray();
            }
            if (c == '\\') {
                value.write(readEscapeSequence(in));
            } else {
                value.write(c);
            }
        }
    }

    private static int readEscapeSequence(ReadBuffer in) {
        int c = in.read();
        if (c < 0) {
            throw new StreamExhaustedException("Cannot parse escape sequence", in.count());
        }
        switch (c) {
            case 'b': return '\b';
            case 'f': return '\f';
            case 'n': return '\n';
            case 'r': return '\r';
            case 't': return '\t';
            case '0': return 0;
            case 'x': return (hexDigit(in) << 4) | hexDigit(in);
            default:  return c;
        }
    }

    private static int hexDigit(ReadBuffer in) {
        int c = in.read();
        if (c < 0) {
            throw new StreamExhaustedException("Cannot parse escape sequence: expected hex digit", in.count());
        }
        int digit = Character.digit(c, 16);
        if (digit < 0) {
            throw new MalformedInputException("Cannot parse escape sequence: '" + (char) c + "' is not a hex digit");
        }
        return digit;
    }

    // ==================== CSV ====================

    /**
     * Writes bytes as a double-quoted CSV field, doubling embedded quotes.
     */
    public static void writeCSVString(byte[] bytes, int offset, int length, WriteBuffer out) {
        out.write('"');
        for (int i = offset; i < offset + length; i++) {
            if (bytes[i] == '"') {
                out.write('"');
            }
            out.write(bytes[i]);
        }
        out.write('"');
    }

    /**
     * Reads a CSV field. A double-quoted field is read up to its closing quote;
     * an unquoted field ends before {@code delimiter}, a line break or end of stream,
     * none of which is consumed.
     */
    public static byte[] readCSVString(ReadBuffer in, byte delimiter) {
        ByteArrayOutputStream value = new ByteArrayOutputStream();
        if (in.checkChar('"')) {
            while (true) {
                int c = in.read();
                if (c < 0) {
                    throw new StreamExhaustedException("Cannot parse CSV string: expected closing quote", in.count());
                }
                if (c == '"') {
                    if (!in.checkChar('"')) {
                        return value.toByteArray();
                    }
                }
                value.write(c);
            }
        }
        while (true) {
            int c = in.peek();
            if (c < 0 || c == (delimiter & 0xFF) || c == '\n' || c == '\r') {
                return value.toByteArray();
            }
            value.write(in.read());
        }
    }

    // ==================== JSON ====================

    /**
     * Writes bytes as a JSON string literal.
     *
     * <p>ASCII runs are escaped; bytes at or above {@code 0x80} are written as is,
     * so invalid UTF-8 reads back unchanged through {@link #readJSONString(ReadBuffer)}.
     */
    public static void writeJSONString(byte[] bytes, int offset, int length, WriteBuffer out) {
        out.write('"');
        int end = offset + length;
        int i = offset;
        while (i < end) {
            int runStart = i;
            if (bytes[i] >= 0) {
                while (i < end && bytes[i] >= 0) {
                    i++;
                }
                out.write(JSON_ENCODER.quoteAsUTF8(new String(bytes, runStart, i - runStart, StandardCharsets.US_ASCII)));
            } else {
                while (i < end && bytes[i] < 0) {
                    i++;
                }
                out.write(bytes, runStart, i - runStart);
            }
        }
        out.write('"');
    }

    /**
     * Reads a JSON string literal and returns its UTF-8 bytes.
     */
    public static byte[] readJSONString(ReadBuffer in) {
        assertChar(in, '"');
        ByteArrayOutputStream value = new ByteArrayOutputStream();
        while (true) {
            int c = in.read();
            if (c < 0) {
                throw new StreamExhaustedException("Cannot parse JSON string: expected closing quote", in.count());
            }
            if (c == '"') {
                return value.toByteArray();
            }
            if (c != '\\') {
                value.write(c);
                continue;
            }
            int e = in.read();
            switch (e) {
                case '"':  value.write('"'); break;
                case '\\': value.write('\\'); break;
                case '/':  value.write('/'); break;
                case 'b':  value.write('\b'); break;
                case 'f':  value.write('\f'); break;
                case 'n':  value.write('\n'); break;
                case 'r':  value.write('\r'); break;
                case 't':  value.write('\t'); break;
                case 'u':  writeCodePoint(readUnicodeEscape(in), value); break;
                case -1:
                    throw new StreamExhaustedException("Cannot parse JSON string: unterminated escape", in.count());
                default:
                    throw new MalformedInputException("Cannot parse JSON string: invalid escape '\\" + (char) e + "'");
            }
        }
    }

    private static int readUnicodeEscape(ReadBuffer in) {
        char high = (char) readHex4(in);
        if (!Character.isHighSurrogate(high)) {
            return high;
        }
        if (in.peek() == '\\' && in.peek(1) == 'u') {
            in.read();
            in.read();
            char low = (char) readHex4(in);
            if (Character.isLowSurrogate(low)) {
                return Character.toCodePoint(high, low);
            }
        }
        throw new MalformedInputException("Cannot parse JSON string: unpaired surrogate \\u" + Integer.toHexString(high));
    }

    private static int readHex4(ReadBuffer in) {
        int result = 0;
        for (int i = 0; i < 4; i++) {
            result = (result << 4) | hexDigit(in);
        }
        return result;
    }

    private static void writeCodePoint(int codePoint, ByteArrayOutputStream value) {
        byte[] utf8 = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
        value.write(utf8, 0, utf8.length);
    }

    // ==================== XML ====================

    /**
     * Writes bytes with XML entity escaping for {@code &}, {@code <} and {@code >}.
     */
    public static void writeXMLString(byte[] bytes, int offset, int length, WriteBuffer out) {
        for (int i = offset; i < offset + length; i++) {
            switch (bytes[i]) {
                case '&': out.writeAscii("&amp;"); break;
                case '<': out.writeAscii("&lt;"); break;
                case '>': out.writeAscii("&gt;"); break;
                default:  out.write(bytes[i]);
            }
        }
    }

    // ==================== Numbers ====================

    /**
     * Reads an optionally signed decimal integer.
     *
     * @throws MalformedInputException if there are no digits or the value does not fit in 64 bits
     */
    public static long readLongText(ReadBuffer in) {
        StringBuilder digits = new StringBuilder();
        int c = in.peek();
        if (c == '-' || c == '+') {
            digits.append((char) in.read());
        }
        while ((c = in.peek()) >= '0' && c <= '9') {
            digits.append((char) in.read());
        }
        try {
            return Long.parseLong(digits.toString());
        } catch (NumberFormatException e) {
            throw new MalformedInputException("Cannot parse integer from '" + digits + "'", null, e);
        }
    }

    /**
     * Reads a floating point number, including {@code nan}, {@code inf} and {@code -inf}.
     */
    public static double readDoubleText(ReadBuffer in) {
        StringBuilder token = new StringBuilder();
        int c;
        while ((c = in.peek()) >= 0 && isNumberTokenChar(c)) {
            token.append((char) in.read());
        }
        String text = token.toString().toLowerCase();
        switch (text) {
            case "nan": case "+nan": case "-nan":
                return Double.NaN;
            case "inf": case "+inf": case "infinity": case "+infinity":
                return Double.POSITIVE_INFINITY;
            case "-inf": case "-infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }
        if (text.isEmpty() || text.indexOf('n') >= 0 || text.indexOf('x') >= 0) {
            throw new MalformedInputException("Cannot parse floating point number from '" + token + "'");
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new MalformedInputException("Cannot parse floating point number from '" + token + "'", null, e);
        }
    }

    private static boolean isNumberTokenChar(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
            || c == '+' || c == '-' || c == '.';
    }

    /**
     * Formats a double, writing non-finite values as {@code nan}, {@code inf} or {@code -inf}.
     */
    public static String formatDouble(double value) {
        if (Double.isNaN(value)) return "nan";
        if (value == Double.POSITIVE_INFINITY) return "inf";
        if (value == Double.NEGATIVE_INFINITY) return "-inf";
        return Double.toString(value);
    }

    public static String formatFloat(float value) {
        if (!Float.isFinite(value)) return formatDouble(value);
        return Float.toString(value);
    }

    // ==================== Punctuation ====================

    public static void skipWhitespace(ReadBuffer in) {
        int c;
        while ((c = in.peek()) == ' ' || c == '\t' || c == '\n' || c == '\r') {
            in.read();
        }
    }

    /**
     * Consumes {@code expected} or fails.
     *
     * @throws StreamExhaustedException at end of stream
     * @throws MalformedInputException if another byte follows
     */
    public static void assertChar(ReadBuffer in, char expected) {
        int c = in.peek();
        if (c < 0) {
            throw new StreamExhaustedException("Expected '" + expected + "' but stream ended", in.count());
        }
        if (c != expected) {
            throw new MalformedInputException("Expected '" + expected + "' but found '" + (char) c + "'");
        }
        in.read();
    }

    /**
     * Consumes the ASCII keyword {@code expected} or fails.
     */
    public static void assertString(ReadBuffer in, String expected) {
        for (int i = 0; i < expected.length(); i++) {
            assertChar(in, expected.charAt(i));
        }
    }

    /**
     * Returns true if the upcoming bytes spell {@code expected}, without consuming them.
     */
    public static boolean lookingAt(ReadBuffer in, String expected) {
        for (int i = 0; i < expected.length(); i++) {
            if (in.peek(i) != expected.charAt(i)) {
                return false;
            }
        }
        return true;
    }
}
