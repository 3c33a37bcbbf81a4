package jdent;

import java.math.BigInteger;
import jdent.JsonException.SyntaxException;

/**
 * Recursive-descent JSON grammar that reports structure to consumers instead of building a tree.
 *
 * <p> Every construct has its own procedure and the procedures call each other; there is no
 * shared state machine. The only state held is the Java call stack, so memory use follows the
 * nesting depth of the input and not its length.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * var cursor = Cursor.of("{\"a\":1,\"b\":[true,null]}");
 * PushParser.parseObject(cursor, (c, name) -> {
 *     switch (name) {
 *         case "a" -> System.out.println(PushParser.parseNumber(c));
 *         default -> PushParser.parseValue(c);
 *     }
 * });
 * }</pre>
 *
 * <p> All procedures throw {@link SyntaxException} on the first grammar violation. There is no
 * recovery; the cursor must not be reused after a failure.
 *
 * @since 0.1.0
 */
public final class PushParser {

    /** Exponent digits beyond this magnitude cannot produce an in-range exponent anyway. */
    private static final long EXPONENT_LIMIT = 1L << 40;

    private PushParser() {
        throw new UnsupportedOperationException();
    }

    /**
     * Parse an object, calling {@code consumer} once per member in input order.
     *
     * <p> Commas follow RFC 8259 strictly: a missing, leading or trailing comma between members is
     * a {@link SyntaxException}, not skipped.
     */
    public static void parseObject(Cursor cursor, FieldConsumer consumer) {
        cursor.expect('{');
        int c = cursor.skipWhitespace();
        if (c == '}') {
            cursor.advance();
            return;
        }
        for (; ; ) {
            c = cursor.skipWhitespace();
            if (c != '"') throw cursor.unexpected(c, "'\"' starting a member name");
            String name = parseString(cursor);
            cursor.expect(':');
            cursor.skipWhitespace();
            consumer.accept(cursor, name);
            c = cursor.skipWhitespace();
            switch (c) {
                case '}' -> {
                    cursor.advance();
                    return;
                }
                case ',' -> cursor.advance();
                default -> throw cursor.unexpected(c, "',' or '}'");
            }
        }
    }

    /**
     * Parse an array, calling {@code consumer} once per element in input order. An empty array
     * makes no calls.
     */
    public static void parseArray(Cursor cursor, ElementConsumer consumer) {
        cursor.expect('[');
        int c = cursor.skipWhitespace();
        if (c == ']') {
            cursor.advance();
            return;
        }
        for (; ; ) {
            cursor.skipWhitespace();
            consumer.accept(cursor);
            c = cursor.skipWhitespace();
            switch (c) {
                case ']' -> {
                    cursor.advance();
                    return;
                }
                case ',' -> cursor.advance();
                default -> throw cursor.unexpected(c, "',' or ']'");
            }
        }
    }

    /**
     * Parse a string literal.
     *
     * <p> Each four-digit unicode escape becomes one UTF-16 code unit on its own. Two escapes
     * spelling a surrogate pair therefore still yield the astral character, but a lone surrogate
     * is kept as is. Unescaped control characters are accepted.
     */
    public static String parseString(Cursor cursor) {
        cursor.expect('"');
        var sb = new StringBuilder();
        for (; ; ) {
            int c = cursor.advance();
            switch (c) {
                case '"' -> {
                    return sb.toString();
                }
                case '\\' -> {
                    int e = cursor.advance();
                    switch (e) {
                        case '"', '\\', '/' -> sb.append((char) e);
                        case 'b' -> sb.append('\b');
                        case 'f' -> sb.append('\f');
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 't' -> sb.append('\t');
                        case 'u' -> sb.append((char) readHex4(cursor));
                        default -> throw cursor.unexpected(e, "one of '\"', '\\', '/', 'b', 'f', 'n', 'r', 't', 'u' after '\\'");
                    }
                }
                case Cursor.EOF -> throw cursor.error("Unterminated string literal");
                default -> sb.append((char) c);
            }
        }
    }

    /**
     * Parse a number literal exactly.
     *
     * <p> Fraction digits are folded into the mantissa, each lowering the exponent by one; an
     * explicit exponent is added on top. {@code -12.50e3} becomes {@code (-1250, 1)}.
     *
     * @throws SyntaxException if the literal is malformed or its exponent does not fit an {@code int}
     */
    public static Decimal parseNumber(Cursor cursor) {
        int c = cursor.skipWhitespace();
        var digits = new StringBuilder();
        if (c == '-') {
            digits.append('-');
            cursor.advance();
            c = cursor.peek();
        }
        if (c == '0') {
            digits.append('0');
            cursor.advance();
        } else if (isDigit(c)) {
            c = readDigits(cursor, digits);
        } else {
            throw cursor.unexpected(c, "digit");
        }
        long exponent = 0;
        c = cursor.peek();
        if (c == '.') {
            cursor.advance();
            c = cursor.peek();
            if (!isDigit(c)) throw cursor.unexpected(c, "digit after '.'");
            int before = digits.length();
            c = readDigits(cursor, digits);
            exponent -= digits.length() - before;
        }
        if (c == 'e' || c == 'E') {
            cursor.advance();
            c = cursor.peek();
            boolean negative = false;
            if (c == '+' || c == '-') {
                negative = c == '-';
                cursor.advance();
                c = cursor.peek();
            }
            if (!isDigit(c)) throw cursor.unexpected(c, "sign or digit in exponent");
            long e = 0;
            while (isDigit(c)) {
                if (e < EXPONENT_LIMIT) e = e * 10 + (c - '0');
                cursor.advance();
                c = cursor.peek();
            }
            exponent += negative ? -e : e;
        }
        if (exponent < -Integer.MAX_VALUE || exponent > Integer.MAX_VALUE)
            throw cursor.error("Number exponent out of range");
        return new Decimal(new BigInteger(digits.toString()), (int) exponent);
    }

    public static boolean parseBoolean(Cursor cursor) {
        int c = cursor.skipWhitespace();
        switch (c) {
            case 't' -> {
                cursor.matchLiteral("true");
                return true;
            }
            case 'f' -> {
                cursor.matchLiteral("false");
                return false;
            }
            default -> throw cursor.unexpected(c, "'true' or 'false'");
        }
    }

    public static void parseNull(Cursor cursor) {
        cursor.skipWhitespace();
        cursor.matchLiteral("null");
    }

    /**
     * Parse any value and discard it.
     *
     * @throws SyntaxException also when the input is already exhausted
     */
    public static void parseValue(Cursor cursor) {
        switch (cursor.classify()) {
            case ARRAY -> parseArray(cursor, PushParser::parseValue);
            case OBJECT -> parseObject(cursor, (c, name) -> parseValue(c));
            case STRING -> parseString(cursor);
            case NUMBER -> parseNumber(cursor);
            case BOOLEAN -> parseBoolean(cursor);
            case NULL -> parseNull(cursor);
            case END_OF_INPUT -> throw cursor.unexpected(Cursor.EOF, "a JSON value");
        }
    }

    private static int readHex4(Cursor cursor) {
        int unit = 0;
        for (int k = 0; k < 4; k++) {
            int c = cursor.peek();
            int v = hexVal(c);
            if (v < 0) throw cursor.unexpected(c, "hexadecimal digit in unicode escape");
            cursor.advance();
            unit = (unit << 4) | v;
        }
        return unit;
    }

    private static int readDigits(Cursor cursor, StringBuilder digits) {
        int c = cursor.peek();
        while (isDigit(c)) {
            digits.append((char) c);
            cursor.advance();
            c = cursor.peek();
        }
        return c;
    }

    private static int hexVal(int c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'a' && c <= 'f') return 10 + (c - 'a');
        if (c >= 'A' && c <= 'F') return 10 + (c - 'A');
        return -1;
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }
}
